package xcsp2cpo.pipeline.builder.stages;

import java.util.Objects;
import xcsp2cpo.normalize.Normalizer;
import xcsp2cpo.pipeline.builder.TransformContext;
import xcsp2cpo.pipeline.builder.TransformStage;

/** Expands arrays, groups, blocks and loops of the source instance. */
public final class NormalizationStage implements TransformStage {
  public static final String NAME = "normalize";

  private final Normalizer normalizer;

  public NormalizationStage() {
    this(new Normalizer());
  }

  public NormalizationStage(Normalizer normalizer) {
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void execute(TransformContext context) {
    Objects.requireNonNull(context, "context");
    context.applyNormalization(normalizer.normalize(context.instance()));
  }
}
