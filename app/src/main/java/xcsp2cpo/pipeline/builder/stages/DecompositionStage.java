package xcsp2cpo.pipeline.builder.stages;

import java.util.Objects;
import xcsp2cpo.core.TargetVocabulary;
import xcsp2cpo.decompose.DecompositionResult;
import xcsp2cpo.decompose.Decomposer;
import xcsp2cpo.pipeline.builder.TransformContext;
import xcsp2cpo.pipeline.builder.TransformStage;

/** Replaces constraints the target cannot write and records what stays unsupported. */
public final class DecompositionStage implements TransformStage {
  public static final String NAME = "decompose";

  private final Decomposer decomposer;

  public DecompositionStage(TargetVocabulary vocabulary) {
    this(new Decomposer(vocabulary));
  }

  public DecompositionStage(Decomposer decomposer) {
    this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void execute(TransformContext context) {
    Objects.requireNonNull(context, "context");
    DecompositionResult result = decomposer.decompose(context.instance());
    context.applyDecomposition(result.instance(), result.diagnostics());
  }
}
