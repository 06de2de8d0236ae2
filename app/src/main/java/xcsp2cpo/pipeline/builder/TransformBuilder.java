package xcsp2cpo.pipeline.builder;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.TransformOptions;
import xcsp2cpo.core.TransformResult;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.pipeline.builder.stages.DecompositionStage;
import xcsp2cpo.pipeline.builder.stages.NormalizationStage;
import xcsp2cpo.pipeline.builder.stages.RewriteStage;

/**
 * Runs a linear list of {@link TransformStage} steps over a shared {@link TransformContext}.
 */
public final class TransformBuilder {
  private final List<TransformStage> stages;

  public TransformBuilder(List<TransformStage> stages) {
    if (stages == null || stages.isEmpty()) {
      throw new IllegalArgumentException("stages must not be empty");
    }
    this.stages = List.copyOf(stages);
  }

  public TransformBuilder(TransformStage... stages) {
    this(List.of(stages));
  }

  public List<TransformStage> stages() {
    return stages;
  }

  /**
   * Normalization, decomposition and rewriting in that order; legacy mode stops after
   * normalization.
   */
  public static TransformBuilder defaultBuilder(TransformOptions options) {
    TransformOptions effective = TransformOptions.normalize(options);
    if (!effective.mode().decomposes()) {
      return new TransformBuilder(new NormalizationStage());
    }
    return new TransformBuilder(
        new NormalizationStage(),
        new DecompositionStage(effective.vocabulary()),
        new RewriteStage(effective.vocabulary()));
  }

  public TransformResult build(Instance instance, TransformOptions options) {
    return runStages(instance, options).toResult();
  }

  public TransformContext buildContext(Instance instance, TransformOptions options) {
    return runStages(instance, options);
  }

  private TransformContext runStages(Instance instance, TransformOptions options) {
    Objects.requireNonNull(instance, "instance");
    TransformContext context = new TransformContext(instance, options);
    for (TransformStage stage : stages) {
      context.timing().lapMillis();
      stage.execute(context);
      context.recordStage(stage.name(), context.timing().lapMillis());
    }
    return context;
  }
}
