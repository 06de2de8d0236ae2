package xcsp2cpo.pipeline;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xcsp2cpo.core.TransformOptions;
import xcsp2cpo.core.TransformResult;
import xcsp2cpo.core.diagnostics.Diagnostic;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.pipeline.builder.TransformBuilder;

/**
 * Entry point of the conversion core: turns a parsed instance into one the CPO writer can print.
 *
 * <p>Holds no per-run state, so one pipeline may serve many instances, concurrently or not.
 */
public final class Pipeline {
  private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

  public TransformResult transform(Instance instance) {
    return transform(instance, TransformOptions.defaults());
  }

  public TransformResult transform(Instance instance, TransformOptions options) {
    Objects.requireNonNull(instance, "instance");
    TransformOptions effective = TransformOptions.normalize(options);
    LOG.debug(
        "Transforming {} variables, {} arrays, {} constraints (mode: {})",
        instance.variables().size(),
        instance.arrays().size(),
        instance.constraints().size(),
        effective.mode());

    TransformResult result = TransformBuilder.defaultBuilder(effective).build(instance, effective);

    for (Diagnostic diagnostic : result.diagnostics()) {
      LOG.warn("Unsupported construct: {}", diagnostic);
    }
    if (result.incomplete()) {
      LOG.warn(
          "Instance is incomplete: {} constructs kept unconverted", result.diagnostics().size());
    }
    LOG.info(
        "Transformed {} into {} variables and {} constraints in {} ms",
        instance.problemType(),
        result.instance().variables().size(),
        result.instance().constraints().size(),
        result.elapsedMillis());
    return result;
  }
}
