package xcsp2cpo.pipeline.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import xcsp2cpo.core.TransformOptions;
import xcsp2cpo.core.TransformResult;
import xcsp2cpo.core.diagnostics.Diagnostic;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.util.Timing;

/**
 * Mutable state flowing through the stages: the instance as last transformed, the diagnostics
 * collected so far and which stages have completed.
 */
public final class TransformContext {
  private final Instance source;
  private final TransformOptions options;
  private final Timing timing;

  private Instance instance;
  private boolean normalized;
  private boolean decomposed;
  private boolean rewritten;

  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final Map<String, Long> stageMillis = new LinkedHashMap<>();

  public TransformContext(Instance source, TransformOptions options) {
    this.source = Objects.requireNonNull(source, "source");
    this.options = TransformOptions.normalize(options);
    this.timing = Timing.start();
    this.instance = source;
  }

  public Instance source() {
    return source;
  }

  public TransformOptions options() {
    return options;
  }

  public Timing timing() {
    return timing;
  }

  public Instance instance() {
    return instance;
  }

  public boolean normalized() {
    return normalized;
  }

  public boolean decomposed() {
    return decomposed;
  }

  public boolean rewritten() {
    return rewritten;
  }

  public List<Diagnostic> diagnostics() {
    return List.copyOf(diagnostics);
  }

  public Map<String, Long> stageMillis() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(stageMillis));
  }

  public void applyNormalization(Instance normalizedInstance) {
    instance = Objects.requireNonNull(normalizedInstance, "normalizedInstance");
    normalized = true;
  }

  public void applyDecomposition(Instance decomposedInstance, List<Diagnostic> found) {
    requireNormalized("Decomposition");
    instance = Objects.requireNonNull(decomposedInstance, "decomposedInstance");
    diagnostics.addAll(Objects.requireNonNull(found, "found"));
    decomposed = true;
  }

  public void applyRewrite(Instance rewrittenInstance) {
    if (!decomposed) {
      throw new IllegalStateException("Decomposition must run before rewriting.");
    }
    instance = Objects.requireNonNull(rewrittenInstance, "rewrittenInstance");
    rewritten = true;
  }

  public void requireNormalized(String stage) {
    if (!normalized) {
      throw new IllegalStateException("Normalization must run before " + stage + ".");
    }
  }

  void recordStage(String name, long millis) {
    stageMillis.merge(name, millis, Long::sum);
  }

  /** Snapshot of the run; stage timings keep execution order. */
  public TransformResult toResult() {
    requireNormalized("building the result");
    return new TransformResult(
        instance,
        diagnostics,
        options.mode(),
        new LinkedHashMap<>(stageMillis),
        timing.elapsedMillis());
  }
}
