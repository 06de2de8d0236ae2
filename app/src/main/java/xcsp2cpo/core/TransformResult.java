package xcsp2cpo.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import xcsp2cpo.core.diagnostics.Diagnostic;
import xcsp2cpo.core.model.Instance;

/** Outcome of one pipeline run: the transformed instance and everything reported on the way. */
public record TransformResult(
    Instance instance,
    List<Diagnostic> diagnostics,
    TransformOptions.Mode mode,
    Map<String, Long> stageMillis,
    long elapsedMillis) {

  public TransformResult {
    Objects.requireNonNull(instance, "instance");
    Objects.requireNonNull(diagnostics, "diagnostics");
    Objects.requireNonNull(mode, "mode");
    diagnostics = List.copyOf(diagnostics);
    stageMillis =
        stageMillis == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(stageMillis));
  }

  /** True when unsupported content was kept; the writer can only emit a best-effort model. */
  public boolean incomplete() {
    return instance.incomplete();
  }

  public boolean hasDiagnostics() {
    return !diagnostics.isEmpty();
  }

  /** Returns the instance, or fails when any construct was left unconverted. */
  public Instance requireComplete() {
    if (incomplete()) {
      throw new UnsupportedConstructException(diagnostics);
    }
    return instance;
  }
}
