package xcsp2cpo.decompose;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.diagnostics.Diagnostic;
import xcsp2cpo.core.model.Instance;

/** Decomposed instance together with the constructs that had to be left as they were. */
public record DecompositionResult(Instance instance, List<Diagnostic> diagnostics) {

  public DecompositionResult {
    Objects.requireNonNull(instance, "instance");
    Objects.requireNonNull(diagnostics, "diagnostics");
    diagnostics = List.copyOf(diagnostics);
  }
}
