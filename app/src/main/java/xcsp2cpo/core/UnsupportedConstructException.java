package xcsp2cpo.core;

import java.util.List;
import java.util.stream.Collectors;
import xcsp2cpo.core.diagnostics.Diagnostic;

/**
 * Raised when a caller asks for a complete conversion but the instance still holds unsupported
 * content. Carries the diagnostics that made the conversion incomplete.
 */
public class UnsupportedConstructException extends RuntimeException {
  private static final long serialVersionUID = 1L;
  private static final int MAX_LISTED = 5;

  private final transient List<Diagnostic> diagnostics;

  public UnsupportedConstructException(List<Diagnostic> diagnostics) {
    super(describe(diagnostics));
    this.diagnostics = List.copyOf(diagnostics);
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  private static String describe(List<Diagnostic> diagnostics) {
    String listed =
        diagnostics.stream()
            .limit(MAX_LISTED)
            .map(Diagnostic::toString)
            .collect(Collectors.joining("; "));
    int hidden = diagnostics.size() - MAX_LISTED;
    return diagnostics.size()
        + " unsupported construct(s): "
        + listed
        + (hidden > 0 ? "; and " + hidden + " more" : "");
  }
}
