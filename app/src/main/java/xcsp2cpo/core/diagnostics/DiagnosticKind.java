package xcsp2cpo.core.diagnostics;

/** Structured reasons why content was kept unconverted. */
public enum DiagnosticKind {
  /** Constraint kind with no decomposition rule, such as {@code cumulative}. */
  UNSUPPORTED_CONSTRAINT,
  /** Constraint or objective over a symbolic, real, set or graph variable. */
  UNSUPPORTED_VARIABLE_TYPE,
  /** Condition form the target cannot express for this constraint kind. */
  UNSUPPORTED_CONDITION;
}
