package xcsp2cpo.core.diagnostics;

import java.util.Map;
import java.util.Objects;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.model.Condition;
import xcsp2cpo.core.model.Variable;

/** Non-fatal diagnostic describing content that was kept verbatim and flagged. */
public record Diagnostic(
    String constraintRef, DiagnosticKind kind, String message, Map<String, Object> attributes) {

  public static final String OBJECTIVE_REF = "objective";

  public static final String ATTR_RAW_KIND = "rawKind";
  public static final String ATTR_CONSTRAINT_KIND = "constraintKind";
  public static final String ATTR_VARIABLE = "variable";
  public static final String ATTR_VARIABLE_TYPE = "variableType";
  public static final String ATTR_CONDITION = "condition";

  public Diagnostic {
    Objects.requireNonNull(constraintRef, "constraintRef");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
    attributes = (attributes == null || attributes.isEmpty()) ? Map.of() : Map.copyOf(attributes);
  }

  public static Diagnostic unsupportedConstraint(String constraintRef, String rawKind) {
    return new Diagnostic(
        constraintRef,
        DiagnosticKind.UNSUPPORTED_CONSTRAINT,
        "No decomposition available for constraint kind '" + rawKind + "'",
        Map.of(ATTR_RAW_KIND, rawKind));
  }

  public static Diagnostic unsupportedVariableType(
      String constraintRef, String constraintKind, Variable variable) {
    return new Diagnostic(
        constraintRef,
        DiagnosticKind.UNSUPPORTED_VARIABLE_TYPE,
        "'"
            + constraintKind
            + "' references "
            + variable.type().xcspName()
            + " variable '"
            + variable.id()
            + "'",
        Map.of(
            ATTR_CONSTRAINT_KIND, constraintKind,
            ATTR_VARIABLE, variable.id(),
            ATTR_VARIABLE_TYPE, variable.type().xcspName()));
  }

  public static Diagnostic unsupportedCondition(
      String constraintRef, Constraint constraint, Condition condition) {
    String kindName = constraint.kind().xcspName();
    return new Diagnostic(
        constraintRef,
        DiagnosticKind.UNSUPPORTED_CONDITION,
        "Condition " + condition + " cannot be expressed for '" + kindName + "'",
        Map.of(ATTR_CONSTRAINT_KIND, kindName, ATTR_CONDITION, condition.toString()));
  }

  @Override
  public String toString() {
    return constraintRef + " [" + kind + "] " + message;
  }
}
