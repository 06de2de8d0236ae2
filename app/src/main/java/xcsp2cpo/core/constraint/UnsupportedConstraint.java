package xcsp2cpo.core.constraint;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;

/**
 * Constraint whose XCSP3 kind has no counterpart in the IR, such as {@code cumulative} or {@code
 * regular}. Kept verbatim with its scope so it can be reported.
 */
public record UnsupportedConstraint(String id, String rawKind, List<Expression> scope)
    implements Constraint {

  public UnsupportedConstraint {
    Objects.requireNonNull(rawKind, "rawKind");
    scope = scope == null ? List.of() : List.copyOf(scope);
  }

  public static UnsupportedConstraint of(String rawKind, List<Expression> scope) {
    return new UnsupportedConstraint(null, rawKind, scope);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.UNSUPPORTED;
  }

  @Override
  public List<Expression> operands() {
    return scope;
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mapped = mapper.list(scope);
    return mapped == scope ? this : new UnsupportedConstraint(id, rawKind, mapped);
  }

  @Override
  public String toString() {
    return rawKind + Constraints.render(scope);
  }
}
