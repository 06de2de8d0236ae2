package xcsp2cpo.core.model;

import java.util.Objects;
import java.util.function.UnaryOperator;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;

/**
 * Condition closing a global constraint: a relational operator with an expression bound, or
 * {@code in}/{@code notin} with a set of values.
 */
public record Condition(ConditionOperator operator, Expression bound, Domain values) {

  public Condition {
    Objects.requireNonNull(operator, "operator");
    if (operator.isSetMembership()) {
      Objects.requireNonNull(values, "values");
      bound = null;
    } else {
      Objects.requireNonNull(bound, "bound");
      values = null;
    }
  }

  public static Condition compare(ConditionOperator operator, Expression bound) {
    return new Condition(operator, bound, null);
  }

  public static Condition compare(ConditionOperator operator, int bound) {
    return compare(operator, Expressions.constant(bound));
  }

  public static Condition in(Domain values) {
    return new Condition(ConditionOperator.IN, null, values);
  }

  public static Condition notIn(Domain values) {
    return new Condition(ConditionOperator.NOTIN, null, values);
  }

  /** Applies {@code mapper} to the bound expression; set conditions are returned unchanged. */
  public Condition mapBound(UnaryOperator<Expression> mapper) {
    if (bound == null) {
      return this;
    }
    Expression mapped = mapper.apply(bound);
    return mapped == bound ? this : new Condition(operator, mapped, null);
  }

  @Override
  public String toString() {
    Object operand = bound != null ? bound : values;
    return "(" + operator.xcspName() + "," + operand + ")";
  }
}
