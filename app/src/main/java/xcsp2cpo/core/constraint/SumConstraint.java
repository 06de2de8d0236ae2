package xcsp2cpo.core.constraint;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.expr.Aggregate;
import xcsp2cpo.core.expr.AggregateKind;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.model.Condition;

/** Weighted sum of the list compared through a condition. Empty coefficients mean all ones. */
public record SumConstraint(
    String id, List<Expression> list, List<Integer> coefficients, Condition condition)
    implements Constraint {

  public SumConstraint {
    list = Constraints.copy(list, "list");
    coefficients = coefficients == null ? List.of() : List.copyOf(coefficients);
    Objects.requireNonNull(condition, "condition");
    if (!coefficients.isEmpty()
        && Expressions.sized(list)
        && coefficients.size() != list.size()) {
      throw new MalformedInstanceException(
          id, list.size() + " terms but " + coefficients.size() + " coefficients");
    }
  }

  public static SumConstraint of(
      List<Expression> list, List<Integer> coefficients, Condition condition) {
    return new SumConstraint(null, list, coefficients, condition);
  }

  /** The left-hand side as an expression. */
  public Aggregate aggregate() {
    return new Aggregate(AggregateKind.SUM, list, coefficients);
  }

  public SumConstraint withCondition(String newId, Condition newCondition) {
    return new SumConstraint(newId, list, coefficients, newCondition);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.SUM;
  }

  @Override
  public List<Expression> operands() {
    return Constraints.concat(list, condition);
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mapped = mapper.list(list);
    Condition mappedCondition = condition.mapBound(mapper::scalar);
    if (mapped == list && mappedCondition == condition) {
      return this;
    }
    return new SumConstraint(id, mapped, coefficients, mappedCondition);
  }

  @Override
  public String toString() {
    return Constraints.withCondition(aggregate().toString(), condition);
  }
}
