package xcsp2cpo.core.constraint;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Aggregate;
import xcsp2cpo.core.expr.AggregateKind;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.model.Condition;

/** Number of distinct values taken by the list, compared through a condition. */
public record NValuesConstraint(String id, List<Expression> list, Condition condition)
    implements Constraint {

  public NValuesConstraint {
    list = Constraints.copy(list, "list");
    Objects.requireNonNull(condition, "condition");
  }

  public Aggregate aggregate() {
    return new Aggregate(AggregateKind.NVALUES, list);
  }

  public NValuesConstraint withCondition(String newId, Condition newCondition) {
    return new NValuesConstraint(newId, list, newCondition);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.NVALUES;
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
    return new NValuesConstraint(id, mapped, mappedCondition);
  }

  @Override
  public String toString() {
    return Constraints.withCondition(aggregate().toString(), condition);
  }
}
