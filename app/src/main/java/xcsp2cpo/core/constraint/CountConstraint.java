package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.model.Condition;

/** Number of list elements taking one of the given values, compared through a condition. */
public record CountConstraint(
    String id, List<Expression> list, List<Expression> values, Condition condition)
    implements Constraint {

  public CountConstraint {
    list = Constraints.copy(list, "list");
    values = Constraints.copy(values, "values");
    Objects.requireNonNull(condition, "condition");
  }

  public CountConstraint withCondition(String newId, Condition newCondition) {
    return new CountConstraint(newId, list, values, newCondition);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.COUNT;
  }

  @Override
  public List<Expression> operands() {
    List<Expression> all = new ArrayList<>(list);
    all.addAll(values);
    return Constraints.concat(List.copyOf(all), condition);
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mappedList = mapper.list(list);
    List<Expression> mappedValues = mapper.list(values);
    Condition mappedCondition = condition.mapBound(mapper::scalar);
    if (mappedList == list && mappedValues == values && mappedCondition == condition) {
      return this;
    }
    return new CountConstraint(id, mappedList, mappedValues, mappedCondition);
  }

  @Override
  public String toString() {
    return Constraints.withCondition(
        "count(" + Constraints.render(list) + "," + Constraints.render(values) + ")", condition);
  }
}
