package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;

/** {@code list[index - startIndex] == value}. */
public record ElementConstraint(
    String id, List<Expression> list, Expression index, Expression value, int startIndex)
    implements Constraint {

  public ElementConstraint {
    list = Constraints.copy(list, "list");
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.ELEMENT;
  }

  @Override
  public List<Expression> operands() {
    List<Expression> all = new ArrayList<>(list);
    all.add(index);
    all.add(value);
    return List.copyOf(all);
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mappedList = mapper.list(list);
    Expression mappedIndex = mapper.scalar(index);
    Expression mappedValue = mapper.scalar(value);
    if (mappedList == list && mappedIndex == index && mappedValue == value) {
      return this;
    }
    return new ElementConstraint(id, mappedList, mappedIndex, mappedValue, startIndex);
  }

  @Override
  public String toString() {
    String offset = startIndex == 0 ? "" : "@" + startIndex;
    return "element(" + Constraints.render(list) + offset + "," + index + ") == " + value;
  }
}
