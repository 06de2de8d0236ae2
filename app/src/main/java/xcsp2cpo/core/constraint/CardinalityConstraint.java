package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.List;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.expr.Expression;

/**
 * Global cardinality: value {@code values[k]} occurs {@code occurrences[k]} times in the list. When
 * {@code closed}, list elements may only take the listed values.
 */
public record CardinalityConstraint(
    String id,
    List<Expression> list,
    List<Expression> values,
    List<Expression> occurrences,
    boolean closed)
    implements Constraint {

  public CardinalityConstraint {
    list = Constraints.copy(list, "list");
    values = Constraints.copy(values, "values");
    occurrences = Constraints.copy(occurrences, "occurrences");
    if (values.size() != occurrences.size()) {
      throw new MalformedInstanceException(
          id, values.size() + " values but " + occurrences.size() + " occurrences");
    }
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.CARDINALITY;
  }

  @Override
  public List<Expression> operands() {
    List<Expression> all = new ArrayList<>(list);
    all.addAll(values);
    all.addAll(occurrences);
    return List.copyOf(all);
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mappedList = mapper.list(list);
    List<Expression> mappedValues = mapper.list(values);
    List<Expression> mappedOccurrences = mapper.list(occurrences);
    if (mappedList == list && mappedValues == values && mappedOccurrences == occurrences) {
      return this;
    }
    return new CardinalityConstraint(id, mappedList, mappedValues, mappedOccurrences, closed);
  }

  @Override
  public String toString() {
    return "cardinality("
        + Constraints.render(list)
        + ","
        + Constraints.render(values)
        + ","
        + Constraints.render(occurrences)
        + (closed ? ",closed)" : ")");
  }
}
