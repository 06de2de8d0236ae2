package xcsp2cpo.core.constraint;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;

/** All listed expressions take distinct values, except for the listed exception values. */
public record AllDifferentConstraint(String id, List<Expression> list, List<Integer> exceptValues)
    implements Constraint {

  public AllDifferentConstraint {
    list = Constraints.copy(list, "list");
    exceptValues = exceptValues == null ? List.of() : List.copyOf(exceptValues);
  }

  public static AllDifferentConstraint of(List<Expression> list) {
    return new AllDifferentConstraint(null, list, List.of());
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.ALL_DIFFERENT;
  }

  @Override
  public List<Expression> operands() {
    return list;
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mapped = mapper.list(list);
    return mapped == list ? this : new AllDifferentConstraint(id, mapped, exceptValues);
  }

  @Override
  public String toString() {
    String head = "allDifferent" + Constraints.render(list);
    return exceptValues.isEmpty() ? head : head + " except " + Objects.toString(exceptValues);
  }
}
