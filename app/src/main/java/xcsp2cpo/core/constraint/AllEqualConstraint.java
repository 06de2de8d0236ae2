package xcsp2cpo.core.constraint;

import java.util.List;
import xcsp2cpo.core.expr.Expression;

/** All listed expressions take the same value. */
public record AllEqualConstraint(String id, List<Expression> list) implements Constraint {

  public AllEqualConstraint {
    list = Constraints.copy(list, "list");
  }

  public static AllEqualConstraint of(List<Expression> list) {
    return new AllEqualConstraint(null, list);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.ALL_EQUAL;
  }

  @Override
  public List<Expression> operands() {
    return list;
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mapped = mapper.list(list);
    return mapped == list ? this : new AllEqualConstraint(id, mapped);
  }

  @Override
  public String toString() {
    return "allEqual" + Constraints.render(list);
  }
}
