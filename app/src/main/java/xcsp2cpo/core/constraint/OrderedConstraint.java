package xcsp2cpo.core.constraint;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Operator;

/** Consecutive list elements satisfy the same comparison operator. */
public record OrderedConstraint(String id, List<Expression> list, Operator operator)
    implements Constraint {

  public OrderedConstraint {
    list = Constraints.copy(list, "list");
    Objects.requireNonNull(operator, "operator");
    switch (operator) {
      case LT, LE, GT, GE -> {}
      default -> throw new IllegalArgumentException(
          "ordered does not accept operator " + operator.xcspName());
    }
  }

  public static OrderedConstraint of(List<Expression> list, Operator operator) {
    return new OrderedConstraint(null, list, operator);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.ORDERED;
  }

  @Override
  public List<Expression> operands() {
    return list;
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mapped = mapper.list(list);
    return mapped == list ? this : new OrderedConstraint(id, mapped, operator);
  }

  @Override
  public String toString() {
    return "ordered" + Constraints.render(list) + " " + operator.xcspName();
  }
}
