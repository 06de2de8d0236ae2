package xcsp2cpo.core.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Application of an associative operator to one or more operands. */
public record NAry(Operator op, List<Expression> operands) implements Expression {

  public NAry {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(operands, "operands");
    if (op.arity() != Operator.Arity.ASSOCIATIVE) {
      throw new IllegalArgumentException(op.xcspName() + " is not an associative operator");
    }
    if (!op.acceptsOperandCount(operands.size())) {
      throw new IllegalArgumentException(op.xcspName() + " requires at least one operand");
    }
    operands = List.copyOf(operands);
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.NARY;
  }

  @Override
  public List<Expression> children() {
    return operands;
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    if (children.equals(operands)) {
      return this;
    }
    return new NAry(op, children);
  }

  @Override
  public String toString() {
    return operands.stream()
        .map(Expression::toString)
        .collect(Collectors.joining(",", op.xcspName() + "(", ")"));
  }
}
