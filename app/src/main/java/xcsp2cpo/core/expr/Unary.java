package xcsp2cpo.core.expr;

import java.util.List;
import java.util.Objects;

/** Application of a unary operator. */
public record Unary(Operator op, Expression operand) implements Expression {

  public Unary {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(operand, "operand");
    if (op.arity() != Operator.Arity.UNARY) {
      throw new IllegalArgumentException(op.xcspName() + " is not a unary operator");
    }
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.UNARY;
  }

  @Override
  public List<Expression> children() {
    return List.of(operand);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Expressions.requireChildCount(this, children, 1);
    Expression child = children.get(0);
    return child == operand ? this : new Unary(op, child);
  }

  @Override
  public String toString() {
    return op.xcspName() + "(" + operand + ")";
  }
}
