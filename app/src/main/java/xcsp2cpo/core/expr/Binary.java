package xcsp2cpo.core.expr;

import java.util.List;
import java.util.Objects;

/** Application of a binary, or two-operand associative, operator. */
public record Binary(Operator op, Expression left, Expression right) implements Expression {

  public Binary {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    if (op.arity() == Operator.Arity.UNARY) {
      throw new IllegalArgumentException(op.xcspName() + " is not a binary operator");
    }
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.BINARY;
  }

  @Override
  public List<Expression> children() {
    return List.of(left, right);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Expressions.requireChildCount(this, children, 2);
    Expression newLeft = children.get(0);
    Expression newRight = children.get(1);
    if (newLeft == left && newRight == right) {
      return this;
    }
    return new Binary(op, newLeft, newRight);
  }

  @Override
  public String toString() {
    return op.xcspName() + "(" + left + "," + right + ")";
  }
}
