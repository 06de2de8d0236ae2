package xcsp2cpo.core.expr;

import java.util.List;

/** Integer literal. Booleans are encoded as 0 and 1. */
public record Const(int value) implements Expression {

  public static final Const ZERO = new Const(0);
  public static final Const ONE = new Const(1);

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.CONST;
  }

  @Override
  public List<Expression> children() {
    return List.of();
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Expressions.requireLeafChildren(this, children);
    return this;
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}
