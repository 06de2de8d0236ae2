package xcsp2cpo.core.expr;

import java.util.List;
import java.util.Objects;

/** If-then-else: {@code if(condition, then, otherwise)}. */
public record Conditional(Expression condition, Expression then, Expression otherwise)
    implements Expression {

  public Conditional {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(then, "then");
    Objects.requireNonNull(otherwise, "otherwise");
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.CONDITIONAL;
  }

  @Override
  public List<Expression> children() {
    return List.of(condition, then, otherwise);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Expressions.requireChildCount(this, children, 3);
    if (children.equals(children())) {
      return this;
    }
    return new Conditional(children.get(0), children.get(1), children.get(2));
  }

  @Override
  public String toString() {
    return "if(" + condition + "," + then + "," + otherwise + ")";
  }
}
