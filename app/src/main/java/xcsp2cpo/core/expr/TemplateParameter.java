package xcsp2cpo.core.expr;

import java.util.List;

/** Placeholder {@code %position} of a group template. */
public record TemplateParameter(int position) implements Expression {

  public TemplateParameter {
    if (position < 0) {
      throw new IllegalArgumentException("position must be non-negative");
    }
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.TEMPLATE_PARAMETER;
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
    return "%" + position;
  }
}
