package xcsp2cpo.core.expr;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.model.Variable;

/** Reference to a concrete variable of the owning instance. */
public record VarRef(Variable variable) implements Expression {

  public VarRef {
    Objects.requireNonNull(variable, "variable");
  }

  public String id() {
    return variable.id();
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.VAR_REF;
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
    return variable.id();
  }
}
