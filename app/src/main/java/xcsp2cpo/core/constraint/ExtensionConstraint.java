package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;

/**
 * Table constraint over a scope. Each tuple lists one value per scope position; a {@code null}
 * entry is the {@code *} wildcard.
 */
public record ExtensionConstraint(
    String id, List<Expression> scope, List<List<Integer>> tuples, boolean supports)
    implements Constraint {

  public ExtensionConstraint {
    scope = Constraints.copy(scope, "scope");
    Objects.requireNonNull(tuples, "tuples");
    List<List<Integer>> copied = new ArrayList<>(tuples.size());
    boolean sized = Expressions.sized(scope);
    for (List<Integer> tuple : tuples) {
      if (sized && tuple.size() != scope.size()) {
        throw new MalformedInstanceException(
            id, "tuple of arity " + tuple.size() + " over a scope of " + scope.size());
      }
      copied.add(Collections.unmodifiableList(new ArrayList<>(tuple)));
    }
    tuples = Collections.unmodifiableList(copied);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.EXTENSION;
  }

  @Override
  public List<Expression> operands() {
    return scope;
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mapped = mapper.list(scope);
    if (mapped == scope) {
      return this;
    }
    return new ExtensionConstraint(id, mapped, tuples, supports);
  }

  @Override
  public String toString() {
    return (supports ? "supports" : "conflicts")
        + "("
        + Constraints.render(scope)
        + ","
        + tuples.size()
        + " tuples)";
  }
}
