package xcsp2cpo.testing;

import java.util.ArrayList;
import java.util.List;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.model.Domain;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.core.model.Variable;

/** Small instance fixtures shared by the tests. */
public final class TestInstances {

  private TestInstances() {}

  public static Variable intVar(String id, int lo, int hi) {
    return Variable.integer(id, Domain.range(lo, hi));
  }

  /** Integer variables over {@code lo..hi}, one per id. */
  public static List<Variable> intVars(int lo, int hi, String... ids) {
    List<Variable> variables = new ArrayList<>(ids.length);
    for (String id : ids) {
      variables.add(intVar(id, lo, hi));
    }
    return variables;
  }

  public static List<Expression> refs(List<Variable> variables) {
    return Expressions.vars(variables);
  }

  public static Expression ref(Variable variable) {
    return Expressions.var(variable);
  }

  public static Instance instanceOf(List<Variable> variables, Constraint... constraints) {
    Instance.Builder builder = Instance.builder();
    variables.forEach(builder::addVariable);
    return builder.addConstraints(List.of(constraints)).build();
  }
}
