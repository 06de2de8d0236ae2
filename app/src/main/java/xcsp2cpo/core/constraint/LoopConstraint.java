package xcsp2cpo.core.constraint;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;

/**
 * For-each repetition: {@code body} is instantiated for every value of {@code indexName} in {@code
 * from..to}, inclusive. An empty range instantiates nothing.
 */
public record LoopConstraint(String id, String indexName, int from, int to, Constraint body)
    implements Constraint {

  public LoopConstraint {
    Objects.requireNonNull(indexName, "indexName");
    Objects.requireNonNull(body, "body");
  }

  public long iterations() {
    return to < from ? 0 : (long) to - from + 1;
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.LOOP;
  }

  @Override
  public List<Expression> operands() {
    return body.operands();
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    Constraint mapped = body.mapOperands(mapper);
    return mapped == body ? this : new LoopConstraint(id, indexName, from, to, mapped);
  }

  @Override
  public String toString() {
    return "forall(" + indexName + " in " + from + ".." + to + ") " + body;
  }
}
