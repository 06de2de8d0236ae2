package xcsp2cpo.core.constraint;

import java.util.List;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.expr.Expression;

/** Fixes {@code list[i]} to {@code values[i]}. */
public record InstantiationConstraint(String id, List<Expression> list, List<Integer> values)
    implements Constraint {

  public InstantiationConstraint {
    list = Constraints.copy(list, "list");
    values = values == null ? List.of() : List.copyOf(values);
  }

  /** Fails when the normalized list and the value list differ in length. */
  public void requireAligned(String reference) {
    if (list.size() != values.size()) {
      throw new MalformedInstanceException(
          reference,
          "instantiation of " + list.size() + " variables with " + values.size() + " values");
    }
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.INSTANTIATION;
  }

  @Override
  public List<Expression> operands() {
    return list;
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mapped = mapper.list(list);
    return mapped == list ? this : new InstantiationConstraint(id, mapped, values);
  }

  @Override
  public String toString() {
    return "instantiation(" + Constraints.render(list) + "," + values + ")";
  }
}
