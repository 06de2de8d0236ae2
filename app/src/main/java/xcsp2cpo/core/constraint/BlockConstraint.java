package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;

/** Ordered block of constraints with an optional source tag such as {@code symmetryBreaking}. */
public record BlockConstraint(String id, List<Constraint> constraints, String tag)
    implements Constraint {

  public BlockConstraint {
    Objects.requireNonNull(constraints, "constraints");
    constraints = List.copyOf(constraints);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.BLOCK;
  }

  @Override
  public List<Expression> operands() {
    List<Expression> all = new ArrayList<>();
    constraints.forEach(c -> all.addAll(c.operands()));
    return List.copyOf(all);
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Constraint> mapped = new ArrayList<>(constraints.size());
    for (Constraint constraint : constraints) {
      mapped.add(constraint.mapOperands(mapper));
    }
    return new BlockConstraint(id, mapped, tag);
  }

  @Override
  public String toString() {
    return "block" + (tag == null ? "" : "[" + tag + "]") + Constraints.render(constraints);
  }
}
