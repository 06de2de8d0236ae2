package xcsp2cpo.core.constraint;

import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;

/** Constraint given by a boolean predicate expression. */
public record IntensionConstraint(String id, Expression predicate) implements Constraint {

  public IntensionConstraint {
    Objects.requireNonNull(predicate, "predicate");
  }

  public static IntensionConstraint of(Expression predicate) {
    return new IntensionConstraint(null, predicate);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.INTENSION;
  }

  @Override
  public List<Expression> operands() {
    return List.of(predicate);
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    Expression mapped = mapper.scalar(predicate);
    return mapped == predicate ? this : new IntensionConstraint(id, mapped);
  }

  @Override
  public String toString() {
    return predicate.toString();
  }
}
