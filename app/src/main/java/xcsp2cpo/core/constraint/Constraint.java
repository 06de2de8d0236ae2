package xcsp2cpo.core.constraint;

import java.util.List;
import xcsp2cpo.core.expr.Expression;

/**
 * Constraint of an instance. Implementations are immutable records, one per {@link
 * ConstraintKind}.
 */
public interface Constraint {

  /** Identifier from the source model, or {@code null} for anonymous constraints. */
  String id();

  ConstraintKind kind();

  /** Every expression operand in declaration order, including condition bounds. */
  List<Expression> operands();

  /** Returns this constraint with its operands replaced through {@code mapper}. */
  Constraint mapOperands(OperandMapper mapper);
}
