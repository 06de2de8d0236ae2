package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import xcsp2cpo.core.expr.Expression;

/**
 * Transformation applied to the operands of a constraint. Scalar positions go through {@link
 * #scalar}; list positions go through {@link #list}, which may change the number of elements.
 */
public interface OperandMapper {

  Expression scalar(Expression expression);

  default List<Expression> list(List<Expression> expressions) {
    List<Expression> mapped = new ArrayList<>(expressions.size());
    boolean changed = false;
    for (Expression expression : expressions) {
      Expression next = scalar(expression);
      changed |= next != expression;
      mapped.add(next);
    }
    return changed ? mapped : expressions;
  }

  /** Mapper that applies the same function to every operand. */
  static OperandMapper of(UnaryOperator<Expression> function) {
    return function::apply;
  }
}
