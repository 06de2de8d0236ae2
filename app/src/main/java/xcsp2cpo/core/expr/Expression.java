package xcsp2cpo.core.expr;

import java.util.List;

/**
 * Immutable node of an expression tree.
 *
 * <p>Nodes never change after construction. Rewrites rebuild the affected path through {@link
 * #withChildren(List)}, so a subtree shared by several constraints is never altered in place.
 */
public interface Expression {

  ExpressionKind kind();

  /** Direct operands in positional order; empty for leaves. */
  List<Expression> children();

  /**
   * Returns a node of the same kind and operator with the given children. Leaves only accept an
   * empty list and return themselves.
   */
  Expression withChildren(List<Expression> children);
}
