package xcsp2cpo.core.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import xcsp2cpo.core.model.Variable;

/** Factories and tree utilities for {@link Expression} nodes. */
public final class Expressions {

  private Expressions() {}

  public static Const constant(int value) {
    return switch (value) {
      case 0 -> Const.ZERO;
      case 1 -> Const.ONE;
      default -> new Const(value);
    };
  }

  public static VarRef var(Variable variable) {
    return new VarRef(variable);
  }

  public static List<Expression> vars(List<Variable> variables) {
    List<Expression> refs = new ArrayList<>(variables.size());
    for (Variable variable : variables) {
      refs.add(new VarRef(variable));
    }
    return refs;
  }

  public static Unary unary(Operator op, Expression operand) {
    return new Unary(op, operand);
  }

  public static Binary binary(Operator op, Expression left, Expression right) {
    return new Binary(op, left, right);
  }

  public static Binary eq(Expression left, Expression right) {
    return new Binary(Operator.EQ, left, right);
  }

  public static Binary ne(Expression left, Expression right) {
    return new Binary(Operator.NE, left, right);
  }

  public static Unary not(Expression operand) {
    return new Unary(Operator.NOT, operand);
  }

  public static NAry nary(Operator op, List<Expression> operands) {
    return new NAry(op, operands);
  }

  /**
   * Rebuilds {@code root} in post-order: children are rewritten first, then {@code rule} is applied
   * to the rebuilt node. Untouched subtrees are returned as the same instances.
   */
  public static Expression rewriteBottomUp(Expression root, UnaryOperator<Expression> rule) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(rule, "rule");
    List<Expression> children = root.children();
    Expression rebuilt = root;
    if (!children.isEmpty()) {
      List<Expression> rewritten = new ArrayList<>(children.size());
      boolean changed = false;
      for (Expression child : children) {
        Expression next = rewriteBottomUp(child, rule);
        changed |= next != child;
        rewritten.add(next);
      }
      if (changed) {
        rebuilt = root.withChildren(rewritten);
      }
    }
    return Objects.requireNonNull(rule.apply(rebuilt), "rule returned null");
  }

  /** Visits every node of the tree in pre-order. */
  public static void forEachNode(Expression root, Consumer<Expression> visitor) {
    Deque<Expression> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Expression node = stack.pop();
      visitor.accept(node);
      List<Expression> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  public static boolean anyMatch(Expression root, Predicate<Expression> predicate) {
    Deque<Expression> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Expression node = stack.pop();
      if (predicate.test(node)) {
        return true;
      }
      node.children().forEach(stack::push);
    }
    return false;
  }

  public static int size(Expression root) {
    int[] count = {0};
    forEachNode(root, node -> count[0]++);
    return count[0];
  }

  /** Variables referenced by the tree, in first-occurrence order, without duplicates. */
  public static List<Variable> variables(Expression root) {
    Set<Variable> found = new LinkedHashSet<>();
    forEachNode(
        root,
        node -> {
          if (node instanceof VarRef ref) {
            found.add(ref.variable());
          }
        });
    return List.copyOf(found);
  }

  /**
   * True when every element stands for exactly one operand, that is, no element is a slice or a
   * template placeholder that may still expand into several.
   */
  public static boolean sized(List<Expression> list) {
    for (Expression element : list) {
      ExpressionKind kind = element.kind();
      if (kind == ExpressionKind.ARRAY_SLICE || kind == ExpressionKind.TEMPLATE_PARAMETER) {
        return false;
      }
    }
    return true;
  }

  static void requireLeafChildren(Expression node, List<Expression> children) {
    if (children != null && !children.isEmpty()) {
      throw new IllegalArgumentException(node.kind() + " node has no children");
    }
  }

  static void requireChildCount(Expression node, List<Expression> children, int expected) {
    Objects.requireNonNull(children, "children");
    if (children.size() != expected) {
      throw new IllegalArgumentException(
          node.kind() + " node expects " + expected + " children but got " + children.size());
    }
  }
}
