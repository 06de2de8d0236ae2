package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.model.Condition;

/** Shared helpers for constraint records. */
public final class Constraints {

  private Constraints() {}

  /**
   * Reference used in diagnostics and errors: the constraint id, or {@code #position} for an
   * anonymous constraint.
   */
  public static String reference(Constraint constraint, int position) {
    Objects.requireNonNull(constraint, "constraint");
    return constraint.id() != null ? constraint.id() : "#" + position;
  }

  /** Id for the {@code index}-th piece derived from {@code sourceId}; null stays null. */
  public static String derivedId(String sourceId, int index) {
    return sourceId == null ? null : sourceId + "#" + index;
  }

  static List<Expression> copy(List<Expression> expressions, String name) {
    Objects.requireNonNull(expressions, name);
    return List.copyOf(expressions);
  }

  static List<Expression> concat(List<Expression> list, Condition condition) {
    if (condition == null || condition.bound() == null) {
      return list;
    }
    List<Expression> all = new ArrayList<>(list);
    all.add(condition.bound());
    return List.copyOf(all);
  }

  static String render(List<?> items) {
    return items.stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
  }

  static String withCondition(String head, Condition condition) {
    return condition == null ? head : head + " " + condition;
  }
}
