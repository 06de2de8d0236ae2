package xcsp2cpo.core.model;

import java.util.Locale;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;

/** Single optimization objective over one target expression, often an aggregate. */
public record Objective(String id, Direction direction, Expression target) {

  /** Optimization direction. */
  public enum Direction {
    MINIMIZE,
    MAXIMIZE
  }

  public Objective {
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(target, "target");
  }

  public static Objective minimize(Expression target) {
    return new Objective(null, Direction.MINIMIZE, target);
  }

  public static Objective maximize(Expression target) {
    return new Objective(null, Direction.MAXIMIZE, target);
  }

  public Objective withTarget(Expression newTarget) {
    return newTarget == target ? this : new Objective(id, direction, newTarget);
  }

  @Override
  public String toString() {
    return direction.name().toLowerCase(Locale.ROOT) + "(" + target + ")";
  }
}
