package xcsp2cpo.decompose;

import java.util.ArrayList;
import java.util.List;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.constraint.Constraints;
import xcsp2cpo.core.constraint.CountConstraint;
import xcsp2cpo.core.constraint.MaximumConstraint;
import xcsp2cpo.core.constraint.MinimumConstraint;
import xcsp2cpo.core.constraint.NValuesConstraint;
import xcsp2cpo.core.constraint.SumConstraint;
import xcsp2cpo.core.expr.Aggregate;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.expr.Operator;
import xcsp2cpo.core.model.Condition;
import xcsp2cpo.core.model.ConditionOperator;
import xcsp2cpo.core.model.Domain;

/**
 * Removes {@code in}/{@code notin} conditions from aggregate-style constraints.
 *
 * <p>A contiguous {@code in lo..hi} becomes two copies of the constraint bounded by {@code ge lo}
 * and {@code le hi}. Other set conditions become an intension over the aggregate, except on
 * {@code count}, which has no expression form and is reported instead.
 */
final class ConditionDecompositions {

  private ConditionDecompositions() {}

  /** Condition of a constraint that may carry one, or null. */
  static Condition conditionOf(Constraint constraint) {
    return switch (constraint.kind()) {
      case SUM -> ((SumConstraint) constraint).condition();
      case COUNT -> ((CountConstraint) constraint).condition();
      case NVALUES -> ((NValuesConstraint) constraint).condition();
      case MINIMUM -> ((MinimumConstraint) constraint).condition();
      case MAXIMUM -> ((MaximumConstraint) constraint).condition();
      default -> null;
    };
  }

  static boolean needsDecomposition(Condition condition) {
    return condition != null && condition.operator().isSetMembership();
  }

  /** True when the set condition can be split into two bounded copies. */
  static boolean splitsIntoBounds(Condition condition) {
    return condition.operator() == ConditionOperator.IN && condition.values().isRange();
  }

  static List<Constraint> splitBounds(Constraint constraint) {
    Domain values = conditionOf(constraint).values();
    return List.of(
        withCondition(
            constraint,
            Constraints.derivedId(constraint.id(), 0),
            Condition.compare(ConditionOperator.GE, values.min())),
        withCondition(
            constraint,
            Constraints.derivedId(constraint.id(), 1),
            Condition.compare(ConditionOperator.LE, values.max())));
  }

  /**
   * Membership test over the aggregate: {@code or} of equalities for {@code in}, {@code and} of
   * disequalities for {@code notin}. Returns null for {@code count}.
   */
  static Constraint toIntension(Constraint constraint) {
    Aggregate aggregate = aggregateOf(constraint);
    if (aggregate == null) {
      return null;
    }
    Condition condition = conditionOf(constraint);
    boolean member = condition.operator() == ConditionOperator.IN;
    List<Expression> tests = new ArrayList<>();
    for (int value : condition.values().values()) {
      Expression constant = Expressions.constant(value);
      tests.add(member ? Expressions.eq(aggregate, constant) : Expressions.ne(aggregate, constant));
    }
    Expression predicate = Expressions.nary(member ? Operator.OR : Operator.AND, tests);
    return ChainDecompositions.piece(constraint.id(), 0, predicate);
  }

  private static Aggregate aggregateOf(Constraint constraint) {
    return switch (constraint.kind()) {
      case SUM -> ((SumConstraint) constraint).aggregate();
      case NVALUES -> ((NValuesConstraint) constraint).aggregate();
      case MINIMUM -> ((MinimumConstraint) constraint).aggregate();
      case MAXIMUM -> ((MaximumConstraint) constraint).aggregate();
      default -> null;
    };
  }

  private static Constraint withCondition(Constraint constraint, String id, Condition condition) {
    return switch (constraint.kind()) {
      case SUM -> ((SumConstraint) constraint).withCondition(id, condition);
      case COUNT -> ((CountConstraint) constraint).withCondition(id, condition);
      case NVALUES -> ((NValuesConstraint) constraint).withCondition(id, condition);
      case MINIMUM -> ((MinimumConstraint) constraint).withCondition(id, condition);
      case MAXIMUM -> ((MaximumConstraint) constraint).withCondition(id, condition);
      default -> throw new IllegalArgumentException(constraint.kind() + " carries no condition");
    };
  }
}
