package xcsp2cpo.decompose;

import java.util.ArrayList;
import java.util.List;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.constraint.AllEqualConstraint;
import xcsp2cpo.core.constraint.ChannelConstraint;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.constraint.Constraints;
import xcsp2cpo.core.constraint.InstantiationConstraint;
import xcsp2cpo.core.constraint.IntensionConstraint;
import xcsp2cpo.core.constraint.OrderedConstraint;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.expr.Operator;

/** Decompositions of list constraints into conjunctions of intensions. */
final class ChainDecompositions {

  private ChainDecompositions() {}

  /** {@code e1==e2, e2==e3, ...}; a list shorter than two yields nothing. */
  static List<Constraint> allEqual(AllEqualConstraint constraint) {
    return chain(constraint.id(), constraint.list(), Operator.EQ);
  }

  /** {@code e1 op e2, e2 op e3, ...} with the constraint's own operator. */
  static List<Constraint> ordered(OrderedConstraint constraint) {
    return chain(constraint.id(), constraint.list(), constraint.operator());
  }

  /**
   * {@code (first[i] == j + s) <=> (second[j] == i + s)} for every pair. A self-inverse channel
   * pairs the list with itself, where {@code i == j} is trivially true and {@code (j, i)} repeats
   * {@code (i, j)}, so only {@code i < j} is emitted.
   */
  static List<Constraint> channel(ChannelConstraint constraint, String reference) {
    List<Expression> first = constraint.first();
    boolean selfInverse = constraint.selfInverse();
    List<Expression> second = selfInverse ? first : constraint.second();
    if (first.size() != second.size()) {
      throw new MalformedInstanceException(
          reference,
          "channel lists differ in length: " + first.size() + " vs " + second.size());
    }
    int start = constraint.startIndex();
    List<Constraint> pieces = new ArrayList<>();
    for (int i = 0; i < first.size(); i++) {
      for (int j = selfInverse ? i + 1 : 0; j < second.size(); j++) {
        Expression left = Expressions.eq(first.get(i), Expressions.constant(j + start));
        Expression right = Expressions.eq(second.get(j), Expressions.constant(i + start));
        Expression link = Expressions.binary(Operator.IFF, left, right);
        pieces.add(piece(constraint.id(), pieces.size(), link));
      }
    }
    return pieces;
  }

  /** {@code list[i] == values[i]} for every position. */
  static List<Constraint> instantiation(InstantiationConstraint constraint, String reference) {
    constraint.requireAligned(reference);
    List<Constraint> pieces = new ArrayList<>(constraint.list().size());
    for (int i = 0; i < constraint.list().size(); i++) {
      Expression value = Expressions.constant(constraint.values().get(i));
      Expression fixed = Expressions.eq(constraint.list().get(i), value);
      pieces.add(piece(constraint.id(), i, fixed));
    }
    return pieces;
  }

  private static List<Constraint> chain(String id, List<Expression> list, Operator operator) {
    List<Constraint> pieces = new ArrayList<>(Math.max(0, list.size() - 1));
    for (int i = 0; i + 1 < list.size(); i++) {
      pieces.add(piece(id, i, Expressions.binary(operator, list.get(i), list.get(i + 1))));
    }
    return pieces;
  }

  static IntensionConstraint piece(String sourceId, int index, Expression predicate) {
    return new IntensionConstraint(Constraints.derivedId(sourceId, index), predicate);
  }
}
