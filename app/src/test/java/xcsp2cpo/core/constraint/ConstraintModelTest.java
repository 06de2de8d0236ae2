package xcsp2cpo.core.constraint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static xcsp2cpo.testing.TestInstances.intVars;
import static xcsp2cpo.testing.TestInstances.refs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.model.Condition;
import xcsp2cpo.core.model.ConditionOperator;

final class ConstraintModelTest {
  private final List<Expression> xs = refs(intVars(0, 5, "a", "b", "c"));

  @Test
  void sumRendersCoefficientsAndCondition() {
    SumConstraint sum =
        SumConstraint.of(xs, List.of(1, 2, 3), Condition.compare(ConditionOperator.LE, 10));

    assertEquals("sum([a,b,c],[1, 2, 3]) (le,10)", sum.toString(), "Weighted sum rendering");
    assertThrows(
        MalformedInstanceException.class,
        () -> SumConstraint.of(xs, List.of(1, 2), Condition.compare(ConditionOperator.EQ, 0)),
        "Coefficients must match the list");
  }

  @Test
  void identityMappingReturnsSameConstraint() {
    CountConstraint count =
        new CountConstraint(
            "c1", xs, List.of(Expressions.constant(2)), Condition.compare(ConditionOperator.GE, 1));

    assertSame(count, count.mapOperands(OperandMapper.of(e -> e)), "Nothing changed");
  }

  @Test
  void listMappingMayResizeOperands() {
    AllDifferentConstraint allDifferent = AllDifferentConstraint.of(xs);
    OperandMapper dropFirst =
        new OperandMapper() {
          @Override
          public Expression scalar(Expression expression) {
            return expression;
          }

          @Override
          public List<Expression> list(List<Expression> expressions) {
            return new ArrayList<>(expressions.subList(1, expressions.size()));
          }
        };

    Constraint mapped = allDifferent.mapOperands(dropFirst);

    assertEquals(2, mapped.operands().size(), "List positions accept a different size");
  }

  @Test
  void kindsResolveFromElementNames() {
    assertEquals(
        ConstraintKind.ALL_DIFFERENT, ConstraintKind.fromXcspName("allDifferent"), "Exact name");
    assertEquals(ConstraintKind.NVALUES, ConstraintKind.fromXcspName("nvalues"), "Case-blind");
    assertEquals(
        ConstraintKind.UNSUPPORTED, ConstraintKind.fromXcspName("cumulative"), "No IR kind");
  }

  @Test
  void referencesAndDerivedIds() {
    IntensionConstraint anonymous = IntensionConstraint.of(Expressions.eq(xs.get(0), xs.get(1)));

    assertEquals("#4", Constraints.reference(anonymous, 4), "Anonymous constraints use position");
    assertEquals("c7#2", Constraints.derivedId("c7", 2), "Pieces extend the source id");
    assertNull(Constraints.derivedId(null, 0), "Anonymous pieces stay anonymous");
  }

  @Test
  void extensionTuplesMustMatchScope() {
    assertThrows(
        MalformedInstanceException.class,
        () -> new ExtensionConstraint("t", xs, List.of(List.of(1, 2)), true),
        "Tuple arity differs from the scope");
    ExtensionConstraint withWildcard =
        new ExtensionConstraint("t", xs, List.of(Arrays.asList(1, null, 3)), true);
    assertNull(withWildcard.tuples().get(0).get(1), "Null is the wildcard");
  }

  @Test
  void instantiationAlignmentIsChecked() {
    InstantiationConstraint instantiation = new InstantiationConstraint("i", xs, List.of(1, 2));

    MalformedInstanceException error =
        assertThrows(
            MalformedInstanceException.class,
            () -> instantiation.requireAligned("i"),
            "Three variables, two values");
    assertEquals("i", error.constraintRef(), "Reference is kept");
  }
}
