package xcsp2cpo.rewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xcsp2cpo.testing.TestInstances.instanceOf;
import static xcsp2cpo.testing.TestInstances.intVars;
import static xcsp2cpo.testing.TestInstances.refs;

import java.util.List;
import org.junit.jupiter.api.Test;
import xcsp2cpo.core.TargetVocabulary;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.constraint.IntensionConstraint;
import xcsp2cpo.core.constraint.SumConstraint;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.expr.Operator;
import xcsp2cpo.core.model.Condition;
import xcsp2cpo.core.model.ConditionOperator;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.core.model.Objective;
import xcsp2cpo.core.model.Variable;

final class ExpressionRewriterTest {
  private final ExpressionRewriter rewriter = new ExpressionRewriter();
  private final List<Variable> vars = intVars(0, 9, "x", "y", "z");
  private final Expression x = refs(vars).get(0);
  private final Expression y = refs(vars).get(1);
  private final Expression z = refs(vars).get(2);

  @Test
  void negationBecomesSubtractionFromZero() {
    Expression rewritten = rewriter.rewrite(Expressions.unary(Operator.NEG, x));

    assertEquals("sub(0,x)", rewritten.toString(), "neg(x)");
  }

  @Test
  void distanceBecomesAbsoluteDifference() {
    Expression expr = Expressions.binary(Operator.LE, Expressions.binary(Operator.DIST, x, y), z);

    assertEquals("le(abs(sub(x,y)),z)", rewriter.rewrite(expr).toString(), "dist(x,y)");
  }

  @Test
  void iffAndXorBecomeRelations() {
    Expression a = Expressions.eq(x, Expressions.constant(1));
    Expression b = Expressions.eq(y, Expressions.constant(2));

    assertEquals(
        "eq(eq(x,1),eq(y,2))",
        rewriter.rewrite(Expressions.binary(Operator.IFF, a, b)).toString(),
        "iff");
    assertEquals(
        "ne(eq(x,1),eq(y,2))",
        rewriter.rewrite(Expressions.binary(Operator.XOR, a, b)).toString(),
        "xor");
  }

  @Test
  void implicationDependsOnVocabulary() {
    Expression a = Expressions.ne(x, y);
    Expression imp = Expressions.binary(Operator.IMP, Expressions.not(a), z);
    ExpressionRewriter withoutImplication =
        new ExpressionRewriter(TargetVocabulary.cpo().withNativeImplication(false));

    assertSame(imp, rewriter.rewrite(imp), "CPO keeps =>");
    assertEquals(
        "or(ne(x,y),z)",
        withoutImplication.rewrite(imp).toString(),
        "Double negation cancels inside the disjunction");
  }

  @Test
  void doubleNegationCancels() {
    assertEquals(
        "lt(x,y)",
        rewriter.rewrite(Expressions.not(Expressions.not(Expressions.binary(Operator.LT, x, y))))
            .toString(),
        "not(not(p)) is p");
  }

  @Test
  void nestedConnectivesAreFlattened() {
    Expression p = Expressions.eq(x, y);
    Expression q = Expressions.ne(y, z);
    Expression r = Expressions.binary(Operator.LT, x, z);
    Expression nested =
        Expressions.nary(
            Operator.AND,
            List.of(
                Expressions.binary(Operator.AND, p, q),
                Expressions.nary(Operator.AND, List.of(r))));

    assertEquals(
        "and(eq(x,y),ne(y,z),lt(x,z))", rewriter.rewrite(nested).toString(), "One flat and");
    assertEquals(
        "eq(x,y)",
        rewriter.rewrite(Expressions.nary(Operator.OR, List.of(p))).toString(),
        "Single operand collapses");
  }

  @Test
  void canonicalTreesAreLeftAlone() {
    Expression canonical = Expressions.nary(Operator.OR, List.of(Expressions.eq(x, y), z));

    assertSame(canonical, rewriter.rewrite(canonical), "Nothing to rewrite");
    assertTrue(ExpressionRewriter.isCanonical(canonical, TargetVocabulary.cpo()), "Canonical");
    assertFalse(
        ExpressionRewriter.isCanonical(Expressions.unary(Operator.NEG, x), TargetVocabulary.cpo()),
        "neg is not canonical");
  }

  @Test
  void instanceRewriteCoversOperandsBoundsAndObjective() {
    Expression negZ = Expressions.unary(Operator.NEG, z);
    Constraint intension =
        new IntensionConstraint("c", Expressions.eq(Expressions.binary(Operator.DIST, x, y), z));
    Constraint sum =
        SumConstraint.of(
            refs(vars).subList(0, 2), List.of(), Condition.compare(ConditionOperator.GT, negZ));
    Instance instance =
        instanceOf(vars, intension, sum).withObjective(Objective.maximize(negZ));

    Instance rewritten = rewriter.rewrite(instance);

    assertEquals(
        "eq(abs(sub(x,y)),z)", rewritten.constraints().get(0).toString(), "Intension predicate");
    assertEquals(
        "sum([x,y]) (gt,sub(0,z))", rewritten.constraints().get(1).toString(), "Condition bound");
    assertEquals(
        "sub(0,z)", rewritten.objective().orElseThrow().target().toString(), "Objective target");
    assertTrue(ExpressionRewriter.isCanonical(rewritten, TargetVocabulary.cpo()), "Canonical");
    assertEquals(rewritten, rewriter.rewrite(rewritten), "Rewriting is idempotent");
  }
}
