package xcsp2cpo.decompose;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xcsp2cpo.testing.TestInstances.instanceOf;
import static xcsp2cpo.testing.TestInstances.intVars;
import static xcsp2cpo.testing.TestInstances.ref;
import static xcsp2cpo.testing.TestInstances.refs;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.TargetVocabulary;
import xcsp2cpo.core.constraint.AllEqualConstraint;
import xcsp2cpo.core.constraint.BlockConstraint;
import xcsp2cpo.core.constraint.ChannelConstraint;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.constraint.ConstraintKind;
import xcsp2cpo.core.constraint.CountConstraint;
import xcsp2cpo.core.constraint.ElementConstraint;
import xcsp2cpo.core.constraint.InstantiationConstraint;
import xcsp2cpo.core.constraint.IntensionConstraint;
import xcsp2cpo.core.constraint.NValuesConstraint;
import xcsp2cpo.core.constraint.OrderedConstraint;
import xcsp2cpo.core.constraint.SumConstraint;
import xcsp2cpo.core.constraint.UnsupportedConstraint;
import xcsp2cpo.core.diagnostics.Diagnostic;
import xcsp2cpo.core.diagnostics.DiagnosticKind;
import xcsp2cpo.core.expr.Aggregate;
import xcsp2cpo.core.expr.AggregateKind;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.expr.NAry;
import xcsp2cpo.core.expr.Operator;
import xcsp2cpo.core.model.Condition;
import xcsp2cpo.core.model.ConditionOperator;
import xcsp2cpo.core.model.Domain;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.core.model.Objective;
import xcsp2cpo.core.model.Variable;
import xcsp2cpo.core.model.VariableType;

final class DecomposerTest {
  private final Decomposer decomposer = new Decomposer();
  private final List<Variable> vars = intVars(0, 9, "a", "b", "c");
  private final List<Expression> abc = refs(vars);

  private DecompositionResult decompose(Constraint... constraints) {
    return decomposer.decompose(instanceOf(vars, constraints));
  }

  private static List<String> rendered(DecompositionResult result) {
    return result.instance().constraints().stream()
        .map(Object::toString)
        .collect(Collectors.toList());
  }

  @Test
  void allEqualBecomesChainOfEqualities() {
    DecompositionResult result = decompose(new AllEqualConstraint("c1", abc));

    assertEquals(List.of("eq(a,b)", "eq(b,c)"), rendered(result), "Chain, never a==c");
    assertEquals("c1#0", result.instance().constraints().get(0).id(), "Derived id");
    assertEquals("c1#1", result.instance().constraints().get(1).id(), "Derived id");
    assertTrue(result.diagnostics().isEmpty(), "Nothing unsupported");
  }

  @Test
  void shortAllEqualYieldsNothing() {
    DecompositionResult result = decompose(AllEqualConstraint.of(abc.subList(0, 1)));

    assertTrue(result.instance().constraints().isEmpty(), "One element is trivially equal");
  }

  @Test
  void orderedKeepsItsOperator() {
    DecompositionResult result = decompose(OrderedConstraint.of(abc, Operator.LE));

    assertEquals(List.of("le(a,b)", "le(b,c)"), rendered(result), "Consecutive pairs only");
    assertTrue(
        result.instance().constraints().stream().allMatch(c -> c.id() == null),
        "Anonymous source gives anonymous pieces");
  }

  @Test
  void channelLinksEveryPair() {
    List<Expression> ys = refs(intVars(0, 1, "y0", "y1"));
    List<Expression> xs = abc.subList(0, 2);

    DecompositionResult result = decompose(ChannelConstraint.of(xs, ys));

    assertEquals(
        List.of(
            "iff(eq(a,0),eq(y0,0))",
            "iff(eq(a,1),eq(y1,0))",
            "iff(eq(b,0),eq(y0,1))",
            "iff(eq(b,1),eq(y1,1))"),
        rendered(result),
        "n^2 equivalences");
  }

  @Test
  void selfInverseChannelSkipsTrivialPairs() {
    DecompositionResult result = decompose(ChannelConstraint.of(abc, List.of()));

    assertEquals(
        List.of("iff(eq(a,1),eq(b,0))", "iff(eq(a,2),eq(c,0))", "iff(eq(b,2),eq(c,1))"),
        rendered(result),
        "Pairs i<j of the list with itself");
  }

  @Test
  void channelLengthMismatchIsMalformed() {
    List<Expression> four = refs(intVars(0, 3, "p", "q", "r", "s"));
    ChannelConstraint channel = new ChannelConstraint("ch", abc, four, 0);

    MalformedInstanceException error =
        assertThrows(
            MalformedInstanceException.class, () -> decompose(channel), "3 vs 4 elements");
    assertEquals("ch", error.constraintRef(), "Channel is named");
  }

  @Test
  void instantiationFixesEachVariable() {
    DecompositionResult result =
        decompose(new InstantiationConstraint("i", abc, List.of(4, 0, 7)));

    assertEquals(List.of("eq(a,4)", "eq(b,0)", "eq(c,7)"), rendered(result), "Pointwise");
    assertThrows(
        MalformedInstanceException.class,
        () -> decompose(new InstantiationConstraint("i", abc, List.of(1))),
        "Length mismatch");
  }

  @Test
  void contiguousInConditionSplitsIntoBounds() {
    SumConstraint sum = new SumConstraint("s", abc, List.of(), Condition.in(Domain.range(3, 8)));

    DecompositionResult result = decompose(sum);

    assertEquals(
        List.of("sum([a,b,c]) (ge,3)", "sum([a,b,c]) (le,8)"), rendered(result), "Two bounds");
    assertEquals("s#1", result.instance().constraints().get(1).id(), "Second piece id");
  }

  @Test
  void inConditionUpToIntegerMaximumSplits() {
    SumConstraint sum =
        new SumConstraint(
            "s", abc, List.of(), Condition.in(Domain.range(3, Integer.MAX_VALUE)));

    DecompositionResult result = decompose(sum);

    assertEquals(
        List.of("sum([a,b,c]) (ge,3)", "sum([a,b,c]) (le," + Integer.MAX_VALUE + ")"),
        rendered(result),
        "Upper bound is MAX_VALUE");
    assertTrue(result.diagnostics().isEmpty(), "Nothing unsupported");
  }

  @Test
  void sparseInConditionBecomesDisjunction() {
    NValuesConstraint nValues = new NValuesConstraint("n", abc, Condition.in(Domain.values(1, 3)));

    DecompositionResult result = decompose(nValues);

    Constraint only = result.instance().constraints().get(0);
    assertEquals(ConstraintKind.INTENSION, only.kind(), "Expressed as an intension");
    NAry predicate = (NAry) ((IntensionConstraint) only).predicate();
    assertEquals(Operator.OR, predicate.op(), "Membership is a disjunction");
    assertEquals(
        "eq(nValues([a,b,c]),3)", predicate.operands().get(1).toString(), "Second value");
  }

  @Test
  void notInOnCountIsReportedUnsupported() {
    CountConstraint count =
        new CountConstraint(
            "k", abc, List.of(Expressions.constant(0)), Condition.notIn(Domain.values(0, 2)));

    DecompositionResult result = decompose(count);

    assertSame(count, result.instance().constraints().get(0), "Kept verbatim");
    assertEquals(1, result.diagnostics().size(), "One diagnostic");
    assertEquals(
        DiagnosticKind.UNSUPPORTED_CONDITION, result.diagnostics().get(0).kind(), "Condition");
    assertTrue(result.instance().incomplete(), "Instance is flagged");
  }

  @Test
  void unknownKindsAreKeptAndReported() {
    UnsupportedConstraint cumulative = UnsupportedConstraint.of("cumulative", abc);

    DecompositionResult result =
        decompose(IntensionConstraint.of(Expressions.ne(abc.get(0), abc.get(1))), cumulative);

    assertEquals(2, result.instance().constraints().size(), "Both constraints remain");
    Diagnostic diagnostic = result.diagnostics().get(0);
    assertEquals("#1", diagnostic.constraintRef(), "Positional reference");
    assertEquals(DiagnosticKind.UNSUPPORTED_CONSTRAINT, diagnostic.kind(), "Unsupported kind");
    assertEquals(
        "cumulative", diagnostic.attributes().get(Diagnostic.ATTR_RAW_KIND), "Raw kind kept");
  }

  @Test
  void nonIntegerVariablesAreFlagged() {
    Variable colour = Variable.unsupported("colour", VariableType.SYMBOLIC);
    List<Variable> all = new ArrayList<>(vars);
    all.add(colour);
    Instance instance =
        instanceOf(all, new AllEqualConstraint("e", List.of(abc.get(0), ref(colour))))
            .withObjective(Objective.minimize(ref(colour)));

    DecompositionResult result = decomposer.decompose(instance);

    assertEquals(ConstraintKind.ALL_EQUAL, result.instance().constraints().get(0).kind(), "Kept");
    assertEquals(2, result.diagnostics().size(), "Constraint and objective");
    assertEquals(
        DiagnosticKind.UNSUPPORTED_VARIABLE_TYPE, result.diagnostics().get(0).kind(), "Type");
    assertEquals(
        Diagnostic.OBJECTIVE_REF, result.diagnostics().get(1).constraintRef(), "Objective ref");
  }

  @Test
  void structuralConstraintsMustBeNormalizedFirst() {
    BlockConstraint block = new BlockConstraint("b", List.of(), null);

    assertThrows(IllegalStateException.class, () -> decompose(block), "Blocks are normalized");
  }

  @Test
  void writableConstraintsPassThroughUnchanged() {
    SumConstraint sum =
        SumConstraint.of(
            refs(intVars(0, 9, "v", "w", "x", "y", "z")),
            List.of(11, 24, 5, 23, 16),
            Condition.compare(ConditionOperator.LE, 100));

    DecompositionResult result = decompose(sum);

    assertSame(sum, result.instance().constraints().get(0), "Weighted sum is writable");
    assertFalse(result.instance().incomplete(), "Nothing was lost");
  }

  @Test
  void vocabularyDecidesWhatIsWritable() {
    TargetVocabulary withoutElement =
        new TargetVocabulary(EnumSet.of(ConstraintKind.INTENSION, ConstraintKind.SUM), true);
    ElementConstraint element =
        new ElementConstraint("el", abc, abc.get(0), Expressions.constant(3), 0);

    DecompositionResult result =
        new Decomposer(withoutElement).decompose(instanceOf(vars, element));

    assertEquals(1, result.diagnostics().size(), "element cannot be written");
    assertEquals("el", result.diagnostics().get(0).constraintRef(), "Reference");
  }

  @Test
  void unwritablePiecesKeepTheSourceConstraint() {
    TargetVocabulary withoutIntension = new TargetVocabulary(EnumSet.of(ConstraintKind.SUM), true);
    AllEqualConstraint allEqual = new AllEqualConstraint("e", abc);

    DecompositionResult result =
        new Decomposer(withoutIntension).decompose(instanceOf(vars, allEqual));

    assertEquals(1, result.instance().constraints().size(), "No pieces emitted");
    assertSame(allEqual, result.instance().constraints().get(0), "Kept verbatim");
    assertEquals(
        DiagnosticKind.UNSUPPORTED_CONSTRAINT, result.diagnostics().get(0).kind(), "Reported");
    assertTrue(result.instance().incomplete(), "Instance is flagged");
  }

  @Test
  void decompositionIsIdempotent() {
    Instance instance =
        instanceOf(
            vars,
            new AllEqualConstraint("e", abc),
            new SumConstraint("s", abc, List.of(), Condition.in(Domain.range(1, 4))),
            new NValuesConstraint("n", abc, Condition.notIn(Domain.values(2, 5))),
            IntensionConstraint.of(
                Expressions.eq(
                    new Aggregate(AggregateKind.MAXIMUM, abc), Expressions.constant(4))));

    Instance once = decomposer.decompose(instance).instance();
    Instance twice = decomposer.decompose(once).instance();

    assertEquals(once, twice, "Second pass is the identity");
  }
}
