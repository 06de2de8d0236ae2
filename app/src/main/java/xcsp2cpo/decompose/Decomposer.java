package xcsp2cpo.decompose;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xcsp2cpo.core.TargetVocabulary;
import xcsp2cpo.core.constraint.AllEqualConstraint;
import xcsp2cpo.core.constraint.ChannelConstraint;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.constraint.Constraints;
import xcsp2cpo.core.constraint.InstantiationConstraint;
import xcsp2cpo.core.constraint.OrderedConstraint;
import xcsp2cpo.core.constraint.UnsupportedConstraint;
import xcsp2cpo.core.diagnostics.Diagnostic;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.model.Condition;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.core.model.Objective;
import xcsp2cpo.core.model.Variable;

/**
 * Rewrites every constraint into kinds the target vocabulary writes.
 *
 * <p>Constraints that cannot be expressed are kept verbatim and reported through a {@link
 * Diagnostic}; the instance is then marked incomplete. Only malformed input aborts the run.
 * Decomposing an already decomposed instance returns an equal instance.
 */
public final class Decomposer {
  private static final Logger LOG = LoggerFactory.getLogger(Decomposer.class);

  private final TargetVocabulary vocabulary;

  public Decomposer() {
    this(TargetVocabulary.cpo());
  }

  public Decomposer(TargetVocabulary vocabulary) {
    this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
  }

  public DecompositionResult decompose(Instance instance) {
    Objects.requireNonNull(instance, "instance");
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<Constraint> decomposed = new ArrayList<>();
    List<Constraint> source = instance.constraints();
    for (int i = 0; i < source.size(); i++) {
      Constraint constraint = source.get(i);
      decomposed.addAll(decompose(constraint, Constraints.reference(constraint, i), diagnostics));
    }

    Optional<Objective> objective = instance.objective();
    if (objective.isPresent()) {
      firstUnsupportedVariable(objective.get().target())
          .ifPresent(
              variable ->
                  diagnostics.add(
                      Diagnostic.unsupportedVariableType(
                          Diagnostic.OBJECTIVE_REF, Diagnostic.OBJECTIVE_REF, variable)));
    }

    Instance result =
        instance
            .withConstraints(decomposed)
            .withIncomplete(instance.incomplete() || !diagnostics.isEmpty());
    LOG.debug(
        "Decomposed {} constraints into {} ({} diagnostics)",
        source.size(),
        decomposed.size(),
        diagnostics.size());
    return new DecompositionResult(result, diagnostics);
  }

  private List<Constraint> decompose(
      Constraint constraint, String reference, List<Diagnostic> diagnostics) {
    if (constraint.kind().isStructural()) {
      throw new IllegalStateException(
          "Normalization must run before decomposition: " + constraint.kind() + " at " + reference);
    }
    Optional<Variable> unsupportedVariable = firstUnsupportedVariable(constraint);
    if (unsupportedVariable.isPresent()) {
      diagnostics.add(
          Diagnostic.unsupportedVariableType(
              reference, constraint.kind().xcspName(), unsupportedVariable.get()));
      return List.of(constraint);
    }

    int reported = diagnostics.size();
    List<Constraint> pieces =
        switch (constraint.kind()) {
          case ALL_EQUAL -> ChainDecompositions.allEqual((AllEqualConstraint) constraint);
          case ORDERED -> ChainDecompositions.ordered((OrderedConstraint) constraint);
          case CHANNEL -> ChainDecompositions.channel((ChannelConstraint) constraint, reference);
          case INSTANTIATION ->
              ChainDecompositions.instantiation((InstantiationConstraint) constraint, reference);
          case SUM, COUNT, NVALUES, MINIMUM, MAXIMUM ->
              decomposeCondition(constraint, reference, diagnostics);
          case UNSUPPORTED -> {
            String rawKind = ((UnsupportedConstraint) constraint).rawKind();
            diagnostics.add(Diagnostic.unsupportedConstraint(reference, rawKind));
            yield List.of(constraint);
          }
          case INTENSION, EXTENSION, ALL_DIFFERENT, CARDINALITY, ELEMENT -> List.of(constraint);
          case GROUP, BLOCK, LOOP -> throw new IllegalStateException(constraint.kind().name());
        };

    if (reported == diagnostics.size()) {
      for (Constraint piece : pieces) {
        if (!vocabulary.writes(piece.kind())) {
          diagnostics.add(Diagnostic.unsupportedConstraint(reference, piece.kind().xcspName()));
          return List.of(constraint);
        }
      }
    }
    if (pieces.size() != 1 || pieces.get(0) != constraint) {
      LOG.debug("{}: {} became {} constraints", reference, constraint.kind(), pieces.size());
    }
    return pieces;
  }

  private static List<Constraint> decomposeCondition(
      Constraint constraint, String reference, List<Diagnostic> diagnostics) {
    Condition condition = ConditionDecompositions.conditionOf(constraint);
    if (!ConditionDecompositions.needsDecomposition(condition)) {
      return List.of(constraint);
    }
    if (ConditionDecompositions.splitsIntoBounds(condition)) {
      return ConditionDecompositions.splitBounds(constraint);
    }
    Constraint intension = ConditionDecompositions.toIntension(constraint);
    if (intension == null) {
      diagnostics.add(Diagnostic.unsupportedCondition(reference, constraint, condition));
      return List.of(constraint);
    }
    return List.of(intension);
  }

  private static Optional<Variable> firstUnsupportedVariable(Constraint constraint) {
    for (Expression operand : constraint.operands()) {
      Optional<Variable> found = firstUnsupportedVariable(operand);
      if (found.isPresent()) {
        return found;
      }
    }
    return Optional.empty();
  }

  private static Optional<Variable> firstUnsupportedVariable(Expression expression) {
    return Expressions.variables(expression).stream()
        .filter(variable -> !variable.convertible())
        .findFirst();
  }
}
