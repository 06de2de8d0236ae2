package xcsp2cpo.normalize;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.constraint.BlockConstraint;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.constraint.Constraints;
import xcsp2cpo.core.constraint.GroupConstraint;
import xcsp2cpo.core.constraint.LoopConstraint;
import xcsp2cpo.core.constraint.OperandMapper;
import xcsp2cpo.core.diagnostics.Diagnostic;
import xcsp2cpo.core.expr.ArraySlice;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.expr.IndexTerm;
import xcsp2cpo.core.expr.TemplateParameter;
import xcsp2cpo.core.expr.VarRef;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.core.model.Objective;
import xcsp2cpo.core.model.VariableArray;

/**
 * Flattens an instance into concrete constraints over scalar variables.
 *
 * <p>Arrays become one variable per cell (see {@link CellNames}), slices become the cells they
 * select, groups and loops are instantiated, and blocks are spliced in place. The result contains
 * no array declaration, no structural constraint and no structural expression node.
 */
public final class Normalizer {
  private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

  public Instance normalize(Instance instance) {
    Objects.requireNonNull(instance, "instance");
    Instance.Builder builder = Instance.builder().incomplete(instance.incomplete());
    instance.variables().values().forEach(builder::addVariable);

    Map<String, ArrayCells> arrays = new LinkedHashMap<>();
    int cellCount = 0;
    for (VariableArray array : instance.arrays()) {
      ArrayCells cells = ArrayCells.expand(array);
      arrays.put(array.id(), cells);
      cells.cells().forEach(builder::addVariable);
      cellCount += cells.cells().size();
    }
    SliceResolver slices = new SliceResolver(arrays);

    List<Constraint> concrete = new ArrayList<>();
    List<Constraint> source = instance.constraints();
    for (int i = 0; i < source.size(); i++) {
      Constraint constraint = source.get(i);
      String reference = Constraints.reference(constraint, i);
      instantiate(constraint, Bindings.EMPTY, reference, slices, concrete);
    }
    builder.addConstraints(concrete);

    if (instance.objective().isPresent()) {
      Objective objective = instance.objective().get();
      OperandResolver resolver =
          new OperandResolver(slices, Bindings.EMPTY, Diagnostic.OBJECTIVE_REF);
      builder.objective(objective.withTarget(resolver.scalar(objective.target())));
    }

    LOG.debug(
        "Expanded {} arrays into {} cells; {} constraints became {}",
        arrays.size(),
        cellCount,
        source.size(),
        concrete.size());
    return builder.build();
  }

  private static void instantiate(
      Constraint constraint,
      Bindings bindings,
      String reference,
      SliceResolver slices,
      List<Constraint> out) {
    switch (constraint.kind()) {
      case BLOCK -> {
        for (Constraint child : ((BlockConstraint) constraint).constraints()) {
          instantiate(child, bindings, reference, slices, out);
        }
      }
      case GROUP -> {
        GroupConstraint group = (GroupConstraint) constraint;
        for (List<Expression> tuple : group.arguments()) {
          instantiate(group.template(), bindings.withArguments(tuple), reference, slices, out);
        }
      }
      case LOOP -> {
        LoopConstraint loop = (LoopConstraint) constraint;
        if (loop.iterations() == 0) {
          return;
        }
        Range<Integer> values = Range.closed(loop.from(), loop.to());
        for (int value : ContiguousSet.create(values, DiscreteDomain.integers())) {
          instantiate(
              loop.body(), bindings.withIndex(loop.indexName(), value), reference, slices, out);
        }
      }
      default -> out.add(constraint.mapOperands(new OperandResolver(slices, bindings, reference)));
    }
  }

  /** Resolves structural expression nodes under one set of bindings. */
  private static final class OperandResolver implements OperandMapper {
    private final SliceResolver slices;
    private final Bindings bindings;
    private final String reference;

    OperandResolver(SliceResolver slices, Bindings bindings, String reference) {
      this.slices = slices;
      this.bindings = bindings;
      this.reference = reference;
    }

    @Override
    public Expression scalar(Expression expression) {
      return switch (expression.kind()) {
        case TEMPLATE_PARAMETER -> forArguments().scalar(argument(expression));
        case ARRAY_SLICE ->
            new VarRef(slices.resolveScalar((ArraySlice) expression, bindings, reference));
        case INDEX_TERM -> {
          IndexTerm term = (IndexTerm) expression;
          yield Expressions.constant(bindings.index(term.indexName(), reference) + term.offset());
        }
        case NARY, AGGREGATE -> rebuild(expression, list(expression.children()));
        default -> {
          List<Expression> children = new ArrayList<>(expression.children().size());
          for (Expression child : expression.children()) {
            children.add(scalar(child));
          }
          yield rebuild(expression, children);
        }
      };
    }

    @Override
    public List<Expression> list(List<Expression> expressions) {
      List<Expression> out = new ArrayList<>(expressions.size());
      for (Expression expression : expressions) {
        switch (expression.kind()) {
          case TEMPLATE_PARAMETER -> out.addAll(forArguments().list(List.of(argument(expression))));
          case ARRAY_SLICE ->
              out.addAll(
                  Expressions.vars(slices.resolve((ArraySlice) expression, bindings, reference)));
          default -> out.add(scalar(expression));
        }
      }
      return out.equals(expressions) ? expressions : out;
    }

    private Expression argument(Expression parameter) {
      return bindings.argument(((TemplateParameter) parameter).position(), reference);
    }

    /** Arguments are resolved outside the template they are bound into. */
    private OperandResolver forArguments() {
      return new OperandResolver(slices, bindings.withoutArguments(), reference);
    }

    private Expression rebuild(Expression expression, List<Expression> children) {
      if (children.equals(expression.children())) {
        return expression;
      }
      try {
        return expression.withChildren(children);
      } catch (IllegalArgumentException ex) {
        throw new MalformedInstanceException(reference, ex.getMessage());
      }
    }
  }
}
