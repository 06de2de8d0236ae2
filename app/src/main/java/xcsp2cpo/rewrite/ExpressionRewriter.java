package xcsp2cpo.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xcsp2cpo.core.TargetVocabulary;
import xcsp2cpo.core.constraint.Constraint;
import xcsp2cpo.core.constraint.OperandMapper;
import xcsp2cpo.core.expr.Binary;
import xcsp2cpo.core.expr.Expression;
import xcsp2cpo.core.expr.Expressions;
import xcsp2cpo.core.expr.NAry;
import xcsp2cpo.core.expr.Operator;
import xcsp2cpo.core.expr.Unary;
import xcsp2cpo.core.model.Instance;
import xcsp2cpo.core.model.Objective;

/**
 * Canonicalizes expression trees so that only {@link TargetVocabulary#canonicalOperators()}
 * remain.
 *
 * <p>One post-order pass with local rules:
 *
 * <ul>
 *   <li>{@code neg(x)} becomes {@code sub(0,x)}
 *   <li>{@code dist(x,y)} becomes {@code abs(sub(x,y))}
 *   <li>{@code iff(a,b)} becomes {@code eq(a,b)} and {@code xor(a,b)} becomes {@code ne(a,b)}
 *   <li>{@code imp(a,b)} becomes {@code or(not(a),b)} unless implication is native
 *   <li>{@code not(not(x))} becomes {@code x}
 *   <li>nested {@code and}/{@code or} are flattened; a single-operand n-ary node is its operand
 * </ul>
 *
 * Constraint shapes are never changed; only their operands are rewritten.
 */
public final class ExpressionRewriter {
  private static final Logger LOG = LoggerFactory.getLogger(ExpressionRewriter.class);

  private final TargetVocabulary vocabulary;

  public ExpressionRewriter() {
    this(TargetVocabulary.cpo());
  }

  public ExpressionRewriter(TargetVocabulary vocabulary) {
    this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
  }

  public Expression rewrite(Expression expression) {
    return Expressions.rewriteBottomUp(expression, this::rewriteNode);
  }

  /** Rewrites every constraint operand, condition bound and the objective. */
  public Instance rewrite(Instance instance) {
    Objects.requireNonNull(instance, "instance");
    OperandMapper mapper = OperandMapper.of(this::rewrite);
    List<Constraint> rewritten = new ArrayList<>(instance.constraints().size());
    int changed = 0;
    for (Constraint constraint : instance.constraints()) {
      Constraint next = constraint.mapOperands(mapper);
      if (next != constraint) {
        changed++;
      }
      rewritten.add(next);
    }
    Instance result = instance.withConstraints(rewritten);
    if (instance.objective().isPresent()) {
      Objective objective = instance.objective().get();
      Expression target = rewrite(objective.target());
      if (target != objective.target()) {
        result = result.withObjective(objective.withTarget(target));
      }
    }
    LOG.debug("Rewrote operands of {} of {} constraints", changed, rewritten.size());
    return result;
  }

  /** True when the tree holds no structural node and no operator outside the canonical set. */
  public static boolean isCanonical(Expression expression, TargetVocabulary vocabulary) {
    Set<Operator> allowed = vocabulary.canonicalOperators();
    return !Expressions.anyMatch(
        expression,
        node -> {
          Operator op = operatorOf(node);
          return node.kind().isStructural() || (op != null && !allowed.contains(op));
        });
  }

  /** Checks every operand of every constraint and the objective. */
  public static boolean isCanonical(Instance instance, TargetVocabulary vocabulary) {
    for (Constraint constraint : instance.constraints()) {
      for (Expression operand : constraint.operands()) {
        if (!isCanonical(operand, vocabulary)) {
          return false;
        }
      }
    }
    return instance.objective().map(o -> isCanonical(o.target(), vocabulary)).orElse(true);
  }

  private Expression rewriteNode(Expression node) {
    if (node instanceof Unary unary) {
      return switch (unary.op()) {
        case NEG -> Expressions.binary(Operator.SUB, Expressions.constant(0), unary.operand());
        case NOT -> negate(unary.operand(), unary);
        default -> unary;
      };
    }
    if (node instanceof Binary binary) {
      return switch (binary.op()) {
        case DIST ->
            Expressions.unary(
                Operator.ABS, Expressions.binary(Operator.SUB, binary.left(), binary.right()));
        case IFF -> Expressions.eq(binary.left(), binary.right());
        case XOR -> Expressions.ne(binary.left(), binary.right());
        case IMP ->
            vocabulary.nativeImplication()
                ? binary
                : flatten(Operator.OR, List.of(negate(binary.left(), null), binary.right()), null);
        case AND, OR -> flatten(binary.op(), binary.children(), null);
        default -> binary;
      };
    }
    if (node instanceof NAry nary) {
      if (nary.op() == Operator.AND || nary.op() == Operator.OR) {
        return flatten(nary.op(), nary.operands(), nary);
      }
      return nary.operands().size() == 1 ? nary.operands().get(0) : nary;
    }
    return node;
  }

  /** {@code not(operand)}, cancelling a double negation; reuses {@code existing} if unchanged. */
  private static Expression negate(Expression operand, Unary existing) {
    if (operand instanceof Unary inner && inner.op() == Operator.NOT) {
      return inner.operand();
    }
    return existing != null ? existing : Expressions.not(operand);
  }

  private static Expression flatten(Operator op, List<Expression> operands, NAry existing) {
    List<Expression> flat = new ArrayList<>(operands.size());
    for (Expression operand : operands) {
      if (operatorOf(operand) == op) {
        flat.addAll(operand.children());
      } else {
        flat.add(operand);
      }
    }
    if (flat.size() == 1) {
      return flat.get(0);
    }
    if (existing != null && flat.equals(existing.operands())) {
      return existing;
    }
    return Expressions.nary(op, flat);
  }

  /** Operator of an operator node; null for leaves, conditionals and aggregates. */
  private static Operator operatorOf(Expression node) {
    if (node instanceof Unary unary) {
      return unary.op();
    }
    if (node instanceof Binary binary) {
      return binary.op();
    }
    if (node instanceof NAry nary) {
      return nary.op();
    }
    return null;
  }
}
