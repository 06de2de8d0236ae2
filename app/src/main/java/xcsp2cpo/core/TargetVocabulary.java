package xcsp2cpo.core;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import xcsp2cpo.core.constraint.ConstraintKind;
import xcsp2cpo.core.expr.Operator;

/**
 * Constraint kinds and expression operators the writer of the target language prints directly.
 * Everything else has to be decomposed or rewritten first.
 */
public record TargetVocabulary(Set<ConstraintKind> writableKinds, boolean nativeImplication) {

  private static final Set<ConstraintKind> CPO_KINDS =
      Set.copyOf(
          EnumSet.of(
              ConstraintKind.INTENSION,
              ConstraintKind.EXTENSION,
              ConstraintKind.ALL_DIFFERENT,
              ConstraintKind.SUM,
              ConstraintKind.COUNT,
              ConstraintKind.NVALUES,
              ConstraintKind.CARDINALITY,
              ConstraintKind.MINIMUM,
              ConstraintKind.MAXIMUM,
              ConstraintKind.ELEMENT));

  public TargetVocabulary {
    Objects.requireNonNull(writableKinds, "writableKinds");
    for (ConstraintKind kind : writableKinds) {
      if (kind.isStructural() || kind == ConstraintKind.UNSUPPORTED) {
        throw new IllegalArgumentException(kind + " cannot be a writable kind");
      }
    }
    writableKinds = Set.copyOf(writableKinds);
  }

  /** CP Optimizer: the writable kinds above, with {@code =>} available for implication. */
  public static TargetVocabulary cpo() {
    return new TargetVocabulary(CPO_KINDS, true);
  }

  public TargetVocabulary withNativeImplication(boolean flag) {
    return new TargetVocabulary(writableKinds, flag);
  }

  public boolean writes(ConstraintKind kind) {
    return writableKinds.contains(kind);
  }

  /** Operators that may survive expression rewriting. */
  public Set<Operator> canonicalOperators() {
    EnumSet<Operator> operators = EnumSet.allOf(Operator.class);
    operators.removeAll(EnumSet.of(Operator.NEG, Operator.DIST, Operator.IFF, Operator.XOR));
    if (!nativeImplication) {
      operators.remove(Operator.IMP);
    }
    return operators;
  }
}
