package xcsp2cpo.core.model;

import java.util.Locale;
import xcsp2cpo.core.expr.Operator;

/** Operators allowed in a constraint condition such as {@code (le,100)}. */
public enum ConditionOperator {
  LT(Operator.LT),
  LE(Operator.LE),
  GT(Operator.GT),
  GE(Operator.GE),
  EQ(Operator.EQ),
  NE(Operator.NE),
  IN(null),
  NOTIN(null);

  private final Operator relation;

  ConditionOperator(Operator relation) {
    this.relation = relation;
  }

  /** Matching expression operator; {@code null} for the set operators. */
  public Operator relation() {
    return relation;
  }

  public boolean isSetMembership() {
    return relation == null;
  }

  public String xcspName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ConditionOperator fromXcspName(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown condition operator: " + name, ex);
    }
  }
}
