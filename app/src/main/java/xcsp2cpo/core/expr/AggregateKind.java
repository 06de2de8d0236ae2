package xcsp2cpo.core.expr;

/** Aggregations over an operand list. Only {@link #SUM} carries coefficients. */
public enum AggregateKind {
  SUM("sum"),
  PRODUCT("product"),
  MINIMUM("minimum"),
  MAXIMUM("maximum"),
  NVALUES("nValues");

  private final String xcspName;

  AggregateKind(String xcspName) {
    this.xcspName = xcspName;
  }

  public String xcspName() {
    return xcspName;
  }
}
