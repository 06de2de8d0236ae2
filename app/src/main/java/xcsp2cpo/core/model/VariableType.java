package xcsp2cpo.core.model;

/** Declared type of a variable. Only {@link #INTEGER} variables can be converted. */
public enum VariableType {
  INTEGER("integer"),
  SYMBOLIC("symbolic"),
  REAL("real"),
  SET("set"),
  GRAPH("graph");

  private final String xcspName;

  VariableType(String xcspName) {
    this.xcspName = xcspName;
  }

  public String xcspName() {
    return xcspName;
  }

  public boolean convertible() {
    return this == INTEGER;
  }
}
