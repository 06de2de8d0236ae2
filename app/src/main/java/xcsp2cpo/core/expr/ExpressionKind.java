package xcsp2cpo.core.expr;

/** Node kinds of the expression algebra. */
public enum ExpressionKind {
  CONST,
  VAR_REF,
  UNARY,
  BINARY,
  NARY,
  CONDITIONAL,
  AGGREGATE,
  /** Array reference with index specs; removed by normalization. */
  ARRAY_SLICE,
  /** Group placeholder {@code %k}; removed by normalization. */
  TEMPLATE_PARAMETER,
  /** Loop index with offset; removed by normalization. */
  INDEX_TERM;

  /** Whether nodes of this kind may only appear before normalization. */
  public boolean isStructural() {
    return this == ARRAY_SLICE || this == TEMPLATE_PARAMETER || this == INDEX_TERM;
  }
}
