package xcsp2cpo.core.expr;

import java.util.List;
import java.util.Objects;

/** Integer value of a loop index plus an offset, e.g. {@code i+1}. */
public record IndexTerm(String indexName, int offset) implements Expression {

  public IndexTerm {
    Objects.requireNonNull(indexName, "indexName");
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.INDEX_TERM;
  }

  @Override
  public List<Expression> children() {
    return List.of();
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Expressions.requireLeafChildren(this, children);
    return this;
  }

  @Override
  public String toString() {
    return render(indexName, offset);
  }

  static String render(String indexName, int offset) {
    if (offset == 0) {
      return indexName;
    }
    return offset > 0 ? indexName + "+" + offset : indexName + offset;
  }
}
