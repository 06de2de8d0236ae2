package xcsp2cpo.core.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reference into a declared variable array, e.g. {@code x[]}, {@code x[2][]} or {@code x[i+1]}.
 * Only valid before normalization.
 */
public record ArraySlice(String arrayId, List<IndexSpec> indices) implements Expression {

  public ArraySlice {
    Objects.requireNonNull(arrayId, "arrayId");
    Objects.requireNonNull(indices, "indices");
    indices = List.copyOf(indices);
  }

  public static ArraySlice of(String arrayId, IndexSpec... indices) {
    return new ArraySlice(arrayId, List.of(indices));
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.ARRAY_SLICE;
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
    return arrayId + indices.stream().map(IndexSpec::toString).collect(Collectors.joining());
  }
}
