package xcsp2cpo.core.expr;

import java.util.Objects;

/**
 * One bracket of an array reference: {@code []}, {@code [k]}, {@code [a..b]}, or a loop index
 * term such as {@code [i+1]}.
 */
public record IndexSpec(Type type, int from, int to, String indexName) {

  /** Shape of an index bracket. */
  public enum Type {
    ALL,
    SINGLE,
    RANGE,
    TERM
  }

  public IndexSpec {
    Objects.requireNonNull(type, "type");
    if (type == Type.TERM) {
      Objects.requireNonNull(indexName, "indexName");
    } else {
      indexName = null;
    }
    if (type == Type.RANGE && from > to) {
      throw new IllegalArgumentException("Empty index range " + from + ".." + to);
    }
  }

  public static IndexSpec all() {
    return new IndexSpec(Type.ALL, 0, 0, null);
  }

  public static IndexSpec at(int index) {
    return new IndexSpec(Type.SINGLE, index, index, null);
  }

  public static IndexSpec range(int from, int to) {
    return new IndexSpec(Type.RANGE, from, to, null);
  }

  /** Index named by a loop variable plus a constant offset; {@code from} holds the offset. */
  public static IndexSpec term(String indexName, int offset) {
    return new IndexSpec(Type.TERM, offset, offset, indexName);
  }

  public int offset() {
    return from;
  }

  @Override
  public String toString() {
    return switch (type) {
      case ALL -> "[]";
      case SINGLE -> "[" + from + "]";
      case RANGE -> "[" + from + ".." + to + "]";
      case TERM -> "[" + IndexTerm.render(indexName, from) + "]";
    };
  }
}
