package xcsp2cpo.normalize;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Lists;
import com.google.common.collect.Range;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Naming of expanded array cells: the array id followed by one bracket per dimension, e.g. {@code
 * x[1][2]}. Writers rely on this to emit arrays positionally.
 */
public final class CellNames {
  private static final Splitter BRACKETS =
      Splitter.on(CharMatcher.anyOf("[]")).trimResults().omitEmptyStrings();

  private CellNames() {}

  /** Cell address recovered from a variable name. */
  public record CellAddress(String arrayId, List<Integer> indices) {
    public CellAddress {
      indices = List.copyOf(indices);
    }
  }

  public static String cellName(String arrayId, List<Integer> indices) {
    StringBuilder sb = new StringBuilder(arrayId);
    for (int index : indices) {
      sb.append('[').append(index).append(']');
    }
    return sb.toString();
  }

  /** Parses {@code id[i]..[k]}; plain ids and malformed suffixes yield empty. */
  public static Optional<CellAddress> parse(String variableName) {
    int open = variableName.indexOf('[');
    if (open <= 0 || !variableName.endsWith("]")) {
      return Optional.empty();
    }
    String arrayId = variableName.substring(0, open);
    List<Integer> indices = new ArrayList<>();
    for (String part : BRACKETS.split(variableName.substring(open))) {
      try {
        indices.add(Integer.parseInt(part));
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }
    return indices.isEmpty() ? Optional.empty() : Optional.of(new CellAddress(arrayId, indices));
  }

  /** Every index tuple of the given dimensions, in row-major order. */
  public static List<List<Integer>> rowMajor(List<Integer> dimensions) {
    List<List<Integer>> axes = new ArrayList<>(dimensions.size());
    for (int dimension : dimensions) {
      axes.add(axis(0, dimension - 1));
    }
    return Lists.cartesianProduct(axes);
  }

  static List<Integer> axis(int from, int to) {
    if (to < from) {
      return List.of();
    }
    return List.copyOf(ContiguousSet.create(Range.closed(from, to), DiscreteDomain.integers()));
  }
}
