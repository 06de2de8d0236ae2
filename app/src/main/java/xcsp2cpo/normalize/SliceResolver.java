package xcsp2cpo.normalize;

import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.expr.ArraySlice;
import xcsp2cpo.core.expr.IndexSpec;
import xcsp2cpo.core.model.Variable;

/** Turns array references into the cell variables they designate. */
final class SliceResolver {
  private final Map<String, ArrayCells> arrays;

  SliceResolver(Map<String, ArrayCells> arrays) {
    this.arrays = Map.copyOf(arrays);
  }

  /**
   * Cells selected by {@code slice} in row-major order. Missing trailing brackets select the whole
   * dimension, so {@code x[]} on a matrix yields every cell.
   */
  List<Variable> resolve(ArraySlice slice, Bindings bindings, String reference) {
    ArrayCells cells = arrays.get(slice.arrayId());
    if (cells == null) {
      throw new MalformedInstanceException(
          reference, "reference to undeclared array '" + slice.arrayId() + "'");
    }
    List<Integer> dimensions = cells.array().dimensions();
    if (slice.indices().size() > dimensions.size()) {
      throw new MalformedInstanceException(
          reference,
          slice
              + " has "
              + slice.indices().size()
              + " indices but the array has "
              + dimensions.size()
              + " dimensions");
    }
    List<List<Integer>> axes = new ArrayList<>(dimensions.size());
    for (int d = 0; d < dimensions.size(); d++) {
      IndexSpec spec = d < slice.indices().size() ? slice.indices().get(d) : IndexSpec.all();
      axes.add(axis(spec, dimensions.get(d), slice, bindings, reference));
    }
    List<Variable> selected = new ArrayList<>();
    for (List<Integer> tuple : Lists.cartesianProduct(axes)) {
      selected.add(cells.cell(tuple));
    }
    return selected;
  }

  /** The single cell designated by {@code slice}; anything else is malformed in scalar position. */
  Variable resolveScalar(ArraySlice slice, Bindings bindings, String reference) {
    List<Variable> selected = resolve(slice, bindings, reference);
    if (selected.size() != 1) {
      throw new MalformedInstanceException(
          reference, slice + " selects " + selected.size() + " cells where one is expected");
    }
    return selected.get(0);
  }

  private static List<Integer> axis(
      IndexSpec spec, int size, ArraySlice slice, Bindings bindings, String reference) {
    return switch (spec.type()) {
      case ALL -> CellNames.axis(0, size - 1);
      case SINGLE -> List.of(checked(spec.from(), size, slice, reference));
      case RANGE -> {
        checked(spec.from(), size, slice, reference);
        checked(spec.to(), size, slice, reference);
        yield CellNames.axis(spec.from(), spec.to());
      }
      case TERM -> {
        int value = bindings.index(spec.indexName(), reference) + spec.offset();
        yield List.of(checked(value, size, slice, reference));
      }
    };
  }

  private static int checked(int index, int size, ArraySlice slice, String reference) {
    if (index < 0 || index >= size) {
      throw new MalformedInstanceException(
          reference, "index " + index + " out of bounds 0.." + (size - 1) + " in " + slice);
    }
    return index;
  }
}
