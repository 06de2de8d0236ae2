package xcsp2cpo.normalize;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import xcsp2cpo.core.model.Variable;
import xcsp2cpo.core.model.VariableArray;

/** Scalar cells of one declared array, addressable by index tuple. */
final class ArrayCells {
  private final VariableArray array;
  private final List<Variable> cells;
  private final Map<List<Integer>, Variable> byIndex;

  private ArrayCells(
      VariableArray array, List<Variable> cells, Map<List<Integer>, Variable> byIndex) {
    this.array = array;
    this.cells = cells;
    this.byIndex = byIndex;
  }

  static ArrayCells expand(VariableArray array) {
    Objects.requireNonNull(array, "array");
    List<Variable> cells = new ArrayList<>(array.cellCount());
    Map<List<Integer>, Variable> byIndex = new HashMap<>();
    for (List<Integer> tuple : CellNames.rowMajor(array.dimensions())) {
      Variable cell = Variable.integer(CellNames.cellName(array.id(), tuple), array.domain());
      cells.add(cell);
      byIndex.put(List.copyOf(tuple), cell);
    }
    return new ArrayCells(array, List.copyOf(cells), byIndex);
  }

  VariableArray array() {
    return array;
  }

  /** Cells in row-major order. */
  List<Variable> cells() {
    return cells;
  }

  Variable cell(List<Integer> tuple) {
    return byIndex.get(tuple);
  }
}
