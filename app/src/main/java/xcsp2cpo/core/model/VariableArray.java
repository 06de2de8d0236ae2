package xcsp2cpo.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.MalformedInstanceException;

/** Declared array of integer variables sharing one domain; expanded during normalization. */
public record VariableArray(String id, List<Integer> dimensions, Domain domain) {

  public VariableArray {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(dimensions, "dimensions");
    Objects.requireNonNull(domain, "domain");
    if (dimensions.isEmpty()) {
      throw new MalformedInstanceException(id, "array declares no dimension");
    }
    for (int dimension : dimensions) {
      if (dimension < 0) {
        throw new MalformedInstanceException(id, "negative array dimension " + dimension);
      }
    }
    dimensions = List.copyOf(dimensions);
  }

  public static VariableArray of(String id, Domain domain, int... dimensions) {
    return new VariableArray(id, Arrays.stream(dimensions).boxed().toList(), domain);
  }

  public int arity() {
    return dimensions.size();
  }

  /** Number of cells, 0 when any dimension is 0. */
  public int cellCount() {
    int total = 1;
    for (int dimension : dimensions) {
      total = Math.multiplyExact(total, dimension);
    }
    return total;
  }
}
