package xcsp2cpo.normalize;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.expr.Expression;

/** Template arguments and loop index values in scope while instantiating a constraint. */
final class Bindings {
  static final Bindings EMPTY = new Bindings(null, Map.of());

  private final List<Expression> arguments;
  private final Map<String, Integer> indices;

  private Bindings(List<Expression> arguments, Map<String, Integer> indices) {
    this.arguments = arguments;
    this.indices = indices;
  }

  Bindings withArguments(List<Expression> tuple) {
    return new Bindings(List.copyOf(tuple), indices);
  }

  Bindings withoutArguments() {
    return arguments == null ? this : new Bindings(null, indices);
  }

  Bindings withIndex(String name, int value) {
    Map<String, Integer> next = new HashMap<>(indices);
    next.put(Objects.requireNonNull(name, "name"), value);
    return new Bindings(arguments, Map.copyOf(next));
  }

  Expression argument(int position, String reference) {
    if (arguments == null) {
      throw new MalformedInstanceException(
          reference, "template parameter %" + position + " used outside a group");
    }
    if (position >= arguments.size()) {
      throw new MalformedInstanceException(
          reference,
          "template parameter %"
              + position
              + " has no binding ("
              + arguments.size()
              + " supplied)");
    }
    return arguments.get(position);
  }

  int index(String name, String reference) {
    Integer value = indices.get(name);
    if (value == null) {
      throw new MalformedInstanceException(reference, "loop index '" + name + "' is not bound");
    }
    return value;
  }
}
