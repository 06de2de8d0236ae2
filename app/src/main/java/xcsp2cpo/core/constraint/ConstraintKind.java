package xcsp2cpo.core.constraint;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of constraint kinds known to the IR. Anything else arrives as {@link #UNSUPPORTED}
 * with its raw XCSP3 element name.
 */
public enum ConstraintKind {
  INTENSION("intension"),
  EXTENSION("extension"),
  ALL_DIFFERENT("allDifferent"),
  ALL_EQUAL("allEqual"),
  ORDERED("ordered"),
  SUM("sum"),
  COUNT("count"),
  NVALUES("nValues"),
  CARDINALITY("cardinality"),
  MINIMUM("minimum"),
  MAXIMUM("maximum"),
  ELEMENT("element"),
  CHANNEL("channel"),
  INSTANTIATION("instantiation"),
  UNSUPPORTED("unsupported"),
  GROUP("group"),
  BLOCK("block"),
  LOOP("loop");

  private static final Map<String, ConstraintKind> BY_NAME =
      Arrays.stream(values())
          .filter(kind -> kind != UNSUPPORTED)
          .collect(
              Collectors.toUnmodifiableMap(
                  kind -> kind.xcspName.toLowerCase(Locale.ROOT), Function.identity()));

  private final String xcspName;

  ConstraintKind(String xcspName) {
    this.xcspName = xcspName;
  }

  public String xcspName() {
    return xcspName;
  }

  /** Structural kinds only exist before normalization. */
  public boolean isStructural() {
    return this == GROUP || this == BLOCK || this == LOOP;
  }

  /**
   * Resolves an XCSP3 element name case-insensitively; unknown names map to {@link #UNSUPPORTED}.
   */
  public static ConstraintKind fromXcspName(String name) {
    if (name == null) {
      return UNSUPPORTED;
    }
    return BY_NAME.getOrDefault(name.trim().toLowerCase(Locale.ROOT), UNSUPPORTED);
  }
}
