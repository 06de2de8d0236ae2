package xcsp2cpo.core.expr;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operators of the XCSP3 functional notation, grouped by arity class.
 *
 * <p>Associative operators may appear both as {@link Binary} and as {@link NAry} nodes.
 */
public enum Operator {
  NEG("neg", Arity.UNARY),
  ABS("abs", Arity.UNARY),
  SQR("sqr", Arity.UNARY),
  NOT("not", Arity.UNARY),

  SUB("sub", Arity.BINARY),
  DIV("div", Arity.BINARY),
  MOD("mod", Arity.BINARY),
  POW("pow", Arity.BINARY),
  DIST("dist", Arity.BINARY),
  LT("lt", Arity.BINARY),
  LE("le", Arity.BINARY),
  GT("gt", Arity.BINARY),
  GE("ge", Arity.BINARY),
  EQ("eq", Arity.BINARY),
  NE("ne", Arity.BINARY),
  IMP("imp", Arity.BINARY),
  IFF("iff", Arity.BINARY),
  XOR("xor", Arity.BINARY),

  ADD("add", Arity.ASSOCIATIVE),
  MUL("mul", Arity.ASSOCIATIVE),
  MIN("min", Arity.ASSOCIATIVE),
  MAX("max", Arity.ASSOCIATIVE),
  AND("and", Arity.ASSOCIATIVE),
  OR("or", Arity.ASSOCIATIVE);

  /** Arity class of an operator. */
  public enum Arity {
    UNARY,
    BINARY,
    ASSOCIATIVE
  }

  private static final Map<String, Operator> BY_NAME =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(Operator::xcspName, Function.identity()));

  private final String xcspName;
  private final Arity arity;
  Operator(String xcspName, Arity arity) {
    this.xcspName = xcspName;
    this.arity = arity;
  }

  public String xcspName() {
    return xcspName;
  }

  public Arity arity() {
    return arity;
  }

  public boolean acceptsOperandCount(int count) {
    return switch (arity) {
      case UNARY -> count == 1;
      case BINARY -> count == 2;
      case ASSOCIATIVE -> count >= 1;
    };
  }

  /** Resolves an XCSP3 operator name such as {@code "le"}, case-insensitively. */
  public static Operator fromXcspName(String name) {
    Operator op = name == null ? null : BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    if (op == null) {
      throw new IllegalArgumentException("Unknown operator: " + name);
    }
    return op;
  }
}
