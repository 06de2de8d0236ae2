package xcsp2cpo.core.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Aggregation over an operand list, such as a weighted sum. An empty coefficient list means every
 * coefficient is 1.
 */
public record Aggregate(
    AggregateKind aggregateKind, List<Expression> operands, List<Integer> coefficients)
    implements Expression {

  public Aggregate {
    Objects.requireNonNull(aggregateKind, "aggregateKind");
    Objects.requireNonNull(operands, "operands");
    operands = List.copyOf(operands);
    coefficients = coefficients == null ? List.of() : List.copyOf(coefficients);
    if (!coefficients.isEmpty()) {
      if (aggregateKind != AggregateKind.SUM) {
        throw new IllegalArgumentException(aggregateKind.xcspName() + " takes no coefficients");
      }
      if (Expressions.sized(operands) && coefficients.size() != operands.size()) {
        throw new IllegalArgumentException(
            "Expected " + operands.size() + " coefficients but got " + coefficients.size());
      }
    }
  }

  public Aggregate(AggregateKind aggregateKind, List<Expression> operands) {
    this(aggregateKind, operands, List.of());
  }

  public boolean weighted() {
    return !coefficients.isEmpty();
  }

  @Override
  public ExpressionKind kind() {
    return ExpressionKind.AGGREGATE;
  }

  @Override
  public List<Expression> children() {
    return operands;
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    if (children.equals(operands)) {
      return this;
    }
    return new Aggregate(aggregateKind, children, coefficients);
  }

  @Override
  public String toString() {
    String body = operands.stream().map(Expression::toString).collect(Collectors.joining(","));
    if (!weighted()) {
      return aggregateKind.xcspName() + "([" + body + "])";
    }
    return aggregateKind.xcspName() + "([" + body + "]," + coefficients + ")";
  }
}
