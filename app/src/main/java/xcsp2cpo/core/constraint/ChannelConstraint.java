package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.List;
import xcsp2cpo.core.expr.Expression;

/**
 * Inverse channelling: {@code first[i] == j + startIndex} iff {@code second[j] == i + startIndex}.
 * An empty second list channels the first list with itself.
 */
public record ChannelConstraint(
    String id, List<Expression> first, List<Expression> second, int startIndex)
    implements Constraint {

  public ChannelConstraint {
    first = Constraints.copy(first, "first");
    second = second == null ? List.of() : List.copyOf(second);
  }

  public static ChannelConstraint of(List<Expression> first, List<Expression> second) {
    return new ChannelConstraint(null, first, second, 0);
  }

  public boolean selfInverse() {
    return second.isEmpty();
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.CHANNEL;
  }

  @Override
  public List<Expression> operands() {
    List<Expression> all = new ArrayList<>(first);
    all.addAll(second);
    return List.copyOf(all);
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<Expression> mappedFirst = mapper.list(first);
    List<Expression> mappedSecond = mapper.list(second);
    if (mappedFirst == first && mappedSecond == second) {
      return this;
    }
    return new ChannelConstraint(id, mappedFirst, mappedSecond, startIndex);
  }

  @Override
  public String toString() {
    if (selfInverse()) {
      return "channel(" + Constraints.render(first) + ")";
    }
    return "channel(" + Constraints.render(first) + "," + Constraints.render(second) + ")";
  }
}
