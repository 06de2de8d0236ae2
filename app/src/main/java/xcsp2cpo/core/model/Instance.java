package xcsp2cpo.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import xcsp2cpo.core.MalformedInstanceException;
import xcsp2cpo.core.constraint.Constraint;

/**
 * One complete problem: variables, variable arrays, the ordered constraint list and at most one
 * objective. Instances are immutable; pipeline stages derive new ones.
 */
public final class Instance {
  private final Map<String, Variable> variables;
  private final List<VariableArray> arrays;
  private final List<Constraint> constraints;
  private final Objective objective;
  private final boolean incomplete;

  private Instance(Builder builder) {
    this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
    this.arrays = List.copyOf(builder.arrays.values());
    this.constraints = List.copyOf(builder.constraints);
    this.objective = builder.objective;
    this.incomplete = builder.incomplete;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder pre-populated with this instance's content. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    variables.values().forEach(builder::addVariable);
    arrays.forEach(builder::addArray);
    builder.addConstraints(constraints);
    if (objective != null) {
      builder.objective(objective);
    }
    return builder.incomplete(incomplete);
  }

  /** Variables by id, in declaration order. */
  public Map<String, Variable> variables() {
    return variables;
  }

  public Optional<Variable> variable(String id) {
    return Optional.ofNullable(variables.get(id));
  }

  public List<VariableArray> arrays() {
    return arrays;
  }

  public Optional<VariableArray> array(String id) {
    for (VariableArray array : arrays) {
      if (array.id().equals(id)) {
        return Optional.of(array);
      }
    }
    return Optional.empty();
  }

  public List<Constraint> constraints() {
    return constraints;
  }

  public Optional<Objective> objective() {
    return Optional.ofNullable(objective);
  }

  public ProblemType problemType() {
    return objective == null ? ProblemType.CSP : ProblemType.COP;
  }

  /** True when some content could not be converted and was kept only for reporting. */
  public boolean incomplete() {
    return incomplete;
  }

  public Instance withConstraints(List<Constraint> newConstraints) {
    Objects.requireNonNull(newConstraints, "newConstraints");
    Builder builder = toBuilder();
    builder.constraints.clear();
    return builder.addConstraints(newConstraints).build();
  }

  public Instance withObjective(Objective newObjective) {
    Builder builder = toBuilder();
    builder.objective = null;
    if (newObjective != null) {
      builder.objective(newObjective);
    }
    return builder.build();
  }

  public Instance withIncomplete(boolean flag) {
    return flag == incomplete ? this : toBuilder().incomplete(flag).build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Instance other)) {
      return false;
    }
    return incomplete == other.incomplete
        && variables.equals(other.variables)
        && arrays.equals(other.arrays)
        && constraints.equals(other.constraints)
        && Objects.equals(objective, other.objective);
  }

  @Override
  public int hashCode() {
    return Objects.hash(variables, arrays, constraints, objective, incomplete);
  }

  @Override
  public String toString() {
    return problemType()
        + "{variables="
        + variables.size()
        + ", arrays="
        + arrays.size()
        + ", constraints="
        + constraints.size()
        + (objective == null ? "" : ", objective=" + objective)
        + "}";
  }

  /** Collects declarations, constraints and the optional objective. */
  public static final class Builder {
    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final Map<String, VariableArray> arrays = new LinkedHashMap<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private Objective objective;
    private boolean incomplete;

    private Builder() {}

    public Builder addVariable(Variable variable) {
      Objects.requireNonNull(variable, "variable");
      requireFreshId(variable.id());
      variables.put(variable.id(), variable);
      return this;
    }

    public Builder addArray(VariableArray array) {
      Objects.requireNonNull(array, "array");
      requireFreshId(array.id());
      arrays.put(array.id(), array);
      return this;
    }

    public Builder addConstraint(Constraint constraint) {
      constraints.add(Objects.requireNonNull(constraint, "constraint"));
      return this;
    }

    public Builder addConstraints(List<? extends Constraint> more) {
      more.forEach(this::addConstraint);
      return this;
    }

    /** Sets the objective. Multi-objective problems are not supported, so a second call fails. */
    public Builder objective(Objective newObjective) {
      Objects.requireNonNull(newObjective, "objective");
      if (objective != null) {
        throw new MalformedInstanceException(
            "objectives", "multi-objective problems are not supported");
      }
      objective = newObjective;
      return this;
    }

    public Builder incomplete(boolean flag) {
      incomplete = flag;
      return this;
    }

    public Instance build() {
      return new Instance(this);
    }

    private void requireFreshId(String id) {
      if (variables.containsKey(id) || arrays.containsKey(id)) {
        throw new MalformedInstanceException(id, "duplicate variable id");
      }
    }
  }
}
