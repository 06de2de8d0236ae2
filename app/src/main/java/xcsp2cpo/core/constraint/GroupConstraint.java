package xcsp2cpo.core.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import xcsp2cpo.core.expr.Expression;

/**
 * Template constraint instantiated once per argument tuple; {@code %k} in the template binds to the
 * {@code k}-th argument.
 */
public record GroupConstraint(String id, Constraint template, List<List<Expression>> arguments)
    implements Constraint {

  public GroupConstraint {
    Objects.requireNonNull(template, "template");
    Objects.requireNonNull(arguments, "arguments");
    List<List<Expression>> copied = new ArrayList<>(arguments.size());
    for (List<Expression> tuple : arguments) {
      copied.add(List.copyOf(tuple));
    }
    arguments = List.copyOf(copied);
  }

  @Override
  public ConstraintKind kind() {
    return ConstraintKind.GROUP;
  }

  @Override
  public List<Expression> operands() {
    List<Expression> all = new ArrayList<>(template.operands());
    arguments.forEach(all::addAll);
    return List.copyOf(all);
  }

  @Override
  public Constraint mapOperands(OperandMapper mapper) {
    List<List<Expression>> mappedArguments = new ArrayList<>(arguments.size());
    for (List<Expression> tuple : arguments) {
      mappedArguments.add(mapper.list(tuple));
    }
    return new GroupConstraint(id, template.mapOperands(mapper), mappedArguments);
  }

  @Override
  public String toString() {
    return "group(" + template + " x" + arguments.size() + ")";
  }
}
