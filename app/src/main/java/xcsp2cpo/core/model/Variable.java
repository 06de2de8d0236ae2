package xcsp2cpo.core.model;

import java.util.Objects;
import xcsp2cpo.core.MalformedInstanceException;

/**
 * Decision variable. Integer variables always carry a domain; the unsupported types carry none and
 * are only kept so that constraints over them can be reported.
 */
public record Variable(String id, VariableType type, Domain domain) {

  public Variable {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    if (id.isBlank()) {
      throw new MalformedInstanceException("Variable id must not be blank");
    }
    if (type == VariableType.INTEGER && domain == null) {
      throw new MalformedInstanceException(id, "integer variable has no domain");
    }
  }

  public static Variable integer(String id, Domain domain) {
    return new Variable(id, VariableType.INTEGER, domain);
  }

  public static Variable unsupported(String id, VariableType type) {
    return new Variable(id, type, null);
  }

  public boolean convertible() {
    return type.convertible();
  }

  @Override
  public String toString() {
    return domain == null ? id + ":" + type.xcspName() : id + " in " + domain;
  }
}
