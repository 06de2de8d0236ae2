package xcsp2cpo.core;

/**
 * Structural violation in an instance, such as a template placeholder without a binding or a
 * {@code channel} over lists of different lengths. Aborts the transformation of that instance.
 */
public class MalformedInstanceException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String constraintRef;

  public MalformedInstanceException(String message) {
    this(null, message);
  }

  public MalformedInstanceException(String constraintRef, String message) {
    super(constraintRef == null ? message : constraintRef + ": " + message);
    this.constraintRef = constraintRef;
  }

  /** Constraint the violation was found in, or {@code null} for instance-level problems. */
  public String constraintRef() {
    return constraintRef;
  }
}
