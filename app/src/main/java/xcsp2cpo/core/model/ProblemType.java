package xcsp2cpo.core.model;

/** Satisfaction problem, or optimization problem when an objective is present. */
public enum ProblemType {
  CSP,
  COP
}
