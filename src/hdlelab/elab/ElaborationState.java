package hdlelab.elab;

/**
 * Lifecycle of an {@link Elaborator}. States are passed in declaration order; VALIDATED and FAILED are terminal.
 */
public enum ElaborationState {
  BUILDING,
  INFERRING,
  RESOLVING,
  VALIDATED,
  FAILED;

  public boolean isTerminal() { return this == VALIDATED || this == FAILED; }
}
