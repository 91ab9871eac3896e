package fsmgen.frontend;

/**
 * Base class of all errors raised while loading a state machine description, building its model or emitting artifacts from it.
 * The message always names the offending state, transition, port or key.
 */
public class FsmSpecException extends Exception {
  private static final long serialVersionUID = 1L;

  public FsmSpecException(String message) { super(message); }

  public FsmSpecException(String message, Throwable cause) { super(message, cause); }
}
