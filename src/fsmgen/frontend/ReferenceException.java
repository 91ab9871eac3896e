package fsmgen.frontend;

/** A state, output or output index is referenced that was never declared. */
public class ReferenceException extends FsmSpecException {
  private static final long serialVersionUID = 1L;

  public ReferenceException(String message) { super(message); }
}
