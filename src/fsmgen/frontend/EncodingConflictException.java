package fsmgen.frontend;

/** Two states resolved to the same encoding value. */
public class EncodingConflictException extends FsmSpecException {
  private static final long serialVersionUID = 1L;

  public EncodingConflictException(String message) { super(message); }
}
