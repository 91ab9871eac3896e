package fsmgen.frontend;

/** An input could not be read or an output artifact could not be written. */
public class ResourceException extends FsmSpecException {
  private static final long serialVersionUID = 1L;

  public ResourceException(String message, Throwable cause) { super(message, cause); }
}
