package fsmgen.frontend;

/** The document does not have the expected shape (missing keys, wrong value types, duplicate names, too few states...). */
public class StructuralInputException extends FsmSpecException {
  private static final long serialVersionUID = 1L;

  public StructuralInputException(String message) { super(message); }

  public StructuralInputException(String message, Throwable cause) { super(message, cause); }
}
