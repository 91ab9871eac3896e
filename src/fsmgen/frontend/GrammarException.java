package fsmgen.frontend;

/** A transition or output clause matches none of the recognized shapes, or a state repeats a clause kind that may appear only once. */
public class GrammarException extends FsmSpecException {
  private static final long serialVersionUID = 1L;

  public GrammarException(String message) { super(message); }
}
