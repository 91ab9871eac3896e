package fsmgen.frontend;

/**
 * An output port. Registered outputs are stored in a flip-flop and keep their value while nothing assigns them;
 * combinational outputs are recomputed every cycle and fall back to zero.
 */
public class OutputPort extends Port {
  private final boolean registered;

  public OutputPort(String name, int width, boolean registered) {
    super(name, width);
    this.registered = registered;
  }

  public boolean isRegistered() { return registered; }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + Boolean.hashCode(registered);
  }

  @Override
  public boolean equals(Object obj) {
    return super.equals(obj) && registered == ((OutputPort)obj).registered;
  }

  @Override
  public String toString() {
    return super.toString() + (registered ? " reg" : "");
  }
}
