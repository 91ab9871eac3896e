package fsmgen.frontend;

/** Reset style of the generated state register. */
public class ResetConfig {
  private final boolean asynchronous;
  private final boolean activeLow;

  public ResetConfig(boolean asynchronous, boolean activeLow) {
    this.asynchronous = asynchronous;
    this.activeLow = activeLow;
  }

  /** Asynchronous, active-high. */
  public static ResetConfig defaults() { return new ResetConfig(true, false); }

  public boolean isAsynchronous() { return asynchronous; }

  public boolean isActiveLow() { return activeLow; }

  /** Port name for the given base name, e.g. {@code rst} or {@code rst_n}. */
  public String portName(String base) { return activeLow ? base + "_n" : base; }

  /** Expression that is true while reset is asserted. */
  public String activeExpression(String base) { return activeLow ? "!" + portName(base) : portName(base); }

  @Override
  public String toString() {
    return (asynchronous ? "async" : "sync") + (activeLow ? " active-low" : " active-high");
  }
}
