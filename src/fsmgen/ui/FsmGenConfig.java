package fsmgen.ui;

/**
 * Data-Class to hold tool options. Can be loaded from a YAML file whose keys are the field names.
 */
public class FsmGenConfig {

  public String tab = "    ";

  public String clock = "clk";
  /** Reset port base name; {@code _n} is appended for active-low resets. */
  public String reset = "rst";
  public String stateRegister = "state";
  /** Suffix of the next-value signals of the state register and registered outputs. */
  public String nextSuffix = "_d";

  public boolean formal = true;
  public String formalMacro = "FORMAL";

  public int testbenchCycles = 1000;
  public int testbenchResetCycles = 4;
  public int clockPeriod = 10;
  public long testbenchSeed = 1;
}
