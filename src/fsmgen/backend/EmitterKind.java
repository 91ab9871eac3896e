package fsmgen.backend;

import fsmgen.ui.FsmGenConfig;
import java.util.Optional;

/** The fixed set of artifacts that can be generated from a machine. */
public enum EmitterKind {
  RTL("rtl"),
  GRAPH("graph"),
  TESTBENCH_SV("sv"),
  TESTBENCH_VERILATOR("verilator");

  private final String serialName;

  EmitterKind(String serialName) { this.serialName = serialName; }

  public String getSerialName() { return serialName; }

  public boolean isTestbench() { return this == TESTBENCH_SV || this == TESTBENCH_VERILATOR; }

  public Emitter create(FsmGenConfig cfg) {
    switch (this) {
    case RTL:
      return new VerilogEmitter(cfg);
    case GRAPH:
      return new DotEmitter();
    case TESTBENCH_SV:
      return new VerilogTestbenchEmitter(cfg);
    case TESTBENCH_VERILATOR:
      return new VerilatorTestbenchEmitter(cfg);
    default:
      throw new IllegalStateException("unhandled emitter kind " + this);
    }
  }

  /** Looks up a testbench kind by its command line name ({@code sv} or {@code verilator}). */
  public static Optional<EmitterKind> fromTestbenchName(String name) {
    for (EmitterKind kind : values())
      if (kind.isTestbench() && kind.serialName.equals(name))
        return Optional.of(kind);
    return Optional.empty();
  }
}
