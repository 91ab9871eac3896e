package fsmgen.backend;

import fsmgen.frontend.Machine;
import fsmgen.frontend.OutputPort;
import fsmgen.frontend.Port;
import fsmgen.frontend.ResetConfig;
import fsmgen.ui.FsmGenConfig;
import fsmgen.util.Verilog;

/**
 * C++ harness for a Verilator build of the generated module ({@code verilator --cc --exe --build <name>.sv <harness>.cpp}).
 * Inputs are driven from a seeded {@code std::mt19937_64}; outputs are printed after every rising edge.
 */
public class VerilatorTestbenchEmitter implements Emitter {
  private final FsmGenConfig cfg;

  public VerilatorTestbenchEmitter(FsmGenConfig cfg) { this.cfg = cfg; }

  @Override
  public EmitterKind kind() {
    return EmitterKind.TESTBENCH_VERILATOR;
  }

  @Override
  public String render(Machine machine) {
    ResetConfig reset = machine.getReset();
    String resetPort = reset.portName(cfg.reset);
    String model = "V" + machine.getName();
    String tab = cfg.tab;

    String text = "// Verilator harness for " + machine.getName() + ", generated by fsmgen.\n";
    text += "#include <cstdint>\n#include <cstdio>\n#include <memory>\n#include <random>\n\n";
    text += "#include \"" + model + ".h\"\n#include \"verilated.h\"\n\n";

    String tick = "top->" + cfg.clock + " = 1;\ntop->eval();\ncontextp->timeInc(1);\n";
    String tock = "top->" + cfg.clock + " = 0;\ntop->eval();\ncontextp->timeInc(1);\n";

    String main = "const std::unique_ptr<VerilatedContext> contextp{new VerilatedContext};\n";
    main += "contextp->commandArgs(argc, argv);\n";
    main += "const std::unique_ptr<" + model + "> top{new " + model + "{contextp.get()}};\n";
    main += "std::mt19937_64 rng(" + cfg.testbenchSeed + "ULL);\n\n";
    main += "top->" + cfg.clock + " = 0;\n";
    main += "top->" + resetPort + " = " + (reset.isActiveLow() ? 0 : 1) + ";\n";
    for (Port input : machine.getInputs().values())
      main += assignZero(input);
    main += "for (int i = 0; i < " + cfg.testbenchResetCycles + "; ++i) {\n" + Verilog.AlignText(tab, tick + tock) + "}\n";
    main += "top->" + resetPort + " = " + (reset.isActiveLow() ? 1 : 0) + ";\n\n";

    String cycle = "";
    for (Port input : machine.getInputs().values())
      cycle += assignRandom(input);
    cycle += tick;
    cycle += printOutputs(machine);
    cycle += tock;
    main += "for (int cycle = 0; cycle < " + cfg.testbenchCycles + " && !contextp->gotFinish(); ++cycle) {\n" +
            Verilog.AlignText(tab, cycle) + "}\n";
    main += "top->final();\nreturn 0;\n";

    text += "int main(int argc, char** argv) {\n" + Verilog.AlignText(tab, main) + "}\n";
    return text;
  }

  private String assignZero(Port port) {
    if (port.getWidth() <= 64)
      return "top->" + port.getName() + " = 0;\n";
    return "for (int w = 0; w < " + words(port) + "; ++w)\n" + cfg.tab + "top->" + port.getName() + "[w] = 0;\n";
  }

  /** Ports up to 64 bits are plain integers in the Verilated model; wider ones are arrays of 32 bit words. */
  private String assignRandom(Port port) {
    int width = port.getWidth();
    if (width < 64)
      return "top->" + port.getName() + " = rng() & 0x" + Long.toHexString((1L << width) - 1) + "ULL;\n";
    if (width == 64)
      return "top->" + port.getName() + " = rng();\n";
    String text =
        "for (int w = 0; w < " + words(port) + "; ++w)\n" + cfg.tab + "top->" + port.getName() + "[w] = static_cast<uint32_t>(rng());\n";
    int rest = width % 32;
    if (rest != 0)
      text += "top->" + port.getName() + "[" + (words(port) - 1) + "] &= 0x" + Long.toHexString((1L << rest) - 1) + "U;\n";
    return text;
  }

  private static String printOutputs(Machine machine) {
    String format = "\"%d";
    String args = "cycle";
    for (OutputPort output : machine.getOutputs().values()) {
      if (output.getWidth() <= 64) {
        format += " " + output.getName() + "=%llx";
        args += ", static_cast<unsigned long long>(top->" + output.getName() + ")";
      } else {
        format += " " + output.getName() + "=";
        for (int w = words(output) - 1; w >= 0; w--) {
          format += "%08x";
          args += ", top->" + output.getName() + "[" + w + "]";
        }
      }
    }
    return "std::printf(" + format + "\\n\", " + args + ");\n";
  }

  private static int words(Port port) { return (port.getWidth() + 31) / 32; }
}
