package fsmgen.backend;

import fsmgen.frontend.Machine;
import fsmgen.frontend.OutputPort;
import fsmgen.frontend.Port;
import fsmgen.frontend.ResetConfig;
import fsmgen.ui.FsmGenConfig;
import fsmgen.util.Verilog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SystemVerilog testbench that drives the generated module with random inputs.
 * Reset is held for a few cycles, then every input is re-randomized on each falling clock edge and the outputs are printed on each
 * rising edge.
 */
public class VerilogTestbenchEmitter implements Emitter {
  private final FsmGenConfig cfg;
  private final Verilog language;

  public VerilogTestbenchEmitter(FsmGenConfig cfg) {
    this.cfg = cfg;
    this.language = new Verilog(cfg.tab);
  }

  @Override
  public EmitterKind kind() {
    return EmitterKind.TESTBENCH_SV;
  }

  @Override
  public String render(Machine machine) {
    ResetConfig reset = machine.getReset();
    String resetPort = reset.portName(cfg.reset);
    String tbName = "tb_" + machine.getName();
    String tab = cfg.tab;

    String body = "logic " + cfg.clock + " = 1'b0;\n";
    body += "logic " + resetPort + " = " + (reset.isActiveLow() ? "1'b0" : "1'b1") + ";\n";
    for (Port input : machine.getInputs().values())
      body += language.CreateDeclSig(input.getWidth(), input.getName());
    for (OutputPort output : machine.getOutputs().values())
      body += language.CreateDeclSig(output.getWidth(), output.getName());
    body += "\n";

    List<String> connections = new ArrayList<>();
    connections.add("." + cfg.clock + "(" + cfg.clock + ")");
    connections.add("." + resetPort + "(" + resetPort + ")");
    for (Port input : machine.getInputs().values())
      connections.add("." + input.getName() + "(" + input.getName() + ")");
    for (OutputPort output : machine.getOutputs().values())
      connections.add("." + output.getName() + "(" + output.getName() + ")");
    body += machine.getName() + " dut (\n" + Verilog.AlignText(tab, String.join(",\n", connections) + "\n") + ");\n\n";

    String halfPeriod = (cfg.clockPeriod % 2 == 0) ? Integer.toString(cfg.clockPeriod / 2) : Double.toString(cfg.clockPeriod / 2.0);
    body += "always #" + halfPeriod + " " + cfg.clock + " = ~" + cfg.clock + ";\n\n";

    String display = "$display(\"%0t " + cfg.stateRegister + "=%0d";
    String displayArgs = "$time, dut." + cfg.stateRegister;
    for (OutputPort output : machine.getOutputs().values()) {
      display += " " + output.getName() + "=%0h";
      displayArgs += ", " + output.getName();
    }
    body += language.CreateBlock("always @(posedge " + cfg.clock + ")",
                                 "if (!(" + reset.activeExpression(cfg.reset) + "))\n" + tab + display + "\", " + displayArgs + ");\n");
    body += "\n";

    String stimulus = "$dumpfile(\"" + tbName + ".vcd\");\n";
    stimulus += "$dumpvars(0, " + tbName + ");\n";
    stimulus += "void'($urandom(" + cfg.testbenchSeed + "));\n";
    for (Port input : machine.getInputs().values())
      stimulus += language.CreateBlocking(input.getName(), "'0");
    stimulus += "repeat (" + cfg.testbenchResetCycles + ") @(posedge " + cfg.clock + ");\n";
    stimulus += language.CreateBlocking(resetPort, reset.isActiveLow() ? "1'b1" : "1'b0");
    String step = "@(negedge " + cfg.clock + ");\n";
    for (Port input : machine.getInputs().values())
      step += language.CreateBlocking(input.getName(), randomValue(input.getWidth()));
    stimulus += language.CreateBlock("repeat (" + cfg.testbenchCycles + ")", step);
    stimulus += "$finish;\n";
    body += language.CreateBlock("initial", stimulus);

    return "// Random stimulus testbench for " + machine.getName() + ", generated by fsmgen.\n"
        + "`timescale 1ns / 1ps\n"
        + "module " + tbName + ";\n" + Verilog.AlignText(tab, body) + "endmodule\n";
  }

  /** $urandom yields 32 bits; wider inputs concatenate several calls. */
  static String randomValue(int width) {
    int words = (width + 31) / 32;
    if (words == 1)
      return "$urandom";
    return "{" + String.join(", ", Collections.nCopies(words, "$urandom")) + "}";
  }
}
