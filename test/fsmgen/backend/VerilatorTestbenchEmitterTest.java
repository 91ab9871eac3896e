package fsmgen.backend;

import fsmgen.frontend.FsmSpecException;
import fsmgen.frontend.MachineFixtures;
import fsmgen.ui.FsmGenConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class VerilatorTestbenchEmitterTest {

  VerilatorTestbenchEmitter emitter = new VerilatorTestbenchEmitter(new FsmGenConfig());

  @Test
  void testTrafficScenario() throws FsmSpecException {
    String cpp = emitter.render(MachineFixtures.build("traffic.yaml"));
    Assertions.assertTrue(cpp.contains("#include \"Vtraffic.h\"\n#include \"verilated.h\"\n"));
    Assertions.assertTrue(cpp.contains("    const std::unique_ptr<Vtraffic> top{new Vtraffic{contextp.get()}};\n"));
    Assertions.assertTrue(cpp.contains("    std::mt19937_64 rng(1ULL);\n"));
    Assertions.assertTrue(cpp.contains("    top->rst = 1;\n    top->go = 0;\n    for (int i = 0; i < 4; ++i) {\n"), cpp);
    Assertions.assertTrue(cpp.contains("    top->rst = 0;\n"));
    Assertions.assertTrue(cpp.contains("    for (int cycle = 0; cycle < 1000 && !contextp->gotFinish(); ++cycle) {\n" + //
                                       "        top->go = rng() & 0x1ULL;\n" + //
                                       "        top->clk = 1;\n"),
                          cpp);
    Assertions.assertTrue(cpp.contains("        std::printf(\"%d busy=%llx\\n\", cycle, static_cast<unsigned long long>(top->busy));\n"), cpp);
    Assertions.assertTrue(cpp.endsWith("    top->final();\n    return 0;\n}\n"));
  }

  @Test
  void testActiveLowResetAndMaskedInputs() throws FsmSpecException {
    String cpp = emitter.render(MachineFixtures.build("uart_rx.yaml"));
    Assertions.assertTrue(cpp.contains("top->rst_n = 0;\n"));
    Assertions.assertTrue(cpp.contains("top->rst_n = 1;\n"));
    Assertions.assertTrue(cpp.contains("top->bit_cnt = rng() & 0x7ULL;\n"));
    Assertions.assertTrue(cpp.contains(" frame=%llx"));
  }

  static final String WIDE = "name: wide\n" + //
                             "inputs:\n  - big: {width: 70}\n  - word: {width: 64}\n" + //
                             "outputs:\n  - out: {width: 96}\n" + //
                             "transitions:\n  - A: [B]\n  - B: [A]\n" + //
                             "initial_state: A\n";

  @Test
  void testWidePorts() throws FsmSpecException {
    String cpp = emitter.render(MachineFixtures.buildYaml(WIDE));
    Assertions.assertTrue(cpp.contains("for (int w = 0; w < 3; ++w)\n"));
    Assertions.assertTrue(cpp.contains("top->big[w] = static_cast<uint32_t>(rng());\n"));
    Assertions.assertTrue(cpp.contains("top->big[2] &= 0x3fU;\n"));
    Assertions.assertTrue(cpp.contains("top->word = rng();\n"));
    Assertions.assertTrue(cpp.contains(" out=%08x%08x%08x\\n\", cycle, top->out[2], top->out[1], top->out[0]);\n"), cpp);
  }

  @Test
  void testWordLoopsUseConfiguredIndent() throws FsmSpecException {
    FsmGenConfig cfg = new FsmGenConfig();
    cfg.tab = "  ";
    String cpp = new VerilatorTestbenchEmitter(cfg).render(MachineFixtures.buildYaml(WIDE));
    Assertions.assertTrue(cpp.contains("\n  for (int w = 0; w < 3; ++w)\n    top->big[w] = 0;\n"), cpp);
    Assertions.assertTrue(cpp.contains("\n    for (int w = 0; w < 3; ++w)\n      top->big[w] = static_cast<uint32_t>(rng());\n"), cpp);
  }
}
