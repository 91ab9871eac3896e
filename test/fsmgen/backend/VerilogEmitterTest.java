package fsmgen.backend;

import fsmgen.frontend.EncodingScheme;
import fsmgen.frontend.FsmSpecException;
import fsmgen.frontend.Machine;
import fsmgen.frontend.MachineFixtures;
import fsmgen.frontend.OutputPort;
import fsmgen.frontend.Port;
import fsmgen.frontend.ReferenceException;
import fsmgen.frontend.ResetConfig;
import fsmgen.frontend.State;
import fsmgen.frontend.Transition;
import fsmgen.ui.FsmGenConfig;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VerilogEmitterTest {

  static final String TRAFFIC_RTL = String.join("\n", //
                                                "// Generated by fsmgen from the description of traffic.", //
                                                "module traffic (", //
                                                "    input  logic clk,", //
                                                "    input  logic rst,", //
                                                "    input  logic go,", //
                                                "    output logic busy", //
                                                ");", //
                                                "", //
                                                "    localparam logic [1:0] IDLE = 2'd1;", //
                                                "    localparam logic [1:0] RUN = 2'd2;", //
                                                "", //
                                                "    logic [1:0] state, state_d;", //
                                                "", //
                                                "    always_ff @(posedge clk or posedge rst) begin", //
                                                "        if (rst) begin", //
                                                "            state <= IDLE;", //
                                                "        end else begin", //
                                                "            state <= state_d;", //
                                                "        end", //
                                                "    end", //
                                                "", //
                                                "    always_comb begin", //
                                                "        state_d = state;", //
                                                "        busy = 1'b0;", //
                                                "        case (state)", //
                                                "            IDLE: begin", //
                                                "                if (go==1) begin", //
                                                "                    state_d = RUN;", //
                                                "                end", //
                                                "            end", //
                                                "            RUN: begin", //
                                                "                busy = 1'b1;", //
                                                "                if (go==0) begin", //
                                                "                    state_d = IDLE;", //
                                                "                end", //
                                                "            end", //
                                                "            default: begin", //
                                                "                state_d = IDLE;", //
                                                "            end", //
                                                "        endcase", //
                                                "    end", //
                                                "", //
                                                "`ifdef FORMAL", //
                                                "    default clocking @(posedge clk); endclocking", //
                                                "    default disable iff (rst);", //
                                                "`endif", //
                                                "", //
                                                "endmodule", //
                                                "");

  VerilogEmitter emitter = new VerilogEmitter(new FsmGenConfig());

  @Test
  void testTrafficScenario() throws FsmSpecException {
    Assertions.assertEquals(TRAFFIC_RTL, emitter.render(MachineFixtures.build("traffic.yaml")));
  }

  @Test
  void testRenderingIsDeterministic() throws FsmSpecException {
    Machine machine = MachineFixtures.build("uart_rx.yaml");
    String first = emitter.render(machine);
    Assertions.assertEquals(first, emitter.render(machine));
    Assertions.assertEquals(first, new VerilogEmitter(new FsmGenConfig()).render(MachineFixtures.build("uart_rx.yaml")));
  }

  @Test
  void testSyncActiveLowResetAndRegisteredOutputs() throws FsmSpecException {
    String rtl = emitter.render(MachineFixtures.build("uart_rx.yaml"));
    Assertions.assertTrue(rtl.contains("    input  logic rst_n,\n"));
    Assertions.assertTrue(rtl.contains("    input  logic [2:0] bit_cnt,\n"));
    Assertions.assertTrue(rtl.contains("    output logic [7:0] frame\n);"));
    Assertions.assertTrue(rtl.contains("localparam logic [2:0] IDLE = 3'd0;"));
    Assertions.assertTrue(rtl.contains("localparam logic [2:0] HALT = 3'd4;"));
    Assertions.assertTrue(rtl.contains("logic valid_d;\n"));
    Assertions.assertTrue(rtl.contains("logic [7:0] frame_d;\n"));
    Assertions.assertFalse(rtl.contains("shift_d"));

    Assertions.assertTrue(rtl.contains("always_ff @(posedge clk) begin\n"));
    Assertions.assertTrue(rtl.contains("if (!rst_n) begin\n" + //
                                       "            state <= IDLE;\n" + //
                                       "            valid <= 1'b0;\n" + //
                                       "            frame <= 8'b0;\n" + //
                                       "        end else begin\n" + //
                                       "            state <= state_d;\n" + //
                                       "            valid <= valid_d;\n" + //
                                       "            frame <= frame_d;\n" + //
                                       "        end\n"));
    Assertions.assertTrue(rtl.contains("        state_d = state;\n" + //
                                       "        shift = 1'b0;\n" + //
                                       "        valid_d = valid;\n" + //
                                       "        frame_d = frame;\n"));
    Assertions.assertTrue(rtl.contains("default disable iff (!rst_n);"));
  }

  @Test
  void testPriorityCascadeWithMealyOverride() throws FsmSpecException {
    String rtl = emitter.render(MachineFixtures.build("uart_rx.yaml"));
    Assertions.assertTrue(rtl.contains("            DATA: begin\n" + //
                                       "                shift = tick;\n" + //
                                       "                if (tick && bit_cnt != 3'd7) begin\n" + //
                                       "                    state_d = DATA;\n" + //
                                       "                    frame_d[7] = rx;\n" + //
                                       "                    frame_d[6:0] = frame[7:1];\n" + //
                                       "                end else if (tick && bit_cnt == 3'd7) begin\n" + //
                                       "                    state_d = STOP;\n" + //
                                       "                    frame_d[7] = rx;\n" + //
                                       "                    shift = 1'b0;\n" + //
                                       "                end\n" + //
                                       "            end\n"),
                          rtl);
    Assertions.assertTrue(rtl.contains("            STOP: begin\n" + //
                                       "                if (tick && rx) begin\n" + //
                                       "                    state_d = IDLE;\n" + //
                                       "                    valid_d = 1'b1;\n" + //
                                       "                end else begin\n" + //
                                       "                    state_d = IDLE;\n" + //
                                       "                end\n" + //
                                       "            end\n"),
                          rtl);
    Assertions.assertTrue(rtl.contains("            HALT: begin\n            end\n"), rtl);
  }

  @Test
  void testLoneDefaultArcIsUnconditional() throws FsmSpecException {
    String yaml = MachineFixtures.twoStates("  - o: {width: 4}\n", "<o=4'd3>", "B");
    String rtl = emitter.render(MachineFixtures.buildYaml(yaml));
    Assertions.assertTrue(rtl.contains("            A: begin\n" + //
                                       "                o = 4'd3;\n" + //
                                       "                state_d = B;\n" + //
                                       "            end\n"),
                          rtl);
    Assertions.assertTrue(rtl.contains("            B: begin\n" + //
                                       "                state_d = A;\n" + //
                                       "            end\n"),
                          rtl);
  }

  @Test
  void testFormalBlockCanBeDisabled() throws FsmSpecException {
    FsmGenConfig cfg = new FsmGenConfig();
    cfg.formal = false;
    String rtl = new VerilogEmitter(cfg).render(MachineFixtures.build("traffic.yaml"));
    Assertions.assertFalse(rtl.contains("`ifdef"));
    Assertions.assertTrue(rtl.endsWith("    end\n\nendmodule\n"));
  }

  @Test
  void testConfiguredNames() throws FsmSpecException {
    FsmGenConfig cfg = new FsmGenConfig();
    cfg.clock = "clk_i";
    cfg.reset = "rst_i";
    cfg.stateRegister = "fsm_q";
    cfg.nextSuffix = "_n";
    cfg.formalMacro = "SYNTHESIS_CHECK";
    cfg.tab = "  ";
    String rtl = new VerilogEmitter(cfg).render(MachineFixtures.build("traffic.yaml"));
    Assertions.assertTrue(rtl.contains("  input  logic clk_i,\n  input  logic rst_i,\n"));
    Assertions.assertTrue(rtl.contains("  logic [1:0] fsm_q, fsm_q_n;\n"));
    Assertions.assertTrue(rtl.contains("always_ff @(posedge clk_i or posedge rst_i) begin\n"));
    Assertions.assertTrue(rtl.contains("`ifdef SYNTHESIS_CHECK\n"));
  }

  /** Machine assembled by hand, bypassing the builder's checks. */
  static Machine unchecked(Map<String, String> moore, Transition transition) {
    Map<String, State> states = new LinkedHashMap<>();
    states.put("A", new State("A", BigInteger.ZERO, moore));
    states.put("B", new State("B", BigInteger.ONE, Map.of()));
    return new Machine("m", ResetConfig.defaults(), Map.of("x", new Port("x", 1)), Map.of("o", new OutputPort("o", 4, false)),
                       EncodingScheme.COUNTER, 1, states, List.of(transition), "A");
  }

  @ParameterizedTest
  @ValueSource(strings = {"p", "p[0]", "p[3:0]"})
  void testUndeclaredMooreTargetIsRejected(String target) {
    Machine machine = unchecked(Map.of(target, "1"), new Transition("A", "B", Optional.empty(), Map.of()));
    ReferenceException e = Assertions.assertThrows(ReferenceException.class, () -> emitter.render(machine));
    Assertions.assertTrue(e.getMessage().contains("'p'"));
    Assertions.assertTrue(e.getMessage().contains("A"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"q", "q[1]"})
  void testUndeclaredMealyTargetIsRejected(String target) {
    Machine machine = unchecked(Map.of(), new Transition("A", "B", Optional.of("x"), Map.of(target, "1")));
    Assertions.assertThrows(ReferenceException.class, () -> emitter.render(machine));
  }

  @Test
  void testUndeclaredDestinationIsRejected() {
    Machine machine = unchecked(Map.of(), new Transition("A", "C", Optional.of("x"), Map.of()));
    ReferenceException e = Assertions.assertThrows(ReferenceException.class, () -> emitter.render(machine));
    Assertions.assertTrue(e.getMessage().contains("C"));
  }
}
