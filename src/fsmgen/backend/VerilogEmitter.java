package fsmgen.backend;

import fsmgen.frontend.FsmSpecException;
import fsmgen.frontend.Machine;
import fsmgen.frontend.OutputAssignment;
import fsmgen.frontend.OutputPort;
import fsmgen.frontend.Port;
import fsmgen.frontend.ReferenceException;
import fsmgen.frontend.ResetConfig;
import fsmgen.frontend.State;
import fsmgen.frontend.Transition;
import fsmgen.ui.FsmGenConfig;
import fsmgen.util.Verilog;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers a machine into a synthesizable SystemVerilog module.
 * <p>
 * The module has a state register with its next value {@code state_d}, and for every registered output a flip-flop fed by
 * {@code <out>_d}. One always_comb block computes the next values per state:
 * <ol>
 * <li>defaults: state holds, registered outputs hold, combinational outputs are zero</li>
 * <li>the state's Moore assignments</li>
 * <li>the state's transitions as an if / else if / else cascade in {@link Transition} order, each branch setting the next state and
 * its Mealy assignments (which override Moore assignments to the same target)</li>
 * </ol>
 * A default case item sends undefined state values back to the initial state.
 */
public class VerilogEmitter implements Emitter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final FsmGenConfig cfg;
  private final Verilog language;

  public VerilogEmitter(FsmGenConfig cfg) {
    this.cfg = cfg;
    this.language = new Verilog(cfg.tab);
  }

  @Override
  public EmitterKind kind() {
    return EmitterKind.RTL;
  }

  @Override
  public String render(Machine machine) throws FsmSpecException {
    checkReferences(machine);
    String tab = cfg.tab;
    StringBuilder text = new StringBuilder();
    text.append("// Generated by fsmgen from the description of " + machine.getName() + ".\n");
    text.append("module " + machine.getName() + " (\n");
    text.append(Verilog.AlignText(tab, String.join(",\n", CreatePortList(machine)) + "\n"));
    text.append(");\n\n");
    text.append(Verilog.AlignText(tab, CreateDeclarations(machine)));
    text.append("\n");
    text.append(Verilog.AlignText(tab, CreateStateRegister(machine)));
    text.append("\n");
    text.append(Verilog.AlignText(tab, CreateNextStateLogic(machine)));
    if (cfg.formal) {
      text.append("\n");
      text.append(CreateFormalBlock(machine));
    }
    text.append("\nendmodule\n");
    logger.debug("Lowered {} with {} states and {} transitions", machine.getName(), machine.getStates().size(),
                 machine.getTransitions().size());
    return text.toString();
  }

  /** Name of the reset port, depending on polarity. */
  public String resetPort(Machine machine) { return machine.getReset().portName(cfg.reset); }

  List<String> CreatePortList(Machine machine) {
    List<String> ports = new ArrayList<>();
    ports.add(language.CreateTextInterface(true, 1, cfg.clock));
    ports.add(language.CreateTextInterface(true, 1, resetPort(machine)));
    for (Port input : machine.getInputs().values())
      ports.add(language.CreateTextInterface(true, input.getWidth(), input.getName()));
    for (OutputPort output : machine.getOutputs().values())
      ports.add(language.CreateTextInterface(false, output.getWidth(), output.getName()));
    return ports;
  }

  String CreateDeclarations(Machine machine) {
    int width = machine.getEncodingWidth();
    String text = "";
    for (State state : machine.getStates().values())
      text += "localparam logic " + Verilog.CreateRange(width) + state.getName() + " = " + Verilog.CreateLiteral(width, state.getEncoding()) +
              ";\n";
    text += "\n";
    text += language.CreateDeclSig(width, cfg.stateRegister, nextState());
    for (OutputPort output : machine.getOutputs().values())
      if (output.isRegistered())
        text += language.CreateDeclSig(output.getWidth(), output.getName() + cfg.nextSuffix);
    return text;
  }

  String CreateStateRegister(Machine machine) {
    ResetConfig reset = machine.getReset();
    String resetPort = resetPort(machine);
    String sensitivity = "posedge " + cfg.clock;
    if (reset.isAsynchronous())
      sensitivity += " or " + (reset.isActiveLow() ? "negedge " : "posedge ") + resetPort;

    String onReset = language.CreateNonBlocking(cfg.stateRegister, machine.getInitialStateName());
    String onClock = language.CreateNonBlocking(cfg.stateRegister, nextState());
    for (OutputPort output : machine.getOutputs().values()) {
      if (!output.isRegistered())
        continue;
      onReset += language.CreateNonBlocking(output.getName(), zero(output));
      onClock += language.CreateNonBlocking(output.getName(), output.getName() + cfg.nextSuffix);
    }
    String body = language.CreateBlock("if (" + reset.activeExpression(cfg.reset) + ")", onReset);
    body = body.substring(0, body.length() - 1) + " " + language.CreateBlock("else", onClock);
    return language.CreateInAlways(sensitivity, body);
  }

  String CreateNextStateLogic(Machine machine) throws ReferenceException {
    String text = language.CreateBlocking(nextState(), cfg.stateRegister);
    for (OutputPort output : machine.getOutputs().values()) {
      if (output.isRegistered())
        text += language.CreateBlocking(output.getName() + cfg.nextSuffix, output.getName());
      else
        text += language.CreateBlocking(output.getName(), zero(output));
    }

    String items = "";
    for (State state : machine.getStates().values())
      items += language.CreateBlock(state.getName() + ":", CreateStateBody(machine, state));
    items += language.CreateBlock("default:", language.CreateBlocking(nextState(), machine.getInitialStateName()));
    text += "case (" + cfg.stateRegister + ")\n" + Verilog.AlignText(cfg.tab, items) + "endcase\n";
    return language.CreateInAlways(null, text);
  }

  /** Moore assignments followed by the priority cascade of the state's transitions. */
  String CreateStateBody(Machine machine, State state) throws ReferenceException {
    String text = CreateAssignments(machine, state.getName(), state.getMooreOutputs());
    List<Transition> outgoing = machine.transitionsFrom(state.getName());
    List<Transition> conditioned = outgoing.stream().filter(transition -> !transition.isDefault()).collect(Collectors.toList());
    Optional<Transition> defaultArc = outgoing.stream().filter(Transition::isDefault).findFirst();

    if (conditioned.isEmpty()) {
      if (defaultArc.isPresent())
        text += CreateBranchBody(machine, defaultArc.get());
      return text;
    }
    String cascade = "";
    for (int i = 0; i < conditioned.size(); i++) {
      Transition transition = conditioned.get(i);
      String head = "if (" + transition.getCondition().get() + ")";
      if (i > 0)
        head = "else " + head;
      cascade = appendBranch(cascade, language.CreateBlock(head, CreateBranchBody(machine, transition)));
    }
    if (defaultArc.isPresent())
      cascade = appendBranch(cascade, language.CreateBlock("else", CreateBranchBody(machine, defaultArc.get())));
    return text + cascade;
  }

  /** Joins branches as {@code end else ...} so the cascade reads as one statement. */
  private static String appendBranch(String cascade, String branch) {
    if (cascade.isEmpty())
      return branch;
    return cascade.substring(0, cascade.length() - 1) + " " + branch;
  }

  private String CreateBranchBody(Machine machine, Transition transition) throws ReferenceException {
    return language.CreateBlocking(nextState(), transition.getDestination()) +
        CreateAssignments(machine, transition.getSource(), transition.getMealyOutputs());
  }

  private String CreateAssignments(Machine machine, String state, Map<String, String> assignments) throws ReferenceException {
    String text = "";
    for (Map.Entry<String, String> entry : assignments.entrySet()) {
      OutputAssignment assignment = resolve(machine, state, entry.getKey(), entry.getValue());
      OutputPort port = machine.getOutputs().get(assignment.getBaseName());
      String signal = port.isRegistered() ? port.getName() + cfg.nextSuffix : port.getName();
      text += language.CreateBlocking(assignment.targetWithName(signal), assignment.getExpression());
    }
    return text;
  }

  String CreateFormalBlock(Machine machine) {
    return "`ifdef " + cfg.formalMacro + "\n" + cfg.tab + "default clocking @(posedge " + cfg.clock + "); endclocking\n" + cfg.tab +
        "default disable iff (" + machine.getReset().activeExpression(cfg.reset) + ");\n"
        + "`endif\n";
  }

  /** Verifies every destination and output target before any text is produced. */
  private void checkReferences(Machine machine) throws ReferenceException {
    if (machine.getInitialState() == null)
      throw new ReferenceException("Initial state " + machine.getInitialStateName() + " is not a declared state");
    for (State state : machine.getStates().values())
      for (Map.Entry<String, String> entry : state.getMooreOutputs().entrySet())
        resolve(machine, state.getName(), entry.getKey(), entry.getValue());
    for (Transition transition : machine.getTransitions()) {
      if (!machine.getStates().containsKey(transition.getSource()))
        throw new ReferenceException("Transition " + transition + " leaves undeclared state " + transition.getSource());
      if (!machine.getStates().containsKey(transition.getDestination()))
        throw new ReferenceException("Transition " + transition + " of state " + transition.getSource() + " leads to undeclared state " +
                                     transition.getDestination());
      for (Map.Entry<String, String> entry : transition.getMealyOutputs().entrySet())
        resolve(machine, transition.getSource(), entry.getKey(), entry.getValue());
    }
  }

  private static OutputAssignment resolve(Machine machine, String state, String target, String expression) throws ReferenceException {
    OutputAssignment assignment;
    try {
      assignment = OutputAssignment.of(target, expression);
    } catch (IllegalArgumentException e) {
      throw new ReferenceException("State " + state + ": '" + target + "' does not name an output");
    }
    if (!machine.getOutputs().containsKey(assignment.getBaseName()))
      throw new ReferenceException("State " + state + ": output '" + assignment.getBaseName() + "' in '" + target + "=" + expression +
                                   "' is not declared");
    return assignment;
  }

  private String nextState() { return cfg.stateRegister + cfg.nextSuffix; }

  private static String zero(Port port) { return port.getWidth() + "'b0"; }
}
