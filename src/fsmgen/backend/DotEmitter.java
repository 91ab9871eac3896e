package fsmgen.backend;

import fsmgen.frontend.Machine;
import fsmgen.frontend.State;
import fsmgen.frontend.Transition;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a machine as a Graphviz digraph: one node per state labelled with its Moore outputs, one edge per transition labelled with
 * its condition and Mealy outputs. The initial state is drawn as a double circle with an entry arrow.
 */
public class DotEmitter implements Emitter {
  static final String START_NODE = "__start";

  @Override
  public EmitterKind kind() {
    return EmitterKind.GRAPH;
  }

  @Override
  public String render(Machine machine) {
    StringBuilder builder = new StringBuilder();
    builder.append("digraph " + quote(machine.getName()) + " {\n");
    builder.append("  rankdir = LR;\n");
    builder.append("  " + quote(START_NODE) + " [shape = point];\n");

    for (State state : machine.getStates().values()) {
      String shape = state.getName().equals(machine.getInitialStateName()) ? "doublecircle" : "circle";
      String label = escape(state.getName());
      if (!state.getMooreOutputs().isEmpty())
        label += "\\n" + assignmentLabel(state.getMooreOutputs(), "\\n");
      builder.append("  " + quote(state.getName()) + " [shape = " + shape + ", label = \"" + label + "\"];\n");
    }

    builder.append("  " + quote(START_NODE) + " -> " + quote(machine.getInitialStateName()) + ";\n");
    for (Transition transition : machine.getTransitions()) {
      String label = edgeLabel(machine, transition);
      builder.append("  " + quote(transition.getSource()) + " -> " + quote(transition.getDestination()));
      if (!label.isEmpty())
        builder.append(" [label = \"" + label + "\"]");
      builder.append(";\n");
    }
    builder.append("}\n");
    return builder.toString();
  }

  /** Condition (or {@code else} for a default arc next to conditioned ones), then {@code / } and the Mealy outputs. */
  private static String edgeLabel(Machine machine, Transition transition) {
    String label;
    if (transition.getCondition().isPresent())
      label = escape(transition.getCondition().get());
    else
      label = machine.transitionsFrom(transition.getSource()).size() > 1 ? "else" : "";
    if (!transition.getMealyOutputs().isEmpty())
      label += (label.isEmpty() ? "/ " : " / ") + assignmentLabel(transition.getMealyOutputs(), "; ");
    return label;
  }

  private static String assignmentLabel(Map<String, String> assignments, String separator) {
    return assignments.entrySet().stream().map(entry -> escape(entry.getKey() + "=" + entry.getValue())).collect(Collectors.joining(separator));
  }

  private static String quote(String id) { return "\"" + escape(id) + "\""; }

  static String escape(String text) { return text.replace("\\", "\\\\").replace("\"", "\\\""); }
}
