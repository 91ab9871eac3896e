package fsmgen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validated, immutable model of one state machine. Built by {@link MachineBuilder}; emitters only read it.
 * <p>
 * Inputs, outputs and states keep their declaration order, which is the order code is emitted in.
 * Transitions are sorted once (see {@link Transition#compareTo(Transition)}).
 */
public class Machine {
  private final String name;
  private final ResetConfig reset;
  private final Map<String, Port> inputs;
  private final Map<String, OutputPort> outputs;
  private final EncodingScheme encodingScheme;
  private final int encodingWidth;
  private final Map<String, State> states;
  private final List<Transition> transitions;
  private final String initialState;

  public Machine(String name, ResetConfig reset, Map<String, Port> inputs, Map<String, OutputPort> outputs, EncodingScheme encodingScheme,
                 int encodingWidth, Map<String, State> states, List<Transition> transitions, String initialState) {
    this.name = name;
    this.reset = reset;
    this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    this.encodingScheme = encodingScheme;
    this.encodingWidth = encodingWidth;
    this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    List<Transition> sorted = new ArrayList<>(transitions);
    Collections.sort(sorted);
    this.transitions = Collections.unmodifiableList(sorted);
    this.initialState = initialState;
  }

  public String getName() { return name; }

  public ResetConfig getReset() { return reset; }

  public Map<String, Port> getInputs() { return inputs; }

  public Map<String, OutputPort> getOutputs() { return outputs; }

  public EncodingScheme getEncodingScheme() { return encodingScheme; }

  /** Bit width of the state register. */
  public int getEncodingWidth() { return encodingWidth; }

  public Map<String, State> getStates() { return states; }

  public List<Transition> getTransitions() { return transitions; }

  public String getInitialStateName() { return initialState; }

  /** The initial state, or null if the name does not refer to a declared state (only possible before validation). */
  public State getInitialState() { return states.get(initialState); }

  /** Outgoing transitions of a state, in priority order. */
  public List<Transition> transitionsFrom(String state) {
    return transitions.stream().filter(transition -> transition.getSource().equals(state)).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return "Machine " + name + " (" + encodingScheme.getSerialName() + ", " + reset + ") states = " + states.values() +
        " transitions = " + transitions;
  }
}
