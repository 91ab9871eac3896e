package fsmgen.frontend;

import fsmgen.drc.DRC;
import fsmgen.ui.FsmGenConfig;
import fsmgen.util.Verilog;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds a validated {@link Machine} from the generic map/list structure of a loaded description.
 * <p>
 * Expected document:
 * <pre>
 * name: traffic
 * reset: {asynchronous: true, active_low: false}
 * inputs:
 *   - go: {width: 1}
 * outputs:
 *   - busy: {width: 1, reg: false}
 * encoding: onehot            # or counter
 * transitions:
 *   - IDLE: ["(go==1), RUN"]
 *   - RUN: ["&lt;busy=1'b1&gt;", "(go==0), IDLE"]
 * initial_state: IDLE
 * </pre>
 * Construction is all-or-nothing: either a fully checked machine is returned or an {@link FsmSpecException} is thrown.
 */
public class MachineBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Set<String> KNOWN_KEYS = Set.of("name", "reset", "inputs", "outputs", "encoding", "transitions", "initial_state");

  private final FsmGenConfig cfg;

  public MachineBuilder(FsmGenConfig cfg) { this.cfg = cfg; }

  public MachineBuilder() { this(new FsmGenConfig()); }

  public Machine build(Map<String, Object> document) throws FsmSpecException {
    for (String key : document.keySet())
      if (!KNOWN_KEYS.contains(key))
        logger.warn("Ignoring unknown key '{}'", key);

    String name = requireString(document, "name");
    if (!TransitionLineParser.IDENTIFIER.matcher(name).matches())
      throw new StructuralInputException("Machine name '" + name + "' is not a valid identifier");
    if (Verilog.KEYWORDS.contains(name))
      throw new StructuralInputException("Machine name '" + name + "' is a SystemVerilog keyword");
    ResetConfig reset = readReset(document.get("reset"));
    EncodingScheme scheme = readEncoding(document.get("encoding"));

    Map<String, Port> inputs = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, Object>> entry : singleKeyEntries(document.get("inputs"), "inputs", false)) {
      Map<String, Object> attributes = entry.getValue();
      if (attributes.containsKey("reg"))
        logger.warn("Input {}: 'reg' has no meaning for inputs and is ignored", entry.getKey());
      inputs.put(entry.getKey(), new Port(entry.getKey(), readWidth(entry.getKey(), attributes)));
    }
    Map<String, OutputPort> outputs = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, Object>> entry : singleKeyEntries(document.get("outputs"), "outputs", true)) {
      Map<String, Object> attributes = entry.getValue();
      boolean registered = readBoolean(attributes, "reg", false, "output " + entry.getKey());
      outputs.put(entry.getKey(), new OutputPort(entry.getKey(), readWidth(entry.getKey(), attributes), registered));
    }
    Set<String> reserved = checkPortNames(inputs, outputs, reset);

    TransitionLineParser parser = new TransitionLineParser(outputs);
    Map<String, State> states = new LinkedHashMap<>();
    List<Transition> transitions = new ArrayList<>();
    for (Map.Entry<String, List<String>> entry : stateEntries(document.get("transitions"))) {
      String stateName = entry.getKey();
      if (!TransitionLineParser.IDENTIFIER.matcher(stateName).matches())
        throw new StructuralInputException("State name '" + stateName + "' is not a valid identifier");
      if (Verilog.KEYWORDS.contains(stateName))
        throw new StructuralInputException("State name '" + stateName + "' is a SystemVerilog keyword");
      if (states.containsKey(stateName))
        throw new StructuralInputException("State " + stateName + " is declared more than once");
      if (reserved.contains(stateName))
        throw new StructuralInputException("State name " + stateName + " collides with a port or internal signal name");
      TransitionLineParser.ParsedState parsed = parser.parseState(stateName, entry.getValue());
      // encodings are assigned once all states are known
      states.put(stateName, new State(stateName, BigInteger.ZERO, parsed.mooreOutputs));
      transitions.addAll(parsed.transitions);
    }

    String initialState = requireString(document, "initial_state");
    StateEncoder encoder = new StateEncoder(scheme);
    Map<String, State> encoded = encoder.assign(states);

    Machine machine =
        new Machine(name, reset, inputs, outputs, scheme, encoder.width(Math.max(1, encoded.size())), encoded, transitions, initialState);
    new DRC(machine).CheckAll();
    logger.debug("Built {}", machine);
    return machine;
  }

  private ResetConfig readReset(Object value) throws StructuralInputException {
    if (value == null)
      return ResetConfig.defaults();
    Map<String, Object> reset = asMap(value, "reset");
    for (Object key : reset.keySet())
      if (!key.equals("asynchronous") && !key.equals("active_low"))
        logger.warn("Ignoring unknown reset setting '{}'", key);
    return new ResetConfig(readBoolean(reset, "asynchronous", true, "reset"), readBoolean(reset, "active_low", false, "reset"));
  }

  private EncodingScheme readEncoding(Object value) throws StructuralInputException {
    if (value == null)
      return EncodingScheme.ONE_HOT;
    if (!(value instanceof String))
      throw new StructuralInputException("'encoding' must be a string, got " + value);
    return EncodingScheme.fromSerialName((String)value)
        .orElseThrow(() -> new StructuralInputException("Unknown encoding '" + value + "', expected 'onehot' or 'counter'"));
  }

  private Set<String> checkPortNames(Map<String, Port> inputs, Map<String, OutputPort> outputs, ResetConfig reset)
      throws StructuralInputException {
    Set<String> taken = new HashSet<>();
    taken.add(cfg.clock);
    taken.add(reset.portName(cfg.reset));
    taken.add(cfg.stateRegister);
    taken.add(cfg.stateRegister + cfg.nextSuffix);
    for (OutputPort output : outputs.values())
      if (output.isRegistered())
        taken.add(output.getName() + cfg.nextSuffix);
    List<Port> all = new ArrayList<>(inputs.values());
    all.addAll(outputs.values());
    Set<String> seen = new HashSet<>();
    for (Port port : all) {
      if (!TransitionLineParser.IDENTIFIER.matcher(port.getName()).matches())
        throw new StructuralInputException("Port name '" + port.getName() + "' is not a valid identifier");
      if (Verilog.KEYWORDS.contains(port.getName()))
        throw new StructuralInputException("Port name '" + port.getName() + "' is a SystemVerilog keyword");
      if (!seen.add(port.getName()))
        throw new StructuralInputException("Port " + port.getName() + " is declared more than once");
      if (taken.contains(port.getName()))
        throw new StructuralInputException("Port " + port.getName() + " collides with a generated signal name");
    }
    taken.addAll(seen);
    return taken;
  }

  private static int readWidth(String port, Map<String, Object> attributes) throws StructuralInputException {
    Object width = attributes.getOrDefault("width", 1);
    if (!(width instanceof Integer) || (Integer)width <= 0)
      throw new StructuralInputException("Port " + port + ": width must be a positive integer, got " + width);
    return (Integer)width;
  }

  private static boolean readBoolean(Map<String, Object> map, String key, boolean fallback, String context)
      throws StructuralInputException {
    Object value = map.get(key);
    if (value == null)
      return fallback;
    if (!(value instanceof Boolean))
      throw new StructuralInputException(context + ": '" + key + "' must be true or false, got " + value);
    return (Boolean)value;
  }

  private static String requireString(Map<String, Object> document, String key) throws StructuralInputException {
    Object value = document.get(key);
    if (value == null)
      throw new StructuralInputException("Missing required key '" + key + "'");
    if (!(value instanceof String) || ((String)value).isBlank())
      throw new StructuralInputException("'" + key + "' must be a non-empty string, got " + value);
    return ((String)value).trim();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object value, String context) throws StructuralInputException {
    if (!(value instanceof Map))
      throw new StructuralInputException("'" + context + "' must be a mapping, got " + value);
    for (Object key : ((Map<?, ?>)value).keySet())
      if (!(key instanceof String))
        throw new StructuralInputException("'" + context + "' has a non-string key " + key);
    return (Map<String, Object>)value;
  }

  private static Map.Entry<String, Object> singleEntry(Object item, String context) throws StructuralInputException {
    Map<String, Object> map = asMap(item, context + " entry");
    if (map.size() != 1)
      throw new StructuralInputException("Each '" + context + "' entry must have exactly one key, got " + map.keySet());
    return map.entrySet().iterator().next();
  }

  private static List<?> asList(Object value, String context, boolean required) throws StructuralInputException {
    if (value == null) {
      if (required)
        throw new StructuralInputException("Missing required key '" + context + "'");
      return List.of();
    }
    if (!(value instanceof List))
      throw new StructuralInputException("'" + context + "' must be a sequence, got " + value);
    return (List<?>)value;
  }

  /** Port declarations: a sequence of {@code - name: {width: N, reg: B}}; the attribute map may be omitted. */
  private static List<Map.Entry<String, Map<String, Object>>> singleKeyEntries(Object value, String context, boolean required)
      throws StructuralInputException {
    List<Map.Entry<String, Map<String, Object>>> entries = new ArrayList<>();
    for (Object item : asList(value, context, required)) {
      Map.Entry<String, Object> entry = singleEntry(item, context);
      Map<String, Object> attributes = entry.getValue() == null ? Map.of() : asMap(entry.getValue(), context + "." + entry.getKey());
      entries.add(Map.entry(entry.getKey(), attributes));
    }
    return entries;
  }

  /** State declarations: a sequence of {@code - STATE: [clause, ...]}; the clause list may be empty or omitted. */
  private static List<Map.Entry<String, List<String>>> stateEntries(Object value) throws StructuralInputException {
    List<Map.Entry<String, List<String>>> entries = new ArrayList<>();
    for (Object item : asList(value, "transitions", true)) {
      Map.Entry<String, Object> entry = singleEntry(item, "transitions");
      List<String> clauses = new ArrayList<>();
      for (Object clause : asList(entry.getValue(), "transitions." + entry.getKey(), false)) {
        if (!(clause instanceof String))
          throw new StructuralInputException("State " + entry.getKey() + ": clause " + clause + " is not a string");
        clauses.add((String)clause);
      }
      entries.add(Map.entry(entry.getKey(), clauses));
    }
    return entries;
  }
}
