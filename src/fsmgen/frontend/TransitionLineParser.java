package fsmgen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decodes the clause strings of one state into conditional arcs, a default arc and Moore output declarations.
 * <p>
 * Accepted clause shapes:
 * <ul>
 * <li>{@code (condition), DEST} or {@code (condition), DEST, <out=expr;...>}; a compound guard such as {@code (a) || (b)} is kept
 * whole</li>
 * <li>{@code DEST}, at most once per state</li>
 * <li>{@code <out=expr;out[3]=expr>}, at most once per state</li>
 * </ul>
 * Conditions and expressions are opaque and kept verbatim.
 */
public class TransitionLineParser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** Clauses of a single state after decoding. */
  public static class ParsedState {
    public final String name;
    public final Map<String, String> mooreOutputs;
    public final List<Transition> transitions;

    ParsedState(String name, Map<String, String> mooreOutputs, List<Transition> transitions) {
      this.name = name;
      this.mooreOutputs = Collections.unmodifiableMap(mooreOutputs);
      this.transitions = Collections.unmodifiableList(transitions);
    }
  }

  private final Map<String, OutputPort> outputs;

  /** @param outputs declared outputs, used to resolve assignment targets */
  public TransitionLineParser(Map<String, OutputPort> outputs) { this.outputs = outputs; }

  /**
   * Decodes all clauses of one state.
   * Destination names are not resolved here since later states may not be known yet.
   */
  public ParsedState parseState(String state, List<String> clauses) throws GrammarException, ReferenceException {
    Map<String, String> moore = new LinkedHashMap<>();
    List<Transition> transitions = new ArrayList<>();
    TransitionClause defaultArc = null;
    TransitionClause mooreClause = null;
    for (String text : clauses) {
      TransitionClause clause = parseClause(state, text);
      logger.trace("State {}: {}", state, clause);
      switch (clause.getKind()) {
      case MOORE:
        if (mooreClause != null)
          throw new GrammarException("State " + state + " declares Moore outputs twice: '" + mooreClause.getText() + "' and '" + text +
                                     "'");
        mooreClause = clause;
        moore.putAll(clause.getOutputs());
        break;
      case DEFAULT:
        if (defaultArc != null)
          throw new GrammarException("State " + state + " has more than one default transition: '" + defaultArc.getText() + "' and '" +
                                     text + "'");
        defaultArc = clause;
        transitions.add(clause.toTransition(state));
        break;
      case CONDITIONAL:
        transitions.add(clause.toTransition(state));
        break;
      }
    }
    return new ParsedState(state, moore, transitions);
  }

  /** Decodes a single clause of the given state. */
  public TransitionClause parseClause(String state, String text) throws GrammarException, ReferenceException {
    String clause = text.trim();
    List<String> fields = splitTopLevel(clause, ',');
    if (fields.size() == 1) {
      String field = fields.get(0);
      if (isAngleList(field))
        return TransitionClause.moore(text, parseAssignments(state, text, field));
      if (IDENTIFIER.matcher(field).matches())
        return TransitionClause.defaultArc(text, field);
      throw new GrammarException("State " + state + ": cannot decode clause '" + text +
                                 "', expected '(condition), DEST[, <outputs>]', 'DEST' or '<outputs>'");
    }
    if (fields.size() > 3)
      throw new GrammarException("State " + state + ": clause '" + text + "' has " + fields.size() + " fields, at most 3 are allowed");

    String conditionField = fields.get(0);
    String condition;
    if (isParenthesized(conditionField))
      condition = conditionField.substring(1, conditionField.length() - 1).trim();
    else if (conditionField.startsWith("(") && conditionField.endsWith(")") && isBalanced(conditionField))
      // compound guard like (a) || (b): the outer parentheses belong to different operands
      condition = conditionField;
    else
      throw new GrammarException("State " + state + ": condition of clause '" + text + "' must start with '(' and end with ')'");
    if (condition.isEmpty())
      throw new GrammarException("State " + state + ": clause '" + text + "' has an empty condition");

    String destination = fields.get(1);
    if (!IDENTIFIER.matcher(destination).matches())
      throw new GrammarException("State " + state + ": clause '" + text + "' has no valid destination state in field '" + destination +
                                 "'");

    Map<String, String> mealy = Map.of();
    if (fields.size() == 3) {
      if (!isAngleList(fields.get(2)))
        throw new GrammarException("State " + state + ": outputs of clause '" + text + "' must be enclosed in '<' and '>'");
      mealy = parseAssignments(state, text, fields.get(2));
    }
    return TransitionClause.conditional(text, condition, destination, mealy);
  }

  /**
   * Decodes an angle-bracketed assignment list {@code <a=x;b[1:0]=y>}. Every target must name a declared output;
   * numeric indexes must lie within the output's width.
   */
  Map<String, String> parseAssignments(String state, String clause, String list) throws GrammarException, ReferenceException {
    Map<String, String> assignments = new LinkedHashMap<>();
    String body = list.substring(1, list.length() - 1);
    for (String entry : splitTopLevel(body, ';')) {
      if (entry.isEmpty())
        continue;
      int eq = indexOfTopLevel(entry, '=');
      if (eq < 0)
        throw new GrammarException("State " + state + ", clause '" + clause + "': output assignment '" + entry + "' has no '='");
      String target = entry.substring(0, eq).trim();
      String expression = entry.substring(eq + 1).trim();
      if (target.isEmpty() || expression.isEmpty())
        throw new GrammarException("State " + state + ", clause '" + clause + "': incomplete output assignment '" + entry + "'");
      OutputAssignment assignment;
      try {
        assignment = OutputAssignment.of(target, expression);
      } catch (IllegalArgumentException e) {
        throw new GrammarException("State " + state + ", clause '" + clause + "': '" + target + "' is not an output name");
      }
      OutputPort port = outputs.get(assignment.getBaseName());
      if (port == null)
        throw new ReferenceException("State " + state + ", clause '" + clause + "': output '" + assignment.getBaseName() +
                                     "' is not declared");
      if (!assignment.indexFits(port.getWidth()))
        throw new ReferenceException("State " + state + ", clause '" + clause + "': index [" + assignment.getIndex() + "] is outside of " +
                                     port.getName() + "[" + (port.getWidth() - 1) + ":0]");
      if (assignments.put(assignment.getTarget(), expression) != null)
        throw new GrammarException("State " + state + ", clause '" + clause + "': output '" + assignment.getTarget() + "' assigned twice");
    }
    return assignments;
  }

  private static boolean isAngleList(String field) { return field.length() >= 2 && field.startsWith("<") && field.endsWith(">"); }

  /** True if the field is one parenthesized group, i.e. the opening parenthesis is closed by the last character. */
  private static boolean isParenthesized(String field) {
    if (!field.startsWith("(") || !field.endsWith(")"))
      return false;
    int depth = 0;
    for (int i = 0; i < field.length(); i++) {
      char c = field.charAt(i);
      if (c == '(')
        depth++;
      else if (c == ')' && --depth == 0)
        return i == field.length() - 1;
    }
    return false;
  }

  private static boolean isBalanced(String field) {
    int depth = 0;
    for (int i = 0; i < field.length(); i++) {
      char c = field.charAt(i);
      if (c == '(')
        depth++;
      else if (c == ')' && --depth < 0)
        return false;
    }
    return depth == 0;
  }

  /** Splits at separators outside of (), [] and {} groups. Fields are trimmed. */
  static List<String> splitTopLevel(String text, char separator) {
    List<String> fields = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(' || c == '[' || c == '{')
        depth++;
      else if ((c == ')' || c == ']' || c == '}') && depth > 0)
        depth--;
      else if (c == separator && depth == 0) {
        fields.add(text.substring(start, i).trim());
        start = i + 1;
      }
    }
    fields.add(text.substring(start).trim());
    return fields;
  }

  private static int indexOfTopLevel(String text, char wanted) {
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(' || c == '[' || c == '{')
        depth++;
      else if ((c == ')' || c == ']' || c == '}') && depth > 0)
        depth--;
      else if (c == wanted && depth == 0)
        return i;
    }
    return -1;
  }
}
