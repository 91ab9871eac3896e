package fsmgen.frontend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** One decoded clause of a state's transition list. */
public class TransitionClause {
  public enum Kind {
    /** {@code (condition), destination[, <mealy outputs>]} */
    CONDITIONAL,
    /** {@code destination} */
    DEFAULT,
    /** {@code <moore outputs>} */
    MOORE
  }

  private final Kind kind;
  private final String text;
  private final Optional<String> condition;
  private final Optional<String> destination;
  private final Map<String, String> outputs;

  private TransitionClause(Kind kind, String text, Optional<String> condition, Optional<String> destination, Map<String, String> outputs) {
    this.kind = kind;
    this.text = text;
    this.condition = condition;
    this.destination = destination;
    this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
  }

  public static TransitionClause conditional(String text, String condition, String destination, Map<String, String> mealyOutputs) {
    return new TransitionClause(Kind.CONDITIONAL, text, Optional.of(condition), Optional.of(destination), mealyOutputs);
  }

  public static TransitionClause defaultArc(String text, String destination) {
    return new TransitionClause(Kind.DEFAULT, text, Optional.empty(), Optional.of(destination), Map.of());
  }

  public static TransitionClause moore(String text, Map<String, String> mooreOutputs) {
    return new TransitionClause(Kind.MOORE, text, Optional.empty(), Optional.empty(), mooreOutputs);
  }

  public Kind getKind() { return kind; }

  /** The clause as written in the description. */
  public String getText() { return text; }

  public Optional<String> getCondition() { return condition; }

  public Optional<String> getDestination() { return destination; }

  /** Mealy outputs of an arc, or the Moore outputs of a {@link Kind#MOORE} clause. */
  public Map<String, String> getOutputs() { return outputs; }

  /** Converts an arc clause into a transition leaving the given state. */
  public Transition toTransition(String source) {
    if (kind == Kind.MOORE)
      throw new IllegalStateException("a Moore output clause is not a transition: " + text);
    return new Transition(source, destination.get(), condition, outputs);
  }

  @Override
  public String toString() {
    return kind + " '" + text + "'";
  }
}
