package fsmgen.frontend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An arc between two states.
 * An empty condition marks the default arc of the source state, which is taken when none of its conditioned arcs match.
 * <p>
 * Ordering: conditioned arcs come before the default arc; conditioned arcs compare by their condition text.
 * This is the priority order of the generated if / else if / else cascade.
 * Note: this class has a natural ordering that is inconsistent with equals.
 */
public class Transition implements Comparable<Transition> {
  private final String source;
  private final String destination;
  private final Optional<String> condition;
  private final Map<String, String> mealyOutputs;

  public Transition(String source, String destination, Optional<String> condition, Map<String, String> mealyOutputs) {
    this.source = source;
    this.destination = destination;
    this.condition = condition;
    this.mealyOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(mealyOutputs));
  }

  public String getSource() { return source; }

  public String getDestination() { return destination; }

  public Optional<String> getCondition() { return condition; }

  public boolean isDefault() { return condition.isEmpty(); }

  public Map<String, String> getMealyOutputs() { return mealyOutputs; }

  @Override
  public int compareTo(Transition other) {
    if (condition.isPresent() != other.condition.isPresent())
      return condition.isPresent() ? -1 : 1;
    if (condition.isEmpty())
      return 0;
    return condition.get().compareTo(other.condition.get());
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, destination, condition, mealyOutputs);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Transition other = (Transition)obj;
    return source.equals(other.source) && destination.equals(other.destination) && condition.equals(other.condition) &&
        mealyOutputs.equals(other.mealyOutputs);
  }

  @Override
  public String toString() {
    return source + " -> " + destination + condition.map(c -> " if (" + c + ")").orElse(" else") +
        (mealyOutputs.isEmpty() ? "" : " / " + mealyOutputs);
  }
}
