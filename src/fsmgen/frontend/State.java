package fsmgen.frontend;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A machine state with its encoding value and the Moore outputs asserted while the machine is in it.
 * Moore outputs map an output target (name or name[index]) to an expression, in declaration order.
 */
public class State {
  private final String name;
  private final BigInteger encoding;
  private final Map<String, String> mooreOutputs;

  public State(String name, BigInteger encoding, Map<String, String> mooreOutputs) {
    if (encoding.signum() < 0)
      throw new IllegalArgumentException("encoding of state " + name + " must not be negative");
    this.name = name;
    this.encoding = encoding;
    this.mooreOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(mooreOutputs));
  }

  public String getName() { return name; }

  public BigInteger getEncoding() { return encoding; }

  public Map<String, String> getMooreOutputs() { return mooreOutputs; }

  /** Copy of this state with a different encoding. */
  public State withEncoding(BigInteger newEncoding) { return new State(name, newEncoding, mooreOutputs); }

  @Override
  public int hashCode() {
    return Objects.hash(name, encoding, mooreOutputs);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    State other = (State)obj;
    return name.equals(other.name) && encoding.equals(other.encoding) && mooreOutputs.equals(other.mooreOutputs);
  }

  @Override
  public String toString() {
    return name + "=" + encoding + (mooreOutputs.isEmpty() ? "" : " " + mooreOutputs);
  }
}
