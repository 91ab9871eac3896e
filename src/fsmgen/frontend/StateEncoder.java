package fsmgen.frontend;

import fsmgen.util.Log2;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assigns encoding values to states in declaration order.
 * <ul>
 * <li>one-hot: 1, 2, 4, 8, ...; the state register has one bit per state</li>
 * <li>counter: 0, 1, 2, ...; the state register has clog2(N) bits (at least one)</li>
 * </ul>
 */
public class StateEncoder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final EncodingScheme scheme;

  public StateEncoder(EncodingScheme scheme) { this.scheme = scheme; }

  /** Bit width of the state register for the given number of states. */
  public int width(int numStates) {
    if (scheme == EncodingScheme.ONE_HOT)
      return numStates;
    return Math.max(1, Log2.clog2(numStates));
  }

  /** Encoding value of the state at the given declaration position. */
  public BigInteger value(int position) {
    if (scheme == EncodingScheme.ONE_HOT)
      return BigInteger.ONE.shiftLeft(position);
    return BigInteger.valueOf(position);
  }

  /**
   * Returns copies of the given states with their encodings assigned, keeping the map order.
   * @throws EncodingConflictException if two states end up with the same value
   */
  public Map<String, State> assign(Map<String, State> states) throws EncodingConflictException {
    Map<String, State> encoded = new LinkedHashMap<>();
    int position = 0;
    for (State state : states.values()) {
      State withValue = state.withEncoding(value(position++));
      logger.debug("State {} encoded as {} ({})", withValue.getName(), withValue.getEncoding(), scheme.getSerialName());
      encoded.put(withValue.getName(), withValue);
    }
    checkUnique(encoded);
    return encoded;
  }

  /** @throws EncodingConflictException naming both states if two encodings are equal */
  public static void checkUnique(Map<String, State> states) throws EncodingConflictException {
    HashMap<BigInteger, String> owners = new HashMap<>();
    for (State state : states.values()) {
      String previous = owners.put(state.getEncoding(), state.getName());
      if (previous != null)
        throw new EncodingConflictException("States " + previous + " and " + state.getName() + " share the encoding " + state.getEncoding());
    }
  }
}
