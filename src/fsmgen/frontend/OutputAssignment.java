package fsmgen.frontend;

import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@code target=expression} pair of a Moore or Mealy output list.
 * The target is either a bare output name or {@code name[index]}, where index is a bit or a {@code hi:lo} slice.
 * Expressions are carried verbatim.
 */
public class OutputAssignment {
  static final Pattern TARGET = Pattern.compile("([A-Za-z_][A-Za-z0-9_$]*)\\s*(?:\\[\\s*([^\\[\\]]+?)\\s*\\])?");
  private static final Pattern NUMERIC_INDEX = Pattern.compile("(\\d+)(?:\\s*:\\s*(\\d+))?");

  private final String baseName;
  private final String index;
  private final String expression;

  public OutputAssignment(String baseName, String index, String expression) {
    this.baseName = baseName;
    this.index = index;
    this.expression = expression;
  }

  /**
   * Splits a target such as {@code out[3]} into base name and index.
   * @throws IllegalArgumentException if target is neither a bare name nor an indexed name
   */
  public static OutputAssignment of(String target, String expression) {
    Matcher m = TARGET.matcher(target.trim());
    if (!m.matches())
      throw new IllegalArgumentException("not an output target: '" + target + "'");
    return new OutputAssignment(m.group(1), m.group(2) == null ? "" : m.group(2), expression);
  }

  public String getBaseName() { return baseName; }

  /** Index text between the brackets, empty for a bare name. */
  public String getIndex() { return index; }

  public boolean isIndexed() { return !index.isEmpty(); }

  public String getExpression() { return expression; }

  /** Target in canonical form, {@code name} or {@code name[index]}. */
  public String getTarget() { return targetWithName(baseName); }

  /** Target with the base name replaced, keeping the index suffix. */
  public String targetWithName(String name) { return isIndexed() ? name + "[" + index + "]" : name; }

  /**
   * Checks a numeric bit index or slice against the port width. Non-numeric index expressions can't be checked and are accepted.
   * @return true if the index is within 0..width-1 (or is not numeric)
   */
  public boolean indexFits(int width) {
    if (!isIndexed())
      return true;
    Matcher m = NUMERIC_INDEX.matcher(index);
    if (!m.matches())
      return true;
    BigInteger hi = new BigInteger(m.group(1));
    BigInteger lo = (m.group(2) == null) ? hi : new BigInteger(m.group(2));
    return lo.compareTo(hi) <= 0 && hi.compareTo(BigInteger.valueOf(width)) < 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(baseName, index, expression);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    OutputAssignment other = (OutputAssignment)obj;
    return baseName.equals(other.baseName) && index.equals(other.index) && expression.equals(other.expression);
  }

  @Override
  public String toString() {
    return getTarget() + "=" + expression;
  }
}
