package fsmgen.util;

public class Log2 {
  public static int log2(int n) {
    if (n <= 0)
      throw new IllegalArgumentException("log2 of " + n);
    return 31 - Integer.numberOfLeadingZeros(n);
  }

  /** Ceiling of log2(n); 0 for n == 1. */
  public static int clog2(int n) {
    if (n <= 0)
      throw new IllegalArgumentException("clog2 of " + n);
    if (n == 1)
      return 0;
    return log2(n - 1) + 1;
  }
}
