package logsim.devices;

/**
 * Level of a single-bit wire. UNDEFINED marks a value that cannot be computed, e.g. from an unconnected input, and is
 * never read as LOW.
 */
public enum Signal {
  LOW('_'),
  HIGH('-'),
  UNDEFINED('X');

  /** Character used when a trace is printed. */
  public final char traceChar;

  Signal(char traceChar) { this.traceChar = traceChar; }

  public static Signal of(boolean level) { return level ? HIGH : LOW; }

  /** Parses the 0/1 notation used for switch levels. */
  public static Signal fromBit(int bit) {
    if (bit != 0 && bit != 1)
      throw new IllegalArgumentException("Switch level must be 0 or 1, got " + bit);
    return bit == 1 ? HIGH : LOW;
  }

  public boolean isDefined() { return this != UNDEFINED; }

  public Signal invert() {
    switch (this) {
    case LOW:
      return HIGH;
    case HIGH:
      return LOW;
    default:
      return UNDEFINED;
    }
  }
}
