package wavetrace.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed net path such as {@code core0.fifo.dout[7:0]}: the hierarchy segments leading to the owning instance,
 * the leaf signal token and its optional bit range.
 */
public class NetSpec {
  private static final Pattern RANGE = Pattern.compile("\\[\\s*(-?\\d+)\\s*(?::\\s*(-?\\d+)\\s*)?\\]");

  private final String path;
  private final List<String> hierarchy;
  private final String signal;

  private NetSpec(String path, List<String> hierarchy, String signal) {
    this.path = path;
    this.hierarchy = Collections.unmodifiableList(hierarchy);
    this.signal = signal;
  }

  /**
   * Splits a net path into its instance segments and the leaf signal token.
   * Dots inside a bracketed range are not treated as separators.
   * @param path dotted net path
   * @return the parsed NetSpec
   * @throws IllegalArgumentException if the path is empty, has an empty segment or more than one bit range
   */
  public static NetSpec parse(String path) {
    if (path == null || path.trim().isEmpty())
      throw new IllegalArgumentException("Empty net path");
    String trimmed = path.trim();
    if (countRanges(trimmed) > 1)
      throw new IllegalArgumentException("Bad net format '" + trimmed + "' (multi-dimensional arrays are not supported)");
    int bracket = trimmed.indexOf('[');
    String hierPart = (bracket < 0) ? trimmed : trimmed.substring(0, bracket);
    String[] segments = hierPart.split("\\.", -1);
    List<String> hierarchy = new ArrayList<>();
    for (int i = 0; i < segments.length; i++) {
      if (segments[i].isEmpty())
        throw new IllegalArgumentException("Bad net format '" + trimmed + "' (empty hierarchy segment)");
      if (i < segments.length - 1)
        hierarchy.add(segments[i]);
    }
    String signal = segments[segments.length - 1] + ((bracket < 0) ? "" : trimmed.substring(bracket));
    if (bracket >= 0 && !RANGE.matcher(trimmed.substring(bracket)).matches())
      throw new IllegalArgumentException("Bad net format '" + trimmed + "' (unparsable bit range)");
    if (bracket >= 0) {
      try {
        width(signal);
      } catch (NumberFormatException | ArithmeticException e) {
        throw new IllegalArgumentException("Bad net format '" + trimmed + "' (bit range out of bounds)", e);
      }
    }
    return new NetSpec(trimmed, hierarchy, signal);
  }

  /** Number of '[' characters in a net string. */
  public static int countRanges(String netString) { return (int)netString.chars().filter(c -> c == '[').count(); }

  /**
   * Extracts the net name from a net string such as "data[3:0]" or "state[0]".
   */
  public static String name(String netString) {
    int bracket = netString.indexOf('[');
    return (bracket < 0 ? netString : netString.substring(0, bracket)).trim();
  }

  /**
   * Extracts the (high, low) bit pair from a net string; (0, 0) if it has no range, (b, b) for a single bit select.
   */
  public static int[] range(String netString) {
    Matcher m = RANGE.matcher(netString);
    if (!m.find())
      return new int[] {0, 0};
    int hi = Integer.parseInt(m.group(1));
    int lo = (m.group(2) == null) ? hi : Integer.parseInt(m.group(2));
    return new int[] {hi, lo};
  }

  /**
   * Bit width of a net string, |hi-lo|+1.
   * @throws NumberFormatException if a bound does not fit an int
   * @throws ArithmeticException if the width does not fit an int
   */
  public static int width(String netString) {
    int[] r = range(netString);
    return Math.addExact(Math.absExact(Math.subtractExact(r[0], r[1])), 1);
  }

  /** True if the net string carries an explicit bracketed range. */
  public static boolean hasRange(String netString) { return netString.indexOf('[') >= 0; }

  /** The full path as given (trimmed). */
  public String getPath() { return path; }
  /** Instance names from the top module down to the instance owning the signal. */
  public List<String> getHierarchy() { return hierarchy; }
  /** Leaf signal token including its range, e.g. "dout[7:0]". */
  public String getSignal() { return signal; }
  public String getBaseName() { return name(signal); }
  public int getBitWidth() { return width(signal); }
  public boolean hasRange() { return hasRange(signal); }

  @Override
  public String toString() {
    return path;
  }
}
