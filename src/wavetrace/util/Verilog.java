package wavetrace.util;

import java.util.List;

/**
 * Generates the Verilog text fragments inserted into patched sources.
 */
public class Verilog {
  public static final String DEBUG_PORT = "wt_debug";
  public static final String UART_RX = "wt_uart_rx";
  public static final String UART_TX = "wt_uart_tx";

  private static final String TAB = "  ";

  /** Generates text like "[7:0]". Single bit signals get "[0:0]". */
  public static String range(int width) { return "[" + (width - 1) + ":0]"; }

  /** Generates text like "wire [7:0] core0_wt_debug;". */
  public static String wireDecl(int width, String name) { return TAB + "wire " + range(width) + " " + name + ";\n"; }

  /** Generates text like "output [7:0] wt_debug" with the given terminator (",", ";" or ""). */
  public static String portDecl(String direction, int width, String name, String terminator) {
    return TAB + direction + " " + range(width) + " " + name + terminator + "\n";
  }

  /** Generates a port declaration without a range, aligned as "input  wt_uart_rx;". */
  public static String portDecl(String direction, String name, String terminator) {
    return TAB + String.format("%-6s ", direction) + name + terminator + "\n";
  }

  /** Generates a port name entry of a 1995-style port list. */
  public static String portName(String name, String terminator) { return TAB + name + terminator + "\n"; }

  /** Generates a named port connection like ".wt_debug(core0_wt_debug),". */
  public static String portConnection(String port, String signal, String terminator) {
    return TAB + TAB + "." + port + "(" + signal + ")" + terminator + "\n";
  }

  /**
   * Generates text like "assign wt_debug = {a, b};" with one signal per line.
   * @param signals signals to concatenate, most significant first
   */
  public static String assignConcat(String target, List<String> signals) {
    String head = TAB + "assign " + target + " = {";
    String separator = ",\n" + " ".repeat(head.length());
    return head + String.join(separator, signals) + "};\n";
  }
}
