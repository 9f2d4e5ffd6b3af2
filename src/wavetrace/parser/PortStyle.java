package wavetrace.parser;

/**
 * Declaration style of a module port list.
 */
public enum PortStyle {
  /** Verilog-1995: the list holds port names only, directions are declared in the module body. */
  LEGACY,
  /** Verilog-2001: directions and types are declared inline in the port list. */
  ANSI
}
