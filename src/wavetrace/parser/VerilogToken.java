package wavetrace.parser;

/**
 * A lexical token of a Verilog source with its 1-based line and column.
 */
public class VerilogToken {
  public enum Kind {
    IDENTIFIER,
    SYSTEM_IDENTIFIER,
    DIRECTIVE,
    NUMBER,
    STRING,
    SYMBOL
  }

  private final Kind kind;
  private final String text;
  private final int line;
  private final int column;

  public VerilogToken(Kind kind, String text, int line, int column) {
    this.kind = kind;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public Kind getKind() { return kind; }
  public String getText() { return text; }
  public int getLine() { return line; }
  public int getColumn() { return column; }

  public boolean isIdentifier() { return kind == Kind.IDENTIFIER; }
  public boolean isIdentifier(String name) { return kind == Kind.IDENTIFIER && text.equals(name); }
  public boolean isSymbol(char c) { return kind == Kind.SYMBOL && text.length() == 1 && text.charAt(0) == c; }

  public SourceAnchor toAnchor() { return new SourceAnchor(line, column); }

  @Override
  public String toString() {
    return kind + "(" + text + ")@" + line + ":" + column;
  }
}
