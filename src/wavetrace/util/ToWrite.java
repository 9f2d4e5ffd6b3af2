package wavetrace.util;

/**
 * One edit to apply to a source line: either an inline insertion (e.g. a module name suffix) or a block of
 * generated lines framed by {@link #MARKER} lines.
 */
public class ToWrite {
  public static final String MARKER = "//---WT_DEBUG---";

  /** 0-based line index within the source file. */
  public final int line;
  /** 0-based character offset within the line; the text is inserted before this character. */
  public final int column;
  /** The text to insert; use "\n" line breaks, they are converted to the file's line separator. */
  public final String text;
  /** True for a framed block, false for inline text. */
  public final boolean block;

  private ToWrite(int line, int column, String text, boolean block) {
    if (line < 0 || column < 0)
      throw new IllegalArgumentException("Negative edit position " + line + ":" + column);
    this.line = line;
    this.column = column;
    this.text = text;
    this.block = block;
  }

  /**
   * Creates an inline insertion, e.g. a suffix appended to an identifier.
   */
  public static ToWrite inline(int line, int column, String text) { return new ToWrite(line, column, text, false); }

  /**
   * Creates a framed block insertion. The line is split at the column; the block goes in between.
   * @param text the block content; every line should end with "\n"
   */
  public static ToWrite block(int line, int column, String text) { return new ToWrite(line, column, text, true); }

  /**
   * Applies this edit to a line (without its terminator).
   * @param content the line text, possibly already modified right of {@link #column}
   * @param eol the line separator used by the file
   */
  public String apply(String content, String eol) {
    if (column > content.length())
      throw new IllegalStateException("Column " + (column + 1) + " is beyond the end of line " + (line + 1));
    String prefix = content.substring(0, column);
    String suffix = content.substring(column);
    if (!block)
      return prefix + text + suffix;
    String body = text.replace("\n", eol);
    return prefix + eol + MARKER + eol + body + MARKER + (suffix.isEmpty() ? "" : eol) + suffix;
  }

  @Override
  public String toString() {
    return (block ? "Block" : "Inline") + " insertion at " + (line + 1) + ":" + (column + 1) + ": " + text;
  }
}
