package wavetrace.parser;

/**
 * A position in a source file. Both line and column are 1-based; the column counts characters, not expanded tabs.
 */
public class SourceAnchor implements Comparable<SourceAnchor> {
  private final int line;
  private final int column;

  public SourceAnchor(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public int getLine() { return line; }
  public int getColumn() { return column; }

  /** 0-based index of the line within the file. */
  public int getLineIndex() { return line - 1; }
  /** 0-based character offset of the anchored token within its line. */
  public int getColumnIndex() { return column - 1; }

  @Override
  public int compareTo(SourceAnchor other) {
    return (line != other.line) ? Integer.compare(line, other.line) : Integer.compare(column, other.column);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    SourceAnchor other = (SourceAnchor)obj;
    return line == other.line && column == other.column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
