package wavetrace.parser;

/**
 * Location of the opening parenthesis of a module port list, along with the list's declaration style.
 */
public class PortListAnchor extends SourceAnchor {
  private final PortStyle style;
  private final boolean empty;

  public PortListAnchor(int line, int column, PortStyle style, boolean empty) {
    super(line, column);
    this.style = style;
    this.empty = empty;
  }

  public PortStyle getStyle() { return style; }

  /** True for {@code ()}, i.e. a port list without any entries. */
  public boolean isEmpty() { return empty; }

  @Override
  public String toString() {
    return super.toString() + " " + style + (empty ? " (empty)" : "");
  }
}
