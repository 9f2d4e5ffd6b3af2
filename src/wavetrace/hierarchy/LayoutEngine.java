package wavetrace.hierarchy;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes debug port widths and the bit position of every net.
 *
 * The canonical net order is depth first: an instance's local nets in insertion order, then each child in insertion
 * order. The first net of that order occupies the least significant bits of the debug vector. The concatenation
 * emitted for an instance ({@link #concatenation(DebugInstance)}) lists children in reverse, then local nets in
 * reverse, which yields the same layout in Verilog's MSB-first notation.
 */
public class LayoutEngine {

  /**
   * Sets {@link DebugInstance#getTotalPortWidth()} for the node and all descendants.
   * @return the width of the node's debug vector
   */
  public static int computeWidths(DebugInstance node) {
    int width = 0;
    for (DebugNet net : node.getLocalNets())
      width += net.getBitWidth();
    for (DebugInstance child : node.getChildren())
      width += computeWidths(child);
    node.setTotalPortWidth(width);
    return width;
  }

  /**
   * Assigns the MSB position of every net of the node and its descendants.
   * @param offset bit position of the node's least significant bit
   * @return the first position after the node's block
   */
  public static int assignPositions(DebugInstance node, int offset) {
    int pos = offset;
    for (DebugNet net : node.getLocalNets()) {
      pos += net.getBitWidth();
      net.setVectorPosition(pos - 1);
    }
    for (DebugInstance child : node.getChildren())
      pos = assignPositions(child, pos);
    return pos;
  }

  /**
   * Runs both passes on a root.
   * @return the global debug vector width
   */
  public static int layout(DebugInstance root) {
    int width = computeWidths(root);
    int end = assignPositions(root, 0);
    if (end != width)
      throw new IllegalStateException("Layout covers " + end + " bits but the debug vector is " + width + " bits wide");
    return width;
  }

  /** All nets in canonical order. */
  public static List<DebugNet> canonicalOrder(DebugInstance node) {
    List<DebugNet> nets = new ArrayList<>();
    collect(node, nets);
    return nets;
  }

  private static void collect(DebugInstance node, List<DebugNet> nets) {
    nets.addAll(node.getLocalNets());
    for (DebugInstance child : node.getChildren())
      collect(child, nets);
  }

  /**
   * Signals concatenated into an instance's debug vector, most significant first: child debug wires in reverse
   * order, then local nets in reverse order.
   */
  public static List<String> concatenation(DebugInstance node) {
    List<String> sigs = new ArrayList<>();
    List<DebugInstance> children = node.getChildren();
    for (int i = children.size() - 1; i >= 0; i--)
      sigs.add(children.get(i).getDebugWireName());
    List<DebugNet> nets = node.getLocalNets();
    for (int i = nets.size() - 1; i >= 0; i--)
      sigs.add(nets.get(i).getName());
    return sigs;
  }
}
