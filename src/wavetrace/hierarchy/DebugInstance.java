package wavetrace.hierarchy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A node of the debug hierarchy: one module instance that either owns debug nets or routes them from below.
 * Local nets and children keep their insertion order; the bit layout and the generated concatenations depend on it.
 */
public class DebugInstance {
  public static final String TOP_NAME = "Top";

  private final String instanceName;
  private final String moduleType;
  private final Path sourceFile;
  private final int dedupId;
  private final boolean isTop;
  private final List<DebugNet> localNets = new ArrayList<>();
  private final List<DebugInstance> children = new ArrayList<>();
  private int totalPortWidth = -1;

  public DebugInstance(String instanceName, String moduleType, Path sourceFile, int dedupId, boolean isTop) {
    this.instanceName = instanceName;
    this.moduleType = moduleType;
    this.sourceFile = sourceFile;
    this.dedupId = dedupId;
    this.isTop = isTop;
  }

  public String getInstanceName() { return instanceName; }
  public String getModuleType() { return moduleType; }
  public Path getSourceFile() { return sourceFile; }
  public int getDedupId() { return dedupId; }
  public boolean isTop() { return isTop; }

  /** Nets owned by this instance, in the order they were added. */
  public List<DebugNet> getLocalNets() { return Collections.unmodifiableList(localNets); }
  /** Debug sub-instances, in the order they were first reached. */
  public List<DebugInstance> getChildren() { return Collections.unmodifiableList(children); }

  /** Returns the first child with the given instance name. */
  public Optional<DebugInstance> getChild(String name) {
    return children.stream().filter(child -> child.instanceName.equals(name)).findFirst();
  }

  void addChild(DebugInstance child) { children.add(child); }
  void addNet(DebugNet net) { localNets.add(net); }

  /**
   * Width of this instance's debug port, i.e. all nets of this instance and below.
   * @throws IllegalStateException if the widths have not been computed yet
   */
  public int getTotalPortWidth() {
    if (totalPortWidth < 0)
      throw new IllegalStateException("Port width of instance '" + instanceName + "' has not been computed");
    return totalPortWidth;
  }

  void setTotalPortWidth(int totalPortWidth) { this.totalPortWidth = totalPortWidth; }

  /** Suffix distinguishing this debug variant of the module type, e.g. "_wt0". */
  public String getVariantSuffix() { return "_wt" + dedupId; }

  /** Module name used in the generated source. The top keeps its original name. */
  public String getVariantModuleType() { return isTop ? moduleType : moduleType + getVariantSuffix(); }

  /** Name of the wire carrying this instance's debug vector in its parent. */
  public String getDebugWireName() { return instanceName + "_wt_debug"; }

  /** This instance followed by all descendants, parent before children. */
  public Stream<DebugInstance> streamPreOrder() {
    return Stream.concat(Stream.of(this), children.stream().flatMap(DebugInstance::streamPreOrder));
  }

  /**
   * Renders this instance and its descendants as an indented tree.
   */
  public String printTree() {
    StringBuilder sb = new StringBuilder();
    printTree(sb, 0);
    return sb.toString();
  }

  private void printTree(StringBuilder sb, int offset) {
    String indent = " ".repeat(offset);
    sb.append(instanceName).append(" (").append(moduleType).append(")\n");
    for (DebugNet net : localNets)
      sb.append(indent).append("|- ").append(net.getName()).append('\n');
    for (DebugInstance child : children) {
      sb.append(indent).append("|- ");
      child.printTree(sb, offset + 3);
    }
  }

  @Override
  public String toString() {
    return instanceName + " (" + moduleType + getVariantSuffix() + ", " + sourceFile + ")";
  }
}
