package wavetrace.parser;

/**
 * All module level anchors the patcher needs for one module definition.
 */
public class ModuleAnchors {
  private final String moduleType;
  private final SourceAnchor header;
  private final PortListAnchor portList;
  private final SourceAnchor declarationPoint;
  private final SourceAnchor endmodule;

  public ModuleAnchors(String moduleType, SourceAnchor header, PortListAnchor portList, SourceAnchor declarationPoint,
                       SourceAnchor endmodule) {
    this.moduleType = moduleType;
    this.header = header;
    this.portList = portList;
    this.declarationPoint = declarationPoint;
    this.endmodule = endmodule;
  }

  public String getModuleType() { return moduleType; }
  /** The module type token following the 'module' keyword. */
  public SourceAnchor getHeader() { return header; }
  public PortListAnchor getPortList() { return portList; }
  /** The ';' closing the module header. New declarations go right after it. */
  public SourceAnchor getDeclarationPoint() { return declarationPoint; }
  public SourceAnchor getEndmodule() { return endmodule; }

  @Override
  public String toString() {
    return "module " + moduleType + ": header " + header + ", ports " + portList + ", decl " + declarationPoint + ", endmodule " +
        endmodule;
  }
}
