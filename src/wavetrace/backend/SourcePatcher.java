package wavetrace.backend;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavetrace.WavetraceException;
import wavetrace.hierarchy.DebugInstance;
import wavetrace.hierarchy.LayoutEngine;
import wavetrace.parser.InstanceAnchor;
import wavetrace.parser.ModuleAnchors;
import wavetrace.parser.PortListAnchor;
import wavetrace.parser.PortStyle;
import wavetrace.parser.SourceAnchor;
import wavetrace.parser.VerilogLocator;
import wavetrace.util.FileWriter;
import wavetrace.util.ToWrite;
import wavetrace.util.Verilog;

/**
 * Emits one patched copy of the source file for every debug instance. The copy adds the debug port, the wires of
 * the child debug vectors, the renamed child module types with their extra connection and the assign statement
 * building the instance's debug vector. The top level additionally gets the UART ports and the capture module.
 */
public class SourcePatcher {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final VerilogLocator locator;
  private final Path outputDir;

  public SourcePatcher(VerilogLocator locator, Path outputDir) {
    this.locator = locator;
    this.outputDir = outputDir;
  }

  /**
   * Output path of an instance: {@code <basename>_wt<dedupId><ext>} in the output directory.
   */
  public Path outputFile(DebugInstance inst) {
    String fileName = inst.getSourceFile().getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String base = (dot < 0) ? fileName : fileName.substring(0, dot);
    String ext = (dot < 0) ? "" : fileName.substring(dot);
    return outputDir.resolve(base + inst.getVariantSuffix() + ext);
  }

  /**
   * Writes the patched files of the whole tree, parent before children.
   * Widths must have been computed.
   * @param root the top level instance
   * @param capture the capture module placed in the top level
   * @return the generated files in write order
   */
  public List<Path> patch(DebugInstance root, CaptureInstance capture) throws WavetraceException, IOException {
    FileWriter writer = new FileWriter();
    List<DebugInstance> instances = new ArrayList<>();
    root.streamPreOrder().forEach(instances::add);
    for (DebugInstance inst : instances) {
      Path outFile = outputFile(inst);
      if (writer.hasFile(outFile))
        throw new WavetraceException("Output file name clash: " + outFile + " would be generated twice (from " + inst.getSourceFile() +
                                     "); rename one of the source files");
      writer.addFile(outFile, inst.getSourceFile());
      for (ToWrite edit : collectEdits(inst, inst.isTop() ? capture : null))
        writer.updateContent(outFile, edit);
    }
    return writer.writeFiles();
  }

  /**
   * Computes all edits for one instance's source file.
   * @param capture the capture module, only used for the top level instance
   */
  public List<ToWrite> collectEdits(DebugInstance inst, CaptureInstance capture) throws WavetraceException, IOException {
    Path file = inst.getSourceFile();
    String moduleType = inst.getModuleType();
    ModuleAnchors anchors = locator.locateModule(file, moduleType);
    List<ToWrite> edits = new ArrayList<>();

    for (DebugInstance child : inst.getChildren()) {
      InstanceAnchor childAnchor = locator.findInstance(file, moduleType, child.getInstanceName());
      SourceAnchor typeLoc = childAnchor.getTypeLocation();
      edits.add(ToWrite.inline(typeLoc.getLineIndex(), typeLoc.getColumnIndex() + childAnchor.getInstanceType().length(),
                               child.getVariantSuffix()));
      SourceAnchor portLoc = childAnchor.getPortConnLocation();
      String terminator = childAnchor.hasEmptyConnections() ? "" : ",";
      edits.add(ToWrite.block(portLoc.getLineIndex(), portLoc.getColumnIndex() + 1,
                              Verilog.portConnection(Verilog.DEBUG_PORT, child.getDebugWireName(), terminator)));
    }

    if (!inst.isTop()) {
      SourceAnchor header = anchors.getHeader();
      edits.add(ToWrite.inline(header.getLineIndex(), header.getColumnIndex() + moduleType.length(), inst.getVariantSuffix()));
    }

    PortListAnchor ports = anchors.getPortList();
    edits.add(ToWrite.block(ports.getLineIndex(), ports.getColumnIndex() + 1, portListText(inst, ports)));

    String declarations = declarationText(inst, ports.getStyle());
    if (!declarations.isEmpty()) {
      SourceAnchor decl = anchors.getDeclarationPoint();
      edits.add(ToWrite.block(decl.getLineIndex(), decl.getColumnIndex() + 1, declarations));
    }

    String body = Verilog.assignConcat(Verilog.DEBUG_PORT, LayoutEngine.concatenation(inst));
    if (inst.isTop() && capture != null)
      body += capture.toVerilog();
    SourceAnchor end = anchors.getEndmodule();
    edits.add(ToWrite.block(end.getLineIndex(), end.getColumnIndex(), body));

    logger.debug("{}: {} edits", inst, edits.size());
    return edits;
  }

  static String portListText(DebugInstance inst, PortListAnchor ports) {
    String last = ports.isEmpty() ? "" : ",";
    if (ports.getStyle() == PortStyle.ANSI) {
      if (inst.isTop())
        return Verilog.portDecl("input", Verilog.UART_RX, ",") + Verilog.portDecl("output", Verilog.UART_TX, last);
      return Verilog.portDecl("output", inst.getTotalPortWidth(), Verilog.DEBUG_PORT, last);
    }
    if (inst.isTop())
      return Verilog.portName(Verilog.UART_RX, ",") + Verilog.portName(Verilog.UART_TX, last);
    return Verilog.portName(Verilog.DEBUG_PORT, last);
  }

  static String declarationText(DebugInstance inst, PortStyle style) {
    StringBuilder content = new StringBuilder();
    // 1995-style modules declare port directions in the body
    if (style == PortStyle.LEGACY) {
      if (inst.isTop())
        content.append(Verilog.portDecl("input", Verilog.UART_RX, ";")).append(Verilog.portDecl("output", Verilog.UART_TX, ";"));
      else
        content.append(Verilog.portDecl("output", inst.getTotalPortWidth(), Verilog.DEBUG_PORT, ";"));
    }
    if (inst.isTop())
      content.append(Verilog.wireDecl(inst.getTotalPortWidth(), Verilog.DEBUG_PORT));
    for (DebugInstance child : inst.getChildren())
      content.append(Verilog.wireDecl(child.getTotalPortWidth(), child.getDebugWireName()));
    return content.toString();
  }
}
