package wavetrace;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import wavetrace.hierarchy.DebugInstance;

/**
 * Outcome of a successful generation run.
 */
public class GenerationResult {
  private final DebugInstance top;
  private final List<Path> generatedFiles;
  private final List<String> signalOrder;
  private final Path signalListFile;
  private final int dataBits;

  public GenerationResult(DebugInstance top, List<Path> generatedFiles, List<String> signalOrder, Path signalListFile, int dataBits) {
    this.top = top;
    this.generatedFiles = Collections.unmodifiableList(new ArrayList<>(generatedFiles));
    this.signalOrder = Collections.unmodifiableList(new ArrayList<>(signalOrder));
    this.signalListFile = signalListFile;
    this.dataBits = dataBits;
  }

  /** Root of the debug hierarchy, with widths and positions assigned. */
  public DebugInstance getTop() { return top; }
  /** Patched Verilog files, top level first. */
  public List<Path> getGeneratedFiles() { return generatedFiles; }
  /** Net paths in debug vector order, starting at bit 0. */
  public List<String> getSignalOrder() { return signalOrder; }
  public Path getSignalListFile() { return signalListFile; }
  /** Width of the top level debug vector. */
  public int getDataBits() { return dataBits; }
}
