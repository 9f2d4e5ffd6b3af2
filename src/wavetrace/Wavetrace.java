package wavetrace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavetrace.backend.CaptureInstance;
import wavetrace.backend.SignalList;
import wavetrace.backend.SourcePatcher;
import wavetrace.hierarchy.DebugInstance;
import wavetrace.hierarchy.HierarchyBuilder;
import wavetrace.hierarchy.LayoutEngine;
import wavetrace.parser.ModuleIndex;
import wavetrace.parser.VerilogLocator;
import wavetrace.util.NetSpec;

/**
 * Instruments a Verilog design with a wavetrace capture module.
 *
 * <pre>
 * Wavetrace wt = new Wavetrace(80.0);
 * wt.addSources("rtl");
 * wt.setTop("top");
 * wt.setClock("clk");
 * wt.setReset("rst");
 * wt.addNets("core0.din_valid");
 * wt.addNets("core0", List.of("dout[7:0]"));
 * wt.generate();
 * </pre>
 *
 * The patched files are written to the output directory (default "output"); the originals are left untouched.
 */
public class Wavetrace {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String DEFAULT_OUTPUT_DIR = "output";
  private static final Pattern GENERATED_FILE = Pattern.compile(".*_wt\\d+\\.s?v");

  private final VerilogLocator locator = new VerilogLocator();
  private final ModuleIndex index = new ModuleIndex(locator);
  private final List<Path> sourcePaths = new ArrayList<>();
  private final List<String> netPaths = new ArrayList<>();

  private double clockMhz;
  private int uartBaud = 115200;
  private int preTrigDepth = 64;
  private int captDepth = 512;
  private String topModule = null;
  private String clockNet = null;
  private String resetNet = null;
  private Path outputDir = Paths.get(DEFAULT_OUTPUT_DIR);

  /**
   * @param clockMhz frequency of the capture clock in MHz
   */
  public Wavetrace(double clockMhz) { this.clockMhz = clockMhz; }

  /**
   * Adds a Verilog file, or all .v/.sv files below a directory, and indexes the modules they define.
   * A leading '~' is expanded to the user's home directory.
   */
  public Wavetrace addSources(String path) throws ConfigurationException, IOException {
    Path p = expandHome(path);
    logger.info("Adding sources from '{}'...", p);
    index.register(p);
    sourcePaths.add(p);
    return this;
  }

  /**
   * Removes the module definitions of a file or directory added earlier, e.g. to resolve duplicate definitions.
   */
  public Wavetrace removeSources(String path) {
    index.unregister(expandHome(path));
    return this;
  }

  /**
   * Selects the top level module. It should be instantiated only once in the design.
   */
  public Wavetrace setTop(String moduleType) throws ConfigurationException {
    if (moduleType == null || moduleType.isBlank())
      throw new ConfigurationException("Empty top level module name");
    this.topModule = moduleType.trim();
    return this;
  }

  /**
   * Selects the top level net used as capture clock.
   * @throws ConfigurationException for hierarchical nets
   */
  public Wavetrace setClock(String net) throws ConfigurationException {
    this.clockNet = topLevelNet(net, "clock");
    return this;
  }

  /**
   * Selects the top level net used to reset the capture module.
   * @throws ConfigurationException for hierarchical nets
   */
  public Wavetrace setReset(String net) throws ConfigurationException {
    this.resetNet = topLevelNet(net, "reset");
    return this;
  }

  /**
   * Adds one debug net. Multi-bit nets must carry their bit range, e.g. "inst1.inst2.data[3:0]".
   */
  public Wavetrace addNets(String path) throws ConfigurationException { return addNets("", List.of(path)); }

  public Wavetrace addNets(List<String> paths) throws ConfigurationException { return addNets("", paths); }

  /**
   * Adds debug nets below a common hierarchical base path.
   * @param base prefix prepended to every path, may be empty
   * @param paths net paths relative to the base
   */
  public Wavetrace addNets(String base, List<String> paths) throws ConfigurationException {
    String prefix = (base == null || base.isEmpty()) ? "" : base + ".";
    for (String path : paths) {
      String full = prefix + path.trim();
      if (NetSpec.countRanges(full) > 1)
        throw new ConfigurationException("Bad net format '" + full + "' (multi-dimensional arrays are not supported)");
      try {
        NetSpec.parse(full);
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException(e.getMessage(), e);
      }
      netPaths.add(full);
    }
    return this;
  }

  public Wavetrace setClockMhz(double clockMhz) {
    this.clockMhz = clockMhz;
    return this;
  }

  public Wavetrace setUartBaud(int uartBaud) {
    this.uartBaud = uartBaud;
    return this;
  }

  public Wavetrace setPreTrigDepth(int preTrigDepth) {
    this.preTrigDepth = preTrigDepth;
    return this;
  }

  public Wavetrace setCaptDepth(int captDepth) {
    this.captDepth = captDepth;
    return this;
  }

  public Wavetrace setOutputDir(Path outputDir) {
    this.outputDir = outputDir;
    return this;
  }

  public Path getOutputDir() { return outputDir; }
  public List<String> getNetPaths() { return List.copyOf(netPaths); }
  public ModuleIndex getModuleIndex() { return index; }

  /**
   * Builds the debug hierarchy, lays out the debug vector and writes the patched sources and the signal list.
   * Files generated by an earlier run are removed from the output directory first. Sources are re-read, so edits made
   * since {@link #addSources(String)} or an earlier run are picked up.
   */
  public GenerationResult generate() throws WavetraceException, IOException {
    checkConfiguration();
    // anchors must come from the text that gets patched
    locator.clear();

    HierarchyBuilder builder = new HierarchyBuilder(locator, index);
    DebugInstance top = builder.createTop(topModule);
    builder.build(top, netPaths);
    int dataBits = LayoutEngine.layout(top);

    logger.info("Debug Net Hierarchy\n-------------------\n{}", top.printTree());
    logger.info("Debug vector is {} bits wide", dataBits);

    cleanOutputDir();
    CaptureInstance capture = new CaptureInstance(dataBits, preTrigDepth, captDepth, clockMhz, uartBaud, clockNet, resetNet);
    List<Path> files = new SourcePatcher(locator, outputDir).patch(top, capture);
    Path signalList = SignalList.write(outputDir, top);
    logger.info("See '{}' for modified verilog files", outputDir);
    return new GenerationResult(top, files, SignalList.paths(top), signalList, dataBits);
  }

  private void checkConfiguration() throws ConfigurationException {
    if (sourcePaths.isEmpty())
      throw new ConfigurationException("Please specify verilog sources using addSources()");
    if (topModule == null)
      throw new ConfigurationException("Please specify a top-level module using setTop()");
    if (resetNet == null)
      throw new ConfigurationException("Please specify a top-level reset net using setReset()");
    if (clockNet == null)
      throw new ConfigurationException("Please specify a top-level clock net using setClock()");
    if (netPaths.isEmpty())
      throw new ConfigurationException("Please specify at least one debug net using addNets()");
    if (clockMhz <= 0)
      throw new ConfigurationException("Invalid clock frequency " + clockMhz + " MHz");
  }

  /**
   * Deletes patched files and the signal list left over from an earlier run.
   */
  void cleanOutputDir() throws IOException {
    if (!Files.isDirectory(outputDir))
      return;
    List<Path> stale;
    try (Stream<Path> list = Files.list(outputDir)) {
      stale = list.filter(file -> Files.isRegularFile(file))
                  .filter(file -> GENERATED_FILE.matcher(file.getFileName().toString()).matches() ||
                                  file.getFileName().toString().equals(SignalList.FILE_NAME))
                  .collect(Collectors.toList());
    }
    for (Path file : stale) {
      logger.debug("Removing stale output {}", file);
      Files.delete(file);
    }
  }

  private static String topLevelNet(String net, String what) throws ConfigurationException {
    if (net == null || net.isBlank())
      throw new ConfigurationException("Empty " + what + " net name");
    if (net.contains("."))
      throw new ConfigurationException("Hierarchical " + what + " nets are not supported yet. Please use a top-level " + what +
                                       " net instead of '" + net + "'");
    return net.trim();
  }

  private static Path expandHome(String path) {
    if (path.equals("~") || path.startsWith("~/"))
      return Paths.get(System.getProperty("user.home") + path.substring(1));
    return Paths.get(path);
  }
}
