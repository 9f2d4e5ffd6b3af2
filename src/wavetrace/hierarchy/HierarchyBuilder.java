package wavetrace.hierarchy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavetrace.AnchorNotFoundException;
import wavetrace.ConfigurationException;
import wavetrace.ResolutionException;
import wavetrace.ResolutionException.Kind;
import wavetrace.WavetraceException;
import wavetrace.parser.InstanceAnchor;
import wavetrace.parser.ModuleIndex;
import wavetrace.parser.NetKind;
import wavetrace.parser.VerilogLocator;
import wavetrace.util.NetSpec;

/**
 * Turns a list of net paths into a tree of {@link DebugInstance}s below the top module.
 * Paths are processed in the given order and children and nets are appended in traversal order.
 */
public class HierarchyBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final VerilogLocator locator;
  private final ModuleIndex index;
  private final DedupCounter dedupCounter;

  public HierarchyBuilder(VerilogLocator locator, ModuleIndex index, DedupCounter dedupCounter) {
    this.locator = locator;
    this.index = index;
    this.dedupCounter = dedupCounter;
  }

  public HierarchyBuilder(VerilogLocator locator, ModuleIndex index) { this(locator, index, new DedupCounter()); }

  /**
   * Creates the root instance for the top module. The top takes the first variant id of its file.
   */
  public DebugInstance createTop(String moduleType) throws ResolutionException {
    Path file = index.resolve(moduleType);
    return new DebugInstance(DebugInstance.TOP_NAME, moduleType, file, dedupCounter.next(file), true);
  }

  /**
   * Builds the whole tree below a top instance.
   * @param top root created by {@link #createTop(String)}
   * @param netPaths net paths relative to the top module, in capture order
   */
  public DebugInstance build(DebugInstance top, List<String> netPaths) throws WavetraceException, IOException {
    for (String path : netPaths)
      addNet(top, path);
    return top;
  }

  /**
   * Adds one net path to the tree, creating the instances along the path that do not exist yet.
   * @return the created net
   */
  public DebugNet addNet(DebugInstance top, String path) throws WavetraceException, IOException {
    NetSpec spec;
    try {
      spec = NetSpec.parse(path);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
    DebugInstance current = top;
    for (String segment : spec.getHierarchy()) {
      Optional<DebugInstance> existing = current.getChild(segment);
      if (existing.isPresent()) {
        current = existing.get();
      } else {
        DebugInstance child = createChild(current, segment, spec);
        current.addChild(child);
        current = child;
      }
    }
    DebugNet net = createNet(current, spec);
    current.addNet(net);
    return net;
  }

  private DebugInstance createChild(DebugInstance parent, String instanceName, NetSpec spec) throws WavetraceException, IOException {
    InstanceAnchor anchor;
    try {
      anchor = locator.findInstance(parent.getSourceFile(), parent.getModuleType(), instanceName);
    } catch (AnchorNotFoundException e) {
      ResolutionException failure = new ResolutionException(
          Kind.UNKNOWN_INSTANCE, instanceName, List.of(parent.getSourceFile()),
          "Failed to locate instance '" + instanceName + "' in file '" + parent.getSourceFile() + "', as specified by net '" + spec + "'");
      failure.initCause(e);
      throw failure;
    }
    String moduleType = anchor.getInstanceType();
    if (!index.contains(moduleType))
      throw new ResolutionException(Kind.UNKNOWN_MODULE, moduleType,
                                    "Cannot find module '" + moduleType + "' for instance '" + instanceName + "' needed for net '" +
                                        spec + "'. Check that its source has been added with addSources()");
    Path file = index.resolve(moduleType);
    DebugInstance child = new DebugInstance(instanceName, moduleType, file, dedupCounter.next(file), false);
    logger.debug("New debug instance {} in {}", child, parent.getInstanceName());
    return child;
  }

  private DebugNet createNet(DebugInstance owner, NetSpec spec) throws WavetraceException, IOException {
    String netName = spec.getBaseName();
    logger.info("Adding debug net '{}'", spec);
    NetKind kind = locator.classifyNet(owner.getSourceFile(), owner.getModuleType(), netName);
    switch (kind) {
    case NOT_FOUND:
      throw new ResolutionException(Kind.UNKNOWN_NET, spec.getPath(), List.of(owner.getSourceFile()),
                                    "Unable to locate net '" + netName + "' in file '" + owner.getSourceFile() + "'");
    case VECTOR:
      if (!spec.hasRange())
        throw new ResolutionException(Kind.AMBIGUOUS_WIDTH, spec.getPath(), List.of(owner.getSourceFile()),
                                      "Unable to extract bit range from net name '" + spec +
                                          "', please append '[x:y]' or '[x]' to all multi-bit nets");
      return new DebugNet(spec, true);
    case SCALAR:
    default:
      if (spec.hasRange())
        throw new ResolutionException(Kind.AMBIGUOUS_WIDTH, spec.getPath(), List.of(owner.getSourceFile()),
                                      "Net '" + spec + "' selects a bit range but '" + netName + "' is declared as a single bit");
      return new DebugNet(spec, false);
    }
  }
}
