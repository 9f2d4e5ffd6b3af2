package wavetrace.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavetrace.ConfigurationException;
import wavetrace.ResolutionException;
import wavetrace.ResolutionException.Kind;

/**
 * Maps module types to the files that define them.
 * Definitions are collected without deduplication; a module type defined more than once is only reported when it is
 * resolved.
 */
public class ModuleIndex {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static class Definition {
    final String moduleType;
    final Path file;
    Definition(String moduleType, Path file) {
      this.moduleType = moduleType;
      this.file = file;
    }
  }

  private final VerilogLocator locator;
  private final List<Definition> definitions = new ArrayList<>();

  public ModuleIndex(VerilogLocator locator) { this.locator = locator; }

  /**
   * Adds a Verilog source file, or all .v/.sv files below a directory. Files and directories starting with '.' are
   * skipped. A file that cannot be tokenized or that holds no module is skipped with a warning.
   * @param path a file or a directory
   * @return the number of module definitions found
   * @throws ConfigurationException if the path is neither a file nor a directory
   * @throws IOException if walking the directory or reading a file fails
   */
  public int register(Path path) throws ConfigurationException, IOException {
    List<Path> files = collectSources(path);
    int numFound = 0;
    for (Path file : files) {
      List<String> modules;
      try {
        modules = locator.listModules(file);
      } catch (VerilogParseException e) {
        logger.warn("Skipping unparsable file '{}': {}", file, e.getMessage());
        continue;
      }
      if (modules.isEmpty()) {
        logger.warn("Unable to locate verilog module in file '{}'", file);
        continue;
      }
      for (String moduleType : modules) {
        logger.trace("Found module {} in {}", moduleType, file);
        definitions.add(new Definition(moduleType, file));
        numFound++;
      }
    }
    logger.info("Found {} modules in {} verilog files below '{}'", numFound, files.size(), path);
    return numFound;
  }

  /**
   * Removes every definition registered from the given file, or from any file below the given directory.
   * @return the number of definitions removed
   */
  public int unregister(Path path) {
    Path root = path.toAbsolutePath().normalize();
    int before = definitions.size();
    definitions.removeIf(def -> def.file.toAbsolutePath().normalize().startsWith(root));
    int removed = before - definitions.size();
    logger.info("Removed {} module definitions from '{}'", removed, path);
    return removed;
  }

  /**
   * Returns the single file defining a module type.
   * @throws ResolutionException UNKNOWN_MODULE if no file defines it, AMBIGUOUS_MODULE if several do
   */
  public Path resolve(String moduleType) throws ResolutionException {
    List<Path> matches = definitionsOf(moduleType);
    if (matches.isEmpty())
      throw new ResolutionException(Kind.UNKNOWN_MODULE, moduleType, "Cannot find module '" + moduleType + "' in the registered sources");
    if (matches.size() > 1)
      throw new ResolutionException(Kind.AMBIGUOUS_MODULE, moduleType, matches,
                                    "Found multiple definitions for module '" + moduleType + "' in these files: " +
                                        matches.stream().map(Path::toString).collect(Collectors.joining(", ")) +
                                        ". Exclude source files or directories with removeSources()");
    return matches.get(0);
  }

  /** True if at least one registered file defines the module type. */
  public boolean contains(String moduleType) { return !definitionsOf(moduleType).isEmpty(); }

  /** Number of registered definitions, duplicates included. */
  public int size() { return definitions.size(); }

  public boolean isEmpty() { return definitions.isEmpty(); }

  private List<Path> definitionsOf(String moduleType) {
    return definitions.stream().filter(def -> def.moduleType.equals(moduleType)).map(def -> def.file).collect(Collectors.toList());
  }

  static List<Path> collectSources(Path path) throws ConfigurationException, IOException {
    if (Files.isRegularFile(path))
      return List.of(path);
    if (!Files.isDirectory(path))
      throw new ConfigurationException("Invalid path or directory '" + path + "'");
    try (Stream<Path> walk = Files.walk(path)) {
      return walk.filter(file -> Files.isRegularFile(file))
          .filter(file -> !isHidden(path, file))
          .filter(file -> file.getFileName().toString().endsWith(".v") || file.getFileName().toString().endsWith(".sv"))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private static boolean isHidden(Path root, Path file) {
    for (Path part : root.relativize(file)) {
      if (part.toString().startsWith("."))
        return true;
    }
    return false;
  }
}
