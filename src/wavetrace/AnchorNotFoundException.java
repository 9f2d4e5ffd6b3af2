package wavetrace;

import java.nio.file.Path;

/**
 * Raised when an expected structural anchor (module header, port list, instance, declaration point or endmodule)
 * is missing from a source file. Generation for that file cannot proceed.
 */
public class AnchorNotFoundException extends WavetraceException {
  private static final long serialVersionUID = 1L;

  private final Path file;
  private final String moduleType;
  private final String instanceName;
  private final String operation;

  public AnchorNotFoundException(Path file, String moduleType, String instanceName, String operation) {
    super(describe(file, moduleType, instanceName, operation));
    this.file = file;
    this.moduleType = moduleType;
    this.instanceName = instanceName;
    this.operation = operation;
  }

  public AnchorNotFoundException(Path file, String moduleType, String operation) { this(file, moduleType, null, operation); }

  private static String describe(Path file, String moduleType, String instanceName, String operation) {
    String what = (instanceName == null) ? "module '" + moduleType + "'"
                                         : "instance '" + instanceName + "' in module '" + moduleType + "'";
    return operation + ": failed to locate " + what + " in file '" + file + "'";
  }

  public Path getFile() { return file; }
  public String getModuleType() { return moduleType; }
  /** @return the instance name, or null for module level anchors */
  public String getInstanceName() { return instanceName; }
  public String getOperation() { return operation; }
}
