package wavetrace;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when a module, instance or net named by the setup cannot be mapped onto the registered sources.
 */
public class ResolutionException extends WavetraceException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    UNKNOWN_MODULE,
    AMBIGUOUS_MODULE,
    UNKNOWN_INSTANCE,
    UNKNOWN_NET,
    AMBIGUOUS_WIDTH
  }

  private final Kind kind;
  private final String name;
  private final List<Path> files;

  public ResolutionException(Kind kind, String name, List<Path> files, String message) {
    super(message);
    this.kind = kind;
    this.name = name;
    this.files = Collections.unmodifiableList(new ArrayList<>(files));
  }

  public ResolutionException(Kind kind, String name, String message) { this(kind, name, List.of(), message); }

  public Kind getKind() { return kind; }

  /** The module type, instance name or net path that failed to resolve. */
  public String getName() { return name; }

  /** Files involved in the failure, e.g. every file defining an ambiguous module. */
  public List<Path> getFiles() { return files; }
}
