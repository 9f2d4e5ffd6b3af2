package wavetrace.parser;

import java.nio.file.Path;
import wavetrace.WavetraceException;

/**
 * Raised when a source file cannot be split into tokens, e.g. because of an unterminated comment or string.
 */
public class VerilogParseException extends WavetraceException {
  private static final long serialVersionUID = 1L;

  private final Path file;
  private final int line;

  public VerilogParseException(Path file, int line, String message) {
    super(((file == null) ? "<text>" : file.toString()) + ":" + line + ": " + message);
    this.file = file;
    this.line = line;
  }

  public Path getFile() { return file; }
  public int getLine() { return line; }
}
