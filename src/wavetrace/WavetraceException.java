package wavetrace;

/**
 * Base class of all errors that abort a generation run.
 */
public class WavetraceException extends Exception {
  private static final long serialVersionUID = 1L;

  public WavetraceException(String message) { super(message); }

  public WavetraceException(String message, Throwable cause) { super(message, cause); }
}
