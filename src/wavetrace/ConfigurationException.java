package wavetrace;

/**
 * Raised for setup errors that are detected before any source file is touched,
 * e.g. a missing top module, clock or reset, or a malformed net path.
 */
public class ConfigurationException extends WavetraceException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) { super(message); }

  public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}
