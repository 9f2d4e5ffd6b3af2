package wavetrace.parser;

/**
 * Result of looking up a net declaration.
 */
public enum NetKind {
  SCALAR,
  VECTOR,
  NOT_FOUND
}
