package co.oaskcl.core;

/**
 * A problem recorded during a build or generation run. Only {@link Kind#UNRESOLVED_REFERENCE} is
 * an error; every other kind is a warning the run recovered from.
 */
public record Diagnostic(Kind kind, String schemaName, String message) {

  public enum Kind {
    MALFORMED_SCHEMA,
    UNRESOLVED_REFERENCE,
    UNSUPPORTED_REGEX,
    NAME_COLLISION,
    DEPTH_LIMIT;

    public boolean isError() {
      return this == UNRESOLVED_REFERENCE;
    }
  }

  public boolean isError() {
    return kind.isError();
  }

  @Override
  public String toString() {
    return kind + " [" + schemaName + "] " + message;
  }
}
