package co.oaskcl.core;

/** A keyword is present with a shape the builder cannot interpret. */
public class MalformedSchemaException extends IllegalArgumentException {

  private final String schemaName;
  private final String keyword;

  public MalformedSchemaException(String schemaName, String keyword, String message) {
    super(schemaName + ": " + message);
    this.schemaName = schemaName;
    this.keyword = keyword;
  }

  public String schemaName() {
    return schemaName;
  }

  /** The offending keyword, or null when the schema itself has the wrong shape. */
  public String keyword() {
    return keyword;
  }
}
