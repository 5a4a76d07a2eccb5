package co.oaskcl.core;

import java.util.Map;

/** What kind of document a loaded schema file is, judged from its top-level markers. */
public enum DocumentKind {
  OPENAPI_2("OpenAPI 2.0"),
  OPENAPI_3_0("OpenAPI 3.0"),
  OPENAPI_3_1("OpenAPI 3.1"),
  JSON_SCHEMA_DRAFT_4("JSON Schema Draft 4"),
  JSON_SCHEMA_DRAFT_6("JSON Schema Draft 6"),
  JSON_SCHEMA_DRAFT_7("JSON Schema Draft 7"),
  JSON_SCHEMA_2019_09("JSON Schema 2019-09"),
  JSON_SCHEMA_2020_12("JSON Schema 2020-12"),
  JSON_SCHEMA("JSON Schema"),
  UNKNOWN("Unknown format");

  private final String label;

  DocumentKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public boolean isOpenApi() {
    return this == OPENAPI_2 || this == OPENAPI_3_0 || this == OPENAPI_3_1;
  }

  public static DocumentKind detect(Map<String, Object> doc) {
    if ("2.0".equals(doc.get("swagger"))) return OPENAPI_2;

    if (doc.get("openapi") instanceof String v) {
      if (v.startsWith("3.0")) return OPENAPI_3_0;
      if (v.startsWith("3.1")) return OPENAPI_3_1;
    }

    if (doc.get("$schema") instanceof String uri) {
      if (uri.contains("draft-04")) return JSON_SCHEMA_DRAFT_4;
      if (uri.contains("draft-06")) return JSON_SCHEMA_DRAFT_6;
      if (uri.contains("draft-07")) return JSON_SCHEMA_DRAFT_7;
      if (uri.contains("2019-09")) return JSON_SCHEMA_2019_09;
      if (uri.contains("2020-12")) return JSON_SCHEMA_2020_12;
      return JSON_SCHEMA;
    }
    return UNKNOWN;
  }
}
