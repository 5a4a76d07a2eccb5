package co.oaskcl.core.model;

import co.oaskcl.core.DocumentKind;
import co.oaskcl.core.naming.Identifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A loaded schema document: the raw top-level map plus the tables the generator needs from it.
 */
public final class SchemaDocument {

  /** A named entry of a definitions table. */
  public record Definition(String pointer, String name, Object raw) {}

  private static final String DEFINITIONS_PREFIX = "#/definitions/";
  private static final String DEFS_PREFIX = "#/$defs/";
  private static final String COMPONENTS_PREFIX = "#/components/schemas/";

  private final Map<String, Object> raw;
  private final DocumentKind kind;
  private final String source;

  public SchemaDocument(Map<String, Object> raw, String source) {
    this.raw = Collections.unmodifiableMap(raw);
    this.kind = DocumentKind.detect(raw);
    this.source = source;
  }

  public static SchemaDocument of(Map<String, Object> raw) {
    return new SchemaDocument(raw, null);
  }

  public Map<String, Object> raw() {
    return raw;
  }

  public DocumentKind kind() {
    return kind;
  }

  /** File the document was read from, or null when built in memory. */
  public String source() {
    return source;
  }

  /**
   * Name of the main schema: its {@code title}, else the base name of {@code $id}, else
   * {@code Schema}; always formatted as a schema name.
   */
  public String rootName() {
    if (raw.get("title") instanceof String t && !t.isBlank()) {
      return Identifiers.formatSchemaName(t);
    }
    if (raw.get("$id") instanceof String id && !id.isBlank()) {
      String base = id;
      int hash = base.indexOf('#');
      if (hash >= 0) base = base.substring(0, hash);
      int slash = base.lastIndexOf('/');
      if (slash >= 0) base = base.substring(slash + 1);
      int dot = base.indexOf('.');
      if (dot > 0) base = base.substring(0, dot);
      return Identifiers.formatSchemaName(base);
    }
    return Identifiers.SCHEMA_PLACEHOLDER;
  }

  /**
   * Every entry of {@code definitions}, {@code $defs} and {@code components.schemas}, in document
   * order.
   */
  public List<Definition> definitions() {
    List<Definition> out = new ArrayList<>();
    collect(raw.get("definitions"), DEFINITIONS_PREFIX, out);
    collect(raw.get("$defs"), DEFS_PREFIX, out);
    if (raw.get("components") instanceof Map<?, ?> components) {
      collect(components.get("schemas"), COMPONENTS_PREFIX, out);
    }
    return out;
  }

  /**
   * True when the document itself is a schema rather than only a container of definitions, as
   * an OpenAPI document is.
   */
  public boolean hasRootSchema() {
    if (kind.isOpenApi()) return false;
    for (String k : List.of("type", "properties", "items", "$ref", "allOf", "anyOf", "oneOf", "not", "if", "enum", "const")) {
      if (raw.containsKey(k)) return true;
    }
    return definitions().isEmpty();
  }

  private static void collect(Object table, String prefix, List<Definition> out) {
    if (!(table instanceof Map<?, ?> entries)) return;
    for (Map.Entry<?, ?> e : entries.entrySet()) {
      String name = String.valueOf(e.getKey());
      out.add(new Definition(prefix + escapePointer(name), name, e.getValue()));
    }
  }

  private static String escapePointer(String name) {
    return name.replace("~", "~0").replace("/", "~1");
  }
}
