package co.oaskcl.core;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on a single raw schema map, run by the tree builder before it interprets the
 * map. Only the keywords the builder lifts are checked; unknown keywords pass through.
 */
public final class SchemaShapeValidator {

  private static final Set<String> NUMERIC = Set.of("minimum", "maximum", "multipleOf");
  private static final Set<String> COUNTS = Set.of(
      "minLength", "maxLength", "minItems", "maxItems", "minProperties", "maxProperties");
  private static final Set<String> SCHEMA_VALUED = Set.of("not", "if", "then", "else");
  private static final Set<String> SCHEMA_LISTS = Set.of("allOf", "anyOf", "oneOf");

  private SchemaShapeValidator() {}

  public static void validate(Map<String, Object> raw, String name) {
    Object ref = raw.get("$ref");
    if (ref != null && !(ref instanceof String)) fail(name, "$ref", "$ref must be a string");

    for (String k : SCHEMA_LISTS) {
      if (!raw.containsKey(k)) continue;
      if (!(raw.get(k) instanceof List)) fail(name, k, k + " must be an array of schemas");
      List<?> l = (List<?>) raw.get(k);
      if (l.isEmpty()) fail(name, k, k + " must not be empty");
      for (Object entry : l) {
        if (!isSchema(entry)) fail(name, k, k + " entries must be schemas");
      }
    }
    for (String k : SCHEMA_VALUED) {
      if (raw.containsKey(k) && !isSchema(raw.get(k))) fail(name, k, k + " must be a schema");
    }

    validateType(raw.get("type"), name);

    checkMapOfSchemas(raw, "properties", name);
    checkMapOfSchemas(raw, "patternProperties", name);

    Object required = raw.get("required");
    if (required != null) {
      // OpenAPI 2 style "required": true on a property is ignored rather than rejected
      if (!(required instanceof Boolean)) {
        if (!(required instanceof List)) fail(name, "required", "required must be an array of property names");
        for (Object r : (List<?>) required) {
          if (!(r instanceof String)) fail(name, "required", "required entries must be strings");
        }
      }
    }

    Object items = raw.get("items");
    if (items != null && !(items instanceof Map) && !(items instanceof List) && !(items instanceof Boolean)) {
      fail(name, "items", "items must be a schema or an array of schemas");
    }
    Object additional = raw.get("additionalProperties");
    if (additional != null && !isSchema(additional)) {
      fail(name, "additionalProperties", "additionalProperties must be a boolean or a schema");
    }

    for (String k : NUMERIC) {
      if (raw.containsKey(k) && !(raw.get(k) instanceof Number)) fail(name, k, k + " must be a number");
    }
    if (raw.get("multipleOf") instanceof Number m && toBigDecimal(m).signum() <= 0) {
      fail(name, "multipleOf", "multipleOf must be greater than 0");
    }
    for (String k : List.of("exclusiveMinimum", "exclusiveMaximum")) {
      Object v = raw.get(k);
      if (v != null && !(v instanceof Number) && !(v instanceof Boolean)) {
        fail(name, k, k + " must be a number or a boolean");
      }
    }
    for (String k : COUNTS) {
      Object v = raw.get(k);
      if (v == null) continue;
      if (!(v instanceof Number n) || !isNonNegativeInteger(n)) {
        fail(name, k, k + " must be a non-negative integer");
      }
    }

    Object pattern = raw.get("pattern");
    if (pattern != null && !(pattern instanceof String)) fail(name, "pattern", "pattern must be a string");
    Object format = raw.get("format");
    if (format != null && !(format instanceof String)) fail(name, "format", "format must be a string");
    Object unique = raw.get("uniqueItems");
    if (unique != null && !(unique instanceof Boolean)) fail(name, "uniqueItems", "uniqueItems must be a boolean");
    if (raw.containsKey("enum") && !(raw.get("enum") instanceof List)) fail(name, "enum", "enum must be an array");
  }

  private static void validateType(Object type, String name) {
    if (type == null) return;
    if (type instanceof String s) {
      if (!NodeType.isValidTypeName(s)) fail(name, "type", "unsupported type " + s);
      return;
    }
    if (type instanceof List<?> l) {
      if (l.isEmpty()) fail(name, "type", "type array must not be empty");
      for (Object t : l) {
        if (!(t instanceof String s) || !NodeType.isValidTypeName(s)) {
          fail(name, "type", "unsupported type " + t);
        }
      }
      return;
    }
    fail(name, "type", "type must be a string or an array of strings");
  }

  private static void checkMapOfSchemas(Map<String, Object> raw, String key, String name) {
    Object v = raw.get(key);
    if (v == null) return;
    if (!(v instanceof Map)) fail(name, key, key + " must be an object");
    for (Map.Entry<?, ?> e : ((Map<?, ?>) v).entrySet()) {
      if (!isSchema(e.getValue())) fail(name, key, key + "." + e.getKey() + " must be a schema");
    }
  }

  private static boolean isSchema(Object v) {
    return v instanceof Map || v instanceof Boolean;
  }

  private static boolean isNonNegativeInteger(Number n) {
    BigDecimal d = toBigDecimal(n);
    return d.signum() >= 0 && d.stripTrailingZeros().scale() <= 0;
  }

  static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal d) return d;
    if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
    return new BigDecimal(n.toString());
  }

  private static void fail(String name, String keyword, String msg) {
    throw new MalformedSchemaException(name, keyword, msg);
  }
}
