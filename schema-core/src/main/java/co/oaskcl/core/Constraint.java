package co.oaskcl.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Validation keywords copied verbatim from a raw schema into a node's constraint table. */
public enum Constraint {
  MINIMUM("minimum"),
  MAXIMUM("maximum"),
  EXCLUSIVE_MINIMUM("exclusiveMinimum"),
  EXCLUSIVE_MAXIMUM("exclusiveMaximum"),
  MULTIPLE_OF("multipleOf"),
  MIN_LENGTH("minLength"),
  MAX_LENGTH("maxLength"),
  PATTERN("pattern"),
  MIN_ITEMS("minItems"),
  MAX_ITEMS("maxItems"),
  UNIQUE_ITEMS("uniqueItems"),
  MIN_PROPERTIES("minProperties"),
  MAX_PROPERTIES("maxProperties"),
  ENUM("enum"),
  CONST("const");

  private final String keyword;

  Constraint(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  /**
   * Copy every constraint keyword present in {@code raw}. An explicit {@code "const": null} is kept
   * since a null constant is meaningful.
   */
  public static Map<Constraint, Object> extract(Map<String, Object> raw) {
    EnumMap<Constraint, Object> out = new EnumMap<>(Constraint.class);
    for (Constraint c : values()) {
      if (raw.containsKey(c.keyword) && (raw.get(c.keyword) != null || c == CONST)) {
        out.put(c, raw.get(c.keyword));
      }
    }
    return Collections.unmodifiableMap(out);
  }
}
