package co.oaskcl.core.naming;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure name transforms shared by the tree builder and the generators.
 *
 * <p>{@link #sanitizeProperty(String)} produces attribute names that are legal KCL identifiers,
 * {@link #formatSchemaName(String)} produces PascalCase schema names.
 */
public final class Identifiers {

  public static final String PROPERTY_PLACEHOLDER = "property";
  public static final String SCHEMA_PLACEHOLDER = "Schema";
  public static final String PATTERN_PLACEHOLDER = "pattern";

  // KCL keywords and builtin literals that cannot be used as attribute names
  private static final Set<String> RESERVED = Set.of(
      "import", "as", "rule", "schema", "mixin", "protocol", "check", "for", "assert",
      "if", "elif", "else", "or", "and", "not", "in", "is", "lambda", "all", "any",
      "filter", "map", "type", "True", "False", "None", "Undefined");

  private static final Pattern SEGMENT_SEPARATORS = Pattern.compile("[\\s\\-_@]+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]");

  private Identifiers() {}

  public static String sanitizeProperty(String name) {
    if (name == null || name.isEmpty()) return PROPERTY_PLACEHOLDER;

    StringBuilder out = new StringBuilder(name.length() + 1);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      out.append(isIdentifierChar(c) ? c : '_');
    }
    if (Character.isDigit(out.charAt(0))) out.insert(0, '_');

    String sanitized = out.toString();
    return RESERVED.contains(sanitized) ? sanitized + "_" : sanitized;
  }

  public static String formatSchemaName(String name) {
    if (name == null) return SCHEMA_PLACEHOLDER;

    StringBuilder out = new StringBuilder(name.length());
    for (String segment : SEGMENT_SEPARATORS.split(name)) {
      if (segment.isEmpty()) continue;
      out.append(Character.toUpperCase(segment.charAt(0))).append(segment.substring(1));
    }
    String formatted = NON_ALPHANUMERIC.matcher(out).replaceAll("");
    if (formatted.isEmpty()) return SCHEMA_PLACEHOLDER;
    // schema names must start with a letter
    return Character.isDigit(formatted.charAt(0)) ? SCHEMA_PLACEHOLDER + formatted : formatted;
  }

  /** Label used when naming a patternProperties child after its regex. */
  public static String sanitizePattern(String pattern) {
    if (pattern == null || pattern.isEmpty()) return PATTERN_PLACEHOLDER;

    StringBuilder out = new StringBuilder(pattern.length() + 1);
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      out.append(c < 128 && Character.isLetterOrDigit(c) ? c : '_');
    }
    if (Character.isDigit(out.charAt(0))) out.insert(0, '_');
    return out.toString();
  }

  /**
   * Last segment of a local JSON pointer such as {@code #/definitions/Pet}, with {@code ~1} and
   * {@code ~0} unescaped.
   */
  public static String refName(String ref) {
    if (ref == null || ref.isEmpty()) return "";
    int slash = ref.lastIndexOf('/');
    String last = slash >= 0 ? ref.substring(slash + 1) : ref;
    return last.replace("~1", "/").replace("~0", "~");
  }

  private static boolean isIdentifierChar(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
  }
}
