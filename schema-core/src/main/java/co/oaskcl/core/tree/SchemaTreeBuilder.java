package co.oaskcl.core.tree;

import co.oaskcl.core.Constraint;
import co.oaskcl.core.Diagnostic;
import co.oaskcl.core.MalformedSchemaException;
import co.oaskcl.core.NodeType;
import co.oaskcl.core.SchemaShapeValidator;
import co.oaskcl.core.model.AnyNode;
import co.oaskcl.core.model.ArrayNode;
import co.oaskcl.core.model.CompositionNode;
import co.oaskcl.core.model.ConditionalNode;
import co.oaskcl.core.model.NumericNode;
import co.oaskcl.core.model.ObjectNode;
import co.oaskcl.core.model.ReferenceNode;
import co.oaskcl.core.model.ScalarNode;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.core.model.StringNode;
import co.oaskcl.core.naming.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the IR from raw schema maps.
 *
 * <p>Keywords are checked in a fixed order: {@code $ref}, then {@code allOf}/{@code anyOf}/
 * {@code oneOf}, then {@code not}, then {@code if}, then {@code type}. References are never
 * followed here. A raw map met again while it is still on the recursion stack becomes a
 * back-reference to the ancestor, so structurally cyclic input terminates.
 *
 * <p>Malformed fragments never abort the build: the fragment becomes an {@link AnyNode} and a
 * diagnostic is recorded on the context.
 */
public final class SchemaTreeBuilder {

  private static final Logger log = LoggerFactory.getLogger(SchemaTreeBuilder.class);

  private static final List<String> COMPOSITIONS = List.of("allOf", "anyOf", "oneOf");
  private static final Set<String> CONDITIONAL_KEYS = Set.of("if", "then", "else");
  private static final Set<String> OBJECT_KEYWORDS = Set.of(
      "properties", "patternProperties", "additionalProperties", "required", "minProperties", "maxProperties");
  private static final Set<String> ARRAY_KEYWORDS = Set.of("items", "minItems", "maxItems", "uniqueItems");
  private static final Set<String> STRING_KEYWORDS = Set.of("minLength", "maxLength", "pattern", "format");
  private static final Set<String> NUMERIC_KEYWORDS = Set.of(
      "minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum", "multipleOf");
  private static final Set<String> SCHEMA_KEYWORDS;

  static {
    Set<String> keys = new LinkedHashSet<>(OBJECT_KEYWORDS);
    keys.addAll(List.of("type", "items", "format", "$ref", "allOf", "anyOf", "oneOf", "not", "if"));
    for (Constraint c : Constraint.values()) keys.add(c.keyword());
    SCHEMA_KEYWORDS = Set.copyOf(keys);
  }

  /** Build a tree in a fresh context. */
  public SchemaNode build(Map<String, Object> raw, String name) {
    return build(raw, name, new BuildContext());
  }

  /**
   * Build a tree, sharing {@code ctx} with earlier calls of the same run.
   *
   * @param raw  the schema map (or a boolean schema)
   * @param name the candidate schema name, formatted and made unique
   * @param ctx  run state: visited raw objects, names, diagnostics
   */
  public SchemaNode build(Object raw, String name, BuildContext ctx) {
    return buildAt(raw, name, ctx, 0);
  }

  // ===== Dispatch =====

  private SchemaNode buildAt(Object rawValue, String candidate, BuildContext ctx, int depth) {
    if (rawValue instanceof Boolean b) {
      return buildBoolean(b, candidate, ctx);
    }
    if (!(rawValue instanceof Map)) {
      String name = ctx.claimName(candidate);
      ctx.report(Diagnostic.Kind.MALFORMED_SCHEMA, name, "schema must be an object or a boolean");
      return registered(new AnyNode(name, Map.of()), ctx);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> raw = (Map<String, Object>) rawValue;

    var previous = ctx.nameOf(raw);
    if (previous.isPresent()) {
      String name = ctx.claimName(candidate);
      if (ctx.isInProgress(raw)) {
        log.debug("Cycle at {}: referring back to {}", name, previous.get());
      } else {
        log.debug("Schema object reused at {}: referring to {}", name, previous.get());
      }
      return registered(ReferenceNode.backReference(name, raw, previous.get()), ctx);
    }

    String name = ctx.claimName(candidate);
    if (depth > ctx.maxDepth()) {
      ctx.report(Diagnostic.Kind.DEPTH_LIMIT, name, "nesting deeper than " + ctx.maxDepth() + " levels, left unconstrained");
      return registered(new AnyNode(name, raw), ctx);
    }

    ctx.enter(raw, name);
    SchemaNode node;
    try {
      SchemaShapeValidator.validate(raw, name);
      node = interpret(raw, name, ctx, depth);
    } catch (MalformedSchemaException e) {
      ctx.report(Diagnostic.Kind.MALFORMED_SCHEMA, name, e.getMessage());
      node = new AnyNode(name, raw);
    } finally {
      ctx.exit(raw);
    }
    log.debug("Built {}", node);
    return registered(node, ctx);
  }

  private SchemaNode interpret(Map<String, Object> raw, String name, BuildContext ctx, int depth) {
    if (raw.get("$ref") instanceof String ref) {
      return ReferenceNode.pointer(name, raw, ref);
    }
    for (String keyword : COMPOSITIONS) {
      if (raw.get(keyword) instanceof List<?> entries) {
        return buildComposition(keyword, entries, raw, name, ctx, depth);
      }
    }
    if (raw.containsKey("not")) {
      SchemaNode child = buildAt(raw.get("not"), name + "_not", ctx, depth + 1);
      SchemaNode base = buildBase(raw, Set.of("not"), name, ctx, depth);
      return new CompositionNode(NodeType.NOT, name, raw, List.of(child), base);
    }
    if (raw.containsKey("if")) {
      return buildConditional(raw, name, ctx, depth);
    }
    return buildTyped(raw, name, ctx, depth);
  }

  // ===== Composition =====

  private SchemaNode buildComposition(String keyword, List<?> entries, Map<String, Object> raw,
                                      String name, BuildContext ctx, int depth) {
    NodeType kind = switch (keyword) {
      case "allOf" -> NodeType.ALL_OF;
      case "anyOf" -> NodeType.ANY_OF;
      default -> NodeType.ONE_OF;
    };
    List<SchemaNode> subs = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      subs.add(buildAt(entries.get(i), name + "_" + keyword + "_" + i, ctx, depth + 1));
    }
    SchemaNode base = buildBase(raw, Set.of(keyword), name, ctx, depth);
    return new CompositionNode(kind, name, raw, subs, base);
  }

  private SchemaNode buildConditional(Map<String, Object> raw, String name, BuildContext ctx, int depth) {
    SchemaNode condition = buildAt(raw.get("if"), name + "_if", ctx, depth + 1);
    SchemaNode then = raw.containsKey("then") ? buildAt(raw.get("then"), name + "_then", ctx, depth + 1) : null;
    SchemaNode otherwise = raw.containsKey("else") ? buildAt(raw.get("else"), name + "_else", ctx, depth + 1) : null;
    SchemaNode base = buildBase(raw, CONDITIONAL_KEYS, name, ctx, depth);
    return new ConditionalNode(name, raw, condition, then, otherwise, base);
  }

  /**
   * Sibling keywords of a composition, built as their own node. Null when the siblings are only
   * annotations.
   */
  private SchemaNode buildBase(Map<String, Object> raw, Set<String> consumed, String name,
                               BuildContext ctx, int depth) {
    Map<String, Object> rest = new LinkedHashMap<>();
    boolean structural = false;
    for (Map.Entry<String, Object> e : raw.entrySet()) {
      if (consumed.contains(e.getKey())) continue;
      rest.put(e.getKey(), e.getValue());
      structural |= SCHEMA_KEYWORDS.contains(e.getKey());
    }
    return structural ? buildAt(rest, name + "_base", ctx, depth + 1) : null;
  }

  // ===== Typed nodes =====

  private SchemaNode buildTyped(Map<String, Object> raw, String name, BuildContext ctx, int depth) {
    NodeType type = resolveType(raw);
    return switch (type) {
      case OBJECT -> buildObject(raw, name, ctx, depth);
      case ARRAY -> buildArray(raw, name, ctx, depth);
      case STRING -> new StringNode(name, raw);
      case NUMBER, INTEGER -> new NumericNode(type, name, raw);
      case BOOLEAN, NULL -> new ScalarNode(type, name, raw);
      default -> throw new IllegalStateException("unexpected type " + type);
    };
  }

  /**
   * The node kind for a raw schema without composition keywords. A type array uses its first
   * element. Without {@code type}, the kind follows the first keyword family present (object, then
   * array, string and numeric keywords), then the {@code enum}/{@code const} literals when they
   * agree; no hint at all means object.
   */
  static NodeType resolveType(Map<String, Object> raw) {
    Object type = raw.get("type");
    if (type instanceof String s) {
      return NodeType.fromTypeName(s).orElse(NodeType.OBJECT);
    }
    if (type instanceof List<?> l && !l.isEmpty() && l.get(0) instanceof String first) {
      return NodeType.fromTypeName(first).orElse(NodeType.OBJECT);
    }
    if (hasAny(raw, OBJECT_KEYWORDS)) return NodeType.OBJECT;
    if (hasAny(raw, ARRAY_KEYWORDS)) return NodeType.ARRAY;
    if (hasAny(raw, STRING_KEYWORDS)) return NodeType.STRING;
    if (hasAny(raw, NUMERIC_KEYWORDS)) return NodeType.NUMBER;

    List<Object> literals = new ArrayList<>();
    if (raw.get("enum") instanceof List<?> values) literals.addAll(values);
    if (raw.containsKey("const")) literals.add(raw.get("const"));
    NodeType inferred = null;
    for (Object v : literals) {
      NodeType t = literalType(v);
      if (inferred == null || inferred == t) {
        inferred = t;
      } else if (isNumeric(inferred) && isNumeric(t)) {
        inferred = NodeType.NUMBER;
      } else {
        return NodeType.OBJECT;
      }
    }
    return inferred == null ? NodeType.OBJECT : inferred;
  }

  private static boolean hasAny(Map<String, Object> raw, Set<String> keywords) {
    for (String k : keywords) {
      if (raw.containsKey(k)) return true;
    }
    return false;
  }

  private static NodeType literalType(Object v) {
    if (v == null) return NodeType.NULL;
    if (v instanceof String) return NodeType.STRING;
    if (v instanceof Boolean) return NodeType.BOOLEAN;
    if (v instanceof Integer || v instanceof Long || v instanceof java.math.BigInteger) return NodeType.INTEGER;
    if (v instanceof Number) return NodeType.NUMBER;
    if (v instanceof List) return NodeType.ARRAY;
    return NodeType.OBJECT;
  }

  private static boolean isNumeric(NodeType t) {
    return t == NodeType.NUMBER || t == NodeType.INTEGER;
  }

  private SchemaNode buildObject(Map<String, Object> raw, String name, BuildContext ctx, int depth) {
    Map<String, SchemaNode> properties = new LinkedHashMap<>();
    if (raw.get("properties") instanceof Map<?, ?> props) {
      for (Map.Entry<?, ?> e : props.entrySet()) {
        String prop = String.valueOf(e.getKey());
        properties.put(prop, buildAt(e.getValue(), name + "_" + prop, ctx, depth + 1));
      }
    }

    Map<String, SchemaNode> patternProperties = new LinkedHashMap<>();
    if (raw.get("patternProperties") instanceof Map<?, ?> patterns) {
      for (Map.Entry<?, ?> e : patterns.entrySet()) {
        String pattern = String.valueOf(e.getKey());
        String childName = name + "_pattern_" + Identifiers.sanitizePattern(pattern);
        patternProperties.put(pattern, buildAt(e.getValue(), childName, ctx, depth + 1));
      }
    }

    Set<String> required = new LinkedHashSet<>();
    if (raw.get("required") instanceof List<?> names) {
      for (Object r : names) required.add((String) r);
    }

    Object additional = raw.get("additionalProperties");
    boolean forbidden = Boolean.FALSE.equals(additional);
    SchemaNode additionalSchema = additional instanceof Map
        ? buildAt(additional, name + "_additionalProperties", ctx, depth + 1)
        : null;

    return new ObjectNode(name, raw, properties, patternProperties, required, forbidden, additionalSchema);
  }

  private SchemaNode buildArray(Map<String, Object> raw, String name, BuildContext ctx, int depth) {
    Object items = raw.get("items");
    SchemaNode child = null;
    if (items instanceof Map || items instanceof Boolean) {
      child = buildAt(items, name + "_items", ctx, depth + 1);
    } else if (items instanceof List) {
      // tuple validation is not modelled; the list stays untyped
      log.debug("{}: positional items treated as an untyped list", name);
    }
    return new ArrayNode(name, raw, child);
  }

  private SchemaNode buildBoolean(boolean accept, String candidate, BuildContext ctx) {
    String name = ctx.claimName(candidate);
    if (accept) {
      return registered(new AnyNode(name, Map.of()), ctx);
    }
    SchemaNode everything = registered(new AnyNode(ctx.claimName(name + "_not"), Map.of()), ctx);
    return registered(new CompositionNode(NodeType.NOT, name, Map.of(), List.of(everything), null), ctx);
  }

  private static SchemaNode registered(SchemaNode node, BuildContext ctx) {
    ctx.register(node);
    return node;
  }
}
