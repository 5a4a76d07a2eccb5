package co.oaskcl.core.model;

import co.oaskcl.core.Constraint;
import co.oaskcl.core.NodeType;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One node of the schema IR.
 *
 * <p>The hierarchy is closed; consumers dispatch through {@link SchemaNodeVisitor} so every kind
 * is handled explicitly. Metadata and the constraint table are lifted from {@code raw} at
 * construction, {@code raw} itself is kept for keywords that are not modelled.
 */
public abstract sealed class SchemaNode
    permits ObjectNode, ArrayNode, StringNode, NumericNode, ScalarNode, AnyNode,
        CompositionNode, ConditionalNode, ReferenceNode {

  private final NodeType type;
  private final String schemaName;
  private final Map<String, Object> raw;
  private final Map<Constraint, Object> constraints;

  protected SchemaNode(NodeType type, String schemaName, Map<String, Object> raw) {
    this.type = type;
    this.schemaName = schemaName;
    this.raw = raw == null ? Map.of() : Collections.unmodifiableMap(raw);
    this.constraints = Constraint.extract(this.raw);
  }

  public abstract <R> R accept(SchemaNodeVisitor<R> visitor);

  /** Owned children in a stable order. */
  public abstract List<SchemaNode> children();

  public NodeType type() {
    return type;
  }

  public String schemaName() {
    return schemaName;
  }

  public Map<String, Object> raw() {
    return raw;
  }

  public String title() {
    return stringKeyword("title");
  }

  public String description() {
    return stringKeyword("description");
  }

  public boolean hasDefault() {
    return raw.containsKey("default");
  }

  public Object defaultValue() {
    return raw.get("default");
  }

  public Map<Constraint, Object> constraints() {
    return constraints;
  }

  public boolean has(Constraint c) {
    return constraints.containsKey(c);
  }

  public Optional<Object> constraint(Constraint c) {
    return Optional.ofNullable(constraints.get(c));
  }

  /** True when the raw schema spells out a {@code type}. */
  public boolean typeDeclared() {
    return raw.containsKey("type");
  }

  /** True when {@code type} is an array of type names. */
  public boolean typeUnion() {
    return raw.get("type") instanceof List;
  }

  /** Declared type names, one element for a plain {@code type}, empty when absent. */
  public List<String> declaredTypes() {
    Object t = raw.get("type");
    if (t instanceof String s) return List.of(s);
    if (t instanceof List<?> l) {
      return l.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }
    return List.of();
  }

  private String stringKeyword(String key) {
    Object v = raw.get(key);
    return v instanceof String s ? s : null;
  }

  @Override
  public String toString() {
    return type + "(" + schemaName + ")";
  }
}
