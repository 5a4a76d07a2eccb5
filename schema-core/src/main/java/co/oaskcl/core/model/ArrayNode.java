package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ArrayNode extends SchemaNode {

  private final SchemaNode items;

  public ArrayNode(String schemaName, Map<String, Object> raw, SchemaNode items) {
    super(NodeType.ARRAY, schemaName, raw);
    this.items = items;
  }

  /** Empty for an untyped list. */
  public Optional<SchemaNode> items() {
    return Optional.ofNullable(items);
  }

  @Override
  public List<SchemaNode> children() {
    return items == null ? List.of() : List.of(items);
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitArray(this);
  }
}
