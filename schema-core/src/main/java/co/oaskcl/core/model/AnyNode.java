package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.List;
import java.util.Map;

/** Accepts any value. Stands in for {@code true} schemas and for fragments that failed to build. */
public final class AnyNode extends SchemaNode {

  public AnyNode(String schemaName, Map<String, Object> raw) {
    super(NodeType.ANY, schemaName, raw);
  }

  @Override
  public List<SchemaNode> children() {
    return List.of();
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitAny(this);
  }
}
