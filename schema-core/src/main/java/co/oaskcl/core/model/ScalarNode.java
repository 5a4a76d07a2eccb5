package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.List;
import java.util.Map;

/** {@code boolean} or {@code null}. */
public final class ScalarNode extends SchemaNode {

  public ScalarNode(NodeType type, String schemaName, Map<String, Object> raw) {
    super(type, schemaName, raw);
    if (type != NodeType.BOOLEAN && type != NodeType.NULL) {
      throw new IllegalArgumentException("not a scalar type: " + type);
    }
  }

  @Override
  public List<SchemaNode> children() {
    return List.of();
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitScalar(this);
  }
}
