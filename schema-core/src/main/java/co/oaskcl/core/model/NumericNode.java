package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.List;
import java.util.Map;

/** {@code number} or {@code integer}. */
public final class NumericNode extends SchemaNode {

  public NumericNode(NodeType type, String schemaName, Map<String, Object> raw) {
    super(type, schemaName, raw);
    if (type != NodeType.NUMBER && type != NodeType.INTEGER) {
      throw new IllegalArgumentException("not a numeric type: " + type);
    }
  }

  public boolean isInteger() {
    return type() == NodeType.INTEGER;
  }

  @Override
  public List<SchemaNode> children() {
    return List.of();
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitNumeric(this);
  }
}
