package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class StringNode extends SchemaNode {

  public StringNode(String schemaName, Map<String, Object> raw) {
    super(NodeType.STRING, schemaName, raw);
  }

  public Optional<String> format() {
    return raw().get("format") instanceof String f && !f.isEmpty() ? Optional.of(f) : Optional.empty();
  }

  @Override
  public List<SchemaNode> children() {
    return List.of();
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitString(this);
  }
}
