package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@code allOf}, {@code anyOf}, {@code oneOf} or {@code not}.
 *
 * <p>The optional base holds sibling keywords of the composition (for example {@code properties}
 * next to {@code allOf}); it applies conjunctively.
 */
public final class CompositionNode extends SchemaNode {

  private static final Set<NodeType> KINDS = EnumSet.of(NodeType.ALL_OF, NodeType.ANY_OF, NodeType.ONE_OF, NodeType.NOT);

  private final List<SchemaNode> subSchemas;
  private final SchemaNode base;

  public CompositionNode(NodeType type, String schemaName, Map<String, Object> raw,
                         List<SchemaNode> subSchemas, SchemaNode base) {
    super(type, schemaName, raw);
    if (!KINDS.contains(type)) throw new IllegalArgumentException("not a composition type: " + type);
    if (type == NodeType.NOT && subSchemas.size() != 1) {
      throw new IllegalArgumentException("not takes exactly one sub-schema");
    }
    this.subSchemas = List.copyOf(subSchemas);
    this.base = base;
  }

  public List<SchemaNode> subSchemas() {
    return subSchemas;
  }

  public Optional<SchemaNode> base() {
    return Optional.ofNullable(base);
  }

  @Override
  public List<SchemaNode> children() {
    List<SchemaNode> out = new ArrayList<>(subSchemas);
    if (base != null) out.add(base);
    return out;
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitComposition(this);
  }
}
