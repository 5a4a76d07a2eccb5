package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code if} with its sibling {@code then} and {@code else} branches, interpreted jointly.
 */
public final class ConditionalNode extends SchemaNode {

  private final SchemaNode condition;
  private final SchemaNode thenBranch;
  private final SchemaNode elseBranch;
  private final SchemaNode base;

  public ConditionalNode(String schemaName, Map<String, Object> raw, SchemaNode condition,
                         SchemaNode thenBranch, SchemaNode elseBranch, SchemaNode base) {
    super(NodeType.IF, schemaName, raw);
    this.condition = condition;
    this.thenBranch = thenBranch;
    this.elseBranch = elseBranch;
    this.base = base;
  }

  public SchemaNode condition() {
    return condition;
  }

  /**
   * @param role {@link NodeType#THEN} or {@link NodeType#ELSE}
   */
  public Optional<SchemaNode> branch(NodeType role) {
    return switch (role) {
      case THEN -> Optional.ofNullable(thenBranch);
      case ELSE -> Optional.ofNullable(elseBranch);
      default -> throw new IllegalArgumentException("not a branch role: " + role);
    };
  }

  public Optional<SchemaNode> base() {
    return Optional.ofNullable(base);
  }

  /** The condition followed by whichever branches are present. */
  public List<SchemaNode> subSchemas() {
    List<SchemaNode> out = new ArrayList<>(3);
    out.add(condition);
    if (thenBranch != null) out.add(thenBranch);
    if (elseBranch != null) out.add(elseBranch);
    return out;
  }

  @Override
  public List<SchemaNode> children() {
    List<SchemaNode> out = subSchemas();
    if (base != null) out.add(base);
    return out;
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitConditional(this);
  }
}
