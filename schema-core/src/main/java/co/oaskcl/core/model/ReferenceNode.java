package co.oaskcl.core.model;

import co.oaskcl.core.NodeType;

import java.util.List;
import java.util.Map;

/**
 * A {@code $ref} to a same-document definition, or a back-reference to a node built earlier in the
 * same run (a cycle through a property chain, or a raw schema object reused in two places).
 */
public final class ReferenceNode extends SchemaNode {

  private final String refTarget;
  private final boolean backReference;

  private ReferenceNode(String schemaName, Map<String, Object> raw, String refTarget, boolean backReference) {
    super(NodeType.REFERENCE, schemaName, raw);
    this.refTarget = refTarget;
    this.backReference = backReference;
  }

  /** A {@code $ref} such as {@code #/definitions/Pet}. */
  public static ReferenceNode pointer(String schemaName, Map<String, Object> raw, String pointer) {
    return new ReferenceNode(schemaName, raw, pointer, false);
  }

  /** A reference to the node already named {@code targetName}. */
  public static ReferenceNode backReference(String schemaName, Map<String, Object> raw, String targetName) {
    return new ReferenceNode(schemaName, raw, targetName, true);
  }

  /** The JSON pointer, or the target schema name for a back-reference. */
  public String refTarget() {
    return refTarget;
  }

  public boolean isBackReference() {
    return backReference;
  }

  @Override
  public List<SchemaNode> children() {
    return List.of();
  }

  @Override
  public <R> R accept(SchemaNodeVisitor<R> visitor) {
    return visitor.visitReference(this);
  }
}
