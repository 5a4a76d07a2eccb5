package co.oaskcl.core.tree;

import co.oaskcl.core.Constraint;
import co.oaskcl.core.NodeType;
import co.oaskcl.core.model.ConditionalNode;
import co.oaskcl.core.model.ObjectNode;
import co.oaskcl.core.model.ReferenceNode;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.core.model.StringNode;

import java.util.Map;

/** Indented dump of an IR tree, one line per node, for {@code --debug} output. */
public final class SchemaTreePrinter {

  private SchemaTreePrinter() {}

  public static String print(SchemaNode root) {
    StringBuilder out = new StringBuilder();
    print(root, null, 0, out);
    return out.toString();
  }

  private static void print(SchemaNode node, String label, int depth, StringBuilder out) {
    out.append("  ".repeat(depth));
    if (label != null) out.append(label).append(": ");
    out.append(node.type().keyword()).append(' ').append(node.schemaName());

    if (node instanceof StringNode s && s.format().isPresent()) {
      out.append(" format=").append(s.format().get());
    }
    if (node instanceof ReferenceNode r) {
      out.append(r.isBackReference() ? " -> " : " $ref=").append(r.refTarget());
    }
    for (Map.Entry<Constraint, Object> c : node.constraints().entrySet()) {
      out.append(' ').append(c.getKey().keyword()).append('=').append(c.getValue());
    }
    out.append('\n');

    if (node instanceof ObjectNode o) {
      for (Map.Entry<String, SchemaNode> p : o.properties().entrySet()) {
        String prop = o.isRequired(p.getKey()) ? p.getKey() + "*" : p.getKey();
        print(p.getValue(), prop, depth + 1, out);
      }
      for (Map.Entry<String, SchemaNode> p : o.patternProperties().entrySet()) {
        print(p.getValue(), "/" + p.getKey() + "/", depth + 1, out);
      }
      o.additionalProperties().ifPresent(a -> print(a, "additionalProperties", depth + 1, out));
      return;
    }
    if (node instanceof ConditionalNode c) {
      print(c.condition(), "if", depth + 1, out);
      c.branch(NodeType.THEN).ifPresent(t -> print(t, "then", depth + 1, out));
      c.branch(NodeType.ELSE).ifPresent(e -> print(e, "else", depth + 1, out));
      c.base().ifPresent(b -> print(b, "base", depth + 1, out));
      return;
    }
    for (SchemaNode child : node.children()) {
      print(child, null, depth + 1, out);
    }
  }
}
