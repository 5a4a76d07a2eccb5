package co.oaskcl.generators.kcl;

import co.oaskcl.core.Constraint;
import co.oaskcl.core.NodeType;
import co.oaskcl.core.model.AnyNode;
import co.oaskcl.core.model.ArrayNode;
import co.oaskcl.core.model.CompositionNode;
import co.oaskcl.core.model.ConditionalNode;
import co.oaskcl.core.model.NumericNode;
import co.oaskcl.core.model.ObjectNode;
import co.oaskcl.core.model.ReferenceNode;
import co.oaskcl.core.model.ScalarNode;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.core.model.SchemaNodeVisitor;
import co.oaskcl.core.model.StringNode;
import co.oaskcl.generators.kcl.format.FormatRegistry;
import co.oaskcl.generators.kcl.format.FormatTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps IR nodes to KCL type expressions.
 *
 * <p>Rules, first match wins:
 * <pre>
 *   $ref                      → the referenced schema's name
 *   "type": [..]              → any
 *   string with known format  → the format's validator schema
 *   integer number boolean    → int float bool
 *   null                      → None
 *   array                     → [items] or [any]
 *   object                    → its own schema when it gets one, else {str:T} or {str:any}
 * </pre>
 * Compositions that get their own schema resolve to it; otherwise to the type their branches
 * share, or {@code any}.
 */
public final class TypeResolver {

    public static final String ANY = "any";

    private static final List<Constraint> STRING_CONSTRAINTS = List.of(
        Constraint.MIN_LENGTH, Constraint.MAX_LENGTH, Constraint.PATTERN, Constraint.ENUM, Constraint.CONST);

    private final GenerationContext ctx;

    TypeResolver(GenerationContext ctx) {
        this.ctx = ctx;
    }

    public String resolve(SchemaNode node) {
        return resolve(node, new HashSet<>());
    }

    /**
     * True when the node, met anywhere below the top level, gets an artifact of its own rather
     * than being checked inline by its parent.
     */
    public boolean hostsSchema(SchemaNode node) {
        if (node.typeUnion()) return false;
        if (node instanceof ObjectNode o) {
            return !o.properties().isEmpty()
                || !o.patternProperties().isEmpty()
                || !o.required().isEmpty()
                || o.additionalPropertiesForbidden()
                || o.title() != null
                || o.has(Constraint.MIN_PROPERTIES)
                || o.has(Constraint.MAX_PROPERTIES);
        }
        if (node instanceof CompositionNode || node instanceof ConditionalNode) {
            return isObjectLike(node, new HashSet<>());
        }
        return false;
    }

    /** True when the type the node resolves to is a schema that validates itself. */
    public boolean isSelfValidating(SchemaNode node) {
        if (node instanceof ReferenceNode ref) {
            if (!ref.isBackReference()) return true;
            SchemaNode target = ctx.resolve(ref);
            return hostsSchema(target) || formatOf(target).isPresent();
        }
        return hostsSchema(node) || formatOf(node).isPresent();
    }

    /**
     * The validator template a string node is typed with, if any. A string that also carries its
     * own length, pattern or literal constraints stays {@code str} and is checked inline instead.
     */
    public Optional<FormatTemplate> formatOf(SchemaNode node) {
        if (node instanceof StringNode s && !s.typeUnion() && !hasStringConstraints(s)) {
            return s.format().flatMap(FormatRegistry::lookup);
        }
        return Optional.empty();
    }

    private static boolean hasStringConstraints(StringNode s) {
        return STRING_CONSTRAINTS.stream().anyMatch(s::has);
    }

    /**
     * True when values of the node are objects: an object node, or a composition whose branches
     * all are.
     */
    boolean isObjectLike(SchemaNode node, Set<String> seen) {
        if (!seen.add(node.schemaName())) return true;
        if (node instanceof ObjectNode) return true;
        if (node instanceof ReferenceNode ref) return ctx.lookup(ref).map(t -> isObjectLike(t, seen)).orElse(false);
        if (node instanceof CompositionNode c) {
            if (c.base().isPresent() && !isObjectLike(c.base().get(), seen)) return false;
            if (c.type() == NodeType.NOT) return c.base().isPresent() || isObjectLike(c.subSchemas().get(0), seen);
            for (SchemaNode sub : c.subSchemas()) {
                if (!isObjectLike(sub, seen)) return false;
            }
            return true;
        }
        if (node instanceof ConditionalNode c) {
            if (c.base().isPresent()) return isObjectLike(c.base().get(), seen);
            return isObjectLike(c.condition(), seen);
        }
        return false;
    }

    private String resolve(SchemaNode node, Set<String> seen) {
        if (!(node instanceof ReferenceNode) && node.typeUnion()) return ANY;
        if (!seen.add(node.schemaName())) {
            return hostsSchema(node) ? node.schemaName() : ANY;
        }
        return node.accept(new SchemaNodeVisitor<>() {
            @Override
            public String visitObject(ObjectNode n) {
                if (hostsSchema(n)) return n.schemaName();
                return n.additionalProperties().map(a -> "{str:" + resolve(a, seen) + "}").orElse("{str:any}");
            }

            @Override
            public String visitArray(ArrayNode n) {
                return "[" + n.items().map(i -> resolve(i, seen)).orElse(ANY) + "]";
            }

            @Override
            public String visitString(StringNode n) {
                return formatOf(n).map(FormatTemplate::schemaName).orElse("str");
            }

            @Override
            public String visitNumeric(NumericNode n) {
                return n.isInteger() ? "int" : "float";
            }

            @Override
            public String visitScalar(ScalarNode n) {
                return n.type() == NodeType.BOOLEAN ? "bool" : "None";
            }

            @Override
            public String visitAny(AnyNode n) {
                return ANY;
            }

            @Override
            public String visitComposition(CompositionNode n) {
                if (hostsSchema(n)) return n.schemaName();
                if (n.type() == NodeType.NOT) {
                    return n.base().map(b -> resolve(b, seen)).orElse(ANY);
                }
                List<SchemaNode> parts = new ArrayList<>(n.subSchemas());
                n.base().ifPresent(parts::add);
                return common(parts, seen);
            }

            @Override
            public String visitConditional(ConditionalNode n) {
                if (hostsSchema(n)) return n.schemaName();
                return n.base().map(b -> resolve(b, seen)).orElse(ANY);
            }

            @Override
            public String visitReference(ReferenceNode n) {
                SchemaNode target = ctx.resolve(n);
                if (!n.isBackReference()) return target.schemaName();
                return resolve(target, seen);
            }
        });
    }

    /** The one type every part resolves to, or {@code any}. */
    private String common(List<SchemaNode> parts, Set<String> seen) {
        String shared = null;
        for (SchemaNode p : parts) {
            String t = resolve(p, new HashSet<>(seen));
            if (shared == null) {
                shared = t;
            } else if (!shared.equals(t)) {
                return ANY;
            }
        }
        return shared == null ? ANY : shared;
    }
}
