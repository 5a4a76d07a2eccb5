package co.oaskcl.generators.kcl;

import co.oaskcl.core.NodeType;
import co.oaskcl.core.model.CompositionNode;
import co.oaskcl.core.model.ConditionalNode;
import co.oaskcl.core.model.ObjectNode;
import co.oaskcl.core.model.ReferenceNode;
import co.oaskcl.core.model.SchemaDocument;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.core.tree.BuildContext;
import co.oaskcl.core.tree.SchemaTreeBuilder;
import co.oaskcl.core.tree.SchemaTreePrinter;
import co.oaskcl.generators.kcl.format.FormatTemplate;
import co.oaskcl.generators.kcl.predicate.Check;
import co.oaskcl.generators.kcl.predicate.KclLiterals;
import co.oaskcl.generators.kcl.predicate.KclRenderer;
import co.oaskcl.generators.kcl.predicate.ValueRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * KCL schema generator for JSON Schema and OpenAPI documents.
 *
 * <p>A run builds one IR tree per definition (from {@code definitions}, {@code $defs} or
 * {@code components.schemas}) and one for the document's own schema, then walks every tree in
 * post-order emitting one artifact per schema name. Each name is generated once.
 *
 * <h3>Artifacts</h3>
 * <ul>
 *   <li>objects, and compositions whose branches are objects, become a {@code schema} with one
 *       attribute per property and a {@code check} block;</li>
 *   <li>a top-level {@code $ref} becomes a schema inheriting from its target;</li>
 *   <li>any other top-level schema becomes a wrapper with a single {@code value} attribute;</li>
 *   <li>each string format in use gets one validator schema ({@code EmailValidator}, ...).</li>
 * </ul>
 * Nested nodes that do not get a schema of their own are typed by {@link TypeResolver} and
 * checked inline by their parent.
 *
 * <p>A {@code $ref} that cannot be resolved fails the artifact it occurs in; the error is
 * collected and the run continues.
 */
public class KclGenerator {

    private static final Logger log = LoggerFactory.getLogger(KclGenerator.class);

    private static final String INDENT = "    ";
    private static final String CHECK_INDENT = INDENT + INDENT;
    static final String WRAPPED_VALUE = "value";
    static final String INDEX_SIGNATURE = "[...str]: any";

    private final GeneratorConfig config;
    private final SchemaTreeBuilder builder = new SchemaTreeBuilder();

    public KclGenerator() {
        this(GeneratorConfig.defaults());
    }

    public KclGenerator(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * Generate schemas for a single raw schema with no surrounding document.
     *
     * @param raw      the schema map, which may carry its own definitions table
     * @param rootName name for the schema itself
     */
    public GenerationResult generate(Map<String, Object> raw, String rootName) {
        return new KclGenerator(config.withRootName(rootName)).generate(SchemaDocument.of(raw));
    }

    public GenerationResult generate(SchemaDocument document) {
        BuildContext build = new BuildContext(config.maxDepth());
        BuiltDocument built = build(document, build);

        GenerationContext ctx = new GenerationContext(build, built.root(), built.definitions());
        Run run = new Run(ctx);
        for (SchemaNode definition : built.definitions().values()) {
            run.walk(definition, true);
        }
        if (built.root() != null) {
            run.walk(built.root(), true);
        }

        GenerationResult result = new GenerationResult(new ArrayList<>(ctx.artifacts()), ctx.diagnostics());
        log.info("Generated {} schema(s) from {} ({} warning(s), {} error(s))",
            result.artifacts().size(),
            document.source() == null ? document.kind().label() : document.source(),
            result.warnings().size(), result.errors().size());
        return result;
    }

    /**
     * The IR trees of a document: one per definition, keyed by its JSON pointer, then the
     * document's own schema when it has one. Definitions are built first so their names win any
     * collision with nested schemas.
     */
    public BuiltDocument build(SchemaDocument document, BuildContext build) {
        Map<String, SchemaNode> definitions = new LinkedHashMap<>();
        for (SchemaDocument.Definition def : document.definitions()) {
            definitions.put(def.pointer(), builder.build(def.raw(), def.name(), build));
        }
        SchemaNode root = null;
        if (document.hasRootSchema()) {
            String name = config.rootName() != null ? config.rootName() : document.rootName();
            root = builder.build(document.raw(), name, build);
        }
        if (log.isDebugEnabled()) {
            definitions.values().forEach(d -> log.debug("IR:\n{}", SchemaTreePrinter.print(d)));
            if (root != null) log.debug("IR:\n{}", SchemaTreePrinter.print(root));
        }
        return new BuiltDocument(root, definitions);
    }

    /** Built trees of one document; {@code root} is null for a document of definitions only. */
    public record BuiltDocument(SchemaNode root, Map<String, SchemaNode> definitions) {

        public List<SchemaNode> trees() {
            List<SchemaNode> out = new ArrayList<>(definitions.values());
            if (root != null) out.add(root);
            return out;
        }
    }

    /** State of one generation pass. */
    private static final class Run {

        private final GenerationContext ctx;
        private final TypeResolver types;
        private final ConstraintCompiler compiler;
        private final Set<String> visited = new HashSet<>();

        Run(GenerationContext ctx) {
            this.ctx = ctx;
            this.types = new TypeResolver(ctx);
            this.compiler = new ConstraintCompiler(ctx, types);
        }

        void walk(SchemaNode node, boolean topLevel) {
            if (!visited.add(node.schemaName())) return;
            for (SchemaNode child : node.children()) {
                walk(child, false);
            }
            types.formatOf(node).ifPresent(this::ensureFormatArtifact);
            if (!topLevel && !types.hostsSchema(node)) return;
            if (ctx.hasArtifact(node.schemaName())) return;

            try {
                ctx.addArtifact(emit(node, topLevel));
            } catch (UnresolvedReferenceException e) {
                ctx.error(node.schemaName(), e.getMessage());
            }
        }

        private GeneratedArtifact emit(SchemaNode node, boolean topLevel) {
            if (node instanceof ObjectNode || types.hostsSchema(node)) {
                return hostedSchema(node);
            }
            if (node instanceof ReferenceNode ref && topLevel) {
                SchemaNode target = ctx.resolve(ref);
                if (!ref.isBackReference() || types.hostsSchema(target)) {
                    return aliasSchema(ref, target);
                }
            }
            return wrapperSchema(node);
        }

        // ===== Format validators =====

        private void ensureFormatArtifact(FormatTemplate format) {
            if (ctx.hasArtifact(format.schemaName())) return;
            KclRenderer renderer = new KclRenderer();
            StringBuilder body = new StringBuilder();
            body.append("schema ").append(format.schemaName()).append(":\n");
            docstring(body, format.description());
            body.append(INDENT).append(WRAPPED_VALUE).append(": str\n\n");
            body.append(INDENT).append("check:\n");
            body.append(CHECK_INDENT).append(format.predicate(WRAPPED_VALUE)).append(", ")
                .append(KclLiterals.string(WRAPPED_VALUE + " must be a valid " + format.format())).append('\n');
            renderer.imports().addAll(format.imports());
            ctx.addArtifact(new GeneratedArtifact(format.schemaName(), body.toString(), renderer.imports()));
            log.debug("Generated format validator {}", format.schemaName());
        }

        // ===== Schema kinds =====

        private GeneratedArtifact hostedSchema(SchemaNode node) {
            List<Field> fields = new FieldCollector(ctx, types).fields(node);
            List<Check> checks = compileChecks(node, () -> compiler.hostChecks(node));
            boolean strict = node instanceof ObjectNode o && o.additionalPropertiesForbidden();
            return render(node.schemaName(), null, node.description(), fields, !strict, checks);
        }

        private GeneratedArtifact aliasSchema(ReferenceNode ref, SchemaNode target) {
            return render(ref.schemaName(), target.schemaName(), ref.description(), List.of(), false, List.of());
        }

        private GeneratedArtifact wrapperSchema(SchemaNode node) {
            ValueRef value = ValueRef.instance().member(WRAPPED_VALUE, WRAPPED_VALUE);
            Field field = new Field(WRAPPED_VALUE, WRAPPED_VALUE, types.resolve(node), true,
                node.hasDefault(), node.defaultValue());
            List<Check> checks = compileChecks(node, () -> compiler.inlineChecks(node, value));
            return render(node.schemaName(), null, node.description(), List.of(field), false, checks);
        }

        private List<Check> compileChecks(SchemaNode node, Supplier<List<Check>> checks) {
            compiler.resetVariables();
            compiler.enterSchema(node.schemaName());
            try {
                return checks.get();
            } finally {
                compiler.exitSchema();
            }
        }

        // ===== Rendering =====

        private GeneratedArtifact render(String name, String parent, String description, List<Field> fields,
                                         boolean indexSignature, List<Check> checks) {
            KclRenderer renderer = new KclRenderer();
            List<String> checkLines = new ArrayList<>(checks.size());
            for (Check c : checks) {
                checkLines.add(CHECK_INDENT + renderer.renderCheck(c));
            }
            List<String> helpers = renderer.helperDefinitions(INDENT);

            StringBuilder body = new StringBuilder();
            body.append("schema ").append(name);
            if (parent != null) body.append('(').append(parent).append(')');
            body.append(":\n");
            boolean empty = true;
            if (description != null && !description.isBlank()) {
                docstring(body, description);
                empty = false;
            }
            for (Field f : fields) {
                body.append(INDENT).append(f.attribute()).append(f.required() ? ": " : "?: ").append(f.type());
                if (f.hasDefault()) body.append(" = ").append(KclLiterals.render(f.defaultValue()));
                body.append('\n');
                empty = false;
            }
            if (indexSignature) {
                body.append(INDENT).append(INDEX_SIGNATURE).append('\n');
                empty = false;
            }
            if (!helpers.isEmpty()) {
                body.append('\n');
                for (String h : helpers) body.append(h).append('\n');
                empty = false;
            }
            if (!checkLines.isEmpty()) {
                if (!empty) body.append('\n');
                body.append(INDENT).append("check:\n");
                for (String line : checkLines) body.append(line).append('\n');
                empty = false;
            }
            if (empty) body.append(INDENT).append("pass\n");
            log.debug("Generated schema {} ({} field(s), {} check(s))", name, fields.size(), checks.size());
            return new GeneratedArtifact(name, body.toString(), renderer.imports());
        }

        private static void docstring(StringBuilder body, String text) {
            String escaped = text.strip().replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"");
            if (escaped.contains("\n")) {
                body.append(INDENT).append("\"\"\"\n");
                for (String line : escaped.split("\n", -1)) {
                    body.append(line.isBlank() ? "" : INDENT + line.stripTrailing()).append('\n');
                }
                body.append(INDENT).append("\"\"\"\n");
            } else {
                body.append(INDENT).append("\"\"\"").append(escaped).append("\"\"\"\n");
            }
        }
    }

    /** One attribute of a generated schema. */
    record Field(String key, String attribute, String type, boolean required, boolean hasDefault, Object defaultValue) {
    }

    /**
     * Attributes of a schema that hosts an object or an object-like composition. allOf merges its
     * branches' attributes; anyOf, oneOf and if/then/else contribute theirs as optional. An
     * attribute declared with different types by different branches is typed {@code any}.
     */
    static final class FieldCollector {

        private final GenerationContext ctx;
        private final TypeResolver types;
        private final Map<String, Field> fields = new LinkedHashMap<>();
        private final Set<String> seen = new HashSet<>();
        // keys only named in required so far, typed any until a branch declares them
        private final Set<String> placeholders = new HashSet<>();

        FieldCollector(GenerationContext ctx, TypeResolver types) {
            this.ctx = ctx;
            this.types = types;
        }

        List<Field> fields(SchemaNode host) {
            collect(host, true);
            Set<String> attributes = new HashSet<>();
            List<Field> out = new ArrayList<>(fields.size());
            for (Field f : fields.values()) {
                String unique = f.attribute();
                for (int n = 2; !attributes.add(unique); n++) unique = f.attribute() + "_" + n;
                out.add(unique.equals(f.attribute()) ? f
                    : new Field(f.key(), unique, f.type(), f.required(), f.hasDefault(), f.defaultValue()));
            }
            return out;
        }

        private void collect(SchemaNode node, boolean requiring) {
            if (!seen.add(node.schemaName())) return;
            if (node instanceof ReferenceNode ref) {
                collect(ctx.resolve(ref), requiring);
            } else if (node instanceof ObjectNode o) {
                Map<String, String> attributes = ConstraintCompiler.attributeNames(o);
                for (Map.Entry<String, SchemaNode> p : o.properties().entrySet()) {
                    SchemaNode prop = p.getValue();
                    add(new Field(p.getKey(), attributes.get(p.getKey()), types.resolve(prop),
                        requiring && o.isRequired(p.getKey()), prop.hasDefault(), prop.defaultValue()), true);
                }
                for (String r : o.required()) {
                    if (!o.properties().containsKey(r)) {
                        add(new Field(r, attributes.get(r), TypeResolver.ANY, requiring, false, null), false);
                    }
                }
            } else if (node instanceof CompositionNode c) {
                c.base().ifPresent(b -> collect(b, requiring));
                if (c.type() == NodeType.NOT) return;
                boolean all = c.type() == NodeType.ALL_OF;
                for (SchemaNode sub : c.subSchemas()) collect(sub, requiring && all);
            } else if (node instanceof ConditionalNode c) {
                c.base().ifPresent(b -> collect(b, requiring));
                for (SchemaNode sub : c.subSchemas()) collect(sub, false);
            }
        }

        private void add(Field f, boolean declared) {
            Field existing = fields.get(f.key());
            if (existing == null) {
                fields.put(f.key(), f);
                if (!declared) placeholders.add(f.key());
                return;
            }
            String type;
            if (existing.type().equals(f.type()) || !declared) {
                type = existing.type();
            } else if (placeholders.remove(f.key())) {
                type = f.type();
            } else {
                type = TypeResolver.ANY;
            }
            boolean hasDefault = existing.hasDefault() || f.hasDefault();
            Object defaultValue = existing.hasDefault() ? existing.defaultValue() : f.defaultValue();
            fields.put(f.key(), new Field(f.key(), existing.attribute(), type,
                existing.required() || f.required(), hasDefault, defaultValue));
        }
    }
}
