package co.oaskcl.generators.kcl;

import co.oaskcl.core.Diagnostic;
import co.oaskcl.core.model.ReferenceNode;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.core.tree.BuildContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registries of one generation run: the built nodes, the definitions table used to resolve
 * references, the artifacts generated so far and the diagnostics reported along the way.
 */
final class GenerationContext {

    private static final Logger log = LoggerFactory.getLogger(GenerationContext.class);

    private static final int MAX_REFERENCE_CHAIN = 64;

    private final BuildContext build;
    private final SchemaNode root;
    private final Map<String, SchemaNode> definitions;
    private final Map<String, GeneratedArtifact> artifacts = new LinkedHashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    GenerationContext(BuildContext build, SchemaNode root, Map<String, SchemaNode> definitions) {
        this.build = build;
        this.root = root;
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    /** The node a reference points at, one hop. */
    SchemaNode resolve(ReferenceNode ref) {
        return lookup(ref).orElseThrow(() -> new UnresolvedReferenceException(ref.schemaName(), ref.refTarget()));
    }

    /** Like {@link #resolve}, empty for a dangling reference. */
    Optional<SchemaNode> lookup(ReferenceNode ref) {
        String target = ref.refTarget();
        if (ref.isBackReference()) {
            return build.lookup(target);
        }
        if ((target.equals("#") || target.isEmpty()) && root != null) {
            return Optional.of(root);
        }
        return Optional.ofNullable(definitions.get(target));
    }

    /** Follows references until a non-reference node. */
    SchemaNode dereference(SchemaNode node) {
        SchemaNode current = node;
        for (int hops = 0; current instanceof ReferenceNode ref; hops++) {
            if (hops == MAX_REFERENCE_CHAIN) {
                throw new UnresolvedReferenceException(node.schemaName(), "reference chain through " + ref.refTarget());
            }
            current = resolve(ref);
        }
        return current;
    }

    boolean hasArtifact(String name) {
        return artifacts.containsKey(name);
    }

    void addArtifact(GeneratedArtifact artifact) {
        artifacts.putIfAbsent(artifact.name(), artifact);
    }

    Collection<GeneratedArtifact> artifacts() {
        return artifacts.values();
    }

    void warn(Diagnostic.Kind kind, String schemaName, String message) {
        Diagnostic d = new Diagnostic(kind, schemaName, message);
        log.warn("{}", d);
        diagnostics.add(d);
    }

    void error(String schemaName, String message) {
        Diagnostic d = new Diagnostic(Diagnostic.Kind.UNRESOLVED_REFERENCE, schemaName, message);
        log.error("{}", d);
        diagnostics.add(d);
    }

    List<Diagnostic> diagnostics() {
        List<Diagnostic> all = new ArrayList<>(build.diagnostics());
        all.addAll(diagnostics);
        return all;
    }
}
