package co.oaskcl.core.tree;

import co.oaskcl.core.Diagnostic;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.core.naming.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State for one build run, shared across the top-level {@code build} calls for a document's main
 * schema and its definitions.
 *
 * <ul>
 *   <li>the name registry that keeps schema names unique,</li>
 *   <li>the identity table of raw schema objects already built, with the subset still on the
 *       recursion stack,</li>
 *   <li>the arena of finished nodes keyed by schema name,</li>
 *   <li>the diagnostics recorded along the way.</li>
 * </ul>
 */
public final class BuildContext {

  private static final Logger log = LoggerFactory.getLogger(BuildContext.class);

  public static final int DEFAULT_MAX_DEPTH = 100;

  private final int maxDepth;
  private final Map<String, Integer> nameCounts = new HashMap<>();
  private final Map<Object, String> namesByRaw = new IdentityHashMap<>();
  private final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
  private final Map<String, SchemaNode> arena = new LinkedHashMap<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public BuildContext() {
    this(DEFAULT_MAX_DEPTH);
  }

  public BuildContext(int maxDepth) {
    if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    this.maxDepth = maxDepth;
  }

  public int maxDepth() {
    return maxDepth;
  }

  /**
   * Reserve a unique schema name. The candidate is formatted first; a taken name gets the next
   * free numeric suffix ({@code Pet}, {@code Pet2}, {@code Pet3}, ...).
   */
  String claimName(String candidate) {
    String base = Identifiers.formatSchemaName(candidate);
    Integer seen = nameCounts.get(base);
    if (seen == null) {
      nameCounts.put(base, 1);
      return base;
    }
    int n = seen;
    String name;
    do {
      n++;
      name = base + n;
    } while (nameCounts.containsKey(name));
    nameCounts.put(base, n);
    nameCounts.put(name, 1);
    report(Diagnostic.Kind.NAME_COLLISION, name, "name " + base + " already in use, renamed to " + name);
    return name;
  }

  boolean isInProgress(Object raw) {
    return inProgress.contains(raw);
  }

  void enter(Object raw, String name) {
    namesByRaw.put(raw, name);
    inProgress.add(raw);
  }

  void exit(Object raw) {
    inProgress.remove(raw);
  }

  /** Name given to {@code raw} by an earlier build in this run, if any. */
  Optional<String> nameOf(Object raw) {
    return Optional.ofNullable(namesByRaw.get(raw));
  }

  void register(SchemaNode node) {
    arena.put(node.schemaName(), node);
  }

  void report(Diagnostic.Kind kind, String schemaName, String message) {
    Diagnostic d = new Diagnostic(kind, schemaName, message);
    log.warn("{}", d);
    diagnostics.add(d);
  }

  /** Every node built in this run, keyed by schema name. */
  public Map<String, SchemaNode> arena() {
    return Collections.unmodifiableMap(arena);
  }

  public Optional<SchemaNode> lookup(String schemaName) {
    return Optional.ofNullable(arena.get(schemaName));
  }

  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }
}
