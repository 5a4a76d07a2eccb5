package co.oaskcl.generators.kcl;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * One generated schema.
 *
 * @param name            schema name, also the file's base name
 * @param content         the schema text, without import statements
 * @param requiredImports KCL modules the content uses, sorted
 */
public record GeneratedArtifact(String name, String content, Set<String> requiredImports) {

    public GeneratedArtifact {
        requiredImports = Collections.unmodifiableSortedSet(new TreeSet<>(requiredImports));
    }
}
