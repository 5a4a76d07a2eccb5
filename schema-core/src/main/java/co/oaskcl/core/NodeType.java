package co.oaskcl.core;

import java.util.Optional;
import java.util.Set;

/**
 * Kinds of IR node produced by the tree builder.
 *
 * <p>The seven JSON Schema primitive type names map onto {@link #OBJECT} through {@link #NULL}.
 * The remaining kinds are structural:
 * <pre>
 *   ALL_OF, ANY_OF, ONE_OF, NOT  → composition over sub-schemas
 *   IF, THEN, ELSE               → conditional and its two branches
 *   REFERENCE                    → local $ref, resolved during generation
 *   ANY                          → unconstrained (boolean true, malformed fragments)
 * </pre>
 */
public enum NodeType {
    OBJECT("object"),
    ARRAY("array"),
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    NULL("null"),
    ALL_OF("allOf"),
    ANY_OF("anyOf"),
    ONE_OF("oneOf"),
    NOT("not"),
    IF("if"),
    THEN("then"),
    ELSE("else"),
    REFERENCE("$ref"),
    ANY("any");

    private static final Set<NodeType> PRIMITIVES = Set.of(OBJECT, ARRAY, STRING, NUMBER, INTEGER, BOOLEAN, NULL);

    private final String keyword;

    NodeType(String keyword) {
        this.keyword = keyword;
    }

    /** The schema keyword or type name this kind is read from. */
    public String keyword() {
        return keyword;
    }

    public boolean isPrimitive() {
        return PRIMITIVES.contains(this);
    }

    /**
     * Map a JSON Schema {@code type} name to its node kind.
     *
     * @param s the type name, e.g. {@code "integer"}
     * @return the primitive kind, or empty for names JSON Schema does not define
     */
    public static Optional<NodeType> fromTypeName(String s) {
        if (s == null || s.isEmpty()) return Optional.empty();
        return switch (s) {
            case "object"  -> Optional.of(OBJECT);
            case "array"   -> Optional.of(ARRAY);
            case "string"  -> Optional.of(STRING);
            case "number"  -> Optional.of(NUMBER);
            case "integer" -> Optional.of(INTEGER);
            case "boolean" -> Optional.of(BOOLEAN);
            case "null"    -> Optional.of(NULL);
            default        -> Optional.empty();
        };
    }

    public static boolean isValidTypeName(String s) {
        return fromTypeName(s).isPresent();
    }
}
