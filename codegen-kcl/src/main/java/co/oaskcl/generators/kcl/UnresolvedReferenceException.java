package co.oaskcl.generators.kcl;

/** A {@code $ref} names nothing in the document's definitions table. */
public class UnresolvedReferenceException extends IllegalStateException {

    private final String schemaName;
    private final String target;

    public UnresolvedReferenceException(String schemaName, String target) {
        super(schemaName + ": unresolved reference " + target);
        this.schemaName = schemaName;
        this.target = target;
    }

    /** The reference node's name. */
    public String schemaName() {
        return schemaName;
    }

    public String target() {
        return target;
    }
}
