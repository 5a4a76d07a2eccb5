package co.oaskcl.generators.kcl.predicate;

/** One line of a schema's check block: the predicate and the message shown when it fails. */
public record Check(Predicate predicate, String message) {
}
