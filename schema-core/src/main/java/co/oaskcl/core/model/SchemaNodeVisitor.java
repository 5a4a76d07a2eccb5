package co.oaskcl.core.model;

public interface SchemaNodeVisitor<R> {
  R visitObject(ObjectNode node);

  R visitArray(ArrayNode node);

  R visitString(StringNode node);

  /** Both {@code number} and {@code integer}. */
  R visitNumeric(NumericNode node);

  /** Both {@code boolean} and {@code null}. */
  R visitScalar(ScalarNode node);

  R visitAny(AnyNode node);

  R visitComposition(CompositionNode node);

  R visitConditional(ConditionalNode node);

  R visitReference(ReferenceNode node);
}
