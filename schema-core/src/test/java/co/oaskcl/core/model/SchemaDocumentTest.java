package co.oaskcl.core.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class SchemaDocumentTest {

  @Test
  void rootNameComesFromTitle() {
    assertThat(SchemaDocument.of(Map.of("title", "pet store", "$id", "other.json")).rootName())
        .isEqualTo("PetStore");
  }

  @Test
  void rootNameFallsBackToIdBaseName() {
    SchemaDocument doc = SchemaDocument.of(Map.of("$id", "https://example.com/schemas/order-item.schema.json#"));
    assertThat(doc.rootName()).isEqualTo("OrderItem");
  }

  @Test
  void rootNameDefaultsToPlaceholder() {
    assertThat(SchemaDocument.of(Map.of("type", "object")).rootName()).isEqualTo("Schema");
    assertThat(SchemaDocument.of(Map.of("title", "  ")).rootName()).isEqualTo("Schema");
  }

  @Test
  void collectsDefinitionsFromEveryTableInOrder() {
    Map<String, Object> defs = new LinkedHashMap<>();
    defs.put("Pet", Map.of("type", "object"));
    defs.put("a/b", Map.of("type", "string"));
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("definitions", defs);
    raw.put("$defs", Map.of("Tag", Map.of("type", "string")));
    raw.put("components", Map.of("schemas", Map.of("Owner", Map.of("type", "object"))));

    List<SchemaDocument.Definition> definitions = SchemaDocument.of(raw).definitions();

    assertThat(definitions).extracting(SchemaDocument.Definition::pointer).containsExactly(
        "#/definitions/Pet", "#/definitions/a~1b", "#/$defs/Tag", "#/components/schemas/Owner");
    assertThat(definitions).extracting(SchemaDocument.Definition::name).containsExactly(
        "Pet", "a/b", "Tag", "Owner");
  }

  @Test
  void definitionsOnlyDocumentHasNoRootSchema() {
    SchemaDocument doc = SchemaDocument.of(Map.of("definitions", Map.of("Pet", Map.of("type", "object"))));
    assertThat(doc.hasRootSchema()).isFalse();
  }

  @Test
  void schemaWithDefinitionsIsStillARootSchema() {
    SchemaDocument doc = SchemaDocument.of(Map.of(
        "type", "object",
        "$defs", Map.of("Pet", Map.of("type", "object"))));
    assertThat(doc.hasRootSchema()).isTrue();
  }

  @Test
  void emptyDocumentIsARootSchema() {
    assertThat(SchemaDocument.of(Map.of()).hasRootSchema()).isTrue();
  }

  @Test
  void openApiDocumentNeverHasRootSchema() {
    SchemaDocument doc = SchemaDocument.of(Map.of("openapi", "3.1.0", "type", "object"));
    assertThat(doc.hasRootSchema()).isFalse();
  }
}
