package co.oaskcl.core;

import co.oaskcl.core.model.SchemaDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class SchemaLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  void loadsJsonSchemaFile() throws IOException {
    Path file = tempDir.resolve("pet.json");
    Files.writeString(file, """
      {
        "$schema": "http://json-schema.org/draft-07/schema#",
        "title": "Pet",
        "type": "object",
        "properties": {
          "name": { "type": "string" },
          "weight": { "type": "number", "multipleOf": 0.1 }
        }
      }
      """);

    SchemaDocument doc = SchemaLoader.load(file);

    assertThat(doc.kind()).isEqualTo(DocumentKind.JSON_SCHEMA_DRAFT_7);
    assertThat(doc.source()).isEqualTo(file.toString());
    assertThat(doc.rootName()).isEqualTo("Pet");
    assertThat(doc.raw()).containsKey("properties");
  }

  @Test
  void keepsDecimalLiteralsExact() throws IOException {
    SchemaDocument doc = SchemaLoader.parse("""
      { "type": "number", "multipleOf": 0.1, "maximum": 10 }
      """, false);

    assertThat(doc.raw().get("multipleOf")).isEqualTo(new BigDecimal("0.1"));
    assertThat(doc.raw().get("maximum")).isEqualTo(10);
  }

  @Test
  void loadsYamlByExtension() throws IOException {
    Path file = tempDir.resolve("api.yaml");
    Files.writeString(file, """
      openapi: 3.0.3
      info:
        title: Pets
        version: "1"
      components:
        schemas:
          Pet:
            type: object
            required: [name]
            properties:
              name:
                type: string
      """);

    SchemaDocument doc = SchemaLoader.load(file);

    assertThat(doc.kind()).isEqualTo(DocumentKind.OPENAPI_3_0);
    assertThat(doc.definitions()).extracting(SchemaDocument.Definition::pointer)
        .containsExactly("#/components/schemas/Pet");
    assertThat(doc.hasRootSchema()).isFalse();
  }

  @Test
  void loadsYmlExtensionAsYaml() throws IOException {
    Path file = tempDir.resolve("schema.yml");
    Files.writeString(file, "type: string\nminLength: 2\n");

    SchemaDocument doc = SchemaLoader.load(file);

    assertThat(doc.raw()).containsEntry("type", "string").containsEntry("minLength", 2);
  }

  @Test
  void rejectsDocumentThatIsNotAnObject() {
    assertThatThrownBy(() -> SchemaLoader.parse("[1, 2, 3]", false))
      .isInstanceOf(MalformedSchemaException.class)
      .hasMessageContaining("must be an object");
  }

  @Test
  void reportsInvalidJson() {
    assertThatThrownBy(() -> SchemaLoader.parse("{ \"type\": ", false))
      .isInstanceOf(IOException.class);
  }

  @Test
  void failsOnMissingFile() {
    assertThatThrownBy(() -> SchemaLoader.load(tempDir.resolve("missing.json")))
      .isInstanceOf(IOException.class);
  }

  @Test
  void parsedDocumentHasNoSource() throws IOException {
    SchemaDocument doc = SchemaLoader.parse("{}", false);
    assertThat(doc.source()).isNull();
    assertThat(doc.raw()).isEqualTo(Map.of());
  }
}
