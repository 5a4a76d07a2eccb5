package co.oaskcl.generators.kcl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

public class ArtifactWriterTest {

  @TempDir
  Path tempDir;

  private static final GeneratedArtifact PET = new GeneratedArtifact("Pet",
      "schema Pet:\n    code?: str\n\n    check:\n        code == None or regex.search(code, \"^a\"), \"code must match pattern ^a\"\n",
      Set.of("regex"));

  private static final GeneratedArtifact OWNER = new GeneratedArtifact("Owner", "schema Owner:\n    name: str\n", Set.of());

  @Test
  void writesOneFilePerSchemaWithImports() throws Exception {
    GenerationResult result = new GenerationResult(List.of(PET, OWNER), List.of());
    Path out = tempDir.resolve("generated/kcl");

    List<Path> written = new ArtifactWriter(GeneratorConfig.defaults()).write(result, out);

    assertThat(written).containsExactly(out.resolve("Pet.k"), out.resolve("Owner.k"), out.resolve("kcl.mod"));
    assertThat(Files.readString(out.resolve("Pet.k"))).isEqualTo("import regex\n\n" + PET.content());
    assertThat(Files.readString(out.resolve("Owner.k"))).isEqualTo(OWNER.content());
  }

  @Test
  void importsAreSorted() {
    GeneratedArtifact a = new GeneratedArtifact("A", "schema A:\n    pass\n", Set.of("regex", "datetime", "net"));
    assertThat(ArtifactWriter.fileContent(a)).startsWith("import datetime\nimport net\nimport regex\n\nschema A:");
  }

  @Test
  void writesModFileWithPackageName() throws Exception {
    GenerationResult result = new GenerationResult(List.of(OWNER), List.of());

    new ArtifactWriter(GeneratorConfig.defaults().withPackageName("petstore")).write(result, tempDir);

    assertThat(Files.readString(tempDir.resolve(ArtifactWriter.MOD_FILE))).isEqualTo("""
        [package]
        name = "petstore"
        edition = "v0.9.0"
        version = "0.0.1"
        """);
  }

  @Test
  void modFileCanBeSkipped() throws Exception {
    GeneratorConfig config = new GeneratorConfig(null, null, null, false);
    new ArtifactWriter(config).write(new GenerationResult(List.of(OWNER), List.of()), tempDir);

    assertThat(tempDir.resolve(ArtifactWriter.MOD_FILE)).doesNotExist();
    assertThat(tempDir.resolve("Owner.k")).exists();
  }

  @Test
  void duplicateNamesAreWrittenOnce() throws Exception {
    GeneratedArtifact other = new GeneratedArtifact("Owner", "schema Owner:\n    other: int\n", Set.of());
    GenerationResult result = new GenerationResult(List.of(OWNER, other), List.of());

    List<Path> written = new ArtifactWriter(new GeneratorConfig(null, null, null, false)).write(result, tempDir);

    assertThat(written).containsExactly(tempDir.resolve("Owner.k"));
    assertThat(Files.readString(tempDir.resolve("Owner.k"))).isEqualTo(OWNER.content());
  }
}
