package co.oaskcl.core;

import co.oaskcl.core.model.SchemaDocument;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a JSON or YAML schema file into a {@link SchemaDocument}. Floats are kept as
 * {@link java.math.BigDecimal} so literals such as {@code 0.1} survive unchanged.
 */
public final class SchemaLoader {

  private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

  private static final ObjectMapper JSON = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private SchemaLoader() {}

  public static SchemaDocument load(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    Map<String, Object> raw = read(bytes, isYaml(path));
    SchemaDocument doc = new SchemaDocument(raw, path.toString());
    log.debug("Loaded {} as {}", path, doc.kind().label());
    return doc;
  }

  public static SchemaDocument parse(String content, boolean yaml) throws IOException {
    return SchemaDocument.of(read(content.getBytes(StandardCharsets.UTF_8), yaml));
  }

  private static Map<String, Object> read(byte[] bytes, boolean yaml) throws IOException {
    Object tree = (yaml ? YAML : JSON).readValue(bytes, Object.class);
    if (!(tree instanceof Map)) {
      throw new MalformedSchemaException("document", null, "top level of a schema document must be an object");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> raw = (Map<String, Object>) tree;
    return raw;
  }

  private static boolean isYaml(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".yaml") || name.endsWith(".yml");
  }
}
