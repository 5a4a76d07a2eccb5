package co.oaskcl.generators.kcl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes generated schemas to disk, one {@code {name}.k} file per artifact with its imports
 * rendered at the top, plus an optional {@code kcl.mod}.
 */
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    public static final String EXTENSION = ".k";
    public static final String MOD_FILE = "kcl.mod";
    static final String KCL_EDITION = "v0.9.0";

    private final GeneratorConfig config;

    public ArtifactWriter(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * Write every artifact of {@code result} under {@code outDir}, creating it if needed.
     *
     * @return the files written, schemas first in artifact order
     */
    public List<Path> write(GenerationResult result, Path outDir) throws IOException {
        Files.createDirectories(outDir);

        Map<String, GeneratedArtifact> unique = new LinkedHashMap<>();
        for (GeneratedArtifact a : result.artifacts()) {
            unique.putIfAbsent(a.name(), a);
        }

        List<Path> written = new ArrayList<>();
        for (GeneratedArtifact a : unique.values()) {
            Path file = outDir.resolve(a.name() + EXTENSION);
            Files.writeString(file, fileContent(a), StandardCharsets.UTF_8);
            log.debug("Wrote {}", file);
            written.add(file);
        }
        if (config.writeModFile()) {
            Path mod = outDir.resolve(MOD_FILE);
            Files.writeString(mod, modFile(config.packageName()), StandardCharsets.UTF_8);
            written.add(mod);
        }
        log.info("Wrote {} file(s) to {}", written.size(), outDir);
        return written;
    }

    /** Import statements, a blank line, then the schema. */
    static String fileContent(GeneratedArtifact artifact) {
        if (artifact.requiredImports().isEmpty()) return artifact.content();
        StringBuilder out = new StringBuilder();
        for (String module : artifact.requiredImports()) {
            out.append("import ").append(module).append('\n');
        }
        return out.append('\n').append(artifact.content()).toString();
    }

    static String modFile(String packageName) {
        return "[package]\n"
            + "name = \"" + packageName + "\"\n"
            + "edition = \"" + KCL_EDITION + "\"\n"
            + "version = \"0.0.1\"\n";
    }
}
