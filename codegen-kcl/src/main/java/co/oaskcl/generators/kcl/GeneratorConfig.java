package co.oaskcl.generators.kcl;

import co.oaskcl.core.tree.BuildContext;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings for one generation run, read from the {@code --config} JSON file and overridden by
 * individual CLI flags. Absent values take their defaults.
 *
 * @param packageName  KCL package name written to {@code kcl.mod}
 * @param maxDepth     nesting depth past which sub-schemas are left unconstrained
 * @param rootName     name for the document's own schema, or null to derive it from the document
 * @param writeModFile whether a {@code kcl.mod} is written next to the schemas
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratorConfig(
    String packageName,
    Integer maxDepth,
    String rootName,
    Boolean writeModFile
) {
    public static final String DEFAULT_PACKAGE = "schema";

    @JsonCreator
    public GeneratorConfig(
        @JsonProperty("packageName") String packageName,
        @JsonProperty("maxDepth") Integer maxDepth,
        @JsonProperty("rootName") String rootName,
        @JsonProperty("writeModFile") Boolean writeModFile
    ) {
        if (maxDepth != null && maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.packageName = packageName == null || packageName.isBlank() ? DEFAULT_PACKAGE : packageName;
        this.maxDepth = maxDepth == null ? BuildContext.DEFAULT_MAX_DEPTH : maxDepth;
        this.rootName = rootName == null || rootName.isBlank() ? null : rootName;
        this.writeModFile = writeModFile == null || writeModFile;
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, null, null, null);
    }

    public GeneratorConfig withPackageName(String packageName) {
        return new GeneratorConfig(packageName, maxDepth, rootName, writeModFile);
    }

    public GeneratorConfig withMaxDepth(int maxDepth) {
        return new GeneratorConfig(packageName, maxDepth, rootName, writeModFile);
    }

    public GeneratorConfig withRootName(String rootName) {
        return new GeneratorConfig(packageName, maxDepth, rootName, writeModFile);
    }
}
