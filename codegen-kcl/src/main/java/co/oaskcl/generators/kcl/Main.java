package co.oaskcl.generators.kcl;

import co.oaskcl.core.Diagnostic;
import co.oaskcl.core.SchemaLoader;
import co.oaskcl.core.model.SchemaDocument;
import co.oaskcl.core.model.SchemaNode;
import co.oaskcl.core.tree.BuildContext;
import co.oaskcl.core.tree.SchemaTreePrinter;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * CLI entry point for the KCL schema generator.
 *
 * Usage:
 *   java -jar codegen-kcl.jar --schema <file> --output <dir> [--package <name>] [--max-depth <n>]
 *                             [--root-name <name>] [--config <json>] [--debug]
 */
public class Main {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String USAGE = "Usage: java -jar codegen-kcl.jar --schema <file> --output <dir> "
        + "[--package <name>] [--max-depth <n>] [--root-name <name>] [--config <json>] [--debug]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        try {
            String schemaFile = null;
            String outputDir = null;
            String packageName = null;
            String maxDepth = null;
            String rootName = null;
            String configFile = null;
            boolean debug = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--schema":
                        schemaFile = value(args, ++i);
                        break;
                    case "--output":
                        outputDir = value(args, ++i);
                        break;
                    case "--package":
                        packageName = value(args, ++i);
                        break;
                    case "--max-depth":
                        maxDepth = value(args, ++i);
                        break;
                    case "--root-name":
                        rootName = value(args, ++i);
                        break;
                    case "--config":
                        configFile = value(args, ++i);
                        break;
                    case "--debug":
                        debug = true;
                        break;
                    default:
                        // Skip unknown args
                        break;
                }
            }

            if (schemaFile == null || outputDir == null) {
                System.err.println(USAGE);
                return 1;
            }

            GeneratorConfig config = configFile != null
                ? MAPPER.readValue(Paths.get(configFile).toFile(), GeneratorConfig.class)
                : GeneratorConfig.defaults();
            if (packageName != null) config = config.withPackageName(packageName);
            if (maxDepth != null) config = config.withMaxDepth(Integer.parseInt(maxDepth));
            if (rootName != null) config = config.withRootName(rootName);

            SchemaDocument document = SchemaLoader.load(Path.of(schemaFile));
            KclGenerator generator = new KclGenerator(config);

            if (debug) {
                for (SchemaNode tree : generator.build(document, new BuildContext(config.maxDepth())).trees()) {
                    System.out.print(SchemaTreePrinter.print(tree));
                }
            }

            GenerationResult result = generator.generate(document);
            List<Path> written = new ArtifactWriter(config).write(result, Paths.get(outputDir));

            System.out.println("Generated " + result.artifacts().size() + " KCL schema(s) from "
                + document.kind().label() + " in " + outputDir);
            for (String name : result.names()) {
                System.out.println("  - " + name);
            }
            for (Diagnostic warning : result.warnings()) {
                System.err.println("Warning: " + warning);
            }
            if (result.hasErrors()) {
                for (Diagnostic error : result.errors()) {
                    System.err.println("Error: " + error);
                }
                System.err.println(result.errors().size() + " schema(s) failed; " + written.size() + " file(s) written");
                return 1;
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        return args[i];
    }
}
