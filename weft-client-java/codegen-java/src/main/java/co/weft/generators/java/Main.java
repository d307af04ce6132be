package co.weft.generators.java;

import co.weft.core.SchemaLoader;
import co.weft.core.types.Api;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI entry point for the Java binding generator.
 *
 * Usage:
 *   java -jar codegen-java.jar --schema-file &lt;path&gt; --package &lt;pkg&gt; --output &lt;dir&gt;
 *   java -jar codegen-java.jar --schema &lt;json&gt; --package &lt;pkg&gt; --output &lt;dir&gt;
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String USAGE =
        "Usage: java -jar codegen-java.jar [--schema-file <path> | --schema <json>] --package <pkg> --output <dir>";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Run the generator and return the process exit code. */
    static int run(String[] args) {
        GeneratorOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            log.error(USAGE);
            return 1;
        }

        try {
            Api api = options.schemaFile() != null
                ? SchemaLoader.load(options.schemaFile())
                : SchemaLoader.parse(options.schemaJson());

            List<JavaGenerator.GeneratedUnit> units = new JavaGenerator().generate(api, options);
            for (JavaGenerator.GeneratedUnit unit : units) {
                log.info("  - {}", unit.id());
            }
            return 0;
        } catch (Exception e) {
            log.error("Generation failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    static GeneratorOptions parseArgs(String[] args) {
        Path schemaFile = null;
        String schemaJson = null;
        String packageName = null;
        Path outputDir = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--schema-file":
                    schemaFile = Path.of(value(args, ++i, "--schema-file"));
                    break;
                case "--schema":
                    schemaJson = value(args, ++i, "--schema");
                    break;
                case "--package":
                    packageName = value(args, ++i, "--package");
                    break;
                case "--output":
                    outputDir = Path.of(value(args, ++i, "--output"));
                    break;
                default:
                    log.warn("Ignoring unknown argument {}", args[i]);
                    break;
            }
        }
        return new GeneratorOptions(schemaFile, schemaJson, packageName, outputDir);
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException(flag + " requires a value");
        return args[i];
    }
}
