package co.weft.generators.java;

import java.nio.file.Path;

/**
 * Settings for one generator run, as assembled from the command line.
 *
 * @param schemaFile  schema document on disk; {@code null} when {@code schemaJson} is given
 * @param schemaJson  schema document text; {@code null} when {@code schemaFile} is given
 * @param basePackage package the namespace packages are placed under
 * @param outputDir   source root generated files are written to
 */
public record GeneratorOptions(Path schemaFile, String schemaJson, String basePackage, Path outputDir) {

    public GeneratorOptions {
        if ((schemaFile == null) == (schemaJson == null)) {
            throw new IllegalArgumentException("exactly one of --schema-file and --schema is required");
        }
        if (basePackage == null) {
            throw new IllegalArgumentException("--package is required");
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("--output is required");
        }
    }
}
