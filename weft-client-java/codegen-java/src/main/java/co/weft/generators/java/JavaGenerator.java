package co.weft.generators.java;

import co.weft.core.types.Api;
import co.weft.core.types.CompositeType;
import co.weft.core.types.Field;
import co.weft.core.types.ListType;
import co.weft.core.types.ModeledType;
import co.weft.core.types.Namespace;
import co.weft.core.types.Struct;
import co.weft.core.types.Types;
import co.weft.core.types.Union;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.TypeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Java binding generator.
 *
 * <p>For every struct and union of an {@link Api} it emits one class that validates its fields
 * on construction and encodes/decodes itself through the {@code co.weft.runtime} wire runtime.
 * Each namespace becomes a package under the base package and gets a {@code package-info.java}.
 *
 * Generates, per namespace:
 * - one class per struct (plain, family root, or family subtype)
 * - one class per union with a nested tag enum and one nested class per variant
 * - package-info.java carrying the namespace documentation
 *
 * <p>All units are rendered before anything is written. A schema the synthesizers cannot honor
 * fails the whole run with nothing on disk.
 */
public class JavaGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaGenerator.class);

    static final String FILE_COMMENT = "Auto-generated by weft, do not modify.";
    static final String PACKAGE_INFO = "package-info";

    /**
     * One rendered source file.
     *
     * @param id          {@code namespace/PublicName}, or {@code namespace/package-info}
     * @param packageName Java package of the file
     * @param typeName    simple name of the top-level type, or {@code package-info}
     * @param source      full file contents
     */
    public record GeneratedUnit(String id, String packageName, String typeName, String source) {

        /** Location of the file relative to a source root. */
        public Path relativePath() {
            Path dir = Path.of("");
            if (!packageName.isEmpty()) {
                for (String seg : packageName.split("\\.")) dir = dir.resolve(seg);
            }
            return dir.resolve(typeName + ".java");
        }
    }

    /**
     * Render every unit of {@code api} and write them under {@code outDir}.
     *
     * @param api         resolved schema
     * @param basePackage package the namespace packages are placed under; may be empty
     * @param outDir      source root to write to
     * @return the written units, in namespace then declaration order
     */
    public List<GeneratedUnit> generate(Api api, String basePackage, Path outDir) throws IOException {
        List<GeneratedUnit> units = render(api, basePackage);
        for (GeneratedUnit unit : units) {
            Path file = outDir.resolve(unit.relativePath());
            Files.createDirectories(file.getParent());
            Files.writeString(file, unit.source(), StandardCharsets.UTF_8);
        }
        log.info("Generated {} types in {} namespaces into {}", api.typeCount(), api.namespaces().size(), outDir);
        return units;
    }

    public List<GeneratedUnit> generate(Api api, GeneratorOptions options) throws IOException {
        return generate(api, options.basePackage(), options.outputDir());
    }

    /**
     * Render every unit of {@code api} in memory.
     *
     * @throws IllegalStateException         if a family or union breaks a contract the validator should have enforced
     * @throws UnsupportedOperationException if a struct-typed field declares a default
     */
    public List<GeneratedUnit> render(Api api, String basePackage) {
        IdentifierEngine names = new IdentifierEngine();
        TypeMapper types = new TypeMapper(names, basePackage);
        HierarchyResolver hierarchy = new HierarchyResolver();
        ConstraintCompiler constraints = new ConstraintCompiler(names, types);
        StructSynthesizer structs = new StructSynthesizer(names, types, constraints, hierarchy);
        UnionSynthesizer unions = new UnionSynthesizer(names, types, constraints, hierarchy);

        Map<CompositeType, Set<ClassName>> related = relatedTypes(api, types);

        List<GeneratedUnit> units = new ArrayList<>();
        for (Namespace ns : api.namespaces()) {
            String pkg = types.packageName(ns);
            units.add(packageInfo(ns, pkg, names));

            for (CompositeType type : ns.types()) {
                List<ClassName> see = new ArrayList<>(related.getOrDefault(type, Set.of()));
                TypeSpec spec;
                if (type instanceof Struct s) {
                    spec = structs.synthesize(s, see);
                } else if (type instanceof Union u) {
                    spec = unions.synthesize(u, see);
                } else {
                    throw new IllegalStateException("unsupported composite type " + type);
                }

                JavaFile file = JavaFile.builder(pkg, spec)
                    .addFileComment(FILE_COMMENT)
                    .skipJavaLangImports(true)
                    .indent("    ")
                    .build();
                String id = ns.name() + "/" + spec.name;
                units.add(new GeneratedUnit(id, pkg, spec.name, file.toString()));
                log.debug("Rendered {} as {}.{}", id, pkg, spec.name);
            }
        }
        return units;
    }

    // =========================================================================
    // Namespace summaries
    // =========================================================================

    /** JavaPoet does not emit package-info files, so this one is written by hand. */
    private static GeneratedUnit packageInfo(Namespace ns, String pkg, IdentifierEngine names) {
        String doc = ns.doc() != null && !ns.doc().isBlank()
            ? ns.doc().strip()
            : "Types of the " + names.nameWords(ns.name()) + " namespace.";
        StringBuilder sb = new StringBuilder();
        sb.append("// ").append(FILE_COMMENT).append("\n\n");
        sb.append("/**\n");
        for (String line : doc.split("\n")) {
            sb.append(line.isBlank() ? " *" : " * " + line.strip()).append("\n");
        }
        sb.append(" */\n");
        if (!pkg.isEmpty()) sb.append("package ").append(pkg).append(";\n");
        return new GeneratedUnit(ns.name() + "/" + PACKAGE_INFO, pkg, PACKAGE_INFO, sb.toString());
    }

    // =========================================================================
    // Cross references
    // =========================================================================

    /**
     * Types each type's Javadoc points at: a subtype's parent, a root's subtypes, and for a
     * struct, the structs that hold it in a field.
     */
    static Map<CompositeType, Set<ClassName>> relatedTypes(Api api, TypeMapper types) {
        Map<CompositeType, Set<ClassName>> related = new IdentityHashMap<>();
        for (Namespace ns : api.namespaces()) {
            for (Struct s : ns.structs()) {
                if (s.parent() != null) {
                    link(related, s, types.className(s.parent()));
                }
                for (Struct.Subtype sub : s.subtypes()) {
                    link(related, s, types.className(sub.type()));
                }
                for (Field f : s.fields()) {
                    ModeledType t = Types.unwrap(f.type());
                    if (t instanceof ListType l) t = l.elementType();
                    if (t instanceof Struct held && held != s) {
                        link(related, held, types.className(s));
                    }
                }
            }
        }
        return related;
    }

    private static void link(Map<CompositeType, Set<ClassName>> related, CompositeType from, ClassName to) {
        related.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }
}
