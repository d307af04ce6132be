package co.weft.generators.java;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Turns schema names into Java identifiers.
 *
 * <p>Names are segmented on {@code /}, {@code _} and camel-case boundaries, then re-cased:
 * <pre>
 *   segment("fooBar_baz")  → [foo, bar, baz]
 *   publicName("foo_bar")  → FooBar
 *   argName("FooBar")      → fooBar
 *   argName("class")       → class_
 *   nameWords("fooBar")    → "foo bar"
 *   constantName("fooBar") → FOO_BAR
 * </pre>
 *
 * <p>Results are memoized per instance. Use one engine per generation run; the caches are
 * safe to share between threads of that run.
 */
public final class IdentifierEngine {

    private static final Pattern CAMEL_CASE = Pattern.compile("((?<=[a-z0-9])[A-Z]|(?!^)[A-Z](?=[a-z]))");

    private static final Set<String> JAVA_KEYWORDS = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
        "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
        "volatile", "while", "true", "false", "null", "var", "yield", "record", "_");

    /** Suffix that keeps an identifier clear of a keyword or a clashing name. */
    static final String ESCAPE_SUFFIX = "_";

    private final Map<String, List<String>> segments = new ConcurrentHashMap<>();
    private final Map<String, String> publicNames = new ConcurrentHashMap<>();
    private final Map<String, String> argNames = new ConcurrentHashMap<>();

    /** Lowercase words of {@code name}, in order. */
    public List<String> segment(String name) {
        return segments.computeIfAbsent(name, IdentifierEngine::computeSegments);
    }

    /** Capitalized segments, concatenated. Used for type and member names. */
    public String publicName(String name) {
        return publicNames.computeIfAbsent(name, n -> {
            StringBuilder sb = new StringBuilder();
            for (String s : segment(n)) {
                sb.append(Character.toUpperCase(s.charAt(0))).append(s, 1, s.length());
            }
            return sb.toString();
        });
    }

    /** {@link #publicName} with a lowercase first letter, escaped if it is a Java keyword. */
    public String argName(String name) {
        return argNames.computeIfAbsent(name, n -> {
            String pub = publicName(n);
            if (pub.isEmpty()) return pub;
            String arg = Character.toLowerCase(pub.charAt(0)) + pub.substring(1);
            return isKeyword(arg) ? arg + ESCAPE_SUFFIX : arg;
        });
    }

    /** Segments joined with spaces, for generated prose only. */
    public String nameWords(String name) {
        return String.join(" ", segment(name));
    }

    public String constantName(String name) {
        return String.join("_", segment(name)).toUpperCase(Locale.ROOT);
    }

    /** Package segment for a namespace: segments concatenated, escaped if a keyword. */
    public String packageSegment(String namespaceName) {
        String seg = String.join("", segment(namespaceName));
        return isKeyword(seg) ? seg + ESCAPE_SUFFIX : seg;
    }

    /** Getter for a field. {@code getClass} is taken by {@link Object}. */
    public String getterName(String fieldName) {
        String getter = "get" + publicName(fieldName);
        return getter.equals("getClass") ? getter + ESCAPE_SUFFIX : getter;
    }

    /**
     * Class name of a union variant. Java forbids a member class named like its enclosing
     * class, and {@code Tag} is taken by the variant enum.
     */
    public String variantClassName(String unionName, String variantName) {
        String name = publicName(variantName);
        if (name.equals(publicName(unionName)) || name.equals(UnionSynthesizer.TAG_ENUM)) {
            return name + "Value";
        }
        return name;
    }

    public static boolean isKeyword(String s) {
        return JAVA_KEYWORDS.contains(s);
    }

    private static List<String> computeSegments(String name) {
        String split = CAMEL_CASE.matcher(name.replace('/', '_')).replaceAll("_$1").toLowerCase(Locale.ROOT);
        List<String> out = new ArrayList<>();
        for (String s : split.split("_")) {
            if (!s.isEmpty()) out.add(s);
        }
        return Collections.unmodifiableList(out);
    }
}
