package co.weft.core;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Built-in type names accepted in a schema document.
 *
 * <pre>
 *   Void                           → no value (union tags only)
 *   Boolean                        → boolean
 *   Int32 / UInt32 / Int64 / UInt64 → fixed-width integers
 *   Float32 / Float64              → IEEE floats
 *   String                         → text, optional length and pattern constraints
 *   Bytes                          → raw binary, base64 on the wire
 *   Timestamp                      → ISO-8601 instant
 *   List                           → ordered sequence, requires an items definition
 * </pre>
 *
 * <p>Any other name is a reference to a struct or union, either {@code Name} (same namespace)
 * or {@code namespace.Name}.
 */
public enum FieldType {
    VOID("Void"),
    BOOLEAN("Boolean"),
    INT32("Int32"),
    UINT32("UInt32"),
    INT64("Int64"),
    UINT64("UInt64"),
    FLOAT32("Float32"),
    FLOAT64("Float64"),
    STRING("String"),
    BYTES("Bytes"),
    TIMESTAMP("Timestamp"),
    LIST("List");

    private static final Map<String, FieldType> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(FieldType::schemaName, Function.identity()));

    private final String schemaName;

    FieldType(String schemaName) {
        this.schemaName = schemaName;
    }

    /** Name of the type as written in a schema document. */
    public String schemaName() {
        return schemaName;
    }

    public boolean isNumeric() {
        return switch (this) {
            case INT32, UINT32, INT64, UINT64, FLOAT32, FLOAT64 -> true;
            default -> false;
        };
    }

    public boolean isIntegral() {
        return switch (this) {
            case INT32, UINT32, INT64, UINT64 -> true;
            default -> false;
        };
    }

    /**
     * Return true if {@code s} names a built-in type.
     *
     * @param s the type string from a schema document
     * @return true if built-in
     */
    public static boolean isValid(String s) {
        return s != null && BY_NAME.containsKey(s);
    }

    /**
     * Look up a built-in type by its schema name.
     *
     * @throws IllegalArgumentException if {@code s} is not a built-in type name
     */
    public static FieldType fromName(String s) {
        FieldType t = s == null ? null : BY_NAME.get(s);
        if (t == null) throw new IllegalArgumentException("not a built-in type: " + s);
        return t;
    }
}
