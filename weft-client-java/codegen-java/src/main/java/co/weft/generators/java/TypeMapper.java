package co.weft.generators.java;

import co.weft.core.FieldType;
import co.weft.core.types.CompositeType;
import co.weft.core.types.ListType;
import co.weft.core.types.ModeledType;
import co.weft.core.types.Namespace;
import co.weft.core.types.NullableType;
import co.weft.core.types.NumericType;
import co.weft.core.types.PrimitiveType;
import co.weft.core.types.StringType;
import co.weft.core.types.Types;
import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Maps modeled types to Java types.
 *
 * <pre>
 *   Bool                 → boolean
 *   Int32                → int
 *   UInt32, Int64        → long
 *   UInt64               → long (compared with Long.compareUnsigned)
 *   Float32 / Float64    → float / double
 *   String               → String
 *   Bytes                → byte[]
 *   Timestamp            → Instant
 *   List(T)              → List&lt;T&gt; stored, Collection&lt;T&gt; as a parameter
 *   Nullable(T)          → boxed T
 *   Struct / Union       → generated class
 *   Void                 → void, or Void as a type argument
 * </pre>
 */
public final class TypeMapper {

    /** Where a mapped type appears. */
    public enum Usage {
        /** Stored field and getter. */
        PROPERTY,
        /** Constructor or builder parameter. */
        PARAMETER,
        /** Type argument or other position that needs a reference type. */
        VALUE
    }

    private final IdentifierEngine names;
    private final String basePackage;

    public TypeMapper(IdentifierEngine names, String basePackage) {
        this.names = names;
        this.basePackage = basePackage == null ? "" : basePackage;
    }

    // =========================================================================
    // Type names
    // =========================================================================

    public String packageName(Namespace ns) {
        String seg = names.packageSegment(ns.name());
        return basePackage.isEmpty() ? seg : basePackage + "." + seg;
    }

    public ClassName className(CompositeType type) {
        return ClassName.get(packageName(type.namespace()), names.publicName(type.name()));
    }

    /**
     * How a composite type is written from inside {@code scope}: its simple name, or the
     * fully qualified name when a local declaration shadows it.
     */
    public String typeReference(CompositeType type, ScopeContext scope) {
        ClassName name = className(type);
        return scope.collides(name.simpleName()) ? name.canonicalName() : name.simpleName();
    }

    public TypeName map(ModeledType type, Usage usage) {
        if (type instanceof NullableType n) {
            return map(n.inner(), usage).box();
        }
        TypeName mapped;
        if (type instanceof CompositeType c) {
            mapped = className(c);
        } else if (type instanceof ListType l) {
            TypeName element = map(l.elementType(), Usage.VALUE);
            ClassName container = usage == Usage.PARAMETER ? ClassName.get(Collection.class) : ClassName.get(List.class);
            mapped = ParameterizedTypeName.get(container, element);
        } else if (type instanceof StringType) {
            mapped = ClassName.get(String.class);
        } else if (type instanceof NumericType num) {
            mapped = mapNumber(num.kind());
        } else if (type == PrimitiveType.VOID) {
            return usage == Usage.VALUE ? ClassName.get(Void.class) : TypeName.VOID;
        } else if (type == PrimitiveType.BOOLEAN) {
            mapped = TypeName.BOOLEAN;
        } else if (type == PrimitiveType.BYTES) {
            mapped = ArrayTypeName.of(TypeName.BYTE);
        } else if (type == PrimitiveType.TIMESTAMP) {
            mapped = ClassName.get(Instant.class);
        } else {
            throw new IllegalStateException("unmapped type " + type.describe());
        }
        return usage == Usage.VALUE ? mapped.box() : mapped;
    }

    /**
     * Class whose static {@code equals}/{@code hashCode}/{@code toString} compare the Java form
     * of {@code type} by content, or {@code null} when {@link java.util.Objects} does.
     */
    public ClassName contentHelper(ModeledType type) {
        ModeledType base = Types.unwrap(type);
        if (base == PrimitiveType.BYTES) return ClassName.get(Arrays.class);
        if (base instanceof ListType l && Types.unwrap(l.elementType()) == PrimitiveType.BYTES) {
            return RuntimeTypes.BINARY_LISTS;
        }
        return null;
    }

    /** True when the Java form of {@code type} can hold {@code null}. */
    public boolean isReference(ModeledType type) {
        return !map(type, Usage.PROPERTY).isPrimitive();
    }

    private static TypeName mapNumber(FieldType kind) {
        return switch (kind) {
            case INT32 -> TypeName.INT;
            case UINT32, INT64, UINT64 -> TypeName.LONG;
            case FLOAT32 -> TypeName.FLOAT;
            case FLOAT64 -> TypeName.DOUBLE;
            default -> throw new IllegalStateException("not numeric: " + kind);
        };
    }

    // =========================================================================
    // Literals
    // =========================================================================

    /**
     * Suffix that types a numeric literal unambiguously.
     *
     * | kind    | suffix |
     * |---------|--------|
     * | Int32   |        |
     * | UInt32  | L      |
     * | Int64   | L      |
     * | UInt64  | L      |
     * | Float32 | F      |
     * | Float64 | D      |
     */
    public static String literalSuffix(FieldType kind) {
        return switch (kind) {
            case INT32 -> "";
            case UINT32, INT64, UINT64 -> "L";
            case FLOAT32 -> "F";
            case FLOAT64 -> "D";
            default -> throw new IllegalStateException("not numeric: " + kind);
        };
    }

    /** Java source for a numeric value of the given kind. UInt64 values past Long.MAX_VALUE render as hex. */
    public static String numericLiteral(FieldType kind, BigDecimal value) {
        if (kind.isIntegral()) {
            BigInteger v = value.toBigIntegerExact();
            if (kind == FieldType.UINT64 && v.bitLength() > 63) {
                return "0x" + Long.toHexString(v.longValue()).toUpperCase() + literalSuffix(kind);
            }
            return v + literalSuffix(kind);
        }
        return value.toPlainString() + literalSuffix(kind);
    }

    /** Initializer for a scalar, boolean or string default. */
    public CodeBlock literal(ModeledType type, Object value) {
        ModeledType t = type instanceof NullableType n ? n.inner() : type;
        if (t == PrimitiveType.BOOLEAN) {
            return CodeBlock.of("$L", Boolean.parseBoolean(value.toString()));
        }
        if (t instanceof StringType) {
            return CodeBlock.of("$S", value.toString());
        }
        if (t instanceof NumericType num) {
            BigDecimal d = value instanceof BigDecimal b ? b : new BigDecimal(value.toString());
            return CodeBlock.of("$L", numericLiteral(num.kind(), d));
        }
        throw new IllegalStateException("no literal form for " + type.describe());
    }

    // =========================================================================
    // Codecs
    // =========================================================================

    /** {@code Codecs.X} constant for a scalar type. */
    public CodeBlock codec(ModeledType type) {
        ModeledType t = type instanceof NullableType n ? n.inner() : type;
        String constant;
        if (t instanceof StringType) {
            constant = "STRING";
        } else if (t instanceof NumericType num) {
            constant = num.kind().name();
        } else if (t == PrimitiveType.BOOLEAN) {
            constant = "BOOLEAN";
        } else if (t == PrimitiveType.BYTES) {
            constant = "BINARY";
        } else if (t == PrimitiveType.TIMESTAMP) {
            constant = "TIMESTAMP";
        } else {
            throw new IllegalStateException("no codec for " + type.describe());
        }
        return CodeBlock.of("$T.$L", RuntimeTypes.CODECS, constant);
    }
}
