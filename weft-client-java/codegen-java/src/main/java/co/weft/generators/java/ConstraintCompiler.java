package co.weft.generators.java;

import co.weft.core.FieldType;
import co.weft.core.types.ListType;
import co.weft.core.types.ModeledType;
import co.weft.core.types.NumericType;
import co.weft.core.types.StringType;
import co.weft.core.types.Struct;
import co.weft.core.types.Types;
import co.weft.core.types.Union;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;

import javax.lang.model.element.Modifier;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Works out, per field, what a constructor must check and what value it stores.
 *
 * <p>Order of the emitted code for one field:
 * <ol>
 *   <li>lists: defensive copy (absent input becomes an empty list), then count checks on the copy;</li>
 *   <li>defaulted references: absent input replaced by the default;</li>
 *   <li>other references that are not nullable: {@code NullPointerException} naming the field;</li>
 *   <li>nullable values: every remaining check guarded by a presence test;</li>
 *   <li>range, length and pattern checks, each an {@code IllegalArgumentException}.</li>
 * </ol>
 *
 * <p>UInt32 values are always range checked, against {@code [0, 4294967295]} unless the
 * declared bounds are tighter.
 */
public final class ConstraintCompiler {

    private static final BigDecimal UINT32_MAX = BigDecimal.valueOf(0xFFFFFFFFL);

    private final IdentifierEngine names;
    private final TypeMapper types;

    public ConstraintCompiler(IdentifierEngine names, TypeMapper types) {
        this.names = names;
        this.types = types;
    }

    /** One violated-bound test. {@code condition} holds when the value is invalid. */
    public record Check(CodeBlock condition, CodeBlock error) {}

    /**
     * Construction plan for one field.
     *
     * @param name         Java field / parameter name
     * @param label        name used in error messages
     * @param type         modeled type, possibly nullable
     * @param nullable     value may be absent; checks only run when present
     * @param rejectsNull  absent value is a {@code NullPointerException}
     * @param list         value is copied into a fresh list before checks
     * @param checks       bound checks in declaration order
     * @param defaultValue expression substituted for an absent value, or {@code null}
     * @param pattern      compiled-pattern constant the checks refer to, or {@code null}
     */
    public record FieldPlan(
        String name,
        String label,
        ModeledType type,
        boolean nullable,
        boolean rejectsNull,
        boolean list,
        List<Check> checks,
        CodeBlock defaultValue,
        FieldSpec pattern
    ) {
        public boolean hasDefault() {
            return defaultValue != null;
        }
    }

    /**
     * Plan a field from its schema name, type and declared default.
     *
     * @throws UnsupportedOperationException if a default is declared on a struct-typed field
     */
    public FieldPlan plan(String schemaName, ModeledType type, Object declaredDefault) {
        return plan(schemaName, names.argName(schemaName), type, declaredDefault);
    }

    /**
     * Plan a value stored under a Java name other than the one derived from its schema name.
     * Messages and the pattern constant still use the schema name.
     */
    public FieldPlan plan(String schemaName, String name, ModeledType type, Object declaredDefault) {
        String label = names.argName(schemaName);
        boolean nullable = Types.isNullable(type);
        ModeledType base = Types.unwrap(type);
        boolean list = base instanceof ListType;

        CodeBlock defaultValue = declaredDefault == null ? null : defaultExpression(schemaName, base, declaredDefault);
        boolean rejectsNull = !nullable && !list && defaultValue == null && types.isReference(base);

        // lists are checked on the stored copy, everything else on the parameter
        String subject = list ? "this." + name : name;
        FieldSpec pattern = null;
        List<Check> checks = new ArrayList<>();

        if (base instanceof NumericType num) {
            BigDecimal min = num.min();
            BigDecimal max = num.max();
            if (num.kind() == FieldType.UINT32) {
                // stored in a long, so the wire range is always enforced
                if (min == null || min.signum() < 0) min = BigDecimal.ZERO;
                if (max == null || max.compareTo(UINT32_MAX) > 0) max = UINT32_MAX;
            }
            if (min != null) checks.add(numericCheck(label, subject, num.kind(), min, true));
            if (max != null) checks.add(numericCheck(label, subject, num.kind(), max, false));
        } else if (base instanceof StringType str) {
            if (str.minLength() != null) {
                checks.add(new Check(
                    CodeBlock.of("$L.length() < $L", subject, str.minLength()),
                    CodeBlock.of("$S + $L.length()", label + " must have minimum length " + str.minLength() + ", got ", subject)));
            }
            if (str.maxLength() != null) {
                checks.add(new Check(
                    CodeBlock.of("$L.length() > $L", subject, str.maxLength()),
                    CodeBlock.of("$S + $L.length()", label + " must have maximum length " + str.maxLength() + ", got ", subject)));
            }
            if (str.pattern() != null) {
                String constant = names.constantName(schemaName) + "_PATTERN";
                pattern = FieldSpec.builder(Pattern.class, constant, Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                    .initializer("$T.compile($S)", Pattern.class, str.pattern())
                    .build();
                checks.add(new Check(
                    CodeBlock.of("!$N.matcher($L).matches()", pattern, subject),
                    CodeBlock.of("$S", label + " must match pattern '" + str.pattern() + "'")));
            }
        } else if (base instanceof ListType l) {
            if (l.minItems() != null) {
                checks.add(new Check(
                    CodeBlock.of("$L.size() < $L", subject, l.minItems()),
                    CodeBlock.of("$S + $L.size()", label + " must have at least " + l.minItems() + " items, got ", subject)));
            }
            if (l.maxItems() != null) {
                checks.add(new Check(
                    CodeBlock.of("$L.size() > $L", subject, l.maxItems()),
                    CodeBlock.of("$S + $L.size()", label + " must have at most " + l.maxItems() + " items, got ", subject)));
            }
        }

        return new FieldPlan(name, label, type, nullable, rejectsNull, list, Collections.unmodifiableList(checks), defaultValue, pattern);
    }

    private static Check numericCheck(String label, String subject, FieldType kind, BigDecimal bound, boolean lower) {
        String literal = TypeMapper.numericLiteral(kind, bound);
        String op = lower ? "<" : ">";
        String message = label + " must be " + (lower ? ">= " : "<= ") + bound.toPlainString() + ", got ";
        if (kind == FieldType.UINT64) {
            return new Check(
                CodeBlock.of("$T.compareUnsigned($L, $L) $L 0", Long.class, subject, literal, op),
                CodeBlock.of("$S + $T.toUnsignedString($L)", message, Long.class, subject));
        }
        return new Check(
            CodeBlock.of("$L $L $L", subject, op, literal),
            CodeBlock.of("$S + $L", message, subject));
    }

    // =========================================================================
    // Defaults
    // =========================================================================

    private CodeBlock defaultExpression(String schemaName, ModeledType base, Object declaredDefault) {
        if (base instanceof Struct) {
            throw new UnsupportedOperationException(
                "default values for struct-typed fields are not supported: " + schemaName);
        }
        if (base instanceof Union u) {
            ClassName union = types.className(u);
            String variant = names.variantClassName(u.name(), declaredDefault.toString());
            return CodeBlock.of("$T.INSTANCE", union.nestedClass(variant));
        }
        return types.literal(base, declaredDefault);
    }

    // =========================================================================
    // Emission
    // =========================================================================

    /**
     * Constructor statements that validate the parameter named {@code plan.name()} and
     * store it in the field of the same name.
     */
    public CodeBlock initialization(FieldPlan plan) {
        CodeBlock.Builder code = CodeBlock.builder();
        String n = plan.name();

        if (plan.list()) {
            code.addStatement("this.$N = $N != null ? new $T<>($N) : new $T<>()", n, n, ArrayList.class, n, ArrayList.class);
            addChecks(code, plan.checks());
            return code.build();
        }

        if (plan.hasDefault() && types.isReference(plan.type())) {
            code.addStatement("$N = $N != null ? $N : $L", n, n, n, plan.defaultValue());
        }
        if (plan.rejectsNull()) {
            code.beginControlFlow("if ($N == null)", n)
                .addStatement("throw new $T($S)", NullPointerException.class, plan.label())
                .endControlFlow();
        }
        if (plan.nullable() && !plan.checks().isEmpty()) {
            code.beginControlFlow("if ($N != null)", n);
            addChecks(code, plan.checks());
            code.endControlFlow();
        } else {
            addChecks(code, plan.checks());
        }
        code.addStatement("this.$N = $N", n, n);
        return code.build();
    }

    private static void addChecks(CodeBlock.Builder code, List<Check> checks) {
        for (Check c : checks) {
            code.beginControlFlow("if ($L)", c.condition())
                .addStatement("throw new $T($L)", IllegalArgumentException.class, c.error())
                .endControlFlow();
        }
    }

    /**
     * Value the no-arg constructor stores: the default if declared, an empty list for lists,
     * otherwise {@code null} meaning the Java zero value is left in place.
     */
    public CodeBlock zeroState(FieldPlan plan) {
        if (plan.hasDefault()) return plan.defaultValue();
        if (plan.list()) return CodeBlock.of("new $T<>()", ArrayList.class);
        return null;
    }
}
