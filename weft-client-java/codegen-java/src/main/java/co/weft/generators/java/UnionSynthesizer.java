package co.weft.generators.java;

import co.weft.core.types.CompositeType;
import co.weft.core.types.ListType;
import co.weft.core.types.ModeledType;
import co.weft.core.types.Union;
import co.weft.core.types.UnionField;
import co.weft.generators.java.ConstraintCompiler.FieldPlan;
import co.weft.generators.java.TypeMapper.Usage;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Emits the Java class for one union: a base class holding the tag enum, accessors and the
 * encode/decode dispatch, plus one nested subclass per variant.
 *
 * <pre>
 *   Void variant   → singleton ({@code INSTANCE}), encoded as the tag alone
 *   value variant  → immutable holder with {@code getValue()}, encoded as tag + entry named after the variant
 * </pre>
 */
public final class UnionSynthesizer {

    /** Name of the nested discriminant enum. */
    static final String TAG_ENUM = "Tag";

    private static final String VALUE = "value";

    private final IdentifierEngine names;
    private final TypeMapper types;
    private final ConstraintCompiler constraints;
    private final HierarchyResolver hierarchy;

    public UnionSynthesizer(IdentifierEngine names, TypeMapper types,
                            ConstraintCompiler constraints, HierarchyResolver hierarchy) {
        this.names = names;
        this.types = types;
        this.constraints = constraints;
        this.hierarchy = hierarchy;
    }

    /** Nested names declared by the union's class; references to other types with these names must be qualified. */
    public ScopeContext scope(Union union, ScopeContext outer) {
        List<String> local = new ArrayList<>();
        local.add(TAG_ENUM);
        for (UnionField f : union.fields()) {
            local.add(names.variantClassName(union.name(), f.name()));
        }
        return outer.enter(local);
    }

    public TypeSpec synthesize(Union union, List<ClassName> related) {
        ClassName self = types.className(union);
        ClassName tagEnum = self.nestedClass(TAG_ENUM);
        ScopeContext scope = scope(union, ScopeContext.EMPTY);
        String unionName = self.simpleName();

        TypeSpec.Builder tb = TypeSpec.classBuilder(self)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(ParameterizedTypeName.get(RuntimeTypes.ENCODABLE, self))
            .alwaysQualify(scope.namesArray());

        if (union.doc() != null && !union.doc().isBlank()) {
            tb.addJavadoc("$L\n", union.doc().strip());
        } else {
            tb.addJavadoc("The $L object.\n", names.nameWords(union.name()));
        }
        if (hierarchy.isOpen(union)) {
            tb.addJavadoc("\n<p>Unrecognized tags decode as {@link $L}.\n",
                variantClass(self, union, union.catchAllField()).simpleName());
        }
        if (!related.isEmpty()) {
            tb.addJavadoc("\n");
            for (ClassName r : related) tb.addJavadoc("@see $T\n", r);
        }

        TypeSpec.Builder eb = TypeSpec.enumBuilder(tagEnum).addModifiers(Modifier.PUBLIC);
        for (UnionField f : union.fields()) {
            eb.addEnumConstant(names.constantName(f.name()));
        }
        tb.addType(eb.build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Decode prototype. Use a variant for actual values.\n")
            .build());

        MethodSpec.Builder tag = MethodSpec.methodBuilder("tag")
            .addModifiers(Modifier.PUBLIC)
            .returns(tagEnum);
        if (hierarchy.isOpen(union)) {
            tag.addStatement("return $T.$L", tagEnum, names.constantName(union.catchAllField().name()));
        } else {
            tag.addStatement("throw new $T($S)", IllegalStateException.class, unionName + " is not one of its variants");
        }
        tb.addMethod(tag.build());

        addAccessors(tb, union, self, tagEnum);
        addEncode(tb, union, self, tagEnum);
        addDecode(tb, union, self);

        for (UnionField f : union.fields()) {
            tb.addType(f.isVoid()
                ? voidVariant(union, f, self, tagEnum)
                : valueVariant(union, f, self, tagEnum, scope));
        }
        return tb.build();
    }

    private ClassName variantClass(ClassName self, Union union, UnionField f) {
        return self.nestedClass(names.variantClassName(union.name(), f.name()));
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    private void addAccessors(TypeSpec.Builder tb, Union union, ClassName self, ClassName tagEnum) {
        for (UnionField f : union.fields()) {
            String pub = names.publicName(f.name());
            tb.addMethod(MethodSpec.methodBuilder("is" + pub)
                .addModifiers(Modifier.PUBLIC)
                .returns(TypeName.BOOLEAN)
                .addStatement("return tag() == $T.$L", tagEnum, names.constantName(f.name()))
                .build());
            if (f.isVoid()) continue;

            ClassName variant = variantClass(self, union, f);
            tb.addMethod(MethodSpec.methodBuilder("as" + pub)
                .addModifiers(Modifier.PUBLIC)
                .returns(variant)
                .beginControlFlow("if (!(this instanceof $T))", variant)
                .addStatement("throw new $T($S)", IllegalStateException.class,
                    self.simpleName() + " is not " + f.name())
                .endControlFlow()
                .addStatement("return ($T) this", variant)
                .build());
        }
    }

    // =========================================================================
    // Encode / decode
    // =========================================================================

    private void addEncode(TypeSpec.Builder tb, Union union, ClassName self, ClassName tagEnum) {
        MethodSpec.Builder mb = MethodSpec.methodBuilder("encode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .addParameter(RuntimeTypes.ENCODER, "encoder")
            .addStatement("$T obj = encoder.addObject()", RuntimeTypes.OBJECT_ENCODER)
            .beginControlFlow("switch (tag())");
        for (UnionField f : union.fields()) {
            String constant = names.constantName(f.name());
            String wireTag = hierarchy.tag(f);
            if (f.isVoid()) {
                mb.addStatement("case $L -> obj.addTag($S)", constant, wireTag);
                continue;
            }
            CodeBlock value = CodeBlock.of("as$L().getValue()", names.publicName(f.name()));
            mb.beginControlFlow("case $L ->", constant)
                .addStatement("obj.addTag($S)", wireTag)
                .addStatement("$L", writeValue(f, value))
                .endControlFlow();
        }
        mb.endControlFlow();
        tb.addMethod(mb.build());
    }

    private CodeBlock writeValue(UnionField f, CodeBlock value) {
        ModeledType t = f.type();
        if (t instanceof ListType l) {
            return l.elementType() instanceof CompositeType
                ? CodeBlock.of("obj.addFieldObjectList($S, $L)", f.name(), value)
                : CodeBlock.of("obj.addFieldList($S, $L, $L)", f.name(), types.codec(l.elementType()), value);
        }
        if (t instanceof CompositeType) {
            return CodeBlock.of("obj.addFieldObject($S, $L)", f.name(), value);
        }
        return CodeBlock.of("obj.addField($S, $L, $L)", f.name(), types.codec(t), value);
    }

    private CodeBlock readValue(UnionField f) {
        ModeledType t = f.type();
        if (t instanceof ListType l) {
            if (l.elementType() instanceof CompositeType c) {
                ClassName element = types.className(c);
                return CodeBlock.of("decoder.getObject().getFieldObjectList($S, $T.class, $T::new)", f.name(), element, element);
            }
            return CodeBlock.of("decoder.getObject().getFieldList($S, $L)", f.name(), types.codec(l.elementType()));
        }
        if (t instanceof CompositeType c) {
            ClassName target = types.className(c);
            return CodeBlock.of("decoder.getObject().getFieldObject($S, $T.class, $T::new)", f.name(), target, target);
        }
        return CodeBlock.of("decoder.getObject().getField($S, $L)", f.name(), types.codec(t));
    }

    private void addDecode(TypeSpec.Builder tb, Union union, ClassName self) {
        CodeBlock.Builder dispatch = CodeBlock.builder()
            .add("return switch (tag) {\n")
            .indent();
        for (UnionField f : union.fields()) {
            ClassName variant = variantClass(self, union, f);
            if (f.isVoid()) {
                dispatch.add("case $S -> $T.INSTANCE;\n", hierarchy.tag(f), variant);
            } else {
                dispatch.add("case $S -> new $T($L);\n", hierarchy.tag(f), variant, readValue(f));
            }
        }
        if (hierarchy.isOpen(union)) {
            dispatch.add("default -> $T.INSTANCE;\n", variantClass(self, union, union.catchAllField()));
        } else {
            dispatch.add("default -> throw new $T($S + tag + $S);\n", IllegalStateException.class,
                "Unknown tag '", "' for " + self.simpleName());
        }
        dispatch.unindent().add("};\n");

        tb.addMethod(MethodSpec.methodBuilder("decode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(self)
            .addParameter(RuntimeTypes.DECODER, "decoder")
            .addStatement("$T tag = decoder.getUnionTag()", String.class)
            .addCode(dispatch.build())
            .build());
    }

    // =========================================================================
    // Variants
    // =========================================================================

    private TypeSpec.Builder variantBuilder(UnionField f, ClassName self, ClassName variant, ClassName tagEnum) {
        TypeSpec.Builder vb = TypeSpec.classBuilder(variant)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .superclass(self);
        if (f.doc() != null && !f.doc().isBlank()) vb.addJavadoc("$L\n", f.doc().strip());

        vb.addMethod(MethodSpec.methodBuilder("tag")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(tagEnum)
            .addStatement("return $T.$L", tagEnum, names.constantName(f.name()))
            .build());
        vb.addMethod(MethodSpec.methodBuilder("decode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(self)
            .addParameter(RuntimeTypes.DECODER, "decoder")
            .addStatement("throw new $T($S)", IllegalStateException.class,
                "Decoding happens through the " + self.simpleName() + " base class")
            .build());
        return vb;
    }

    private TypeSpec voidVariant(Union union, UnionField f, ClassName self, ClassName tagEnum) {
        ClassName variant = variantClass(self, union, f);
        TypeSpec.Builder vb = variantBuilder(f, self, variant, tagEnum);
        vb.addField(FieldSpec.builder(variant, "INSTANCE", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer("new $T()", variant)
            .build());
        vb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());
        vb.addMethod(MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return $S", self.simpleName() + "." + variant.simpleName())
            .build());
        return vb.build();
    }

    private TypeSpec valueVariant(Union union, UnionField f, ClassName self, ClassName tagEnum, ScopeContext scope) {
        ClassName variant = variantClass(self, union, f);
        FieldPlan plan = constraints.plan(f.name(), VALUE, f.type(), null);
        TypeName property = types.map(f.type(), Usage.PROPERTY);
        TypeName parameter = types.map(f.type(), Usage.PARAMETER);
        ClassName helper = types.contentHelper(f.type());
        ClassName equality = helper != null ? helper : ClassName.get(Objects.class);

        TypeSpec.Builder vb = variantBuilder(f, self, variant, tagEnum);
        if (f.type() instanceof CompositeType c && (f.doc() == null || f.doc().isBlank())) {
            vb.addJavadoc("Carries a {@code $L}.\n", types.typeReference(c, scope));
        }
        if (plan.pattern() != null) vb.addField(plan.pattern());
        vb.addField(FieldSpec.builder(property, VALUE, Modifier.PRIVATE, Modifier.FINAL).build());

        vb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addParameter(parameter, VALUE)
            .addCode(constraints.initialization(plan))
            .build());
        MethodSpec.Builder getter = MethodSpec.methodBuilder("getValue")
            .addModifiers(Modifier.PUBLIC)
            .returns(property);
        if (plan.list()) {
            getter.addStatement("return $T.unmodifiableList(this.value)", Collections.class);
        } else {
            getter.addStatement("return this.value");
        }
        vb.addMethod(getter.build());

        vb.addMethod(MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(TypeName.BOOLEAN)
            .addParameter(Object.class, "o")
            .addStatement("if (this == o) return true")
            .addStatement("if (!(o instanceof $T)) return false", variant)
            .addStatement("return $T.equals(this.value, (($T) o).value)", equality, variant)
            .build());
        vb.addMethod(MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(TypeName.INT)
            .addStatement("return $T.hashCode(this.value)", equality)
            .build());
        CodeBlock shown = helper != null
            ? CodeBlock.of("$T.toString(this.value)", helper)
            : CodeBlock.of("this.value");
        vb.addMethod(MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return $S + $L + $S", self.simpleName() + "." + variant.simpleName() + "(", shown, ")")
            .build());
        return vb.build();
    }
}
