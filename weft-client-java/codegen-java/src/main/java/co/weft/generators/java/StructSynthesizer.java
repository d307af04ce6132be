package co.weft.generators.java;

import co.weft.core.types.CompositeType;
import co.weft.core.types.Field;
import co.weft.core.types.ListType;
import co.weft.core.types.ModeledType;
import co.weft.core.types.Struct;
import co.weft.core.types.Types;
import co.weft.generators.java.ConstraintCompiler.FieldPlan;
import co.weft.generators.java.HierarchyResolver.Role;
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
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Emits the Java class for one struct.
 *
 * <p>A plain struct is a {@code final} class with private {@code encodeFields}/{@code decodeFields}.
 * A family root owns {@code final} encode/decode that dispatch on the concrete subtype (encode)
 * or on the wire tag (decode), and delegates field handling to the protected, overridable
 * {@code encodeFields}/{@code decodeFields}. Subtypes extend the root and only add their own fields.
 */
public final class StructSynthesizer {

    private final IdentifierEngine names;
    private final TypeMapper types;
    private final ConstraintCompiler constraints;
    private final HierarchyResolver hierarchy;

    public StructSynthesizer(IdentifierEngine names, TypeMapper types,
                             ConstraintCompiler constraints, HierarchyResolver hierarchy) {
        this.names = names;
        this.types = types;
        this.constraints = constraints;
        this.hierarchy = hierarchy;
    }

    /** One field as the synthesizer sees it. */
    private record Member(Field field, FieldPlan plan, TypeName property, TypeName parameter,
                          ClassName contentHelper, boolean inherited) {
        String name() {
            return plan.name();
        }

        String wireName() {
            return field.name();
        }
    }

    /**
     * Build the class for {@code struct}.
     *
     * @param related types listed as {@code @see} in the class Javadoc
     */
    public TypeSpec synthesize(Struct struct, List<ClassName> related) {
        Role role = hierarchy.role(struct);
        ClassName self = types.className(struct);
        ClassName root = types.className(hierarchy.familyRoot(struct));

        List<Member> members = members(struct);
        List<Member> own = members.stream().filter(m -> !m.inherited()).collect(Collectors.toList());

        TypeSpec.Builder tb = TypeSpec.classBuilder(self).addModifiers(Modifier.PUBLIC);
        switch (role) {
            case PLAIN -> tb.addModifiers(Modifier.FINAL)
                .addSuperinterface(ParameterizedTypeName.get(RuntimeTypes.ENCODABLE, self));
            case ROOT -> tb.addSuperinterface(ParameterizedTypeName.get(RuntimeTypes.ENCODABLE, self));
            case SUBTYPE -> tb.addModifiers(Modifier.FINAL).superclass(root);
        }
        addTypeJavadoc(tb, struct, role, related);

        for (Member m : own) {
            if (m.plan().pattern() != null) tb.addField(m.plan().pattern());
        }
        for (Member m : own) {
            tb.addField(FieldSpec.builder(m.property(), m.name(), Modifier.PRIVATE).build());
        }

        addConstructors(tb, role, members, own);
        if (role == Role.ROOT) addSubtypeAccessors(tb, struct, self);
        addGetters(tb, own);
        if (role != Role.ROOT || hierarchy.catchAllMember(struct) == struct) {
            addBuilderClass(tb, self, members, role == Role.PLAIN);
        }

        switch (role) {
            case PLAIN -> addPlainEncodeDecode(tb, self);
            case ROOT -> addDispatchingEncodeDecode(tb, struct, self);
            case SUBTYPE -> { }
        }
        addEncodeFields(tb, role, own);
        addDecodeFields(tb, role, own);

        addEqualsHashCodeToString(tb, self, role, members, own);
        return tb.build();
    }

    private List<Member> members(Struct struct) {
        List<Member> out = new ArrayList<>();
        int inheritedCount = struct.allFields().size() - struct.fields().size();
        int i = 0;
        for (Field f : struct.allFields()) {
            FieldPlan plan = constraints.plan(f.name(), f.type(), f.defaultValue());
            out.add(new Member(f, plan,
                types.map(f.type(), Usage.PROPERTY),
                types.map(f.type(), Usage.PARAMETER),
                types.contentHelper(f.type()),
                i++ < inheritedCount));
        }
        return out;
    }

    private void addTypeJavadoc(TypeSpec.Builder tb, Struct struct, Role role, List<ClassName> related) {
        if (struct.doc() != null && !struct.doc().isBlank()) {
            tb.addJavadoc("$L\n", struct.doc().strip());
        } else {
            tb.addJavadoc("The $L object.\n", names.nameWords(struct.name()));
        }
        if (role == Role.ROOT) {
            tb.addJavadoc("\n<p>Tagged family root. Encoded values carry a {@code .tag} entry naming the subtype.\n");
        }
        if (!related.isEmpty()) {
            tb.addJavadoc("\n");
            for (ClassName r : related) {
                tb.addJavadoc("@see $T\n", r);
            }
        }
    }

    // =========================================================================
    // Constructors
    // =========================================================================

    private void addConstructors(TypeSpec.Builder tb, Role role, List<Member> members, List<Member> own) {
        if (members.isEmpty()) {
            tb.addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PUBLIC).build());
            return;
        }

        MethodSpec.Builder init = MethodSpec.constructorBuilder()
            .addModifiers(role == Role.ROOT ? Modifier.PROTECTED : Modifier.PUBLIC);
        for (Member m : members) {
            init.addParameter(m.parameter(), m.name());
        }
        if (role == Role.SUBTYPE) {
            String superArgs = members.stream().filter(Member::inherited).map(Member::name).collect(Collectors.joining(", "));
            init.addStatement("super($L)", superArgs);
        }
        for (Member m : own) {
            init.addCode(constraints.initialization(m.plan()));
        }
        tb.addMethod(init.build());

        MethodSpec.Builder zero = MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Empty instance with declared defaults applied; used as a decode target.\n");
        for (Member m : own) {
            CodeBlock zeroState = constraints.zeroState(m.plan());
            if (zeroState != null) zero.addStatement("this.$N = $L", m.name(), zeroState);
        }
        tb.addMethod(zero.build());
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    private void addSubtypeAccessors(TypeSpec.Builder tb, Struct root, ClassName self) {
        for (Struct.Subtype s : root.subtypes()) {
            ClassName sub = types.className(s.type());
            String pub = names.publicName(s.type().name());
            tb.addMethod(MethodSpec.methodBuilder("is" + pub)
                .addModifiers(Modifier.PUBLIC)
                .returns(TypeName.BOOLEAN)
                .addStatement("return this instanceof $T", sub)
                .build());
            tb.addMethod(MethodSpec.methodBuilder("as" + pub)
                .addModifiers(Modifier.PUBLIC)
                .returns(sub)
                .beginControlFlow("if (!(this instanceof $T))", sub)
                .addStatement("throw new $T($S)", IllegalStateException.class,
                    names.publicName(root.name()) + " is not a " + pub)
                .endControlFlow()
                .addStatement("return ($T) this", sub)
                .build());
        }
    }

    private void addGetters(TypeSpec.Builder tb, List<Member> own) {
        for (Member m : own) {
            MethodSpec.Builder getter = MethodSpec.methodBuilder(names.getterName(m.wireName()))
                .addModifiers(Modifier.PUBLIC)
                .returns(m.property())
                .addStatement("return this.$N", m.name());
            String doc = m.field().doc();
            if (doc != null && !doc.isBlank()) getter.addJavadoc("$L\n", doc.strip());
            tb.addMethod(getter.build());
        }
    }

    /**
     * Nested {@code Builder} whose fields start at the declared defaults. Only plain structs get
     * a static {@code builder()} factory; in a family it would hide the parent's with an
     * incompatible return type.
     */
    private void addBuilderClass(TypeSpec.Builder tb, ClassName self, List<Member> members, boolean factory) {
        String builderName = self.simpleName().equals("Builder") ? "Builder" + IdentifierEngine.ESCAPE_SUFFIX : "Builder";
        ClassName builder = self.nestedClass(builderName);

        if (factory) {
            tb.addMethod(MethodSpec.methodBuilder("builder")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(builder)
                .addStatement("return new $T()", builder)
                .build());
        }

        TypeSpec.Builder bb = TypeSpec.classBuilder(builder)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL);
        for (Member m : members) {
            FieldSpec.Builder fb = FieldSpec.builder(m.parameter(), m.name(), Modifier.PRIVATE);
            if (m.plan().hasDefault()) fb.initializer(m.plan().defaultValue());
            bb.addField(fb.build());
        }
        for (Member m : members) {
            bb.addMethod(MethodSpec.methodBuilder(m.name())
                .addModifiers(Modifier.PUBLIC)
                .addParameter(m.parameter(), m.name())
                .returns(builder)
                .addStatement("this.$N = $N", m.name(), m.name())
                .addStatement("return this")
                .build());
        }
        String args = members.stream().map(Member::name).collect(Collectors.joining(", "));
        bb.addMethod(MethodSpec.methodBuilder("build")
            .addModifiers(Modifier.PUBLIC)
            .returns(self)
            .addStatement("return new $T($L)", self, args)
            .build());
        tb.addType(bb.build());
    }

    // =========================================================================
    // Encode / decode
    // =========================================================================

    private void addPlainEncodeDecode(TypeSpec.Builder tb, ClassName self) {
        tb.addMethod(MethodSpec.methodBuilder("encode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .addParameter(RuntimeTypes.ENCODER, "encoder")
            .addStatement("$T obj = encoder.addObject()", RuntimeTypes.OBJECT_ENCODER)
            .addStatement("encodeFields(obj)")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("decode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(self)
            .addParameter(RuntimeTypes.DECODER, "decoder")
            .addStatement("$T value = new $T()", self, self)
            .addStatement("value.decodeFields(decoder.getObject())")
            .addStatement("return value")
            .build());
    }

    /**
     * Root-owned encode/decode. Encode writes the concrete subtype's tag; decode allocates the
     * member a tag names, or the catch-all member for an unknown tag, then fills it in.
     */
    private void addDispatchingEncodeDecode(TypeSpec.Builder tb, Struct root, ClassName self) {
        String rootName = names.publicName(root.name());
        Struct catchAll = hierarchy.catchAllMember(root);

        MethodSpec.Builder encode = MethodSpec.methodBuilder("encode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addParameter(RuntimeTypes.ENCODER, "encoder")
            .addStatement("$T obj = encoder.addObject()", RuntimeTypes.OBJECT_ENCODER);
        boolean first = true;
        for (Struct.Subtype s : root.subtypes()) {
            String test = "is" + names.publicName(s.type().name()) + "()";
            if (first) {
                encode.beginControlFlow("if ($L)", test);
                first = false;
            } else {
                encode.nextControlFlow("else if ($L)", test);
            }
            encode.addStatement("obj.addTag($S)", hierarchy.tag(s.type()));
        }
        encode.nextControlFlow("else");
        if (catchAll == root) {
            encode.addStatement("obj.addTag($S)", "");
        } else {
            encode.addStatement("throw new $T($S)", IllegalStateException.class,
                rootName + " must be encoded as one of its subtypes");
        }
        encode.endControlFlow();
        encode.addStatement("encodeFields(obj)");
        tb.addMethod(encode.build());

        CodeBlock.Builder dispatch = CodeBlock.builder()
            .add("$T value = switch (tag) {\n", self)
            .indent();
        for (Struct.Subtype s : root.subtypes()) {
            if (s.type() == catchAll) continue;
            dispatch.add("case $S -> new $T();\n", hierarchy.tag(s.type()), types.className(s.type()));
        }
        if (catchAll != null) {
            dispatch.add("default -> new $T();\n", types.className(catchAll));
        } else {
            dispatch.add("default -> throw new $T($S + tag + $S);\n", IllegalStateException.class,
                "Unknown tag '", "' for " + rootName);
        }
        dispatch.unindent().add("};\n");

        tb.addMethod(MethodSpec.methodBuilder("decode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .returns(self)
            .addParameter(RuntimeTypes.DECODER, "decoder")
            .addStatement("$T obj = decoder.getObject()", RuntimeTypes.OBJECT_DECODER)
            .addStatement("$T tag = obj.getTag()", String.class)
            .addCode(dispatch.build())
            .addStatement("value.decodeFields(obj)")
            .addStatement("return value")
            .build());
    }

    private static MethodSpec.Builder fieldsMethod(String name, Role role) {
        MethodSpec.Builder mb = MethodSpec.methodBuilder(name);
        switch (role) {
            case PLAIN -> mb.addModifiers(Modifier.PRIVATE);
            case ROOT -> mb.addModifiers(Modifier.PROTECTED);
            case SUBTYPE -> mb.addAnnotation(Override.class).addModifiers(Modifier.PROTECTED);
        }
        return mb;
    }

    private void addEncodeFields(TypeSpec.Builder tb, Role role, List<Member> own) {
        MethodSpec.Builder mb = fieldsMethod("encodeFields", role)
            .addParameter(RuntimeTypes.OBJECT_ENCODER, "obj");
        if (role == Role.SUBTYPE) mb.addStatement("super.encodeFields(obj)");
        for (Member m : own) {
            ModeledType base = Types.unwrap(m.field().type());
            if (base instanceof ListType l) {
                mb.beginControlFlow("if (!this.$N.isEmpty())", m.name());
                if (l.elementType() instanceof CompositeType) {
                    mb.addStatement("obj.addFieldObjectList($S, this.$N)", m.wireName(), m.name());
                } else {
                    mb.addStatement("obj.addFieldList($S, $L, this.$N)", m.wireName(), types.codec(l.elementType()), m.name());
                }
                mb.endControlFlow();
                continue;
            }
            CodeBlock write = base instanceof CompositeType
                ? CodeBlock.of("obj.addFieldObject($S, this.$N)", m.wireName(), m.name())
                : CodeBlock.of("obj.addField($S, $L, this.$N)", m.wireName(), types.codec(base), m.name());
            if (m.plan().nullable()) {
                mb.beginControlFlow("if (this.$N != null)", m.name())
                    .addStatement("$L", write)
                    .endControlFlow();
            } else {
                mb.addStatement("$L", write);
            }
        }
        tb.addMethod(mb.build());
    }

    private void addDecodeFields(TypeSpec.Builder tb, Role role, List<Member> own) {
        MethodSpec.Builder mb = fieldsMethod("decodeFields", role)
            .addParameter(RuntimeTypes.OBJECT_DECODER, "obj");
        if (role == Role.SUBTYPE) mb.addStatement("super.decodeFields(obj)");
        for (Member m : own) {
            ModeledType base = Types.unwrap(m.field().type());
            if (base instanceof ListType l) {
                if (l.elementType() instanceof CompositeType c) {
                    ClassName element = types.className(c);
                    mb.addStatement("this.$N = obj.getFieldObjectList($S, $T.class, $T::new)", m.name(), m.wireName(), element, element);
                } else {
                    mb.addStatement("this.$N = obj.getFieldList($S, $L)", m.name(), m.wireName(), types.codec(l.elementType()));
                }
                continue;
            }
            CodeBlock read;
            if (base instanceof CompositeType c) {
                ClassName target = types.className(c);
                read = CodeBlock.of("obj.getFieldObject($S, $T.class, $T::new)", m.wireName(), target, target);
            } else {
                read = CodeBlock.of("obj.getField($S, $L)", m.wireName(), types.codec(base));
            }
            if (m.plan().nullable()) {
                mb.addStatement("this.$N = obj.hasField($S) ? $L : null", m.name(), m.wireName(), read);
            } else if (m.plan().hasDefault()) {
                mb.addStatement("this.$N = obj.hasField($S) ? $L : $L", m.name(), m.wireName(), read, m.plan().defaultValue());
            } else {
                mb.addStatement("this.$N = $L", m.name(), read);
            }
        }
        tb.addMethod(mb.build());
    }

    // =========================================================================
    // equals / hashCode / toString
    // =========================================================================

    private void addEqualsHashCodeToString(TypeSpec.Builder tb, ClassName self, Role role,
                                           List<Member> members, List<Member> own) {
        MethodSpec.Builder equals = MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(TypeName.BOOLEAN)
            .addParameter(Object.class, "o")
            .addStatement("if (this == o) return true");
        switch (role) {
            case PLAIN -> equals.addStatement("if (!(o instanceof $T)) return false", self);
            case ROOT -> equals.addStatement("if (o == null || getClass() != o.getClass()) return false");
            case SUBTYPE -> equals.addStatement("if (!super.equals(o)) return false");
        }
        if (own.isEmpty()) {
            equals.addStatement("return true");
        } else {
            equals.addStatement("$T that = ($T) o", self, self);
            List<CodeBlock> terms = new ArrayList<>();
            for (Member m : own) {
                ClassName helper = m.contentHelper() != null ? m.contentHelper() : ClassName.get(Objects.class);
                terms.add(CodeBlock.of("$T.equals(this.$N, that.$N)", helper, m.name(), m.name()));
            }
            equals.addStatement("return $L", CodeBlock.join(terms, "\n    && "));
        }
        tb.addMethod(equals.build());

        List<CodeBlock> hashTerms = new ArrayList<>();
        if (role == Role.SUBTYPE) hashTerms.add(CodeBlock.of("super.hashCode()"));
        for (Member m : own) {
            hashTerms.add(m.contentHelper() != null
                ? CodeBlock.of("$T.hashCode(this.$N)", m.contentHelper(), m.name())
                : CodeBlock.of("this.$N", m.name()));
        }
        MethodSpec.Builder hashCode = MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(TypeName.INT);
        if (hashTerms.isEmpty()) {
            hashCode.addStatement("return 0");
        } else if (own.isEmpty()) {
            hashCode.addStatement("return super.hashCode()");
        } else {
            hashCode.addStatement("return $T.hash($L)", Objects.class, CodeBlock.join(hashTerms, ", "));
        }
        tb.addMethod(hashCode.build());

        // inherited fields are private to the parent, so read everything through getters
        String simple = self.simpleName();
        MethodSpec.Builder toString = MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class);
        if (members.isEmpty()) {
            toString.addStatement("return $S", simple + "{}");
        } else {
            CodeBlock.Builder expr = CodeBlock.builder();
            for (int i = 0; i < members.size(); i++) {
                Member m = members.get(i);
                String label = (i == 0 ? simple + "{" : ", ") + m.name() + "=";
                String getter = names.getterName(m.wireName()) + "()";
                if (m.contentHelper() != null) {
                    expr.add(i == 0 ? "$S + $T.toString($L)" : " + $S + $T.toString($L)", label, m.contentHelper(), getter);
                } else {
                    expr.add(i == 0 ? "$S + $L" : " + $S + $L", label, getter);
                }
            }
            expr.add(" + $S", "}");
            toString.addStatement("return $L", expr.build());
        }
        tb.addMethod(toString.build());
    }
}
