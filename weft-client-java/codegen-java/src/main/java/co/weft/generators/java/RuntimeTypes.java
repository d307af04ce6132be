package co.weft.generators.java;

import com.squareup.javapoet.ClassName;

/** Classes of the wire runtime that generated code calls. */
final class RuntimeTypes {

    static final String PACKAGE = "co.weft.runtime";

    static final ClassName ENCODABLE = ClassName.get(PACKAGE, "Encodable");
    static final ClassName ENCODER = ClassName.get(PACKAGE, "Encoder");
    static final ClassName OBJECT_ENCODER = ClassName.get(PACKAGE, "ObjectEncoder");
    static final ClassName DECODER = ClassName.get(PACKAGE, "Decoder");
    static final ClassName OBJECT_DECODER = ClassName.get(PACKAGE, "ObjectDecoder");
    static final ClassName CODECS = ClassName.get(PACKAGE, "Codecs");
    static final ClassName BINARY_LISTS = ClassName.get(PACKAGE, "BinaryLists");

    private RuntimeTypes() {}
}
