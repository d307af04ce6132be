package co.weft.generators.java;

import co.weft.core.types.Struct;
import co.weft.core.types.Union;
import co.weft.core.types.UnionField;

/**
 * Answers the tagged-family questions the synthesizers ask: which role a struct plays,
 * what tag it is written with, and whether its family or union accepts unknown tags.
 *
 * <p>Families are single-level: a root enumerates subtypes, and a subtype has no subtypes
 * of its own.
 */
public final class HierarchyResolver {

    /** Position of a struct in its tagged family. */
    public enum Role {
        /** No family. */
        PLAIN,
        /** Enumerates subtypes and owns the dispatching encode/decode. */
        ROOT,
        /** Enumerated by its parent. */
        SUBTYPE
    }

    public Role role(Struct struct) {
        if (struct.hasEnumeratedSubtypes()) return Role.ROOT;
        if (struct.parent() != null) return Role.SUBTYPE;
        return Role.PLAIN;
    }

    /** The struct that owns dispatch for {@code struct}: its parent for a subtype, else itself. */
    public Struct familyRoot(Struct struct) {
        return role(struct) == Role.SUBTYPE ? struct.parent() : struct;
    }

    /**
     * Tag a subtype is written with, as recorded in its parent's subtype list. The family's
     * catch-all member has no fixed tag and returns the empty string.
     *
     * @throws IllegalStateException if {@code struct} is not listed by its parent
     */
    public String tag(Struct struct) {
        Struct parent = struct.parent();
        if (parent == null) {
            throw new IllegalStateException(struct.qualifiedName() + " has no parent and therefore no tag");
        }
        if (struct.isCatchAll()) return "";
        for (Struct.Subtype s : parent.subtypes()) {
            if (s.type() == struct) return s.tag();
        }
        throw new IllegalStateException(struct.qualifiedName() + " is not a listed subtype of " + parent.qualifiedName());
    }

    /**
     * The member of {@code root}'s family that absorbs unrecognized tags: the root itself or one
     * of its subtypes, or {@code null} for a closed family.
     */
    public Struct catchAllMember(Struct root) {
        if (root.isCatchAll()) return root;
        for (Struct.Subtype s : root.subtypes()) {
            if (s.type().isCatchAll()) return s.type();
        }
        return null;
    }

    /** An open family decodes unknown tags into its catch-all member instead of failing. */
    public boolean isOpen(Struct root) {
        return catchAllMember(familyRoot(root)) != null;
    }

    public boolean isOpen(Union union) {
        return union.catchAllField() != null;
    }

    /** Wire tag of a union variant. */
    public String tag(UnionField variant) {
        return variant.name();
    }
}
