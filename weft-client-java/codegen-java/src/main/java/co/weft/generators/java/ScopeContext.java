package co.weft.generators.java;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names declared locally by the construct being generated, such as a union's variant
 * classes. Immutable; entering a nested construct yields a new context and leaving it
 * is simply dropping that value.
 */
public final class ScopeContext {

    public static final ScopeContext EMPTY = new ScopeContext(Set.of());

    private final Set<String> names;

    private ScopeContext(Set<String> names) {
        this.names = names;
    }

    public ScopeContext enter(Collection<String> localNames) {
        Set<String> merged = new LinkedHashSet<>(names);
        merged.addAll(localNames);
        return new ScopeContext(Collections.unmodifiableSet(merged));
    }

    public boolean collides(String simpleName) {
        return names.contains(simpleName);
    }

    public Set<String> names() {
        return names;
    }

    /** For {@link com.squareup.javapoet.TypeSpec.Builder#alwaysQualify}. */
    String[] namesArray() {
        return names.toArray(new String[0]);
    }

    @Override
    public String toString() {
        return "ScopeContext" + names;
    }
}
