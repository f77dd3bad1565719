package com.whosly.guard.parser;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Names of common table expressions visible at one point of a statement.
 * Nested bodies work on a {@link #copy()} so sibling names never leak.
 */
final class CteScope {

    private final Set<String> names;

    CteScope() {
        this(new HashSet<>());
    }

    private CteScope(Set<String> names) {
        this.names = names;
    }

    CteScope copy() {
        return new CteScope(new HashSet<>(names));
    }

    void declare(String name) {
        if (name != null && !name.isEmpty()) {
            names.add(name.toLowerCase(Locale.ROOT));
        }
    }

    boolean contains(String name) {
        return name != null && names.contains(name.toLowerCase(Locale.ROOT));
    }
}
