package com.libragraph.nsm.core.archive;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which entries an extract should write: all of them or a list of paths.
 */
public final class EntrySelection {

    private static final EntrySelection ALL = new EntrySelection(null);

    private final Set<String> paths;

    private EntrySelection(Set<String> paths) {
        this.paths = paths;
    }

    public static EntrySelection all() {
        return ALL;
    }

    public static EntrySelection of(Collection<String> paths) {
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("Selection needs at least one path");
        }
        return new EntrySelection(new LinkedHashSet<>(paths));
    }

    public static EntrySelection of(String... paths) {
        return of(List.of(paths));
    }

    public boolean isAll() {
        return paths == null;
    }

    public boolean includes(String path) {
        return paths == null || paths.contains(path);
    }

    /**
     * Requested paths in request order; empty for {@link #all()}.
     */
    public Set<String> paths() {
        return paths == null ? Set.of() : Collections.unmodifiableSet(paths);
    }

    @Override
    public String toString() {
        return isAll() ? "all" : paths.toString();
    }
}
