package io.poolscope.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

public final class ScopeFilter {
    private static final ScopeFilter EXCLUDING_BASE = new ScopeFilter(null);

    private final List<String> ids;

    private ScopeFilter(List<String> ids) {
        this.ids = ids;
    }

    public static ScopeFilter excludingBase() {
        return EXCLUDING_BASE;
    }

    public static ScopeFilter ids(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("ids must not be empty, use excludingBase()");
        }
        return new ScopeFilter(List.copyOf(new LinkedHashSet<>(ids)));
    }

    public boolean isExcludingBase() {
        return ids == null;
    }

    public List<String> ids() {
        return ids == null ? List.of() : new ArrayList<>(ids);
    }

    public boolean matches(String id) {
        if (ids == null) {
            return !ScopeDocument.BASE_SCOPE.equals(id);
        }
        return ids.contains(id);
    }

    @Override
    public String toString() {
        return ids == null ? "ScopeFilter{id != ''}" : "ScopeFilter{id in " + ids + "}";
    }
}
