package io.poolscope.store;

public interface ScopeStore {
    ScopeCollection collection(String name);
}
