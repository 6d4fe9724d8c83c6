package io.poolscope.store;

final class InMemoryScopeStoreTest extends ScopeCollectionContract {
    private final InMemoryScopeStore store = new InMemoryScopeStore();

    @Override
    protected ScopeStore store() {
        return store;
    }
}
