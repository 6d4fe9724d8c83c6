package io.poolscope.error;

public final class NotFoundException extends ScopedConfigException {
    private final String collection;
    private final String scope;

    public NotFoundException(String collection, String scope) {
        super("Scope entry not found: collection=" + collection + ", scope='" + scope + "'");
        this.collection = collection;
        this.scope = scope;
    }

    public String collection() {
        return collection;
    }

    public String scope() {
        return scope;
    }
}
