package io.poolscope.error;

/**
 * Connection or I/O failure of the backing scope store. Never retried by the engine.
 */
public final class StoreException extends ScopedConfigException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
