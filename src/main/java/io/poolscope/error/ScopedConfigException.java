package io.poolscope.error;

/**
 * Root of every failure raised by the scoped configuration engine.
 */
public class ScopedConfigException extends RuntimeException {
    public ScopedConfigException(String message) {
        super(message);
    }

    public ScopedConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
