package io.poolscope.error;

/**
 * Input rejected before touching the store: wrong record type, null value, blank field name.
 */
public final class ValidationException extends ScopedConfigException {
    public ValidationException(String message) {
        super(message);
    }
}
