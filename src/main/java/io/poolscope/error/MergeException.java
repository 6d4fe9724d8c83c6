package io.poolscope.error;

/**
 * A field value could not be assigned during a structural merge. Fields merged before the
 * failing one keep their merged values.
 */
public final class MergeException extends ScopedConfigException {
    private final String fieldPath;

    public MergeException(String fieldPath, String message) {
        super("error trying to set field " + fieldPath + ": " + message);
        this.fieldPath = fieldPath;
    }

    public MergeException(String fieldPath, String message, Throwable cause) {
        super("error trying to set field " + fieldPath + ": " + message, cause);
        this.fieldPath = fieldPath;
    }

    public String fieldPath() {
        return fieldPath;
    }
}
