package io.poolscope.merge;

public enum FieldKind {
    LEAF,
    MAP,
    RECORD
}
