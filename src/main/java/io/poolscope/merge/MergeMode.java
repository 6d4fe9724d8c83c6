package io.poolscope.merge;

public enum MergeMode {
    DEEP,
    SHALLOW;

    public static MergeMode of(boolean shallow) {
        return shallow ? SHALLOW : DEEP;
    }
}
