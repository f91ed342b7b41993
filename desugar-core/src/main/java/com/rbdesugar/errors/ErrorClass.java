package com.rbdesugar.errors;

/**
 * Stable classification tags for diagnostics emitted while lowering.
 */
public enum ErrorClass {
    INTERNAL_ERROR(1001),
    INTEGER_OUT_OF_RANGE(3001),
    UNSUPPORTED_NODE(3002),
    INVALID_SINGLETON_DEF(3003),
    FLOAT_OUT_OF_RANGE(3004),
    NO_CONSTANT_REASSIGNMENT(3005);

    private final int code;

    ErrorClass(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
