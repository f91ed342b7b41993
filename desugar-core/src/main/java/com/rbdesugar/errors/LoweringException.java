package com.rbdesugar.errors;

/**
 * Thrown when an internal invariant of the lowering pass is violated. Aborts the lowering of
 * the current compilation unit only.
 */
public class LoweringException extends RuntimeException {

    public LoweringException(String message) {
        super(message);
    }

    public LoweringException(String message, Throwable cause) {
        super(message, cause);
    }

    public static LoweringException notImplemented(String what) {
        return new LoweringException("not implemented: " + what);
    }
}
