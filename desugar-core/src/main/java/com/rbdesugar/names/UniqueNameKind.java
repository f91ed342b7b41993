package com.rbdesugar.names;

/**
 * Which pass minted a {@link Name.Unique}. Two unique names with the same original and number
 * but different kinds are distinct.
 */
public enum UniqueNameKind {
    DESUGAR,
    CFG
}
