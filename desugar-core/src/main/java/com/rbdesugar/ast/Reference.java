package com.rbdesugar.ast;

/**
 * Nodes that name a storage location. Reading one has no side effects, so the lowering may
 * evaluate a reference more than once.
 */
public sealed interface Reference extends Expression permits
    Local,
    UnresolvedIdent,
    RestArg,
    KeywordArg,
    OptionalArg,
    BlockArg,
    ShadowArg {
}
