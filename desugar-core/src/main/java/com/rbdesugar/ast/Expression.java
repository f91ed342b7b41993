package com.rbdesugar.ast;

/**
 * Base interface for all core AST nodes.
 */
public sealed interface Expression permits
    Reference,
    Send,
    Block,
    Literal,
    UnresolvedConstantLit,
    ConstantLit,
    Self,
    ClassDef,
    MethodDef,
    InsSeq,
    If,
    While,
    Return,
    Break,
    Next,
    Retry,
    Yield,
    Rescue,
    RescueCase,
    ArrayLit,
    HashLit,
    Splat,
    Assign,
    ZSuperArgs,
    EmptyTree {

    String type();
    SourceLocation loc();
}
