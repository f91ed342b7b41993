package com.rbdesugar.names;

import java.util.List;

/**
 * Well-known names, pre-registered in every {@link NameTable}.
 */
public final class Names {

    private Names() {
        // Constants only
    }

    // Operators and conversions
    public static final Name TO_S = utf8("to_s");
    public static final Name TO_A = utf8("to_a");
    public static final Name TO_HASH = utf8("to_hash");
    public static final Name TO_PROC = utf8("to_proc");
    public static final Name CONCAT = utf8("concat");
    public static final Name MERGE = utf8("merge");
    public static final Name INTERN = utf8("intern");
    public static final Name CALL = utf8("call");
    public static final Name BANG = utf8("!");
    public static final Name SQUARE_BRACKETS = utf8("[]");
    public static final Name SQUARE_BRACKETS_EQ = utf8("[]=");
    public static final Name TRIPLE_EQ = utf8("===");
    public static final Name OR_OP = utf8("|");
    public static final Name BACKTICK = utf8("`");
    public static final Name SLICE = utf8("slice");
    public static final Name DEFINED_P = utf8("defined?");
    public static final Name EACH = utf8("each");
    public static final Name NEW = utf8("new");
    public static final Name NIL_P = utf8("nil?");
    public static final Name SUPER = utf8("super");
    public static final Name ALIAS_METHOD = utf8("alias_method");
    public static final Name COMPLEX = utf8("Complex");
    public static final Name RATIONAL = utf8("Rational");
    public static final Name CURRENT_FILE = utf8("__FILE__");
    public static final Name EMPTY = utf8("");

    // Magic methods understood by later passes
    public static final Name CALL_WITH_SPLAT = utf8("<call-with-splat>");
    public static final Name EXPAND_SPLAT = utf8("<expand-splat>");

    // Bases for fresh temporaries
    public static final Name AND_AND = utf8("&&");
    public static final Name OR_OR = utf8("||");
    public static final Name ASSIGN_TEMP = utf8("<assignTemp>");
    public static final Name RESCUE_TEMP = utf8("<rescueTemp>");
    public static final Name FOR_TEMP = utf8("forTemp");
    public static final Name BLOCK_PASS_TEMP = utf8("<block-pass>");
    public static final Name DESTRUCTURE_ARG = utf8("<destructure>");
    public static final Name SINGLETON = utf8("<singleton class>");

    static final List<Name> ALL = List.of(
        TO_S, TO_A, TO_HASH, TO_PROC, CONCAT, MERGE, INTERN, CALL, BANG,
        SQUARE_BRACKETS, SQUARE_BRACKETS_EQ, TRIPLE_EQ, OR_OP, BACKTICK, SLICE,
        DEFINED_P, EACH, NEW, NIL_P, SUPER, ALIAS_METHOD, COMPLEX, RATIONAL,
        CURRENT_FILE, EMPTY, CALL_WITH_SPLAT, EXPAND_SPLAT, AND_AND, OR_OR,
        ASSIGN_TEMP, RESCUE_TEMP, FOR_TEMP, BLOCK_PASS_TEMP, DESTRUCTURE_ARG,
        SINGLETON
    );

    private static Name utf8(String text) {
        return new Name.Utf8(text);
    }
}
