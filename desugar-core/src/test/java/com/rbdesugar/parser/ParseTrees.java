package com.rbdesugar.parser;

import com.rbdesugar.ast.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 * Terse builders for parse trees. Every node is placed on line 1 unless a location is given.
 */
public final class ParseTrees {

    public static final SourceLocation LOC = loc(1);

    private ParseTrees() {
    }

    public static SourceLocation loc(int line) {
        return SourceLocation.of(line, 1, line, 40);
    }

    private static List<Node> list(Node... nodes) {
        return Arrays.asList(nodes);
    }

    // Calls

    public static Node.Send send(Node receiver, String method, Node... args) {
        return new Node.Send(LOC, receiver, method, list(args));
    }

    public static Node.Send call(String method, Node... args) {
        return new Node.Send(LOC, null, method, list(args));
    }

    public static Node.CSend csend(Node receiver, String method, Node... args) {
        return new Node.CSend(LOC, receiver, method, list(args));
    }

    public static Node.Block block(Node send, Node args, Node body) {
        return new Node.Block(LOC, send, args, body);
    }

    public static Node.BlockPass blockPass(Node block) {
        return new Node.BlockPass(LOC, block);
    }

    public static Node.Super superCall(Node... args) {
        return new Node.Super(LOC, list(args));
    }

    // Variables and constants

    public static Node.LVar lvar(String name) {
        return new Node.LVar(LOC, name);
    }

    public static Node.LVarLhs lvarLhs(String name) {
        return new Node.LVarLhs(LOC, name);
    }

    public static Node.IVar ivar(String name) {
        return new Node.IVar(LOC, name);
    }

    public static Node.IVarLhs ivarLhs(String name) {
        return new Node.IVarLhs(LOC, name);
    }

    public static Node.Const cnst(String name) {
        return new Node.Const(LOC, null, name);
    }

    public static Node.Const cnst(Node scope, String name) {
        return new Node.Const(LOC, scope, name);
    }

    public static Node.ConstLhs cnstLhs(String name) {
        return new Node.ConstLhs(LOC, null, name);
    }

    public static Node.Self self() {
        return new Node.Self(LOC);
    }

    // Literals

    public static Node.IntegerLit integer(String text) {
        return new Node.IntegerLit(LOC, text);
    }

    public static Node.IntegerLit integer(long value) {
        return new Node.IntegerLit(LOC, Long.toString(value));
    }

    public static Node.FloatLit floating(String text) {
        return new Node.FloatLit(LOC, text);
    }

    public static Node.Str str(String val) {
        return new Node.Str(LOC, val);
    }

    public static Node.Sym sym(String val) {
        return new Node.Sym(LOC, val);
    }

    public static Node.DString dstr(Node... nodes) {
        return new Node.DString(LOC, list(nodes));
    }

    public static Node.DSymbol dsym(Node... nodes) {
        return new Node.DSymbol(LOC, list(nodes));
    }

    public static Node.Nil nil() {
        return new Node.Nil(LOC);
    }

    public static Node.True trueNode() {
        return new Node.True(LOC);
    }

    public static Node.ArrayLit array(Node... elts) {
        return new Node.ArrayLit(LOC, list(elts));
    }

    public static Node.HashLit hash(Node... pairs) {
        return new Node.HashLit(LOC, list(pairs));
    }

    public static Node.Pair pair(Node key, Node value) {
        return new Node.Pair(LOC, key, value);
    }

    public static Node.Kwsplat kwsplat(Node expr) {
        return new Node.Kwsplat(LOC, expr);
    }

    public static Node.Splat splat(Node var) {
        return new Node.Splat(LOC, var);
    }

    // Statements

    public static Node.Begin begin(Node... stmts) {
        return new Node.Begin(LOC, list(stmts));
    }

    public static Node.Kwbegin kwbegin(Node... stmts) {
        return new Node.Kwbegin(LOC, list(stmts));
    }

    public static Node.And and(Node left, Node right) {
        return new Node.And(LOC, left, right);
    }

    public static Node.Or or(Node left, Node right) {
        return new Node.Or(LOC, left, right);
    }

    public static Node.Assign assign(Node lhs, Node rhs) {
        return new Node.Assign(LOC, lhs, rhs);
    }

    public static Node.AndAsgn andAsgn(Node left, Node right) {
        return new Node.AndAsgn(LOC, left, right);
    }

    public static Node.OrAsgn orAsgn(Node left, Node right) {
        return new Node.OrAsgn(LOC, left, right);
    }

    public static Node.OpAsgn opAsgn(Node left, String op, Node right) {
        return new Node.OpAsgn(LOC, left, op, right);
    }

    public static Node.Masgn masgn(Node lhs, Node rhs) {
        return new Node.Masgn(LOC, lhs, rhs);
    }

    public static Node.Mlhs mlhs(Node... exprs) {
        return new Node.Mlhs(LOC, list(exprs));
    }

    public static Node.SplatLhs splatLhs(Node var) {
        return new Node.SplatLhs(LOC, var);
    }

    // Definitions

    public static Node.DefMethod def(String name, Node args, Node body) {
        return new Node.DefMethod(LOC, LOC, name, args, body);
    }

    public static Node.DefS defs(Node singleton, String name, Node args, Node body) {
        return new Node.DefS(LOC, LOC, singleton, name, args, body);
    }

    public static Node.ClassDef classDef(Node name, Node superclass, Node body) {
        return new Node.ClassDef(LOC, LOC, name, superclass, body);
    }

    public static Node.ModuleDef module(Node name, Node body) {
        return new Node.ModuleDef(LOC, LOC, name, body);
    }

    public static Node.Args args(Node... args) {
        return new Node.Args(LOC, list(args));
    }

    public static Node.Arg arg(String name) {
        return new Node.Arg(LOC, name);
    }

    // Control flow

    public static Node.If ifNode(Node condition, Node thenBody, Node elseBody) {
        return new Node.If(LOC, condition, thenBody, elseBody);
    }

    public static Node.Case caseNode(Node condition, List<Node> whens, Node elseBody) {
        return new Node.Case(LOC, condition, whens, elseBody);
    }

    public static Node.When when(List<Node> patterns, Node body) {
        return new Node.When(LOC, patterns, body);
    }

    public static Node.Rescue rescue(Node body, List<Node> resbodies, Node elseBody) {
        return new Node.Rescue(LOC, body, resbodies, elseBody);
    }

    public static Node.Resbody resbody(Node exception, Node var, Node body) {
        return new Node.Resbody(LOC, exception, var, body);
    }

    public static Node.Ensure ensure(Node body, Node ensure) {
        return new Node.Ensure(LOC, body, ensure);
    }
}
