package com.rbdesugar.parser;

import com.rbdesugar.ast.SourceLocation;

import java.util.List;

/**
 * Parse tree produced by the external parser, one record per syntax form.
 *
 * <p>Every node carries the span of the source it was parsed from. Identifiers are kept as
 * plain text; the lowering pass interns them. Optional children are null when absent and
 * child lists are never null.</p>
 *
 * <p>The hierarchy is closed: {@link NodeVisitor} has one method per record, so a new syntax
 * form cannot be added without every visitor handling it.</p>
 */
public sealed interface Node {

    String type();

    SourceLocation loc();

    <R, P> R accept(NodeVisitor<R, P> visitor, P param);

    // ==================== Calls ====================

    record Send(
        SourceLocation loc,
        Node receiver,   // Can be null for an implicit receiver
        String method,
        List<Node> args
    ) implements Node {
        public Send {
            args = args == null ? List.of() : args;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSend(this, param);
        }

        @Override
        public String type() {
            return "Send";
        }
    }

    record CSend(
        SourceLocation loc,
        Node receiver,
        String method,
        List<Node> args
    ) implements Node {
        public CSend {
            args = args == null ? List.of() : args;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCSend(this, param);
        }

        @Override
        public String type() {
            return "CSend";
        }
    }

    record Super(SourceLocation loc, List<Node> args) implements Node {
        public Super {
            args = args == null ? List.of() : args;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSuper(this, param);
        }

        @Override
        public String type() {
            return "Super";
        }
    }

    record ZSuper(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitZSuper(this, param);
        }

        @Override
        public String type() {
            return "ZSuper";
        }
    }

    record Block(
        SourceLocation loc,
        Node send,
        Node args,   // Args or null
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBlock(this, param);
        }

        @Override
        public String type() {
            return "Block";
        }
    }

    record BlockPass(SourceLocation loc, Node block) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBlockPass(this, param);
        }

        @Override
        public String type() {
            return "BlockPass";
        }
    }

    record Yield(SourceLocation loc, List<Node> exprs) implements Node {
        public Yield {
            exprs = exprs == null ? List.of() : exprs;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitYield(this, param);
        }

        @Override
        public String type() {
            return "Yield";
        }
    }

    // ==================== Constants and variables ====================

    record Const(
        SourceLocation loc,
        Node scope,   // Can be null
        String name
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitConst(this, param);
        }

        @Override
        public String type() {
            return "Const";
        }
    }

    record ConstLhs(
        SourceLocation loc,
        Node scope,   // Can be null
        String name
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitConstLhs(this, param);
        }

        @Override
        public String type() {
            return "ConstLhs";
        }
    }

    record Cbase(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCbase(this, param);
        }

        @Override
        public String type() {
            return "Cbase";
        }
    }

    record LVar(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitLVar(this, param);
        }

        @Override
        public String type() {
            return "LVar";
        }
    }

    record LVarLhs(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitLVarLhs(this, param);
        }

        @Override
        public String type() {
            return "LVarLhs";
        }
    }

    record IVar(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIVar(this, param);
        }

        @Override
        public String type() {
            return "IVar";
        }
    }

    record IVarLhs(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIVarLhs(this, param);
        }

        @Override
        public String type() {
            return "IVarLhs";
        }
    }

    record GVar(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitGVar(this, param);
        }

        @Override
        public String type() {
            return "GVar";
        }
    }

    record GVarLhs(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitGVarLhs(this, param);
        }

        @Override
        public String type() {
            return "GVarLhs";
        }
    }

    record CVar(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCVar(this, param);
        }

        @Override
        public String type() {
            return "CVar";
        }
    }

    record CVarLhs(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCVarLhs(this, param);
        }

        @Override
        public String type() {
            return "CVarLhs";
        }
    }

    record NthRef(SourceLocation loc, int ref) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitNthRef(this, param);
        }

        @Override
        public String type() {
            return "NthRef";
        }
    }

    record Backref(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBackref(this, param);
        }

        @Override
        public String type() {
            return "Backref";
        }
    }

    record Self(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSelf(this, param);
        }

        @Override
        public String type() {
            return "Self";
        }
    }

    // ==================== Literals ====================

    record Str(SourceLocation loc, String val) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitStr(this, param);
        }

        @Override
        public String type() {
            return "Str";
        }
    }

    record Sym(SourceLocation loc, String val) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSym(this, param);
        }

        @Override
        public String type() {
            return "Sym";
        }
    }

    record DString(SourceLocation loc, List<Node> nodes) implements Node {
        public DString {
            nodes = nodes == null ? List.of() : nodes;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDString(this, param);
        }

        @Override
        public String type() {
            return "DString";
        }
    }

    record DSymbol(SourceLocation loc, List<Node> nodes) implements Node {
        public DSymbol {
            nodes = nodes == null ? List.of() : nodes;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDSymbol(this, param);
        }

        @Override
        public String type() {
            return "DSymbol";
        }
    }

    record XString(SourceLocation loc, List<Node> nodes) implements Node {
        public XString {
            nodes = nodes == null ? List.of() : nodes;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitXString(this, param);
        }

        @Override
        public String type() {
            return "XString";
        }
    }

    record IntegerLit(SourceLocation loc, String val) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIntegerLit(this, param);
        }

        @Override
        public String type() {
            return "IntegerLit";
        }
    }

    record FloatLit(SourceLocation loc, String val) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFloatLit(this, param);
        }

        @Override
        public String type() {
            return "FloatLit";
        }
    }

    record ComplexLit(SourceLocation loc, String value) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitComplexLit(this, param);
        }

        @Override
        public String type() {
            return "ComplexLit";
        }
    }

    record RationalLit(SourceLocation loc, String val) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRationalLit(this, param);
        }

        @Override
        public String type() {
            return "RationalLit";
        }
    }

    record Nil(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitNil(this, param);
        }

        @Override
        public String type() {
            return "Nil";
        }
    }

    record True(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitTrue(this, param);
        }

        @Override
        public String type() {
            return "True";
        }
    }

    record False(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFalse(this, param);
        }

        @Override
        public String type() {
            return "False";
        }
    }

    record FileLiteral(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFileLiteral(this, param);
        }

        @Override
        public String type() {
            return "FileLiteral";
        }
    }

    record LineLiteral(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitLineLiteral(this, param);
        }

        @Override
        public String type() {
            return "LineLiteral";
        }
    }

    record ArrayLit(SourceLocation loc, List<Node> elts) implements Node {
        public ArrayLit {
            elts = elts == null ? List.of() : elts;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitArrayLit(this, param);
        }

        @Override
        public String type() {
            return "ArrayLit";
        }
    }

    record HashLit(
        SourceLocation loc,
        List<Node> pairs   // Pair or Kwsplat
    ) implements Node {
        public HashLit {
            pairs = pairs == null ? List.of() : pairs;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitHashLit(this, param);
        }

        @Override
        public String type() {
            return "HashLit";
        }
    }

    record Pair(
        SourceLocation loc,
        Node key,
        Node value
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitPair(this, param);
        }

        @Override
        public String type() {
            return "Pair";
        }
    }

    record Kwsplat(SourceLocation loc, Node expr) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitKwsplat(this, param);
        }

        @Override
        public String type() {
            return "Kwsplat";
        }
    }

    record Splat(SourceLocation loc, Node var) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSplat(this, param);
        }

        @Override
        public String type() {
            return "Splat";
        }
    }

    record IRange(
        SourceLocation loc,
        Node from,   // Can be null
        Node to   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIRange(this, param);
        }

        @Override
        public String type() {
            return "IRange";
        }
    }

    record ERange(
        SourceLocation loc,
        Node from,   // Can be null
        Node to   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitERange(this, param);
        }

        @Override
        public String type() {
            return "ERange";
        }
    }

    record Regexp(
        SourceLocation loc,
        List<Node> regex,
        Node opts   // Regopt or null
    ) implements Node {
        public Regexp {
            regex = regex == null ? List.of() : regex;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRegexp(this, param);
        }

        @Override
        public String type() {
            return "Regexp";
        }
    }

    record Regopt(SourceLocation loc, String opts) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRegopt(this, param);
        }

        @Override
        public String type() {
            return "Regopt";
        }
    }

    // ==================== Sequencing and boolean operators ====================

    record Begin(SourceLocation loc, List<Node> stmts) implements Node {
        public Begin {
            stmts = stmts == null ? List.of() : stmts;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBegin(this, param);
        }

        @Override
        public String type() {
            return "Begin";
        }
    }

    record Kwbegin(SourceLocation loc, List<Node> stmts) implements Node {
        public Kwbegin {
            stmts = stmts == null ? List.of() : stmts;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitKwbegin(this, param);
        }

        @Override
        public String type() {
            return "Kwbegin";
        }
    }

    record And(
        SourceLocation loc,
        Node left,
        Node right
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAnd(this, param);
        }

        @Override
        public String type() {
            return "And";
        }
    }

    record Or(
        SourceLocation loc,
        Node left,
        Node right
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitOr(this, param);
        }

        @Override
        public String type() {
            return "Or";
        }
    }

    // ==================== Assignment ====================

    record Assign(
        SourceLocation loc,
        Node lhs,
        Node rhs
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAssign(this, param);
        }

        @Override
        public String type() {
            return "Assign";
        }
    }

    record AndAsgn(
        SourceLocation loc,
        Node left,
        Node right
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAndAsgn(this, param);
        }

        @Override
        public String type() {
            return "AndAsgn";
        }
    }

    record OrAsgn(
        SourceLocation loc,
        Node left,
        Node right
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitOrAsgn(this, param);
        }

        @Override
        public String type() {
            return "OrAsgn";
        }
    }

    record OpAsgn(
        SourceLocation loc,
        Node left,
        String op,
        Node right
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitOpAsgn(this, param);
        }

        @Override
        public String type() {
            return "OpAsgn";
        }
    }

    record Masgn(
        SourceLocation loc,
        Node lhs,   // Always an Mlhs
        Node rhs
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitMasgn(this, param);
        }

        @Override
        public String type() {
            return "Masgn";
        }
    }

    record Mlhs(SourceLocation loc, List<Node> exprs) implements Node {
        public Mlhs {
            exprs = exprs == null ? List.of() : exprs;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitMlhs(this, param);
        }

        @Override
        public String type() {
            return "Mlhs";
        }
    }

    record SplatLhs(
        SourceLocation loc,
        Node var   // Can be null for an anonymous splat
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSplatLhs(this, param);
        }

        @Override
        public String type() {
            return "SplatLhs";
        }
    }

    // ==================== Definitions ====================

    record ModuleDef(
        SourceLocation loc,
        SourceLocation declLoc,
        Node name,
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitModuleDef(this, param);
        }

        @Override
        public String type() {
            return "ModuleDef";
        }
    }

    record ClassDef(
        SourceLocation loc,
        SourceLocation declLoc,
        Node name,
        Node superclass,   // Can be null
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitClassDef(this, param);
        }

        @Override
        public String type() {
            return "ClassDef";
        }
    }

    record SClass(
        SourceLocation loc,
        SourceLocation declLoc,
        Node expr,
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSClass(this, param);
        }

        @Override
        public String type() {
            return "SClass";
        }
    }

    record DefMethod(
        SourceLocation loc,
        SourceLocation declLoc,
        String name,
        Node args,   // Args or null
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDefMethod(this, param);
        }

        @Override
        public String type() {
            return "DefMethod";
        }
    }

    record DefS(
        SourceLocation loc,
        SourceLocation declLoc,
        Node singleton,
        String name,
        Node args,   // Args or null
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDefS(this, param);
        }

        @Override
        public String type() {
            return "DefS";
        }
    }

    record Alias(
        SourceLocation loc,
        Node from,
        Node to
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAlias(this, param);
        }

        @Override
        public String type() {
            return "Alias";
        }
    }

    record Args(SourceLocation loc, List<Node> args) implements Node {
        public Args {
            args = args == null ? List.of() : args;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitArgs(this, param);
        }

        @Override
        public String type() {
            return "Args";
        }
    }

    record Arg(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitArg(this, param);
        }

        @Override
        public String type() {
            return "Arg";
        }
    }

    record Restarg(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRestarg(this, param);
        }

        @Override
        public String type() {
            return "Restarg";
        }
    }

    record Kwrestarg(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitKwrestarg(this, param);
        }

        @Override
        public String type() {
            return "Kwrestarg";
        }
    }

    record Kwarg(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitKwarg(this, param);
        }

        @Override
        public String type() {
            return "Kwarg";
        }
    }

    record Kwoptarg(
        SourceLocation loc,
        String name,
        Node defaultValue
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitKwoptarg(this, param);
        }

        @Override
        public String type() {
            return "Kwoptarg";
        }
    }

    record Optarg(
        SourceLocation loc,
        String name,
        Node defaultValue
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitOptarg(this, param);
        }

        @Override
        public String type() {
            return "Optarg";
        }
    }

    record Blockarg(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBlockarg(this, param);
        }

        @Override
        public String type() {
            return "Blockarg";
        }
    }

    record Shadowarg(SourceLocation loc, String name) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitShadowarg(this, param);
        }

        @Override
        public String type() {
            return "Shadowarg";
        }
    }

    // ==================== Control flow ====================

    record If(
        SourceLocation loc,
        Node condition,
        Node thenBody,   // Can be null
        Node elseBody   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIf(this, param);
        }

        @Override
        public String type() {
            return "If";
        }
    }

    record Case(
        SourceLocation loc,
        Node condition,   // Can be null
        List<Node> whens,
        Node elseBody   // Can be null
    ) implements Node {
        public Case {
            whens = whens == null ? List.of() : whens;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCase(this, param);
        }

        @Override
        public String type() {
            return "Case";
        }
    }

    record When(
        SourceLocation loc,
        List<Node> patterns,
        Node body   // Can be null
    ) implements Node {
        public When {
            patterns = patterns == null ? List.of() : patterns;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitWhen(this, param);
        }

        @Override
        public String type() {
            return "When";
        }
    }

    record While(
        SourceLocation loc,
        Node cond,
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitWhile(this, param);
        }

        @Override
        public String type() {
            return "While";
        }
    }

    record WhilePost(
        SourceLocation loc,
        Node cond,
        Node body
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitWhilePost(this, param);
        }

        @Override
        public String type() {
            return "WhilePost";
        }
    }

    record Until(
        SourceLocation loc,
        Node cond,
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitUntil(this, param);
        }

        @Override
        public String type() {
            return "Until";
        }
    }

    record UntilPost(
        SourceLocation loc,
        Node cond,
        Node body
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitUntilPost(this, param);
        }

        @Override
        public String type() {
            return "UntilPost";
        }
    }

    record For(
        SourceLocation loc,
        Node vars,   // Mlhs or a single target
        Node expr,
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFor(this, param);
        }

        @Override
        public String type() {
            return "For";
        }
    }

    record Return(SourceLocation loc, List<Node> exprs) implements Node {
        public Return {
            exprs = exprs == null ? List.of() : exprs;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitReturn(this, param);
        }

        @Override
        public String type() {
            return "Return";
        }
    }

    record Break(SourceLocation loc, List<Node> exprs) implements Node {
        public Break {
            exprs = exprs == null ? List.of() : exprs;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBreak(this, param);
        }

        @Override
        public String type() {
            return "Break";
        }
    }

    record Next(SourceLocation loc, List<Node> exprs) implements Node {
        public Next {
            exprs = exprs == null ? List.of() : exprs;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitNext(this, param);
        }

        @Override
        public String type() {
            return "Next";
        }
    }

    record Retry(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRetry(this, param);
        }

        @Override
        public String type() {
            return "Retry";
        }
    }

    record Redo(SourceLocation loc) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRedo(this, param);
        }

        @Override
        public String type() {
            return "Redo";
        }
    }

    record Rescue(
        SourceLocation loc,
        Node body,   // Can be null
        List<Node> rescue,   // Resbody nodes
        Node elseBody   // Can be null
    ) implements Node {
        public Rescue {
            rescue = rescue == null ? List.of() : rescue;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRescue(this, param);
        }

        @Override
        public String type() {
            return "Rescue";
        }
    }

    record Resbody(
        SourceLocation loc,
        Node exception,   // Can be null
        Node var,   // Can be null
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitResbody(this, param);
        }

        @Override
        public String type() {
            return "Resbody";
        }
    }

    record Ensure(
        SourceLocation loc,
        Node body,   // Can be null
        Node ensure   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitEnsure(this, param);
        }

        @Override
        public String type() {
            return "Ensure";
        }
    }

    record Defined(SourceLocation loc, Node value) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDefined(this, param);
        }

        @Override
        public String type() {
            return "Defined";
        }
    }

    // ==================== Not supported by the lowering pass ====================

    record Preexe(
        SourceLocation loc,
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitPreexe(this, param);
        }

        @Override
        public String type() {
            return "Preexe";
        }
    }

    record Postexe(
        SourceLocation loc,
        Node body   // Can be null
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitPostexe(this, param);
        }

        @Override
        public String type() {
            return "Postexe";
        }
    }

    record Undef(SourceLocation loc, List<Node> exprs) implements Node {
        public Undef {
            exprs = exprs == null ? List.of() : exprs;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitUndef(this, param);
        }

        @Override
        public String type() {
            return "Undef";
        }
    }

    record EFlipflop(
        SourceLocation loc,
        Node left,
        Node right
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitEFlipflop(this, param);
        }

        @Override
        public String type() {
            return "EFlipflop";
        }
    }

    record IFlipflop(
        SourceLocation loc,
        Node left,
        Node right
    ) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIFlipflop(this, param);
        }

        @Override
        public String type() {
            return "IFlipflop";
        }
    }

    record MatchCurLine(SourceLocation loc, Node cond) implements Node {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitMatchCurLine(this, param);
        }

        @Override
        public String type() {
            return "MatchCurLine";
        }
    }
}
