package com.rbdesugar.parser;

/**
 * One method per parse-node variant.
 *
 * @param <R> result of visiting a node
 * @param <P> extra state threaded through the traversal
 */
public interface NodeVisitor<R, P> {

    // Calls
    R visitSend(Node.Send node, P param);
    R visitCSend(Node.CSend node, P param);
    R visitSuper(Node.Super node, P param);
    R visitZSuper(Node.ZSuper node, P param);
    R visitBlock(Node.Block node, P param);
    R visitBlockPass(Node.BlockPass node, P param);
    R visitYield(Node.Yield node, P param);

    // Constants and variables
    R visitConst(Node.Const node, P param);
    R visitConstLhs(Node.ConstLhs node, P param);
    R visitCbase(Node.Cbase node, P param);
    R visitLVar(Node.LVar node, P param);
    R visitLVarLhs(Node.LVarLhs node, P param);
    R visitIVar(Node.IVar node, P param);
    R visitIVarLhs(Node.IVarLhs node, P param);
    R visitGVar(Node.GVar node, P param);
    R visitGVarLhs(Node.GVarLhs node, P param);
    R visitCVar(Node.CVar node, P param);
    R visitCVarLhs(Node.CVarLhs node, P param);
    R visitNthRef(Node.NthRef node, P param);
    R visitBackref(Node.Backref node, P param);
    R visitSelf(Node.Self node, P param);

    // Literals
    R visitStr(Node.Str node, P param);
    R visitSym(Node.Sym node, P param);
    R visitDString(Node.DString node, P param);
    R visitDSymbol(Node.DSymbol node, P param);
    R visitXString(Node.XString node, P param);
    R visitIntegerLit(Node.IntegerLit node, P param);
    R visitFloatLit(Node.FloatLit node, P param);
    R visitComplexLit(Node.ComplexLit node, P param);
    R visitRationalLit(Node.RationalLit node, P param);
    R visitNil(Node.Nil node, P param);
    R visitTrue(Node.True node, P param);
    R visitFalse(Node.False node, P param);
    R visitFileLiteral(Node.FileLiteral node, P param);
    R visitLineLiteral(Node.LineLiteral node, P param);
    R visitArrayLit(Node.ArrayLit node, P param);
    R visitHashLit(Node.HashLit node, P param);
    R visitPair(Node.Pair node, P param);
    R visitKwsplat(Node.Kwsplat node, P param);
    R visitSplat(Node.Splat node, P param);
    R visitIRange(Node.IRange node, P param);
    R visitERange(Node.ERange node, P param);
    R visitRegexp(Node.Regexp node, P param);
    R visitRegopt(Node.Regopt node, P param);

    // Sequencing and boolean operators
    R visitBegin(Node.Begin node, P param);
    R visitKwbegin(Node.Kwbegin node, P param);
    R visitAnd(Node.And node, P param);
    R visitOr(Node.Or node, P param);

    // Assignment
    R visitAssign(Node.Assign node, P param);
    R visitAndAsgn(Node.AndAsgn node, P param);
    R visitOrAsgn(Node.OrAsgn node, P param);
    R visitOpAsgn(Node.OpAsgn node, P param);
    R visitMasgn(Node.Masgn node, P param);
    R visitMlhs(Node.Mlhs node, P param);
    R visitSplatLhs(Node.SplatLhs node, P param);

    // Definitions
    R visitModuleDef(Node.ModuleDef node, P param);
    R visitClassDef(Node.ClassDef node, P param);
    R visitSClass(Node.SClass node, P param);
    R visitDefMethod(Node.DefMethod node, P param);
    R visitDefS(Node.DefS node, P param);
    R visitAlias(Node.Alias node, P param);
    R visitArgs(Node.Args node, P param);
    R visitArg(Node.Arg node, P param);
    R visitRestarg(Node.Restarg node, P param);
    R visitKwrestarg(Node.Kwrestarg node, P param);
    R visitKwarg(Node.Kwarg node, P param);
    R visitKwoptarg(Node.Kwoptarg node, P param);
    R visitOptarg(Node.Optarg node, P param);
    R visitBlockarg(Node.Blockarg node, P param);
    R visitShadowarg(Node.Shadowarg node, P param);

    // Control flow
    R visitIf(Node.If node, P param);
    R visitCase(Node.Case node, P param);
    R visitWhen(Node.When node, P param);
    R visitWhile(Node.While node, P param);
    R visitWhilePost(Node.WhilePost node, P param);
    R visitUntil(Node.Until node, P param);
    R visitUntilPost(Node.UntilPost node, P param);
    R visitFor(Node.For node, P param);
    R visitReturn(Node.Return node, P param);
    R visitBreak(Node.Break node, P param);
    R visitNext(Node.Next node, P param);
    R visitRetry(Node.Retry node, P param);
    R visitRedo(Node.Redo node, P param);
    R visitRescue(Node.Rescue node, P param);
    R visitResbody(Node.Resbody node, P param);
    R visitEnsure(Node.Ensure node, P param);
    R visitDefined(Node.Defined node, P param);

    // Not supported by the lowering pass
    R visitPreexe(Node.Preexe node, P param);
    R visitPostexe(Node.Postexe node, P param);
    R visitUndef(Node.Undef node, P param);
    R visitEFlipflop(Node.EFlipflop node, P param);
    R visitIFlipflop(Node.IFlipflop node, P param);
    R visitMatchCurLine(Node.MatchCurLine node, P param);
}
