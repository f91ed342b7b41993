package com.rbdesugar.desugar;

import static com.rbdesugar.ast.Trees.assign;
import static com.rbdesugar.ast.Trees.constant;
import static com.rbdesugar.ast.Trees.copyRef;
import static com.rbdesugar.ast.Trees.emptyTree;
import static com.rbdesugar.ast.Trees.falseLit;
import static com.rbdesugar.ast.Trees.floating;
import static com.rbdesugar.ast.Trees.ifThenElse;
import static com.rbdesugar.ast.Trees.insSeq;
import static com.rbdesugar.ast.Trees.insSeq1;
import static com.rbdesugar.ast.Trees.integer;
import static com.rbdesugar.ast.Trees.isEmptyTree;
import static com.rbdesugar.ast.Trees.isSymbolLit;
import static com.rbdesugar.ast.Trees.local;
import static com.rbdesugar.ast.Trees.nil;
import static com.rbdesugar.ast.Trees.self;
import static com.rbdesugar.ast.Trees.send;
import static com.rbdesugar.ast.Trees.send0;
import static com.rbdesugar.ast.Trees.send1;
import static com.rbdesugar.ast.Trees.send2;
import static com.rbdesugar.ast.Trees.send3;
import static com.rbdesugar.ast.Trees.string;
import static com.rbdesugar.ast.Trees.symbol;
import static com.rbdesugar.ast.Trees.trueLit;

import com.rbdesugar.ast.ArrayLit;
import com.rbdesugar.ast.Block;
import com.rbdesugar.ast.BlockArg;
import com.rbdesugar.ast.Break;
import com.rbdesugar.ast.ClassDef;
import com.rbdesugar.ast.CoreSymbol;
import com.rbdesugar.ast.EmptyTree;
import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.If;
import com.rbdesugar.ast.InsSeq;
import com.rbdesugar.ast.KeywordArg;
import com.rbdesugar.ast.Literal;
import com.rbdesugar.ast.Local;
import com.rbdesugar.ast.MethodDef;
import com.rbdesugar.ast.Next;
import com.rbdesugar.ast.OptionalArg;
import com.rbdesugar.ast.Reference;
import com.rbdesugar.ast.Rescue;
import com.rbdesugar.ast.RescueCase;
import com.rbdesugar.ast.RestArg;
import com.rbdesugar.ast.Retry;
import com.rbdesugar.ast.Return;
import com.rbdesugar.ast.Send;
import com.rbdesugar.ast.ShadowArg;
import com.rbdesugar.ast.SourceLocation;
import com.rbdesugar.ast.Splat;
import com.rbdesugar.ast.UnresolvedConstantLit;
import com.rbdesugar.ast.UnresolvedIdent;
import com.rbdesugar.ast.While;
import com.rbdesugar.ast.Yield;
import com.rbdesugar.ast.ZSuperArgs;
import com.rbdesugar.errors.ErrorClass;
import com.rbdesugar.errors.LoweringException;
import com.rbdesugar.names.Name;
import com.rbdesugar.names.Names;
import com.rbdesugar.parser.Node;
import com.rbdesugar.parser.NodeVisitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a parse tree into the core tree.
 *
 * <p>Each syntax form is rewritten into the small core vocabulary: operators and sugar become
 * method calls, compound and multiple assignment become explicit temporaries, and loops,
 * {@code case} and {@code rescue} become {@link While}, {@link If} and {@link Rescue}. The
 * {@link FreshNames} passed to every visit method is the counter of the method, class or file
 * body being lowered.</p>
 *
 * <p>Recoverable problems are reported through the context's diagnostic sink and replaced by
 * an {@link EmptyTree}. Anything else raises a {@link LoweringException}, which is reported
 * once as an internal error and propagated to the caller.</p>
 */
public final class Desugar implements NodeVisitor<Expression, FreshNames> {

    private static final Logger LOG = LoggerFactory.getLogger(Desugar.class);

    private final LoweringContext ctx;
    private final FatalErrorReporter fatalErrors = new FatalErrorReporter();
    private final DesugarAssignments assignments;
    private final DesugarCollections collections;
    private final NumericLiterals numerics;

    private Desugar(LoweringContext ctx) {
        this.ctx = ctx;
        this.assignments = new DesugarAssignments(this);
        this.collections = new DesugarCollections(this);
        this.numerics = new NumericLiterals(ctx);
    }

    /**
     * Lowers one compilation unit. The result is always a {@link ClassDef}: a tree that is not
     * one already is wrapped into the root class.
     *
     * @throws LoweringException if the tree cannot be lowered; one internal error has been
     *         reported to the context's sink by then
     */
    public static Expression node2Tree(LoweringContext ctx, Node what) {
        if (what == null) {
            throw new IllegalArgumentException("Cannot lower a null parse tree");
        }
        return new Desugar(ctx).run(what);
    }

    private Expression run(Node what) {
        LOG.debug("Lowering {}", ctx.file());
        fatalErrors.reset();
        Expression result;
        try {
            result = node2TreeImpl(what, new FreshNames(ctx.names()));
        } catch (LoweringException e) {
            fatalErrors.reportOnce(ctx.diagnostics(), hasLocation(what) ? what.loc() : SourceLocation.none(), e);
            LOG.warn("Lowering of {} aborted: {}", ctx.file(), e.getMessage());
            throw e;
        }
        result = liftTopLevel(what.loc(), result);
        List<String> violations = ctx.verifier().verify(result);
        if (!violations.isEmpty()) {
            LOG.warn("Verifier found {} problem(s) in {}, first: {}", violations.size(), ctx.file(), violations.get(0));
        }
        LOG.debug("Lowered {}", ctx.file());
        return result;
    }

    private static Expression liftTopLevel(SourceLocation loc, Expression what) {
        if (what instanceof ClassDef) {
            return what;
        }
        List<Expression> rhs = new ArrayList<>();
        if (what instanceof InsSeq insSeq) {
            rhs.addAll(insSeq.stats());
            rhs.add(insSeq.expr());
        } else {
            rhs.add(what);
        }
        return new ClassDef(loc, loc, CoreSymbol.ROOT, emptyTree(loc), List.of(), rhs, ClassDef.Kind.CLASS);
    }

    LoweringContext ctx() {
        return ctx;
    }

    // ==================== Dispatch ====================

    Expression node2TreeImpl(Node what, FreshNames fresh) {
        if (what == null) {
            throw new LoweringException("parse tree is missing a required child");
        }
        if (!hasLocation(what)) {
            // Reported by the nearest enclosing node that has a location
            throw new LoweringException("parse node " + what.type() + " has no location");
        }
        try {
            return what.accept(this, fresh);
        } catch (LoweringException e) {
            fatalErrors.reportOnce(ctx.diagnostics(), what.loc(), e);
            throw e;
        }
    }

    private static boolean hasLocation(Node node) {
        return node.loc() != null && node.loc().exists();
    }

    /**
     * Lowers an optional child, standing in an {@link EmptyTree} at {@code loc} when it is absent.
     */
    Expression lowerOrEmpty(Node what, SourceLocation loc, FreshNames fresh) {
        if (what == null) {
            return emptyTree(loc);
        }
        return node2TreeImpl(what, fresh);
    }

    private List<Expression> lowerAll(List<Node> nodes, FreshNames fresh) {
        List<Expression> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(node2TreeImpl(node, fresh));
        }
        return result;
    }

    private Expression unsupportedNode(Node node) {
        ctx.report(node.loc(), ErrorClass.UNSUPPORTED_NODE, "Unsupported node type `" + node.type() + "`");
        return emptyTree(node.loc());
    }

    private static Expression noRule(Node node) {
        throw LoweringException.notImplemented("Parser Node: " + node.type());
    }

    // ==================== Calls ====================

    @Override
    public Expression visitSend(Node.Send send, FreshNames fresh) {
        Expression rec = send.receiver() == null ? null : node2TreeImpl(send.receiver(), fresh);
        return desugarSend(send.loc(), rec, ctx.intern(send.method()), send.args(), fresh);
    }

    /**
     * Lowers a call once its receiver is known. A null or empty receiver is an implicit
     * {@code self} and makes the call private-ok.
     */
    private Expression desugarSend(SourceLocation loc, Expression rec, Name method, List<Node> args, FreshNames fresh) {
        boolean privateOk = false;
        if (rec == null || isEmptyTree(rec)) {
            rec = self(loc);
            privateOk = true;
        }

        if (args.stream().anyMatch(arg -> arg instanceof Node.Splat)) {
            List<Node> positional = new ArrayList<>(args);
            Node blockPass = null;
            for (int i = 0; i < positional.size(); i++) {
                if (positional.get(i) instanceof Node.BlockPass bp) {
                    blockPass = bp.block();
                    positional.remove(i);
                    break;
                }
            }
            Expression array = collections.desugarArray(loc, positional, fresh);
            Block block = node2Proc(blockPass, fresh);
            return send(loc, constant(loc, CoreSymbol.MAGIC), Names.CALL_WITH_SPLAT,
                List.of(rec, symbol(loc, method), array), false, block);
        }

        List<Expression> lowered = new ArrayList<>(args.size());
        Node blockPass = null;
        for (Node arg : args) {
            if (arg instanceof Node.BlockPass bp) {
                if (blockPass != null) {
                    throw new LoweringException("passing a block where there is no block");
                }
                blockPass = bp.block();
            } else {
                lowered.add(node2TreeImpl(arg, fresh));
            }
        }
        return send(loc, rec, method, lowered, privateOk, node2Proc(blockPass, fresh));
    }

    /**
     * Turns the operand of a block-pass argument into a block: {@code &:m} becomes
     * {@code {|t| t.m}}, anything else forwards its arguments to {@code expr.to_proc.call}.
     */
    private Block node2Proc(Node node, FreshNames fresh) {
        if (node == null) {
            return null;
        }
        Expression expr = node2TreeImpl(node, fresh);
        SourceLocation loc = expr.loc();
        Name temp = fresh.fresh(Names.BLOCK_PASS_TEMP);

        if (isSymbolLit(expr)) {
            Name name = (Name) ((Literal) expr).value();
            return new Block(loc, List.of(local(loc, temp)), send0(loc, local(loc, temp), name));
        }

        Send proc = send0(loc, expr, Names.TO_PROC);
        Expression body = send3(loc, constant(loc, CoreSymbol.MAGIC), Names.CALL_WITH_SPLAT,
            proc, symbol(loc, Names.CALL), local(loc, temp));
        return new Block(loc, List.of(new RestArg(loc, local(loc, temp))), body);
    }

    @Override
    public Expression visitCSend(Node.CSend csend, FreshNames fresh) {
        SourceLocation loc = csend.loc();
        SourceLocation recvLoc = csend.receiver().loc();
        Name tempRecv = fresh.fresh(Names.ASSIGN_TEMP);
        Expression assgn = assign(recvLoc, tempRecv, node2TreeImpl(csend.receiver(), fresh));
        Expression cond = send0(loc, local(recvLoc, tempRecv), Names.NIL_P);
        Expression call = desugarSend(loc, local(recvLoc, tempRecv), ctx.intern(csend.method()), csend.args(), fresh);
        return insSeq1(loc, assgn, ifThenElse(loc, cond, nil(loc), call));
    }

    @Override
    public Expression visitSuper(Node.Super node, FreshNames fresh) {
        return desugarSend(node.loc(), null, Names.SUPER, node.args(), fresh);
    }

    @Override
    public Expression visitZSuper(Node.ZSuper node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return send1(loc, self(loc), Names.SUPER, new ZSuperArgs(loc));
    }

    @Override
    public Expression visitBlock(Node.Block block, FreshNames fresh) {
        SourceLocation loc = block.loc();
        Expression recv = node2TreeImpl(block.send(), fresh);
        ArgsAndBody argsAndBody = desugarArgsAndBody(loc, block.args(), block.body(), fresh);
        return attachBlock(recv, new Block(loc, argsAndBody.args(), argsAndBody.body()));
    }

    /**
     * Attaches {@code block} to the call {@code recv} lowered to: the call itself, or the call in
     * the else branch of a safe-navigation rewrite.
     */
    private static Expression attachBlock(Expression recv, Block block) {
        if (recv instanceof Send send) {
            return send.withBlock(block);
        }
        if (!(recv instanceof InsSeq insSeq)) {
            throw new LoweringException("DesugarBlock: failed to find InsSeq");
        }
        if (!(insSeq.expr() instanceof If iff)) {
            throw new LoweringException("DesugarBlock: failed to find If");
        }
        if (!(iff.elsep() instanceof Send send)) {
            throw new LoweringException("DesugarBlock: failed to find Send");
        }
        If withBlock = new If(iff.loc(), iff.cond(), iff.thenp(), send.withBlock(block));
        return new InsSeq(insSeq.loc(), insSeq.stats(), withBlock);
    }

    @Override
    public Expression visitBlockPass(Node.BlockPass node, FreshNames fresh) {
        throw new LoweringException("Send should have already handled the BlockPass");
    }

    @Override
    public Expression visitYield(Node.Yield node, FreshNames fresh) {
        return new Yield(node.loc(), lowerAll(node.exprs(), fresh));
    }

    // ==================== Names ====================

    @Override
    public Expression visitConst(Node.Const node, FreshNames fresh) {
        Expression scope = lowerOrEmpty(node.scope(), node.loc(), fresh);
        return new UnresolvedConstantLit(node.loc(), scope, ctx.intern(node.name()));
    }

    @Override
    public Expression visitConstLhs(Node.ConstLhs node, FreshNames fresh) {
        Expression scope = lowerOrEmpty(node.scope(), node.loc(), fresh);
        return new UnresolvedConstantLit(node.loc(), scope, ctx.intern(node.name()));
    }

    @Override
    public Expression visitCbase(Node.Cbase node, FreshNames fresh) {
        return constant(node.loc(), CoreSymbol.ROOT);
    }

    @Override
    public Expression visitLVar(Node.LVar node, FreshNames fresh) {
        return local(node.loc(), ctx.intern(node.name()));
    }

    @Override
    public Expression visitLVarLhs(Node.LVarLhs node, FreshNames fresh) {
        return local(node.loc(), ctx.intern(node.name()));
    }

    @Override
    public Expression visitIVar(Node.IVar node, FreshNames fresh) {
        return ident(node.loc(), UnresolvedIdent.Kind.INSTANCE, node.name());
    }

    @Override
    public Expression visitIVarLhs(Node.IVarLhs node, FreshNames fresh) {
        return ident(node.loc(), UnresolvedIdent.Kind.INSTANCE, node.name());
    }

    @Override
    public Expression visitGVar(Node.GVar node, FreshNames fresh) {
        return ident(node.loc(), UnresolvedIdent.Kind.GLOBAL, node.name());
    }

    @Override
    public Expression visitGVarLhs(Node.GVarLhs node, FreshNames fresh) {
        return ident(node.loc(), UnresolvedIdent.Kind.GLOBAL, node.name());
    }

    @Override
    public Expression visitCVar(Node.CVar node, FreshNames fresh) {
        return ident(node.loc(), UnresolvedIdent.Kind.CLASS, node.name());
    }

    @Override
    public Expression visitCVarLhs(Node.CVarLhs node, FreshNames fresh) {
        return ident(node.loc(), UnresolvedIdent.Kind.CLASS, node.name());
    }

    @Override
    public Expression visitNthRef(Node.NthRef node, FreshNames fresh) {
        return ident(node.loc(), UnresolvedIdent.Kind.GLOBAL, Integer.toString(node.ref()));
    }

    @Override
    public Expression visitBackref(Node.Backref node, FreshNames fresh) {
        return unsupportedNode(node);
    }

    @Override
    public Expression visitSelf(Node.Self node, FreshNames fresh) {
        return self(node.loc());
    }

    private UnresolvedIdent ident(SourceLocation loc, UnresolvedIdent.Kind kind, String name) {
        return new UnresolvedIdent(loc, kind, ctx.intern(name));
    }

    // ==================== Literals ====================

    @Override
    public Expression visitStr(Node.Str node, FreshNames fresh) {
        return string(node.loc(), ctx.intern(node.val()));
    }

    @Override
    public Expression visitSym(Node.Sym node, FreshNames fresh) {
        return symbol(node.loc(), ctx.intern(node.val()));
    }

    @Override
    public Expression visitDString(Node.DString node, FreshNames fresh) {
        return collections.desugarDString(node.loc(), node.nodes(), fresh);
    }

    @Override
    public Expression visitDSymbol(Node.DSymbol node, FreshNames fresh) {
        return collections.desugarDSymbol(node.loc(), node.nodes(), fresh);
    }

    @Override
    public Expression visitXString(Node.XString node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return send1(loc, self(loc), Names.BACKTICK, collections.desugarDString(loc, node.nodes(), fresh));
    }

    @Override
    public Expression visitIntegerLit(Node.IntegerLit node, FreshNames fresh) {
        return integer(node.loc(), numerics.parseInteger(node.loc(), node.val()));
    }

    @Override
    public Expression visitFloatLit(Node.FloatLit node, FreshNames fresh) {
        return floating(node.loc(), numerics.parseFloat(node.loc(), node.val()));
    }

    @Override
    public Expression visitComplexLit(Node.ComplexLit node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return send1(loc, constant(loc, CoreSymbol.KERNEL), Names.COMPLEX, string(loc, ctx.intern(node.value())));
    }

    @Override
    public Expression visitRationalLit(Node.RationalLit node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return send1(loc, constant(loc, CoreSymbol.KERNEL), Names.RATIONAL, string(loc, ctx.intern(node.val())));
    }

    @Override
    public Expression visitNil(Node.Nil node, FreshNames fresh) {
        return nil(node.loc());
    }

    @Override
    public Expression visitTrue(Node.True node, FreshNames fresh) {
        return trueLit(node.loc());
    }

    @Override
    public Expression visitFalse(Node.False node, FreshNames fresh) {
        return falseLit(node.loc());
    }

    @Override
    public Expression visitFileLiteral(Node.FileLiteral node, FreshNames fresh) {
        return string(node.loc(), Names.CURRENT_FILE);
    }

    @Override
    public Expression visitLineLiteral(Node.LineLiteral node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        if (!loc.singleLine()) {
            throw new LoweringException("position corrupted: __LINE__ spans " + loc);
        }
        return integer(loc, loc.start().line());
    }

    // ==================== Collections ====================

    @Override
    public Expression visitArrayLit(Node.ArrayLit node, FreshNames fresh) {
        return collections.desugarArray(node.loc(), node.elts(), fresh);
    }

    @Override
    public Expression visitHashLit(Node.HashLit node, FreshNames fresh) {
        return collections.desugarHash(node.loc(), node.pairs(), fresh);
    }

    @Override
    public Expression visitPair(Node.Pair node, FreshNames fresh) {
        return noRule(node);
    }

    @Override
    public Expression visitKwsplat(Node.Kwsplat node, FreshNames fresh) {
        return noRule(node);
    }

    @Override
    public Expression visitSplat(Node.Splat node, FreshNames fresh) {
        return new Splat(node.loc(), node2TreeImpl(node.var(), fresh));
    }

    @Override
    public Expression visitIRange(Node.IRange node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression from = lowerOrEmpty(node.from(), loc, fresh);
        Expression to = lowerOrEmpty(node.to(), loc, fresh);
        return send2(loc, constant(loc, CoreSymbol.RANGE), Names.NEW, from, to);
    }

    @Override
    public Expression visitERange(Node.ERange node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression from = lowerOrEmpty(node.from(), loc, fresh);
        Expression to = lowerOrEmpty(node.to(), loc, fresh);
        return send3(loc, constant(loc, CoreSymbol.RANGE), Names.NEW, from, to, trueLit(loc));
    }

    @Override
    public Expression visitRegexp(Node.Regexp node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression pattern = collections.desugarDString(loc, node.regex(), fresh);
        Expression opts = lowerOrEmpty(node.opts(), loc, fresh);
        return send2(loc, constant(loc, CoreSymbol.REGEXP), Names.NEW, pattern, opts);
    }

    @Override
    public Expression visitRegopt(Node.Regopt node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression acc = integer(loc, 0);
        for (char opt : node.opts().toCharArray()) {
            int flag = regexpFlag(opt);
            if (flag != 0) {
                acc = send1(loc, acc, Names.OR_OP, integer(loc, flag));
            }
        }
        return acc;
    }

    private static int regexpFlag(char opt) {
        switch (opt) {
            case 'i':
                return 1;
            case 'x':
                return 2;
            case 'm':
                return 4;
            default:
                return 0;
        }
    }

    // ==================== Sequencing and logic ====================

    @Override
    public Expression visitBegin(Node.Begin node, FreshNames fresh) {
        return desugarBegin(node.loc(), node.stmts(), fresh);
    }

    @Override
    public Expression visitKwbegin(Node.Kwbegin node, FreshNames fresh) {
        return desugarBegin(node.loc(), node.stmts(), fresh);
    }

    private Expression desugarBegin(SourceLocation loc, List<Node> stmts, FreshNames fresh) {
        if (stmts.isEmpty()) {
            return emptyTree(loc);
        }
        List<Expression> lowered = lowerAll(stmts, fresh);
        Expression last = lowered.remove(lowered.size() - 1);
        return insSeq(loc, lowered, last);
    }

    @Override
    public Expression visitAnd(Node.And node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression lhs = node2TreeImpl(node.left(), fresh);
        if (lhs instanceof Reference ref) {
            Expression rhs = node2TreeImpl(node.right(), fresh);
            return ifThenElse(loc, copyRef(ref), rhs, lhs);
        }
        Name temp = fresh.fresh(Names.AND_AND);
        Expression rhs = node2TreeImpl(node.right(), fresh);
        SourceLocation lhsLoc = lhs.loc();
        Expression assgn = assign(lhsLoc, temp, lhs);
        Expression iff = ifThenElse(loc, local(lhsLoc, temp), rhs, local(lhsLoc, temp));
        return insSeq1(loc, assgn, iff);
    }

    @Override
    public Expression visitOr(Node.Or node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression lhs = node2TreeImpl(node.left(), fresh);
        if (lhs instanceof Reference ref) {
            Expression rhs = node2TreeImpl(node.right(), fresh);
            return ifThenElse(loc, copyRef(ref), lhs, rhs);
        }
        Name temp = fresh.fresh(Names.OR_OR);
        Expression rhs = node2TreeImpl(node.right(), fresh);
        SourceLocation lhsLoc = lhs.loc();
        Expression assgn = assign(lhsLoc, temp, lhs);
        Expression iff = ifThenElse(loc, local(lhsLoc, temp), local(lhsLoc, temp), rhs);
        return insSeq1(loc, assgn, iff);
    }

    @Override
    public Expression visitDefined(Node.Defined node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return send1(loc, constant(loc, CoreSymbol.MAGIC), Names.DEFINED_P, node2TreeImpl(node.value(), fresh));
    }

    @Override
    public Expression visitAlias(Node.Alias node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression from = node2TreeImpl(node.from(), fresh);
        Expression to = node2TreeImpl(node.to(), fresh);
        return send2(loc, self(loc), Names.ALIAS_METHOD, from, to);
    }

    // ==================== Assignment ====================

    @Override
    public Expression visitAssign(Node.Assign node, FreshNames fresh) {
        Expression lhs = node2TreeImpl(node.lhs(), fresh);
        Expression rhs = node2TreeImpl(node.rhs(), fresh);
        return assign(node.loc(), lhs, rhs);
    }

    @Override
    public Expression visitAndAsgn(Node.AndAsgn node, FreshNames fresh) {
        return assignments.desugarAndAsgn(node, fresh);
    }

    @Override
    public Expression visitOrAsgn(Node.OrAsgn node, FreshNames fresh) {
        return assignments.desugarOrAsgn(node, fresh);
    }

    @Override
    public Expression visitOpAsgn(Node.OpAsgn node, FreshNames fresh) {
        return assignments.desugarOpAsgn(node, fresh);
    }

    @Override
    public Expression visitMasgn(Node.Masgn node, FreshNames fresh) {
        if (!(node.lhs() instanceof Node.Mlhs lhs)) {
            throw new LoweringException("Failed to get lhs of Masgn");
        }
        Expression rhs = node2TreeImpl(node.rhs(), fresh);
        return assignments.desugarMlhs(node.loc(), lhs, rhs, fresh);
    }

    @Override
    public Expression visitMlhs(Node.Mlhs node, FreshNames fresh) {
        return noRule(node);
    }

    @Override
    public Expression visitSplatLhs(Node.SplatLhs node, FreshNames fresh) {
        return noRule(node);
    }

    // ==================== Definitions ====================

    @Override
    public Expression visitModuleDef(Node.ModuleDef node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        List<Expression> body = scopeNodeToBody(node.body(), loc);
        Expression name = node2TreeImpl(node.name(), fresh);
        return new ClassDef(loc, node.declLoc(), CoreSymbol.TODO, name, List.of(), body, ClassDef.Kind.MODULE);
    }

    @Override
    public Expression visitClassDef(Node.ClassDef node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        List<Expression> body = scopeNodeToBody(node.body(), loc);
        Expression ancestor = node.superclass() == null
            ? constant(loc, CoreSymbol.TODO)
            : node2TreeImpl(node.superclass(), fresh);
        Expression name = node2TreeImpl(node.name(), fresh);
        return new ClassDef(loc, node.declLoc(), CoreSymbol.TODO, name, List.of(ancestor), body, ClassDef.Kind.CLASS);
    }

    @Override
    public Expression visitSClass(Node.SClass node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        if (!(node.expr() instanceof Node.Self)) {
            ctx.report(node.expr().loc(), ErrorClass.INVALID_SINGLETON_DEF,
                "`class << EXPRESSION` is only supported for `class << self`");
            return emptyTree(loc);
        }
        List<Expression> body = scopeNodeToBody(node.body(), loc);
        Expression name = new UnresolvedIdent(node.expr().loc(), UnresolvedIdent.Kind.CLASS, Names.SINGLETON);
        return new ClassDef(loc, node.declLoc(), CoreSymbol.TODO, name, List.of(), body, ClassDef.Kind.CLASS);
    }

    /**
     * Lowers a class or module body with its own fresh-name counter. A {@code begin} body
     * contributes its statements one by one.
     */
    private List<Expression> scopeNodeToBody(Node body, SourceLocation loc) {
        FreshNames fresh = new FreshNames(ctx.names());
        List<Expression> result = new ArrayList<>();
        if (body instanceof Node.Begin begin) {
            for (Node stat : begin.stmts()) {
                result.add(node2TreeImpl(stat, fresh));
            }
            if (result.isEmpty()) {
                result.add(emptyTree(loc));
            }
        } else {
            result.add(lowerOrEmpty(body, loc, fresh));
        }
        return result;
    }

    @Override
    public Expression visitDefMethod(Node.DefMethod node, FreshNames fresh) {
        return buildMethod(node.loc(), node.declLoc(), node.name(), node.args(), node.body(), false);
    }

    @Override
    public Expression visitDefS(Node.DefS node, FreshNames fresh) {
        if (!(node.singleton() instanceof Node.Self)) {
            ctx.report(node.singleton().loc(), ErrorClass.INVALID_SINGLETON_DEF,
                "`def EXPRESSION.method` is only supported for `def self.method`");
            return emptyTree(node.loc());
        }
        return buildMethod(node.loc(), node.declLoc(), node.name(), node.args(), node.body(), true);
    }

    private Expression buildMethod(SourceLocation loc, SourceLocation declLoc, String name,
                                   Node args, Node body, boolean selfMethod) {
        FreshNames fresh = new FreshNames(ctx.names());
        ArgsAndBody argsAndBody = desugarArgsAndBody(loc, args, body, fresh);
        return new MethodDef(loc, declLoc, ctx.intern(name), argsAndBody.args(), argsAndBody.body(), selfMethod);
    }

    private record ArgsAndBody(List<Expression> args, Expression body) {
    }

    /**
     * Lowers a parameter list and the body it scopes. Destructuring parameters become fresh
     * locals whose destructuring is prepended to the body.
     */
    private ArgsAndBody desugarArgsAndBody(SourceLocation loc, Node argnode, Node bodynode, FreshNames fresh) {
        List<Expression> args = new ArrayList<>();
        List<Expression> destructures = new ArrayList<>();

        if (argnode instanceof Node.Args oargs) {
            for (Node arg : oargs.args()) {
                if (arg instanceof Node.Mlhs mlhs) {
                    Name temporary = fresh.fresh(Names.DESTRUCTURE_ARG);
                    SourceLocation argLoc = arg.loc();
                    args.add(local(argLoc, temporary));
                    destructures.add(assignments.desugarMlhs(argLoc, mlhs, local(argLoc, temporary), fresh));
                } else {
                    args.add(node2TreeImpl(arg, fresh));
                }
            }
        } else if (argnode != null) {
            throw LoweringException.notImplemented("parameter list of type " + argnode.type());
        }

        Expression body = lowerOrEmpty(bodynode, loc, fresh);
        if (!destructures.isEmpty()) {
            body = insSeq(loc, destructures, body);
        }
        return new ArgsAndBody(args, body);
    }

    @Override
    public Expression visitArgs(Node.Args node, FreshNames fresh) {
        return noRule(node);
    }

    @Override
    public Expression visitArg(Node.Arg node, FreshNames fresh) {
        return local(node.loc(), ctx.intern(node.name()));
    }

    @Override
    public Expression visitRestarg(Node.Restarg node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return new RestArg(loc, local(loc, ctx.intern(node.name())));
    }

    @Override
    public Expression visitKwrestarg(Node.Kwrestarg node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return new RestArg(loc, new KeywordArg(loc, local(loc, ctx.intern(node.name()))));
    }

    @Override
    public Expression visitKwarg(Node.Kwarg node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return new KeywordArg(loc, local(loc, ctx.intern(node.name())));
    }

    @Override
    public Expression visitKwoptarg(Node.Kwoptarg node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        KeywordArg ref = new KeywordArg(loc, local(loc, ctx.intern(node.name())));
        return new OptionalArg(loc, ref, node2TreeImpl(node.defaultValue(), fresh));
    }

    @Override
    public Expression visitOptarg(Node.Optarg node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Local ref = local(loc, ctx.intern(node.name()));
        return new OptionalArg(loc, ref, node2TreeImpl(node.defaultValue(), fresh));
    }

    @Override
    public Expression visitBlockarg(Node.Blockarg node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return new BlockArg(loc, local(loc, ctx.intern(node.name())));
    }

    @Override
    public Expression visitShadowarg(Node.Shadowarg node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        return new ShadowArg(loc, local(loc, ctx.intern(node.name())));
    }

    // ==================== Control flow ====================

    @Override
    public Expression visitIf(Node.If node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression cond = node2TreeImpl(node.condition(), fresh);
        Expression thenp = lowerOrEmpty(node.thenBody(), loc, fresh);
        Expression elsep = lowerOrEmpty(node.elseBody(), loc, fresh);
        return ifThenElse(loc, cond, thenp, elsep);
    }

    @Override
    public Expression visitCase(Node.Case node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression assgn = null;
        Name temp = null;
        SourceLocation cloc = loc;

        if (node.condition() != null) {
            cloc = node.condition().loc();
            temp = fresh.fresh(Names.ASSIGN_TEMP);
            assgn = assign(cloc, temp, node2TreeImpl(node.condition(), fresh));
        }

        Expression res = lowerOrEmpty(node.elseBody(), loc, fresh);
        List<Node> whens = node.whens();
        for (int i = whens.size() - 1; i >= 0; i--) {
            if (!(whens.get(i) instanceof Node.When when)) {
                throw new LoweringException("case without a when?");
            }
            Expression cond = null;
            for (Node cnode : when.patterns()) {
                Expression ctree = node2TreeImpl(cnode, fresh);
                Expression test = temp == null
                    ? ctree
                    : send1(ctree.loc(), ctree, Names.TRIPLE_EQ, local(cloc, temp));
                cond = cond == null ? test : ifThenElse(test.loc(), test, trueLit(test.loc()), cond);
            }
            if (cond == null) {
                throw new LoweringException("when without a pattern");
            }
            res = ifThenElse(when.loc(), cond, lowerOrEmpty(when.body(), when.loc(), fresh), res);
        }

        if (assgn != null) {
            res = insSeq1(loc, assgn, res);
        }
        return res;
    }

    @Override
    public Expression visitWhen(Node.When node, FreshNames fresh) {
        return noRule(node);
    }

    @Override
    public Expression visitWhile(Node.While node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression cond = node2TreeImpl(node.cond(), fresh);
        Expression body = lowerOrEmpty(node.body(), loc, fresh);
        return new While(loc, cond, body);
    }

    @Override
    public Expression visitWhilePost(Node.WhilePost node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        boolean isDoWhile = node.body() instanceof Node.Kwbegin;
        Expression body = lowerOrEmpty(node.body(), loc, fresh);
        if (isDoWhile) {
            Expression cond = send0(loc, node2TreeImpl(node.cond(), fresh), Names.BANG);
            return doWhile(loc, cond, body, fresh);
        }
        return new While(loc, node2TreeImpl(node.cond(), fresh), body);
    }

    @Override
    public Expression visitUntil(Node.Until node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression cond = send0(loc, node2TreeImpl(node.cond(), fresh), Names.BANG);
        Expression body = lowerOrEmpty(node.body(), loc, fresh);
        return new While(loc, cond, body);
    }

    @Override
    public Expression visitUntilPost(Node.UntilPost node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        boolean isDoUntil = node.body() instanceof Node.Kwbegin;
        Expression body = lowerOrEmpty(node.body(), loc, fresh);
        if (isDoUntil) {
            return doWhile(loc, node2TreeImpl(node.cond(), fresh), body, fresh);
        }
        Expression cond = send0(loc, node2TreeImpl(node.cond(), fresh), Names.BANG);
        return new While(loc, cond, body);
    }

    /**
     * A loop that runs {@code body} at least once and stops with the body's last value once
     * {@code breakCond} holds.
     */
    private static Expression doWhile(SourceLocation loc, Expression breakCond, Expression body, FreshNames fresh) {
        Name temp = fresh.fresh(Names.FOR_TEMP);
        Expression withResult = assign(loc, temp, body);
        Expression breaker = ifThenElse(loc, breakCond, new Break(loc, local(loc, temp)), emptyTree(loc));
        return new While(loc, trueLit(loc), insSeq1(loc, withResult, breaker));
    }

    @Override
    public Expression visitFor(Node.For node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Name temp = fresh.fresh(Names.FOR_TEMP);
        Node.Mlhs mlhs = node.vars() instanceof Node.Mlhs vars ? vars : new Node.Mlhs(loc, List.of(node.vars()));
        Expression masgn = assignments.desugarMlhs(loc, mlhs, local(loc, temp), fresh);
        Expression body = insSeq1(loc, masgn, lowerOrEmpty(node.body(), loc, fresh));
        Block block = new Block(loc, List.of(new RestArg(loc, local(loc, temp))), body);
        Expression recv = node2TreeImpl(node.expr(), fresh);
        return send(loc, recv, Names.EACH, List.of(), false, block);
    }

    @Override
    public Expression visitReturn(Node.Return node, FreshNames fresh) {
        return new Return(node.loc(), jumpValue(node.loc(), node.exprs(), fresh));
    }

    @Override
    public Expression visitBreak(Node.Break node, FreshNames fresh) {
        return new Break(node.loc(), jumpValue(node.loc(), node.exprs(), fresh));
    }

    @Override
    public Expression visitNext(Node.Next node, FreshNames fresh) {
        return new Next(node.loc(), jumpValue(node.loc(), node.exprs(), fresh));
    }

    private Expression jumpValue(SourceLocation loc, List<Node> exprs, FreshNames fresh) {
        if (exprs.size() > 1) {
            return new ArrayLit(loc, lowerAll(exprs, fresh));
        } else if (exprs.size() == 1) {
            return node2TreeImpl(exprs.get(0), fresh);
        }
        return emptyTree(loc);
    }

    @Override
    public Expression visitRetry(Node.Retry node, FreshNames fresh) {
        return new Retry(node.loc());
    }

    @Override
    public Expression visitRedo(Node.Redo node, FreshNames fresh) {
        return unsupportedNode(node);
    }

    // ==================== Exceptions ====================

    @Override
    public Expression visitRescue(Node.Rescue node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Rescue.Builder builder = Rescue.builder(loc);
        for (Node rescueNode : node.rescue()) {
            if (!(rescueNode instanceof Node.Resbody resbody)) {
                throw new LoweringException("rescue case cast failed for " + rescueNode.type());
            }
            builder.rescueCase(desugarResbody(resbody, fresh));
        }
        builder.body(lowerOrEmpty(node.body(), loc, fresh));
        builder.elsep(lowerOrEmpty(node.elseBody(), loc, fresh));
        return builder.build();
    }

    private RescueCase desugarResbody(Node.Resbody resbody, FreshNames fresh) {
        SourceLocation loc = resbody.loc();

        List<Expression> exceptions = new ArrayList<>();
        Expression exceptionsExpr = lowerOrEmpty(resbody.exception(), loc, fresh);
        // An empty list rescues StandardError
        if (exceptionsExpr instanceof ArrayLit array) {
            exceptions.addAll(array.elems());
        } else if (exceptionsExpr instanceof Send send) {
            if (!send.fun().equals(Names.TO_A) && !send.fun().equals(Names.CONCAT)) {
                throw new LoweringException("Unknown exception list function " + send.fun().show());
            }
            exceptions.add(send);
        } else if (exceptionsExpr instanceof Splat) {
            exceptions.add(exceptionsExpr);
        } else if (!(exceptionsExpr instanceof EmptyTree)) {
            throw new LoweringException("Bad exception list of type " + exceptionsExpr.type());
        }

        Expression varExpr = lowerOrEmpty(resbody.var(), loc, fresh);
        Expression body = lowerOrEmpty(resbody.body(), loc, fresh);

        SourceLocation varLoc = varExpr.loc();
        Name var;
        if (varExpr instanceof Local target) {
            var = target.name();
        } else {
            var = fresh.fresh(Names.RESCUE_TEMP);
            if (isEmptyTree(varExpr)) {
                varLoc = loc;
            } else {
                body = insSeq1(varLoc, assign(varLoc, varExpr, local(varLoc, var)), body);
            }
        }
        return new RescueCase(loc, exceptions, local(varLoc, var), body);
    }

    @Override
    public Expression visitResbody(Node.Resbody node, FreshNames fresh) {
        return noRule(node);
    }

    @Override
    public Expression visitEnsure(Node.Ensure node, FreshNames fresh) {
        SourceLocation loc = node.loc();
        Expression body = lowerOrEmpty(node.body(), loc, fresh);
        Expression ensure = lowerOrEmpty(node.ensure(), loc, fresh);
        if (body instanceof Rescue rescue) {
            return Rescue.from(rescue).ensure(ensure).build();
        }
        return Rescue.builder(loc).body(body).ensure(ensure).build();
    }

    // ==================== Unsupported ====================

    @Override
    public Expression visitPreexe(Node.Preexe node, FreshNames fresh) {
        return unsupportedNode(node);
    }

    @Override
    public Expression visitPostexe(Node.Postexe node, FreshNames fresh) {
        return unsupportedNode(node);
    }

    @Override
    public Expression visitUndef(Node.Undef node, FreshNames fresh) {
        return unsupportedNode(node);
    }

    @Override
    public Expression visitEFlipflop(Node.EFlipflop node, FreshNames fresh) {
        return unsupportedNode(node);
    }

    @Override
    public Expression visitIFlipflop(Node.IFlipflop node, FreshNames fresh) {
        return unsupportedNode(node);
    }

    @Override
    public Expression visitMatchCurLine(Node.MatchCurLine node, FreshNames fresh) {
        return unsupportedNode(node);
    }
}
