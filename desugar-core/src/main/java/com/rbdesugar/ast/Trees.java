package com.rbdesugar.ast;

import com.rbdesugar.errors.LoweringException;
import com.rbdesugar.names.Name;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory helpers for building core trees.
 */
public final class Trees {

    private Trees() {
        // Utility class
    }

    // ==================== Calls ====================

    public static Send send(SourceLocation loc, Expression recv, Name fun, List<Expression> args,
                            boolean privateOk, Block block) {
        return new Send(loc, recv, fun, args, privateOk, block);
    }

    public static Send send0(SourceLocation loc, Expression recv, Name fun) {
        return new Send(loc, recv, fun, List.of());
    }

    public static Send send1(SourceLocation loc, Expression recv, Name fun, Expression arg) {
        return new Send(loc, recv, fun, List.of(arg));
    }

    public static Send send2(SourceLocation loc, Expression recv, Name fun, Expression arg1, Expression arg2) {
        return new Send(loc, recv, fun, List.of(arg1, arg2));
    }

    public static Send send3(SourceLocation loc, Expression recv, Name fun,
                             Expression arg1, Expression arg2, Expression arg3) {
        return new Send(loc, recv, fun, List.of(arg1, arg2, arg3));
    }

    // ==================== Literals ====================

    public static Literal integer(SourceLocation loc, long value) {
        return new Literal(loc, Literal.Kind.INTEGER, value);
    }

    public static Literal floating(SourceLocation loc, double value) {
        return new Literal(loc, Literal.Kind.FLOAT, value);
    }

    public static Literal string(SourceLocation loc, Name value) {
        return new Literal(loc, Literal.Kind.STRING, value);
    }

    public static Literal symbol(SourceLocation loc, Name value) {
        return new Literal(loc, Literal.Kind.SYMBOL, value);
    }

    public static Literal trueLit(SourceLocation loc) {
        return new Literal(loc, Literal.Kind.TRUE, null);
    }

    public static Literal falseLit(SourceLocation loc) {
        return new Literal(loc, Literal.Kind.FALSE, null);
    }

    public static Literal nil(SourceLocation loc) {
        return new Literal(loc, Literal.Kind.NIL, null);
    }

    public static boolean isStringLit(Expression expr) {
        return expr instanceof Literal lit && lit.kind() == Literal.Kind.STRING;
    }

    public static boolean isSymbolLit(Expression expr) {
        return expr instanceof Literal lit && lit.kind() == Literal.Kind.SYMBOL;
    }

    // ==================== Structure ====================

    public static Local local(SourceLocation loc, Name name) {
        return new Local(loc, name);
    }

    public static Assign assign(SourceLocation loc, Expression lhs, Expression rhs) {
        return new Assign(loc, lhs, rhs);
    }

    public static Assign assign(SourceLocation loc, Name lhs, Expression rhs) {
        return new Assign(loc, new Local(loc, lhs), rhs);
    }

    public static If ifThenElse(SourceLocation loc, Expression cond, Expression thenp, Expression elsep) {
        return new If(loc, cond, thenp, elsep);
    }

    public static InsSeq insSeq(SourceLocation loc, List<Expression> stats, Expression expr) {
        return new InsSeq(loc, stats, expr);
    }

    public static InsSeq insSeq1(SourceLocation loc, Expression stat, Expression expr) {
        return new InsSeq(loc, List.of(stat), expr);
    }

    public static ConstantLit constant(SourceLocation loc, CoreSymbol symbol) {
        return new ConstantLit(loc, symbol);
    }

    public static Self self(SourceLocation loc) {
        return new Self(loc);
    }

    public static EmptyTree emptyTree(SourceLocation loc) {
        return new EmptyTree(loc);
    }

    public static boolean isEmptyTree(Expression expr) {
        return expr instanceof EmptyTree;
    }

    /**
     * A fresh copy of {@code ref}, so that one reference can appear in several places without
     * the tree sharing a node.
     */
    public static Reference copyRef(Reference ref) {
        if (ref instanceof Local l) {
            return new Local(l.loc(), l.name());
        } else if (ref instanceof UnresolvedIdent id) {
            return new UnresolvedIdent(id.loc(), id.kind(), id.name());
        } else if (ref instanceof RestArg r) {
            return new RestArg(r.loc(), copyRef(r.expr()));
        } else if (ref instanceof KeywordArg k) {
            return new KeywordArg(k.loc(), copyRef(k.expr()));
        } else if (ref instanceof BlockArg b) {
            return new BlockArg(b.loc(), copyRef(b.expr()));
        } else if (ref instanceof ShadowArg s) {
            return new ShadowArg(s.loc(), copyRef(s.expr()));
        } else if (ref instanceof OptionalArg) {
            throw new LoweringException("cannot copy an optional argument with its default value");
        }
        throw LoweringException.notImplemented("copyRef for " + ref.type());
    }

    // ==================== Traversal ====================

    /**
     * The direct children of {@code expr} in source order. Absent optional children (a
     * {@link Send} without a block) are skipped; any other null slot is returned as null.
     */
    public static List<Expression> children(Expression expr) {
        if (expr instanceof Send s) {
            List<Expression> result = new ArrayList<>();
            result.add(s.recv());
            result.addAll(s.args());
            if (s.block() != null) {
                result.add(s.block());
            }
            return result;
        } else if (expr instanceof Block b) {
            return concat(b.args(), b.body());
        } else if (expr instanceof ClassDef c) {
            List<Expression> result = new ArrayList<>();
            result.add(c.name());
            result.addAll(c.ancestors());
            result.addAll(c.rhs());
            return result;
        } else if (expr instanceof MethodDef m) {
            return concat(m.args(), m.rhs());
        } else if (expr instanceof InsSeq i) {
            return concat(i.stats(), i.expr());
        } else if (expr instanceof If i) {
            return Arrays.asList(i.cond(), i.thenp(), i.elsep());
        } else if (expr instanceof While w) {
            return Arrays.asList(w.cond(), w.body());
        } else if (expr instanceof Return r) {
            return Arrays.asList(r.expr());
        } else if (expr instanceof Break b) {
            return Arrays.asList(b.expr());
        } else if (expr instanceof Next n) {
            return Arrays.asList(n.expr());
        } else if (expr instanceof Yield y) {
            return y.args();
        } else if (expr instanceof Rescue r) {
            List<Expression> result = new ArrayList<>();
            result.add(r.body());
            result.addAll(r.rescueCases());
            result.add(r.elsep());
            result.add(r.ensure());
            return result;
        } else if (expr instanceof RescueCase rc) {
            List<Expression> result = new ArrayList<>(rc.exceptions());
            result.add(rc.var());
            result.add(rc.body());
            return result;
        } else if (expr instanceof ArrayLit a) {
            return a.elems();
        } else if (expr instanceof HashLit h) {
            List<Expression> result = new ArrayList<>();
            for (int i = 0; i < h.keys().size(); i++) {
                result.add(h.keys().get(i));
                result.add(h.values().get(i));
            }
            return result;
        } else if (expr instanceof Splat s) {
            return Arrays.asList(s.arg());
        } else if (expr instanceof Assign a) {
            return Arrays.asList(a.lhs(), a.rhs());
        } else if (expr instanceof UnresolvedConstantLit c) {
            return Arrays.asList(c.scope());
        } else if (expr instanceof RestArg r) {
            return Arrays.asList(r.expr());
        } else if (expr instanceof KeywordArg k) {
            return Arrays.asList(k.expr());
        } else if (expr instanceof OptionalArg o) {
            return Arrays.asList(o.expr(), o.defaultValue());
        } else if (expr instanceof BlockArg b) {
            return Arrays.asList(b.expr());
        } else if (expr instanceof ShadowArg s) {
            return Arrays.asList(s.expr());
        }
        return List.of();
    }

    private static List<Expression> concat(List<? extends Expression> first, Expression last) {
        List<Expression> result = new ArrayList<>(first);
        result.add(last);
        return result;
    }
}
