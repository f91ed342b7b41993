package com.rbdesugar.ast;

import java.util.List;

/**
 * Renders a core tree as compact, single-line, source-like text.
 *
 * <p>The output is for people and tests, not for re-parsing: calls always show their receiver
 * and parentheses ({@code self.foo(1)}), instruction sequences are parenthesized with
 * {@code ;} separators, and an {@link EmptyTree} prints as {@code <emptyTree>}.</p>
 */
public final class TreePrinter {

    private final StringBuilder out = new StringBuilder();

    private TreePrinter() {
    }

    public static String print(Expression expr) {
        TreePrinter printer = new TreePrinter();
        printer.emit(expr);
        return printer.out.toString();
    }

    private void emit(Expression expr) {
        if (expr == null) {
            out.append("<null>");
        } else if (expr instanceof Local l) {
            out.append(l.name().show());
        } else if (expr instanceof UnresolvedIdent id) {
            out.append(id.name().show());
        } else if (expr instanceof Literal lit) {
            emitLiteral(lit);
        } else if (expr instanceof Self) {
            out.append("self");
        } else if (expr instanceof Send s) {
            emit(s.recv());
            out.append('.').append(s.fun().show()).append('(');
            emitList(s.args(), ", ");
            out.append(')');
            if (s.block() != null) {
                out.append(' ');
                emit(s.block());
            }
        } else if (expr instanceof Block b) {
            out.append("{ ");
            if (!b.args().isEmpty()) {
                out.append('|');
                emitList(b.args(), ", ");
                out.append("| ");
            }
            emit(b.body());
            out.append(" }");
        } else if (expr instanceof InsSeq seq) {
            out.append('(');
            for (Expression stat : seq.stats()) {
                emit(stat);
                out.append("; ");
            }
            emit(seq.expr());
            out.append(')');
        } else if (expr instanceof If i) {
            out.append("if ");
            emit(i.cond());
            out.append(" then ");
            emit(i.thenp());
            out.append(" else ");
            emit(i.elsep());
            out.append(" end");
        } else if (expr instanceof While w) {
            out.append("while ");
            emit(w.cond());
            out.append(" do ");
            emit(w.body());
            out.append(" end");
        } else if (expr instanceof Assign a) {
            emit(a.lhs());
            out.append(" = ");
            emit(a.rhs());
        } else if (expr instanceof Return r) {
            jump("return", r.expr());
        } else if (expr instanceof Break b) {
            jump("break", b.expr());
        } else if (expr instanceof Next n) {
            jump("next", n.expr());
        } else if (expr instanceof Retry) {
            out.append("retry");
        } else if (expr instanceof Yield y) {
            out.append("yield(");
            emitList(y.args(), ", ");
            out.append(')');
        } else if (expr instanceof EmptyTree) {
            out.append("<emptyTree>");
        } else if (expr instanceof ZSuperArgs) {
            out.append("<zsuper-args>");
        } else if (expr instanceof ArrayLit a) {
            out.append('[');
            emitList(a.elems(), ", ");
            out.append(']');
        } else if (expr instanceof HashLit h) {
            out.append('{');
            for (int i = 0; i < h.keys().size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                emit(h.keys().get(i));
                out.append(" => ");
                emit(h.values().get(i));
            }
            out.append('}');
        } else if (expr instanceof Splat s) {
            out.append('*');
            emit(s.arg());
        } else if (expr instanceof ConstantLit c) {
            out.append(c.symbol().show());
        } else if (expr instanceof UnresolvedConstantLit c) {
            if (!(c.scope() instanceof EmptyTree)) {
                emit(c.scope());
                out.append("::");
            }
            out.append(c.cnst().show());
        } else if (expr instanceof RestArg r) {
            out.append('*');
            emit(r.expr());
        } else if (expr instanceof KeywordArg k) {
            emit(k.expr());
            out.append(':');
        } else if (expr instanceof OptionalArg o) {
            emit(o.expr());
            out.append(" = ");
            emit(o.defaultValue());
        } else if (expr instanceof BlockArg b) {
            out.append('&');
            emit(b.expr());
        } else if (expr instanceof ShadowArg s) {
            out.append(';');
            emit(s.expr());
        } else if (expr instanceof MethodDef m) {
            out.append("def ");
            if (m.selfMethod()) {
                out.append("self.");
            }
            out.append(m.name().show()).append('(');
            emitList(m.args(), ", ");
            out.append("); ");
            emit(m.rhs());
            out.append("; end");
        } else if (expr instanceof ClassDef c) {
            out.append(c.kind() == ClassDef.Kind.MODULE ? "module " : "class ");
            if (c.symbol() == CoreSymbol.ROOT) {
                out.append(CoreSymbol.ROOT.show());
            } else {
                emit(c.name());
            }
            if (!c.ancestors().isEmpty()) {
                out.append(" < ");
                emitList(c.ancestors(), ", ");
            }
            out.append("; ");
            emitList(c.rhs(), "; ");
            out.append("; end");
        } else if (expr instanceof Rescue r) {
            out.append("begin ");
            emit(r.body());
            for (RescueCase rescueCase : r.rescueCases()) {
                out.append(' ');
                emit(rescueCase);
            }
            out.append(" else ");
            emit(r.elsep());
            out.append(" ensure ");
            emit(r.ensure());
            out.append(" end");
        } else if (expr instanceof RescueCase rc) {
            out.append("rescue ");
            if (!rc.exceptions().isEmpty()) {
                emitList(rc.exceptions(), ", ");
                out.append(' ');
            }
            out.append("=> ");
            emit(rc.var());
            out.append(" then ");
            emit(rc.body());
        } else {
            out.append('<').append(expr.type()).append('>');
        }
    }

    private void emitLiteral(Literal lit) {
        switch (lit.kind()) {
            case STRING:
                out.append('"').append(lit.value()).append('"');
                break;
            case SYMBOL:
                out.append(':').append(lit.value());
                break;
            case TRUE:
                out.append("true");
                break;
            case FALSE:
                out.append("false");
                break;
            case NIL:
                out.append("nil");
                break;
            default:
                out.append(lit.value());
                break;
        }
    }

    private void jump(String keyword, Expression value) {
        out.append(keyword);
        if (!(value instanceof EmptyTree)) {
            out.append(' ');
            emit(value);
        }
    }

    private void emitList(List<? extends Expression> exprs, String separator) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            emit(exprs.get(i));
        }
    }
}
