package com.rbdesugar.desugar;

import static com.rbdesugar.ast.Trees.isStringLit;
import static com.rbdesugar.ast.Trees.send0;
import static com.rbdesugar.ast.Trees.send1;
import static com.rbdesugar.ast.Trees.string;
import static com.rbdesugar.ast.Trees.symbol;

import com.rbdesugar.ast.ArrayLit;
import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.HashLit;
import com.rbdesugar.ast.SourceLocation;
import com.rbdesugar.errors.LoweringException;
import com.rbdesugar.names.Names;
import com.rbdesugar.parser.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Array and hash literals with splats, and string interpolation.
 */
final class DesugarCollections {

    private final Desugar desugar;

    DesugarCollections(Desugar desugar) {
        this.desugar = desugar;
    }

    /**
     * {@code [a, *b, c]} becomes {@code [a].concat(b.to_a).concat([c])}; an array without
     * splats stays a literal.
     */
    Expression desugarArray(SourceLocation loc, List<Node> elts, FreshNames fresh) {
        List<Expression> elems = new ArrayList<>();
        Expression lastMerge = null;

        for (Node stat : elts) {
            if (stat instanceof Node.Splat splat) {
                Expression var = send0(loc, desugar.node2TreeImpl(splat.var(), fresh), Names.TO_A);
                if (!elems.isEmpty()) {
                    Expression current = new ArrayLit(loc, elems);
                    elems = new ArrayList<>();
                    lastMerge = lastMerge == null ? current : send1(loc, lastMerge, Names.CONCAT, current);
                    lastMerge = send1(loc, lastMerge, Names.CONCAT, var);
                } else {
                    lastMerge = lastMerge == null ? var : send1(loc, lastMerge, Names.CONCAT, var);
                }
            } else {
                elems.add(desugar.node2TreeImpl(stat, fresh));
            }
        }

        if (elems.isEmpty()) {
            return lastMerge != null ? lastMerge : new ArrayLit(loc, elems);
        }
        Expression res = new ArrayLit(loc, elems);
        return lastMerge != null ? send1(loc, lastMerge, Names.CONCAT, res) : res;
    }

    /**
     * {@code {a => 1, **b}} becomes {@code {a => 1}.merge(b.to_hash)}; a hash without
     * double splats stays a literal.
     */
    Expression desugarHash(SourceLocation loc, List<Node> pairs, FreshNames fresh) {
        List<Expression> keys = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        Expression lastMerge = null;

        for (Node pairAsExpression : pairs) {
            if (pairAsExpression instanceof Node.Pair pair) {
                keys.add(desugar.node2TreeImpl(pair.key(), fresh));
                values.add(desugar.node2TreeImpl(pair.value(), fresh));
            } else if (pairAsExpression instanceof Node.Kwsplat kwsplat) {
                Expression expr = send0(loc, desugar.node2TreeImpl(kwsplat.expr(), fresh), Names.TO_HASH);
                if (!keys.isEmpty()) {
                    Expression current = new HashLit(loc, keys, values);
                    keys = new ArrayList<>();
                    values = new ArrayList<>();
                    lastMerge = lastMerge == null ? current : send1(loc, lastMerge, Names.MERGE, current);
                    lastMerge = send1(loc, lastMerge, Names.MERGE, expr);
                } else {
                    lastMerge = lastMerge == null ? expr : send1(loc, lastMerge, Names.MERGE, expr);
                }
            } else {
                throw new LoweringException("kwsplat cast failed for " + pairAsExpression.type());
            }
        }

        if (keys.isEmpty()) {
            return lastMerge != null ? lastMerge : new HashLit(loc, keys, values);
        }
        Expression res = new HashLit(loc, keys, values);
        return lastMerge != null ? send1(loc, lastMerge, Names.MERGE, res) : res;
    }

    /**
     * Interpolated strings: segments that are not string literals are converted with
     * {@code to_s}, then joined left to right with {@code concat}.
     */
    Expression desugarDString(SourceLocation loc, List<Node> nodes, FreshNames fresh) {
        if (nodes.isEmpty()) {
            return string(loc, Names.EMPTY);
        }
        Expression res = null;
        for (Node stat : nodes) {
            Expression piece = desugar.node2TreeImpl(stat, fresh);
            if (!isStringLit(piece)) {
                piece = send0(piece.loc(), piece, Names.TO_S);
            }
            res = res == null ? piece : send1(loc, res, Names.CONCAT, piece);
        }
        return res;
    }

    Expression desugarDSymbol(SourceLocation loc, List<Node> nodes, FreshNames fresh) {
        if (nodes.isEmpty()) {
            return symbol(loc, Names.EMPTY);
        }
        return send0(loc, desugarDString(loc, nodes, fresh), Names.INTERN);
    }
}
