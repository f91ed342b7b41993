package com.rbdesugar.desugar;

import com.rbdesugar.ast.ClassDef;
import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.Send;
import com.rbdesugar.ast.Trees;
import com.rbdesugar.ast.TreePrinter;
import com.rbdesugar.errors.CollectingDiagnosticSink;
import com.rbdesugar.names.NameTable;
import com.rbdesugar.parser.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Lowers parse trees with a fresh session and keeps what was reported.
 */
final class LoweringFixture {

    final NameTable names = new NameTable();
    final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    LoweringContext context() {
        return LoweringContext.builder().names(names).diagnostics(sink).file("test.rb").build();
    }

    ClassDef lowerUnit(Node node) {
        return (ClassDef) Desugar.node2Tree(context(), node);
    }

    /**
     * Lowers a single top-level expression and returns it without the root class around it.
     */
    Expression lower(Node node) {
        ClassDef root = lowerUnit(node);
        if (root.rhs().size() != 1) {
            throw new AssertionError("expected one top-level expression, got " + root.rhs().size());
        }
        return root.rhs().get(0);
    }

    String print(Node node) {
        return TreePrinter.print(lower(node));
    }

    static List<Expression> collect(Expression tree, Predicate<Expression> filter) {
        List<Expression> found = new ArrayList<>();
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(tree);
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            if (filter.test(node)) {
                found.add(node);
            }
            for (Expression child : Trees.children(node)) {
                pending.push(child);
            }
        }
        return found;
    }

    static long countSends(Expression tree, String fun) {
        return collect(tree, e -> e instanceof Send s && s.fun().show().equals(fun)).size();
    }
}
