package com.rbdesugar.verifier;

import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.Trees;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Checks that every node carries an existing location and has no missing children.
 */
public final class BasicVerifier implements Verifier {

    private static final Logger LOG = LoggerFactory.getLogger(BasicVerifier.class);

    @Override
    public List<String> verify(Expression tree) {
        List<String> violations = new ArrayList<>();
        if (tree == null) {
            violations.add("tree is null");
            return violations;
        }
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(tree);
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            if (node.loc() == null || !node.loc().exists()) {
                violations.add(node.type() + " has no location");
            }
            for (Expression child : Trees.children(node)) {
                if (child == null) {
                    violations.add(node.type() + " at " + node.loc() + " has a missing child");
                } else {
                    pending.push(child);
                }
            }
        }
        for (String violation : violations) {
            LOG.warn("Verifier: {}", violation);
        }
        return violations;
    }
}
