package com.rbdesugar.verifier;

import com.rbdesugar.ast.Expression;

import java.util.List;

/**
 * Structural checks run once on every lowered tree.
 */
public interface Verifier {

    /**
     * Checks {@code tree} and returns a description of every violation found, empty when the
     * tree is well formed. The tree is never changed.
     */
    List<String> verify(Expression tree);
}
