package com.rbdesugar.verifier;

import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.If;
import com.rbdesugar.ast.SourceLocation;
import com.rbdesugar.ast.Trees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestBasicVerifier {

    private static final SourceLocation LOC = SourceLocation.of(1, 1, 1, 10);

    @Test
    void testWellFormedTree() {
        Expression tree = Trees.ifThenElse(LOC, Trees.trueLit(LOC), Trees.integer(LOC, 1), Trees.emptyTree(LOC));
        assertEquals(List.of(), new BasicVerifier().verify(tree));
    }

    @Test
    void testMissingLocation() {
        Expression tree = Trees.ifThenElse(LOC, Trees.trueLit(SourceLocation.none()), Trees.nil(LOC), Trees.nil(LOC));
        List<String> violations = new BasicVerifier().verify(tree);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("Literal"));
    }

    @Test
    void testMissingChild() {
        Expression tree = new If(LOC, Trees.trueLit(LOC), null, Trees.nil(LOC));
        List<String> violations = new BasicVerifier().verify(tree);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("missing child"));
    }
}
