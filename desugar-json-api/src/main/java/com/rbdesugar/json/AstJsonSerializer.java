package com.rbdesugar.json;

import com.rbdesugar.ast.Expression;

/**
 * Writes lowered trees as JSON.
 */
public interface AstJsonSerializer {

    String serialize(Expression tree) throws AstJsonException;

    String serializePretty(Expression tree) throws AstJsonException;
}
