package com.rbdesugar.json;

import com.rbdesugar.parser.Node;

/**
 * Reads parse trees from JSON. Every node object carries its variant name in a
 * {@code "type"} property.
 */
public interface AstJsonDeserializer {

    /**
     * Reads the root of a parse tree.
     *
     * @throws AstJsonException if the JSON is malformed or names an unknown node type
     */
    Node deserializeParseTree(String json) throws AstJsonException;

    /**
     * Reads a parse node of a known variant.
     *
     * @throws AstJsonException if the JSON is malformed or is not a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
