package com.rbdesugar.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMappers that read parse trees and write lowered trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = DesugarJackson.createObjectMapper();
 * Node parseTree = mapper.readValue(json, Node.class);
 * String out = mapper.writerFor(Expression.class).writeValueAsString(lowered);
 * </pre>
 */
public final class DesugarJackson {

    private DesugarJackson() {
        // Utility class
    }

    /**
     * Creates a new mapper. Nodes of both trees carry their variant name in a {@code "type"}
     * property, names are written as their display text, absent optional children are
     * omitted and unknown properties are ignored when reading.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
