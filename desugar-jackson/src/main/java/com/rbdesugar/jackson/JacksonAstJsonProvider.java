package com.rbdesugar.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rbdesugar.ast.Expression;
import com.rbdesugar.json.AstJsonDeserializer;
import com.rbdesugar.json.AstJsonException;
import com.rbdesugar.json.AstJsonProvider;
import com.rbdesugar.json.AstJsonSerializer;
import com.rbdesugar.parser.Node;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = DesugarJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Expression tree) throws AstJsonException {
            try {
                return mapper.writerFor(Expression.class).writeValueAsString(tree);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + tree.type(), e);
            }
        }

        @Override
        public String serializePretty(Expression tree) throws AstJsonException {
            try {
                return mapper.writerFor(Expression.class).withDefaultPrettyPrinter().writeValueAsString(tree);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + tree.type(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Node deserializeParseTree(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, Node.class);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize parse tree", e);
            }
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
