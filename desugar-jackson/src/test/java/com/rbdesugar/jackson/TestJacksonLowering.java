package com.rbdesugar.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rbdesugar.ast.Expression;
import com.rbdesugar.desugar.Desugar;
import com.rbdesugar.desugar.LoweringContext;
import com.rbdesugar.errors.CollectingDiagnosticSink;
import com.rbdesugar.errors.ErrorClass;
import com.rbdesugar.json.AstJsonException;
import com.rbdesugar.json.AstJsonProvider;
import com.rbdesugar.parser.Node;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestJacksonLowering {

    private static final String LOC = "{\"start\":{\"line\":1,\"column\":0},\"end\":{\"line\":1,\"column\":10}}";

    private final JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
    private final ObjectMapper mapper = provider.getObjectMapper();
    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    private JsonNode lowerToJson(String parseTreeJson) throws Exception {
        Node parseTree = provider.getDeserializer().deserializeParseTree(parseTreeJson.replace("$LOC", LOC));
        LoweringContext ctx = LoweringContext.builder().diagnostics(sink).file("test.rb").build();
        Expression lowered = Desugar.node2Tree(ctx, parseTree);
        return mapper.readTree(provider.getSerializer().serialize(lowered));
    }

    @Test
    void testReadsParseTree() {
        Node node = provider.getDeserializer().deserializeParseTree("""
            {"type": "Send", "loc": $LOC, "method": "puts",
             "args": [{"type": "Str", "loc": $LOC, "val": "hi"}]}
            """.replace("$LOC", LOC));

        Node.Send send = assertInstanceOf(Node.Send.class, node);
        assertNull(send.receiver());
        assertEquals("puts", send.method());
        assertEquals(1, send.args().size());
        assertEquals("hi", assertInstanceOf(Node.Str.class, send.args().get(0)).val());
        assertEquals(10, send.loc().end().column());
    }

    @Test
    void testReadsKnownVariant() {
        Node.IntegerLit lit = provider.getDeserializer().deserialize(
            "{\"type\": \"IntegerLit\", \"loc\": " + LOC + ", \"val\": \"0x1F\"}", Node.IntegerLit.class);
        assertEquals("0x1F", lit.val());
    }

    @Test
    void testTopLevelCallIsWrappedInRootClass() throws Exception {
        JsonNode root = lowerToJson("""
            {"type": "Send", "loc": $LOC, "method": "foo",
             "args": [{"type": "IntegerLit", "loc": $LOC, "val": "1"}]}
            """);

        assertEquals("ClassDef", root.get("type").asText());
        assertEquals("ROOT", root.get("symbol").asText());
        assertEquals("EmptyTree", root.get("name").get("type").asText());

        JsonNode send = root.get("rhs").get(0);
        assertEquals("Send", send.get("type").asText());
        assertEquals("foo", send.get("fun").asText());
        assertEquals("Self", send.get("recv").get("type").asText());
        assertTrue(send.get("privateOk").asBoolean());
        assertFalse(send.has("block"));
        assertEquals(1L, send.get("args").get(0).get("value").asLong());
        assertEquals("INTEGER", send.get("args").get(0).get("kind").asText());
        assertTrue(sink.isEmpty());
    }

    @Test
    void testSyntheticNamesAreWrittenAsText() throws Exception {
        JsonNode root = lowerToJson("""
            {"type": "CSend", "loc": $LOC, "method": "foo",
             "receiver": {"type": "LVar", "loc": $LOC, "name": "a"}}
            """);

        // The top-level sequence is spread over the root class body
        JsonNode assign = root.get("rhs").get(0);
        assertEquals("Assign", assign.get("type").asText());
        assertEquals("<assignTemp>$2", assign.get("lhs").get("name").asText());
        assertEquals("a", assign.get("rhs").get("name").asText());
        assertEquals("If", root.get("rhs").get(1).get("type").asText());
    }

    @Test
    void testRejectedFloatIsWrittenAsNull() throws Exception {
        JsonNode root = lowerToJson("""
            {"type": "FloatLit", "loc": $LOC, "val": "1e400"}
            """);

        JsonNode lit = root.get("rhs").get(0);
        assertEquals("FLOAT", lit.get("kind").asText());
        assertTrue(lit.has("value"));
        assertTrue(lit.get("value").isNull());
        assertEquals(1, sink.count(ErrorClass.FLOAT_OUT_OF_RANGE));
    }

    @Test
    void testStringLiteralValue() throws Exception {
        JsonNode root = lowerToJson("""
            {"type": "Str", "loc": $LOC, "val": "hello"}
            """);

        JsonNode lit = root.get("rhs").get(0);
        assertEquals("STRING", lit.get("kind").asText());
        assertEquals("hello", lit.get("value").asText());
    }

    @Test
    void testUnknownNodeTypeIsRejected() {
        AstJsonException e = assertThrows(AstJsonException.class, () ->
            provider.getDeserializer().deserializeParseTree("{\"type\": \"Bogus\", \"loc\": " + LOC + "}"));
        assertEquals("Failed to deserialize parse tree", e.getMessage());
        assertNotNull(e.getCause());
    }

    @Test
    void testMalformedJsonIsRejected() {
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeParseTree("{\"type\": "));
    }

    @Test
    void testPrettyOutputIsIndented() throws Exception {
        Node parseTree = provider.getDeserializer().deserializeParseTree(
            "{\"type\": \"Nil\", \"loc\": " + LOC + "}");
        Expression lowered = Desugar.node2Tree(LoweringContext.builder().build(), parseTree);

        String pretty = provider.getSerializer().serializePretty(lowered);
        assertTrue(pretty.contains("\n"));
        assertEquals(mapper.readTree(provider.getSerializer().serialize(lowered)), mapper.readTree(pretty));
    }

    @Test
    void testProviderDiscovery() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertEquals("Jackson", AstJsonProvider.getProvider().getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("Jackson"));
    }
}
