package com.rbdesugar.desugar;

import com.rbdesugar.ast.Expression;
import com.rbdesugar.ast.Send;
import com.rbdesugar.errors.ErrorClass;
import com.rbdesugar.errors.LoweringException;
import com.rbdesugar.parser.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.rbdesugar.parser.ParseTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestCallLowering {

    private final LoweringFixture fixture = new LoweringFixture();

    @Test
    void testImplicitReceiverIsPrivateSelf() {
        Expression tree = fixture.lower(call("puts", integer(1)));
        Send send = assertInstanceOf(Send.class, tree);
        assertTrue(send.privateOk());
        assertEquals("self.puts(1)", fixture.print(call("puts", integer(1))));
    }

    @Test
    void testExplicitReceiverIsNotPrivate() {
        Send send = assertInstanceOf(Send.class, fixture.lower(send(lvar("a"), "b")));
        assertFalse(send.privateOk());
    }

    @Test
    void testSafeNavigation() {
        assertEquals(
            "(<assignTemp>$2 = a; if <assignTemp>$2.nil?() then nil else <assignTemp>$2.foo(1) end)",
            fixture.print(csend(lvar("a"), "foo", integer(1))));
    }

    @Test
    void testSplatCallWithBlockPass() {
        Node tree = call("foo", lvar("a"), splat(lvar("b")), blockPass(lvar("blk")));
        assertEquals(
            "Magic.<call-with-splat>(self, :foo, [a].concat(b.to_a())) "
                + "{ |*<block-pass>$2| Magic.<call-with-splat>(blk.to_proc(), :call, <block-pass>$2) }",
            fixture.print(tree));
    }

    @Test
    void testSplatCallKeepsExplicitReceiver() {
        assertEquals("Magic.<call-with-splat>(r, :foo, a.to_a())",
            fixture.print(send(lvar("r"), "foo", splat(lvar("a")))));
    }

    @Test
    void testSymbolBlockPass() {
        assertEquals("self.foo() { |<block-pass>$2| <block-pass>$2.bar() }",
            fixture.print(call("foo", blockPass(sym("bar")))));
    }

    @Test
    void testTwoBlockPassesAreFatal() {
        Node tree = call("foo", blockPass(lvar("a")), blockPass(lvar("b")));
        assertThrows(LoweringException.class, () -> fixture.lower(tree));
        assertEquals(1, fixture.sink.count(ErrorClass.INTERNAL_ERROR));
    }

    @Test
    void testBlockAttachesToSend() {
        Node tree = block(send(lvar("xs"), "map"), args(arg("x")), send(lvar("x"), "succ"));
        assertEquals("xs.map() { |x| x.succ() }", fixture.print(tree));
    }

    @Test
    void testBlockAttachesThroughSafeNavigation() {
        Node tree = block(csend(lvar("a"), "each"), args(arg("x")), lvar("x"));
        assertEquals(
            "(<assignTemp>$2 = a; if <assignTemp>$2.nil?() then nil else <assignTemp>$2.each() { |x| x } end)",
            fixture.print(tree));
    }

    @Test
    void testBlockOnNonCallIsFatal() {
        Node tree = begin(call("foo", block(lvar("a"), null, null)), nil());
        LoweringException e = assertThrows(LoweringException.class, () -> fixture.lowerUnit(tree));
        assertTrue(e.getMessage().contains("InsSeq"), e.getMessage());
        // Reported once, by the innermost frame, however many frames the error crossed
        assertEquals(1, fixture.sink.count(ErrorClass.INTERNAL_ERROR));
        assertEquals(1, fixture.sink.diagnostics().size());
    }

    @Test
    void testDestructuringBlockParameter() {
        Node tree = block(call("each"), args(mlhs(arg("a"), arg("b"))), lvar("a"));
        assertEquals(
            "self.each() { |<destructure>$2| ((<assignTemp>$3 = Magic.<expand-splat>(<destructure>$2, 2, 0); "
                + "a = <assignTemp>$3.[](0); b = <assignTemp>$3.[](1); <assignTemp>$3); a) }",
            fixture.print(tree));
    }

    @Test
    void testSigKeepsCallChain() {
        Node tree = block(call("sig"), null,
            send(call("params", hash(pair(sym("x"), cnst("Integer")))), "returns", cnst("String")));
        assertEquals("self.sig() { self.params({:x => Integer}).returns(String) }", fixture.print(tree));
    }

    @Test
    void testSuper() {
        assertEquals("self.super(a)", fixture.print(superCall(lvar("a"))));
        assertEquals("self.super(<zsuper-args>)", fixture.print(new Node.ZSuper(LOC)));
    }

    @Test
    void testAliasAndDefined() {
        assertEquals("self.alias_method(:a, :b)", fixture.print(new Node.Alias(LOC, sym("a"), sym("b"))));
        assertEquals("Magic.defined?(x)", fixture.print(new Node.Defined(LOC, lvar("x"))));
    }

    @Test
    void testYield() {
        assertEquals("yield(1, a)", fixture.print(new Node.Yield(LOC, List.of(integer(1), lvar("a")))));
    }

    @Test
    void testBareBlockPassIsFatal() {
        assertThrows(LoweringException.class, () -> fixture.lower(blockPass(lvar("a"))));
    }
}
