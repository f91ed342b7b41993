package com.rbdesugar.desugar;

import com.rbdesugar.ast.Literal;
import com.rbdesugar.ast.SourceLocation;
import com.rbdesugar.errors.ErrorClass;
import com.rbdesugar.errors.LoweringException;
import com.rbdesugar.parser.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.rbdesugar.parser.ParseTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestLiteralLowering {

    private final LoweringFixture fixture = new LoweringFixture();

    @Test
    void testIntegerForms() {
        assertEquals("31", fixture.print(integer("0x1F")));
        assertEquals("1000", fixture.print(integer("1_000")));
        assertEquals("5", fixture.print(integer("0b101")));
        assertEquals("15", fixture.print(integer("017")));
        assertEquals("15", fixture.print(integer("0o17")));
        assertEquals("-42", fixture.print(integer("-42")));
        assertEquals("0", fixture.print(integer("0")));
        assertTrue(fixture.sink.isEmpty());
    }

    @Test
    void testIntegerOutOfRangeIsReportedAndZeroed() {
        Literal lit = assertInstanceOf(Literal.class, fixture.lower(integer("9_999_999_999_999_999_999_999")));
        assertEquals(0L, lit.value());
        assertEquals(1, fixture.sink.count(ErrorClass.INTEGER_OUT_OF_RANGE));
        assertEquals(1, fixture.sink.diagnostics().size());
    }

    @Test
    void testLongBoundaries() {
        assertEquals(Long.toString(Long.MAX_VALUE), fixture.print(integer("9223372036854775807")));
        assertEquals("0", fixture.print(integer("9223372036854775808")));
        assertEquals(1, fixture.sink.count(ErrorClass.INTEGER_OUT_OF_RANGE));
    }

    @Test
    void testMalformedIntegerIsReported() {
        assertEquals("0", fixture.print(integer("12abc")));
        assertEquals(1, fixture.sink.count(ErrorClass.INTEGER_OUT_OF_RANGE));
    }

    @Test
    void testFloats() {
        assertEquals("1.5", fixture.print(floating("1.5")));
        assertEquals("1000.5", fixture.print(floating("1_000.5")));
        assertTrue(fixture.sink.isEmpty());

        Literal lit = assertInstanceOf(Literal.class, fixture.lower(floating("1e400")));
        assertTrue(Double.isNaN((Double) lit.value()));
        assertEquals(1, fixture.sink.count(ErrorClass.FLOAT_OUT_OF_RANGE));

        assertEquals("NaN", fixture.print(floating("1.0f")));
        assertEquals(2, fixture.sink.count(ErrorClass.FLOAT_OUT_OF_RANGE));
    }

    @Test
    void testComplexAndRational() {
        assertEquals("Kernel.Complex(\"1i\")", fixture.print(new Node.ComplexLit(LOC, "1i")));
        assertEquals("Kernel.Rational(\"2r\")", fixture.print(new Node.RationalLit(LOC, "2r")));
    }

    @Test
    void testInterpolation() {
        assertEquals("\"a\".concat(x.to_s()).concat(\"b\")", fixture.print(dstr(str("a"), lvar("x"), str("b"))));
        assertEquals("x.to_s().concat(\"b\")", fixture.print(dstr(lvar("x"), str("b"))));
        assertEquals("\"\"", fixture.print(dstr()));
        assertEquals("x.to_s().intern()", fixture.print(dsym(lvar("x"))));
        assertEquals("self.`(\"ls\")", fixture.print(new Node.XString(LOC, List.of(str("ls")))));
    }

    @Test
    void testArraySplats() {
        assertEquals("[1, 2]", fixture.print(array(integer(1), integer(2))));
        assertEquals("a.to_a().concat([1])", fixture.print(array(splat(lvar("a")), integer(1))));
        assertEquals("[1].concat(a.to_a()).concat([2]).concat(b.to_a())",
            fixture.print(array(integer(1), splat(lvar("a")), integer(2), splat(lvar("b")))));
    }

    @Test
    void testHashSplats() {
        assertEquals("{:a => 1}", fixture.print(hash(pair(sym("a"), integer(1)))));
        assertEquals("{:a => 1}.merge(h.to_hash())",
            fixture.print(hash(pair(sym("a"), integer(1)), kwsplat(lvar("h")))));
        assertEquals("h.to_hash().merge({:a => 1})",
            fixture.print(hash(kwsplat(lvar("h")), pair(sym("a"), integer(1)))));
    }

    @Test
    void testRegexp() {
        Node tree = new Node.Regexp(LOC, List.of(str("a")), new Node.Regopt(LOC, "imo"));
        assertEquals("Regexp.new(\"a\", 0.|(1).|(4))", fixture.print(tree));
        assertEquals("Regexp.new(\"a\", <emptyTree>)", fixture.print(new Node.Regexp(LOC, List.of(str("a")), null)));
    }

    @Test
    void testRanges() {
        assertEquals("Range.new(1, 2)", fixture.print(new Node.IRange(LOC, integer(1), integer(2))));
        assertEquals("Range.new(1, 2, true)", fixture.print(new Node.ERange(LOC, integer(1), integer(2))));
        assertEquals("Range.new(1, <emptyTree>)", fixture.print(new Node.IRange(LOC, integer(1), null)));
    }

    @Test
    void testFileAndLine() {
        assertEquals("\"__FILE__\"", fixture.print(new Node.FileLiteral(LOC)));
        assertEquals("7", fixture.print(new Node.LineLiteral(loc(7))));
        Node multiLine = new Node.LineLiteral(SourceLocation.of(1, 1, 2, 1));
        assertThrows(LoweringException.class, () -> fixture.lower(multiLine));
    }

    @Test
    void testNamesAndConstants() {
        assertEquals("@a", fixture.print(ivar("@a")));
        assertEquals("$g", fixture.print(new Node.GVar(LOC, "$g")));
        assertEquals("@@c", fixture.print(new Node.CVar(LOC, "@@c")));
        assertEquals("1", fixture.print(new Node.NthRef(LOC, 1)));
        assertEquals("Foo", fixture.print(cnst("Foo")));
        assertEquals("A::B", fixture.print(cnst(cnst("A"), "B")));
        assertEquals("<root>::Foo", fixture.print(cnst(new Node.Cbase(LOC), "Foo")));
        assertEquals(":sym", fixture.print(sym("sym")));
        assertEquals("nil", fixture.print(nil()));
        assertEquals("self", fixture.print(self()));
    }

    @Test
    void testStrayPairIsFatal() {
        assertThrows(LoweringException.class, () -> fixture.lower(pair(sym("a"), integer(1))));
    }
}
