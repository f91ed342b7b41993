package com.rbdesugar.ast;

import com.rbdesugar.names.NameTable;
import com.rbdesugar.names.Names;
import com.rbdesugar.names.UniqueNameKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestTreePrinter {

    private static final SourceLocation LOC = SourceLocation.of(1, 1, 1, 10);
    private final NameTable names = new NameTable();

    @Test
    void testCallsAndLiterals() {
        Expression call = Trees.send2(LOC, Trees.self(LOC), names.intern("foo"),
            Trees.string(LOC, names.intern("a")), Trees.symbol(LOC, names.intern("b")));
        assertEquals("self.foo(\"a\", :b)", TreePrinter.print(call));
        assertEquals("2.5", TreePrinter.print(Trees.floating(LOC, 2.5)));
        assertEquals("false", TreePrinter.print(Trees.falseLit(LOC)));
    }

    @Test
    void testUniqueNamesShowTheirNumber() {
        Local temp = Trees.local(LOC, names.freshNameUnique(UniqueNameKind.DESUGAR, Names.FOR_TEMP, 3));
        assertEquals("forTemp$3 = 1", TreePrinter.print(Trees.assign(LOC, temp, Trees.integer(LOC, 1))));
    }

    @Test
    void testRescueAndHash() {
        Local e = Trees.local(LOC, names.intern("e"));
        Rescue rescue = Rescue.builder(LOC)
            .body(Trees.nil(LOC))
            .rescueCase(new RescueCase(LOC, List.of(), e, Trees.emptyTree(LOC)))
            .build();
        assertEquals("begin nil rescue => e then <emptyTree> else <emptyTree> ensure <emptyTree> end",
            TreePrinter.print(rescue));

        HashLit hash = new HashLit(LOC, List.of(Trees.integer(LOC, 1)), List.of(Trees.nil(LOC)));
        assertEquals("{1 => nil}", TreePrinter.print(hash));
    }

    @Test
    void testEnsureMergeKeepsRescueCases() {
        Local e = Trees.local(LOC, names.intern("e"));
        Rescue rescue = Rescue.builder(LOC)
            .rescueCase(new RescueCase(LOC, List.of(), e, Trees.emptyTree(LOC)))
            .build();
        Rescue merged = Rescue.from(rescue).ensure(Trees.nil(LOC)).build();
        assertEquals(1, merged.rescueCases().size());
        assertEquals("nil", TreePrinter.print(merged.ensure()));
    }
}
