package com.rbdesugar.names;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class TestNameTable {

    @Test
    void testWellKnownNamesArePreSeeded() {
        NameTable names = new NameTable();
        assertTrue(names.contains("to_s"));
        assertTrue(names.contains("<expand-splat>"));
        assertSame(Names.SQUARE_BRACKETS, names.intern("[]"));
    }

    @Test
    void testInterningIsIdempotent() {
        NameTable names = new NameTable();
        int before = names.size();
        Name first = names.intern("foo");
        assertSame(first, names.intern("foo"));
        assertEquals(before + 1, names.size());
    }

    @Test
    void testSetterName() {
        NameTable names = new NameTable();
        assertEquals("foo=", names.addEq(names.intern("foo")).show());
        assertSame(Names.SQUARE_BRACKETS_EQ, names.addEq(Names.SQUARE_BRACKETS));
    }

    @Test
    void testUniqueNamesCannotCollideWithSource() {
        NameTable names = new NameTable();
        Name unique = names.freshNameUnique(UniqueNameKind.DESUGAR, Names.ASSIGN_TEMP, 2);
        assertEquals("<assignTemp>$2", unique.show());
        assertNotEquals(names.intern("<assignTemp>$2"), unique);
        assertEquals(unique, names.freshNameUnique(UniqueNameKind.DESUGAR, Names.ASSIGN_TEMP, 2));
        assertNotEquals(unique, names.freshNameUnique(UniqueNameKind.CFG, Names.ASSIGN_TEMP, 2));
    }

    @Test
    void testConcurrentInterning() throws Exception {
        NameTable names = new NameTable();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Name>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> names.intern("shared")));
            }
            Name expected = names.intern("shared");
            for (Future<Name> future : futures) {
                assertSame(expected, future.get());
            }
        } finally {
            executor.shutdown();
        }
    }
}
