package com.rbdesugar.names;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Interning table for identifiers, shared by every compilation unit of a session.
 *
 * <p>The table is safe to use from several lowering threads at once. It is seeded with
 * {@link Names}, so {@code intern("to_s")} returns {@link Names#TO_S} itself.</p>
 */
public final class NameTable {

    private final ConcurrentHashMap<String, Name> utf8Names = new ConcurrentHashMap<>();

    public NameTable() {
        for (Name name : Names.ALL) {
            utf8Names.put(name.show(), name);
        }
    }

    public Name intern(String text) {
        if (text == null) {
            throw new IllegalArgumentException("cannot intern a null name");
        }
        return utf8Names.computeIfAbsent(text, Name.Utf8::new);
    }

    public Name freshNameUnique(UniqueNameKind kind, Name original, int num) {
        return new Name.Unique(kind, original, num);
    }

    /**
     * The setter name for {@code name}, e.g. {@code []} becomes {@code []=}.
     */
    public Name addEq(Name name) {
        return intern(name.show() + "=");
    }

    public boolean contains(String text) {
        return utf8Names.containsKey(text);
    }

    public int size() {
        return utf8Names.size();
    }
}
