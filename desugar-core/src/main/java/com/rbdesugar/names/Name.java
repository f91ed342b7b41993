package com.rbdesugar.names;

/**
 * An interned identifier.
 *
 * <p>{@link Utf8} names come from source text (or from the well-known table in {@link Names}).
 * {@link Unique} names are synthesized during lowering; the parser never produces one, so they
 * cannot collide with anything a user wrote.</p>
 */
public sealed interface Name permits Name.Utf8, Name.Unique {

    /**
     * Text used when printing the name in trees and diagnostics.
     */
    String show();

    record Utf8(String text) implements Name {
        public Utf8 {
            if (text == null) {
                throw new IllegalArgumentException("name text must not be null");
            }
        }

        @Override
        public String show() {
            return text;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    record Unique(UniqueNameKind kind, Name original, int num) implements Name {
        @Override
        public String show() {
            return original.show() + "$" + num;
        }

        @Override
        public String toString() {
            return show();
        }
    }
}
