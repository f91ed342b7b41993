package com.rbdesugar.desugar;

import com.rbdesugar.names.Name;
import com.rbdesugar.names.NameTable;
import com.rbdesugar.names.UniqueNameKind;

/**
 * Mints synthetic local names for one method, class or file body.
 *
 * <p>One instance is threaded through every recursive call that lowers the body, so the
 * counter is shared by all rewrites inside it. Blocks reuse the instance of the body they
 * appear in. Names are {@code (original, counter)} pairs of kind {@link UniqueNameKind#DESUGAR};
 * the counter starts at 1 and is incremented before each use.</p>
 */
public final class FreshNames {

    private final NameTable names;
    private int counter = 1;

    public FreshNames(NameTable names) {
        this.names = names;
    }

    public Name fresh(Name original) {
        return names.freshNameUnique(UniqueNameKind.DESUGAR, original, ++counter);
    }
}
