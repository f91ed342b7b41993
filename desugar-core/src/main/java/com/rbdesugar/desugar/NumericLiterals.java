package com.rbdesugar.desugar;

import com.rbdesugar.ast.SourceLocation;
import com.rbdesugar.errors.ErrorClass;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Parses numeric literal text. A literal that does not fit is reported and replaced by
 * {@code 0} (integers) or {@code NaN} (floats).
 */
final class NumericLiterals {

    private static final Pattern FLOAT = Pattern.compile("[+-]?[0-9]+(\\.[0-9]+)?([eE][+-]?[0-9]+)?");

    private final LoweringContext ctx;

    NumericLiterals(LoweringContext ctx) {
        this.ctx = ctx;
    }

    long parseInteger(SourceLocation loc, String text) {
        BigInteger value = parseIntegerText(text);
        if (value == null || value.bitLength() > 63) {
            ctx.report(loc, ErrorClass.INTEGER_OUT_OF_RANGE, "Unsupported integer literal: `" + text + "`");
            return 0;
        }
        return value.longValue();
    }

    /**
     * Parses {@code [+-]digits} with underscores between digits, honouring the {@code 0x},
     * {@code 0b}, {@code 0o}, {@code 0d} and leading-zero octal prefixes. Returns null when the
     * text is not an integer.
     */
    static BigInteger parseIntegerText(String text) {
        if (text == null) {
            return null;
        }
        String digits = text.replace("_", "");
        boolean negative = false;
        if (digits.startsWith("-") || digits.startsWith("+")) {
            negative = digits.charAt(0) == '-';
            digits = digits.substring(1);
        }

        int radix = 10;
        String lower = digits.toLowerCase();
        if (lower.startsWith("0x")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (lower.startsWith("0b")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (lower.startsWith("0o")) {
            radix = 8;
            digits = digits.substring(2);
        } else if (lower.startsWith("0d")) {
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.charAt(0) == '0') {
            radix = 8;
            digits = digits.substring(1);
        }

        if (digits.isEmpty() || digits.charAt(0) == '-' || digits.charAt(0) == '+') {
            return null;
        }
        try {
            BigInteger value = new BigInteger(digits, radix);
            return negative ? value.negate() : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    double parseFloat(SourceLocation loc, String text) {
        String digits = text == null ? "" : text.replace("_", "");
        if (!FLOAT.matcher(digits).matches()) {
            ctx.report(loc, ErrorClass.FLOAT_OUT_OF_RANGE, "Unsupported float literal: `" + text + "`");
            return Double.NaN;
        }
        double value = Double.parseDouble(digits);
        if (Double.isInfinite(value)) {
            ctx.report(loc, ErrorClass.FLOAT_OUT_OF_RANGE, "Unsupported large float literal: `" + text + "`");
            return Double.NaN;
        }
        return value;
    }
}
