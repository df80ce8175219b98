package com.finpal.assistant.query;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Renders whole-rupee amounts with a comma thousands separator and no decimals,
 * e.g. 850000 becomes "₹850,000".
 */
public final class RupeeFormatter {

    public static final String SYMBOL = "₹";

    private RupeeFormatter() {
    }

    public static String format(long amount) {
        return SYMBOL + grouped(amount);
    }

    public static String format(BigInteger amount) {
        return SYMBOL + grouped(amount);
    }

    public static String grouped(long amount) {
        return String.format(Locale.US, "%,d", amount);
    }

    public static String grouped(BigInteger amount) {
        return String.format(Locale.US, "%,d", amount);
    }
}
