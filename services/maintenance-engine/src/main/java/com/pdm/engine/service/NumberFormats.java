package com.pdm.engine.service;

import java.util.Locale;

/**
 * Number rendering for narrative text.
 */
final class NumberFormats {

    private NumberFormats() {}

    /**
     * Whole number with thousands separators, e.g. "12,000".
     */
    static String grouped(double value) {
        return String.format(Locale.US, "%,d", Math.round(value));
    }

    /**
     * Whole numbers without decimals, anything else with one, e.g. "85" or "4.2".
     */
    static String plain(double value) {
        if (value == Math.rint(value)) {
            return String.format(Locale.US, "%.0f", value);
        }
        return String.format(Locale.US, "%.1f", value);
    }

    static String percent(double ratio) {
        return String.format(Locale.US, "%.0f", ratio * 100);
    }
}
