package com.mailboxcopy.util;

import java.util.Locale;

/**
 * Human readable byte sizes: 512.0bytes, 1.5KiB, 3.2MiB ...
 */
public final class SizeFormatter {

    private static final String[] UNITS = {"bytes", "KiB", "MiB", "GiB", "TiB"};

    private SizeFormatter() {}

    public static String format(long bytes) {
        double value = bytes;
        int unit = 0;
        while (value >= 1024.0 && unit < UNITS.length - 1) {
            value /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f%s", value, UNITS[unit]);
    }
}
