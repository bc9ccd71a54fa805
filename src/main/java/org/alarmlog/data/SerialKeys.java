package org.alarmlog.data;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Canonical machine serial keys. Numeric serials are compared and printed as
 * numbers, so {@code "1"}, {@code "1.0"} and {@code " 01 "} denote the same machine.
 */
public final class SerialKeys {

    /**
     * Numeric serials first in numeric order, then the rest lexically.
     */
    public static final Comparator<String> ORDER = (a, b) -> {
        BigDecimal na = asNumber(a);
        BigDecimal nb = asNumber(b);
        if (na != null && nb != null) return na.compareTo(nb);
        if (na != null) return -1;
        if (nb != null) return 1;
        return a.compareTo(b);
    };

    private static final int MAX_PLAIN_SCALE = 64;

    private SerialKeys() {
    }

    /**
     * @return canonical key, or {@code null} for a blank serial
     */
    public static String canonical(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;
        BigDecimal number = asNumber(s);
        if (number == null) return s;
        if (number.signum() == 0) return "0";
        BigDecimal stripped = number.stripTrailingZeros();
        // plain text of a huge exponent would not fit in memory
        if (Math.abs(stripped.scale()) > MAX_PLAIN_SCALE) return s;
        return stripped.toPlainString();
    }

    private static BigDecimal asNumber(String s) {
        if (s == null) return null;
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
