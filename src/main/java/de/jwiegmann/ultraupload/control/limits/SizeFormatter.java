package de.jwiegmann.ultraupload.control.limits;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formatiert Byte-Werte in die größte Einheit, deren Quotient mindestens 1 ist.
 * Zwei Nachkommastellen, abschließende Nullen entfallen ("1 MB", "1.5 KB").
 */
public final class SizeFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB", "PB"};

    private SizeFormatter() {
    }

    public static String format(long bytes) {
        long safe = Math.max(bytes, 0);

        int pow = 0;
        BigDecimal divisor = BigDecimal.ONE;
        BigDecimal value = BigDecimal.valueOf(safe);
        while (pow < UNITS.length - 1 && value.compareTo(divisor.multiply(BigDecimal.valueOf(1024))) >= 0) {
            divisor = divisor.multiply(BigDecimal.valueOf(1024));
            pow++;
        }

        BigDecimal scaled = value.divide(divisor, 2, RoundingMode.HALF_UP).stripTrailingZeros();
        return scaled.toPlainString() + " " + UNITS[pow];
    }
}
