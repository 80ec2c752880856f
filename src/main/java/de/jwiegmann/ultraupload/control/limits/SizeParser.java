package de.jwiegmann.ultraupload.control.limits;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Wandelt menschenlesbare Größenangaben ("80M", "2G", "1024") in Bytes um.
 * Einheiten sind Binärpräfixe (1K = 1024), Groß-/Kleinschreibung egal.
 * Maßgeblich ist der erste Buchstabe der Einheit, "100M", "100MB" und "100Mb" sind gleich.
 */
@Component
public class SizeParser {

    private static final long KB = 1024L;

    private static final Map<String, Long> UNITS = Map.of(
            "", 1L,
            "k", KB,
            "m", KB * KB,
            "g", KB * KB * KB,
            "t", KB * KB * KB * KB,
            "p", KB * KB * KB * KB * KB,
            "e", KB * KB * KB * KB * KB * KB
    );

    /**
     * @param size Größenangabe, z.B. "80M"
     * @return Größe in Bytes, auf ganze Bytes gerundet
     * @throws IllegalArgumentException bei leerer Eingabe, fehlender Zahl oder unbekannter Einheit
     */
    public long parse(String size) {

        if (size == null || size.isBlank()) {
            throw new IllegalArgumentException("Size must be a non-empty string");
        }

        String number = size.replaceAll("[^0-9.]", "");
        String unit = size.replaceAll("[^a-zA-Z]", "").toLowerCase();

        if (number.isEmpty()) {
            throw new IllegalArgumentException("Invalid size format: no valid number found in '" + size + "'");
        }

        BigDecimal value;
        try {
            value = new BigDecimal(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid size format: no valid number found in '" + size + "'", e);
        }

        Long multiplier = UNITS.get(unitPrefix(unit));
        if (multiplier == null) {
            throw new IllegalArgumentException("Invalid unit '" + unit + "' in size string '" + size + "'");
        }

        try {
            return value.multiply(BigDecimal.valueOf(multiplier))
                    .setScale(0, RoundingMode.HALF_UP)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Size '" + size + "' exceeds the supported range", e);
        }
    }

    private static String unitPrefix(String unit) {
        if (unit.isEmpty() || unit.equals("b")) {
            return "";
        }
        return unit.substring(0, 1);
    }
}
