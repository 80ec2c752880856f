package de.jwiegmann.ultraupload.control.error.log;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.util.Locale;

/**
 * Zeitraster für Fehlerhäufigkeiten.
 */
public enum FrequencyPeriod {

    DAILY {
        @Override
        String key(LocalDate date) {
            return date.toString();
        }

        @Override
        LocalDate start(LocalDate today, int periods) {
            return today.minusDays(periods - 1L);
        }

        @Override
        LocalDate next(LocalDate date) {
            return date.plusDays(1);
        }
    },
    WEEKLY {
        @Override
        String key(LocalDate date) {
            return String.format("%d-W%02d",
                    date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }

        @Override
        LocalDate start(LocalDate today, int periods) {
            return today.minusWeeks(periods - 1L).with(DayOfWeek.MONDAY);
        }

        @Override
        LocalDate next(LocalDate date) {
            return date.plusWeeks(1);
        }
    },
    MONTHLY {
        @Override
        String key(LocalDate date) {
            return YearMonth.from(date).toString();
        }

        @Override
        LocalDate start(LocalDate today, int periods) {
            return today.minusMonths(periods - 1L).withDayOfMonth(1);
        }

        @Override
        LocalDate next(LocalDate date) {
            return date.plusMonths(1);
        }
    };

    abstract String key(LocalDate date);

    abstract LocalDate start(LocalDate today, int periods);

    abstract LocalDate next(LocalDate date);

    /**
     * Unbekannte Werte ergeben DAILY.
     */
    public static FrequencyPeriod parse(String value) {
        if (value != null) {
            for (FrequencyPeriod period : values()) {
                if (period.name().equalsIgnoreCase(value.trim())) {
                    return period;
                }
            }
        }
        return DAILY;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
