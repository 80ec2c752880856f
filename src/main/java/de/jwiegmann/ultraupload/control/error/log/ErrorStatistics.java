package de.jwiegmann.ultraupload.control.error.log;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ErrorStatistics {

    long total;
    long unresolved;
    long critical;
    long today;

    String period;
    int periods;

    @Singular
    List<CodeCount> topErrorCodes;

    /** Anzahl je Fehlertyp, absteigend. */
    Map<String, Long> byType;

    /** Häufigkeit der häufigsten Codes im gewählten Raster. */
    Map<String, List<PeriodCount>> frequency;

    @Value
    public static class CodeCount {
        String errorCode;
        long count;
    }

    @Value
    public static class PeriodCount {
        String period;
        long count;
    }
}
