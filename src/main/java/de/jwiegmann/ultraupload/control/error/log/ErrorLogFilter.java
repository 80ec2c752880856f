package de.jwiegmann.ultraupload.control.error.log;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Suchkriterien für das Fehlerprotokoll. Null bedeutet "nicht einschränken".
 */
@Value
@Builder
public class ErrorLogFilter {

    public enum Status {RESOLVED, UNRESOLVED, ALL}

    String type;
    String code;
    @Builder.Default
    Status status = Status.UNRESOLVED;
    LocalDate from;
    LocalDate to;
}
