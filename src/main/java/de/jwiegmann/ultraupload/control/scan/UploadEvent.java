package de.jwiegmann.ultraupload.control.scan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Nachricht auf dem Echtzeitkanal "upload".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UploadEvent {

    public static final String CHANNEL = "upload";

    public static final String VIRUS_SCAN = "virusScan";
    public static final String ALL_CLEAN = "allFileScannedNotInfected";
    public static final String SOME_INFECTED = "allFileScannedSomeInfected";
    public static final String END_VIRUS_SCAN = "endVirusScan";
    public static final String UPLOAD_FAILED = "uploadFailed";

    @Builder.Default
    private String channel = CHANNEL;
    private String state;
    private String message;
    private String fileName;

    public static UploadEvent of(String state, String message, String fileName) {
        return UploadEvent.builder().state(state).message(message).fileName(fileName).build();
    }
}
