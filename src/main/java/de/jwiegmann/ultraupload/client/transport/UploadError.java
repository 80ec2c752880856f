package de.jwiegmann.ultraupload.client.transport;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fehlerbeschreibung eines Uploads, wie der Server sie liefert oder der Client sie erzeugt.
 * Liest auch die snake_case-Felder der ErrorManager-Antwort.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadError {
    @JsonAlias("user_message")
    private String message;
    private Object details;
    private String state;
    @JsonAlias("error_code")
    private String errorCode;
    private String blocking;
}
