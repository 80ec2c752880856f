package de.jwiegmann.ultraupload.boundary.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadReceiptResponse {
    private String message;
    private String fileName;
    private String fileId;
    private String hash;
    /** Nur bei Upload-Typen mit Verifikation (epp). */
    private String verificationToken;
    private Boolean scanDisabled;
}
