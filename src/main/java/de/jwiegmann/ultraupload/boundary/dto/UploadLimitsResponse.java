package de.jwiegmann.ultraupload.boundary.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ausgehandelte Upload-Grenzen, wie sie an Clients gehen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadLimitsResponse {

    @JsonProperty("max_total_size")
    private long maxTotalSize;

    @JsonProperty("max_file_size")
    private long maxFileSize;

    @JsonProperty("max_files")
    private int maxFiles;

    @JsonProperty("max_total_size_formatted")
    private String maxTotalSizeFormatted;

    @JsonProperty("max_file_size_formatted")
    private String maxFileSizeFormatted;
}
