package de.jwiegmann.ultraupload.boundary.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalConfigResponse {
    private String currentLang;
    private List<String> availableLangs;
    private Map<String, String> translations;
    private String envMode;
    private List<String> allowedExtensions;
    private List<String> allowedMimeTypes;
    private long maxSize;
    private Map<String, String> uploadTypePaths;
    private String defaultUploadType;
}
