package de.jwiegmann.ultraupload.boundary.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body für das Lösen eines oder mehrerer Fehlerprotokolle. {@code ids} nur beim Sammel-Lösen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveErrorRequest {
    @Builder.Default
    private List<Long> ids = new ArrayList<>();
    private String resolvedBy;
    private String notes;
}
