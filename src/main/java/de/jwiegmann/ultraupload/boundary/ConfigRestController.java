package de.jwiegmann.ultraupload.boundary;

import de.jwiegmann.ultraupload.boundary.dto.GlobalConfigResponse;
import de.jwiegmann.ultraupload.boundary.dto.UploadLimitsResponse;
import de.jwiegmann.ultraupload.control.ClientConfigService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigRestController {

    private final ClientConfigService service;

    public ConfigRestController(ClientConfigService service) {
        this.service = service;
    }

    /**
     * GET /config/global-config: Sprache, Übersetzungen, Datei-Policy, Upload-Typen
     */
    @GetMapping("/config/global-config")
    public ResponseEntity<GlobalConfigResponse> globalConfig() {
        return ResponseEntity.ok(service.globalConfig());
    }

    /**
     * GET /api/system/upload-limits: ausgehandelte Grenzen
     */
    @GetMapping("/api/system/upload-limits")
    public ResponseEntity<UploadLimitsResponse> uploadLimits() {
        return ResponseEntity.ok(service.uploadLimits());
    }
}
