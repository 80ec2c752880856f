package de.jwiegmann.ultraupload.boundary;

import de.jwiegmann.ultraupload.boundary.dto.UploadReceiptResponse;
import de.jwiegmann.ultraupload.config.UltraUploadProperties;
import de.jwiegmann.ultraupload.control.UploadReceiptService;
import de.jwiegmann.ultraupload.control.error.ErrorManager;
import de.jwiegmann.ultraupload.control.exception.UploadRejectedException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;

@RestController
@RequestMapping("/uploading")
public class UploadRestController {

    private final UploadReceiptService service;
    private final ErrorManager errorManager;
    private final ErrorResponseAdapter errorResponseAdapter;
    private final UltraUploadProperties properties;

    public UploadRestController(UploadReceiptService service,
                                ErrorManager errorManager,
                                ErrorResponseAdapter errorResponseAdapter,
                                UltraUploadProperties properties) {
        this.service = service;
        this.errorManager = errorManager;
        this.errorResponseAdapter = errorResponseAdapter;
        this.properties = properties;
    }

    /**
     * POST /uploading/{uploadType}: eine Datei pro Request, Feld "file"
     */
    @PostMapping("/{uploadType}")
    public ResponseEntity<Object> upload(@PathVariable String uploadType,
                                         @RequestParam(value = "file", required = false) MultipartFile file,
                                         @RequestParam(value = "index", required = false) String index,
                                         HttpServletRequest request) {
        if (!isKnownType(uploadType)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown upload type " + uploadType);
        }
        try {
            UploadReceiptResponse receipt = service.receive(uploadType, file, index);
            return ResponseEntity.ok(receipt);
        } catch (UploadRejectedException e) {
            return errorResponseAdapter.toResponseEntity(errorManager.handle(
                    e.getErrorCode(),
                    e.getContext() == null ? new HashMap<>() : new HashMap<>(e.getContext()),
                    e.getCause(),
                    errorResponseAdapter.shapeOf(request)));
        }
    }

    private boolean isKnownType(String uploadType) {
        return properties.getDefaultUploadType().equals(uploadType)
                || properties.getUploadTypePaths().containsKey(uploadType);
    }
}
