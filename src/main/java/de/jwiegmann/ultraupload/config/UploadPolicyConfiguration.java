package de.jwiegmann.ultraupload.config;

import de.jwiegmann.ultraupload.control.validation.ClientFileValidator;
import de.jwiegmann.ultraupload.control.validation.FilePolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Server-seitige Datei-Policy. Identisch mit der, die über /config/global-config an Clients geht.
 */
@Configuration
public class UploadPolicyConfiguration {

    @Bean
    public FilePolicy filePolicy(UltraUploadProperties properties) {
        return FilePolicy.builder()
                .allowedExtensions(properties.getAllowedExtensions())
                .allowedMimeTypes(properties.getAllowedMimeTypes())
                .maxSize(properties.getMaxSize())
                .build();
    }

    @Bean
    public ClientFileValidator fileValidator(FilePolicy filePolicy) {
        return new ClientFileValidator(filePolicy);
    }
}
