package de.jwiegmann.ultraupload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ultra")
public class EnvironmentProperties {

    /**
     * local | development | testing | staging | production
     */
    private String environment = "production";
}
