package de.jwiegmann.ultraupload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UltraUploadApplication {

    public static void main(String[] args) {
        SpringApplication.run(UltraUploadApplication.class, args);
    }
}
