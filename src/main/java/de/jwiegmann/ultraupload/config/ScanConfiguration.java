package de.jwiegmann.ultraupload.config;

import de.jwiegmann.ultraupload.control.scan.ClamAvVirusScanner;
import de.jwiegmann.ultraupload.control.scan.VirusScanner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ScanConfiguration {

    @Bean
    public VirusScanner virusScanner(UltraUploadProperties properties) {
        return new ClamAvVirusScanner(properties.getScan());
    }

    @Bean
    public ThreadPoolTaskExecutor virusScanExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("virus-scan-");
        return executor;
    }
}
