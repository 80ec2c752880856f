package de.jwiegmann.ultraupload.config;

import de.jwiegmann.ultraupload.control.error.ErrorDispatcher;
import de.jwiegmann.ultraupload.control.error.ErrorFlashStore;
import de.jwiegmann.ultraupload.control.error.ErrorMessageFormatter;
import de.jwiegmann.ultraupload.control.error.handler.ErrorLogHandler;
import de.jwiegmann.ultraupload.control.error.handler.LogErrorHandler;
import de.jwiegmann.ultraupload.control.error.handler.NotificationErrorHandler;
import de.jwiegmann.ultraupload.control.error.handler.RecoveryActionHandler;
import de.jwiegmann.ultraupload.control.error.handler.SimulationErrorHandler;
import de.jwiegmann.ultraupload.control.error.handler.UserInterfaceErrorHandler;
import de.jwiegmann.ultraupload.control.repository.InMemoryErrorLogRepository;
import de.jwiegmann.ultraupload.control.repository.InMemoryStoredFileRepository;
import de.jwiegmann.ultraupload.control.scan.VirusScanService;
import de.jwiegmann.ultraupload.control.simulation.EnvironmentPolicy;
import de.jwiegmann.ultraupload.control.simulation.TestingConditions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.List;

/**
 * Verdrahtet die Fehlerhandler in fester Reihenfolge:
 * Log, Fehlerprotokoll, UI, Benachrichtigung, Gegenmaßnahme, Simulation.
 */
@Configuration
public class ErrorManagerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ThreadPoolTaskScheduler recoveryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("error-recovery-");
        return scheduler;
    }

    @Bean
    public ErrorDispatcher errorDispatcher(ErrorMessageFormatter formatter,
                                           ErrorFlashStore flashStore,
                                           ApplicationEventPublisher eventPublisher,
                                           ErrorManagerProperties properties,
                                           UltraUploadProperties uploadProperties,
                                           EnvironmentPolicy environmentPolicy,
                                           TestingConditions testingConditions,
                                           InMemoryErrorLogRepository errorLogRepository,
                                           InMemoryStoredFileRepository fileRepository,
                                           ObjectProvider<VirusScanService> virusScanService,
                                           @Qualifier("recoveryScheduler") TaskScheduler recoveryScheduler,
                                           Clock clock) {
        return new ErrorDispatcher(List.of(
                new LogErrorHandler(formatter),
                new ErrorLogHandler(formatter, errorLogRepository, properties.getDatabaseLogging(), clock),
                new UserInterfaceErrorHandler(formatter, flashStore, properties.getUi()),
                new NotificationErrorHandler(formatter, eventPublisher, properties.getNotification()),
                new RecoveryActionHandler(uploadProperties.getStoragePath(), fileRepository, virusScanService,
                        recoveryScheduler, properties.getRecovery(), clock),
                new SimulationErrorHandler(environmentPolicy, testingConditions)));
    }
}
