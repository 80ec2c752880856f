package de.jwiegmann.ultraupload.control.simulation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulierte Fehlerbedingungen für Tests. In Produktion deaktiviert:
 * Bedingungen werden dort weder gesetzt noch gemeldet.
 */
@Slf4j(topic = "ultra.errors")
@Component
public class TestingConditions {

    private final boolean testingEnabled;
    private final Map<String, Boolean> conditions = new ConcurrentHashMap<>();

    @Autowired
    public TestingConditions(EnvironmentPolicy environmentPolicy) {
        this(!environmentPolicy.isProduction());
    }

    public TestingConditions(boolean testingEnabled) {
        this.testingEnabled = testingEnabled;
    }

    public void setCondition(String condition, boolean value) {
        if (!testingEnabled) {
            log.warn("Ignoring testing condition {} outside of a test environment", condition);
            return;
        }
        if (value) {
            conditions.put(condition, Boolean.TRUE);
        } else {
            conditions.remove(condition);
        }
    }

    public boolean isTesting(String condition) {
        return testingEnabled && conditions.getOrDefault(condition, Boolean.FALSE);
    }

    /**
     * @return aktive Bedingungen, alphabetisch sortiert
     */
    public Map<String, Boolean> getActiveConditions() {
        return testingEnabled ? new TreeMap<>(conditions) : Map.of();
    }

    public void reset() {
        conditions.clear();
    }

    public boolean isTestingEnabled() {
        return testingEnabled;
    }
}
