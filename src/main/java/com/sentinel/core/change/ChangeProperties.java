package com.sentinel.core.change;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "sentinel.change")
public class ChangeProperties {

    private String productionGateKey = "production-change";
    private boolean enforceSeparationOfDuties = true;
    private Map<ChangeRiskLevel, Duration> windowLength = defaultWindows();

    public String getProductionGateKey() {
        return productionGateKey;
    }

    public void setProductionGateKey(String productionGateKey) {
        this.productionGateKey = productionGateKey;
    }

    public boolean isEnforceSeparationOfDuties() {
        return enforceSeparationOfDuties;
    }

    public void setEnforceSeparationOfDuties(boolean enforceSeparationOfDuties) {
        this.enforceSeparationOfDuties = enforceSeparationOfDuties;
    }

    public Map<ChangeRiskLevel, Duration> getWindowLength() {
        return windowLength;
    }

    public void setWindowLength(Map<ChangeRiskLevel, Duration> windowLength) {
        Map<ChangeRiskLevel, Duration> merged = defaultWindows();
        merged.putAll(windowLength);
        this.windowLength = merged;
    }

    /**
     * Length of the execution window granted to an approved change of the given risk.
     */
    public Duration windowFor(ChangeRiskLevel riskLevel) {
        return windowLength.getOrDefault(riskLevel, Duration.ofHours(2));
    }

    private static Map<ChangeRiskLevel, Duration> defaultWindows() {
        Map<ChangeRiskLevel, Duration> windows = new EnumMap<>(ChangeRiskLevel.class);
        windows.put(ChangeRiskLevel.LOW, Duration.ofHours(24));
        windows.put(ChangeRiskLevel.MEDIUM, Duration.ofHours(8));
        windows.put(ChangeRiskLevel.HIGH, Duration.ofHours(4));
        windows.put(ChangeRiskLevel.CRITICAL, Duration.ofHours(2));
        return windows;
    }
}
