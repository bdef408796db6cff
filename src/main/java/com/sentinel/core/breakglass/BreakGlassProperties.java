package com.sentinel.core.breakglass;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "sentinel.break-glass")
public class BreakGlassProperties {

    private String entryGateKey = "break-glass-entry";
    private Duration defaultDuration = Duration.ofHours(2);
    private Duration maxDuration = Duration.ofHours(8);

    public String getEntryGateKey() {
        return entryGateKey;
    }

    public void setEntryGateKey(String entryGateKey) {
        this.entryGateKey = entryGateKey;
    }

    public Duration getDefaultDuration() {
        return defaultDuration;
    }

    public void setDefaultDuration(Duration defaultDuration) {
        this.defaultDuration = defaultDuration;
    }

    public Duration getMaxDuration() {
        return maxDuration;
    }

    public void setMaxDuration(Duration maxDuration) {
        this.maxDuration = maxDuration;
    }
}
