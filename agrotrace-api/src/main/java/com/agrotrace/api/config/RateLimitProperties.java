package com.agrotrace.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Request budgets per caller. The strict budget applies to owner and role-holder endpoints.
 */
@Configuration
@ConfigurationProperties(prefix = "agrotrace.rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;
    private long defaultCapacity = 100;
    private long strictCapacity = 10;
    private long readCapacity = 500;
    private Duration refillPeriod = Duration.ofMinutes(1);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public long getDefaultCapacity() { return defaultCapacity; }
    public void setDefaultCapacity(long defaultCapacity) { this.defaultCapacity = defaultCapacity; }
    public long getStrictCapacity() { return strictCapacity; }
    public void setStrictCapacity(long strictCapacity) { this.strictCapacity = strictCapacity; }
    public long getReadCapacity() { return readCapacity; }
    public void setReadCapacity(long readCapacity) { this.readCapacity = readCapacity; }
    public Duration getRefillPeriod() { return refillPeriod; }
    public void setRefillPeriod(Duration refillPeriod) { this.refillPeriod = refillPeriod; }
}
