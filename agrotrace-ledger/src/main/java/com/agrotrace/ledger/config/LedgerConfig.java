package com.agrotrace.ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the ledger shim: logical clock source and opening balances.
 */
@Configuration
@ConfigurationProperties(prefix = "agrotrace.ledger")
public class LedgerConfig {

    private long clockStart = 100;
    private Map<String, BigInteger> openingBalances = new LinkedHashMap<>();
    private final Chain chain = new Chain();

    public long getClockStart() { return clockStart; }
    public void setClockStart(long clockStart) { this.clockStart = clockStart; }
    public Map<String, BigInteger> getOpeningBalances() { return openingBalances; }
    public void setOpeningBalances(Map<String, BigInteger> balances) { this.openingBalances = balances; }
    public Chain getChain() { return chain; }

    /**
     * Chain node used as the clock source when enabled.
     */
    public static class Chain {
        private boolean enabled = false;
        private String nodeUrl = "http://localhost:8545";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getNodeUrl() { return nodeUrl; }
        public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    }
}
