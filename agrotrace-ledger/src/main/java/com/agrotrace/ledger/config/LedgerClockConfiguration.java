package com.agrotrace.ledger.config;

import com.agrotrace.ledger.clock.LogicalClock;
import com.agrotrace.ledger.clock.MonotonicLogicalClock;
import com.agrotrace.ledger.clock.Web3jBlockClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Chooses the logical clock: chain block height when a node is configured, a local counter otherwise.
 */
@Configuration
public class LedgerClockConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LedgerClockConfiguration.class);

    @Bean
    public LogicalClock logicalClock(LedgerConfig config) {
        if (config.getChain().isEnabled()) {
            Web3j web3j = Web3j.build(new HttpService(config.getChain().getNodeUrl()));
            log.info("Logical clock bound to block height of {}", config.getChain().getNodeUrl());
            return new Web3jBlockClock(web3j);
        }
        log.info("Logical clock is a local counter starting at {}", config.getClockStart());
        return new MonotonicLogicalClock(config.getClockStart());
    }
}
