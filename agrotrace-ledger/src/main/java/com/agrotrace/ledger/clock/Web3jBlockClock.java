package com.agrotrace.ledger.clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthBlockNumber;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logical clock backed by the block height of an Ethereum-compatible chain.
 *
 * The chain advances on its own, so {@link #advance()} only re-reads the height. Reads never
 * go backwards: a lower height reported by a lagging node is ignored.
 */
public class Web3jBlockClock implements LogicalClock {

    private static final Logger log = LoggerFactory.getLogger(Web3jBlockClock.class);

    private final Web3j web3j;
    private final AtomicLong lastSeen = new AtomicLong(0);

    public Web3jBlockClock(Web3j web3j) {
        this.web3j = web3j;
    }

    @Override
    public long current() {
        try {
            EthBlockNumber response = web3j.ethBlockNumber().send();
            if (response.hasError()) {
                throw new ChainClockException("Node rejected eth_blockNumber: " + response.getError().getMessage());
            }
            long height = response.getBlockNumber().longValueExact();
            return lastSeen.accumulateAndGet(height, Math::max);
        } catch (IOException e) {
            log.error("Failed to read block height from chain", e);
            throw new ChainClockException("Block height unavailable", e);
        }
    }

    @Override
    public long advance() {
        return current();
    }

    /**
     * Raised when the chain cannot supply a block height.
     */
    public static class ChainClockException extends RuntimeException {
        public ChainClockException(String message) {
            super(message);
        }

        public ChainClockException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
