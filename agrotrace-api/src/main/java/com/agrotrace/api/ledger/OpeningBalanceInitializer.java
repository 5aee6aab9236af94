package com.agrotrace.api.ledger;

import com.agrotrace.ledger.ValueLedger;
import com.agrotrace.ledger.config.LedgerConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;

/**
 * Funds the accounts listed under {@code agrotrace.ledger.opening-balances}.
 * An account that already holds funds is left alone, so restarts do not mint twice.
 */
@Component
public class OpeningBalanceInitializer {

    private static final Logger log = LoggerFactory.getLogger(OpeningBalanceInitializer.class);

    private final ValueLedger ledger;
    private final LedgerConfig config;

    public OpeningBalanceInitializer(ValueLedger ledger, LedgerConfig config) {
        this.ledger = ledger;
        this.config = config;
    }

    @PostConstruct
    public void fundOpeningBalances() {
        for (Map.Entry<String, BigInteger> opening : config.getOpeningBalances().entrySet()) {
            String account = opening.getKey();
            if (ledger.balanceOf(account).signum() > 0) {
                log.debug("Account {} already funded, skipping opening balance", account);
                continue;
            }
            ledger.credit(account, opening.getValue());
            log.info("Opened account {} with {}", account, opening.getValue());
        }
    }
}
