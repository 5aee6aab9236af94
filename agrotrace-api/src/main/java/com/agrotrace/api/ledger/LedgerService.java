package com.agrotrace.api.ledger;

import com.agrotrace.api.access.AccessControl;
import com.agrotrace.api.access.OperationSequencer;
import com.agrotrace.api.registry.FarmerRegistryService;
import com.agrotrace.core.result.OperationResult;
import com.agrotrace.core.result.RegistryError;
import com.agrotrace.ledger.ValueLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Balances of the local ledger, and the registry owner's way of funding accounts with it.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final ValueLedger ledger;
    private final FarmerRegistryService registry;
    private final OperationSequencer sequencer;

    public LedgerService(ValueLedger ledger, FarmerRegistryService registry, OperationSequencer sequencer) {
        this.ledger = ledger;
        this.registry = registry;
        this.sequencer = sequencer;
    }

    /**
     * Registry owner only. Credits {@code amount} to {@code account}.
     *
     * @return the account's new balance
     */
    public OperationResult<BigInteger> deposit(String caller, String account, BigInteger amount) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("deposit", () -> {
            if (!caller.equals(registry.getOwner())) {
                return OperationResult.failure(RegistryError.NOT_AUTHORIZED);
            }
            if (account == null || account.isBlank() || amount == null || amount.signum() <= 0) {
                return OperationResult.failure(RegistryError.INVALID_INPUT);
            }
            ledger.credit(account, amount);
            BigInteger balance = ledger.balanceOf(account);

            log.info("Owner {} deposited {} into {} (balance {})", caller, amount, account, balance);
            return OperationResult.ok(balance);
        });
    }

    public BigInteger balanceOf(String account) {
        return sequencer.read(() -> ledger.balanceOf(account));
    }
}
