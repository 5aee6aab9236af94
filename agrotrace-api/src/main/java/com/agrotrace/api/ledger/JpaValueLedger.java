package com.agrotrace.api.ledger;

import com.agrotrace.core.domain.LedgerAccount;
import com.agrotrace.core.repository.LedgerAccountRepository;
import com.agrotrace.ledger.TransferError;
import com.agrotrace.ledger.TransferException;
import com.agrotrace.ledger.ValueLedger;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Ledger over the {@code ledger_accounts} table.
 *
 * Joins the surrounding transaction, so a fee transfer commits or rolls back together with the
 * registry write that follows it.
 */
@Component
public class JpaValueLedger implements ValueLedger {

    private final LedgerAccountRepository accountRepository;

    public JpaValueLedger(LedgerAccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    @Transactional
    public void transfer(String from, String to, BigInteger amount) throws TransferException {
        ValueLedger.checkTransfer(from, to, amount);
        LedgerAccount source = accountRepository.findById(from).orElse(null);
        BigInteger available = source != null ? source.getBalance() : BigInteger.ZERO;
        if (source == null || available.compareTo(amount) < 0) {
            throw new TransferException(TransferError.INSUFFICIENT_BALANCE,
                    "Account " + from + " holds " + available + ", needs " + amount);
        }
        LedgerAccount target = accountRepository.findById(to).orElseGet(() -> LedgerAccount.open(to));

        source.withdraw(amount);
        target.deposit(amount);
        accountRepository.save(source);
        accountRepository.save(target);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String account) {
        if (account == null) {
            return BigInteger.ZERO;
        }
        return accountRepository.findById(account)
                .map(LedgerAccount::getBalance)
                .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional
    public void credit(String account, BigInteger amount) {
        Objects.requireNonNull(account, "Account cannot be null");
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Credit amount cannot be negative");
        }
        LedgerAccount target = accountRepository.findById(account).orElseGet(() -> LedgerAccount.open(account));
        target.deposit(amount);
        accountRepository.save(target);
    }
}
