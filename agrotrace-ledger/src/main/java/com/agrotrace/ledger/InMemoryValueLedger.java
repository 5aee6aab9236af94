package com.agrotrace.ledger;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process ledger keeping balances in memory.
 * Not persistent; used for embedded runs and tests.
 */
public class InMemoryValueLedger implements ValueLedger {

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();

    @Override
    public synchronized void transfer(String from, String to, BigInteger amount) throws TransferException {
        ValueLedger.checkTransfer(from, to, amount);
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            throw new TransferException(TransferError.INSUFFICIENT_BALANCE,
                    "Account " + from + " holds " + available + ", needs " + amount);
        }
        balances.put(from, available.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized void credit(String account, BigInteger amount) {
        Objects.requireNonNull(account, "Account cannot be null");
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Credit amount cannot be negative");
        }
        balances.merge(account, amount, BigInteger::add);
    }
}
