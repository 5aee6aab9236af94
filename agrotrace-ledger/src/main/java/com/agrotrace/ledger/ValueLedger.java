package com.agrotrace.ledger;

import java.math.BigInteger;

/**
 * A {@link ValueTransfer} whose balances can be inspected and funded.
 */
public interface ValueLedger extends ValueTransfer {

    /**
     * Balance of an account; zero for accounts never seen.
     */
    BigInteger balanceOf(String account);

    /**
     * Adds funds to an account out of thin air. Used for opening balances.
     */
    void credit(String account, BigInteger amount);

    /**
     * Shared argument checks, applied before any balance is touched.
     */
    static void checkTransfer(String from, String to, BigInteger amount) throws TransferException {
        if (from == null || from.isBlank() || to == null || to.isBlank()) {
            throw new TransferException(TransferError.UNKNOWN_ACCOUNT, "Transfer requires both accounts");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new TransferException(TransferError.NON_POSITIVE_AMOUNT, "Transfer amount must be positive");
        }
        if (from.equals(to)) {
            throw new TransferException(TransferError.SAME_ACCOUNT, "Cannot transfer to the same account: " + from);
        }
    }
}
