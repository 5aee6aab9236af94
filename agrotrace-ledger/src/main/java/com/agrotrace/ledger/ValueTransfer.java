package com.agrotrace.ledger;

import java.math.BigInteger;

/**
 * Atomic value transfer between two accounts. Either the full amount moves or nothing does.
 */
public interface ValueTransfer {

    /**
     * Moves {@code amount} from {@code from} to {@code to}.
     *
     * @throws TransferException if the ledger refuses the transfer; balances are unchanged
     */
    void transfer(String from, String to, BigInteger amount) throws TransferException;
}
