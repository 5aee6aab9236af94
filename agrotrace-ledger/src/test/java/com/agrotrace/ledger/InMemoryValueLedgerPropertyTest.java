package com.agrotrace.ledger;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the in-memory ledger.
 */
class InMemoryValueLedgerPropertyTest {

    /**
     * Property: a successful transfer moves exactly the amount and conserves the total.
     */
    @Property(tries = 100)
    void transfer_conservesTotalBalance(
            @ForAll @BigRange(min = "1", max = "1000000") BigInteger opening,
            @ForAll @BigRange(min = "1", max = "1000000") BigInteger amount) throws TransferException {

        Assume.that(amount.compareTo(opening) <= 0);
        InMemoryValueLedger ledger = new InMemoryValueLedger();
        ledger.credit("alice", opening);

        ledger.transfer("alice", "treasury", amount);

        assertThat(ledger.balanceOf("alice")).isEqualTo(opening.subtract(amount));
        assertThat(ledger.balanceOf("treasury")).isEqualTo(amount);
        assertThat(ledger.balanceOf("alice").add(ledger.balanceOf("treasury"))).isEqualTo(opening);
    }

    /**
     * Property: an overdraft is refused and moves nothing.
     */
    @Property(tries = 100)
    void overdraft_movesNothing(
            @ForAll @BigRange(min = "0", max = "1000") BigInteger opening,
            @ForAll @BigRange(min = "1", max = "1000") BigInteger excess) {

        InMemoryValueLedger ledger = new InMemoryValueLedger();
        ledger.credit("alice", opening);
        BigInteger amount = opening.add(excess);

        assertThatThrownBy(() -> ledger.transfer("alice", "treasury", amount))
                .isInstanceOf(TransferException.class)
                .extracting(e -> ((TransferException) e).getError())
                .isEqualTo(TransferError.INSUFFICIENT_BALANCE);
        assertThat(ledger.balanceOf("alice")).isEqualTo(opening);
        assertThat(ledger.balanceOf("treasury")).isZero();
    }

    @Property(tries = 50)
    void nonPositiveAmounts_areRefused(@ForAll @BigRange(min = "-1000", max = "0") BigInteger amount) {
        InMemoryValueLedger ledger = new InMemoryValueLedger();
        ledger.credit("alice", BigInteger.valueOf(10_000));

        assertThatThrownBy(() -> ledger.transfer("alice", "treasury", amount))
                .isInstanceOf(TransferException.class)
                .extracting(e -> ((TransferException) e).getError())
                .isEqualTo(TransferError.NON_POSITIVE_AMOUNT);
        assertThat(ledger.balanceOf("alice")).isEqualTo(BigInteger.valueOf(10_000));
    }

    @Test
    void sameAccount_isRefused() {
        InMemoryValueLedger ledger = new InMemoryValueLedger();
        ledger.credit("alice", BigInteger.TEN);

        assertThatThrownBy(() -> ledger.transfer("alice", "alice", BigInteger.ONE))
                .isInstanceOf(TransferException.class)
                .extracting(e -> ((TransferException) e).getError())
                .isEqualTo(TransferError.SAME_ACCOUNT);
    }

    @Test
    void blankAccount_isUnknown() {
        InMemoryValueLedger ledger = new InMemoryValueLedger();

        assertThatThrownBy(() -> ledger.transfer(" ", "treasury", BigInteger.ONE))
                .isInstanceOf(TransferException.class)
                .extracting(e -> ((TransferException) e).getError())
                .isEqualTo(TransferError.UNKNOWN_ACCOUNT);
        assertThatThrownBy(() -> ledger.transfer("alice", null, BigInteger.ONE))
                .isInstanceOf(TransferException.class)
                .extracting(e -> ((TransferException) e).getError())
                .isEqualTo(TransferError.UNKNOWN_ACCOUNT);
    }

    @Test
    void transferErrors_keepTheirCodes() {
        assertThat(TransferError.INSUFFICIENT_BALANCE.code()).isEqualTo(1);
        assertThat(TransferError.SAME_ACCOUNT.code()).isEqualTo(2);
        assertThat(TransferError.NON_POSITIVE_AMOUNT.code()).isEqualTo(3);
        assertThat(TransferError.UNKNOWN_ACCOUNT.code()).isEqualTo(4);
    }

    @Test
    void unseenAccount_hasZeroBalance() {
        assertThat(new InMemoryValueLedger().balanceOf("nobody")).isZero();
    }

    @Test
    void negativeCredit_isRefused() {
        InMemoryValueLedger ledger = new InMemoryValueLedger();

        assertThatThrownBy(() -> ledger.credit("alice", BigInteger.valueOf(-5)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
