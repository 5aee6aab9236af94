package com.agrotrace.core.domain;

import jakarta.persistence.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * LedgerAccount - Balance held by one principal (or the registry treasury) in the local ledger.
 */
@Entity
@Table(name = "ledger_accounts")
public class LedgerAccount {

    @Id
    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Column(name = "balance", nullable = false, precision = 38, scale = 0)
    private BigInteger balance;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected LedgerAccount() {}

    public static LedgerAccount open(String accountId) {
        LedgerAccount account = new LedgerAccount();
        account.accountId = Objects.requireNonNull(accountId, "Account id cannot be null");
        account.balance = BigInteger.ZERO;
        account.updatedAt = Instant.now();
        return account;
    }

    public void deposit(BigInteger amount) {
        this.balance = balance.add(amount);
        this.updatedAt = Instant.now();
    }

    public void withdraw(BigInteger amount) {
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException("Insufficient balance in account " + accountId);
        }
        this.balance = balance.subtract(amount);
        this.updatedAt = Instant.now();
    }

    public String getAccountId() { return accountId; }
    public BigInteger getBalance() { return balance; }
    public Instant getUpdatedAt() { return updatedAt; }
}
