package com.agrotrace.api.access;

import com.agrotrace.core.result.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single writer for the shared store.
 *
 * Every operation runs to completion under one fair, reentrant lock and inside one transaction
 * before the next begins. A failure result marks the transaction rollback-only, so a rejected
 * operation leaves the store untouched even if a write slipped through. Nested calls from one
 * service into another (the practice log asking the registry for verification) re-enter the
 * lock and join the same transaction.
 *
 * Side effects outside the store, such as ticking the logical clock, are registered with
 * {@link #afterCommit(Runnable)} and only happen once the operation's writes are durable.
 */
@Component
public class OperationSequencer {

    private static final Logger log = LoggerFactory.getLogger(OperationSequencer.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionOperations transactions;

    public OperationSequencer(TransactionOperations transactions) {
        this.transactions = transactions;
    }

    /**
     * Runs a mutating operation atomically.
     */
    public <T> OperationResult<T> execute(String operation, Supplier<OperationResult<T>> body) {
        lock.lock();
        try {
            return transactions.execute(status -> {
                OperationResult<T> result = body.get();
                if (result.isFailure()) {
                    status.setRollbackOnly();
                    log.debug("{} rejected: {}", operation, result);
                }
                return result;
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a read against a consistent state, never interleaved with a write.
     */
    public <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} once the current operation has committed, still under the lock. Outside
     * a synchronized transaction the action runs immediately.
     */
    public void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
