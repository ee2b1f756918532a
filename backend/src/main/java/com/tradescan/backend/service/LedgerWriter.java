package com.tradescan.backend.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every ledger mutation (trades, positions, closed positions, daily stats).
 * Each call runs in one transaction under a process-wide fair lock; nested calls join the outer one.
 * Never call a provider from inside a mutation.
 */
@Component
public class LedgerWriter {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public LedgerWriter(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T write(Supplier<T> mutation) {
        lock.lock();
        try {
            return transactionTemplate.execute(status -> mutation.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable mutation) {
        write(() -> {
            mutation.run();
            return null;
        });
    }
}
