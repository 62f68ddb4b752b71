package com.snuffles.journal.service;

import com.snuffles.journal.service.exception.RepositoryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs ledger work as one all-or-nothing transaction on a pooled connection that is released
 * when the transaction ends. Lock contention is retried with bounded backoff; every storage
 * failure that escapes is reported as a {@link RepositoryException} after the rollback.
 */
@Component
@Slf4j
public class LedgerTransactions {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final RetryTemplate retryTemplate;

    public LedgerTransactions(PlatformTransactionManager transactionManager,
                              @Qualifier("ledgerRetryTemplate") RetryTemplate retryTemplate) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        // positions and cash must come from the same committed state
        this.readTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        this.retryTemplate = retryTemplate;
    }

    public <T> T execute(String operation, TransactionCallback<T> work) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying {} (attempt {}) after lock contention: {}",
                        operation, context.getRetryCount() + 1, String.valueOf(context.getLastThrowable()));
                }
                return writeTemplate.execute(work);
            });
        } catch (ConcurrencyFailureException ex) {
            log.error("Giving up on {}: ledger write lock not acquired", operation);
            throw new RepositoryException("Ledger is busy; " + operation + " could not acquire the write lock", ex);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Storage failure during {}", operation, ex);
            throw new RepositoryException("Storage failure during " + operation, ex);
        }
    }

    public <T> T read(String operation, TransactionCallback<T> work) {
        try {
            return readTemplate.execute(work);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Storage failure during {}", operation, ex);
            throw new RepositoryException("Storage failure during " + operation, ex);
        }
    }
}
