package com.lifecycle.engine.persistence;

import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Transactions over an {@link InMemoryReadModelStore}: the callback's
 * read model writes are staged and committed only if it returns normally
 * without being marked rollback-only. A nested call joins the outer one.
 */
public class InMemoryReadModelTransactions implements TransactionOperations {

    private final InMemoryReadModelStore store;

    public InMemoryReadModelTransactions(InMemoryReadModelStore store) {
        this.store = store;
    }

    @Override
    public <T> T execute(TransactionCallback<T> action) {
        if (store.inTransaction()) {
            return action.doInTransaction(new SimpleTransactionStatus(false));
        }
        store.begin();
        boolean committed = false;
        try {
            SimpleTransactionStatus status = new SimpleTransactionStatus(true);
            T result = action.doInTransaction(status);
            if (!status.isRollbackOnly()) {
                store.commit();
                committed = true;
            }
            return result;
        } finally {
            if (!committed) {
                store.rollback();
            }
        }
    }
}
