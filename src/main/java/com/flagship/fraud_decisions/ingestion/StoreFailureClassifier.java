package com.flagship.fraud_decisions.ingestion;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.net.ConnectException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Decides whether a store failure is worth retrying.
 *
 * Transient: timeouts, lock contention, lost or refused connections. These are retried with
 * backoff and count toward the circuit breaker. Everything else (constraint violations,
 * mapping errors, bugs) is permanent and must not be retried.
 */
@Component
public class StoreFailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    public boolean isTransient(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof CannotCreateTransactionException
                    || current instanceof TransactionTimedOutException
                    || current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException
                    || current instanceof ConnectException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
