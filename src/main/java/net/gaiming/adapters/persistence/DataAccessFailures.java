package net.gaiming.adapters.persistence;

import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import net.gaiming.support.result.ResultError;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * Translates Spring's data-access and transaction exceptions into {@link Result} failures.
 */
public final class DataAccessFailures {

    private DataAccessFailures() {
    }

    /**
     * Repositories wrap read failures in {@link IllegalStateException} with a context message;
     * the wrapped data-access exception decides the code.
     */
    public static ErrorCode classify(RuntimeException ex) {
        if (ex instanceof IllegalStateException && ex.getCause() instanceof DataAccessException wrapped) {
            return classify(wrapped);
        }
        if (ex instanceof OptimisticLockingFailureException
            || ex instanceof DuplicateKeyException
            || ex instanceof PessimisticLockingFailureException) {
            return ErrorCode.CONFLICT;
        }
        if (ex instanceof TransactionTimedOutException || ex instanceof QueryTimeoutException) {
            return ErrorCode.CANCELLED;
        }
        if (ex instanceof TransientDataAccessException || ex instanceof TransactionException) {
            return ErrorCode.TRANSIENT;
        }
        return ErrorCode.UNEXPECTED;
    }

    public static ResultError toError(String action, RuntimeException ex) {
        ErrorCode code = classify(ex);
        String detail = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return new ResultError(code, action + ": " + detail, ex);
    }

    public static <T> Result<T> toResult(String action, RuntimeException ex) {
        return Result.failure(toError(action, ex));
    }
}
