package com.baladi.common.result;

import com.baladi.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Translates storage exceptions into the failure taxonomy.
 *
 * <p>A lost optimistic-lock race is a terminal {@link Failure.BusinessRuleFailure}
 * (stale state). Lock-acquisition timeouts and transient errors become retryable
 * {@link Failure.NetworkFailure}; everything else is a {@link Failure.ServerFailure}.</p>
 */
@Slf4j
public final class Failures {

    private Failures() {
    }

    public static Failure fromDataAccess(DataAccessException e) {
        if (e instanceof OptimisticLockingFailureException) {
            log.warn("Optimistic lock conflict: {}", e.getMessage());
            return Failure.businessRule(ErrorCode.STALE_ORDER_STATE,
                    "Data was modified concurrently, reload and try again");
        }
        if (e instanceof TransientDataAccessException || e instanceof PessimisticLockingFailureException) {
            log.warn("Transient storage failure: {}", e.getMessage());
            return new Failure.NetworkFailure(ErrorCode.SERVICE_UNAVAILABLE, e.getMostSpecificCause().getMessage());
        }
        log.error("Storage failure", e);
        return new Failure.ServerFailure(ErrorCode.INTERNAL_ERROR, e.getMostSpecificCause().getMessage());
    }
}
