package com.baladi.common.exception;

import com.baladi.common.result.Failure;
import com.baladi.common.result.Failures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Renders failures as RFC 7807 {@link ProblemDetail}.
 *
 * <p>The failure message is passed through verbatim; no translation happens here.</p>
 *
 * <pre>
 *   {
 *     "type": "https://baladi.app/errors/period_already_closed",
 *     "status": 409,
 *     "detail": "Settlement already closed for this week",
 *     "retryable": false
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        Failure failure = e.getFailure();
        if (failure instanceof Failure.ServerFailure || failure instanceof Failure.NetworkFailure) {
            log.error("Backend failure surfaced to client: code={}, message={}",
                    failure.errorCode(), failure.message());
        }
        return toResponse(failure.errorCode(), failure.message(), failure.isRetryable());
    }

    /** Storage errors escaping a transaction commit, e.g. a lost optimistic lock race. */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException e) {
        Failure failure = Failures.fromDataAccess(e);
        return toResponse(failure.errorCode(), failure.message(), failure.isRetryable());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRequest(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return toResponse(ErrorCode.INVALID_INPUT, detail, false);
    }

    private ResponseEntity<ProblemDetail> toResponse(ErrorCode errorCode, String detail, boolean retryable) {
        HttpStatus status = errorCode.getStatus();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://baladi.app/errors/" + errorCode.name().toLowerCase()));
        problem.setProperty("retryable", retryable);
        return ResponseEntity.status(status).body(problem);
    }
}
