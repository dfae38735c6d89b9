package com.baladi.common.exception;

import com.baladi.common.result.Failure;
import lombok.Getter;

/**
 * Unchecked carrier for a {@link Failure} at the HTTP edge.
 *
 * <p>Core operations return {@code Result}; controllers unwrap with
 * {@code getOrThrow()} and this exception reaches {@link GlobalExceptionHandler}.</p>
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
 *   throw new BusinessException(Failure.businessRule(ErrorCode.NOTHING_TO_SETTLE));
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final transient Failure failure;

    public BusinessException(Failure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public BusinessException(ErrorCode errorCode) {
        this(Failure.businessRule(errorCode));
    }

    public ErrorCode getErrorCode() {
        return failure.errorCode();
    }
}
