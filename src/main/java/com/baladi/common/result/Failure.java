package com.baladi.common.result;

import com.baladi.common.exception.ErrorCode;

/**
 * Typed failure taxonomy returned by core operations.
 *
 * <ul>
 *   <li>{@link ValidationFailure} - malformed input or wrong actor</li>
 *   <li>{@link BusinessRuleFailure} - valid input that breaks a domain invariant</li>
 *   <li>{@link NotFoundFailure} - referenced entity does not exist</li>
 *   <li>{@link NetworkFailure} - transient transport or storage failure</li>
 *   <li>{@link ServerFailure} - non-transient backend failure</li>
 *   <li>{@link CacheFailure} - local persistence failure</li>
 * </ul>
 *
 * <p>A business rule failure is a terminal rejection; retrying the same input
 * yields the same answer. Only {@link NetworkFailure} is retryable.</p>
 */
public sealed interface Failure
        permits Failure.ValidationFailure, Failure.BusinessRuleFailure, Failure.NotFoundFailure,
        Failure.NetworkFailure, Failure.ServerFailure, Failure.CacheFailure {

    ErrorCode errorCode();

    String message();

    default boolean isRetryable() {
        return false;
    }

    static ValidationFailure validation(ErrorCode code, String message) {
        return new ValidationFailure(code, message);
    }

    static ValidationFailure validation(String message) {
        return new ValidationFailure(ErrorCode.INVALID_INPUT, message);
    }

    static BusinessRuleFailure businessRule(ErrorCode code) {
        return new BusinessRuleFailure(code, code.getMessage());
    }

    static BusinessRuleFailure businessRule(ErrorCode code, String message) {
        return new BusinessRuleFailure(code, message);
    }

    static NotFoundFailure notFound(ErrorCode code) {
        return new NotFoundFailure(code, code.getMessage());
    }

    record ValidationFailure(ErrorCode errorCode, String message) implements Failure {
    }

    record BusinessRuleFailure(ErrorCode errorCode, String message) implements Failure {
    }

    record NotFoundFailure(ErrorCode errorCode, String message) implements Failure {
    }

    record NetworkFailure(ErrorCode errorCode, String message) implements Failure {
        @Override
        public boolean isRetryable() {
            return true;
        }
    }

    record ServerFailure(ErrorCode errorCode, String message) implements Failure {
    }

    record CacheFailure(ErrorCode errorCode, String message) implements Failure {
    }
}
