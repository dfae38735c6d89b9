package com.baladi.common.result;

import com.baladi.common.exception.BusinessException;
import com.baladi.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

    @Test
    @DisplayName("map and flatMap chain on success")
    void chainsOnSuccess() {
        Result<Integer> result = Result.success(2)
                .map(value -> value * 10)
                .flatMap(value -> Result.success(value + 1));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOrThrow()).isEqualTo(21);
        assertThat(result.failure()).isNull();
    }

    @Test
    @DisplayName("a failure short-circuits the rest of the chain")
    void failureShortCircuits() {
        AtomicInteger calls = new AtomicInteger();

        Result<Integer> result = Result.<Integer>failure(Failure.businessRule(ErrorCode.NOTHING_TO_SETTLE))
                .map(value -> calls.incrementAndGet())
                .flatMap(value -> Result.success(calls.incrementAndGet()))
                .peek(value -> calls.incrementAndGet());

        assertThat(result.isFailure()).isTrue();
        assertThat(calls).hasValue(0);
        assertThat(result.failure().errorCode()).isEqualTo(ErrorCode.NOTHING_TO_SETTLE);
    }

    @Test
    @DisplayName("fold picks the branch matching the outcome")
    void foldPicksBranch() {
        String ok = Result.success("done").fold(value -> "ok:" + value, failure -> "err");
        String err = Result.<String>failure(Failure.validation("bad input"))
                .fold(value -> "ok", failure -> "err:" + failure.message());

        assertThat(ok).isEqualTo("ok:done");
        assertThat(err).isEqualTo("err:bad input");
    }

    @Test
    @DisplayName("getOrThrow wraps the failure in a BusinessException")
    void getOrThrowWrapsFailure() {
        Failure failure = Failure.businessRule(ErrorCode.PERIOD_ALREADY_CLOSED);

        assertThatThrownBy(() -> Result.failure(failure).getOrThrow())
                .isInstanceOf(BusinessException.class)
                .hasMessage("Settlement already closed for this week")
                .satisfies(e -> assertThat(((BusinessException) e).getFailure()).isSameAs(failure));
    }

    @Test
    @DisplayName("only network failures are retryable")
    void onlyNetworkFailuresAreRetryable() {
        assertThat(new Failure.NetworkFailure(ErrorCode.SERVICE_UNAVAILABLE, "timeout").isRetryable()).isTrue();
        assertThat(new Failure.ServerFailure(ErrorCode.INTERNAL_ERROR, "boom").isRetryable()).isFalse();
        assertThat(Failure.businessRule(ErrorCode.SELF_REFERRAL).isRetryable()).isFalse();
        assertThat(Failure.validation("x").isRetryable()).isFalse();
        assertThat(Failure.notFound(ErrorCode.ORDER_NOT_FOUND).isRetryable()).isFalse();
    }

    @Test
    @DisplayName("getOrElse falls back only on failure")
    void getOrElse() {
        assertThat(Result.success(1).getOrElse(() -> 9)).isEqualTo(1);
        assertThat(Result.<Integer>failure(Failure.validation("x")).getOrElse(() -> 9)).isEqualTo(9);
    }
}
