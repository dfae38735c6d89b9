package com.baladi.ads;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ads costs over HTTP.
 *
 * <p>Retry is the outer aspect and owns the fallback, so every attempt goes through
 * the circuit breaker and the fallback only runs once retries are exhausted (or the
 * circuit is open). The fallback never throws; it reports a retryable
 * {@link Failure.NetworkFailure} and the settlement close is aborted.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeignAdsCostProvider implements AdsCostProvider {

    private final AdsServiceClient adsServiceClient;

    @Override
    @Retry(name = "adsService", fallbackMethod = "adsCostFallback")
    @CircuitBreaker(name = "adsService")
    public Result<List<AdsCost>> getAdsCostForPeriod(Instant start, Instant end) {
        List<AdsCost> costs = adsServiceClient.getCosts(start, end).stream()
                .filter(Objects::nonNull)
                .map(response -> new AdsCost(response.shopId(),
                        response.totalCost() != null ? response.totalCost() : BigDecimal.ZERO))
                .toList();
        log.info("Ads costs fetched: start={}, end={}, shops={}", start, end, costs.size());
        return Result.success(costs);
    }

    private Result<List<AdsCost>> adsCostFallback(Instant start, Instant end, Throwable t) {
        log.error("Ads service unavailable: start={}, end={}, cause={}", start, end, t.toString());
        return Result.failure(new Failure.NetworkFailure(ErrorCode.ADS_SERVICE_UNAVAILABLE,
                "Ads service is temporarily unavailable, settlement was not closed"));
    }
}
