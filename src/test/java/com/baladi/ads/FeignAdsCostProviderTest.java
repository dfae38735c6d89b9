package com.baladi.ads;

import com.baladi.common.exception.ErrorCode;
import com.baladi.common.result.Failure;
import com.baladi.common.result.Result;
import com.baladi.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class FeignAdsCostProviderTest {

    @Mock
    private AdsServiceClient adsServiceClient;

    @InjectMocks
    private FeignAdsCostProvider provider;

    @Test
    @DisplayName("missing costs are read as zero and null rows are skipped")
    void mapsResponse() {
        given(adsServiceClient.getCosts(Fixtures.WEEK_START, Fixtures.NEXT_WEEK_START)).willReturn(Arrays.asList(
                new AdsServiceClient.AdsCostResponse(10L, new BigDecimal("12.50")),
                null,
                new AdsServiceClient.AdsCostResponse(20L, null)));

        List<AdsCost> costs = provider.getAdsCostForPeriod(Fixtures.WEEK_START, Fixtures.NEXT_WEEK_START).getOrThrow();

        assertThat(costs).containsExactly(
                new AdsCost(10L, new BigDecimal("12.50")),
                new AdsCost(20L, BigDecimal.ZERO));
    }

    @Test
    @DisplayName("the fallback reports a retryable network failure")
    void fallback() {
        Result<List<AdsCost>> result = ReflectionTestUtils.invokeMethod(provider, "adsCostFallback",
                Fixtures.WEEK_START, Fixtures.NEXT_WEEK_START, new IllegalStateException("connection refused"));

        assertThat(result.failure()).isInstanceOf(Failure.NetworkFailure.class);
        assertThat(result.failure().errorCode()).isEqualTo(ErrorCode.ADS_SERVICE_UNAVAILABLE);
    }
}
