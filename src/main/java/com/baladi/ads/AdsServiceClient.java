package com.baladi.ads;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Declarative client for the ads service.
 * Calls are guarded by Resilience4j in {@link FeignAdsCostProvider}.
 */
@FeignClient(name = "ads-service", url = "${ads-service.url:http://localhost:8085}")
public interface AdsServiceClient {

    @GetMapping("/api/ads/costs")
    List<AdsCostResponse> getCosts(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end);

    record AdsCostResponse(Long shopId, BigDecimal totalCost) {}
}
