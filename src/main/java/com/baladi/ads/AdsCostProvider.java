package com.baladi.ads;

import com.baladi.common.result.Result;

import java.time.Instant;
import java.util.List;

/**
 * Source of per-shop advertising costs for a settlement window {@code [start, end)}.
 * Shops without ads are simply absent from the list.
 */
public interface AdsCostProvider {

    Result<List<AdsCost>> getAdsCostForPeriod(Instant start, Instant end);
}
