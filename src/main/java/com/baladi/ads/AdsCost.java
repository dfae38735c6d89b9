package com.baladi.ads;

import java.math.BigDecimal;

/** Advertising spend billed to one shop for a period. */
public record AdsCost(Long shopId, BigDecimal totalCost) {
}
