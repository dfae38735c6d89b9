package com.baladi.settlement.entity;

/**
 * Admin review state of a shop or rider settlement.
 *
 * <pre>
 * PENDING --> REVIEWED --> SETTLED
 *    |            ^  |
 *    v            |  v
 *    +------> DISPUTED
 * </pre>
 */
public enum SettlementStatus {
    PENDING,
    REVIEWED,
    SETTLED,
    DISPUTED;

    public boolean canMoveTo(SettlementStatus target) {
        return switch (this) {
            case PENDING -> target == REVIEWED || target == DISPUTED;
            case REVIEWED -> target == SETTLED || target == DISPUTED;
            case DISPUTED -> target == REVIEWED;
            case SETTLED -> false;
        };
    }
}
