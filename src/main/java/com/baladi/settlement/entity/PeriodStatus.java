package com.baladi.settlement.entity;

/** ACTIVE -> CLOSED -> SETTLED. At most one ACTIVE period exists. */
public enum PeriodStatus {
    ACTIVE,
    CLOSED,
    SETTLED
}
