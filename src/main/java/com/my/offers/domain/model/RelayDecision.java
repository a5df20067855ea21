package com.my.offers.domain.model;

public enum RelayDecision {
    DUPLICATE,
    REJECTED,
    PUBLISHED,
    PENDING,
    DEFERRED
}
