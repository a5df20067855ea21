package com.my.offers.domain.model;

public enum DedupOutcome {
    PUBLISHED,
    REJECTED
}
