package io.governance.core.query;

/** Pool-level counters. */
public record StateResponse(long pollCount, long totalShare, long totalDeposit) {}
