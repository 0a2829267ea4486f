package com.questrail.memmap.observability;

import java.time.Instant;

/**
 * Record representing the removal of a resolved layout from a schema cache.
 * The schema text itself is not carried; its hash and length identify it in
 * logs.
 */
public record CacheEvictionEvent(
    Instant timestamp,
    int sourceHash,
    int sourceLength,
    Reason reason,
    int remainingEntries
) {
    public enum Reason { CAPACITY, EXPLICIT, CLEARED }
}
