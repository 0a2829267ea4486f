package com.questrail.memmap.observability;

/**
 * Main interface for receiving layout engine observability events.
 * Implementations can provide logging, metrics, or test recording.
 */
public interface LayoutObservabilitySink {
    /**
     * Called for non-fatal compile- or resolve-time observations
     * (print-offset directives, suspicious seeks, undeclared bitfield bits).
     * @param event the diagnostic details
     */
    void onDiagnostic(LayoutDiagnosticEvent event);

    /**
     * Called when a schema cache drops an entry.
     * @param event the eviction details
     */
    void onCacheEviction(CacheEvictionEvent event);
}
