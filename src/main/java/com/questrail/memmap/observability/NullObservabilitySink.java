package com.questrail.memmap.observability;

/**
 * No-op implementation of LayoutObservabilitySink.
 */
public final class NullObservabilitySink implements LayoutObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDiagnostic(LayoutDiagnosticEvent event) {}

    @Override
    public void onCacheEviction(CacheEvictionEvent event) {}
}
