package com.questrail.memmap.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LayoutObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLayoutObservabilitySink implements LayoutObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLayoutObservabilitySink.class);

    @Override
    public void onDiagnostic(LayoutDiagnosticEvent event) {
        switch (event.kind()) {
            case PRINT_OFFSET -> log.debug("{}", event.message());
            case REDUNDANT_SEEK, BACKWARD_SEEK, TRAILING_BITS ->
                log.warn("Schema line {}: {}", event.line(), event.message());
        }
    }

    @Override
    public void onCacheEviction(CacheEvictionEvent event) {
        log.debug("Evicted layout (hash={}, {} chars, reason={}); {} entries remain",
            Integer.toHexString(event.sourceHash()),
            event.sourceLength(),
            event.reason(),
            event.remainingEntries());
    }
}
