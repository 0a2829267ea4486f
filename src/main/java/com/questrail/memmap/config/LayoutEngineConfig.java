package com.questrail.memmap.config;

/**
 * Aggregated configuration for a {@link com.questrail.memmap.LayoutEngine}.
 *
 * @param cacheCapacity       maximum number of resolved layouts kept by the
 *                            engine's schema cache (at least 1)
 * @param charPad             byte used to pad character fields when a shorter
 *                            string is assigned
 * @param rejectBackwardSeeks whether a {@code #seekto} to the current or a lower
 *                            offset fails resolution instead of producing a
 *                            warning
 */
public record LayoutEngineConfig(
    int cacheCapacity,
    byte charPad,
    boolean rejectBackwardSeeks
) {
    public static final int DEFAULT_CACHE_CAPACITY = 64;
    public static final byte DEFAULT_CHAR_PAD = 0x20;

    public LayoutEngineConfig {
        if (cacheCapacity < 1) {
            throw new IllegalArgumentException("cacheCapacity must be at least 1: " + cacheCapacity);
        }
    }

    public static LayoutEngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int cacheCapacity = DEFAULT_CACHE_CAPACITY;
        private byte charPad = DEFAULT_CHAR_PAD;
        private boolean rejectBackwardSeeks = false;

        public Builder withCacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder withCharPad(byte charPad) {
            this.charPad = charPad;
            return this;
        }

        public Builder withRejectBackwardSeeks(boolean reject) {
            this.rejectBackwardSeeks = reject;
            return this;
        }

        public LayoutEngineConfig build() {
            return new LayoutEngineConfig(cacheCapacity, charPad, rejectBackwardSeeks);
        }
    }
}
