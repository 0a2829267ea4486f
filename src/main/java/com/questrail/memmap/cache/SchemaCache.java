package com.questrail.memmap.cache;

import com.questrail.memmap.layout.LayoutResolver;
import com.questrail.memmap.layout.ResolvedLayout;
import com.questrail.memmap.observability.CacheEvictionEvent;
import com.questrail.memmap.observability.LayoutObservabilitySink;
import com.questrail.memmap.schema.SchemaCompiler;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SchemaCache
 * -----------------------------------------------------------------------------
 * Bounded, least-recently-used cache of resolved layouts keyed by exact
 * schema text.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>A hit returns the same {@link ResolvedLayout} instance that was
 *       stored.</li>
 *   <li>A miss compiles and resolves; a failure propagates and nothing is
 *       stored.</li>
 *   <li>Past {@code capacity} entries the least recently used one is evicted
 *       and reported to the observability sink.</li>
 * </ul>
 *
 * <h2>Thread safety</h2>
 * All public methods are synchronized; one cache may be shared by concurrent
 * sessions. Compilation of a miss happens under the lock.
 */
public final class SchemaCache
{
    private final int capacity;
    private final SchemaCompiler compiler;
    private final LayoutResolver resolver;
    private final LayoutObservabilitySink sink;
    private final LinkedHashMap<String, ResolvedLayout> entries;

    public SchemaCache(int capacity, SchemaCompiler compiler, LayoutResolver resolver, LayoutObservabilitySink sink)
    {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Returns the layout for {@code text}, compiling and resolving it on a
     * miss.
     *
     * @throws com.questrail.memmap.schema.SchemaSyntaxException if the text
     *         does not compile
     * @throws com.questrail.memmap.layout.LayoutException if it does not
     *         resolve
     */
    public synchronized ResolvedLayout layoutFor(String text)
    {
        Objects.requireNonNull(text, "text");
        ResolvedLayout cached = entries.get(text);
        if (cached != null) {
            return cached;
        }

        ResolvedLayout layout = resolver.resolve(compiler.compile(text));
        entries.put(text, layout);

        Iterator<Map.Entry<String, ResolvedLayout>> eldest = entries.entrySet().iterator();
        while (entries.size() > capacity) {
            String victim = eldest.next().getKey();
            eldest.remove();
            report(victim, CacheEvictionEvent.Reason.CAPACITY);
        }
        return layout;
    }

    /**
     * Removes the entry for {@code text}, if present.
     *
     * @return whether an entry was removed
     */
    public synchronized boolean evict(String text)
    {
        if (entries.remove(text) == null) {
            return false;
        }
        report(text, CacheEvictionEvent.Reason.EXPLICIT);
        return true;
    }

    public synchronized void clear()
    {
        Iterator<String> it = entries.keySet().iterator();
        while (it.hasNext()) {
            String text = it.next();
            it.remove();
            report(text, CacheEvictionEvent.Reason.CLEARED);
        }
    }

    public synchronized int size()
    {
        return entries.size();
    }

    public int capacity()
    {
        return capacity;
    }

    private void report(String text, CacheEvictionEvent.Reason reason)
    {
        sink.onCacheEviction(new CacheEvictionEvent(
                Instant.now(), text.hashCode(), text.length(), reason, entries.size()));
    }
}
