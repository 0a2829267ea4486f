package com.questrail.memmap;

import com.questrail.memmap.binding.Bindings;
import com.questrail.memmap.binding.BoundRecord;
import com.questrail.memmap.cache.SchemaCache;
import com.questrail.memmap.config.LayoutEngineConfig;
import com.questrail.memmap.layout.LayoutResolver;
import com.questrail.memmap.layout.ResolvedLayout;
import com.questrail.memmap.layout.impl.DefaultLayoutResolver;
import com.questrail.memmap.observability.LayoutObservabilitySink;
import com.questrail.memmap.observability.Slf4jLayoutObservabilitySink;
import com.questrail.memmap.schema.CompiledSchema;
import com.questrail.memmap.schema.SchemaCompiler;
import com.questrail.memmap.schema.impl.DefaultSchemaCompiler;
import com.questrail.memmap.store.BackingStore;

import java.util.Objects;

/**
 * LayoutEngine
 * =============================================================================
 * Composition root of the library. Wires a schema compiler, a layout resolver
 * and a schema cache from one configuration and one observability sink.
 *
 * <pre>
 *   LayoutEngine engine = LayoutEngine.builder()
 *       .withConfig(LayoutEngineConfig.defaults())
 *       .build();
 *   BoundRecord mem = engine.parse(schemaText, BackingStore.load(image));
 *   mem.at(".memory[3].rxfreq")...
 * </pre>
 *
 * <p>An engine holds no per-image state; it may be shared across edit
 * sessions.</p>
 */
public final class LayoutEngine
{
    private final LayoutEngineConfig config;
    private final SchemaCompiler compiler;
    private final LayoutResolver resolver;
    private final SchemaCache cache;

    private LayoutEngine(LayoutEngineConfig config, LayoutObservabilitySink sink)
    {
        this.config = config;
        this.compiler = new DefaultSchemaCompiler(sink);
        this.resolver = new DefaultLayoutResolver(sink, config.rejectBackwardSeeks());
        this.cache = new SchemaCache(config.cacheCapacity(), compiler, resolver, sink);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public LayoutEngineConfig config()
    {
        return config;
    }

    public SchemaCache cache()
    {
        return cache;
    }

    /**
     * Compiles schema text without caching.
     */
    public CompiledSchema compile(String text)
    {
        return compiler.compile(text);
    }

    public ResolvedLayout resolve(CompiledSchema schema)
    {
        return resolver.resolve(schema);
    }

    public ResolvedLayout resolve(CompiledSchema schema, int declaredSize)
    {
        return resolver.resolve(schema, declaredSize);
    }

    /**
     * Compiles and resolves through the cache.
     */
    public ResolvedLayout layout(String text)
    {
        return cache.layoutFor(text);
    }

    public BoundRecord bind(ResolvedLayout layout, BackingStore store)
    {
        return Bindings.bind(layout, store, config.charPad());
    }

    /**
     * Cached layout of {@code text} bound to {@code store}.
     */
    public BoundRecord parse(String text, BackingStore store)
    {
        return bind(layout(text), store);
    }

    public static final class Builder
    {
        private LayoutEngineConfig config = LayoutEngineConfig.defaults();
        private LayoutObservabilitySink sink = new Slf4jLayoutObservabilitySink();

        public Builder withConfig(LayoutEngineConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(LayoutObservabilitySink sink)
        {
            this.sink = sink;
            return this;
        }

        public LayoutEngine build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(sink, "sink");
            return new LayoutEngine(config, sink);
        }
    }
}
