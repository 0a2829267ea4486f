/**
 * Runtime Binding: Live Views over a Backing Store
 * =============================================================================
 *
 * <p>A {@link com.questrail.memmap.layout.ResolvedLayout} says where every
 * field lives; this package attaches it to a
 * {@link com.questrail.memmap.store.BackingStore} and exposes the result as a
 * graph of {@link com.questrail.memmap.binding.BoundElement}s.</p>
 *
 * <pre>
 *   Bindings.bind(layout, store, pad)
 *        → BoundRecord (root)
 *            .field("memory")        → BoundArray
 *                .element(3)         → BoundRecord
 *                    .field("rxfreq")→ BoundPrimitive → Long
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Views hold a template node, a byte delta and the store; never data.</li>
 *   <li>Array elements are never resolved again; element {@code i} is the
 *       element template shifted by {@code i * stride}.</li>
 *   <li>Writes encode first and touch the store last.</li>
 * </ul>
 */
package com.questrail.memmap.binding;
