package com.questrail.memmap.binding;

import com.questrail.memmap.layout.ResolvedLayout;
import com.questrail.memmap.store.BackingStore;
import com.questrail.memmap.store.OutOfBoundsException;

import java.util.Objects;

/**
 * Bindings
 * -----------------------------------------------------------------------------
 * Entry point of the binding layer: attaches a resolved layout to a store and
 * reads or writes leaf values without knowing their concrete view type.
 *
 * <h2>Values</h2>
 * <ul>
 *   <li>integer fields and BCD fields of up to nine pairs: {@link Long}; wider
 *       BCD fields: {@link java.math.BigInteger} (any integral {@link Number}
 *       is accepted on write; BCD also accepts a {@code BigInteger} or a digit
 *       {@link String})</li>
 *   <li>character fields: {@link String}</li>
 *   <li>bitfields and bits: {@link Long} ({@link Boolean} is accepted on
 *       write)</li>
 * </ul>
 * Records and arrays have no single value; asking for one is a
 * {@link TypeMismatchException}.
 */
public final class Bindings
{
    private Bindings() {}

    /**
     * Binds {@code layout} to {@code store}, padding character assignments
     * with {@code charPad}.
     *
     * @return the root record view
     * @throws OutOfBoundsException if the store is shorter than the layout
     */
    public static BoundRecord bind(ResolvedLayout layout, BackingStore store, byte charPad)
    {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(store, "store");
        if (store.length() < layout.byteSize()) {
            throw new OutOfBoundsException(String.format(
                    "layout needs %d bytes but the store holds %d", layout.byteSize(), store.length()));
        }
        return new RecordView(layout.root(), 0, store, charPad, "");
    }

    /**
     * Reads the value of a leaf element.
     *
     * @throws TypeMismatchException for records and arrays
     */
    public static Object value(BoundElement element)
    {
        return view(element).read();
    }

    /**
     * Writes a value to a leaf element. Nothing is written if the value is
     * rejected.
     *
     * @throws TypeMismatchException for records and arrays, or a value of the
     *         wrong type
     * @throws com.questrail.memmap.codec.EncodingException if the value does
     *         not fit
     */
    public static void assign(BoundElement element, Object value)
    {
        view(element).write(value);
    }

    static <T extends BoundElement> T as(BoundElement element, Class<T> type)
    {
        if (!type.isInstance(element)) {
            throw new TypeMismatchException(String.format("%s is not a %s",
                    view(element).describe(), type.getSimpleName().replace("Bound", "").toLowerCase()));
        }
        return type.cast(element);
    }

    private static AbstractView view(BoundElement element)
    {
        return (AbstractView) Objects.requireNonNull(element, "element");
    }
}
