package com.questrail.memmap.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A placed struct or union. Children are kept in declaration order and are
 * looked up by name.
 */
public record ResolvedRecord(String name, boolean union, int byteOffset, int byteSize,
                             Map<String, ResolvedNode> children)
        implements ResolvedNode {

    public ResolvedRecord {
        Objects.requireNonNull(name, "name");
        children = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(children, "children")));
    }
}
