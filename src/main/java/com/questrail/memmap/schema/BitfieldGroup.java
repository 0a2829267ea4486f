package com.questrail.memmap.schema;

import java.util.List;
import java.util.Objects;

/**
 * Named sub-byte fields declared together on one integer carrier, e.g.
 * {@code u8 lowpower:2, wide:1, unused:5;}.
 *
 * <p>The first member occupies the most significant bits of the carrier. The
 * group consumes the whole carrier as a unit.</p>
 */
public record BitfieldGroup(PrimitiveKind carrier, List<BitfieldMember> members, int line)
        implements FieldNode {

    public BitfieldGroup {
        Objects.requireNonNull(carrier, "carrier");
        members = List.copyOf(Objects.requireNonNull(members, "members"));
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A bitfield group needs at least one member");
        }
    }

    /**
     * Sum of member widths in bits.
     */
    public int totalBits() {
        int total = 0;
        for (BitfieldMember m : members) {
            total += m.width();
        }
        return total;
    }

    /**
     * One named member of a {@link BitfieldGroup}.
     */
    public record BitfieldMember(String name, int width, int line) {

        public BitfieldMember {
            Objects.requireNonNull(name, "name");
            if (width < 1) {
                throw new IllegalArgumentException("width must be positive: " + width);
            }
        }

        public BitfieldMember(String name, int width) {
            this(name, width, 0);
        }
    }
}
