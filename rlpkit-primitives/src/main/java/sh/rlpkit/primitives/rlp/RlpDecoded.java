// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import java.util.Arrays;
import java.util.Objects;

/**
 * One value decoded from the front of a buffer, with the bytes that follow it.
 *
 * <p>Whether leftover bytes are an error is up to the caller; use
 * {@link Rlp#decode(byte[])} when they are.
 *
 * @since 1.0
 */
public final class RlpDecoded {

    private final RlpItem item;
    private final int consumed;
    private final byte[] remainder;

    RlpDecoded(final RlpItem item, final int consumed, final byte[] remainder) {
        this.item = Objects.requireNonNull(item, "item");
        this.consumed = consumed;
        this.remainder = Objects.requireNonNull(remainder, "remainder");
    }

    public RlpItem item() {
        return item;
    }

    /**
     * Number of input bytes the item occupied.
     *
     * @return consumed byte count
     */
    public int consumed() {
        return consumed;
    }

    /**
     * Returns a copy of the unconsumed bytes.
     *
     * @return trailing bytes, empty when the input held exactly one value
     */
    public byte[] remainder() {
        return Arrays.copyOf(remainder, remainder.length);
    }

    public boolean hasRemainder() {
        return remainder.length > 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RlpDecoded other)) {
            return false;
        }
        return consumed == other.consumed
                && item.equals(other.item)
                && Arrays.equals(remainder, other.remainder);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * item.hashCode() + consumed) + Arrays.hashCode(remainder);
    }

    @Override
    public String toString() {
        return "RlpDecoded[item=" + item + ", consumed=" + consumed + ", remainder=" + remainder.length + " bytes]";
    }
}
