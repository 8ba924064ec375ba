// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import sh.rlpkit.primitives.Hex;

/**
 * RLP node: an ordered, possibly empty list of items.
 *
 * <p>The payload length is summed from the children once, at construction.
 * Since children always exist before their parent, building any tree costs a
 * single pass and no method of this class recurses into nested lists, so very
 * deep trees can be encoded and compared without exhausting the stack.
 *
 * @since 1.0
 */
public final class RlpList implements RlpItem {

    private static final RlpList EMPTY = new RlpList(List.of(), 0);

    private final List<RlpItem> items;
    private final int payloadLength;
    private final int encodedLength;

    /** Lazily computed; racing threads compute the same value. */
    private int hash;

    private RlpList(final List<RlpItem> items, final int payloadLength) {
        this.items = items;
        this.payloadLength = payloadLength;
        this.encodedLength = RlpHeader.lengthOf(payloadLength) + payloadLength;
    }

    /**
     * Creates an {@link RlpList} holding a copy of the given items.
     *
     * @param items the items, none of them null
     * @return the list
     * @throws IllegalArgumentException if an item is null or the encoding would
     *                                  not fit in a Java array
     */
    public static RlpList of(final List<? extends RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");
        if (items.isEmpty()) {
            return EMPTY;
        }
        return wrap(new ArrayList<>(items));
    }

    /**
     * Creates an {@link RlpList} from the given items.
     *
     * @param items the items, none of them null
     * @return the list
     */
    public static RlpList of(final RlpItem... items) {
        Objects.requireNonNull(items, "items cannot be null");
        return of(Arrays.asList(items));
    }

    /**
     * Takes ownership of {@code items} without copying.
     */
    static RlpList wrap(final List<RlpItem> items) {
        long payload = 0;
        for (final RlpItem item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null values");
            }
            payload += item.encodedLength();
        }
        if (payload > RlpHeader.MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("RLP list too large to encode: " + payload + " payload bytes");
        }
        return new RlpList(Collections.unmodifiableList(items), (int) payload);
    }

    /**
     * Unmodifiable view of the items, in order.
     *
     * @return the items
     */
    public List<RlpItem> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public RlpItem get(final int index) {
        return items.get(index);
    }

    /**
     * Length of the concatenated encodings of the items.
     *
     * @return payload length in bytes
     */
    public int payloadLength() {
        return payloadLength;
    }

    /**
     * Checks that this list has exactly {@code arity} elements, as a fixed-arity
     * structure must.
     *
     * @param arity expected number of elements
     * @return this list
     * @throws RlpDecodingException {@code LENGTH_MISMATCH} naming expected and actual counts
     */
    public RlpList requireSize(final int arity) {
        if (arity < 0) {
            throw new IllegalArgumentException("arity cannot be negative: " + arity);
        }
        if (items.size() != arity) {
            throw RlpDecodingException.lengthMismatch(arity, items.size());
        }
        return this;
    }

    @Override
    public int encodedLength() {
        return encodedLength;
    }

    @Override
    public byte[] encode() {
        return Rlp.encode(this);
    }

    /**
     * Structural equality. Canonical encodings are unique per value, so two
     * lists are equal exactly when their encodings are.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RlpList other)) {
            return false;
        }
        if (encodedLength != other.encodedLength || items.size() != other.items.size()) {
            return false;
        }
        return Arrays.equals(encode(), other.encode());
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Arrays.hashCode(encode());
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return "RlpList[size=" + items.size() + ", " + Hex.encode(encode()) + "]";
    }
}
