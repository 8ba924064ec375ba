// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Entry points for encoding and decoding Recursive Length Prefix (RLP) data.
 *
 * <p>Encoding is total: every {@link RlpItem} has exactly one canonical
 * encoding, written into a single array sized from the item's cached
 * {@link RlpItem#encodedLength()}. Nested lists are walked with an explicit
 * work stack, so nesting depth is bounded by heap rather than thread stack.
 *
 * <p>Decoding methods use {@link RlpDecoder#defaults()}; build an
 * {@link RlpDecoder} from an {@link RlpDecoderConfig} for other limits.
 *
 * @see <a href=
 *      "https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">Ethereum
 *      RLP Specification</a>
 * @since 1.0
 */
public final class Rlp {

    private Rlp() {
        // Utility class
    }

    /**
     * Encodes the provided item to RLP bytes.
     *
     * @param item the item to encode
     * @return encoded bytes
     */
    public static byte[] encode(final RlpItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        final byte[] out = new byte[item.encodedLength()];
        write(item, out);
        return out;
    }

    /**
     * Encodes a byte string: the canonical header followed by the bytes verbatim,
     * or the byte alone when it is a single byte below {@code 0x80}.
     *
     * @param bytes the raw bytes to encode
     * @return encoded bytes
     */
    public static byte[] encodeString(final byte[] bytes) {
        return new RlpString(bytes).encode();
    }

    /**
     * Encodes a list: every item encoded in order, concatenated, and prefixed
     * with the list header for the concatenation's length.
     *
     * @param items the items to encode
     * @return encoded bytes
     */
    public static byte[] encodeList(final List<? extends RlpItem> items) {
        return RlpList.of(items).encode();
    }

    /**
     * Decodes exactly one value spanning the whole buffer.
     *
     * @param encoded the encoded bytes
     * @return decoded item
     * @throws RlpDecodingException if the input is malformed, non-canonical, or
     *                              followed by trailing bytes
     */
    public static RlpItem decode(final byte[] encoded) {
        return RlpDecoder.defaults().decode(encoded);
    }

    /**
     * Decodes one value from the front of the buffer and returns it with the
     * unconsumed bytes.
     *
     * @param encoded the encoded bytes
     * @return the item and the remainder
     */
    public static RlpDecoded decodePrefix(final byte[] encoded) {
        return RlpDecoder.defaults().decodePrefix(encoded);
    }

    /**
     * Decodes a byte string spanning the whole buffer.
     *
     * @param encoded the encoded bytes
     * @return the payload
     * @throws RlpDecodingException {@code TYPE_MISMATCH} if the input is a list
     */
    public static byte[] decodeString(final byte[] encoded) {
        return RlpDecoder.defaults().decodeString(encoded);
    }

    /**
     * Decodes a list spanning the whole buffer.
     *
     * @param encoded the encoded bytes representing a list
     * @return decoded list
     * @throws RlpDecodingException {@code TYPE_MISMATCH} if the input is a string
     */
    public static RlpList decodeList(final byte[] encoded) {
        return RlpDecoder.defaults().decodeList(encoded);
    }

    /**
     * Decodes a list that must have exactly {@code arity} elements.
     *
     * @param encoded the encoded bytes
     * @param arity   expected element count
     * @return decoded list
     * @throws RlpDecodingException {@code LENGTH_MISMATCH} if the count differs
     */
    public static RlpList decodeFixedList(final byte[] encoded, final int arity) {
        return RlpDecoder.defaults().decodeFixedList(encoded, arity);
    }

    private static void write(final RlpItem root, final byte[] out) {
        final Deque<RlpItem> pending = new ArrayDeque<>();
        pending.push(root);
        int pos = 0;
        while (!pending.isEmpty()) {
            final RlpItem item = pending.pop();
            if (item instanceof RlpString string) {
                pos = string.writeTo(out, pos);
                continue;
            }
            // list header sizes are known up front, so write pre-order
            final RlpList list = (RlpList) item;
            pos += RlpHeader.write(out, pos, list.payloadLength(), true);
            for (int i = list.size() - 1; i >= 0; i--) {
                pending.push(list.get(i));
            }
        }
    }
}
