// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.codec;

import java.util.Objects;
import java.util.function.Function;

import sh.rlpkit.primitives.rlp.Rlp;
import sh.rlpkit.primitives.rlp.RlpDecoder;
import sh.rlpkit.primitives.rlp.RlpItem;

/**
 * Two-way mapping between a Java type and the RLP data model.
 *
 * <p>Codecs are passed explicitly; there is no lookup by type. Built-in codecs
 * live in {@link RlpCodecs}, fixed-arity records use {@link RlpStructCodec}.
 *
 * <pre>{@code
 * RlpCodec<List<String>> names = RlpCodecs.listOf(RlpCodecs.string(StandardCharsets.UTF_8));
 * byte[] wire = names.encodeToBytes(List.of("cat", "dog"));   // c88363617483646f67
 * List<String> back = names.decodeFromBytes(wire);
 * }</pre>
 *
 * @param <T> the Java type
 * @since 1.0
 */
public interface RlpCodec<T> {

    /**
     * Maps a value to its RLP item.
     *
     * @param value the value, never null
     * @return the item
     * @throws RlpAdapterException if the value has no RLP representation
     */
    RlpItem encode(T value);

    /**
     * Maps an RLP item back to a value.
     *
     * @param item the item
     * @return the value
     * @throws RlpAdapterException if the item does not hold a valid value
     * @throws sh.rlpkit.primitives.rlp.RlpDecodingException {@code TYPE_MISMATCH}
     *         or {@code LENGTH_MISMATCH} if the item has the wrong shape
     */
    T decode(RlpItem item);

    /**
     * Encodes a value straight to RLP bytes.
     *
     * @param value the value
     * @return encoded bytes
     */
    default byte[] encodeToBytes(final T value) {
        return Rlp.encode(encode(value));
    }

    /**
     * Decodes a value from bytes holding exactly one RLP item.
     *
     * @param encoded encoded bytes
     * @return the value
     */
    default T decodeFromBytes(final byte[] encoded) {
        return decode(Rlp.decode(encoded));
    }

    /**
     * Decodes a value using a specific decoder, e.g. one with a tighter depth limit.
     *
     * @param encoded encoded bytes
     * @param decoder the decoder
     * @return the value
     */
    default T decodeFromBytes(final byte[] encoded, final RlpDecoder decoder) {
        return decode(decoder.decode(encoded));
    }

    /**
     * Derives a codec for another type through a pair of conversions.
     *
     * @param onDecode converts a decoded value to the new type
     * @param onEncode converts a value of the new type back before encoding
     * @param <R>      the new type
     * @return the derived codec
     */
    default <R> RlpCodec<R> map(
            final Function<? super T, ? extends R> onDecode,
            final Function<? super R, ? extends T> onEncode) {
        Objects.requireNonNull(onDecode, "onDecode");
        Objects.requireNonNull(onEncode, "onEncode");
        final RlpCodec<T> self = this;
        return new RlpCodec<>() {
            @Override
            public RlpItem encode(final R value) {
                return self.encode(onEncode.apply(value));
            }

            @Override
            public R decode(final RlpItem item) {
                return onDecode.apply(self.decode(item));
            }
        };
    }
}
