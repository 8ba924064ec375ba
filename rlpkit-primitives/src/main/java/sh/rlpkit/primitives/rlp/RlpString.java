// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.rlpkit.primitives.Hex;

/**
 * RLP leaf: an opaque byte string.
 *
 * <p>The package-private constructor wraps its array without copying and is
 * only used where the caller owns a fresh array (decoder, numeric helpers).
 * Public factories copy, and {@link #bytes()} returns a copy, so instances are
 * immutable from the outside.
 *
 * @since 1.0
 */
public final class RlpString implements RlpItem {

    private final byte[] bytes;
    private final int encodedLength;

    RlpString(final byte[] bytes) {
        this.bytes = Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length > RlpHeader.MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("RLP string too large to encode: " + bytes.length + " bytes");
        }
        this.encodedLength = selfEncoding(bytes)
                ? 1
                : RlpHeader.lengthOf(bytes.length) + bytes.length;
    }

    /**
     * Creates an {@link RlpString} holding a copy of the given bytes.
     *
     * @param bytes the bytes to wrap
     * @return the item
     */
    public static RlpString of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new RlpString(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Creates an {@link RlpString} from hex, with or without {@code 0x} prefix.
     *
     * @param hex the hex digits
     * @return the item
     */
    public static RlpString ofHex(final String hex) {
        return new RlpString(Hex.decode(hex));
    }

    /**
     * Creates an {@link RlpString} holding the canonical payload of a non-negative long.
     *
     * @param value the value
     * @return the item
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative: " + value);
        }
        return RlpNumeric.encodeLongUnsignedItem(value);
    }

    /**
     * Creates an {@link RlpString} holding the canonical payload of a non-negative {@link BigInteger}.
     *
     * @param value the value
     * @return the item
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final BigInteger value) {
        return RlpNumeric.encodeBigIntegerUnsignedItem(value);
    }

    /**
     * Returns a copy of the payload bytes.
     *
     * @return payload bytes
     */
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Payload length in bytes.
     *
     * @return number of payload bytes
     */
    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * Returns the payload byte at {@code index} without copying the payload.
     *
     * @param index byte index
     * @return the byte
     */
    public byte byteAt(final int index) {
        return bytes[index];
    }

    @Override
    public int encodedLength() {
        return encodedLength;
    }

    @Override
    public byte[] encode() {
        final byte[] out = new byte[encodedLength];
        writeTo(out, 0);
        return out;
    }

    /**
     * Writes header and payload into {@code out}.
     *
     * @return offset just past the written bytes
     */
    int writeTo(final byte[] out, final int offset) {
        if (selfEncoding(bytes)) {
            out[offset] = bytes[0];
            return offset + 1;
        }
        final int headerLength = RlpHeader.write(out, offset, bytes.length, false);
        System.arraycopy(bytes, 0, out, offset + headerLength, bytes.length);
        return offset + headerLength + bytes.length;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RlpString other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RlpString[" + Hex.encode(bytes) + "]";
    }

    private static boolean selfEncoding(final byte[] bytes) {
        return bytes.length == 1 && (bytes[0] & 0xFF) < RlpHeader.STRING_OFFSET;
    }
}
