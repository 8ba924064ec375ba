// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Canonical integer payloads for RLP.
 *
 * <p>RLP has no integer type: an integer travels as the byte string holding its
 * big-endian magnitude with no leading zero octets, and zero travels as the
 * empty string. These helpers produce that payload; the header framing is left
 * to {@link Rlp#encodeString(byte[])}. The decoder never interprets integers,
 * that is the job of whoever reads the resulting {@link RlpString}.
 *
 * <p>{@code long} arguments are interpreted as unsigned 64-bit values, so
 * {@code -1L} is the eight-octet payload {@code ffffffffffffffff}.
 *
 * @since 1.0
 */
public final class RlpNumeric {

    private static final byte[] EMPTY = new byte[0];

    private RlpNumeric() {
        // Utility class
    }

    /**
     * Number of big-endian octets needed for {@code value} without leading zeros.
     *
     * @param value unsigned 64-bit value
     * @return 0 for zero, otherwise 1 to 8
     */
    public static int minimalByteLength(final long value) {
        final int bits = Long.SIZE - Long.numberOfLeadingZeros(value);
        return (bits + 7) >>> 3;
    }

    /**
     * Canonical payload of an unsigned 64-bit value.
     *
     * <p>{@code 0 -> []}, {@code 15 -> [0x0f]}, {@code 1024 -> [0x04, 0x00]}.
     *
     * @param value unsigned 64-bit value
     * @return a fresh array of {@link #minimalByteLength(long)} bytes
     */
    public static byte[] toMinimalBytes(final long value) {
        final int size = minimalByteLength(value);
        if (size == 0) {
            return EMPTY.clone();
        }
        final byte[] out = new byte[size];
        long tmp = value;
        for (int i = size - 1; i >= 0; i--) {
            out[i] = (byte) tmp;
            tmp >>>= 8;
        }
        return out;
    }

    /**
     * Canonical payload of a non-negative {@link BigInteger}.
     *
     * @param value the value
     * @return big-endian magnitude without a sign octet, empty for zero
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static byte[] toMinimalBytes(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative: " + value);
        }
        if (value.signum() == 0) {
            return EMPTY.clone();
        }
        // toByteArray() is two's complement and may carry one leading 0x00 sign octet
        final byte[] twosComp = value.toByteArray();
        if (twosComp[0] != 0) {
            return twosComp;
        }
        final byte[] out = new byte[twosComp.length - 1];
        System.arraycopy(twosComp, 1, out, 0, out.length);
        return out;
    }

    /**
     * Encodes an unsigned 64-bit value straight to RLP bytes.
     *
     * <p>0 encodes as {@code 0x80}, 1 to 127 as themselves, anything larger as a
     * short string.
     *
     * @param value unsigned 64-bit value
     * @return encoded bytes
     */
    public static byte[] encodeLongUnsigned(final long value) {
        return Rlp.encodeString(toMinimalBytes(value));
    }

    /**
     * Wraps the canonical payload of an unsigned 64-bit value in an {@link RlpString}.
     *
     * @param value unsigned 64-bit value
     * @return the item
     */
    public static RlpString encodeLongUnsignedItem(final long value) {
        return new RlpString(toMinimalBytes(value));
    }

    /**
     * Encodes a non-negative {@link BigInteger} straight to RLP bytes.
     *
     * @param value the value
     * @return encoded bytes
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static byte[] encodeBigIntegerUnsigned(final BigInteger value) {
        return Rlp.encodeString(toMinimalBytes(value));
    }

    /**
     * Wraps the canonical payload of a non-negative {@link BigInteger} in an {@link RlpString}.
     *
     * @param value the value
     * @return the item
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString encodeBigIntegerUnsignedItem(final BigInteger value) {
        return new RlpString(toMinimalBytes(value));
    }
}
