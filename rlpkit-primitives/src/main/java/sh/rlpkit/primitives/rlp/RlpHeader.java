// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import java.util.Objects;

import sh.rlpkit.primitives.Hex;

/**
 * The length-prefix header of one RLP value.
 *
 * <p>Header grammar, by first byte {@code b}:
 * <pre>
 * 0x00..0x7f  the byte is a one-byte string on its own, no header
 * 0x80..0xb7  string, payload length b - 0x80 (0 to 55)
 * 0xb8..0xbf  string, next (b - 0xb7) bytes hold the big-endian payload length
 * 0xc0..0xf7  list, payload length b - 0xc0 (0 to 55)
 * 0xf8..0xff  list, next (b - 0xf7) bytes hold the big-endian payload length
 * </pre>
 *
 * <p>Only canonical headers are produced and accepted: the short form whenever
 * the payload is at most 55 bytes, no leading zero octet in a long-form length,
 * and no header at all for a single byte below {@code 0x80}.
 *
 * @param list          whether the header introduces a list
 * @param payloadLength number of payload bytes following the header
 * @param headerLength  number of header bytes, 0 for a self-encoded byte
 * @since 1.0
 */
public record RlpHeader(boolean list, int payloadLength, int headerLength) {

    /** Largest payload that still uses the single-byte header form. */
    public static final int SHORT_PAYLOAD_MAX = 55;

    static final int STRING_OFFSET = 0x80;
    static final int LONG_STRING_OFFSET = 0xB7;
    static final int LIST_OFFSET = 0xC0;
    static final int LONG_LIST_OFFSET = 0xF7;

    /**
     * Largest payload an item may carry so that header plus payload still fits
     * in a Java array.
     */
    static final int MAX_PAYLOAD_LENGTH = Integer.MAX_VALUE - 16;

    public RlpHeader {
        if (payloadLength < 0) {
            throw new IllegalArgumentException("payloadLength cannot be negative: " + payloadLength);
        }
        if (headerLength < 0 || headerLength > 9) {
            throw new IllegalArgumentException("headerLength must be in range 0-9: " + headerLength);
        }
    }

    /**
     * Header bytes plus payload bytes.
     *
     * @return the total encoded length of the value
     */
    public int totalLength() {
        return headerLength + payloadLength;
    }

    /**
     * Size of the canonical explicit header for a payload length.
     *
     * <p>The self-encoding case is decided by the leaf codec, which can see the
     * payload byte; this method always assumes a header is written.
     *
     * @param payloadLength non-negative payload length
     * @return 1 for short payloads, otherwise 1 plus the length-of-length
     */
    public static int lengthOf(final int payloadLength) {
        if (payloadLength < 0) {
            throw new IllegalArgumentException("payloadLength cannot be negative: " + payloadLength);
        }
        if (payloadLength <= SHORT_PAYLOAD_MAX) {
            return 1;
        }
        return 1 + RlpNumeric.minimalByteLength(payloadLength);
    }

    /**
     * Returns the canonical explicit header for {@code (payloadLength, list)}.
     *
     * @param payloadLength non-negative payload length
     * @param list          whether the payload is a list
     * @return header bytes
     */
    public static byte[] encode(final int payloadLength, final boolean list) {
        final byte[] out = new byte[lengthOf(payloadLength)];
        write(out, 0, payloadLength, list);
        return out;
    }

    /**
     * Writes the canonical explicit header into {@code out}.
     *
     * @return the number of bytes written
     */
    static int write(final byte[] out, final int offset, final int payloadLength, final boolean list) {
        if (payloadLength <= SHORT_PAYLOAD_MAX) {
            out[offset] = (byte) ((list ? LIST_OFFSET : STRING_OFFSET) + payloadLength);
            return 1;
        }
        final int lengthOfLength = RlpNumeric.minimalByteLength(payloadLength);
        out[offset] = (byte) ((list ? LONG_LIST_OFFSET : LONG_STRING_OFFSET) + lengthOfLength);
        int remaining = payloadLength;
        for (int i = lengthOfLength; i >= 1; i--) {
            out[offset + i] = (byte) remaining;
            remaining >>>= 8;
        }
        return 1 + lengthOfLength;
    }

    /**
     * Parses the header at {@code offset} and checks that the whole value fits
     * before {@code limit}.
     *
     * @param data   input buffer
     * @param offset index of the first header byte
     * @param limit  exclusive end of the region the value must fit in
     * @return the parsed header
     * @throws RlpDecodingException {@code INSUFFICIENT_BYTES} if the header or
     *                              payload runs past {@code limit},
     *                              {@code NON_CANONICAL} if the header is not the
     *                              canonical one for its payload
     */
    public static RlpHeader parse(final byte[] data, final int offset, final int limit) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.checkFromToIndex(offset, limit, data.length);

        final int available = limit - offset;
        if (available == 0) {
            throw RlpDecodingException.insufficientBytes(offset, 1, 0);
        }

        final int prefix = data[offset] & 0xFF;
        if (prefix < STRING_OFFSET) {
            return new RlpHeader(false, 1, 0);
        }

        final boolean list = prefix >= LIST_OFFSET;
        final int shortBase = list ? LIST_OFFSET : STRING_OFFSET;
        final int longBase = list ? LONG_LIST_OFFSET : LONG_STRING_OFFSET;

        if (prefix <= longBase) {
            final int length = prefix - shortBase;
            if (length > available - 1) {
                throw RlpDecodingException.insufficientBytes(offset + 1, length, available - 1L);
            }
            if (!list && length == 1 && (data[offset + 1] & 0xFF) < STRING_OFFSET) {
                throw RlpDecodingException.nonCanonical(offset,
                        "single byte " + Hex.encodeByte(data[offset + 1]) + " must not carry a header");
            }
            return new RlpHeader(list, length, 1);
        }

        final int lengthOfLength = prefix - longBase;
        if (lengthOfLength > available - 1) {
            throw RlpDecodingException.insufficientBytes(offset + 1, lengthOfLength, available - 1L);
        }
        if (data[offset + 1] == 0) {
            throw RlpDecodingException.nonCanonical(offset + 1, "length field has a leading zero byte");
        }

        long length = 0;
        for (int i = 1; i <= lengthOfLength; i++) {
            length = (length << 8) | (data[offset + i] & 0xFF);
        }
        if (Long.compareUnsigned(length, SHORT_PAYLOAD_MAX) <= 0) {
            throw RlpDecodingException.nonCanonical(offset,
                    "long-form header " + Hex.encodeByte(prefix) + " for a payload of " + length + " byte(s)");
        }

        final int headerLength = 1 + lengthOfLength;
        final long remaining = (long) available - headerLength;
        if (Long.compareUnsigned(length, remaining) > 0) {
            throw RlpDecodingException.insufficientBytes(offset + headerLength, length, remaining);
        }
        return new RlpHeader(list, (int) length, headerLength);
    }
}
