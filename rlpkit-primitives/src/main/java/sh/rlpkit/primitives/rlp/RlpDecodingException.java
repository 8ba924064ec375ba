// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import sh.rlpkit.primitives.Hex;

/**
 * Thrown when input bytes are not a valid canonical RLP encoding.
 *
 * <p>Decoding stops at the first violation; no partially decoded value is ever
 * returned. {@link #kind()} tells callers what went wrong and {@link #offset()}
 * where, relative to the start of the buffer handed to the decoder.
 *
 * <pre>{@code
 * try {
 *     RlpItem item = Rlp.decode(bytes);
 * } catch (RlpDecodingException e) {
 *     if (e.kind() == RlpDecodingException.Kind.NON_CANONICAL) {
 *         // reject the peer
 *     }
 * }
 * }</pre>
 *
 * @since 1.0
 */
public final class RlpDecodingException extends RuntimeException {

    /**
     * Categorizes the decoding failure.
     */
    public enum Kind {
        /** A header or payload declares more bytes than are available. */
        INSUFFICIENT_BYTES,
        /** A header is valid but not the shortest form for its payload. */
        NON_CANONICAL,
        /** A list was found where a string was expected, or the reverse. */
        TYPE_MISMATCH,
        /** A fixed-arity list holds a different number of elements than expected. */
        LENGTH_MISMATCH,
        /** Bytes remain after a value that should have ended its input or span. */
        TRAILING_DATA,
        /** Lists are nested deeper than the decoder's configured limit. */
        NESTING_TOO_DEEP
    }

    private final Kind kind;
    private final long offset;

    /**
     * Creates a new exception.
     *
     * @param kind    the failure category
     * @param offset  byte offset at which the violation was detected
     * @param message the detail message
     */
    public RlpDecodingException(final Kind kind, final long offset, final String message) {
        super(message + " (at offset " + offset + ")");
        this.kind = kind;
        this.offset = offset;
    }

    public Kind kind() {
        return kind;
    }

    public long offset() {
        return offset;
    }

    static RlpDecodingException insufficientBytes(final long offset, final long needed, final long available) {
        return new RlpDecodingException(Kind.INSUFFICIENT_BYTES, offset,
                "Need " + Long.toUnsignedString(needed) + " byte(s) but only " + available + " available");
    }

    static RlpDecodingException nonCanonical(final long offset, final String reason) {
        return new RlpDecodingException(Kind.NON_CANONICAL, offset, "Non-canonical RLP: " + reason);
    }

    static RlpDecodingException typeMismatch(final long offset, final boolean expectedList) {
        return new RlpDecodingException(Kind.TYPE_MISMATCH, offset,
                "Expected RLP " + (expectedList ? "list" : "string")
                        + " but found " + (expectedList ? "string" : "list"));
    }

    static RlpDecodingException typeMismatch(final long offset, final boolean expectedList, final int prefix) {
        return new RlpDecodingException(Kind.TYPE_MISMATCH, offset,
                "Expected RLP " + (expectedList ? "list" : "string") + " but header " + Hex.encodeByte(prefix)
                        + " declares a " + (expectedList ? "string" : "list"));
    }

    static RlpDecodingException lengthMismatch(final int expected, final int actual) {
        return new RlpDecodingException(Kind.LENGTH_MISMATCH, 0,
                "Invalid list length (expected: " + expected + ", actual: " + actual + ")");
    }

    static RlpDecodingException trailingData(final long offset, final long remaining) {
        return new RlpDecodingException(Kind.TRAILING_DATA, offset,
                remaining + " trailing byte(s) after RLP value");
    }

    static RlpDecodingException nestingTooDeep(final long offset, final int maxDepth) {
        return new RlpDecodingException(Kind.NESTING_TOO_DEEP, offset,
                "List nesting exceeds maximum depth " + maxDepth);
    }
}
