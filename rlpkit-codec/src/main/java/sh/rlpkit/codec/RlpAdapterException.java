// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.codec;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a host value cannot be mapped to or from its RLP form.
 *
 * <p>These failures belong to the adapter layer: the bytes were valid RLP (or
 * the value was never encoded), but they do not represent a value of the
 * requested Java type. Malformed RLP itself is reported by
 * {@link sh.rlpkit.primitives.rlp.RlpDecodingException}.
 *
 * @since 1.0
 */
public final class RlpAdapterException extends RuntimeException {

    /**
     * Categorizes the adapter failure.
     */
    public enum Kind {
        /** The host value has no RLP representation, e.g. a negative integer. */
        UNSUPPORTED_VALUE,
        /** The payload holds a number too large for the target type. */
        OUT_OF_RANGE,
        /** An integer payload starts with a zero octet. */
        NON_CANONICAL_VALUE,
        /** The payload is not a valid value of the target type, e.g. bad text. */
        MALFORMED_VALUE
    }

    private final Kind kind;

    public RlpAdapterException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public RlpAdapterException(final Kind kind, final String message, final @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    static RlpAdapterException unsupportedValue(final String message) {
        return new RlpAdapterException(Kind.UNSUPPORTED_VALUE, message);
    }

    static RlpAdapterException outOfRange(final String type, final int payloadLength) {
        return new RlpAdapterException(Kind.OUT_OF_RANGE,
                payloadLength + "-byte payload does not fit in " + type);
    }

    static RlpAdapterException outOfRange(final String type, final long value) {
        return new RlpAdapterException(Kind.OUT_OF_RANGE,
                "Value " + Long.toUnsignedString(value) + " does not fit in " + type);
    }

    static RlpAdapterException nonCanonicalValue(final String type) {
        return new RlpAdapterException(Kind.NON_CANONICAL_VALUE,
                type + " payload has a leading zero byte");
    }

    static RlpAdapterException malformedValue(final String message, final @Nullable Throwable cause) {
        return new RlpAdapterException(Kind.MALFORMED_VALUE, message, cause);
    }
}
