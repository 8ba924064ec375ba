// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.codec;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

import sh.rlpkit.primitives.rlp.RlpItem;
import sh.rlpkit.primitives.rlp.RlpList;
import sh.rlpkit.primitives.rlp.RlpNumeric;
import sh.rlpkit.primitives.rlp.RlpString;

/**
 * Built-in {@link RlpCodec} implementations.
 *
 * <p>Integers are unsigned: they encode as their minimal big-endian magnitude
 * ({@code 0} as the empty string) and negative values are rejected with
 * {@link RlpAdapterException.Kind#UNSUPPORTED_VALUE}. Decoding rejects integer
 * payloads with a leading zero octet, so every integer has exactly one
 * encoding. {@link #BYTE} is the exception: it is a raw octet, so
 * {@code (byte) 0xff} encodes as 255.
 *
 * @since 1.0
 */
public final class RlpCodecs {

    /** {@code false} as the empty string, {@code true} as {@code 0x01}. */
    public static final RlpCodec<Boolean> BOOLEAN = new RlpCodec<>() {
        @Override
        public RlpItem encode(final Boolean value) {
            return RlpNumeric.encodeLongUnsignedItem(Objects.requireNonNull(value, "value") ? 1 : 0);
        }

        @Override
        public Boolean decode(final RlpItem item) {
            final long value = unsigned(item, 1, "boolean");
            if (value > 1) {
                throw RlpAdapterException.outOfRange("boolean", value);
            }
            return value == 1;
        }
    };

    /** A raw octet, read as its unsigned value 0 to 255. */
    public static final RlpCodec<Byte> BYTE = new RlpCodec<>() {
        @Override
        public RlpItem encode(final Byte value) {
            return RlpNumeric.encodeLongUnsignedItem(Objects.requireNonNull(value, "value") & 0xFF);
        }

        @Override
        public Byte decode(final RlpItem item) {
            return (byte) unsigned(item, Byte.BYTES, "byte");
        }
    };

    public static final RlpCodec<Short> SHORT = new RlpCodec<>() {
        @Override
        public RlpItem encode(final Short value) {
            return nonNegative(Objects.requireNonNull(value, "value"));
        }

        @Override
        public Short decode(final RlpItem item) {
            return (short) bounded(item, Short.BYTES, Short.MAX_VALUE, "short");
        }
    };

    public static final RlpCodec<Integer> INT = new RlpCodec<>() {
        @Override
        public RlpItem encode(final Integer value) {
            return nonNegative(Objects.requireNonNull(value, "value"));
        }

        @Override
        public Integer decode(final RlpItem item) {
            return (int) bounded(item, Integer.BYTES, Integer.MAX_VALUE, "int");
        }
    };

    public static final RlpCodec<Long> LONG = new RlpCodec<>() {
        @Override
        public RlpItem encode(final Long value) {
            return nonNegative(Objects.requireNonNull(value, "value"));
        }

        @Override
        public Long decode(final RlpItem item) {
            return bounded(item, Long.BYTES, Long.MAX_VALUE, "long");
        }
    };

    /** Arbitrary-size non-negative integers. */
    public static final RlpCodec<BigInteger> BIG_INTEGER = new RlpCodec<>() {
        @Override
        public RlpItem encode(final BigInteger value) {
            Objects.requireNonNull(value, "value");
            if (value.signum() < 0) {
                throw RlpAdapterException.unsupportedValue("RLP integers are unsigned, got " + value);
            }
            return RlpNumeric.encodeBigIntegerUnsignedItem(value);
        }

        @Override
        public BigInteger decode(final RlpItem item) {
            final byte[] bytes = canonicalMagnitude(item.asString(), "BigInteger");
            return new BigInteger(1, bytes);
        }
    };

    /** Byte arrays, passed through untouched. */
    public static final RlpCodec<byte[]> BYTES = new RlpCodec<>() {
        @Override
        public RlpItem encode(final byte[] value) {
            return RlpString.of(value);
        }

        @Override
        public byte[] decode(final RlpItem item) {
            return item.asString().bytes();
        }
    };

    private RlpCodecs() {
        // Utility class
    }

    /**
     * Text in the given charset. Characters the charset cannot represent, and
     * payloads that are not valid in it, fail with
     * {@link RlpAdapterException.Kind#MALFORMED_VALUE}.
     *
     * @param charset the charset
     * @return the codec
     */
    public static RlpCodec<String> string(final Charset charset) {
        Objects.requireNonNull(charset, "charset cannot be null");
        return new RlpCodec<>() {
            @Override
            public RlpItem encode(final String value) {
                return RlpString.of(encodeText(Objects.requireNonNull(value, "value"), charset));
            }

            @Override
            public String decode(final RlpItem item) {
                return decodeText(item.asString().bytes(), charset);
            }
        };
    }

    /**
     * A single {@code char} in the given charset.
     *
     * @param charset the charset
     * @return the codec
     */
    public static RlpCodec<Character> character(final Charset charset) {
        final RlpCodec<String> text = string(charset);
        return new RlpCodec<>() {
            @Override
            public RlpItem encode(final Character value) {
                return text.encode(String.valueOf(Objects.requireNonNull(value, "value").charValue()));
            }

            @Override
            public Character decode(final RlpItem item) {
                final String decoded = text.decode(item);
                if (decoded.length() != 1) {
                    throw RlpAdapterException.malformedValue(
                            "Expected a single character but decoded " + decoded.length(), null);
                }
                return decoded.charAt(0);
            }
        };
    }

    /**
     * A homogeneous list whose elements all use {@code elementCodec}.
     *
     * @param elementCodec codec for each element
     * @param <E>          element type
     * @return the codec; decoded lists are unmodifiable
     */
    public static <E> RlpCodec<List<E>> listOf(final RlpCodec<E> elementCodec) {
        Objects.requireNonNull(elementCodec, "elementCodec cannot be null");
        return new RlpCodec<>() {
            @Override
            public RlpItem encode(final List<E> value) {
                final List<RlpItem> items = new ArrayList<>(value.size());
                for (final E element : value) {
                    items.add(elementCodec.encode(element));
                }
                return RlpList.of(items);
            }

            @Override
            public List<E> decode(final RlpItem item) {
                final RlpList list = item.asList();
                final List<E> out = new ArrayList<>(list.size());
                for (final RlpItem element : list.items()) {
                    out.add(elementCodec.decode(element));
                }
                return Collections.unmodifiableList(out);
            }
        };
    }

    /**
     * An array whose elements all use {@code elementCodec}.
     *
     * @param elementCodec codec for each element
     * @param newArray     array constructor, e.g. {@code String[]::new}
     * @param <E>          element type
     * @return the codec
     */
    public static <E> RlpCodec<E[]> arrayOf(final RlpCodec<E> elementCodec, final IntFunction<E[]> newArray) {
        Objects.requireNonNull(newArray, "newArray cannot be null");
        return listOf(elementCodec).<E[]>map(
                list -> list.toArray(newArray.apply(list.size())),
                Arrays::asList);
    }

    private static RlpString nonNegative(final long value) {
        if (value < 0) {
            throw RlpAdapterException.unsupportedValue("RLP integers are unsigned, got " + value);
        }
        return RlpNumeric.encodeLongUnsignedItem(value);
    }

    private static long bounded(final RlpItem item, final int maxBytes, final long max, final String type) {
        final long value = unsigned(item, maxBytes, type);
        // an 8-byte payload with the top bit set is negative as a long
        if (value < 0 || value > max) {
            throw RlpAdapterException.outOfRange(type, value);
        }
        return value;
    }

    private static long unsigned(final RlpItem item, final int maxBytes, final String type) {
        final RlpString string = item.asString();
        if (string.length() > maxBytes) {
            throw RlpAdapterException.outOfRange(type, string.length());
        }
        final byte[] bytes = canonicalMagnitude(string, type);
        long value = 0;
        for (final byte b : bytes) {
            value = (value << 8) | (b & 0xFF);
        }
        return value;
    }

    private static byte[] canonicalMagnitude(final RlpString string, final String type) {
        if (!string.isEmpty() && string.byteAt(0) == 0) {
            throw RlpAdapterException.nonCanonicalValue(type);
        }
        return string.bytes();
    }

    private static byte[] encodeText(final String value, final Charset charset) {
        try {
            final ByteBuffer buffer = charset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(value));
            final byte[] out = new byte[buffer.remaining()];
            buffer.get(out);
            return out;
        } catch (CharacterCodingException e) {
            throw RlpAdapterException.malformedValue("Text cannot be encoded as " + charset.name(), e);
        }
    }

    private static String decodeText(final byte[] bytes, final Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw RlpAdapterException.malformedValue("Payload is not valid " + charset.name(), e);
        }
    }
}
