// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical RLP decoder.
 *
 * <p>Nested lists are decoded with an explicit stack of open list frames
 * instead of native recursion, and the number of simultaneously open lists is
 * capped by {@link RlpDecoderConfig#maxDepth()}. Each element is parsed against
 * the span of its enclosing list, so an element that claims more bytes than
 * its parent has left fails with {@code INSUFFICIENT_BYTES}.
 *
 * <p>Instances are immutable and safe to share between threads.
 *
 * @since 1.0
 */
public final class RlpDecoder {

    private static final Logger LOG = LoggerFactory.getLogger("sh.rlpkit.rlp");

    private static final RlpDecoder DEFAULT = new RlpDecoder(RlpDecoderConfig.withDefaults());

    private final RlpDecoderConfig config;

    private RlpDecoder(final RlpDecoderConfig config) {
        this.config = config;
    }

    /**
     * Returns the shared decoder with default settings.
     *
     * @return default decoder
     */
    public static RlpDecoder defaults() {
        return DEFAULT;
    }

    /**
     * Creates a decoder with the given settings.
     *
     * @param config decoder settings
     * @return the decoder
     */
    public static RlpDecoder create(final RlpDecoderConfig config) {
        return new RlpDecoder(Objects.requireNonNull(config, "config cannot be null"));
    }

    public RlpDecoderConfig config() {
        return config;
    }

    /**
     * Decodes exactly one value spanning the whole buffer.
     *
     * @param encoded the encoded bytes
     * @return the decoded item
     * @throws RlpDecodingException on malformed or non-canonical input, or
     *                              {@code TRAILING_DATA} if bytes follow the value
     */
    public RlpItem decode(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        try {
            final Value root = decodeValue(encoded, 0, encoded.length);
            if (root.end != encoded.length) {
                throw RlpDecodingException.trailingData(root.end, encoded.length - root.end);
            }
            return root.item;
        } catch (RlpDecodingException e) {
            throw rejected(e, encoded.length);
        }
    }

    /**
     * Decodes one value from the front of the buffer.
     *
     * @param encoded the encoded bytes
     * @return the item and the bytes following it
     */
    public RlpDecoded decodePrefix(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        return decodePrefix(encoded, 0, encoded.length);
    }

    /**
     * Decodes one value starting at {@code offset}, reading no further than
     * {@code offset + length}.
     *
     * @param encoded the buffer
     * @param offset  index of the value's first byte
     * @param length  number of bytes available from {@code offset}
     * @return the item and the bytes in the region following it
     */
    public RlpDecoded decodePrefix(final byte[] encoded, final int offset, final int length) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        Objects.checkFromIndexSize(offset, length, encoded.length);
        final int limit = offset + length;
        try {
            final Value root = decodeValue(encoded, offset, limit);
            return new RlpDecoded(root.item, root.end - offset, Arrays.copyOfRange(encoded, root.end, limit));
        } catch (RlpDecodingException e) {
            throw rejected(e, length);
        }
    }

    /**
     * Decodes a single byte string spanning the whole buffer.
     *
     * @param encoded the encoded bytes
     * @return the payload bytes
     * @throws RlpDecodingException {@code TYPE_MISMATCH} if the header declares a list
     */
    public byte[] decodeString(final byte[] encoded) {
        expectKind(encoded, false);
        return decode(encoded).asString().bytes();
    }

    /**
     * Decodes a single list spanning the whole buffer.
     *
     * @param encoded the encoded bytes
     * @return the list
     * @throws RlpDecodingException {@code TYPE_MISMATCH} if the header declares a string
     */
    public RlpList decodeList(final byte[] encoded) {
        expectKind(encoded, true);
        return decode(encoded).asList();
    }

    /**
     * Decodes a list that must hold exactly {@code arity} elements.
     *
     * @param encoded the encoded bytes
     * @param arity   expected element count
     * @return the list
     * @throws RlpDecodingException {@code LENGTH_MISMATCH} if the count differs
     */
    public RlpList decodeFixedList(final byte[] encoded, final int arity) {
        final RlpList list = decodeList(encoded);
        try {
            return list.requireSize(arity);
        } catch (RlpDecodingException e) {
            throw rejected(e, encoded.length);
        }
    }

    private void expectKind(final byte[] encoded, final boolean list) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        try {
            final RlpHeader header = RlpHeader.parse(encoded, 0, encoded.length);
            if (header.list() != list) {
                throw RlpDecodingException.typeMismatch(0, list, encoded[0] & 0xFF);
            }
        } catch (RlpDecodingException e) {
            throw rejected(e, encoded.length);
        }
    }

    /**
     * Decodes the value starting at {@code offset}.
     */
    private Value decodeValue(final byte[] data, final int offset, final int limit) {
        final Deque<Frame> open = new ArrayDeque<>();
        int pos = offset;
        while (true) {
            final Frame top = open.peek();
            final RlpItem item;
            if (top != null && pos == top.end) {
                open.pop();
                item = RlpList.wrap(top.children);
            } else {
                final RlpHeader header = RlpHeader.parse(data, pos, top == null ? limit : top.end);
                if (header.list()) {
                    if (open.size() >= config.maxDepth()) {
                        throw RlpDecodingException.nestingTooDeep(pos, config.maxDepth());
                    }
                    pos += header.headerLength();
                    open.push(new Frame(pos + header.payloadLength()));
                    continue;
                }
                item = readString(data, pos, header);
                pos += header.totalLength();
            }

            final Frame parent = open.peek();
            if (parent == null) {
                return new Value(item, pos);
            }
            parent.children.add(item);
        }
    }

    private static RlpString readString(final byte[] data, final int offset, final RlpHeader header) {
        final int start = offset + header.headerLength();
        return new RlpString(Arrays.copyOfRange(data, start, start + header.payloadLength()));
    }

    private static RlpDecodingException rejected(final RlpDecodingException e, final int inputLength) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Rejected RLP input of {} byte(s): {} at offset {}", inputLength, e.kind(), e.offset());
        }
        return e;
    }

    /** A list whose span has not been fully consumed yet. */
    private static final class Frame {
        final int end;
        final List<RlpItem> children = new ArrayList<>();

        Frame(final int end) {
            this.end = end;
        }
    }

    /** A decoded value and the index just past it. */
    private record Value(RlpItem item, int end) {
    }
}
