// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

/**
 * A value in the RLP data model: either a byte string or a list of items.
 *
 * <p>Items are immutable and know their exact encoded size up front.
 *
 * @since 1.0
 */
public sealed interface RlpItem permits RlpString, RlpList {

    /**
     * Encodes this item into RLP bytes.
     *
     * @return a fresh array holding the canonical encoding
     */
    byte[] encode();

    /**
     * Number of bytes {@link #encode()} produces, header included.
     *
     * @return encoded length
     */
    int encodedLength();

    /**
     * Narrows this item to a string.
     *
     * @return this item as an {@link RlpString}
     * @throws RlpDecodingException {@code TYPE_MISMATCH} if this is a list
     */
    default RlpString asString() {
        if (this instanceof RlpString string) {
            return string;
        }
        throw RlpDecodingException.typeMismatch(0, false);
    }

    /**
     * Narrows this item to a list.
     *
     * @return this item as an {@link RlpList}
     * @throws RlpDecodingException {@code TYPE_MISMATCH} if this is a string
     */
    default RlpList asList() {
        if (this instanceof RlpList list) {
            return list;
        }
        throw RlpDecodingException.typeMismatch(0, true);
    }
}
