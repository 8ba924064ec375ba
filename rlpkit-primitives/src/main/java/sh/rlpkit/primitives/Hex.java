// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives;

import java.util.Arrays;

/**
 * Lowercase hex rendering and lenient parsing of byte arrays.
 *
 * <p>Used for diagnostics ({@code toString} of RLP items, exception messages)
 * and for writing test vectors. Parsing accepts an optional {@code 0x} prefix
 * and either letter case.
 *
 * @since 1.0
 */
public final class Hex {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Parses a hex string, with or without {@code 0x} prefix.
     *
     * @param hex the string to parse
     * @return the decoded bytes, empty for {@code ""} or {@code "0x"}
     * @throws IllegalArgumentException if {@code hex} is null, has odd length or
     *                                  contains a non-hex character
     */
    public static byte[] decode(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hex) ? 2 : 0;
        final int digits = hex.length() - start;
        if ((digits & 1) != 0) {
            throw new IllegalArgumentException("hex string must have even length: " + hex);
        }

        final byte[] out = new byte[digits >>> 1];
        for (int i = 0, pos = start; i < out.length; i++, pos += 2) {
            out[i] = (byte) ((nibble(hex, pos) << 4) | nibble(hex, pos + 1));
        }
        return out;
    }

    /**
     * Renders bytes as lowercase hex with a {@code 0x} prefix.
     *
     * @param bytes the bytes to render
     * @return {@code 0x}-prefixed hex
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Renders bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to render
     * @return bare hex digits
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (final byte b : bytes) {
            sb.append(DIGITS[(b >>> 4) & 0x0F]).append(DIGITS[b & 0x0F]);
        }
        return sb.toString();
    }

    /**
     * Renders a single octet as {@code 0xNN}, handy for header bytes in messages.
     *
     * @param value octet value, only the low 8 bits are used
     * @return four-character hex form
     */
    public static String encodeByte(final int value) {
        return "0x" + DIGITS[(value >>> 4) & 0x0F] + DIGITS[value & 0x0F];
    }

    /**
     * Returns {@code true} when the string starts with {@code 0x} or {@code 0X}.
     *
     * @param hex the string to check
     * @return whether the prefix is present
     */
    public static boolean hasPrefix(final String hex) {
        return hex != null
                && hex.length() >= 2
                && hex.charAt(0) == '0'
                && (hex.charAt(1) == 'x' || hex.charAt(1) == 'X');
    }

    private static int nibble(final String hex, final int pos) {
        final char c = hex.charAt(pos);
        final int digit = c < NIBBLE_LOOKUP.length ? NIBBLE_LOOKUP[c] : -1;
        if (digit < 0) {
            throw new IllegalArgumentException("Invalid hex character at index " + pos + " in: " + hex);
        }
        return digit;
    }
}
