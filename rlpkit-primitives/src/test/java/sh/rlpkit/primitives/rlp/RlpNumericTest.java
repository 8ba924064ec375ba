// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.rlpkit.primitives.Hex;

/**
 * Tests for {@link RlpNumeric} boundary values and error cases.
 */
class RlpNumericTest {

    @Nested
    @DisplayName("minimal big-endian payloads")
    class MinimalBytes {

        @Test
        @DisplayName("byte length grows one octet per 8 bits")
        void testMinimalByteLength() {
            assertEquals(0, RlpNumeric.minimalByteLength(0L));
            assertEquals(1, RlpNumeric.minimalByteLength(1L));
            assertEquals(1, RlpNumeric.minimalByteLength(255L));
            assertEquals(2, RlpNumeric.minimalByteLength(256L));
            assertEquals(2, RlpNumeric.minimalByteLength(1024L));
            assertEquals(8, RlpNumeric.minimalByteLength(Long.MAX_VALUE));
            assertEquals(8, RlpNumeric.minimalByteLength(-1L));
        }

        @Test
        void testLongPayloads() {
            assertArrayEquals(new byte[0], RlpNumeric.toMinimalBytes(0L));
            assertArrayEquals(new byte[] {0x0f}, RlpNumeric.toMinimalBytes(15L));
            assertArrayEquals(new byte[] {0x04, 0x00}, RlpNumeric.toMinimalBytes(1024L));
        }

        @Test
        @DisplayName("negative longs are read as unsigned 64-bit values")
        void testLongIsUnsigned() {
            assertEquals("ffffffffffffffff", Hex.encodeNoPrefix(RlpNumeric.toMinimalBytes(-1L)));
            assertEquals("8000000000000000", Hex.encodeNoPrefix(RlpNumeric.toMinimalBytes(Long.MIN_VALUE)));
        }

        @Test
        @DisplayName("BigInteger payload drops the two's complement sign octet")
        void testBigIntegerDropsSignOctet() {
            assertArrayEquals(new byte[0], RlpNumeric.toMinimalBytes(BigInteger.ZERO));
            assertArrayEquals(new byte[] {(byte) 0x80}, RlpNumeric.toMinimalBytes(BigInteger.valueOf(128)));
            assertArrayEquals(new byte[] {(byte) 0xff, (byte) 0xff},
                    RlpNumeric.toMinimalBytes(BigInteger.valueOf(65535)));
        }

        @Test
        void testZeroPayloadIsFreshArray() {
            assertNotSame(RlpNumeric.toMinimalBytes(0L), RlpNumeric.toMinimalBytes(0L));
        }
    }

    @Nested
    @DisplayName("encodeLongUnsigned boundary values")
    class EncodeLongUnsignedBoundary {

        @Test
        @DisplayName("0 encodes as empty string (0x80)")
        void testZero() {
            assertEquals("80", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(0L)));
        }

        @Test
        @DisplayName("127 encodes as single byte (0x7f)")
        void test127() {
            assertEquals("7f", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(127L)));
        }

        @Test
        @DisplayName("128 encodes as string with length prefix (0x8180)")
        void test128() {
            assertEquals("8180", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(128L)));
        }

        @Test
        @DisplayName("256 encodes as two-byte string (0x820100)")
        void test256() {
            assertEquals("820100", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(256L)));
        }

        @Test
        @DisplayName("Long.MAX_VALUE encodes correctly")
        void testLongMaxValue() {
            assertEquals("887fffffffffffffff", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(Long.MAX_VALUE)));
        }

        @Test
        @DisplayName("-1 encodes as the largest unsigned 64-bit value")
        void testAllOnes() {
            assertEquals("88ffffffffffffffff", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(-1L)));
        }
    }

    @Nested
    @DisplayName("encodeLongUnsignedItem")
    class EncodeLongUnsignedItem {

        @Test
        @DisplayName("0 produces empty RlpString")
        void testZero() {
            final RlpString item = RlpNumeric.encodeLongUnsignedItem(0L);
            assertTrue(item.isEmpty());
            assertEquals(1, item.encodedLength());
        }

        @Test
        @DisplayName("128 produces single-byte RlpString with value 0x80")
        void test128() {
            final RlpString item = RlpNumeric.encodeLongUnsignedItem(128L);
            assertArrayEquals(new byte[] {(byte) 0x80}, item.bytes());
            assertEquals(RlpString.of(128L), item);
        }
    }

    @Nested
    @DisplayName("encodeBigIntegerUnsigned")
    class EncodeBigIntegerUnsigned {

        @Test
        @DisplayName("0 encodes as empty string (0x80)")
        void testZero() {
            assertEquals("80", Hex.encodeNoPrefix(RlpNumeric.encodeBigIntegerUnsigned(BigInteger.ZERO)));
        }

        @Test
        @DisplayName("Value larger than Long.MAX_VALUE encodes correctly")
        void testBeyondLongMaxValue() {
            final BigInteger beyondMax = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
            assertEquals("888000000000000000", Hex.encodeNoPrefix(RlpNumeric.encodeBigIntegerUnsigned(beyondMax)));
        }

        @Test
        @DisplayName("2^256 encodes as a 33-byte string")
        void test2Pow256() {
            final byte[] encoded = RlpNumeric.encodeBigIntegerUnsigned(BigInteger.TWO.pow(256));
            assertEquals(34, encoded.length);
            assertEquals((byte) 0xa1, encoded[0]);
            assertEquals(0x01, encoded[1]);
        }

        @Test
        @DisplayName("Item form matches byte form")
        void testItemMatchesBytes() {
            final BigInteger value = new BigInteger("83729609699884896815286331701780722");
            assertArrayEquals(
                    RlpNumeric.encodeBigIntegerUnsigned(value),
                    RlpNumeric.encodeBigIntegerUnsignedItem(value).encode());
            assertEquals("8f102030405060708090a0b0c0d0e0f2",
                    Hex.encodeNoPrefix(RlpNumeric.encodeBigIntegerUnsigned(value)));
        }
    }

    @Nested
    @DisplayName("error cases")
    class Errors {

        @Test
        @DisplayName("Negative BigInteger throws IllegalArgumentException")
        void testNegativeBigInteger() {
            final IllegalArgumentException ex = assertThrows(
                    IllegalArgumentException.class,
                    () -> RlpNumeric.encodeBigIntegerUnsigned(BigInteger.valueOf(-1)));
            assertTrue(ex.getMessage().contains("non-negative"));
            assertThrows(IllegalArgumentException.class,
                    () -> RlpNumeric.encodeBigIntegerUnsignedItem(BigInteger.valueOf(-1)));
        }

        @Test
        @DisplayName("Null BigInteger throws NullPointerException")
        void testNullBigInteger() {
            assertThrows(NullPointerException.class, () -> RlpNumeric.toMinimalBytes((BigInteger) null));
        }
    }
}
