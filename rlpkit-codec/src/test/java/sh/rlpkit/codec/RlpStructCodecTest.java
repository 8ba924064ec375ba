// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.rlpkit.primitives.Hex;
import sh.rlpkit.primitives.rlp.Rlp;
import sh.rlpkit.primitives.rlp.RlpDecodingException;
import sh.rlpkit.primitives.rlp.RlpList;
import sh.rlpkit.primitives.rlp.RlpString;

class RlpStructCodecTest {

    record Account(long nonce, BigInteger balance, String label) {}

    record Person(String name, int age) {}

    private static final RlpField<Account, Long> NONCE = RlpField.of("nonce", RlpCodecs.LONG, Account::nonce);
    private static final RlpField<Account, BigInteger> BALANCE =
            RlpField.of("balance", RlpCodecs.BIG_INTEGER, Account::balance);
    private static final RlpField<Account, String> LABEL =
            RlpField.of("label", RlpCodecs.string(StandardCharsets.UTF_8), Account::label);

    private static final RlpStructCodec<Account> ACCOUNT = RlpStructCodec.<Account>builder()
            .field(NONCE)
            .field(BALANCE)
            .field(LABEL)
            .build(v -> new Account(v.get(NONCE), v.get(BALANCE), v.get(LABEL)));

    private static final RlpField<Person, String> NAME =
            RlpField.of("name", RlpCodecs.string(StandardCharsets.UTF_8), Person::name);
    private static final RlpField<Person, Integer> AGE = RlpField.of("age", RlpCodecs.INT, Person::age);

    @Test
    @DisplayName("fields encode as a list in declaration order")
    void testEncodeInFieldOrder() {
        final Account account = new Account(1024L, BigInteger.ZERO, "dog");

        assertEquals("c88204008083646f67", Hex.encodeNoPrefix(ACCOUNT.encodeToBytes(account)));
        assertEquals(3, ACCOUNT.arity());
        assertEquals(List.of(NONCE, BALANCE, LABEL), ACCOUNT.fields());
    }

    @Test
    void testRoundTrip() {
        final Account account = new Account(7L, BigInteger.TWO.pow(200), "savings");

        assertEquals(account, ACCOUNT.decodeFromBytes(ACCOUNT.encodeToBytes(account)));
    }

    @Test
    void testOfMatchesBuilder() {
        final RlpStructCodec<Person> viaOf = RlpStructCodec.of(
                List.<RlpField<Person, ?>>of(NAME, AGE),
                v -> new Person(v.get(NAME), v.get(AGE)));
        final RlpStructCodec<Person> viaBuilder = RlpStructCodec.<Person>builder()
                .field(NAME)
                .field(AGE)
                .build(v -> new Person(v.get(NAME), v.get(AGE)));
        final Person person = new Person("ada", 36);

        assertArrayEquals(viaBuilder.encodeToBytes(person), viaOf.encodeToBytes(person));
        assertEquals(person, viaOf.decodeFromBytes(viaBuilder.encodeToBytes(person)));
    }

    @Test
    @DisplayName("element count must equal the field count")
    void testArityEnforced() {
        final byte[] twoFields = Rlp.encode(RlpList.of(RlpString.of(1L), RlpString.of(2L)));
        final byte[] fourFields = Rlp.encode(RlpList.of(
                RlpString.of(1L), RlpString.of(2L), RlpString.ofHex("0x61"), RlpString.of(3L)));

        final RlpDecodingException tooFew =
                assertThrows(RlpDecodingException.class, () -> ACCOUNT.decodeFromBytes(twoFields));
        assertEquals(RlpDecodingException.Kind.LENGTH_MISMATCH, tooFew.kind());
        assertTrue(tooFew.getMessage().contains("expected: 3, actual: 2"));

        final RlpDecodingException tooMany =
                assertThrows(RlpDecodingException.class, () -> ACCOUNT.decodeFromBytes(fourFields));
        assertEquals(RlpDecodingException.Kind.LENGTH_MISMATCH, tooMany.kind());
    }

    @Test
    void testStringIsTypeMismatch() {
        final RlpDecodingException ex = assertThrows(RlpDecodingException.class,
                () -> ACCOUNT.decodeFromBytes(Hex.decode("83646f67")));
        assertEquals(RlpDecodingException.Kind.TYPE_MISMATCH, ex.kind());
    }

    @Test
    @DisplayName("adapter errors name the failing field")
    void testFieldErrorsCarryFieldName() {
        final RlpAdapterException encode = assertThrows(RlpAdapterException.class,
                () -> ACCOUNT.encode(new Account(-1L, BigInteger.ONE, "x")));
        assertEquals(RlpAdapterException.Kind.UNSUPPORTED_VALUE, encode.kind());
        assertTrue(encode.getMessage().startsWith("Field 'nonce': "));

        final byte[] badBalance = Hex.decode("c50182000161");
        final RlpAdapterException decode =
                assertThrows(RlpAdapterException.class, () -> ACCOUNT.decodeFromBytes(badBalance));
        assertEquals(RlpAdapterException.Kind.NON_CANONICAL_VALUE, decode.kind());
        assertTrue(decode.getMessage().startsWith("Field 'balance': "));
        assertInstanceOf(RlpAdapterException.class, decode.getCause());
    }

    @Test
    void testNullFieldValueRejected() {
        final RlpAdapterException ex = assertThrows(RlpAdapterException.class,
                () -> ACCOUNT.encode(new Account(1L, BigInteger.ONE, null)));
        assertEquals(RlpAdapterException.Kind.UNSUPPORTED_VALUE, ex.kind());
        assertTrue(ex.getMessage().contains("label"));
    }

    @Test
    void testNestedStructs() {
        final RlpField<List<Person>, List<Person>> people = RlpField.of(
                "people",
                RlpCodecs.listOf(RlpStructCodec.<Person>builder()
                        .field(NAME)
                        .field(AGE)
                        .build(v -> new Person(v.get(NAME), v.get(AGE)))),
                list -> list);
        final RlpStructCodec<List<Person>> roster = RlpStructCodec.<List<Person>>builder()
                .field(people)
                .build(v -> v.get(people));
        final List<Person> value = List.of(new Person("ada", 36), new Person("alan", 41));

        assertEquals(value, roster.decodeFromBytes(roster.encodeToBytes(value)));
    }

    @Test
    void testInvalidDefinitions() {
        assertThrows(IllegalArgumentException.class,
                () -> RlpStructCodec.<Person>builder().field(NAME).field(NAME).build(v -> null));
        assertThrows(NullPointerException.class, () -> RlpStructCodec.<Person>builder().field(null));
        assertThrows(NullPointerException.class, () -> RlpField.of(null, RlpCodecs.INT, Person::age));
    }

    @Test
    void testUnknownFieldLookupRejected() {
        final RlpStructCodec<Person> nameOnly = RlpStructCodec.<Person>builder()
                .field(NAME)
                .build(v -> new Person(v.get(NAME), v.get(AGE)));

        assertThrows(IllegalArgumentException.class, () -> nameOnly.decodeFromBytes(Hex.decode("c483616461")));
    }
}
