// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.codec;

import java.util.Objects;
import java.util.function.Function;

import sh.rlpkit.primitives.rlp.RlpItem;

/**
 * One field of a fixed-arity structure: its name, its codec, and how to read
 * it from the owning object.
 *
 * <p>Fields are usually held in constants so the decode factory can look up
 * values by field:
 *
 * <pre>{@code
 * static final RlpField<Account, Long> NONCE = RlpField.of("nonce", RlpCodecs.LONG, Account::nonce);
 * static final RlpField<Account, BigInteger> BALANCE = RlpField.of("balance", RlpCodecs.BIG_INTEGER, Account::balance);
 * }</pre>
 *
 * @param name   field name, used in error messages
 * @param codec  codec for the field value
 * @param getter reads the field value from the owner
 * @param <T>    owner type
 * @param <V>    field value type
 * @since 1.0
 */
public record RlpField<T, V>(String name, RlpCodec<V> codec, Function<? super T, ? extends V> getter) {

    public RlpField {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(codec, "codec cannot be null");
        Objects.requireNonNull(getter, "getter cannot be null");
    }

    public static <T, V> RlpField<T, V> of(
            final String name, final RlpCodec<V> codec, final Function<? super T, ? extends V> getter) {
        return new RlpField<>(name, codec, getter);
    }

    RlpItem encodeFrom(final T owner) {
        final V value = getter.apply(owner);
        if (value == null) {
            throw RlpAdapterException.unsupportedValue("Field '" + name + "' is null");
        }
        try {
            return codec.encode(value);
        } catch (RlpAdapterException e) {
            throw new RlpAdapterException(e.kind(), "Field '" + name + "': " + e.getMessage(), e);
        }
    }

    V decodeFrom(final RlpItem item) {
        try {
            return codec.decode(item);
        } catch (RlpAdapterException e) {
            throw new RlpAdapterException(e.kind(), "Field '" + name + "': " + e.getMessage(), e);
        }
    }
}
