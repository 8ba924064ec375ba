// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.codec;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import sh.rlpkit.primitives.rlp.RlpItem;
import sh.rlpkit.primitives.rlp.RlpList;

/**
 * Codec for record-like values with a fixed, ordered set of fields.
 *
 * <p>Encodes as an RLP list of the field values in declaration order. Decoding
 * requires exactly as many elements as there are fields and fails with
 * {@code LENGTH_MISMATCH} otherwise.
 *
 * <pre>{@code
 * record Account(long nonce, BigInteger balance) {}
 *
 * static final RlpField<Account, Long> NONCE = RlpField.of("nonce", RlpCodecs.LONG, Account::nonce);
 * static final RlpField<Account, BigInteger> BALANCE = RlpField.of("balance", RlpCodecs.BIG_INTEGER, Account::balance);
 *
 * static final RlpStructCodec<Account> CODEC = RlpStructCodec.<Account>builder()
 *         .field(NONCE)
 *         .field(BALANCE)
 *         .build(v -> new Account(v.get(NONCE), v.get(BALANCE)));
 * }</pre>
 *
 * @param <T> the structure type
 * @since 1.0
 */
public final class RlpStructCodec<T> implements RlpCodec<T> {

    private final List<RlpField<T, ?>> fields;
    private final Function<Values, ? extends T> factory;

    private RlpStructCodec(final List<RlpField<T, ?>> fields, final Function<Values, ? extends T> factory) {
        this.fields = List.copyOf(fields);
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
        if (hasDuplicates(this.fields)) {
            throw new IllegalArgumentException("Each field may appear only once");
        }
    }

    /**
     * Creates a codec from an ordered field list.
     *
     * @param fields  the fields in wire order
     * @param factory builds the value from decoded field values
     * @param <T>     the structure type
     * @return the codec
     */
    public static <T> RlpStructCodec<T> of(
            final List<RlpField<T, ?>> fields, final Function<Values, ? extends T> factory) {
        Objects.requireNonNull(fields, "fields cannot be null");
        return new RlpStructCodec<>(fields, factory);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Number of fields, which is the exact element count required on decode.
     *
     * @return arity
     */
    public int arity() {
        return fields.size();
    }

    public List<RlpField<T, ?>> fields() {
        return fields;
    }

    @Override
    public RlpItem encode(final T value) {
        Objects.requireNonNull(value, "value");
        final List<RlpItem> items = new ArrayList<>(fields.size());
        for (final RlpField<T, ?> field : fields) {
            items.add(field.encodeFrom(value));
        }
        return RlpList.of(items);
    }

    @Override
    public T decode(final RlpItem item) {
        final RlpList list = item.asList().requireSize(fields.size());
        final Map<RlpField<?, ?>, Object> decoded = new IdentityHashMap<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            final RlpField<T, ?> field = fields.get(i);
            decoded.put(field, field.decodeFrom(list.get(i)));
        }
        return factory.apply(new Values(decoded));
    }

    private static boolean hasDuplicates(final List<? extends RlpField<?, ?>> fields) {
        final Map<RlpField<?, ?>, Boolean> seen = new IdentityHashMap<>();
        for (final RlpField<?, ?> field : fields) {
            if (seen.put(field, Boolean.TRUE) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Decoded field values, looked up by field.
     */
    public static final class Values {
        private final Map<RlpField<?, ?>, Object> values;

        private Values(final Map<RlpField<?, ?>, Object> values) {
            this.values = values;
        }

        /**
         * Returns the decoded value of {@code field}.
         *
         * @param field a field of this structure
         * @param <V>   the field value type
         * @return the decoded value
         * @throws IllegalArgumentException if the field does not belong to this structure
         */
        @SuppressWarnings("unchecked")
        public <V> V get(final RlpField<?, V> field) {
            if (!values.containsKey(field)) {
                throw new IllegalArgumentException("Unknown field: " + field.name());
            }
            return (V) values.get(field);
        }
    }

    /**
     * Collects fields in wire order.
     *
     * @param <T> the structure type
     */
    public static final class Builder<T> {
        private final List<RlpField<T, ?>> fields = new ArrayList<>();

        private Builder() {
        }

        public Builder<T> field(final RlpField<T, ?> field) {
            fields.add(Objects.requireNonNull(field, "field cannot be null"));
            return this;
        }

        public RlpStructCodec<T> build(final Function<Values, ? extends T> factory) {
            return new RlpStructCodec<>(fields, factory);
        }
    }
}
