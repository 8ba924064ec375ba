// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rlpkit.primitives.rlp;

/**
 * Configuration for {@link RlpDecoder}.
 *
 * <p>Zero or negative values select the default.
 *
 * <pre>{@code
 * RlpDecoder decoder = RlpDecoder.create(RlpDecoderConfig.builder()
 *         .maxDepth(64)
 *         .build());
 * }</pre>
 *
 * @param maxDepth maximum number of nested lists accepted while decoding; the
 *                 outermost list counts as depth 1. Default: 512.
 * @since 1.0
 */
public record RlpDecoderConfig(int maxDepth) {

    private static final int DEFAULT_MAX_DEPTH = 512;
    private static final int MAX_DEPTH_LIMIT = 1 << 20;

    public RlpDecoderConfig {
        if (maxDepth <= 0) {
            maxDepth = DEFAULT_MAX_DEPTH;
        }
        if (maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException(
                    "maxDepth (" + maxDepth + ") exceeds maximum allowed (" + MAX_DEPTH_LIMIT + ")");
        }
    }

    /**
     * Returns a config with every option at its default.
     *
     * @return default config
     */
    public static RlpDecoderConfig withDefaults() {
        return new RlpDecoderConfig(0);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link RlpDecoderConfig}.
     */
    public static final class Builder {
        private int maxDepth = 0;

        private Builder() {
        }

        /**
         * Sets the maximum list nesting depth.
         *
         * @param maxDepth the limit, or 0 for the default
         * @return this builder
         */
        public Builder maxDepth(final int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public RlpDecoderConfig build() {
            return new RlpDecoderConfig(maxDepth);
        }
    }
}
