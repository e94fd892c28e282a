package com.questrail.transducer.config;

import java.util.Objects;

/**
 * Configuration for saving and resuming transducer checkpoints.
 *
 * @param decodeFailurePolicy handling of checkpoints that fail to decode
 * @param maxCheckpointBytes  largest checkpoint accepted on save or resume
 */
public record CheckpointConfig(
    DecodeFailurePolicy decodeFailurePolicy,
    int maxCheckpointBytes
) {
    public static final int DEFAULT_MAX_CHECKPOINT_BYTES = 16 * 1024 * 1024;

    public CheckpointConfig {
        Objects.requireNonNull(decodeFailurePolicy, "decodeFailurePolicy");
        if (maxCheckpointBytes <= 0) {
            throw new IllegalArgumentException("maxCheckpointBytes must be positive: " + maxCheckpointBytes);
        }
    }

    public static CheckpointConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DecodeFailurePolicy decodeFailurePolicy = DecodeFailurePolicy.RESET_TO_TEMPLATE;
        private int maxCheckpointBytes = DEFAULT_MAX_CHECKPOINT_BYTES;

        public Builder withDecodeFailurePolicy(DecodeFailurePolicy policy) {
            this.decodeFailurePolicy = policy;
            return this;
        }

        public Builder withMaxCheckpointBytes(int maxCheckpointBytes) {
            this.maxCheckpointBytes = maxCheckpointBytes;
            return this;
        }

        public CheckpointConfig build() {
            return new CheckpointConfig(decodeFailurePolicy, maxCheckpointBytes);
        }
    }
}
