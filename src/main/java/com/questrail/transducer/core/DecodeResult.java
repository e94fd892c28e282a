package com.questrail.transducer.core;

import com.questrail.transducer.codec.CheckpointDecodeException;

import java.util.Objects;

/**
 * Outcome of decoding a checkpoint against a template transducer.
 *
 * <p>Decode failures are always recoverable by the caller, typically by
 * falling back to the template itself (its initial state).</p>
 */
public sealed interface DecodeResult<A, B>
        permits DecodeResult.Resumed, DecodeResult.Rejected
{
    /** The checkpoint was accepted; {@code transducer} carries the decoded state. */
    record Resumed<A, B>(Transducer<A, B> transducer) implements DecodeResult<A, B> {
        public Resumed {
            Objects.requireNonNull(transducer, "transducer");
        }
    }

    /** The checkpoint did not match the template or was malformed. */
    record Rejected<A, B>(CheckpointDecodeException error) implements DecodeResult<A, B> {
        public Rejected {
            Objects.requireNonNull(error, "error");
        }
    }

    default boolean isResumed() {
        return this instanceof Resumed;
    }

    default Transducer<A, B> orElse(Transducer<A, B> fallback) {
        if (this instanceof Resumed<A, B> r) {
            return r.transducer();
        }
        return Objects.requireNonNull(fallback, "fallback");
    }

    default Transducer<A, B> orElseThrow() {
        if (this instanceof Resumed<A, B> r) {
            return r.transducer();
        }
        throw ((Rejected<A, B>) this).error();
    }
}
