package com.questrail.transducer.checkpoint;

import com.questrail.transducer.codec.CheckpointDecodeException;
import com.questrail.transducer.config.CheckpointConfig;
import com.questrail.transducer.config.DecodeFailurePolicy;
import com.questrail.transducer.core.DecodeResult;
import com.questrail.transducer.core.Transducer;
import com.questrail.transducer.observability.CheckpointObservabilitySink;
import com.questrail.transducer.observability.CheckpointSavedEvent;
import com.questrail.transducer.observability.DecodeFailureEvent;
import com.questrail.transducer.observability.NullObservabilitySink;
import com.questrail.transducer.observability.ResumeEvent;

import java.time.Clock;
import java.util.Objects;

/**
 * Checkpointer
 * -----------------------------------------------------------------------------
 * Saves and resumes transducers on behalf of a driver loop.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Encode a transducer, refusing checkpoints above the configured size</li>
 *   <li>Decode checkpoint bytes against a template and apply the
 *       {@link DecodeFailurePolicy} when they are rejected</li>
 *   <li>Report every save, resume and rejection to the observability sink</li>
 * </ul>
 *
 * <p>The Checkpointer holds no transducer state. Persisting the bytes is the
 * driver's concern.</p>
 */
public final class Checkpointer
{
    private final CheckpointConfig config;
    private final CheckpointObservabilitySink sink;
    private final Clock clock;

    public Checkpointer(CheckpointConfig config) {
        this(config, NullObservabilitySink.INSTANCE);
    }

    public Checkpointer(CheckpointConfig config, CheckpointObservabilitySink sink) {
        this(config, sink, Clock.systemUTC());
    }

    public Checkpointer(CheckpointConfig config, CheckpointObservabilitySink sink, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CheckpointConfig config() {
        return config;
    }

    /**
     * Encodes the current state of {@code transducer}.
     *
     * @throws IllegalArgumentException if the checkpoint exceeds
     *         {@link CheckpointConfig#maxCheckpointBytes()}
     */
    public byte[] save(Transducer<?, ?> transducer) {
        Objects.requireNonNull(transducer, "transducer");

        byte[] bytes = transducer.encode();
        if (bytes.length > config.maxCheckpointBytes()) {
            throw new IllegalArgumentException("Checkpoint of " + bytes.length
                    + " bytes exceeds limit of " + config.maxCheckpointBytes());
        }
        sink.onCheckpointSaved(new CheckpointSavedEvent(clock.instant(), transducer.variant(), bytes.length));
        return bytes;
    }

    /**
     * Resumes from {@code bytes} using {@code template} for behavior. On a
     * rejected checkpoint, returns {@code template} or rethrows according to
     * the configured policy.
     *
     * @throws CheckpointDecodeException if the checkpoint is rejected and the
     *         policy is {@link DecodeFailurePolicy#FAIL}
     */
    public <A, B> Transducer<A, B> resume(Transducer<A, B> template, byte[] bytes) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(bytes, "bytes");

        DecodeResult<A, B> result = tryResume(template, bytes);
        if (result instanceof DecodeResult.Resumed<A, B> resumed) {
            sink.onResumed(new ResumeEvent(clock.instant(), template.variant(), bytes.length));
            return resumed.transducer();
        }

        CheckpointDecodeException error = ((DecodeResult.Rejected<A, B>) result).error();
        DecodeFailurePolicy policy = config.decodeFailurePolicy();
        sink.onDecodeFailure(new DecodeFailureEvent(clock.instant(), template.variant(), bytes.length, policy, error));

        return switch (policy) {
            case FAIL -> throw error;
            case RESET_TO_TEMPLATE -> template;
        };
    }

    private <A, B> DecodeResult<A, B> tryResume(Transducer<A, B> template, byte[] bytes) {
        if (bytes.length > config.maxCheckpointBytes()) {
            return new DecodeResult.Rejected<>(new CheckpointDecodeException("Checkpoint of " + bytes.length
                    + " bytes exceeds limit of " + config.maxCheckpointBytes()));
        }
        return template.tryDecode(bytes);
    }
}
