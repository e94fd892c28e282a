package com.questrail.transducer.core;

import com.questrail.transducer.codec.CheckpointDecodeException;
import com.questrail.transducer.codec.CheckpointReader;
import com.questrail.transducer.codec.CheckpointWriter;
import com.questrail.transducer.codec.FrameTag;
import com.questrail.transducer.codec.StateCodec;

import java.util.Objects;
import java.util.function.Function;

/**
 * Transducer
 * -----------------------------------------------------------------------------
 * A stateful stream transducer: given one input of type {@code A} it yields one
 * output of type {@code B} and a successor transducer that consumes the next
 * input.
 *
 * <h2>Variants</h2>
 * The representation is a closed set of five variants, chosen so that common
 * cases avoid carrying machinery they do not need:
 * <ul>
 *   <li>{@link Stateless}: {@code A -> B}</li>
 *   <li>{@link StatelessEffect}: {@code A -> Effect<B>}</li>
 *   <li>{@link Stateful}: {@code (A, S) -> (B, S)} with a {@link StateCodec} for {@code S}</li>
 *   <li>{@link StatefulEffect}: {@code (A, S) -> Effect<(B, S)>} with a codec</li>
 *   <li>{@link General}: an arbitrary closure returning the output and the
 *       successor directly, plus an attached saver and a stored loader</li>
 * </ul>
 *
 * <h2>Value semantics</h2>
 * A transducer is never mutated. Stepping returns a new instance; older
 * instances remain valid and may be stepped independently (fan-out,
 * snapshots). The behavior is fixed at construction, only the state moves.
 *
 * <h2>Checkpoints</h2>
 * Every variant supports {@link #encode()} and {@link #decode(byte[])}.
 * Decoding is always relative to a template of matching construction: the
 * template contributes the behavior, the bytes contribute the state.
 * Stateless variants encode to zero bytes and decode to themselves.
 *
 * @param <A> input type
 * @param <B> output type
 */
public sealed interface Transducer<A, B>
        permits Transducer.Stateless, Transducer.StatelessEffect,
                Transducer.Stateful, Transducer.StatefulEffect, Transducer.General
{
    /**
     * Representational variant of a transducer.
     */
    enum Variant {
        STATELESS,
        STATELESS_EFFECT,
        STATEFUL,
        STATEFUL_EFFECT,
        GENERAL
    }

    Variant variant();

    /**
     * Returns true if stepping may perform effects.
     */
    boolean isEffectful();

    /**
     * Steps this transducer with one input. Pure variants return an already
     * computed action; effectful variants perform their effects when the
     * returned action is run.
     */
    Effect<Output<A, B>> step(A input);

    /**
     * Steps a pure transducer. Total for pure variants.
     *
     * @throws IllegalStateException if this transducer is effectful
     */
    default Output<A, B> stepPure(A input) {
        if (isEffectful()) {
            throw new IllegalStateException(
                    variant() + " transducer performs effects; use step(input).run()");
        }
        return step(input).run();
    }

    default B evalPure(A input) {
        return stepPure(input).result();
    }

    default Transducer<A, B> execPure(A input) {
        return stepPure(input).next();
    }

    /**
     * Appends this transducer's state to {@code out}.
     */
    void writeState(CheckpointWriter out);

    /**
     * Reads state written by a transducer of the same construction and
     * returns a transducer with this one's behavior and the decoded state.
     *
     * @throws CheckpointDecodeException on truncated, malformed or mismatched input
     */
    Transducer<A, B> readState(CheckpointReader in);

    default byte[] encode() {
        CheckpointWriter out = CheckpointWriter.create();
        writeState(out);
        return out.toByteArray();
    }

    /**
     * Resumes from checkpoint bytes, using this transducer as the template.
     *
     * @throws CheckpointDecodeException if the bytes do not describe the state
     *         of a transducer of this construction
     */
    default Transducer<A, B> decode(byte[] bytes) {
        if (variant() == Variant.STATELESS || variant() == Variant.STATELESS_EFFECT) {
            return this;
        }
        CheckpointReader in = CheckpointReader.of(bytes);
        Transducer<A, B> resumed = readState(in);
        in.expectExhausted();
        return resumed;
    }

    default DecodeResult<A, B> tryDecode(byte[] bytes) {
        try {
            return new DecodeResult.Resumed<>(decode(bytes));
        } catch (CheckpointDecodeException e) {
            return new DecodeResult.Rejected<>(e);
        }
    }

    default <C> Transducer<A, C> andThen(Transducer<B, C> next) {
        return Transducers.compose(next, this);
    }

    default <Z> Transducer<Z, B> compose(Transducer<Z, A> before) {
        return Transducers.compose(this, before);
    }

    default <C> Transducer<A, C> map(Function<? super B, ? extends C> f) {
        return Transducers.compose(Transducers.<B, C>function(f), this);
    }

    default <Z> Transducer<Z, B> contramap(Function<? super Z, ? extends A> f) {
        return Transducers.compose(this, Transducers.<Z, A>function(f));
    }

    // ---------------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------------

    /**
     * Pure function, no state. The successor is always this instance.
     */
    final class Stateless<A, B> implements Transducer<A, B> {
        private final Function<? super A, ? extends B> function;

        Stateless(Function<? super A, ? extends B> function) {
            this.function = Objects.requireNonNull(function, "function");
        }

        B apply(A input) {
            return function.apply(input);
        }

        Function<A, Effect<B>> effectFunction() {
            return x -> Effect.pure(function.apply(x));
        }

        @Override
        public Variant variant() {
            return Variant.STATELESS;
        }

        @Override
        public boolean isEffectful() {
            return false;
        }

        @Override
        public Effect<Output<A, B>> step(A input) {
            return Effect.pure(stepPure(input));
        }

        @Override
        public Output<A, B> stepPure(A input) {
            return new Output<>(function.apply(input), this);
        }

        @Override
        public void writeState(CheckpointWriter out) {
        }

        @Override
        public Transducer<A, B> readState(CheckpointReader in) {
            return this;
        }

        @Override
        public String toString() {
            return "Stateless";
        }
    }

    /**
     * Effectful function, no state. The successor is always this instance.
     */
    final class StatelessEffect<A, B> implements Transducer<A, B> {
        private final Function<? super A, ? extends Effect<B>> function;

        StatelessEffect(Function<? super A, ? extends Effect<B>> function) {
            this.function = Objects.requireNonNull(function, "function");
        }

        Function<A, Effect<B>> effectFunction() {
            return function::apply;
        }

        @Override
        public Variant variant() {
            return Variant.STATELESS_EFFECT;
        }

        @Override
        public boolean isEffectful() {
            return true;
        }

        @Override
        public Effect<Output<A, B>> step(A input) {
            return function.apply(input).map(y -> new Output<>(y, this));
        }

        @Override
        public void writeState(CheckpointWriter out) {
        }

        @Override
        public Transducer<A, B> readState(CheckpointReader in) {
            return this;
        }

        @Override
        public String toString() {
            return "StatelessEffect";
        }
    }

    /**
     * Pure step over an explicit state value. Stepping rebinds the same
     * function and codec to the new state.
     *
     * @param <S> the state type, hidden from callers of the transducer
     */
    final class Stateful<A, B, S> implements Transducer<A, B> {
        private final StateCodec<S> codec;
        private final StateFunction<A, S, B> function;
        private final S state;

        Stateful(StateCodec<S> codec, StateFunction<A, S, B> function, S state) {
            this.codec = Objects.requireNonNull(codec, "codec");
            this.function = Objects.requireNonNull(function, "function");
            this.state = state;
        }

        StateCodec<S> codec() {
            return codec;
        }

        StateFunction<A, S, B> function() {
            return function;
        }

        S state() {
            return state;
        }

        StateView<A, B, S> effectView() {
            return new StateView<>(codec, (x, s) -> Effect.pure(function.apply(x, s)), state);
        }

        @Override
        public Variant variant() {
            return Variant.STATEFUL;
        }

        @Override
        public boolean isEffectful() {
            return false;
        }

        @Override
        public Effect<Output<A, B>> step(A input) {
            return Effect.pure(stepPure(input));
        }

        @Override
        public Output<A, B> stepPure(A input) {
            Pair<B, S> r = function.apply(input, state);
            return new Output<>(r.first(), new Stateful<>(codec, function, r.second()));
        }

        @Override
        public void writeState(CheckpointWriter out) {
            out.writeFrame(FrameTag.STATE, w -> codec.write(state, w));
        }

        @Override
        public Transducer<A, B> readState(CheckpointReader in) {
            return new Stateful<>(codec, function, StateView.readStateFrame(codec, in));
        }

        @Override
        public String toString() {
            return "Stateful[state=" + state + "]";
        }
    }

    /**
     * Effectful step over an explicit state value.
     */
    final class StatefulEffect<A, B, S> implements Transducer<A, B> {
        private final StateCodec<S> codec;
        private final EffectStateFunction<A, S, B> function;
        private final S state;

        StatefulEffect(StateCodec<S> codec, EffectStateFunction<A, S, B> function, S state) {
            this.codec = Objects.requireNonNull(codec, "codec");
            this.function = Objects.requireNonNull(function, "function");
            this.state = state;
        }

        StateView<A, B, S> effectView() {
            return new StateView<>(codec, function, state);
        }

        @Override
        public Variant variant() {
            return Variant.STATEFUL_EFFECT;
        }

        @Override
        public boolean isEffectful() {
            return true;
        }

        @Override
        public Effect<Output<A, B>> step(A input) {
            return function.apply(input, state)
                    .map(r -> new Output<>(r.first(), new StatefulEffect<>(codec, function, r.second())));
        }

        @Override
        public void writeState(CheckpointWriter out) {
            out.writeFrame(FrameTag.STATE, w -> codec.write(state, w));
        }

        @Override
        public Transducer<A, B> readState(CheckpointReader in) {
            return new StatefulEffect<>(codec, function, StateView.readStateFrame(codec, in));
        }

        @Override
        public String toString() {
            return "StatefulEffect[state=" + state + "]";
        }
    }

    /**
     * Opaque transducer: the step closure returns the output and a ready-made
     * successor, which may have any internal shape. Checkpointing goes through
     * the attached {@link CheckpointSaver} and the stored
     * {@link CheckpointLoader}.
     *
     * <p>Successors and loaded transducers of another shape are re-expressed
     * through {@link Transducers#toGeneral(Transducer)}, so every checkpoint
     * of a General lineage starts with a {@code G} frame and the template's
     * loader always receives the inner payload.</p>
     */
    final class General<A, B> implements Transducer<A, B> {
        private final boolean effectful;
        private final Function<? super A, ? extends Effect<Output<A, B>>> function;
        private final CheckpointSaver saver;
        private final CheckpointLoader<A, B> loader;

        General(boolean effectful,
                Function<? super A, ? extends Effect<Output<A, B>>> function,
                CheckpointSaver saver,
                CheckpointLoader<A, B> loader) {
            this.effectful = effectful;
            this.function = Objects.requireNonNull(function, "function");
            this.saver = Objects.requireNonNull(saver, "saver");
            this.loader = Objects.requireNonNull(loader, "loader");
        }

        @Override
        public Variant variant() {
            return Variant.GENERAL;
        }

        @Override
        public boolean isEffectful() {
            return effectful;
        }

        @Override
        public Effect<Output<A, B>> step(A input) {
            return function.apply(input).map(General::keepGeneral);
        }

        private static <X, Y> Output<X, Y> keepGeneral(Output<X, Y> o) {
            if (o.next() instanceof General) {
                return o;
            }
            return o.withNext(Transducers.toGeneral(o.next()));
        }

        @Override
        public void writeState(CheckpointWriter out) {
            out.writeFrame(FrameTag.GENERAL, saver::save);
        }

        @Override
        public Transducer<A, B> readState(CheckpointReader in) {
            CheckpointReader body = in.readFrame(FrameTag.GENERAL);
            Transducer<A, B> loaded;
            try {
                loaded = loader.load(body);
            } catch (CheckpointDecodeException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new CheckpointDecodeException("Checkpoint loader rejected checkpoint payload", e);
            }
            body.expectExhausted();
            return Transducers.toGeneral(loaded);
        }

        @Override
        public String toString() {
            return effectful ? "General[effectful]" : "General";
        }
    }
}
