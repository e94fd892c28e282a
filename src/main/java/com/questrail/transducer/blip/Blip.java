package com.questrail.transducer.blip;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Blip
 * -----------------------------------------------------------------------------
 * A discrete event: at most one occurrence per step, either {@link Absent} or
 * {@link Present} with a non-null payload.
 *
 * <p>Blips are plain values. An event source is an ordinary transducer whose
 * output type is {@code Blip<E>}.</p>
 *
 * @param <A> payload type
 */
public sealed interface Blip<A>
        permits Blip.Absent, Blip.Present
{
    static <A> Blip<A> absent() {
        return new Absent<>();
    }

    static <A> Blip<A> of(A payload) {
        return new Present<>(payload);
    }

    static <A> Blip<A> fromOptional(Optional<A> value) {
        Objects.requireNonNull(value, "value");
        return value.<Blip<A>>map(Blip::of).orElseGet(Blip::absent);
    }

    boolean isPresent();

    <B> Blip<B> map(Function<? super A, ? extends B> f);

    /**
     * Returns {@code f(payload)} if present, otherwise {@code ifAbsent}.
     */
    <B> B fold(B ifAbsent, Function<? super A, ? extends B> f);

    Optional<A> toOptional();

    /**
     * No occurrence. All instances are equal.
     */
    record Absent<A>() implements Blip<A> {
        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public <B> Blip<B> map(Function<? super A, ? extends B> f) {
            Objects.requireNonNull(f, "f");
            return Blip.absent();
        }

        @Override
        public <B> B fold(B ifAbsent, Function<? super A, ? extends B> f) {
            return ifAbsent;
        }

        @Override
        public Optional<A> toOptional() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "Blip.absent";
        }
    }

    record Present<A>(A payload) implements Blip<A> {
        public Present {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public <B> Blip<B> map(Function<? super A, ? extends B> f) {
            return new Present<>(f.apply(payload));
        }

        @Override
        public <B> B fold(B ifAbsent, Function<? super A, ? extends B> f) {
            return f.apply(payload);
        }

        @Override
        public Optional<A> toOptional() {
            return Optional.of(payload);
        }
    }
}
