package com.questrail.transducer.blip;

import com.questrail.transducer.codec.Codecs;
import com.questrail.transducer.codec.StateCodec;

import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Operations over {@link Blip} values.
 */
public final class Blips
{
    private Blips() {}

    /**
     * Merges two simultaneous blips. Two present blips combine their payloads
     * with {@code op}; otherwise the present one wins, or the result is absent.
     */
    public static <A> Blip<A> merge(BinaryOperator<A> op, Blip<A> a, Blip<A> b) {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");

        if (a instanceof Blip.Present<A> x && b instanceof Blip.Present<A> y) {
            return Blip.of(op.apply(x.payload(), y.payload()));
        }
        return a.isPresent() ? a : b;
    }

    public static <A, B> B destructure(B ifAbsent, Function<? super A, ? extends B> f, Blip<A> blip) {
        Objects.requireNonNull(f, "f");
        Objects.requireNonNull(blip, "blip");
        return blip.fold(ifAbsent, f);
    }

    /**
     * Presence byte followed by the payload when present.
     */
    public static <A> StateCodec<Blip<A>> codec(StateCodec<A> payload) {
        return Codecs.optional(payload).xmap(Blip::fromOptional, Blip::toOptional);
    }
}
