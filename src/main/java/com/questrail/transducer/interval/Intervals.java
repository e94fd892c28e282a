package com.questrail.transducer.interval;

import com.questrail.transducer.blip.Blip;
import com.questrail.transducer.codec.Codecs;
import com.questrail.transducer.codec.StateCodec;
import com.questrail.transducer.core.CheckpointLoader;
import com.questrail.transducer.core.CheckpointSaver;
import com.questrail.transducer.core.Effect;
import com.questrail.transducer.core.Output;
import com.questrail.transducer.core.Pair;
import com.questrail.transducer.core.StateFunction;
import com.questrail.transducer.core.Transducer;
import com.questrail.transducer.core.Transducers;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Intervals
 * -----------------------------------------------------------------------------
 * Transducers whose output is "on" ({@code Optional.of(x)}) or "off"
 * ({@code Optional.empty()}) on each step.
 *
 * <p>Everything here except {@link #gate(Transducer)} is built from the
 * stateless and explicit-state constructors, so intervals compose without
 * widening to General. Payloads are non-null; a null inner result seen by
 * {@code gate} reads as "off".</p>
 *
 * <h2>between</h2>
 * <pre>
 *   Off --start--> On
 *   On  --end----> Off
 * </pre>
 * The end event is checked first when both occur on the same step. The
 * initial state is Off.
 */
public final class Intervals
{
    private Intervals() {}

    // ---------------------------------------------------------------------
    // Static intervals
    // ---------------------------------------------------------------------

    /**
     * Always off.
     */
    public static <A, B> Transducer<A, Optional<B>> off() {
        return Transducers.constant(Optional.empty());
    }

    /**
     * Always on, passing the input through.
     */
    public static <A> Transducer<A, Optional<A>> toOn() {
        return Transducers.<A, Optional<A>>function(Optional::of);
    }

    /**
     * Collapses an interval, emitting {@code ifOff} during off periods.
     */
    public static <A> Transducer<Optional<A>, A> fromInterval(A ifOff) {
        return Transducers.<Optional<A>, A>function(o -> o.orElse(ifOff));
    }

    public static <A, B> Transducer<Optional<A>, B> fromIntervalWith(B ifOff, Function<? super A, ? extends B> f) {
        Objects.requireNonNull(f, "f");
        return Transducers.<Optional<A>, B>function(o -> o.isPresent() ? f.apply(o.get()) : ifOff);
    }

    // ---------------------------------------------------------------------
    // Counted intervals
    // ---------------------------------------------------------------------

    /**
     * On for the first {@code n} steps, off forever after. Negative
     * {@code n} behaves as zero.
     */
    public static <A> Transducer<A, Optional<A>> onFor(int n) {
        StateFunction<A, Integer, Optional<A>> step = (x, remaining) -> {
            if (remaining == 0) {
                return Pair.of(Optional.empty(), 0);
            }
            return Pair.of(Optional.of(x), remaining - 1);
        };
        return Transducers.state(Codecs.INT, step, Math.max(0, n));
    }

    /**
     * Off for the first {@code n} steps, on forever after. Negative
     * {@code n} behaves as zero.
     */
    public static <A> Transducer<A, Optional<A>> offFor(int n) {
        StateFunction<A, Integer, Optional<A>> step = (x, remaining) -> {
            if (remaining == 0) {
                return Pair.of(Optional.of(x), 0);
            }
            return Pair.of(Optional.empty(), remaining - 1);
        };
        return Transducers.state(Codecs.INT, step, Math.max(0, n));
    }

    // ---------------------------------------------------------------------
    // Predicate intervals
    // ---------------------------------------------------------------------

    public static <A> Transducer<A, Optional<A>> when(Predicate<? super A> p) {
        Objects.requireNonNull(p, "p");
        return Transducers.<A, Optional<A>>function(x -> p.test(x) ? Optional.of(x) : Optional.empty());
    }

    public static <A> Transducer<A, Optional<A>> unless(Predicate<? super A> p) {
        Objects.requireNonNull(p, "p");
        return when(p.negate());
    }

    // ---------------------------------------------------------------------
    // Event-triggered intervals
    // ---------------------------------------------------------------------

    /**
     * Off until the paired blip first occurs (inclusive), on forever after.
     */
    public static <A, E> Transducer<Pair<A, Blip<E>>, Optional<A>> after() {
        StateFunction<Pair<A, Blip<E>>, Boolean, Optional<A>> step = (in, seen) -> {
            if (seen || in.second().isPresent()) {
                return Pair.of(Optional.of(in.first()), true);
            }
            return Pair.of(Optional.empty(), false);
        };
        return Transducers.state(Codecs.BOOLEAN, step, false);
    }

    /**
     * On until the paired blip first occurs, off forever from that step on.
     */
    public static <A, E> Transducer<Pair<A, Blip<E>>, Optional<A>> before() {
        StateFunction<Pair<A, Blip<E>>, Boolean, Optional<A>> step = (in, seen) -> {
            if (seen || in.second().isPresent()) {
                return Pair.of(Optional.empty(), true);
            }
            return Pair.of(Optional.of(in.first()), false);
        };
        return Transducers.state(Codecs.BOOLEAN, step, false);
    }

    /**
     * Turns on when the start blip occurs and off when the end blip occurs.
     * The input pairs a value with {@code (start, end)}.
     */
    public static <A, S, E> Transducer<Pair<A, Pair<Blip<S>, Blip<E>>>, Optional<A>> between() {
        StateFunction<Pair<A, Pair<Blip<S>, Blip<E>>>, Boolean, Optional<A>> step = (in, on) -> {
            Pair<Blip<S>, Blip<E>> events = in.second();
            if (events.second().isPresent()) {
                return Pair.of(Optional.empty(), false);
            }
            if (events.first().isPresent() || on) {
                return Pair.of(Optional.of(in.first()), true);
            }
            return Pair.of(Optional.empty(), false);
        };
        return Transducers.state(Codecs.BOOLEAN, step, false);
    }

    // ---------------------------------------------------------------------
    // Holding blips
    // ---------------------------------------------------------------------

    /**
     * Off until the first blip, then on with the most recent payload.
     */
    public static <A> Transducer<Blip<A>, Optional<A>> hold(StateCodec<A> codec) {
        Objects.requireNonNull(codec, "codec");
        return Transducers.accum(Codecs.optional(codec), Intervals::holdStep, Optional.empty());
    }

    public static <A> Transducer<Blip<A>, Optional<A>> holdNonResuming() {
        return Transducers.accumNonResuming(Intervals::holdStep, Optional.empty());
    }

    private static <A> Optional<A> holdStep(Optional<A> held, Blip<A> blip) {
        return blip.fold(held, Optional::of);
    }

    /**
     * Like {@link #hold(StateCodec)}, but a payload stays visible for only
     * {@code n} steps after the step it arrived on. Negative {@code n}
     * behaves as zero.
     */
    public static <A> Transducer<Blip<A>, Optional<A>> holdFor(int n, StateCodec<A> codec) {
        Objects.requireNonNull(codec, "codec");
        int steps = Math.max(0, n);
        return Transducers.state(Codecs.pair(Codecs.optional(codec), Codecs.INT),
                Intervals.<A>holdForStep(steps), Pair.of(Optional.<A>empty(), steps));
    }

    public static <A> Transducer<Blip<A>, Optional<A>> holdForNonResuming(int n) {
        int steps = Math.max(0, n);
        return Transducers.stateNonResuming(Intervals.<A>holdForStep(steps), Pair.of(Optional.<A>empty(), steps));
    }

    private static <A> StateFunction<Blip<A>, Pair<Optional<A>, Integer>, Optional<A>> holdForStep(int n) {
        return (blip, s) -> {
            Pair<Optional<A>, Integer> next;
            if (blip instanceof Blip.Present<A> p) {
                next = Pair.of(Optional.of(p.payload()), n);
            } else if (s.second() == 0) {
                next = Pair.of(Optional.empty(), 0);
            } else {
                next = Pair.of(s.first(), s.second() - 1);
            }
            return Pair.of(next.first(), next);
        };
    }

    // ---------------------------------------------------------------------
    // Choosing between intervals
    // ---------------------------------------------------------------------

    /**
     * Runs both intervals and emits the first one's value when it is on,
     * otherwise the second's.
     */
    public static <A, B> Transducer<A, Optional<B>> orElse(Transducer<A, Optional<B>> first,
                                                         Transducer<A, Optional<B>> second) {
        return Transducers.zipWith((Optional<B> x, Optional<B> y) -> x.isPresent() ? x : y, first, second);
    }

    /**
     * Runs both and emits the interval's value when it is on, otherwise the
     * fallback transducer's output.
     */
    public static <A, B> Transducer<A, B> orElseAlways(Transducer<A, Optional<B>> interval,
                                                     Transducer<A, B> fallback) {
        return Transducers.zipWith((Optional<B> x, B y) -> x.isPresent() ? x.get() : y, interval, fallback);
    }

    /**
     * Emits the value of the first interval that is on. Every candidate
     * steps on every input, in list order. An empty list is always off.
     */
    public static <A, B> Transducer<A, Optional<B>> chooseInterval(List<Transducer<A, Optional<B>>> candidates) {
        Objects.requireNonNull(candidates, "candidates");
        if (candidates.isEmpty()) {
            return off();
        }
        Transducer<A, Optional<B>> chosen = candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            chosen = orElse(chosen, candidates.get(i));
        }
        return chosen;
    }

    /**
     * Like {@link #chooseInterval(List)}, falling back to {@code fallback}
     * when no candidate is on. The fallback steps last.
     */
    public static <A, B> Transducer<A, B> choose(Transducer<A, B> fallback,
                                               List<Transducer<A, Optional<B>>> candidates) {
        Objects.requireNonNull(fallback, "fallback");
        Objects.requireNonNull(candidates, "candidates");
        Transducer<A, B> chosen = fallback;
        for (int i = candidates.size() - 1; i >= 0; i--) {
            chosen = orElseAlways(candidates.get(i), chosen);
        }
        return chosen;
    }

    // ---------------------------------------------------------------------
    // Gating
    // ---------------------------------------------------------------------

    /**
     * Steps {@code inner} only while the input interval is on. During off
     * steps the inner transducer is not stepped at all, its state is frozen
     * and the gate emits off. Checkpoints carry the inner transducer's state.
     */
    public static <A, B> Transducer<Optional<A>, Optional<B>> gate(Transducer<A, B> inner) {
        Objects.requireNonNull(inner, "inner");
        CheckpointLoader<Optional<A>, Optional<B>> loader = in -> gate(inner.readState(in));
        CheckpointSaver saver = inner::writeState;
        if (inner.isEffectful()) {
            return Transducers.generalEffect(loader, saver, x -> gateStep(inner, x));
        }
        return Transducers.general(loader, saver, x -> gateStep(inner, x).run());
    }

    private static <A, B> Effect<Output<Optional<A>, Optional<B>>> gateStep(Transducer<A, B> inner,
                                                                            Optional<A> input) {
        if (input.isEmpty()) {
            return Effect.pure(new Output<Optional<A>, Optional<B>>(Optional.empty(), gate(inner)));
        }
        return inner.step(input.get())
                .map(o -> new Output<Optional<A>, Optional<B>>(Optional.ofNullable(o.result()), gate(o.next())));
    }

    /**
     * {@link #gate(Transducer)} for an inner interval: the nested optional
     * is flattened, so the result is on only when both layers are.
     */
    public static <A, B> Transducer<Optional<A>, Optional<B>> gateFlat(Transducer<A, Optional<B>> inner) {
        return gate(inner).<Optional<B>>map(o -> o.flatMap(v -> v));
    }
}
