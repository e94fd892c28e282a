package com.questrail.transducer.core;

import com.questrail.transducer.codec.Codecs;
import com.questrail.transducer.codec.StateCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Transducers
 * -----------------------------------------------------------------------------
 * Constructors and combinators for {@link Transducer}s.
 *
 * <h2>Constructors</h2>
 * Each constructor produces the cheapest variant able to express it. Every
 * state-carrying constructor comes in two forms:
 * <ul>
 *   <li>resuming: takes a {@link StateCodec}; checkpoints carry the current state</li>
 *   <li>non-resuming ({@code ...NonResuming}): checkpoints carry no state and
 *       decode back to the initial state</li>
 * </ul>
 *
 * <h2>Combinators</h2>
 * Sequential, parallel and choice composition preserve the most specialized
 * variant possible. Chains of explicit-state transducers stay explicit-state
 * with a paired state and a paired codec; only a {@code General} operand
 * forces a {@code General} result.
 */
public final class Transducers
{
    private Transducers() {}

    // ---------------------------------------------------------------------
    // Stateless
    // ---------------------------------------------------------------------

    public static <A> Transducer<A, A> identity() {
        return new Transducer.Stateless<>(Function.identity());
    }

    public static <A, B> Transducer<A, B> function(Function<? super A, ? extends B> f) {
        return new Transducer.Stateless<>(f);
    }

    public static <A, B> Transducer<A, B> constant(B value) {
        return new Transducer.Stateless<>(x -> value);
    }

    public static <A, B> Transducer<A, B> functionEffect(Function<? super A, ? extends Effect<B>> f) {
        return new Transducer.StatelessEffect<>(f);
    }

    /**
     * Runs {@code action} at every step, ignoring the input.
     */
    public static <A, B> Transducer<A, B> constantEffect(Effect<B> action) {
        Objects.requireNonNull(action, "action");
        return new Transducer.StatelessEffect<A, B>(x -> action);
    }

    // ---------------------------------------------------------------------
    // Explicit state
    // ---------------------------------------------------------------------

    public static <A, B, S> Transducer<A, B> state(StateCodec<S> codec, StateFunction<A, S, B> f, S initial) {
        return new Transducer.Stateful<>(codec, f, initial);
    }

    public static <A, B, S> Transducer<A, B> stateNonResuming(StateFunction<A, S, B> f, S initial) {
        return new Transducer.Stateful<>(Codecs.constant(initial), f, initial);
    }

    public static <A, B, S> Transducer<A, B> stateEffect(StateCodec<S> codec,
                                                         EffectStateFunction<A, S, B> f,
                                                         S initial) {
        return new Transducer.StatefulEffect<>(codec, f, initial);
    }

    public static <A, B, S> Transducer<A, B> stateEffectNonResuming(EffectStateFunction<A, S, B> f, S initial) {
        return new Transducer.StatefulEffect<>(Codecs.constant(initial), f, initial);
    }

    /**
     * Folds each input into an accumulator and emits the updated accumulator.
     */
    public static <A, B> Transducer<A, B> accum(StateCodec<B> codec, BiFunction<B, A, B> f, B initial) {
        return state(codec, accumStep(f), initial);
    }

    public static <A, B> Transducer<A, B> accumNonResuming(BiFunction<B, A, B> f, B initial) {
        return stateNonResuming(accumStep(f), initial);
    }

    /**
     * Like {@link #accum} but emits the accumulator as it was before this
     * step's input was folded in.
     */
    public static <A, B> Transducer<A, B> accumDelayed(StateCodec<B> codec, BiFunction<B, A, B> f, B initial) {
        return state(codec, accumDelayedStep(f), initial);
    }

    public static <A, B> Transducer<A, B> accumDelayedNonResuming(BiFunction<B, A, B> f, B initial) {
        return stateNonResuming(accumDelayedStep(f), initial);
    }

    public static <A, B> Transducer<A, B> accumEffect(StateCodec<B> codec,
                                                      BiFunction<B, A, Effect<B>> f,
                                                      B initial) {
        return stateEffect(codec, accumEffectStep(f), initial);
    }

    public static <A, B> Transducer<A, B> accumEffectNonResuming(BiFunction<B, A, Effect<B>> f, B initial) {
        return stateEffectNonResuming(accumEffectStep(f), initial);
    }

    public static <A, B> Transducer<A, B> accumDelayedEffect(StateCodec<B> codec,
                                                             BiFunction<B, A, Effect<B>> f,
                                                             B initial) {
        return stateEffect(codec, accumDelayedEffectStep(f), initial);
    }

    public static <A, B> Transducer<A, B> accumDelayedEffectNonResuming(BiFunction<B, A, Effect<B>> f, B initial) {
        return stateEffectNonResuming(accumDelayedEffectStep(f), initial);
    }

    private static <A, B> StateFunction<A, B, B> accumStep(BiFunction<B, A, B> f) {
        Objects.requireNonNull(f, "f");
        return (x, acc) -> {
            B next = f.apply(acc, x);
            return Pair.of(next, next);
        };
    }

    private static <A, B> StateFunction<A, B, B> accumDelayedStep(BiFunction<B, A, B> f) {
        Objects.requireNonNull(f, "f");
        return (x, acc) -> Pair.of(acc, f.apply(acc, x));
    }

    private static <A, B> EffectStateFunction<A, B, B> accumEffectStep(BiFunction<B, A, Effect<B>> f) {
        Objects.requireNonNull(f, "f");
        return (x, acc) -> f.apply(acc, x).map(next -> Pair.of(next, next));
    }

    private static <A, B> EffectStateFunction<A, B, B> accumDelayedEffectStep(BiFunction<B, A, Effect<B>> f) {
        Objects.requireNonNull(f, "f");
        return (x, acc) -> f.apply(acc, x).map(next -> Pair.of(acc, next));
    }

    // ---------------------------------------------------------------------
    // General
    // ---------------------------------------------------------------------

    /**
     * Builds a pure {@code General} transducer from a step closure, the
     * encoder for its current state and the procedure that rebuilds an
     * equivalent transducer from those bytes.
     */
    public static <A, B> Transducer<A, B> general(CheckpointLoader<A, B> loader,
                                                  CheckpointSaver saver,
                                                  Function<? super A, Output<A, B>> step) {
        Objects.requireNonNull(step, "step");
        return new Transducer.General<>(false, x -> Effect.pure(step.apply(x)), saver, loader);
    }

    public static <A, B> Transducer<A, B> generalNonResuming(Function<? super A, Output<A, B>> step) {
        return general(in -> {
            in.skipRemaining();
            return generalNonResuming(step);
        }, CheckpointSaver.NONE, step);
    }

    public static <A, B> Transducer<A, B> generalEffect(CheckpointLoader<A, B> loader,
                                                        CheckpointSaver saver,
                                                        Function<? super A, ? extends Effect<Output<A, B>>> step) {
        return new Transducer.General<>(true, step, saver, loader);
    }

    public static <A, B> Transducer<A, B> generalEffectNonResuming(
            Function<? super A, ? extends Effect<Output<A, B>>> step) {
        return generalEffect(in -> {
            in.skipRemaining();
            return generalEffectNonResuming(step);
        }, CheckpointSaver.NONE, step);
    }

    /**
     * Re-expresses any transducer as an equivalent {@code General} one. The
     * result steps identically and its checkpoints wrap those of {@code t}.
     */
    public static <A, B> Transducer<A, B> toGeneral(Transducer<A, B> t) {
        Objects.requireNonNull(t, "t");
        if (t instanceof Transducer.General) {
            return t;
        }
        return new Transducer.General<>(
                t.isEffectful(),
                x -> t.step(x).map(o -> new Output<>(o.result(), toGeneral(o.next()))),
                t::writeState,
                in -> toGeneral(t.readState(in)));
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    /**
     * Sequential composition {@code g . f}: {@code f} consumes the input and
     * {@code g} consumes {@code f}'s output.
     */
    public static <A, X, B> Transducer<A, B> compose(Transducer<X, B> g, Transducer<A, X> f) {
        return Composition.compose(g, f);
    }

    public static <A, A2, B, B2> Transducer<A2, B2> dimap(Function<? super A2, ? extends A> before,
                                                          Function<? super B, ? extends B2> after,
                                                          Transducer<A, B> t) {
        return compose(Transducers.<B, B2>function(after), compose(t, Transducers.<A2, A>function(before)));
    }

    /**
     * Runs both transducers on every input, {@code t1} before {@code t2},
     * and combines their outputs.
     */
    public static <A, B1, B2, C> Transducer<A, C> zipWith(BiFunction<? super B1, ? super B2, ? extends C> combine,
                                                          Transducer<A, B1> t1,
                                                          Transducer<A, B2> t2) {
        return ParallelComposition.zipWith(combine, t1, t2);
    }

    public static <A, B1, B2> Transducer<A, Pair<B1, B2>> fanout(Transducer<A, B1> t1, Transducer<A, B2> t2) {
        return zipWith(Pair::of, t1, t2);
    }

    public static <A1, A2, B1, B2> Transducer<Pair<A1, A2>, Pair<B1, B2>> split(Transducer<A1, B1> t1,
                                                                              Transducer<A2, B2> t2) {
        return fanout(t1.<Pair<A1, A2>>contramap(Pair::first), t2.<Pair<A1, A2>>contramap(Pair::second));
    }

    public static <A, B, C> Transducer<Pair<A, C>, Pair<B, C>> first(Transducer<A, B> t) {
        return split(t, Transducers.<C>identity());
    }

    public static <A, B, C> Transducer<Pair<C, A>, Pair<C, B>> second(Transducer<A, B> t) {
        return split(Transducers.<C>identity(), t);
    }

    /**
     * Routes {@code Left} inputs to {@code l} and {@code Right} inputs to
     * {@code r}. Only the selected side steps; the other keeps its state.
     */
    public static <A1, A2, B1, B2> Transducer<Either<A1, A2>, Either<B1, B2>> choice(Transducer<A1, B1> l,
                                                                                   Transducer<A2, B2> r) {
        return ChoiceComposition.choice(l, r);
    }

    public static <A, B, C> Transducer<Either<A, C>, Either<B, C>> left(Transducer<A, B> t) {
        return choice(t, Transducers.<C>identity());
    }

    public static <A, B, C> Transducer<Either<C, A>, Either<C, B>> right(Transducer<A, B> t) {
        return choice(Transducers.<C>identity(), t);
    }

    public static <A1, A2, B> Transducer<Either<A1, A2>, B> fanin(Transducer<A1, B> l, Transducer<A2, B> r) {
        return choice(l, r).map(e -> e.<B>fold(x -> x, x -> x));
    }

    // ---------------------------------------------------------------------
    // Effects
    // ---------------------------------------------------------------------

    /**
     * Passes every effect performed by {@code t} through {@code transform}.
     * Pure variants are returned unchanged.
     */
    public static <A, B> Transducer<A, B> hoist(Transducer<A, B> t, EffectTransform transform) {
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(transform, "transform");

        return switch (t.variant()) {
            case STATELESS, STATEFUL -> t;
            case STATELESS_EFFECT -> {
                Function<A, Effect<B>> f = ((Transducer.StatelessEffect<A, B>) t).effectFunction();
                yield new Transducer.StatelessEffect<A, B>(x -> transform.apply(f.apply(x)));
            }
            case STATEFUL_EFFECT -> hoistState(((Transducer.StatefulEffect<A, B, ?>) t).effectView(), transform);
            case GENERAL -> {
                if (!t.isEffectful()) {
                    yield t;
                }
                yield new Transducer.General<A, B>(
                        true,
                        x -> transform.apply(t.step(x))
                                .map(o -> new Output<>(o.result(), hoist(o.next(), transform))),
                        t::writeState,
                        in -> hoist(t.readState(in), transform));
            }
        };
    }

    private static <A, B, S> Transducer<A, B> hoistState(StateView<A, B, S> view, EffectTransform transform) {
        EffectStateFunction<A, S, B> f = view.function();
        return new Transducer.StatefulEffect<>(view.codec(), (x, s) -> transform.apply(f.apply(x, s)), view.state());
    }

    // ---------------------------------------------------------------------
    // Running
    // ---------------------------------------------------------------------

    /**
     * Steps a pure transducer over {@code inputs} in order.
     */
    public static <A, B> RunResult<A, B> overList(Transducer<A, B> t, List<? extends A> inputs) {
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(inputs, "inputs");

        List<B> outputs = new ArrayList<>(inputs.size());
        Transducer<A, B> current = t;
        for (A x : inputs) {
            Output<A, B> o = current.stepPure(x);
            outputs.add(o.result());
            current = o.next();
        }
        return new RunResult<>(outputs, current);
    }

    /**
     * Steps a transducer over {@code inputs}; the steps' effects run in input
     * order when the returned action runs. The first failing step aborts the
     * run with that step's failure.
     */
    public static <A, B> Effect<RunResult<A, B>> overListEffect(Transducer<A, B> t, List<? extends A> inputs) {
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(inputs, "inputs");
        List<A> snapshot = new ArrayList<>(inputs);

        return () -> {
            List<B> outputs = new ArrayList<>(snapshot.size());
            Transducer<A, B> current = t;
            for (A x : snapshot) {
                Output<A, B> o = current.step(x).run();
                outputs.add(o.result());
                current = o.next();
            }
            return new RunResult<>(outputs, current);
        };
    }
}
