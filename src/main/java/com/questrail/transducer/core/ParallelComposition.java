package com.questrail.transducer.core;

import com.questrail.transducer.codec.Codecs;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * ParallelComposition
 * -----------------------------------------------------------------------------
 * Runs two transducers on the same input and combines their outputs.
 *
 * <p>Both operands always step, {@code t1} first, so effects on either side
 * are never skipped. The result variant follows the same rules as sequential
 * composition:</p>
 * <ul>
 *   <li>two stateless operands stay stateless</li>
 *   <li>one explicit-state operand keeps its state and codec</li>
 *   <li>two explicit-state operands pair their states and codecs ({@code t1} first)</li>
 *   <li>either operand effectful makes the result effectful</li>
 *   <li>either operand General makes the result General</li>
 * </ul>
 */
final class ParallelComposition
{
    private ParallelComposition() {}

    static <A, B1, B2, C> Transducer<A, C> zipWith(BiFunction<? super B1, ? super B2, ? extends C> combine,
                                                   Transducer<A, B1> t1,
                                                   Transducer<A, B2> t2) {
        Objects.requireNonNull(combine, "combine");
        Objects.requireNonNull(t1, "t1");
        Objects.requireNonNull(t2, "t2");

        return switch (t1.variant()) {
            case STATELESS -> switch (t2.variant()) {
                case STATELESS -> functions(combine, (Transducer.Stateless<A, B1>) t1, (Transducer.Stateless<A, B2>) t2);
                case STATELESS_EFFECT -> effectFunctions(combine, Views.effectFunction(t1), Views.effectFunction(t2));
                case STATEFUL -> functionAndState(combine, (Transducer.Stateless<A, B1>) t1, Views.stateful(t2));
                case STATEFUL_EFFECT -> effectFunctionAndState(combine, Views.effectFunction(t1), Views.effectState(t2));
                case GENERAL -> general(combine, t1, t2);
            };
            case STATELESS_EFFECT -> switch (t2.variant()) {
                case STATELESS, STATELESS_EFFECT -> effectFunctions(combine, Views.effectFunction(t1), Views.effectFunction(t2));
                case STATEFUL, STATEFUL_EFFECT -> effectFunctionAndState(combine, Views.effectFunction(t1), Views.effectState(t2));
                case GENERAL -> general(combine, t1, t2);
            };
            case STATEFUL -> switch (t2.variant()) {
                case STATELESS -> stateAndFunction(combine, Views.stateful(t1), (Transducer.Stateless<A, B2>) t2);
                case STATELESS_EFFECT -> effectStateAndFunction(combine, Views.effectState(t1), Views.effectFunction(t2));
                case STATEFUL -> states(combine, Views.stateful(t1), Views.stateful(t2));
                case STATEFUL_EFFECT -> effectStates(combine, Views.effectState(t1), Views.effectState(t2));
                case GENERAL -> general(combine, t1, t2);
            };
            case STATEFUL_EFFECT -> switch (t2.variant()) {
                case STATELESS, STATELESS_EFFECT -> effectStateAndFunction(combine, Views.effectState(t1), Views.effectFunction(t2));
                case STATEFUL, STATEFUL_EFFECT -> effectStates(combine, Views.effectState(t1), Views.effectState(t2));
                case GENERAL -> general(combine, t1, t2);
            };
            case GENERAL -> general(combine, t1, t2);
        };
    }

    // ---------------------------------------------------------------------
    // Pure cases
    // ---------------------------------------------------------------------

    private static <A, B1, B2, C> Transducer<A, C> functions(BiFunction<? super B1, ? super B2, ? extends C> combine,
                                                             Transducer.Stateless<A, B1> t1,
                                                             Transducer.Stateless<A, B2> t2) {
        return new Transducer.Stateless<A, C>(x -> {
            B1 y1 = t1.apply(x);
            B2 y2 = t2.apply(x);
            return combine.apply(y1, y2);
        });
    }

    private static <A, B1, B2, C, S> Transducer<A, C> functionAndState(
            BiFunction<? super B1, ? super B2, ? extends C> combine,
            Transducer.Stateless<A, B1> t1,
            Transducer.Stateful<A, B2, S> t2) {
        StateFunction<A, S, B2> f2 = t2.function();
        return new Transducer.Stateful<A, C, S>(t2.codec(), (x, s) -> {
            B1 y1 = t1.apply(x);
            Pair<B2, S> r2 = f2.apply(x, s);
            return Pair.of(combine.apply(y1, r2.first()), r2.second());
        }, t2.state());
    }

    private static <A, B1, B2, C, S> Transducer<A, C> stateAndFunction(
            BiFunction<? super B1, ? super B2, ? extends C> combine,
            Transducer.Stateful<A, B1, S> t1,
            Transducer.Stateless<A, B2> t2) {
        StateFunction<A, S, B1> f1 = t1.function();
        return new Transducer.Stateful<A, C, S>(t1.codec(), (x, s) -> {
            Pair<B1, S> r1 = f1.apply(x, s);
            B2 y2 = t2.apply(x);
            return Pair.of(combine.apply(r1.first(), y2), r1.second());
        }, t1.state());
    }

    private static <A, B1, B2, C, S1, S2> Transducer<A, C> states(
            BiFunction<? super B1, ? super B2, ? extends C> combine,
            Transducer.Stateful<A, B1, S1> t1,
            Transducer.Stateful<A, B2, S2> t2) {
        StateFunction<A, S1, B1> f1 = t1.function();
        StateFunction<A, S2, B2> f2 = t2.function();
        StateFunction<A, Pair<S1, S2>, C> step = (x, s) -> {
            Pair<B1, S1> r1 = f1.apply(x, s.first());
            Pair<B2, S2> r2 = f2.apply(x, s.second());
            return Pair.of(combine.apply(r1.first(), r2.first()), Pair.of(r1.second(), r2.second()));
        };
        return new Transducer.Stateful<>(Codecs.pair(t1.codec(), t2.codec()), step, Pair.of(t1.state(), t2.state()));
    }

    // ---------------------------------------------------------------------
    // Effectful cases
    // ---------------------------------------------------------------------

    private static <A, B1, B2, C> Transducer<A, C> effectFunctions(
            BiFunction<? super B1, ? super B2, ? extends C> combine,
            Function<A, Effect<B1>> f1,
            Function<A, Effect<B2>> f2) {
        return new Transducer.StatelessEffect<A, C>(x -> f1.apply(x)
                .flatMap(y1 -> f2.apply(x).map(y2 -> (C) combine.apply(y1, y2))));
    }

    private static <A, B1, B2, C, S> Transducer<A, C> effectFunctionAndState(
            BiFunction<? super B1, ? super B2, ? extends C> combine,
            Function<A, Effect<B1>> f1,
            StateView<A, B2, S> t2) {
        EffectStateFunction<A, S, B2> f2 = t2.function();
        return new Transducer.StatefulEffect<A, C, S>(t2.codec(), (x, s) -> f1.apply(x)
                .flatMap(y1 -> f2.apply(x, s)
                        .map(r2 -> Pair.of((C) combine.apply(y1, r2.first()), r2.second()))),
                t2.state());
    }

    private static <A, B1, B2, C, S> Transducer<A, C> effectStateAndFunction(
            BiFunction<? super B1, ? super B2, ? extends C> combine,
            StateView<A, B1, S> t1,
            Function<A, Effect<B2>> f2) {
        EffectStateFunction<A, S, B1> f1 = t1.function();
        return new Transducer.StatefulEffect<A, C, S>(t1.codec(), (x, s) -> f1.apply(x, s)
                .flatMap(r1 -> f2.apply(x)
                        .map(y2 -> Pair.of((C) combine.apply(r1.first(), y2), r1.second()))),
                t1.state());
    }

    private static <A, B1, B2, C, S1, S2> Transducer<A, C> effectStates(
            BiFunction<? super B1, ? super B2, ? extends C> combine,
            StateView<A, B1, S1> t1,
            StateView<A, B2, S2> t2) {
        EffectStateFunction<A, S1, B1> f1 = t1.function();
        EffectStateFunction<A, S2, B2> f2 = t2.function();
        EffectStateFunction<A, Pair<S1, S2>, C> step = (x, s) -> f1.apply(x, s.first())
                .flatMap(r1 -> f2.apply(x, s.second())
                        .map(r2 -> Pair.of((C) combine.apply(r1.first(), r2.first()),
                                Pair.of(r1.second(), r2.second()))));
        return new Transducer.StatefulEffect<>(Codecs.pair(t1.codec(), t2.codec()), step,
                Pair.of(t1.state(), t2.state()));
    }

    // ---------------------------------------------------------------------
    // General fallback
    // ---------------------------------------------------------------------

    static <A, B1, B2, C> Transducer<A, C> general(BiFunction<? super B1, ? super B2, ? extends C> combine,
                                                   Transducer<A, B1> t1,
                                                   Transducer<A, B2> t2) {
        return new Transducer.General<A, C>(
                t1.isEffectful() || t2.isEffectful(),
                x -> t1.step(x).flatMap(o1 -> t2.step(x)
                        .map(o2 -> new Output<A, C>(combine.apply(o1.result(), o2.result()),
                                general(combine, o1.next(), o2.next())))),
                out -> {
                    t1.writeState(out);
                    t2.writeState(out);
                },
                in -> {
                    Transducer<A, B1> loaded1 = t1.readState(in);
                    Transducer<A, B2> loaded2 = t2.readState(in);
                    return general(combine, loaded1, loaded2);
                });
    }
}
