package com.questrail.transducer.core;

import com.questrail.transducer.codec.Codecs;

import java.util.Objects;
import java.util.function.Function;

/**
 * Composition
 * -----------------------------------------------------------------------------
 * Sequential composition {@code g . f} as an explicit case table over the
 * variants of both operands.
 *
 * <h2>Specialization table</h2>
 * <pre>
 *   g \ f            | STATELESS   STATELESS_EFFECT  STATEFUL         STATEFUL_EFFECT  GENERAL
 *   -----------------+--------------------------------------------------------------------------
 *   STATELESS        | STATELESS   STATELESS_EFFECT  STATEFUL         STATEFUL_EFFECT  GENERAL
 *   STATELESS_EFFECT | S_EFFECT    STATELESS_EFFECT  STATEFUL_EFFECT  STATEFUL_EFFECT  GENERAL
 *   STATEFUL         | STATEFUL    STATEFUL_EFFECT   STATEFUL (pair)  S_EFFECT (pair)  GENERAL
 *   STATEFUL_EFFECT  | S_EFFECT    STATEFUL_EFFECT   S_EFFECT (pair)  S_EFFECT (pair)  GENERAL
 *   GENERAL          | GENERAL     GENERAL           GENERAL          GENERAL          GENERAL
 * </pre>
 *
 * When both operands carry state, the result's state is {@code (gState, fState)}
 * and its codec writes {@code g}'s state before {@code f}'s.
 */
final class Composition
{
    private Composition() {}

    static <A, X, B> Transducer<A, B> compose(Transducer<X, B> g, Transducer<A, X> f) {
        Objects.requireNonNull(g, "g");
        Objects.requireNonNull(f, "f");

        return switch (g.variant()) {
            case STATELESS -> switch (f.variant()) {
                case STATELESS -> functions(stateless(g), stateless(f));
                case STATELESS_EFFECT -> effectFunctions(Views.effectFunction(g), Views.effectFunction(f));
                case STATEFUL -> functionAfterState(stateless(g), Views.stateful(f));
                case STATEFUL_EFFECT -> effectFunctionAfterState(Views.effectFunction(g), Views.effectState(f));
                case GENERAL -> general(g, f);
            };
            case STATELESS_EFFECT -> switch (f.variant()) {
                case STATELESS, STATELESS_EFFECT -> effectFunctions(Views.effectFunction(g), Views.effectFunction(f));
                case STATEFUL, STATEFUL_EFFECT -> effectFunctionAfterState(Views.effectFunction(g), Views.effectState(f));
                case GENERAL -> general(g, f);
            };
            case STATEFUL -> switch (f.variant()) {
                case STATELESS -> stateAfterFunction(Views.stateful(g), stateless(f));
                case STATELESS_EFFECT -> effectStateAfterFunction(Views.effectState(g), Views.effectFunction(f));
                case STATEFUL -> states(Views.stateful(g), Views.stateful(f));
                case STATEFUL_EFFECT -> effectStates(Views.effectState(g), Views.effectState(f));
                case GENERAL -> general(g, f);
            };
            case STATEFUL_EFFECT -> switch (f.variant()) {
                case STATELESS, STATELESS_EFFECT -> effectStateAfterFunction(Views.effectState(g), Views.effectFunction(f));
                case STATEFUL, STATEFUL_EFFECT -> effectStates(Views.effectState(g), Views.effectState(f));
                case GENERAL -> general(g, f);
            };
            case GENERAL -> general(g, f);
        };
    }

    private static <A, B> Transducer.Stateless<A, B> stateless(Transducer<A, B> t) {
        return (Transducer.Stateless<A, B>) t;
    }

    // ---------------------------------------------------------------------
    // Pure cases
    // ---------------------------------------------------------------------

    private static <A, X, B> Transducer<A, B> functions(Transducer.Stateless<X, B> g, Transducer.Stateless<A, X> f) {
        return new Transducer.Stateless<A, B>(x -> g.apply(f.apply(x)));
    }

    private static <A, X, B, S> Transducer<A, B> functionAfterState(Transducer.Stateless<X, B> g,
                                                                     Transducer.Stateful<A, X, S> f) {
        StateFunction<A, S, X> ff = f.function();
        return new Transducer.Stateful<A, B, S>(f.codec(), (x, s) -> {
            Pair<X, S> r = ff.apply(x, s);
            return Pair.of(g.apply(r.first()), r.second());
        }, f.state());
    }

    private static <A, X, B, S> Transducer<A, B> stateAfterFunction(Transducer.Stateful<X, B, S> g,
                                                                     Transducer.Stateless<A, X> f) {
        StateFunction<X, S, B> gf = g.function();
        return new Transducer.Stateful<A, B, S>(g.codec(), (x, s) -> gf.apply(f.apply(x), s), g.state());
    }

    private static <A, X, B, SG, SF> Transducer<A, B> states(Transducer.Stateful<X, B, SG> g,
                                                              Transducer.Stateful<A, X, SF> f) {
        StateFunction<X, SG, B> gf = g.function();
        StateFunction<A, SF, X> ff = f.function();
        StateFunction<A, Pair<SG, SF>, B> step = (x, s) -> {
            Pair<X, SF> fr = ff.apply(x, s.second());
            Pair<B, SG> gr = gf.apply(fr.first(), s.first());
            return Pair.of(gr.first(), Pair.of(gr.second(), fr.second()));
        };
        return new Transducer.Stateful<>(Codecs.pair(g.codec(), f.codec()), step, Pair.of(g.state(), f.state()));
    }

    // ---------------------------------------------------------------------
    // Effectful cases
    // ---------------------------------------------------------------------

    private static <A, X, B> Transducer<A, B> effectFunctions(Function<X, Effect<B>> g, Function<A, Effect<X>> f) {
        return new Transducer.StatelessEffect<A, B>(x -> f.apply(x).flatMap(g));
    }

    private static <A, X, B, S> Transducer<A, B> effectFunctionAfterState(Function<X, Effect<B>> g,
                                                                           StateView<A, X, S> f) {
        EffectStateFunction<A, S, X> ff = f.function();
        return new Transducer.StatefulEffect<A, B, S>(f.codec(),
                (x, s) -> ff.apply(x, s).flatMap(r -> g.apply(r.first()).map(z -> Pair.of(z, r.second()))),
                f.state());
    }

    private static <A, X, B, S> Transducer<A, B> effectStateAfterFunction(StateView<X, B, S> g,
                                                                           Function<A, Effect<X>> f) {
        EffectStateFunction<X, S, B> gf = g.function();
        return new Transducer.StatefulEffect<A, B, S>(g.codec(),
                (x, s) -> f.apply(x).flatMap(y -> gf.apply(y, s)),
                g.state());
    }

    private static <A, X, B, SG, SF> Transducer<A, B> effectStates(StateView<X, B, SG> g, StateView<A, X, SF> f) {
        EffectStateFunction<X, SG, B> gf = g.function();
        EffectStateFunction<A, SF, X> ff = f.function();
        EffectStateFunction<A, Pair<SG, SF>, B> step = (x, s) -> ff.apply(x, s.second())
                .flatMap(fr -> gf.apply(fr.first(), s.first())
                        .map(gr -> Pair.of(gr.first(), Pair.of(gr.second(), fr.second()))));
        return new Transducer.StatefulEffect<>(Codecs.pair(g.codec(), f.codec()), step, Pair.of(g.state(), f.state()));
    }

    // ---------------------------------------------------------------------
    // General fallback
    // ---------------------------------------------------------------------

    /**
     * Wraps both operands in a closure. Each step recomposes the operands'
     * successors through this same method, so the result stays General for
     * its whole lifetime and its checkpoint layout stays stable.
     */
    static <A, X, B> Transducer<A, B> general(Transducer<X, B> g, Transducer<A, X> f) {
        return new Transducer.General<A, B>(
                g.isEffectful() || f.isEffectful(),
                x -> f.step(x).flatMap(fo -> g.step(fo.result())
                        .map(go -> new Output<>(go.result(), general(go.next(), fo.next())))),
                out -> {
                    g.writeState(out);
                    f.writeState(out);
                },
                in -> {
                    Transducer<X, B> gLoaded = g.readState(in);
                    Transducer<A, X> fLoaded = f.readState(in);
                    return general(gLoaded, fLoaded);
                });
    }
}
