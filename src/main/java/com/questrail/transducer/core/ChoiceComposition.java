package com.questrail.transducer.core;

import com.questrail.transducer.codec.Codecs;

import java.util.Objects;
import java.util.function.Function;

/**
 * ChoiceComposition
 * -----------------------------------------------------------------------------
 * Routes {@code Left} inputs to one transducer and {@code Right} inputs to the
 * other. Only the selected branch steps; the other branch keeps its state
 * untouched and performs no effects.
 *
 * <p>Variant selection follows the sequential table: two stateless branches
 * stay stateless, a single explicit-state branch keeps its codec, two
 * explicit-state branches pair their states ({@code l} first), effects make
 * the result effectful and a General branch makes the result General.</p>
 */
final class ChoiceComposition
{
    private ChoiceComposition() {}

    static <A1, A2, B1, B2> Transducer<Either<A1, A2>, Either<B1, B2>> choice(Transducer<A1, B1> l,
                                                                            Transducer<A2, B2> r) {
        Objects.requireNonNull(l, "l");
        Objects.requireNonNull(r, "r");

        return switch (l.variant()) {
            case STATELESS -> switch (r.variant()) {
                case STATELESS -> functions((Transducer.Stateless<A1, B1>) l, (Transducer.Stateless<A2, B2>) r);
                case STATELESS_EFFECT -> effectFunctions(Views.effectFunction(l), Views.effectFunction(r));
                case STATEFUL -> functionOrState((Transducer.Stateless<A1, B1>) l, Views.stateful(r));
                case STATEFUL_EFFECT -> effectFunctionOrState(Views.effectFunction(l), Views.effectState(r));
                case GENERAL -> general(l, r);
            };
            case STATELESS_EFFECT -> switch (r.variant()) {
                case STATELESS, STATELESS_EFFECT -> effectFunctions(Views.effectFunction(l), Views.effectFunction(r));
                case STATEFUL, STATEFUL_EFFECT -> effectFunctionOrState(Views.effectFunction(l), Views.effectState(r));
                case GENERAL -> general(l, r);
            };
            case STATEFUL -> switch (r.variant()) {
                case STATELESS -> stateOrFunction(Views.stateful(l), (Transducer.Stateless<A2, B2>) r);
                case STATELESS_EFFECT -> effectStateOrFunction(Views.effectState(l), Views.effectFunction(r));
                case STATEFUL -> states(Views.stateful(l), Views.stateful(r));
                case STATEFUL_EFFECT -> effectStates(Views.effectState(l), Views.effectState(r));
                case GENERAL -> general(l, r);
            };
            case STATEFUL_EFFECT -> switch (r.variant()) {
                case STATELESS, STATELESS_EFFECT -> effectStateOrFunction(Views.effectState(l), Views.effectFunction(r));
                case STATEFUL, STATEFUL_EFFECT -> effectStates(Views.effectState(l), Views.effectState(r));
                case GENERAL -> general(l, r);
            };
            case GENERAL -> general(l, r);
        };
    }

    // ---------------------------------------------------------------------
    // Pure cases
    // ---------------------------------------------------------------------

    private static <A1, A2, B1, B2> Transducer<Either<A1, A2>, Either<B1, B2>> functions(
            Transducer.Stateless<A1, B1> l,
            Transducer.Stateless<A2, B2> r) {
        return new Transducer.Stateless<Either<A1, A2>, Either<B1, B2>>(e -> {
            if (e instanceof Either.Left<A1, A2> x) {
                return Either.<B1, B2>left(l.apply(x.value()));
            }
            return Either.<B1, B2>right(r.apply(((Either.Right<A1, A2>) e).value()));
        });
    }

    private static <A1, A2, B1, B2, S> Transducer<Either<A1, A2>, Either<B1, B2>> functionOrState(
            Transducer.Stateless<A1, B1> l,
            Transducer.Stateful<A2, B2, S> r) {
        StateFunction<A2, S, B2> rf = r.function();
        StateFunction<Either<A1, A2>, S, Either<B1, B2>> step = (e, s) -> {
            if (e instanceof Either.Left<A1, A2> x) {
                return Pair.of(Either.<B1, B2>left(l.apply(x.value())), s);
            }
            Pair<B2, S> rr = rf.apply(((Either.Right<A1, A2>) e).value(), s);
            return Pair.of(Either.<B1, B2>right(rr.first()), rr.second());
        };
        return new Transducer.Stateful<>(r.codec(), step, r.state());
    }

    private static <A1, A2, B1, B2, S> Transducer<Either<A1, A2>, Either<B1, B2>> stateOrFunction(
            Transducer.Stateful<A1, B1, S> l,
            Transducer.Stateless<A2, B2> r) {
        StateFunction<A1, S, B1> lf = l.function();
        StateFunction<Either<A1, A2>, S, Either<B1, B2>> step = (e, s) -> {
            if (e instanceof Either.Left<A1, A2> x) {
                Pair<B1, S> lr = lf.apply(x.value(), s);
                return Pair.of(Either.<B1, B2>left(lr.first()), lr.second());
            }
            return Pair.of(Either.<B1, B2>right(r.apply(((Either.Right<A1, A2>) e).value())), s);
        };
        return new Transducer.Stateful<>(l.codec(), step, l.state());
    }

    private static <A1, A2, B1, B2, SL, SR> Transducer<Either<A1, A2>, Either<B1, B2>> states(
            Transducer.Stateful<A1, B1, SL> l,
            Transducer.Stateful<A2, B2, SR> r) {
        StateFunction<A1, SL, B1> lf = l.function();
        StateFunction<A2, SR, B2> rf = r.function();
        StateFunction<Either<A1, A2>, Pair<SL, SR>, Either<B1, B2>> step = (e, s) -> {
            if (e instanceof Either.Left<A1, A2> x) {
                Pair<B1, SL> lr = lf.apply(x.value(), s.first());
                return Pair.of(Either.<B1, B2>left(lr.first()), s.withFirst(lr.second()));
            }
            Pair<B2, SR> rr = rf.apply(((Either.Right<A1, A2>) e).value(), s.second());
            return Pair.of(Either.<B1, B2>right(rr.first()), s.withSecond(rr.second()));
        };
        return new Transducer.Stateful<>(Codecs.pair(l.codec(), r.codec()), step, Pair.of(l.state(), r.state()));
    }

    // ---------------------------------------------------------------------
    // Effectful cases
    // ---------------------------------------------------------------------

    private static <A1, A2, B1, B2> Transducer<Either<A1, A2>, Either<B1, B2>> effectFunctions(
            Function<A1, Effect<B1>> l,
            Function<A2, Effect<B2>> r) {
        return new Transducer.StatelessEffect<Either<A1, A2>, Either<B1, B2>>(e -> {
            if (e instanceof Either.Left<A1, A2> x) {
                return l.apply(x.value()).map(Either::<B1, B2>left);
            }
            return r.apply(((Either.Right<A1, A2>) e).value()).map(Either::<B1, B2>right);
        });
    }

    private static <A1, A2, B1, B2, S> Transducer<Either<A1, A2>, Either<B1, B2>> effectFunctionOrState(
            Function<A1, Effect<B1>> l,
            StateView<A2, B2, S> r) {
        EffectStateFunction<A2, S, B2> rf = r.function();
        EffectStateFunction<Either<A1, A2>, S, Either<B1, B2>> step = (e, s) -> {
            if (e instanceof Either.Left<A1, A2> x) {
                return l.apply(x.value()).map(y -> Pair.of(Either.<B1, B2>left(y), s));
            }
            return rf.apply(((Either.Right<A1, A2>) e).value(), s)
                    .map(rr -> Pair.of(Either.<B1, B2>right(rr.first()), rr.second()));
        };
        return new Transducer.StatefulEffect<>(r.codec(), step, r.state());
    }

    private static <A1, A2, B1, B2, S> Transducer<Either<A1, A2>, Either<B1, B2>> effectStateOrFunction(
            StateView<A1, B1, S> l,
            Function<A2, Effect<B2>> r) {
        EffectStateFunction<A1, S, B1> lf = l.function();
        EffectStateFunction<Either<A1, A2>, S, Either<B1, B2>> step = (e, s) -> {
            if (e instanceof Either.Left<A1, A2> x) {
                return lf.apply(x.value(), s)
                        .map(lr -> Pair.of(Either.<B1, B2>left(lr.first()), lr.second()));
            }
            return r.apply(((Either.Right<A1, A2>) e).value()).map(y -> Pair.of(Either.<B1, B2>right(y), s));
        };
        return new Transducer.StatefulEffect<>(l.codec(), step, l.state());
    }

    private static <A1, A2, B1, B2, SL, SR> Transducer<Either<A1, A2>, Either<B1, B2>> effectStates(
            StateView<A1, B1, SL> l,
            StateView<A2, B2, SR> r) {
        EffectStateFunction<A1, SL, B1> lf = l.function();
        EffectStateFunction<A2, SR, B2> rf = r.function();
        EffectStateFunction<Either<A1, A2>, Pair<SL, SR>, Either<B1, B2>> step = (e, s) -> {
            if (e instanceof Either.Left<A1, A2> x) {
                return lf.apply(x.value(), s.first())
                        .map(lr -> Pair.of(Either.<B1, B2>left(lr.first()), s.withFirst(lr.second())));
            }
            return rf.apply(((Either.Right<A1, A2>) e).value(), s.second())
                    .map(rr -> Pair.of(Either.<B1, B2>right(rr.first()), s.withSecond(rr.second())));
        };
        return new Transducer.StatefulEffect<>(Codecs.pair(l.codec(), r.codec()), step,
                Pair.of(l.state(), r.state()));
    }

    // ---------------------------------------------------------------------
    // General fallback
    // ---------------------------------------------------------------------

    static <A1, A2, B1, B2> Transducer<Either<A1, A2>, Either<B1, B2>> general(Transducer<A1, B1> l,
                                                                             Transducer<A2, B2> r) {
        return new Transducer.General<Either<A1, A2>, Either<B1, B2>>(
                l.isEffectful() || r.isEffectful(),
                e -> {
                    if (e instanceof Either.Left<A1, A2> x) {
                        return l.step(x.value()).map(o -> new Output<Either<A1, A2>, Either<B1, B2>>(
                                Either.<B1, B2>left(o.result()), general(o.next(), r)));
                    }
                    return r.step(((Either.Right<A1, A2>) e).value()).map(o -> new Output<Either<A1, A2>, Either<B1, B2>>(
                            Either.<B1, B2>right(o.result()), general(l, o.next())));
                },
                out -> {
                    l.writeState(out);
                    r.writeState(out);
                },
                in -> {
                    Transducer<A1, B1> lLoaded = l.readState(in);
                    Transducer<A2, B2> rLoaded = r.readState(in);
                    return general(lLoaded, rLoaded);
                });
    }
}
