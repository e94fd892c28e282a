package com.questrail.transducer.core;

import java.util.function.Function;

/**
 * Narrowing helpers used by the composition tables once a variant has been
 * established by a {@code switch} over {@link Transducer.Variant}.
 */
final class Views
{
    private Views() {}

    static <A, B> Transducer.Stateful<A, B, ?> stateful(Transducer<A, B> t) {
        return (Transducer.Stateful<A, B, ?>) t;
    }

    /**
     * Lifts a stateless transducer (pure or effectful) to an effect function.
     */
    static <A, B> Function<A, Effect<B>> effectFunction(Transducer<A, B> t) {
        if (t instanceof Transducer.Stateless<A, B> s) {
            return s.effectFunction();
        }
        if (t instanceof Transducer.StatelessEffect<A, B> s) {
            return s.effectFunction();
        }
        throw new IllegalStateException("Not a stateless transducer: " + t.variant());
    }

    /**
     * Lifts an explicit-state transducer (pure or effectful) to an effect view.
     */
    static <A, B> StateView<A, B, ?> effectState(Transducer<A, B> t) {
        if (t instanceof Transducer.Stateful<A, B, ?> s) {
            return s.effectView();
        }
        if (t instanceof Transducer.StatefulEffect<A, B, ?> s) {
            return s.effectView();
        }
        throw new IllegalStateException("Not an explicit-state transducer: " + t.variant());
    }
}
