package com.questrail.transducer.core;

/**
 * Effectful step function of an explicit-state transducer.
 */
@FunctionalInterface
public interface EffectStateFunction<A, S, B>
{
    Effect<Pair<B, S>> apply(A input, S state);
}
