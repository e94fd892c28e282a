package com.questrail.transducer.core;

/**
 * Pure step function of an explicit-state transducer.
 *
 * @param <A> input type
 * @param <S> state type
 * @param <B> output type
 */
@FunctionalInterface
public interface StateFunction<A, S, B>
{
    /**
     * @return the output for this step paired with the next state
     */
    Pair<B, S> apply(A input, S state);
}
