package com.questrail.transducer.core;

/**
 * Immutable pair of values.
 *
 * <p>Used for paired state produced by composition, for the inputs and outputs
 * of parallel composition, and for event-carrying inputs of the interval
 * layer.</p>
 */
public record Pair<L, R>(L first, R second)
{
    public static <L, R> Pair<L, R> of(L first, R second) {
        return new Pair<>(first, second);
    }

    public <L2> Pair<L2, R> withFirst(L2 value) {
        return new Pair<>(value, second);
    }

    public <R2> Pair<L, R2> withSecond(R2 value) {
        return new Pair<>(first, value);
    }
}
