package com.questrail.transducer.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either
 * -----------------------------------------------------------------------------
 * A value tagged as {@link Left} or {@link Right}.
 *
 * <p>Choice composition routes {@code Left} inputs to one transducer and
 * {@code Right} inputs to the other.</p>
 */
public sealed interface Either<L, R>
        permits Either.Left, Either.Right
{
    record Left<L, R>(L value) implements Either<L, R> {}

    record Right<L, R>(R value) implements Either<L, R> {}

    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    default boolean isLeft() {
        return this instanceof Left;
    }

    default <T> T fold(Function<? super L, ? extends T> onLeft,
                       Function<? super R, ? extends T> onRight) {
        Objects.requireNonNull(onLeft, "onLeft");
        Objects.requireNonNull(onRight, "onRight");
        if (this instanceof Left<L, R> l) {
            return onLeft.apply(l.value());
        }
        return onRight.apply(((Right<L, R>) this).value());
    }
}
