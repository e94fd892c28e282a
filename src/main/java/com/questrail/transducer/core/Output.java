package com.questrail.transducer.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * The full result of one step: the value produced and the successor
 * transducer that consumes the next input.
 *
 * @param result the value produced by the step
 * @param next   the transducer to step next
 */
public record Output<A, B>(B result, Transducer<A, B> next)
{
    public Output {
        Objects.requireNonNull(next, "next");
    }

    /**
     * Maps the result and the successor independently.
     */
    public <A2, C> Output<A2, C> onOutput(Function<? super B, ? extends C> onResult,
                                          Function<? super Transducer<A, B>, ? extends Transducer<A2, C>> onNext) {
        return new Output<>(onResult.apply(result), onNext.apply(next));
    }

    public Output<A, B> withResult(B value) {
        return new Output<>(value, next);
    }

    public <A2> Output<A2, B> withNext(Transducer<A2, B> successor) {
        return new Output<>(result, successor);
    }
}
