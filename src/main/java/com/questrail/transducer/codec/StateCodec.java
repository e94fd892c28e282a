package com.questrail.transducer.codec;

import java.util.Objects;
import java.util.function.Function;

/**
 * Encode/decode pair for a transducer's state.
 *
 * <p>Implementations must be mechanical inverses: {@code read} applied to the
 * bytes produced by {@code write} yields an equal value. {@code read} signals
 * malformed input by throwing {@link CheckpointDecodeException}.</p>
 *
 * @param <S> the state type
 */
public interface StateCodec<S>
{
    void write(S value, CheckpointWriter out);

    S read(CheckpointReader in);

    /**
     * Derives a codec for {@code T} by converting to and from {@code S}.
     */
    default <T> StateCodec<T> xmap(Function<? super S, ? extends T> fromState,
                                   Function<? super T, ? extends S> toState) {
        Objects.requireNonNull(fromState, "fromState");
        Objects.requireNonNull(toState, "toState");
        StateCodec<S> self = this;
        return new StateCodec<>() {
            @Override
            public void write(T value, CheckpointWriter out) {
                self.write(toState.apply(value), out);
            }

            @Override
            public T read(CheckpointReader in) {
                return fromState.apply(self.read(in));
            }
        };
    }
}
