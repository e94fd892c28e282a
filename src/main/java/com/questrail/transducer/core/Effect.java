package com.questrail.transducer.core;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Effect
 * -----------------------------------------------------------------------------
 * A deferred action that may perform side effects and yields a value.
 *
 * <p>This is the kernel's view of the environment's effect context. The kernel
 * only ever needs three things from it:</p>
 * <ul>
 *   <li>lift a pure value ({@link #pure(Object)})</li>
 *   <li>sequence two actions ({@link #flatMap(Function)})</li>
 *   <li>run an action to obtain its value ({@link #run()})</li>
 * </ul>
 *
 * <p>Failures belong to the effect context. Whatever {@link #run()} throws is
 * propagated unchanged through every effectful step and composition; the
 * kernel never catches or reinterprets it.</p>
 *
 * @param <T> the value produced by the action
 */
@FunctionalInterface
public interface Effect<T>
{
    /**
     * Performs the action and returns its value.
     */
    T run();

    default <U> Effect<U> map(Function<? super T, ? extends U> f) {
        Objects.requireNonNull(f, "f");
        return () -> f.apply(run());
    }

    default <U> Effect<U> flatMap(Function<? super T, ? extends Effect<U>> f) {
        Objects.requireNonNull(f, "f");
        return () -> f.apply(run()).run();
    }

    /**
     * Runs this action, discards its value, then runs {@code next}.
     */
    default <U> Effect<U> then(Effect<U> next) {
        Objects.requireNonNull(next, "next");
        return () -> {
            run();
            return next.run();
        };
    }

    static <T> Effect<T> pure(T value) {
        return () -> value;
    }

    static <T> Effect<T> of(Supplier<? extends T> action) {
        Objects.requireNonNull(action, "action");
        return action::get;
    }
}
