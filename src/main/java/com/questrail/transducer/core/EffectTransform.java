package com.questrail.transducer.core;

/**
 * A natural transformation over effects, applied by
 * {@link Transducers#hoist(Transducer, EffectTransform)} to every action an
 * effectful transducer performs.
 *
 * <p>Typical uses wrap each step's action with tracing, timing or retry
 * behavior owned by the caller's environment.</p>
 */
@FunctionalInterface
public interface EffectTransform
{
    <T> Effect<T> apply(Effect<T> effect);
}
