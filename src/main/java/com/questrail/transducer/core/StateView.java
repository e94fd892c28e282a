package com.questrail.transducer.core;

import com.questrail.transducer.codec.CheckpointDecodeException;
import com.questrail.transducer.codec.CheckpointReader;
import com.questrail.transducer.codec.FrameTag;
import com.questrail.transducer.codec.StateCodec;

/**
 * Effect-lifted view of an explicit-state transducer, used by the
 * composition tables when at least one operand is effectful.
 */
record StateView<A, B, S>(StateCodec<S> codec, EffectStateFunction<A, S, B> function, S state)
{
    static <S> S readStateFrame(StateCodec<S> codec, CheckpointReader in) {
        CheckpointReader body = in.readFrame(FrameTag.STATE);
        S state;
        try {
            state = codec.read(body);
        } catch (CheckpointDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CheckpointDecodeException("State codec rejected checkpoint payload", e);
        }
        body.expectExhausted();
        return state;
    }
}
