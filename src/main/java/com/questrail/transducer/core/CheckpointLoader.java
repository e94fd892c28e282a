package com.questrail.transducer.core;

import com.questrail.transducer.codec.CheckpointDecodeException;
import com.questrail.transducer.codec.CheckpointReader;

/**
 * Stored decoding procedure of a {@link Transducer.General} transducer.
 *
 * <p>A loader is captured when the transducer is built. It reads the bytes
 * written by the matching {@link CheckpointSaver} and returns a new
 * transducer with the same behavior and the decoded state. Loaders of
 * composite transducers decode each component against its own template and
 * re-wrap the results.</p>
 */
@FunctionalInterface
public interface CheckpointLoader<A, B>
{
    /**
     * @throws CheckpointDecodeException if the bytes are truncated, malformed
     *         or were written by a transducer of a different shape
     */
    Transducer<A, B> load(CheckpointReader in);
}
