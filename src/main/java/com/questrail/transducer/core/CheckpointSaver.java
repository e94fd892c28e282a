package com.questrail.transducer.core;

import com.questrail.transducer.codec.CheckpointWriter;

/**
 * Encoder attached to a {@link Transducer.General} transducer. Writes whatever
 * the matching {@link CheckpointLoader} needs to rebuild an equivalent
 * transducer.
 */
@FunctionalInterface
public interface CheckpointSaver
{
    CheckpointSaver NONE = out -> { };

    void save(CheckpointWriter out);
}
