package com.questrail.transducer.observability;

import com.questrail.transducer.codec.CheckpointDecodeException;
import com.questrail.transducer.config.DecodeFailurePolicy;
import com.questrail.transducer.core.Transducer;

import java.time.Instant;

/**
 * Record describing checkpoint bytes rejected by a template.
 */
public record DecodeFailureEvent(
    Instant timestamp,
    Transducer.Variant variant,
    int byteCount,
    DecodeFailurePolicy policy,
    CheckpointDecodeException error
) {
}
