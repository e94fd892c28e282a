package com.questrail.transducer.observability;

import com.questrail.transducer.core.Transducer;

import java.time.Instant;

/**
 * Record describing a successful checkpoint save.
 */
public record CheckpointSavedEvent(
    Instant timestamp,
    Transducer.Variant variant,
    int byteCount
) {
}
