package com.questrail.transducer.observability;

import com.questrail.transducer.core.Transducer;

import java.time.Instant;

/**
 * Record describing a successful resume from checkpoint bytes.
 */
public record ResumeEvent(
    Instant timestamp,
    Transducer.Variant variant,
    int byteCount
) {
}
