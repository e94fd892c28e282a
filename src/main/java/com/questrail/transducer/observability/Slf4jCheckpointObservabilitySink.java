package com.questrail.transducer.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CheckpointObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCheckpointObservabilitySink implements CheckpointObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCheckpointObservabilitySink.class);

    @Override
    public void onCheckpointSaved(CheckpointSavedEvent event) {
        log.debug("Checkpoint saved: {} transducer, {} bytes", event.variant(), event.byteCount());
    }

    @Override
    public void onResumed(ResumeEvent event) {
        log.debug("Checkpoint resumed: {} transducer, {} bytes", event.variant(), event.byteCount());
    }

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {
        log.warn("Checkpoint rejected for {} transducer ({} bytes), policy {}: {}",
            event.variant(),
            event.byteCount(),
            event.policy(),
            event.error().getMessage());
    }
}
