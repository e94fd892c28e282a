package com.questrail.transducer.observability;

/**
 * Receives checkpoint lifecycle events from a {@code Checkpointer}.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CheckpointObservabilitySink {
    /**
     * Called after a transducer's state has been encoded.
     * @param event the save details
     */
    void onCheckpointSaved(CheckpointSavedEvent event);

    /**
     * Called after checkpoint bytes have been decoded against a template.
     * @param event the resume details
     */
    void onResumed(ResumeEvent event);

    /**
     * Called when checkpoint bytes were rejected, before the failure policy
     * is applied.
     * @param event the failure details
     */
    void onDecodeFailure(DecodeFailureEvent event);
}
