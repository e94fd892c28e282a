package com.questrail.transducer.observability;

/**
 * No-op implementation of CheckpointObservabilitySink.
 */
public final class NullObservabilitySink implements CheckpointObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCheckpointSaved(CheckpointSavedEvent event) {}

    @Override
    public void onResumed(ResumeEvent event) {}

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {}
}
