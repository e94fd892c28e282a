package com.questrail.transducer.config;

/**
 * What a {@code Checkpointer} does when checkpoint bytes do not decode
 * against the template.
 */
public enum DecodeFailurePolicy
{
    /** Rethrow the {@code CheckpointDecodeException}. */
    FAIL,

    /** Resume from the template itself, i.e. its initial state. */
    RESET_TO_TEMPLATE
}
