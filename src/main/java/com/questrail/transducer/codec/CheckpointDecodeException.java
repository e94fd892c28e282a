package com.questrail.transducer.codec;

/**
 * Indicates that checkpoint bytes could not be decoded against a template
 * transducer.
 *
 * This typically reflects:
 * <ul>
 *   <li>Truncated input (the byte stream ended early)</li>
 *   <li>A frame written by a transducer of a different shape</li>
 *   <li>Trailing bytes left over after the template consumed its state</li>
 *   <li>Failure in a state codec's own validation</li>
 * </ul>
 *
 * It is the only error kind the kernel itself defines.
 */
public final class CheckpointDecodeException extends RuntimeException
{
    public CheckpointDecodeException(String message) {
        super(message);
    }

    public CheckpointDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
