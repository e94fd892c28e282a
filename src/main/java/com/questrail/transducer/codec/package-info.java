/**
 * Checkpoint Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>byte-level checkpoint format</strong>
 * shared by every transducer variant.</p>
 *
 * <h2>Frames</h2>
 * <pre>
 *   explicit-state transducer   ['S'][int32 length][codec payload]
 *   General transducer          ['G'][int32 length][saver payload]
 *   stateless transducer        (nothing)
 * </pre>
 *
 * <p>Composite transducers concatenate the frames of their parts in a fixed
 * order. Integers are big-endian.</p>
 *
 * <h2>Decoding Rules</h2>
 * <ul>
 *   <li>The frame tag must match the template's variant.</li>
 *   <li>Every read is bounds-checked against the remaining input.</li>
 *   <li>A frame's payload must be consumed exactly, and so must the whole
 *       checkpoint.</li>
 * </ul>
 *
 * <p>Any violation is reported as a {@link CheckpointDecodeException}. No
 * compatibility is kept across changes to a transducer's construction.</p>
 */
package com.questrail.transducer.codec;
