package com.questrail.transducer.codec;

/**
 * Leading byte of a checkpoint frame. The tag records which kind of
 * transducer wrote the frame so that decoding against a template of another
 * shape is detected instead of misread.
 */
public enum FrameTag
{
    /** Explicit-state transducer: the payload is the codec-encoded state. */
    STATE((byte) 'S'),

    /** General transducer: the payload is whatever its saver wrote. */
    GENERAL((byte) 'G');

    private final byte code;

    FrameTag(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    /**
     * Describes a raw tag byte for diagnostics.
     */
    static String describe(byte code) {
        for (FrameTag tag : values()) {
            if (tag.code == code) {
                return tag.name();
            }
        }
        return "unknown tag 0x" + Integer.toHexString(code & 0xFF);
    }
}
