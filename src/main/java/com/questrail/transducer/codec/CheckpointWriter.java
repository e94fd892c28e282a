package com.questrail.transducer.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * CheckpointWriter
 * -----------------------------------------------------------------------------
 * Append-only writer for checkpoint bytes.
 *
 * <p>All multi-byte values are big-endian. Variable-length values (byte
 * arrays, strings) are prefixed with their length as a 32-bit integer.</p>
 *
 * <p>Frames ({@link #writeFrame(FrameTag, Consumer)}) wrap the state of one
 * transducer as {@code [tag][int length][payload]}. The length is
 * back-patched once the payload has been written.</p>
 */
public final class CheckpointWriter
{
    private final ByteBuf buffer;

    private CheckpointWriter(ByteBuf buffer) {
        this.buffer = buffer;
    }

    public static CheckpointWriter create() {
        return new CheckpointWriter(Unpooled.buffer());
    }

    public CheckpointWriter writeByte(int value) {
        buffer.writeByte(value);
        return this;
    }

    public CheckpointWriter writeBoolean(boolean value) {
        buffer.writeByte(value ? 1 : 0);
        return this;
    }

    public CheckpointWriter writeInt(int value) {
        buffer.writeInt(value);
        return this;
    }

    public CheckpointWriter writeLong(long value) {
        buffer.writeLong(value);
        return this;
    }

    public CheckpointWriter writeDouble(double value) {
        buffer.writeDouble(value);
        return this;
    }

    public CheckpointWriter writeBytes(byte[] value) {
        Objects.requireNonNull(value, "value");
        buffer.writeInt(value.length);
        buffer.writeBytes(value);
        return this;
    }

    public CheckpointWriter writeString(String value) {
        Objects.requireNonNull(value, "value");
        return writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes a tagged, length-prefixed frame whose payload is produced by
     * {@code body}.
     */
    public CheckpointWriter writeFrame(FrameTag tag, Consumer<CheckpointWriter> body) {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(body, "body");

        buffer.writeByte(tag.code());
        int lengthIndex = buffer.writerIndex();
        buffer.writeInt(0);

        body.accept(this);

        int length = buffer.writerIndex() - lengthIndex - Integer.BYTES;
        buffer.setInt(lengthIndex, length);
        return this;
    }

    /**
     * Number of bytes written so far.
     */
    public int size() {
        return buffer.readableBytes();
    }

    public byte[] toByteArray() {
        byte[] out = new byte[buffer.readableBytes()];
        buffer.getBytes(buffer.readerIndex(), out);
        return out;
    }
}
