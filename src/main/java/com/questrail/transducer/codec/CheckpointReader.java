package com.questrail.transducer.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * CheckpointReader
 * -----------------------------------------------------------------------------
 * Bounds-checked reader over checkpoint bytes; the inverse of
 * {@link CheckpointWriter}.
 *
 * <p>Every read verifies that enough bytes remain. Running out of input, an
 * unexpected frame tag, a negative length or a malformed boolean all raise
 * {@link CheckpointDecodeException}; nothing is silently defaulted.</p>
 */
public final class CheckpointReader
{
    private final ByteBuf buffer;

    private CheckpointReader(ByteBuf buffer) {
        this.buffer = buffer;
    }

    public static CheckpointReader of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new CheckpointReader(Unpooled.wrappedBuffer(bytes));
    }

    public byte readByte() {
        require(1, "byte");
        return buffer.readByte();
    }

    public boolean readBoolean() {
        byte b = readByte();
        if (b == 0) {
            return false;
        }
        if (b == 1) {
            return true;
        }
        throw new CheckpointDecodeException("Malformed boolean byte: 0x" + Integer.toHexString(b & 0xFF));
    }

    public int readInt() {
        require(Integer.BYTES, "int");
        return buffer.readInt();
    }

    public long readLong() {
        require(Long.BYTES, "long");
        return buffer.readLong();
    }

    public double readDouble() {
        require(Double.BYTES, "double");
        return buffer.readDouble();
    }

    public byte[] readBytes() {
        int length = readLength("byte array");
        byte[] out = new byte[length];
        buffer.readBytes(out);
        return out;
    }

    public String readString() {
        return new String(readBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Reads a frame header, checks its tag and returns a reader restricted to
     * the frame payload. The payload bytes are consumed from this reader.
     *
     * @throws CheckpointDecodeException if the tag differs from {@code expected}
     *         or the declared length exceeds the remaining input
     */
    public CheckpointReader readFrame(FrameTag expected) {
        Objects.requireNonNull(expected, "expected");

        byte tag = readByte();
        if (tag != expected.code()) {
            throw new CheckpointDecodeException(
                    "Checkpoint shape mismatch: expected " + expected
                            + " frame but found " + FrameTag.describe(tag));
        }
        int length = readLength(expected + " frame");
        return new CheckpointReader(buffer.readSlice(length));
    }

    /**
     * Discards the rest of the input.
     */
    public void skipRemaining() {
        buffer.skipBytes(buffer.readableBytes());
    }

    public int remaining() {
        return buffer.readableBytes();
    }

    public boolean isExhausted() {
        return buffer.readableBytes() == 0;
    }

    /**
     * Fails if any bytes remain unread.
     */
    public void expectExhausted() {
        int left = buffer.readableBytes();
        if (left != 0) {
            throw new CheckpointDecodeException(
                    left + " unread byte(s) left after decoding; checkpoint does not match template");
        }
    }

    private int readLength(String what) {
        int length = readInt();
        if (length < 0) {
            throw new CheckpointDecodeException("Negative length " + length + " for " + what);
        }
        require(length, what);
        return length;
    }

    private void require(int bytes, String what) {
        if (buffer.readableBytes() < bytes) {
            throw new CheckpointDecodeException(
                    "Checkpoint truncated: needed " + bytes + " byte(s) for " + what
                            + " but only " + buffer.readableBytes() + " remain");
        }
    }
}
