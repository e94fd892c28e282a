package com.questrail.transducer.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CheckpointReaderWriterTest
 * -----------------------------------------------------------------------------
 * Byte-level behavior of the checkpoint writer and its bounds-checked reader.
 */
final class CheckpointReaderWriterTest
{
    @Test
    void primitivesAreBigEndian()
    {
        byte[] bytes = CheckpointWriter.create()
                .writeInt(0x01020304)
                .writeBoolean(true)
                .toByteArray();

        assertArrayEquals(new byte[] { 1, 2, 3, 4, 1 }, bytes);
    }

    @Test
    void readsBackWhatWasWritten()
    {
        byte[] bytes = CheckpointWriter.create()
                .writeByte(7)
                .writeLong(-5L)
                .writeDouble(2.5)
                .writeString("checkpoint é")
                .writeBytes(new byte[] { 9, 8 })
                .toByteArray();

        CheckpointReader in = CheckpointReader.of(bytes);
        assertEquals(7, in.readByte());
        assertEquals(-5L, in.readLong());
        assertEquals(2.5, in.readDouble());
        assertEquals("checkpoint é", in.readString());
        assertArrayEquals(new byte[] { 9, 8 }, in.readBytes());
        assertTrue(in.isExhausted());
    }

    @Test
    void frameLengthIsBackPatched()
    {
        CheckpointWriter out = CheckpointWriter.create();
        out.writeFrame(FrameTag.STATE, w -> w.writeInt(42).writeBoolean(false));

        assertEquals(10, out.size());
        assertArrayEquals(new byte[] { 'S', 0, 0, 0, 5, 0, 0, 0, 42, 0 }, out.toByteArray());
    }

    @Test
    void frameReaderIsLimitedToPayload()
    {
        byte[] bytes = CheckpointWriter.create()
                .writeFrame(FrameTag.GENERAL, w -> w.writeInt(1))
                .writeInt(2)
                .toByteArray();

        CheckpointReader in = CheckpointReader.of(bytes);
        CheckpointReader body = in.readFrame(FrameTag.GENERAL);

        assertEquals(1, body.readInt());
        assertThrows(CheckpointDecodeException.class, body::readByte);
        assertEquals(2, in.readInt());
        in.expectExhausted();
    }

    @Test
    void wrongFrameTagIsRejected()
    {
        byte[] bytes = CheckpointWriter.create().writeFrame(FrameTag.STATE, w -> { }).toByteArray();

        CheckpointDecodeException e = assertThrows(CheckpointDecodeException.class,
                () -> CheckpointReader.of(bytes).readFrame(FrameTag.GENERAL));
        assertTrue(e.getMessage().contains("expected GENERAL frame but found STATE"), e.getMessage());
    }

    @Test
    void unknownFrameTagIsDescribed()
    {
        CheckpointDecodeException e = assertThrows(CheckpointDecodeException.class,
                () -> CheckpointReader.of(new byte[] { 0x7F, 0, 0, 0, 0 }).readFrame(FrameTag.STATE));
        assertTrue(e.getMessage().contains("unknown tag 0x7f"), e.getMessage());
    }

    @Test
    void malformedBooleanIsRejected()
    {
        assertThrows(CheckpointDecodeException.class, () -> CheckpointReader.of(new byte[] { 2 }).readBoolean());
    }

    @Test
    void negativeLengthIsRejected()
    {
        byte[] bytes = CheckpointWriter.create().writeInt(-1).toByteArray();
        assertThrows(CheckpointDecodeException.class, () -> CheckpointReader.of(bytes).readBytes());
    }

    @Test
    void oversizedLengthIsRejectedBeforeAllocating()
    {
        byte[] bytes = CheckpointWriter.create().writeInt(Integer.MAX_VALUE).toByteArray();
        assertThrows(CheckpointDecodeException.class, () -> CheckpointReader.of(bytes).readString());
    }

    @Test
    void truncatedPrimitiveIsRejected()
    {
        CheckpointReader in = CheckpointReader.of(new byte[] { 0, 0, 0 });

        CheckpointDecodeException e = assertThrows(CheckpointDecodeException.class, in::readInt);
        assertEquals(3, in.remaining());
        assertTrue(e.getMessage().contains("truncated"), e.getMessage());
    }

    @Test
    void unreadBytesFailExhaustionCheck()
    {
        CheckpointReader in = CheckpointReader.of(new byte[] { 1 });
        assertFalse(in.isExhausted());
        assertThrows(CheckpointDecodeException.class, in::expectExhausted);
    }

    @Test
    void skipRemainingExhaustsReader()
    {
        CheckpointReader in = CheckpointReader.of(new byte[] { 1, 2, 3 });
        in.readByte();
        in.skipRemaining();

        assertTrue(in.isExhausted());
        in.expectExhausted();
    }
}
