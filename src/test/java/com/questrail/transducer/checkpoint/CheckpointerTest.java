package com.questrail.transducer.checkpoint;

import com.questrail.transducer.codec.CheckpointDecodeException;
import com.questrail.transducer.codec.Codecs;
import com.questrail.transducer.config.CheckpointConfig;
import com.questrail.transducer.config.DecodeFailurePolicy;
import com.questrail.transducer.core.Transducer;
import com.questrail.transducer.core.Transducers;
import com.questrail.transducer.observability.CheckpointSavedEvent;
import com.questrail.transducer.observability.DecodeFailureEvent;
import com.questrail.transducer.observability.RecordingObservabilitySink;
import com.questrail.transducer.observability.ResumeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CheckpointerTest
 * -----------------------------------------------------------------------------
 * Save/resume on behalf of a driver, failure policies and emitted events.
 */
final class CheckpointerTest
{
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private RecordingObservabilitySink sink;
    private Clock clock;

    @BeforeEach
    void setUp()
    {
        sink = new RecordingObservabilitySink();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private static Transducer<Integer, Integer> sum()
    {
        return Transducers.accum(Codecs.INT, (acc, x) -> acc + x, 0);
    }

    private Checkpointer checkpointer(CheckpointConfig config)
    {
        return new Checkpointer(config, sink, clock);
    }

    @Test
    void defaultsResetToTemplateWithSixteenMebibyteLimit()
    {
        CheckpointConfig config = CheckpointConfig.defaults();

        assertEquals(DecodeFailurePolicy.RESET_TO_TEMPLATE, config.decodeFailurePolicy());
        assertEquals(16 * 1024 * 1024, config.maxCheckpointBytes());
    }

    @Test
    void configRejectsNonPositiveLimit()
    {
        assertThrows(IllegalArgumentException.class,
                () -> CheckpointConfig.builder().withMaxCheckpointBytes(0).build());
        assertThrows(NullPointerException.class,
                () -> CheckpointConfig.builder().withDecodeFailurePolicy(null).build());
    }

    @Test
    void saveThenResumeContinuesTheStream()
    {
        Checkpointer checkpointer = checkpointer(CheckpointConfig.defaults());
        Transducer<Integer, Integer> stepped = Transducers.overList(sum(), List.of(1, 2, 3)).last();

        byte[] bytes = checkpointer.save(stepped);
        Transducer<Integer, Integer> resumed = checkpointer.resume(sum(), bytes);

        assertEquals(10, resumed.evalPure(4));
        assertEquals(List.of(
                new CheckpointSavedEvent(NOW, Transducer.Variant.STATEFUL, 9),
                new ResumeEvent(NOW, Transducer.Variant.STATEFUL, 9)), sink.getAllEvents());
    }

    @Test
    void rejectedCheckpointResetsToTemplateByDefault()
    {
        Checkpointer checkpointer = checkpointer(CheckpointConfig.defaults());
        Transducer<Integer, Integer> template = sum();

        Transducer<Integer, Integer> resumed = checkpointer.resume(template, new byte[] { 'G', 0, 0, 0, 0 });

        assertSame(template, resumed);
        List<DecodeFailureEvent> failures = sink.getEventsOfType(DecodeFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals(DecodeFailurePolicy.RESET_TO_TEMPLATE, failures.get(0).policy());
        assertEquals(5, failures.get(0).byteCount());
        assertFalse(sink.hasEventOfType(ResumeEvent.class));
    }

    @Test
    void rejectedCheckpointFailsWhenConfigured()
    {
        Checkpointer checkpointer = checkpointer(CheckpointConfig.builder()
                .withDecodeFailurePolicy(DecodeFailurePolicy.FAIL)
                .build());

        CheckpointDecodeException e = assertThrows(CheckpointDecodeException.class,
                () -> checkpointer.resume(sum(), new byte[] { 'S', 0, 0 }));

        DecodeFailureEvent failure = sink.getEventsOfType(DecodeFailureEvent.class).get(0);
        assertSame(e, failure.error());
        assertEquals(NOW, failure.timestamp());
    }

    @Test
    void oversizedCheckpointIsRefusedOnSave()
    {
        Checkpointer checkpointer = checkpointer(CheckpointConfig.builder().withMaxCheckpointBytes(8).build());

        assertThrows(IllegalArgumentException.class, () -> checkpointer.save(sum().execPure(1)));
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void oversizedCheckpointIsRejectedOnResume()
    {
        byte[] bytes = sum().execPure(1).encode();
        Checkpointer checkpointer = checkpointer(CheckpointConfig.builder()
                .withMaxCheckpointBytes(8)
                .withDecodeFailurePolicy(DecodeFailurePolicy.FAIL)
                .build());

        CheckpointDecodeException e = assertThrows(CheckpointDecodeException.class,
                () -> checkpointer.resume(sum(), bytes));
        assertTrue(e.getMessage().contains("exceeds limit"), e.getMessage());
    }

    @Test
    void statelessTransducersSaveEmptyCheckpoints()
    {
        Checkpointer checkpointer = checkpointer(CheckpointConfig.defaults());
        Transducer<Integer, Integer> doubled = Transducers.function(x -> x * 2);

        byte[] bytes = checkpointer.save(doubled);

        assertEquals(0, bytes.length);
        assertSame(doubled, checkpointer.resume(doubled, bytes));
    }

    @Test
    void nullSinkFallsBackToNoOp()
    {
        Checkpointer checkpointer = new Checkpointer(CheckpointConfig.defaults(), null);
        assertEquals(9, checkpointer.save(sum().execPure(2)).length);
    }
}
