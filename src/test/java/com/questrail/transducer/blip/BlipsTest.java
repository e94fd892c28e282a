package com.questrail.transducer.blip;

import com.questrail.transducer.codec.CheckpointReader;
import com.questrail.transducer.codec.CheckpointWriter;
import com.questrail.transducer.codec.Codecs;
import com.questrail.transducer.codec.StateCodec;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BlipsTest
 * -----------------------------------------------------------------------------
 * Value-level behavior of {@link Blip} and {@link Blips}.
 */
final class BlipsTest
{
    @Test
    void mergeWithAbsentReturnsTheOtherSide()
    {
        Blip<Integer> b = Blip.of(4);

        assertEquals(b, Blips.merge(Integer::sum, Blip.absent(), b));
        assertEquals(b, Blips.merge(Integer::sum, b, Blip.absent()));
        assertFalse(Blips.merge(Integer::sum, Blip.<Integer>absent(), Blip.absent()).isPresent());
    }

    @Test
    void mergeOfTwoPresentBlipsCombinesPayloads()
    {
        assertEquals(Blip.of("ab"), Blips.merge(String::concat, Blip.of("a"), Blip.of("b")));
    }

    @Test
    void destructureAppliesFunctionOnlyWhenPresent()
    {
        assertEquals(6, Blips.destructure(0, (Integer x) -> x * 2, Blip.of(3)));
        assertEquals(0, Blips.destructure(0, (Integer x) -> x * 2, Blip.absent()));
    }

    @Test
    void absentBlipsAreEqual()
    {
        assertEquals(Blip.<Integer>absent(), Blip.<Integer>absent());
        assertEquals(Blip.<Integer>absent().hashCode(), Blip.<Integer>absent().hashCode());
        assertEquals(Blip.<Integer>absent(), Blip.<Integer>absent().map(x -> x + 1));
        assertFalse(Blip.<Integer>absent().isPresent());
        assertNotEquals(Blip.<Integer>absent(), Blip.of(1));
    }

    @Test
    void optionalConversionsAgree()
    {
        assertEquals(Optional.of(5), Blip.of(5).toOptional());
        assertEquals(Optional.empty(), Blip.absent().toOptional());
        assertEquals(Blip.of("x"), Blip.fromOptional(Optional.of("x")));
        assertFalse(Blip.fromOptional(Optional.empty()).isPresent());
    }

    @Test
    void presentRequiresPayload()
    {
        assertThrows(NullPointerException.class, () -> Blip.of(null));
    }

    @Test
    void codecPreservesPresence()
    {
        StateCodec<Blip<Integer>> codec = Blips.codec(Codecs.INT);

        CheckpointWriter out = CheckpointWriter.create();
        codec.write(Blip.of(9), out);
        codec.write(Blip.absent(), out);

        CheckpointReader in = CheckpointReader.of(out.toByteArray());
        assertEquals(Blip.of(9), codec.read(in));
        assertFalse(codec.read(in).isPresent());
        in.expectExhausted();
    }
}
