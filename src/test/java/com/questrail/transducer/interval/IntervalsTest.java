package com.questrail.transducer.interval;

import com.questrail.transducer.blip.Blip;
import com.questrail.transducer.codec.Codecs;
import com.questrail.transducer.core.Effect;
import com.questrail.transducer.core.Output;
import com.questrail.transducer.core.Pair;
import com.questrail.transducer.core.RunResult;
import com.questrail.transducer.core.Transducer;
import com.questrail.transducer.core.Transducers;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IntervalsTest
 * -----------------------------------------------------------------------------
 * Scenario tests for the interval layer.
 */
final class IntervalsTest
{
    private static final Optional<Integer> OFF = Optional.empty();

    private static <A, B> List<B> run(Transducer<A, B> t, List<A> inputs)
    {
        return Transducers.overList(t, inputs).outputs();
    }

    private static Optional<Integer> on(int x)
    {
        return Optional.of(x);
    }

    private static Transducer<Integer, Integer> sum()
    {
        return Transducers.accum(Codecs.INT, (acc, x) -> acc + x, 0);
    }

    private static Transducer<Integer, Integer> loggingSum(List<Integer> seen)
    {
        return Transducers.accumEffect(Codecs.INT, (Integer acc, Integer x) -> Effect.of(() -> {
            seen.add(x);
            return acc + x;
        }), 0);
    }

    /** General transducer whose successor is a plain running sum. */
    private static Transducer<Integer, Integer> startsSum()
    {
        return Transducers.general(
                in -> sum().readState(in),
                out -> sum().writeState(out),
                x -> new Output<>(x, sum().execPure(x)));
    }

    private static void assertGateResumesWhereItLeftOff(Supplier<Transducer<Optional<Integer>, Optional<Integer>>> template,
                                                        List<Optional<Integer>> xs,
                                                        List<Optional<Integer>> ys)
    {
        List<Optional<Integer>> all = new ArrayList<>(xs);
        all.addAll(ys);
        List<Optional<Integer>> expected = Transducers.overListEffect(template.get(), all).run().outputs();

        RunResult<Optional<Integer>, Optional<Integer>> firstHalf = Transducers.overListEffect(template.get(), xs).run();
        Transducer<Optional<Integer>, Optional<Integer>> resumed = template.get().decode(firstHalf.last().encode());

        List<Optional<Integer>> actual = new ArrayList<>(firstHalf.outputs());
        actual.addAll(Transducers.overListEffect(resumed, ys).run().outputs());
        assertEquals(expected, actual);
    }

    private static List<Pair<Integer, Blip<String>>> withEventAt(int step, int steps)
    {
        List<Pair<Integer, Blip<String>>> out = new ArrayList<>();
        for (int i = 1; i <= steps; i++) {
            out.add(Pair.of(i, i == step ? Blip.of("event") : Blip.absent()));
        }
        return out;
    }

    @Test
    void staticIntervals()
    {
        assertEquals(List.of(OFF, OFF), run(Intervals.<String, Integer>off(), List.of("a", "b")));
        assertEquals(List.of(on(1), on(2)), run(Intervals.<Integer>toOn(), List.of(1, 2)));
        assertEquals(List.of(1, 0), run(Intervals.fromInterval(0), List.of(on(1), OFF)));
        assertEquals(List.of("v1", "-"), run(Intervals.fromIntervalWith("-", (Integer x) -> "v" + x), List.of(on(1), OFF)));
    }

    @Test
    void onForStaysOnForCountedSteps()
    {
        assertEquals(List.of(on(10), on(20), OFF, OFF), run(Intervals.<Integer>onFor(2), List.of(10, 20, 30, 40)));
    }

    @Test
    void offForStaysOffForCountedSteps()
    {
        assertEquals(List.of(OFF, OFF, on(30), on(40)), run(Intervals.<Integer>offFor(2), List.of(10, 20, 30, 40)));
    }

    @Test
    void negativeCountsBehaveAsZero()
    {
        assertEquals(List.of(OFF, OFF), run(Intervals.<Integer>onFor(-3), List.of(1, 2)));
        assertEquals(List.of(on(1), on(2)), run(Intervals.<Integer>offFor(-3), List.of(1, 2)));
    }

    @Test
    void predicateIntervals()
    {
        List<Integer> inputs = List.of(1, 2, 3, 4);

        assertEquals(List.of(OFF, on(2), OFF, on(4)), run(Intervals.<Integer>when(x -> x % 2 == 0), inputs));
        assertEquals(List.of(on(1), OFF, on(3), OFF), run(Intervals.<Integer>unless(x -> x % 2 == 0), inputs));
    }

    @Test
    void afterTurnsOnAtTheEventAndStaysOn()
    {
        assertEquals(List.of(OFF, OFF, on(3), on(4), on(5)),
                run(Intervals.<Integer, String>after(), withEventAt(3, 5)));
    }

    @Test
    void beforeTurnsOffAtTheEventAndStaysOff()
    {
        assertEquals(List.of(on(1), on(2), OFF, OFF, OFF),
                run(Intervals.<Integer, String>before(), withEventAt(3, 5)));
    }

    @Test
    void betweenFollowsStartAndEndEvents()
    {
        List<Pair<Integer, Pair<Blip<String>, Blip<String>>>> inputs = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            Blip<String> start = i == 3 ? Blip.of("start") : Blip.absent();
            Blip<String> end = i == 5 ? Blip.of("end") : Blip.absent();
            inputs.add(Pair.of(i, Pair.of(start, end)));
        }

        assertEquals(List.of(OFF, OFF, on(3), on(4), OFF, OFF, OFF),
                run(Intervals.<Integer, String, String>between(), inputs));
    }

    @Test
    void betweenGivesEndPrecedence()
    {
        Blip<String> event = Blip.of("both");
        List<Pair<Integer, Pair<Blip<String>, Blip<String>>>> inputs = List.of(
                Pair.of(1, Pair.of(event, event)),
                Pair.of(2, Pair.of(Blip.<String>absent(), Blip.<String>absent())));

        assertEquals(List.of(OFF, OFF), run(Intervals.<Integer, String, String>between(), inputs));
    }

    @Test
    void holdRetainsLastPayload()
    {
        List<Blip<Integer>> inputs = Arrays.asList(Blip.absent(), Blip.absent(), Blip.of(3), Blip.absent(), Blip.absent());
        List<Optional<Integer>> expected = List.of(OFF, OFF, on(3), on(3), on(3));

        assertEquals(expected, run(Intervals.hold(Codecs.INT), inputs));
        assertEquals(expected, run(Intervals.<Integer>holdNonResuming(), inputs));
    }

    @Test
    void holdForExpiresAfterCountedSteps()
    {
        List<Blip<Integer>> inputs = Arrays.asList(
                Blip.of(1), Blip.absent(), Blip.absent(), Blip.absent(), Blip.of(5), Blip.absent());
        List<Optional<Integer>> expected = List.of(on(1), on(1), on(1), OFF, on(5), on(5));

        assertEquals(expected, run(Intervals.holdFor(2, Codecs.INT), inputs));
        assertEquals(expected, run(Intervals.<Integer>holdForNonResuming(2), inputs));
    }

    @Test
    void holdForResumesMidCountdown()
    {
        Transducer<Blip<Integer>, Optional<Integer>> stepped = Transducers.overList(
                Intervals.holdFor(2, Codecs.INT), Arrays.asList(Blip.of(7), Blip.absent())).last();

        Transducer<Blip<Integer>, Optional<Integer>> resumed = Intervals.holdFor(2, Codecs.INT).decode(stepped.encode());

        assertEquals(List.of(on(7), OFF), run(resumed, Arrays.asList(Blip.<Integer>absent(), Blip.<Integer>absent())));
    }

    @Test
    void orElsePrefersFirstInterval()
    {
        Transducer<Integer, Optional<Integer>> t = Intervals.orElse(
                Intervals.<Integer>when(x -> x > 2), Intervals.<Integer>when(x -> x % 2 == 1));

        assertEquals(List.of(on(1), OFF, on(3), on(4)), run(t, List.of(1, 2, 3, 4)));
    }

    @Test
    void orElseAlwaysFallsBack()
    {
        Transducer<Integer, Integer> t = Intervals.orElseAlways(
                Intervals.<Integer>onFor(1), Transducers.<Integer, Integer>function(x -> -x));

        assertEquals(List.of(1, -2, -3), run(t, List.of(1, 2, 3)));
    }

    @Test
    void chooseIntervalStepsEveryCandidate()
    {
        List<Transducer<Integer, Optional<Integer>>> candidates = List.of(
                Intervals.<Integer>onFor(1), Intervals.<Integer>onFor(3));

        // the second candidate counts down on step 1 even though the first one is chosen
        assertEquals(List.of(on(1), on(2), on(3), OFF), run(Intervals.chooseInterval(candidates), List.of(1, 2, 3, 4)));
    }

    @Test
    void chooseIntervalRunsEveryCandidateEffect()
    {
        List<String> log = new ArrayList<>();
        List<Transducer<Integer, Optional<Integer>>> candidates = List.of(
                Transducers.functionEffect(x -> Effect.of(() -> {
                    log.add("a" + x);
                    return Optional.of(x);
                })),
                Transducers.functionEffect(x -> Effect.of(() -> {
                    log.add("b" + x);
                    return Optional.<Integer>empty();
                })));

        Optional<Integer> chosen = Intervals.chooseInterval(candidates).step(1).run().result();

        assertEquals(on(1), chosen);
        assertEquals(List.of("a1", "b1"), log);
    }

    @Test
    void chooseIntervalOfNothingIsOff()
    {
        assertEquals(List.of(OFF), run(Intervals.chooseInterval(List.<Transducer<Integer, Optional<Integer>>>of()), List.of(1)));
    }

    @Test
    void chooseFallsBackToDefault()
    {
        Transducer<Integer, Integer> t = Intervals.choose(
                Transducers.<Integer, Integer>function(x -> -x),
                List.of(Intervals.<Integer>when(x -> x > 3), Intervals.<Integer>when(x -> x == 2)));

        assertEquals(List.of(-1, 2, -3, 4), run(t, List.of(1, 2, 3, 4)));
    }

    @Test
    void gateFreezesInnerStateWhileOff()
    {
        List<Optional<Integer>> inputs = new ArrayList<>();
        List<Integer> onSteps = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            if (i % 2 == 1) {
                inputs.add(on(i));
                onSteps.add(i);
            } else {
                inputs.add(OFF);
            }
        }

        var result = Transducers.overList(Intervals.gate(sum()), inputs);
        assertEquals(List.of(on(1), OFF, on(4), OFF, on(9), OFF), result.outputs());

        // the inner state matches a sum stepped only on the "on" steps
        Transducer<Integer, Integer> manual = Transducers.overList(sum(), onSteps).last();
        byte[] gateBytes = result.last().encode();
        assertArrayEquals(manual.encode(), Arrays.copyOfRange(gateBytes, 5, gateBytes.length));

        Transducer<Optional<Integer>, Optional<Integer>> resumed = Intervals.gate(sum()).decode(gateBytes);
        assertEquals(on(19), resumed.evalPure(on(10)));
        assertEquals(manual.evalPure(10), resumed.evalPure(on(10)).orElseThrow());
    }

    @Test
    void gateSkipsInnerEffectsWhileOff()
    {
        List<Integer> seen = new ArrayList<>();
        Transducer<Integer, Integer> inner = Transducers.functionEffect(x -> Effect.of(() -> {
            seen.add(x);
            return x;
        }));
        Transducer<Optional<Integer>, Optional<Integer>> gated = Intervals.gate(inner);

        assertTrue(gated.isEffectful());
        List<Optional<Integer>> outputs = Transducers.overListEffect(gated, List.of(on(1), OFF, on(3))).run().outputs();

        assertEquals(List.of(on(1), OFF, on(3)), outputs);
        assertEquals(List.of(1, 3), seen);
    }

    @Test
    void gateOverEffectfulInnerResumes()
    {
        List<Integer> seen = new ArrayList<>();
        List<Optional<Integer>> xs = List.of(on(1), OFF, on(3));
        List<Optional<Integer>> ys = List.of(on(4), OFF, on(5));

        assertGateResumesWhereItLeftOff(() -> Intervals.gate(loggingSum(seen)), xs, ys);

        List<Optional<Integer>> all = new ArrayList<>(xs);
        all.addAll(ys);
        assertEquals(List.of(on(1), OFF, on(4), on(8), OFF, on(13)),
                Transducers.overListEffect(Intervals.gate(loggingSum(seen)), all).run().outputs());
    }

    @Test
    void gateOverGeneralInnerResumes()
    {
        List<Optional<Integer>> xs = List.of(on(2), OFF, on(3));
        List<Optional<Integer>> ys = List.of(OFF, on(4), on(1));

        assertGateResumesWhereItLeftOff(() -> Intervals.gate(startsSum()), xs, ys);
        assertEquals(List.of(on(2), OFF, on(5), OFF, on(9), on(10)),
                run(Intervals.gate(startsSum()), List.of(on(2), OFF, on(3), OFF, on(4), on(1))));
    }

    @Test
    void gateFlatCollapsesNestedIntervals()
    {
        Transducer<Optional<Integer>, Optional<Integer>> t = Intervals.gateFlat(Intervals.<Integer>onFor(1));

        assertEquals(List.of(on(1), OFF, OFF, OFF), run(t, List.of(on(1), OFF, on(2), on(3))));
    }

    @Test
    void intervalsComposeWithoutWideningToGeneral()
    {
        Transducer<Integer, Integer> t = Intervals.<Integer>onFor(2).andThen(Intervals.fromInterval(0));

        assertEquals(Transducer.Variant.STATEFUL, t.variant());
        assertEquals(Transducer.Variant.GENERAL, Intervals.gate(sum()).variant());
    }
}
