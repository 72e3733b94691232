package org.boc.belief;

import org.boc.MutableClock;
import org.boc.ValueException;
import org.boc.config.BocConfiguration;
import org.boc.config.BocParams;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestBeliefStore {

    private static final double DELTA = 1e-9;
    private static final Duration HOUR = Duration.ofHours(1);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private MutableClock clock;
    private BeliefStore store;

    @Before
    public void setUp()
    {
        clock = new MutableClock();
        store = new BeliefStore(BocConfiguration.defaults(), clock);
    }

    private Evidence evidence(double confidence, EvidenceType type)
    {
        return new Evidence("observation", confidence, "sensor_123", clock.instant(), type);
    }

    @Test
    public void createStoresConfidenceExactly()
    {
        assertEquals(0.0, store.create("a", 0.0).getCurrentConfidence(), 0.0);
        assertEquals(1.0, store.create("b", 1.0).getCurrentConfidence(), 0.0);

        BeliefState belief = store.create("c", 0.85);
        assertEquals(0.85, belief.getInitialConfidence(), 0.0);
        assertEquals(0.85, belief.getCurrentConfidence(), 0.0);
        assertEquals(clock.instant(), belief.getCreatedAt());
        assertEquals(clock.instant(), belief.getLastUpdated());
        assertEquals(3, store.size());
    }

    @Test
    public void createRejectsConfidenceOutOfRange()
    {
        for (double bad : new double[]{-0.01, 1.01, Double.NaN}) {
            try {
                store.create("bad", bad);
                fail("accepted " + bad);
            } catch (ValueException expected) {
                assertFalse(store.contains("bad"));
            }
        }
    }

    @Test(expected = ValueException.class)
    public void createRejectsNonPositivePeriod()
    {
        store.create("a", 0.5, DecayCurve.LINEAR, 0.1, Duration.ZERO, null);
    }

    @Test
    public void createOverwritesWithoutMerging()
    {
        store.create("a", 0.4);
        store.update("a", 0.9, evidence(0.9, EvidenceType.POSITIVE));
        BeliefState again = store.create("a", 0.3);

        assertEquals(0.3, again.getCurrentConfidence(), 0.0);
        assertTrue(again.getEvidenceHistory().isEmpty());
        assertEquals(1, store.size());
    }

    @Test
    public void noDecayWithoutElapsedTime()
    {
        for (DecayCurve curve : DecayCurve.values()) {
            store.create(curve.name(), 0.7, curve, 0.5, HOUR, null);
            assertEquals(curve.name(), 0.7, store.getCurrentConfidence(curve.name()).getAsDouble(), DELTA);
        }
    }

    @Test
    public void exponentialDecayOverTwoPeriods()
    {
        store.create("temp", 0.8, DecayCurve.EXPONENTIAL, 0.1, HOUR, null);
        clock.advance(Duration.ofHours(2));

        double decayed = store.getCurrentConfidence("temp").getAsDouble();
        assertEquals(0.8 * Math.exp(-0.2), decayed, DELTA);
        assertEquals(0.655, decayed, 1e-3);
    }

    @Test
    public void linearDecayOverTwoPeriods()
    {
        store.create("db", 0.9, DecayCurve.LINEAR, 0.05, HOUR, null);
        clock.advance(Duration.ofHours(2));
        assertEquals(0.8, store.getCurrentConfidence("db").getAsDouble(), DELTA);

        clock.advance(Duration.ofDays(3));
        assertEquals(0.0, store.getCurrentConfidence("db").getAsDouble(), 0.0);
    }

    @Test
    public void logarithmicAndStepDecay()
    {
        store.create("log", 0.9, DecayCurve.LOGARITHMIC, 0.5, HOUR, null);
        store.create("step", 0.9, DecayCurve.STEP, 0.5, HOUR, null);
        clock.advance(Duration.ofMinutes(150));

        assertEquals(0.9 / (1 + 0.5 * Math.log(1 + 2.5)), store.getCurrentConfidence("log").getAsDouble(), DELTA);
        assertEquals(0.9 * 0.25, store.getCurrentConfidence("step").getAsDouble(), DELTA);
    }

    @Test
    public void decayDoesNotModifyTheBelief()
    {
        store.create("temp", 0.8, DecayCurve.EXPONENTIAL, 0.1, HOUR, null);
        clock.advance(Duration.ofHours(5));

        BeliefState stored = store.getBelief("temp").get();
        double projected = store.applyDecay(stored);
        assertTrue(projected < 0.8);
        assertEquals(0.8, store.getBelief("temp").get().getCurrentConfidence(), 0.0);

        Map<String, BeliefState> decayed = store.getAllBeliefs(true);
        assertEquals(projected, decayed.get("temp").getCurrentConfidence(), DELTA);
        assertEquals(0.8, store.getAllBeliefs(false).get("temp").getCurrentConfidence(), 0.0);
    }

    @Test
    public void clockSkewCountsAsNoTime()
    {
        store.create("temp", 0.8, DecayCurve.LINEAR, 0.1, HOUR, null);
        clock.set(Instant.parse("2026-02-03T15:00:00Z"));
        assertEquals(0.8, store.getCurrentConfidence("temp").getAsDouble(), 0.0);
    }

    @Test
    public void inactiveBeliefsDoNotDecay()
    {
        store.create("temp", 0.8, DecayCurve.LINEAR, 0.1, HOUR, null);
        assertTrue(store.setActive("temp", false));
        clock.advance(Duration.ofHours(3));
        assertEquals(0.8, store.getCurrentConfidence("temp").getAsDouble(), 0.0);

        store.setActive("temp", true);
        assertEquals(0.5, store.getCurrentConfidence("temp").getAsDouble(), DELTA);
    }

    @Test
    public void customDecayFallsBackToExponential()
    {
        store.create("custom", 0.8, DecayCurve.CUSTOM, 0.1, HOUR, null);
        clock.advance(Duration.ofHours(2));
        assertEquals(0.8 * Math.exp(-0.2), store.getCurrentConfidence("custom").getAsDouble(), DELTA);

        store.setCustomDecay("custom", new DecayStrategy() {
            @Override
            public double decay(double confidence, double rate, double periods) {
                return confidence / 2;
            }
        });
        assertEquals(0.4, store.getCurrentConfidence("custom").getAsDouble(), DELTA);
    }

    @Test
    public void updateBlendsDecayedConfidenceWithEvidence()
    {
        store.create("temp", 0.8, DecayCurve.EXPONENTIAL, 0.1, HOUR, null);
        clock.advance(Duration.ofHours(2));

        // neutral evidence of weight 1 scores 0.8, which blends half and half
        assertTrue(store.update("temp", 0.95, evidence(0.95, EvidenceType.NEUTRAL)));

        double expected = 0.5 * 0.8 * Math.exp(-0.2) + 0.5 * 0.95;
        BeliefState belief = store.getBelief("temp").get();
        assertEquals(expected, belief.getCurrentConfidence(), DELTA);
        assertEquals(0.802, belief.getCurrentConfidence(), 1e-3);
        assertEquals(clock.instant(), belief.getLastUpdated());
        assertEquals(1, belief.getEvidenceHistory().size());
    }

    @Test
    public void heavyEvidenceWeighsMore()
    {
        store.create("temp", 0.2, DecayCurve.LINEAR, 0.0, HOUR, null);
        Evidence heavy = new Evidence("reading", 1.0, "sensor", clock.instant(), EvidenceType.POSITIVE, 2.5);

        store.update("temp", 1.0, heavy);

        // 2.5 * 1.0 * 1.2 = 3.0, blend weight 0.75
        assertEquals(0.25 * 0.2 + 0.75, store.getCurrentConfidence("temp").getAsDouble(), DELTA);
    }

    @Test
    public void updateWithoutEvidenceReplacesConfidence()
    {
        store.create("temp", 0.8, DecayCurve.EXPONENTIAL, 0.1, HOUR, null);
        clock.advance(Duration.ofHours(10));

        assertTrue(store.update("temp", 0.3));
        assertEquals(0.3, store.getCurrentConfidence("temp").getAsDouble(), 0.0);
    }

    @Test
    public void updateOfUnknownBeliefIsSoft()
    {
        assertFalse(store.update("missing", 0.5, evidence(0.5, EvidenceType.NEUTRAL)));
        assertFalse(store.getCurrentConfidence("missing").isPresent());
        assertFalse(store.configureDecay("missing", DecayCurve.LINEAR, 0.1, HOUR));
        assertEquals(0.0, store.addContradictoryEvidence("missing", evidence(0.5, EvidenceType.CONTRADICTORY)), 0.0);
        assertEquals(0.0, store.resolveConflicts("missing"), 0.0);
        assertFalse(store.getBelief("missing").isPresent());
    }

    @Test(expected = ValueException.class)
    public void updateRejectsConfidenceOutOfRange()
    {
        store.create("temp", 0.8);
        store.update("temp", 1.5);
    }

    @Test
    public void contradictoryEvidenceTakesFlatPenalty()
    {
        store.create("temp", 0.8, DecayCurve.LINEAR, 0.0, HOUR, null);

        double penalty = store.addContradictoryEvidence("temp", evidence(0.85, EvidenceType.CONTRADICTORY));

        assertEquals(0.255, penalty, DELTA);
        assertEquals(0.545, store.getCurrentConfidence("temp").getAsDouble(), DELTA);
        assertEquals(1, store.getBelief("temp").get().getEvidenceHistory().size());
    }

    @Test
    public void contradictoryPenaltyIsClampedAtFloor()
    {
        store.create("weak", 0.1);
        assertEquals(0.255, store.addContradictoryEvidence("weak", evidence(0.85, EvidenceType.CONTRADICTORY)), DELTA);
        assertEquals(0.0, store.getBelief("weak").get().getCurrentConfidence(), 0.0);
    }

    @Test
    public void resolveConflictsWithoutContradictionIsNoOp()
    {
        store.create("temp", 0.8, DecayCurve.LINEAR, 0.0, HOUR, null);
        store.update("temp", 0.6, evidence(0.6, EvidenceType.POSITIVE));
        double before = store.getBelief("temp").get().getCurrentConfidence();

        assertEquals(before, store.resolveConflicts("temp"), 0.0);
    }

    @Test
    public void dominantContradictionHalvesConfidence()
    {
        store.create("temp", 0.8, DecayCurve.LINEAR, 0.0, HOUR, null);
        store.addContradictoryEvidence("temp", evidence(0.5, EvidenceType.CONTRADICTORY));
        // 0.8 - 0.15
        assertEquals(0.65 * 0.5, store.resolveConflicts("temp"), DELTA);
    }

    @Test
    public void outweighedContradictionStillReducesConfidence()
    {
        store.create("temp", 0.8, DecayCurve.LINEAR, 0.0, HOUR, null);
        store.update("temp", 0.8, evidence(0.8, EvidenceType.POSITIVE));
        store.addContradictoryEvidence("temp", evidence(0.5, EvidenceType.CONTRADICTORY));

        // positive 1.2 against contradictory 0.5
        assertEquals(0.65 * 0.8, store.resolveConflicts("temp"), DELTA);
    }

    @Test
    public void olderEvidenceCountsLess()
    {
        store.create("temp", 0.8, DecayCurve.LINEAR, 0.0, HOUR, null);
        store.addContradictoryEvidence("temp", evidence(0.5, EvidenceType.CONTRADICTORY));
        store.addContradictoryEvidence("temp", evidence(0.5, EvidenceType.CONTRADICTORY));
        store.addContradictoryEvidence("temp", evidence(0.5, EvidenceType.CONTRADICTORY));

        // fresh, the three would score 1.5 against 1.2; eight days on they score 0.6
        clock.advance(Duration.ofDays(8));
        store.update("temp", 0.8, evidence(0.8, EvidenceType.POSITIVE));
        double current = store.getBelief("temp").get().getCurrentConfidence();

        assertEquals(current * 0.8, store.resolveConflicts("temp"), DELTA);
    }

    @Test
    public void configureDecayRetargetsBelief()
    {
        store.create("temp", 0.9);
        assertTrue(store.configureDecay("temp", DecayCurve.LINEAR, 0.1, Duration.ofDays(1)));
        clock.advance(Duration.ofDays(2));

        assertEquals(0.7, store.getCurrentConfidence("temp").getAsDouble(), DELTA);
        assertEquals(DecayCurve.LINEAR, store.getBelief("temp").get().getDecayCurve());
    }

    @Test
    public void boundsClampStoredAndDecayedConfidence()
    {
        store.create("temp", 0.9, DecayCurve.LINEAR, 0.5, HOUR, null);
        assertTrue(store.setConfidenceBounds("temp", 0.2, 0.8));
        assertEquals(0.8, store.getBelief("temp").get().getCurrentConfidence(), 0.0);

        clock.advance(Duration.ofHours(4));
        assertEquals(0.2, store.getCurrentConfidence("temp").getAsDouble(), 0.0);
    }

    @Test(expected = ValueException.class)
    public void boundsMustBeOrdered()
    {
        store.create("temp", 0.5);
        store.setConfidenceBounds("temp", 0.8, 0.2);
    }

    @Test
    public void metadataAndCopiesAreDetached()
    {
        store.create("temp", 0.5, DecayCurve.LINEAR, 0.1, HOUR, Collections.<String, Object>singletonMap("source", "sensor_123"));
        BeliefState copy = store.getBelief("temp").get();
        copy.setCurrentConfidence(0.1);

        assertEquals("sensor_123", store.getBelief("temp").get().getMetadata().get("source"));
        assertEquals(0.5, store.getBelief("temp").get().getCurrentConfidence(), 0.0);
    }

    @Test
    public void defaultStoreReadsBundledConfiguration() throws IOException
    {
        File dir = folder.newFolder("classpath");
        Files.write(new File(dir, BocParams.DEFAULT_RESOURCE).toPath(),
                Arrays.asList(BocParams.DECAY_CURVE + "=LINEAR", BocParams.CONFLICT_PENALTY + "=0.4"),
                StandardCharsets.UTF_8);

        Thread thread = Thread.currentThread();
        ClassLoader saved = thread.getContextClassLoader();
        URLClassLoader loader = new URLClassLoader(new URL[]{dir.toURI().toURL()}, null);
        thread.setContextClassLoader(loader);
        try {
            BeliefStore configured = new BeliefStore();
            assertEquals(DecayCurve.LINEAR, configured.getConfiguration().getDecayCurve());
            assertEquals(0.4, configured.getConfiguration().getConflictPenalty(), DELTA);
            assertEquals(DecayCurve.LINEAR, configured.create("fresh", 0.5).getDecayCurve());
        } finally {
            thread.setContextClassLoader(saved);
            loader.close();
        }
    }
}
