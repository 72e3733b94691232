package org.boc.parsing;

import java.util.Locale;
import org.boc.belief.DecayCurve;
import org.boc.helper.Tuple;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;

public class TestDecaySpecification {

    @Test
    public void findsCurveAndRate()
    {
        assertCurve(DecayCurve.LINEAR, 0.1, "linear(0.1/day)");
        assertCurve(DecayCurve.EXPONENTIAL, 0.05, "exponential(0.05/day)");
        assertCurve(DecayCurve.LOGARITHMIC, 0.2, "Logarithmic 0.2");
        assertCurve(DecayCurve.STEP, 0.25, "step(0.25)");
    }

    @Test
    public void firstCurveRuleWins()
    {
        assertCurve(DecayCurve.LINEAR, 0.3, "step then linear 0.3");
        assertCurve(DecayCurve.EXPONENTIAL, 0.1, "linear or exponential");
    }

    @Test
    public void unknownCurveFallsBack()
    {
        assertCurve(DecayCurve.EXPONENTIAL, 0.1, "sigmoid(0.4)");
        assertCurve(DecayCurve.EXPONENTIAL, 0.1, "");
        assertCurve(DecayCurve.EXPONENTIAL, 0.1, null);
        assertCurve(DecayCurve.LINEAR, 0.1, "linear");
    }

    @Test
    public void parsesPeriods()
    {
        Assert.assertEquals(Duration.ofDays(7), DecaySpecification.parsePeriod("7_days"));
        Assert.assertEquals(Duration.ofHours(2), DecaySpecification.parsePeriod("2 hours"));
        Assert.assertEquals(Duration.ofMinutes(30), DecaySpecification.parsePeriod("30_minutes"));
        Assert.assertEquals(Duration.ofMinutes(90), DecaySpecification.parsePeriod("1.5 hours"));
        Assert.assertEquals(Duration.ofDays(1), DecaySpecification.parsePeriod("day"));
    }

    @Test
    public void unknownPeriodIsOneHour()
    {
        Assert.assertEquals(Duration.ofHours(1), DecaySpecification.parsePeriod("3 fortnights"));
        Assert.assertEquals(Duration.ofHours(1), DecaySpecification.parsePeriod(null));
    }

    @Test
    public void unitIgnoresTheRate()
    {
        Assert.assertEquals(Duration.ofHours(1), DecaySpecification.parseUnit("linear(0.01/hour)"));
        Assert.assertEquals(Duration.ofDays(1), DecaySpecification.parseUnit("exponential(0.05/day)"));
        Assert.assertEquals(Duration.ofHours(1), DecaySpecification.parseUnit("step(0.3)"));
    }

    @Test
    public void rulesIgnoreTheDefaultLocale()
    {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertCurve(DecayCurve.LINEAR, 0.2, "LINEAR(0.2)");
            Assert.assertEquals(Duration.ofMinutes(5), DecaySpecification.parsePeriod("5 MINUTES"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    private static void assertCurve(DecayCurve curve, double rate, String text)
    {
        Tuple<DecayCurve, Double> parsed = DecaySpecification.parseCurve(text);
        Assert.assertEquals(curve, parsed.getA());
        Assert.assertEquals(rate, parsed.getB(), 1e-12);
    }
}
