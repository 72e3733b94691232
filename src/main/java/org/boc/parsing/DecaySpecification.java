package org.boc.parsing;

import org.apache.commons.lang.StringUtils;
import org.boc.belief.DecayCurve;
import org.boc.helper.Tuple;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mines decay curves and periods out of free text such as {@code "exponential(0.05/day)"} or
 * {@code "7_days"}.
 *
 * Rules are tried in declaration order and the first keyword found anywhere in the text, ignoring
 * case, wins. Text like "linear step" is therefore a linear curve. The first embedded number is the
 * rate or the period count.
 */
public final class DecaySpecification {

    public static final DecayCurve DEFAULT_CURVE = DecayCurve.EXPONENTIAL;
    public static final double DEFAULT_RATE = 0.1;
    public static final double DEFAULT_COUNT = 1.0;
    public static final Duration DEFAULT_PERIOD = Duration.ofHours(1);

    private static final Pattern NUMBER = Pattern.compile("(\\d+\\.?\\d*)");

    private static final Map<String, DecayCurve> curveRules = generateCurveRules();
    private static Map<String, DecayCurve> generateCurveRules(){
        Map<String, DecayCurve> rules = new LinkedHashMap<String, DecayCurve>();
        rules.put("exponential", DecayCurve.EXPONENTIAL);
        rules.put("linear", DecayCurve.LINEAR);
        rules.put("logarithmic", DecayCurve.LOGARITHMIC);
        rules.put("step", DecayCurve.STEP);
        return rules;
    }

    private static final Map<String, ChronoUnit> unitRules = generateUnitRules();
    private static Map<String, ChronoUnit> generateUnitRules(){
        Map<String, ChronoUnit> rules = new LinkedHashMap<String, ChronoUnit>();
        rules.put("day", ChronoUnit.DAYS);
        rules.put("hour", ChronoUnit.HOURS);
        rules.put("minute", ChronoUnit.MINUTES);
        return rules;
    }

    private DecaySpecification() {
    }

    /**
     * The curve and rate named by the text; exponential at 0.1 when no curve keyword matches or the
     * text is null. A matched curve without a number gets the default rate.
     */
    public static Tuple<DecayCurve, Double> parseCurve(String text) {
        if (StringUtils.isBlank(text)) {
            return new Tuple<DecayCurve, Double>(DEFAULT_CURVE, DEFAULT_RATE);
        }
        String lower = StringUtils.lowerCase(text, Locale.ROOT);
        for (Map.Entry<String, DecayCurve> rule : curveRules.entrySet()) {
            if (lower.contains(rule.getKey())) {
                return new Tuple<DecayCurve, Double>(rule.getValue(), firstNumber(text, DEFAULT_RATE));
            }
        }
        return new Tuple<DecayCurve, Double>(DEFAULT_CURVE, DEFAULT_RATE);
    }

    /**
     * The period named by the text; one hour when no unit keyword matches or the text is null.
     * Fractional counts are kept to the millisecond.
     */
    public static Duration parsePeriod(String text) {
        ChronoUnit unit = findUnit(text);
        if (unit == null) {
            return DEFAULT_PERIOD;
        }
        double count = firstNumber(text, DEFAULT_COUNT);
        return Duration.ofMillis(Math.round(count * unit.getDuration().toMillis()));
    }

    /**
     * One of the unit named by the text, ignoring any number: the period of a rate such as
     * {@code "linear(0.01/hour)"}. One hour when no unit keyword matches.
     */
    public static Duration parseUnit(String text) {
        ChronoUnit unit = findUnit(text);
        return unit == null ? DEFAULT_PERIOD : unit.getDuration();
    }

    private static ChronoUnit findUnit(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        String lower = StringUtils.lowerCase(text, Locale.ROOT);
        for (Map.Entry<String, ChronoUnit> rule : unitRules.entrySet()) {
            if (lower.contains(rule.getKey())) {
                return rule.getValue();
            }
        }
        return null;
    }

    private static double firstNumber(String text, double fallback) {
        Matcher matcher = NUMBER.matcher(text);
        return matcher.find() ? Double.parseDouble(matcher.group(1)) : fallback;
    }
}
