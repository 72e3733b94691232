package org.boc.uncertainty;

/**
 * How the uncertainty of an {@link UncertaintyValue} is to be read.
 */
public enum UncertaintyType {
    // plus or minus, in the units of the value
    ABSOLUTE("absolute"),
    // a fraction of the value
    RELATIVE("relative"),
    STANDARD_DEVIATION("std"),
    // half width of the interval at the value's confidence level
    CONFIDENCE_INTERVAL("ci");

    private final String tag;

    UncertaintyType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
