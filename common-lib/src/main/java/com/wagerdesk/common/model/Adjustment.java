package com.wagerdesk.common.model;

/**
 * One named, signed component of a projection.
 */
public record Adjustment(String label, double value, String rationale) {

    public static Adjustment of(String label, double value, String rationale) {
        return new Adjustment(label, value, rationale);
    }
}
