package com.wpanther.cgaca.entity;

/**
 * Compliance level attested by a CGA certificate, lowest first.
 * Each level carries its default validity period and whether renewal needs manual review.
 */
public enum CgaLevel {
    BRONZE(30, false),
    SILVER(90, false),
    GOLD(180, false),
    PLATINUM(365, true);

    private final int validityDays;
    private final boolean manualReviewRequired;

    CgaLevel(int validityDays, boolean manualReviewRequired) {
        this.validityDays = validityDays;
        this.manualReviewRequired = manualReviewRequired;
    }

    public int getValidityDays() {
        return validityDays;
    }

    public boolean isManualReviewRequired() {
        return manualReviewRequired;
    }

    public boolean isAbove(CgaLevel other) {
        return ordinal() > other.ordinal();
    }
}
