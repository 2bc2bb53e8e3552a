package com.volumesentinel.core.model;

/**
 * The independent statistical methods whose findings are cross-validated.
 *
 * <p>
 * Declaration order is the order in which methods are listed on a
 * {@link ValidatedAnomaly}.
 * </p>
 */
public enum DetectionMethod {

    Z_SCORE("z_score"),
    IQR("iqr"),
    ROLLING_DEVIATION("rolling_deviation");

    private final String wireName;

    DetectionMethod(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the name stored in persisted alerts
     */
    public String getWireName() {
        return wireName;
    }
}
