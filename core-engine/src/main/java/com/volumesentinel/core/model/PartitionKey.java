package com.volumesentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity of one independent time series: a (state, district) pair.
 *
 * <p>
 * Either component may be {@code null}. A {@code null} district denotes a
 * state-wide series; a key with both components {@code null} denotes the
 * national aggregate.
 * </p>
 *
 * @since 1.0.0
 */
public final class PartitionKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final String WILDCARD = "*";

    private final String state;
    private final String district;

    private PartitionKey(String state, String district) {
        this.state = state;
        this.district = district;
    }

    /**
     * @param state    state name, or {@code null} for all states
     * @param district district name, or {@code null} for all districts
     * @return a partition key
     */
    public static PartitionKey of(String state, String district) {
        return new PartitionKey(state, district);
    }

    public String getState() {
        return state;
    }

    public String getDistrict() {
        return district;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PartitionKey that))
            return false;
        return Objects.equals(state, that.state) && Objects.equals(district, that.district);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, district);
    }

    @Override
    public String toString() {
        return (state != null ? state : WILDCARD) + "/" + (district != null ? district : WILDCARD);
    }
}
