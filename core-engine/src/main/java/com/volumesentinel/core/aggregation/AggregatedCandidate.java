package com.volumesentinel.core.aggregation;

import com.volumesentinel.core.model.DetectionMethod;
import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.IqrFinding;
import com.volumesentinel.core.model.RollingDeviationFinding;
import com.volumesentinel.core.model.ZScoreFinding;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * All findings that fired for one date, one slot per detection method.
 *
 * <p>
 * Mutable and confined to a single {@link FindingAggregator} pass. A second
 * finding for a slot that is already filled replaces the first, so a method
 * is never counted twice.
 * </p>
 */
final class AggregatedCandidate {

    private final LocalDate date;
    private final double value;

    private ZScoreFinding zScore;
    private IqrFinding iqr;
    private RollingDeviationFinding rollingDeviation;

    AggregatedCandidate(LocalDate date, double value) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
    }

    /**
     * Store a finding in the slot for its method.
     *
     * @return {@code true} if the slot was previously empty
     */
    boolean add(Finding finding) {
        Objects.requireNonNull(finding, "Finding must not be null");
        if (!date.equals(finding.getDate())) {
            throw new IllegalArgumentException(
                    "Finding for " + finding.getDate() + " added to candidate for " + date);
        }

        boolean wasEmpty;
        if (finding instanceof ZScoreFinding z) {
            wasEmpty = zScore == null;
            zScore = z;
        } else if (finding instanceof IqrFinding q) {
            wasEmpty = iqr == null;
            iqr = q;
        } else if (finding instanceof RollingDeviationFinding r) {
            wasEmpty = rollingDeviation == null;
            rollingDeviation = r;
        } else {
            throw new IllegalArgumentException("Unsupported finding type: " + finding.getClass().getName());
        }
        return wasEmpty;
    }

    LocalDate getDate() {
        return date;
    }

    double getValue() {
        return value;
    }

    Optional<ZScoreFinding> zScore() {
        return Optional.ofNullable(zScore);
    }

    Optional<IqrFinding> iqr() {
        return Optional.ofNullable(iqr);
    }

    Optional<RollingDeviationFinding> rollingDeviation() {
        return Optional.ofNullable(rollingDeviation);
    }

    /**
     * @return methods with a filled slot, in declaration order
     */
    Set<DetectionMethod> methods() {
        Set<DetectionMethod> methods = EnumSet.noneOf(DetectionMethod.class);
        if (zScore != null) {
            methods.add(DetectionMethod.Z_SCORE);
        }
        if (iqr != null) {
            methods.add(DetectionMethod.IQR);
        }
        if (rollingDeviation != null) {
            methods.add(DetectionMethod.ROLLING_DEVIATION);
        }
        return methods;
    }

    int methodCount() {
        return (zScore != null ? 1 : 0) + (iqr != null ? 1 : 0) + (rollingDeviation != null ? 1 : 0);
    }

    @Override
    public String toString() {
        return "AggregatedCandidate{date=" + date + ", value=" + value + ", methods=" + methods() + '}';
    }
}
