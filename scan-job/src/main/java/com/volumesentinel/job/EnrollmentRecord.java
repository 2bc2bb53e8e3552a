package com.volumesentinel.job;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One row of the daily enrollment export: counts for a district on a date,
 * split into age buckets.
 *
 * <p>
 * Missing buckets count as zero. Unknown fields are ignored.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class EnrollmentRecord {

    @JsonProperty("date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;
    @JsonProperty("state")
    private String state;
    @JsonProperty("district")
    private String district;

    @JsonProperty("age_0_5")
    private Double age0To5;
    @JsonProperty("age_5_17")
    private Double age5To17;
    @JsonProperty("age_18_greater")
    private Double age18Plus;

    /** Required by Jackson. */
    EnrollmentRecord() {
    }

    EnrollmentRecord(LocalDate date, String state, String district,
            Double age0To5, Double age5To17, Double age18Plus) {
        this.date = date;
        this.state = state;
        this.district = district;
        this.age0To5 = age0To5;
        this.age5To17 = age5To17;
        this.age18Plus = age18Plus;
    }

    /**
     * @return why the record cannot be used, or {@code null} if it is valid
     */
    String problem() {
        if (date == null) {
            return "missing date";
        }
        if (state == null || state.isBlank()) {
            return "missing state";
        }
        if (district == null || district.isBlank()) {
            return "missing district";
        }
        if (!validCount(age0To5) || !validCount(age5To17) || !validCount(age18Plus)) {
            return "age bucket counts must be finite and >= 0";
        }
        return null;
    }

    /**
     * @return sum of the age buckets
     */
    double total() {
        return orZero(age0To5) + orZero(age5To17) + orZero(age18Plus);
    }

    LocalDate getDate() {
        return date;
    }

    String getState() {
        return state;
    }

    String getDistrict() {
        return district;
    }

    private static boolean validCount(Double count) {
        return count == null || (Double.isFinite(count) && count >= 0);
    }

    private static double orZero(Double count) {
        return count == null ? 0.0 : count;
    }

    @Override
    public String toString() {
        return "EnrollmentRecord{date=" + date + ", state='" + state + "', district='" + district + "'}";
    }
}
