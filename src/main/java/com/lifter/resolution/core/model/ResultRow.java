package com.lifter.resolution.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One scraped result line as it arrives from the meet feed.
 * Lift attempts are kept as raw text; a negative value marks a missed attempt.
 */
public class ResultRow {
    private final long lineNumber;
    private final String lifterName;
    private final Long meetId;
    private final String meetName;
    private final LocalDate date;
    private final String ageCategory;
    private final String weightClass;
    private final Double bodyweightKg;
    private final String snatchLift1;
    private final String snatchLift2;
    private final String snatchLift3;
    private final String bestSnatch;
    private final String cleanJerkLift1;
    private final String cleanJerkLift2;
    private final String cleanJerkLift3;
    private final String bestCleanJerk;
    private final Double total;
    private final Long stableId;
    private final String membershipNumber;
    private final String club;
    private final String countryCode;
    private final String gender;
    private final Integer birthYear;

    private ResultRow(Builder builder) {
        this.lineNumber = builder.lineNumber;
        this.lifterName = builder.lifterName;
        this.meetId = builder.meetId;
        this.meetName = builder.meetName;
        this.date = builder.date;
        this.ageCategory = builder.ageCategory;
        this.weightClass = builder.weightClass;
        this.bodyweightKg = builder.bodyweightKg;
        this.snatchLift1 = builder.snatchLift1;
        this.snatchLift2 = builder.snatchLift2;
        this.snatchLift3 = builder.snatchLift3;
        this.bestSnatch = builder.bestSnatch;
        this.cleanJerkLift1 = builder.cleanJerkLift1;
        this.cleanJerkLift2 = builder.cleanJerkLift2;
        this.cleanJerkLift3 = builder.cleanJerkLift3;
        this.bestCleanJerk = builder.bestCleanJerk;
        this.total = builder.total;
        this.stableId = builder.stableId;
        this.membershipNumber = builder.membershipNumber;
        this.club = builder.club;
        this.countryCode = builder.countryCode;
        this.gender = builder.gender;
        this.birthYear = builder.birthYear;
    }

    /**
     * 1-based position in the source file, 0 when the row did not come from a file.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    public String getLifterName() {
        return lifterName;
    }

    public Long getMeetId() {
        return meetId;
    }

    public String getMeetName() {
        return meetName;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getAgeCategory() {
        return ageCategory;
    }

    public String getWeightClass() {
        return weightClass;
    }

    public Double getBodyweightKg() {
        return bodyweightKg;
    }

    public String getSnatchLift1() {
        return snatchLift1;
    }

    public String getSnatchLift2() {
        return snatchLift2;
    }

    public String getSnatchLift3() {
        return snatchLift3;
    }

    public String getBestSnatch() {
        return bestSnatch;
    }

    public String getCleanJerkLift1() {
        return cleanJerkLift1;
    }

    public String getCleanJerkLift2() {
        return cleanJerkLift2;
    }

    public String getCleanJerkLift3() {
        return cleanJerkLift3;
    }

    public String getBestCleanJerk() {
        return bestCleanJerk;
    }

    public Double getTotal() {
        return total;
    }

    public Long getStableId() {
        return stableId;
    }

    public String getMembershipNumber() {
        return membershipNumber;
    }

    public String getClub() {
        return club;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getGender() {
        return gender;
    }

    public Integer getBirthYear() {
        return birthYear;
    }

    public Builder toBuilder() {
        return new Builder()
                .lineNumber(lineNumber)
                .lifterName(lifterName)
                .meetId(meetId)
                .meetName(meetName)
                .date(date)
                .ageCategory(ageCategory)
                .weightClass(weightClass)
                .bodyweightKg(bodyweightKg)
                .snatchLifts(snatchLift1, snatchLift2, snatchLift3)
                .bestSnatch(bestSnatch)
                .cleanJerkLifts(cleanJerkLift1, cleanJerkLift2, cleanJerkLift3)
                .bestCleanJerk(bestCleanJerk)
                .total(total)
                .stableId(stableId)
                .membershipNumber(membershipNumber)
                .club(club)
                .countryCode(countryCode)
                .gender(gender)
                .birthYear(birthYear);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long lineNumber;
        private String lifterName;
        private Long meetId;
        private String meetName;
        private LocalDate date;
        private String ageCategory;
        private String weightClass;
        private Double bodyweightKg;
        private String snatchLift1;
        private String snatchLift2;
        private String snatchLift3;
        private String bestSnatch;
        private String cleanJerkLift1;
        private String cleanJerkLift2;
        private String cleanJerkLift3;
        private String bestCleanJerk;
        private Double total;
        private Long stableId;
        private String membershipNumber;
        private String club;
        private String countryCode;
        private String gender;
        private Integer birthYear;

        public Builder lineNumber(long lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder lifterName(String lifterName) {
            this.lifterName = lifterName;
            return this;
        }

        public Builder meetId(Long meetId) {
            this.meetId = meetId;
            return this;
        }

        public Builder meetName(String meetName) {
            this.meetName = meetName;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder ageCategory(String ageCategory) {
            this.ageCategory = ageCategory;
            return this;
        }

        public Builder weightClass(String weightClass) {
            this.weightClass = weightClass;
            return this;
        }

        public Builder bodyweightKg(Double bodyweightKg) {
            this.bodyweightKg = bodyweightKg;
            return this;
        }

        public Builder snatchLifts(String lift1, String lift2, String lift3) {
            this.snatchLift1 = lift1;
            this.snatchLift2 = lift2;
            this.snatchLift3 = lift3;
            return this;
        }

        public Builder bestSnatch(String bestSnatch) {
            this.bestSnatch = bestSnatch;
            return this;
        }

        public Builder cleanJerkLifts(String lift1, String lift2, String lift3) {
            this.cleanJerkLift1 = lift1;
            this.cleanJerkLift2 = lift2;
            this.cleanJerkLift3 = lift3;
            return this;
        }

        public Builder bestCleanJerk(String bestCleanJerk) {
            this.bestCleanJerk = bestCleanJerk;
            return this;
        }

        public Builder total(Double total) {
            this.total = total;
            return this;
        }

        public Builder stableId(Long stableId) {
            this.stableId = stableId;
            return this;
        }

        public Builder membershipNumber(String membershipNumber) {
            this.membershipNumber = membershipNumber;
            return this;
        }

        public Builder club(String club) {
            this.club = club;
            return this;
        }

        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public Builder gender(String gender) {
            this.gender = gender;
            return this;
        }

        public Builder birthYear(Integer birthYear) {
            this.birthYear = birthYear;
            return this;
        }

        public ResultRow build() {
            Objects.requireNonNull(lifterName, "lifterName is required");
            return new ResultRow(this);
        }
    }

    @Override
    public String toString() {
        return "ResultRow{" +
                "line=" + lineNumber +
                ", lifterName='" + lifterName + '\'' +
                ", meetId=" + meetId +
                ", date=" + date +
                ", division='" + ageCategory + " " + weightClass + '\'' +
                '}';
    }
}
