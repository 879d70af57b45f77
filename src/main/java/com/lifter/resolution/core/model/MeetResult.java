package com.lifter.resolution.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A stored competition result. Always references a persisted lifter.
 * The store keeps at most one result per (meet, lifter, weight class).
 */
public class MeetResult {
    private final Long resultId;
    private final Long lifterId;
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
    private final String club;
    private final String wso;
    private final Integer competitionAge;
    private final Integer nationalRank;
    private final String gender;

    private MeetResult(Builder builder) {
        this.resultId = builder.resultId;
        this.lifterId = builder.lifterId;
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
        this.club = builder.club;
        this.wso = builder.wso;
        this.competitionAge = builder.competitionAge;
        this.nationalRank = builder.nationalRank;
        this.gender = builder.gender;
    }

    /**
     * Builds an unsaved result for the given row. The lifter id may still be null when the
     * lifter is committed together with the result.
     */
    public static MeetResult fromRow(ResultRow row, Long lifterId, String lifterName) {
        return builder()
                .lifterId(lifterId)
                .lifterName(lifterName)
                .meetId(row.getMeetId())
                .meetName(row.getMeetName())
                .date(row.getDate())
                .ageCategory(row.getAgeCategory())
                .weightClass(row.getWeightClass())
                .bodyweightKg(row.getBodyweightKg())
                .snatchLifts(row.getSnatchLift1(), row.getSnatchLift2(), row.getSnatchLift3())
                .bestSnatch(row.getBestSnatch())
                .cleanJerkLifts(row.getCleanJerkLift1(), row.getCleanJerkLift2(), row.getCleanJerkLift3())
                .bestCleanJerk(row.getBestCleanJerk())
                .total(row.getTotal())
                .club(row.getClub())
                .gender(row.getGender())
                .build();
    }

    public Long getResultId() {
        return resultId;
    }

    public Long getLifterId() {
        return lifterId;
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

    public String getClub() {
        return club;
    }

    public String getWso() {
        return wso;
    }

    public Integer getCompetitionAge() {
        return competitionAge;
    }

    public Integer getNationalRank() {
        return nationalRank;
    }

    public String getGender() {
        return gender;
    }

    /**
     * Reads the current value of an enrichable field.
     */
    public Object get(ResultField field) {
        return switch (field) {
            case CLUB -> club;
            case WSO -> wso;
            case COMPETITION_AGE -> competitionAge;
            case NATIONAL_RANK -> nationalRank;
            case GENDER -> gender;
        };
    }

    /**
     * True when this result was recorded in the same meet and division.
     */
    public boolean isSameMeetAndDivision(Long otherMeetId, String otherAgeCategory, String otherWeightClass) {
        return Objects.equals(meetId, otherMeetId)
                && Objects.equals(ageCategory, otherAgeCategory)
                && Objects.equals(weightClass, otherWeightClass);
    }

    public Builder toBuilder() {
        return new Builder()
                .resultId(resultId)
                .lifterId(lifterId)
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
                .club(club)
                .wso(wso)
                .competitionAge(competitionAge)
                .nationalRank(nationalRank)
                .gender(gender);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long resultId;
        private Long lifterId;
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
        private String club;
        private String wso;
        private Integer competitionAge;
        private Integer nationalRank;
        private String gender;

        public Builder resultId(Long resultId) {
            this.resultId = resultId;
            return this;
        }

        public Builder lifterId(Long lifterId) {
            this.lifterId = lifterId;
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

        public Builder club(String club) {
            this.club = club;
            return this;
        }

        public Builder wso(String wso) {
            this.wso = wso;
            return this;
        }

        public Builder competitionAge(Integer competitionAge) {
            this.competitionAge = competitionAge;
            return this;
        }

        public Builder nationalRank(Integer nationalRank) {
            this.nationalRank = nationalRank;
            return this;
        }

        public Builder gender(String gender) {
            this.gender = gender;
            return this;
        }

        /**
         * Sets an enrichable field by its enum handle.
         */
        public Builder set(ResultField field, Object value) {
            switch (field) {
                case CLUB -> club((String) value);
                case WSO -> wso((String) value);
                case COMPETITION_AGE -> competitionAge((Integer) value);
                case NATIONAL_RANK -> nationalRank((Integer) value);
                case GENDER -> gender((String) value);
            }
            return this;
        }

        public MeetResult build() {
            return new MeetResult(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MeetResult that = (MeetResult) o;
        if (resultId == null || that.resultId == null) {
            return false;
        }
        return resultId.equals(that.resultId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(resultId);
    }

    @Override
    public String toString() {
        return "MeetResult{" +
                "resultId=" + resultId +
                ", lifterId=" + lifterId +
                ", meetId=" + meetId +
                ", division='" + ageCategory + " " + weightClass + '\'' +
                ", bodyweightKg=" + bodyweightKg +
                ", total=" + total +
                '}';
    }
}
