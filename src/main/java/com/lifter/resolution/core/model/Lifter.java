package com.lifter.resolution.core.model;

import java.util.Objects;

/**
 * A persisted athlete identity.
 * Core domain object for lifter resolution. Instances are immutable; updates go
 * through {@link #toBuilder()} and are written back by the repository.
 */
public class Lifter {
    private final Long lifterId;
    private final String normalizedName;
    private final Long stableId;
    private final String membershipNumber;
    private final String countryCode;
    private final String countryName;
    private final Integer birthYear;
    private final String gender;

    private Lifter(Builder builder) {
        this.lifterId = builder.lifterId;
        this.normalizedName = builder.normalizedName;
        this.stableId = builder.stableId;
        this.membershipNumber = builder.membershipNumber;
        this.countryCode = builder.countryCode;
        this.countryName = builder.countryName;
        this.birthYear = builder.birthYear;
        this.gender = builder.gender;
    }

    /**
     * Store-assigned identifier, null until the lifter is persisted.
     */
    public Long getLifterId() {
        return lifterId;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    /**
     * External stable identifier issued by the ranking site. Unique across lifters when present.
     */
    public Long getStableId() {
        return stableId;
    }

    public String getMembershipNumber() {
        return membershipNumber;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getCountryName() {
        return countryName;
    }

    public Integer getBirthYear() {
        return birthYear;
    }

    public String getGender() {
        return gender;
    }

    public boolean isPersisted() {
        return lifterId != null;
    }

    public boolean hasStableId() {
        return stableId != null;
    }

    /**
     * Reads the current value of an enrichable field.
     */
    public Object get(LifterField field) {
        return switch (field) {
            case STABLE_ID -> stableId;
            case MEMBERSHIP_NUMBER -> membershipNumber;
            case COUNTRY_CODE -> countryCode;
            case COUNTRY_NAME -> countryName;
            case BIRTH_YEAR -> birthYear;
            case GENDER -> gender;
        };
    }

    public Builder toBuilder() {
        return new Builder()
                .lifterId(lifterId)
                .normalizedName(normalizedName)
                .stableId(stableId)
                .membershipNumber(membershipNumber)
                .countryCode(countryCode)
                .countryName(countryName)
                .birthYear(birthYear)
                .gender(gender);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long lifterId;
        private String normalizedName;
        private Long stableId;
        private String membershipNumber;
        private String countryCode;
        private String countryName;
        private Integer birthYear;
        private String gender;

        public Builder lifterId(Long lifterId) {
            this.lifterId = lifterId;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
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

        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public Builder countryName(String countryName) {
            this.countryName = countryName;
            return this;
        }

        public Builder birthYear(Integer birthYear) {
            this.birthYear = birthYear;
            return this;
        }

        public Builder gender(String gender) {
            this.gender = gender;
            return this;
        }

        /**
         * Sets a field by its enum handle. Values must match the field's type.
         */
        public Builder set(LifterField field, Object value) {
            switch (field) {
                case STABLE_ID -> stableId((Long) value);
                case MEMBERSHIP_NUMBER -> membershipNumber((String) value);
                case COUNTRY_CODE -> countryCode((String) value);
                case COUNTRY_NAME -> countryName((String) value);
                case BIRTH_YEAR -> birthYear((Integer) value);
                case GENDER -> gender((String) value);
            }
            return this;
        }

        public Lifter build() {
            Objects.requireNonNull(normalizedName, "normalizedName is required");
            return new Lifter(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Lifter lifter = (Lifter) o;
        if (lifterId == null || lifter.lifterId == null) {
            return false;
        }
        return lifterId.equals(lifter.lifterId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(lifterId);
    }

    @Override
    public String toString() {
        return "Lifter{" +
                "lifterId=" + lifterId +
                ", normalizedName='" + normalizedName + '\'' +
                ", stableId=" + stableId +
                ", membershipNumber='" + membershipNumber + '\'' +
                '}';
    }
}
