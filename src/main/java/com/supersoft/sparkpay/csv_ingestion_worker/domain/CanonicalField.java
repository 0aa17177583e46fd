package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import java.util.Optional;

/**
 * Fields of the {@code ImportPlayerV1} contract that a column mapping may target.
 */
public enum CanonicalField {
    EMAIL("email"),
    PHONE("phone"),
    EXTERNAL_ID("external_id"),
    FIRST_NAME("first_name"),
    LAST_NAME("last_name"),
    DOB("dob"),
    LOYALTY_POINTS("loyalty_points"),
    NOTES("notes");

    private final String key;

    CanonicalField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<CanonicalField> fromKey(String key) {
        for (CanonicalField field : values()) {
            if (field.key.equals(key)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
