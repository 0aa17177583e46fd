package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Declared mapping from canonical field keys to source headers. Read-only during ingestion;
 * keys that are not {@link CanonicalField}s are ignored.
 */
public final class ColumnMapping {

    private final Map<String, FieldMapping> fields;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ColumnMapping(Map<String, FieldMapping> fields) {
        this.fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ColumnMapping empty() {
        return new ColumnMapping(null);
    }

    public static ColumnMapping ofHeaders(Map<String, String> headersByField) {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        headersByField.forEach((field, header) -> fields.put(field, FieldMapping.of(header)));
        return new ColumnMapping(fields);
    }

    public Optional<FieldMapping> get(CanonicalField field) {
        return Optional.ofNullable(fields.get(field.key()));
    }

    @JsonValue
    public Map<String, FieldMapping> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColumnMapping && fields.equals(((ColumnMapping) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ColumnMapping" + fields;
    }
}
