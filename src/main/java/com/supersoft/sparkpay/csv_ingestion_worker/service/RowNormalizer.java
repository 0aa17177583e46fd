package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.CanonicalField;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ColumnMapping;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.FieldMapping;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportPlayerPayload;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.NormalizedRow;
import com.supersoft.sparkpay.csv_ingestion_worker.util.HeaderNormalizer;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns one raw record into a {@link NormalizedRow}. Values are trimmed and empty values are
 * treated as absent; coercions run only when the column mapping declares them.
 */
@Component
public class RowNormalizer {

    private static final Pattern GROUPED_NUMBER = Pattern.compile("^[+-]?\\d{1,3}(,\\d{3})+(\\.\\d+)?$");

    public NormalizedRow normalize(List<String> headers, List<String> record, ColumnMapping mapping,
                                   int rowNumber, String fileName) {
        Map<String, String> rawRow = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String value = i < record.size() ? record.get(i) : null;
            rawRow.put(headers.get(i), value != null ? value.trim() : null);
        }

        Map<CanonicalField, String> values = new EnumMap<>(CanonicalField.class);
        for (CanonicalField field : CanonicalField.values()) {
            mapping.get(field).ifPresent(fieldMapping -> {
                String value = resolve(rawRow, fieldMapping);
                if (value != null) {
                    values.put(field, value);
                }
            });
        }

        ImportPlayerPayload payload = ImportPlayerPayload.builder()
                .source(ImportPlayerPayload.Source.builder().fileName(fileName).build())
                .rowRef(new ImportPlayerPayload.RowRef(rowNumber))
                .identifiers(ImportPlayerPayload.Identifiers.builder()
                        .email(values.get(CanonicalField.EMAIL))
                        .phone(values.get(CanonicalField.PHONE))
                        .externalId(values.get(CanonicalField.EXTERNAL_ID))
                        .build())
                .profile(ImportPlayerPayload.Profile.builder()
                        .firstName(values.get(CanonicalField.FIRST_NAME))
                        .lastName(values.get(CanonicalField.LAST_NAME))
                        .dob(values.get(CanonicalField.DOB))
                        .build())
                .notes(values.get(CanonicalField.NOTES))
                .build();

        return new NormalizedRow(rowNumber, Collections.unmodifiableMap(rawRow), payload,
                values.get(CanonicalField.LOYALTY_POINTS));
    }

    private String resolve(Map<String, String> rawRow, FieldMapping fieldMapping) {
        if (fieldMapping.getSource() == null) {
            return null;
        }
        String value = rawRow.get(HeaderNormalizer.normalizeName(fieldMapping.getSource()));
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (fieldMapping.isStripThousandsSeparator()) {
            value = stripThousandsSeparator(value);
        }
        if (fieldMapping.getDateFormat() != null && !fieldMapping.getDateFormat().isBlank()) {
            value = reformatDate(value, fieldMapping.getDateFormat());
        }
        return value;
    }

    /**
     * Removes comma grouping from well-formed numbers only; anything else is left for the validator.
     */
    static String stripThousandsSeparator(String value) {
        if (GROUPED_NUMBER.matcher(value).matches()) {
            return value.replace(",", "");
        }
        return value;
    }

    /**
     * Rewrites a date in the declared pattern as ISO {@code yyyy-MM-dd}. Parsing is strict, so
     * impossible dates and unusable patterns leave the value untouched.
     */
    static String reformatDate(String value, String pattern) {
        try {
            DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                    .appendPattern(pattern)
                    .parseDefaulting(ChronoField.ERA, 1)
                    .toFormatter(Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);
            return LocalDate.parse(value, formatter).toString();
        } catch (DateTimeParseException | IllegalArgumentException e) {
            return value;
        }
    }
}
