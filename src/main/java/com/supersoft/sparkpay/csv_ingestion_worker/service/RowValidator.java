package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportPlayerPayload;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.NormalizedRow;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.RowOutcome;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.RowReasonCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates a normalized row against the {@code ImportPlayerV1} contract. Never throws: every
 * problem becomes a rejected {@link RowOutcome}.
 */
@Slf4j
@Component
public class RowValidator {

    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_NOTES_LENGTH = 1000;
    static final int MAX_EXTERNAL_ID_LENGTH = 64;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^[0-9+\\-(). ]{7,20}$");
    private static final Pattern ISO_DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("^[+-]?\\d{1,18}$");

    public RowOutcome validate(NormalizedRow row) {
        try {
            List<Violation> violations = collectViolations(row.getPayload(), row.getLoyaltyPointsText());
            if (violations.isEmpty()) {
                if (row.getLoyaltyPointsText() != null) {
                    row.getPayload().setLoyaltyPoints(Long.parseLong(row.getLoyaltyPointsText()));
                }
                return RowOutcome.staged(row);
            }

            // Codes are declared in precedence order
            RowReasonCode reasonCode = violations.stream()
                    .map(Violation::code)
                    .min(Enum::compareTo)
                    .orElseThrow();
            String detail = violations.stream()
                    .map(Violation::message)
                    .collect(Collectors.joining("; "));
            return RowOutcome.rejected(row, reasonCode, detail);
        } catch (RuntimeException e) {
            log.warn("Unexpected error validating row {}: {}", row.getRowNumber(), e.getMessage());
            return RowOutcome.rejected(row, RowReasonCode.INVALID_FORMAT, "row could not be validated");
        }
    }

    private List<Violation> collectViolations(ImportPlayerPayload payload, String loyaltyPoints) {
        List<Violation> violations = new ArrayList<>();
        ImportPlayerPayload.Identifiers ids = payload.getIdentifiers() != null
                ? payload.getIdentifiers() : new ImportPlayerPayload.Identifiers();
        ImportPlayerPayload.Profile profile = payload.getProfile() != null
                ? payload.getProfile() : new ImportPlayerPayload.Profile();

        if (ids.getEmail() == null && ids.getPhone() == null && ids.getExternalId() == null) {
            violations.add(new Violation(RowReasonCode.MISSING_IDENTIFIER,
                    "at least one of email, phone or external_id is required"));
        }

        if (ids.getEmail() != null && !EMAIL_PATTERN.matcher(ids.getEmail()).matches()) {
            violations.add(new Violation(RowReasonCode.INVALID_FORMAT, "email is not a valid address"));
        }
        if (ids.getPhone() != null && !PHONE_PATTERN.matcher(ids.getPhone()).matches()) {
            violations.add(new Violation(RowReasonCode.INVALID_FORMAT,
                    "phone must be 7-20 characters of digits, spaces or + - ( ) ."));
        }
        if (profile.getDob() != null && !isIsoDate(profile.getDob())) {
            violations.add(new Violation(RowReasonCode.INVALID_FORMAT, "dob must be a valid YYYY-MM-DD date"));
        }
        if (loyaltyPoints != null && !INTEGER_PATTERN.matcher(loyaltyPoints).matches()) {
            violations.add(new Violation(RowReasonCode.INVALID_FORMAT, "loyalty_points must be an integer"));
        }

        checkLength(violations, "first_name", profile.getFirstName(), MAX_NAME_LENGTH);
        checkLength(violations, "last_name", profile.getLastName(), MAX_NAME_LENGTH);
        checkLength(violations, "notes", payload.getNotes(), MAX_NOTES_LENGTH);
        checkLength(violations, "external_id", ids.getExternalId(), MAX_EXTERNAL_ID_LENGTH);
        return violations;
    }

    private static void checkLength(List<Violation> violations, String field, String value, int max) {
        if (value != null && value.length() > max) {
            violations.add(new Violation(RowReasonCode.FIELD_TOO_LONG,
                    field + " exceeds " + max + " characters"));
        }
    }

    private static boolean isIsoDate(String value) {
        if (!ISO_DATE_PATTERN.matcher(value).matches()) {
            return false;
        }
        try {
            LocalDate.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static final class Violation {
        private final RowReasonCode code;
        private final String message;

        private Violation(RowReasonCode code, String message) {
            this.code = code;
            this.message = message;
        }

        RowReasonCode code() {
            return code;
        }

        String message() {
            return message;
        }
    }
}
