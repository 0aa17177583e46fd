package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical {@code ImportPlayerV1} payload stored in {@code import_row.normalized_payload}.
 * The execute step reads nested paths such as {@code identifiers.email}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportPlayerPayload {

    public static final String CONTRACT_VERSION = "v1";

    @JsonProperty("contract_version")
    @Builder.Default
    private String contractVersion = CONTRACT_VERSION;

    @JsonProperty("source")
    private Source source;

    @JsonProperty("row_ref")
    private RowRef rowRef;

    @JsonProperty("identifiers")
    private Identifiers identifiers;

    @JsonProperty("profile")
    private Profile profile;

    @JsonProperty("loyalty_points")
    private Long loyaltyPoints;

    @JsonProperty("notes")
    private String notes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Source {
        @JsonProperty("file_name")
        private String fileName;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RowRef {
        @JsonProperty("row_number")
        private int rowNumber;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Identifiers {
        @JsonProperty("email")
        private String email;

        @JsonProperty("phone")
        private String phone;

        @JsonProperty("external_id")
        private String externalId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Profile {
        @JsonProperty("first_name")
        private String firstName;

        @JsonProperty("last_name")
        private String lastName;

        @JsonProperty("dob")
        private String dob;
    }
}
