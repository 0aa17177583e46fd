package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import lombok.Value;

import java.util.Map;

/**
 * A source record after header and field normalization, before validation.
 */
@Value
public class NormalizedRow {
    int rowNumber;
    Map<String, String> rawRow;
    ImportPlayerPayload payload;
    /** Mapped {@code loyalty_points} text after declared coercions; set on the payload once it validates. */
    String loyaltyPointsText;
}
