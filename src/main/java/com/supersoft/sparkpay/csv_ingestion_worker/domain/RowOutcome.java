package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import lombok.Getter;

/**
 * Result of validating one normalized row: either a staged payload or a classified rejection.
 */
@Getter
public class RowOutcome {

    private final NormalizedRow row;
    private final ImportRow.RowStatus status;
    private final RowReasonCode reasonCode;
    private final String reasonDetail;

    private RowOutcome(NormalizedRow row, ImportRow.RowStatus status, RowReasonCode reasonCode, String reasonDetail) {
        this.row = row;
        this.status = status;
        this.reasonCode = reasonCode;
        this.reasonDetail = reasonDetail;
    }

    public static RowOutcome staged(NormalizedRow row) {
        return new RowOutcome(row, ImportRow.RowStatus.STAGED, null, null);
    }

    public static RowOutcome rejected(NormalizedRow row, RowReasonCode reasonCode, String reasonDetail) {
        return new RowOutcome(row, ImportRow.RowStatus.ERROR, reasonCode, reasonDetail);
    }

    public boolean isStaged() {
        return status == ImportRow.RowStatus.STAGED;
    }

    public int getRowNumber() {
        return row.getRowNumber();
    }
}
