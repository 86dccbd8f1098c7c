package com.govsense.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Row accounting for one cleaning pass.
 *
 * total = kept + rejected + duplicatesRemoved. Rows superseded by a later
 * occurrence under KEEP_LAST count as duplicatesRemoved; rows dropped under
 * REJECT_ALL count as rejected with reason DUPLICATE_KEY.
 */
@Value
@Builder
public class CleaningReport {

    String datasetId;
    int totalCount;
    int keptCount;
    int rejectedCount;
    int duplicatesRemoved;
    Map<RejectionReason, Integer> rejectionsByReason;
}
