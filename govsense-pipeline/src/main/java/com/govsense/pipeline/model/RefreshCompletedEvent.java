package com.govsense.pipeline.model;

import java.util.List;
import java.util.Set;

/**
 * Fired once per run that reaches SUCCEEDED, after every table is committed.
 */
public record RefreshCompletedEvent(String runId, List<String> succeededDatasets, Set<String> failedDatasets) {}
