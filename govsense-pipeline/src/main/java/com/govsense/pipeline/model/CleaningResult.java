package com.govsense.pipeline.model;

import java.util.List;

public record CleaningResult(List<CleanRecord> records, CleaningReport report) {}
