package com.govsense.pipeline.model;

import java.util.List;

/**
 * @param records           derived rows ordered by region code, then year
 * @param unmappedCommunes  communes left out of every regional aggregate because they carry no region code
 */
public record TransformResult(List<DerivedRecord> records, int unmappedCommunes) {}
