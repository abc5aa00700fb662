package com.eyelevel.catalogingestion.dto.cleanup;

/**
 * Outcome of one cleanup run. {@code orphaned} is {@code null} when the orphan sweep was not requested.
 */
public record CleanupReport(ExpiredSweepStats expired, OrphanSweepStats orphaned) {
}
