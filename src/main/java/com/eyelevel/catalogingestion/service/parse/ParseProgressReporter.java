package com.eyelevel.catalogingestion.service.parse;

/**
 * Status contract between a parse job and its upload session.
 * <p>
 * A job calls {@link #started} once, {@link #pageProcessed} after every page, and finally exactly one
 * of {@link #completed} or {@link #failed}. Progress values never go backwards: a report lower than
 * what is already recorded is ignored. Every method returns {@code false} when the session no longer
 * accepts progress (deleted, or moved out of {@code parsing} by someone else), in which case the job
 * should stop.
 */
public interface ParseProgressReporter {

    boolean started(String uploadId, int totalPages);

    boolean pageProcessed(String uploadId, int pagesProcessed, ParseCounts counts, String currentStep);

    boolean completed(String uploadId, ParseCounts counts);

    /**
     * @param errorMessage Human readable reason; recorded verbatim on the session.
     */
    boolean failed(String uploadId, String errorMessage);
}
