package com.eyelevel.catalogingestion.client;

import com.eyelevel.catalogingestion.dto.cleanup.CleanupReport;
import com.eyelevel.catalogingestion.dto.importer.ProductionImportResult;
import com.eyelevel.catalogingestion.dto.staged.PageResult;
import com.eyelevel.catalogingestion.dto.staged.StagedFamilyResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedProductResponse;
import com.eyelevel.catalogingestion.dto.upload.SessionDeletionResult;
import com.eyelevel.catalogingestion.dto.upload.UploadAcceptedResponse;
import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import com.eyelevel.catalogingestion.exception.ParseFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one reviewer's workflow against the ingestion service: upload, poll until parsing ends, load
 * the staged data, then import or clear the session.
 * <p>
 * Only the most recent upload or resume is live. Starting a new one, or calling {@link #cancel()},
 * invalidates the previous run's token, and a run only publishes results while its token is valid, so
 * a late poll or page fetch can never overwrite newer state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "catalog-client", name = "base-url")
public class CatalogReviewOrchestrator {

    private final CatalogIngestionApiClient apiClient;
    private final StagedPageAggregator pageAggregator;
    private final UploadStatusPoller statusPoller;

    private final AtomicReference<Run> currentRun = new AtomicReference<>();
    private final AtomicReference<ReviewState> reviewState = new AtomicReference<>();

    /**
     * Uploads a catalog and follows it to review mode in the background.
     *
     * @return the new session's id.
     */
    public String startUpload(final Resource catalog, final Integer maxPages, final ReviewListener listener) {
        final Run run = replaceRun();
        final UploadAcceptedResponse accepted = apiClient.upload(catalog, maxPages);
        final String uploadId = accepted.uploadId();
        log.info("Upload {} accepted with status {}.", uploadId, accepted.status());

        run.attach(statusPoller.start(uploadId, apiClient::getStatus, new UploadStatusPoller.Listener() {
            @Override
            public void onProgress(final UploadSessionResponse status) {
                if (run.isLive()) {
                    listener.onProgress(status);
                }
            }

            @Override
            public void onCompleted(final UploadSessionResponse status) {
                loadReview(run, uploadId, listener);
            }

            @Override
            public void onFailed(final ParseFailedException failure) {
                if (run.isLive()) {
                    listener.onFailed(failure);
                }
            }

            @Override
            public void onError(final RuntimeException error) {
                if (run.isLive()) {
                    listener.onError(error);
                }
            }
        }));
        return uploadId;
    }

    /**
     * Loads the workspace's latest completed session without a session id, e.g. after the reviewer lost
     * track of it.
     *
     * @return the review, or empty when the workspace has nothing left to review.
     */
    public Optional<ReviewState> resume() {
        final Run run = replaceRun();
        final String uploadId = latestUploadId();
        if (uploadId == null) {
            log.info("No staged data to resume.");
            return Optional.empty();
        }
        final List<StagedFamilyResponse> families = pageAggregator.fetchAll(
                (offset, limit) -> apiClient.listFamilies(uploadId, offset, limit));
        final List<StagedProductResponse> products = pageAggregator.fetchAll(
                (offset, limit) -> apiClient.listProducts(uploadId, null, offset, limit));

        final ReviewState review = new ReviewState(uploadId, families, products);
        if (!publish(run, review)) {
            return Optional.empty();
        }
        log.info("Resumed upload {}: {} families, {} products.", uploadId, families.size(), products.size());
        return Optional.of(review);
    }

    public Optional<ReviewState> currentReview() {
        return Optional.ofNullable(reviewState.get());
    }

    /**
     * Imports the session under review and leaves review mode.
     *
     * @throws IllegalStateException if nothing is under review.
     */
    public ProductionImportResult importCurrent() {
        final ReviewState review = requireReview();
        final ProductionImportResult result = apiClient.importSession(review.uploadId());
        reviewState.compareAndSet(review, null);
        log.info("Imported upload {}: {}", review.uploadId(), result);
        return result;
    }

    /**
     * Deletes the session under review with all its staged data.
     *
     * @throws IllegalStateException if nothing is under review.
     */
    public SessionDeletionResult clearCurrent() {
        final ReviewState review = requireReview();
        final SessionDeletionResult result = apiClient.deleteSession(review.uploadId());
        reviewState.compareAndSet(review, null);
        log.info("Cleared upload {}: {}", review.uploadId(), result);
        return result;
    }

    public CleanupReport cleanupExpired(final boolean includeOrphaned) {
        return apiClient.cleanupExpired(includeOrphaned);
    }

    /**
     * Stops the current upload's polling and discards any result still in flight.
     */
    public void cancel() {
        final Run run = currentRun.getAndSet(null);
        if (run != null) {
            run.cancel();
        }
    }

    private void loadReview(final Run run, final String uploadId, final ReviewListener listener) {
        try {
            final List<StagedFamilyResponse> families = pageAggregator.fetchAll(
                    (offset, limit) -> apiClient.listFamilies(uploadId, offset, limit));
            final List<StagedProductResponse> products = pageAggregator.fetchAll(
                    (offset, limit) -> apiClient.listProducts(uploadId, null, offset, limit));
            final ReviewState review = new ReviewState(uploadId, families, products);
            if (publish(run, review)) {
                log.info("Upload {} ready for review: {} families, {} products.", uploadId, families.size(),
                         products.size());
                listener.onReviewReady(review);
            }
        } catch (RuntimeException e) {
            log.warn("Could not load staged data of upload {}.", uploadId, e);
            if (run.isLive()) {
                listener.onError(e);
            }
        }
    }

    /**
     * Asks the service once which session it would list by default. Every later fetch names that session
     * explicitly, so a session completing mid-resume cannot mix into the review.
     */
    private String latestUploadId() {
        final PageResult<StagedFamilyResponse> familyPage = apiClient.listFamilies(null, 0, 1);
        if (familyPage != null && !CollectionUtils.isEmpty(familyPage.items())) {
            return familyPage.items().get(0).uploadId();
        }
        final PageResult<StagedProductResponse> productPage = apiClient.listProducts(null, null, 0, 1);
        if (productPage != null && !CollectionUtils.isEmpty(productPage.items())) {
            return productPage.items().get(0).uploadId();
        }
        return null;
    }

    private boolean publish(final Run run, final ReviewState review) {
        if (!run.isLive() || currentRun.get() != run) {
            log.debug("Dropping stale review of upload {}.", review.uploadId());
            return false;
        }
        reviewState.set(review);
        return true;
    }

    private ReviewState requireReview() {
        final ReviewState review = reviewState.get();
        if (review == null) {
            throw new IllegalStateException("No upload session is under review.");
        }
        return review;
    }

    private Run replaceRun() {
        final Run run = new Run();
        final Run previous = currentRun.getAndSet(run);
        if (previous != null) {
            previous.cancel();
        }
        reviewState.set(null);
        return run;
    }

    /**
     * Cancellation token of one upload or resume.
     */
    private static final class Run {

        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile UploadStatusPoller.PollingSession polling;

        boolean isLive() {
            return !cancelled.get();
        }

        void attach(final UploadStatusPoller.PollingSession session) {
            this.polling = session;
            if (cancelled.get()) {
                session.cancel();
            }
        }

        void cancel() {
            cancelled.set(true);
            final UploadStatusPoller.PollingSession session = polling;
            if (session != null) {
                session.cancel();
            }
        }
    }
}
