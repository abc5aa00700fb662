package com.eyelevel.catalogingestion.client;

import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import com.eyelevel.catalogingestion.exception.ParseFailedException;
import com.eyelevel.catalogingestion.exception.apiclient.ConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls an upload session at a fixed interval until it reaches a terminal status.
 * <p>
 * Every poll ends in exactly one of: more polling, a single terminal callback, or silence after
 * {@link PollingSession#cancel()}. A result that arrives after cancellation is dropped. Any error,
 * including {@code NotFound} for a session deleted out of band, stops polling instead of retrying.
 */
@Slf4j
public class UploadStatusPoller {

    private final ThreadPoolTaskScheduler scheduler;
    private final Duration interval;

    public UploadStatusPoller(final ThreadPoolTaskScheduler scheduler, final Duration interval) {
        this.scheduler = scheduler;
        this.interval = interval;
    }

    @FunctionalInterface
    public interface StatusFetcher {
        UploadSessionResponse fetch(String uploadId);
    }

    /**
     * Receives the outcome of a poll. Called on the scheduler thread.
     */
    public interface Listener {

        void onProgress(UploadSessionResponse status);

        void onCompleted(UploadSessionResponse status);

        void onFailed(ParseFailedException failure);

        void onError(RuntimeException error);
    }

    public PollingSession start(final String uploadId, final StatusFetcher fetcher, final Listener listener) {
        final PollingSession session = new PollingSession(uploadId);
        log.info("Polling upload {} every {} ms.", uploadId, interval.toMillis());
        session.attach(scheduler.scheduleAtFixedRate(() -> poll(session, fetcher, listener), interval));
        return session;
    }

    public void shutdown() {
        scheduler.shutdown();
    }

    private void poll(final PollingSession session, final StatusFetcher fetcher, final Listener listener) {
        if (session.isCancelled()) {
            return;
        }
        final String uploadId = session.getUploadId();
        final UploadSessionResponse status;
        try {
            status = fetcher.fetch(uploadId);
        } catch (RuntimeException e) {
            if (session.finish()) {
                log.warn("Polling upload {} stopped after an error: {}", uploadId, e.getMessage());
                listener.onError(e);
            }
            return;
        }
        if (session.isCancelled() || status == null) {
            return;
        }

        switch (status.status()) {
            case UPLOADING, PARSING -> listener.onProgress(status);
            case COMPLETED -> {
                if (session.finish()) {
                    log.info("Upload {} completed after {} page(s).", uploadId, status.pagesProcessed());
                    listener.onCompleted(status);
                }
            }
            case FAILED -> {
                if (session.finish()) {
                    log.warn("Upload {} failed: {}", uploadId, status.errorMessage());
                    listener.onFailed(new ParseFailedException(uploadId, status.errorMessage(),
                                                               status.pagesProcessed()));
                }
            }
            case IMPORTED, EXPIRED -> {
                if (session.finish()) {
                    listener.onError(new ConflictException(String.format("Upload %s is already %s.", uploadId,
                                                                         status.status().getValue())));
                }
            }
        }
    }

    /**
     * Handle of one polling loop.
     */
    public static final class PollingSession {

        private final String uploadId;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        PollingSession(final String uploadId) {
            this.uploadId = uploadId;
        }

        public String getUploadId() {
            return uploadId;
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        /**
         * Stops polling. No callback is delivered after this returns, except one already in progress.
         */
        public void cancel() {
            if (finish()) {
                log.info("Polling of upload {} cancelled.", uploadId);
            }
        }

        void attach(final ScheduledFuture<?> scheduled) {
            this.future = scheduled;
            if (cancelled.get()) {
                scheduled.cancel(false);
            }
        }

        /**
         * @return {@code true} for the one caller that ends this loop.
         */
        boolean finish() {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            final ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            return true;
        }
    }
}
