package com.eyelevel.catalogingestion.client;

import com.eyelevel.catalogingestion.dto.staged.PageResult;
import com.eyelevel.catalogingestion.exception.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Loads every row of a paged staged-data listing.
 * <p>
 * The first page is fetched on the calling thread and tells how many rows exist. The remaining
 * {@code ceil((total - pageSize) / pageSize)} pages are then fetched in parallel, at most
 * {@code maxInFlight} at a time, and concatenated in page order. Rows added or removed between the first and later fetches may cause a short last page, a
 * duplicate or a gap; none of those is treated as an error.
 */
@Slf4j
public class StagedPageAggregator {

    private final Executor executor;
    private final int pageSize;
    private final int maxInFlight;

    public StagedPageAggregator(final Executor executor, final int pageSize, final int maxInFlight) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be at least 1.");
        }
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("Fetch parallelism must be at least 1.");
        }
        this.executor = executor;
        this.pageSize = pageSize;
        this.maxInFlight = maxInFlight;
    }

    /**
     * Fetches one page of a listing.
     */
    @FunctionalInterface
    public interface PageFetcher<T> {
        PageResult<T> fetch(long offset, int limit);
    }

    /**
     * @throws TransportException if any page fetch fails for a network reason.
     */
    public <T> List<T> fetchAll(final PageFetcher<T> fetcher) {
        final PageResult<T> first = fetcher.fetch(0, pageSize);
        final List<T> rows = new ArrayList<>(itemsOf(first));
        if (first == null || first.total() <= pageSize) {
            return rows;
        }

        final long extraPages = (first.total() - pageSize + pageSize - 1) / pageSize;
        log.debug("Listing has {} rows; fetching {} more page(s) of {} in parallel.", first.total(), extraPages,
                  pageSize);

        for (long wave = 1; wave <= extraPages; wave += maxInFlight) {
            final long lastPage = Math.min(extraPages, wave + maxInFlight - 1);
            rows.addAll(fetchWave(fetcher, wave, lastPage));
        }
        return rows;
    }

    private <T> List<T> fetchWave(final PageFetcher<T> fetcher, final long firstPage, final long lastPage) {
        final List<CompletableFuture<List<T>>> pages = new ArrayList<>();
        final List<T> rows = new ArrayList<>();
        try {
            for (long page = firstPage; page <= lastPage; page++) {
                final long offset = page * pageSize;
                pages.add(CompletableFuture.supplyAsync(() -> itemsOf(fetcher.fetch(offset, pageSize)), executor));
            }
            for (CompletableFuture<List<T>> page : pages) {
                rows.addAll(page.join());
            }
        } catch (RejectedExecutionException e) {
            pages.forEach(page -> page.cancel(true));
            throw new TransportException("Page fetch could not be scheduled: " + e.getMessage(), e);
        } catch (CompletionException e) {
            pages.forEach(page -> page.cancel(true));
            final Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TransportException("Page fetch failed: " + cause.getMessage(), cause);
        }
        return rows;
    }

    private static <T> List<T> itemsOf(final PageResult<T> page) {
        return page == null || page.items() == null ? List.of() : page.items();
    }
}
