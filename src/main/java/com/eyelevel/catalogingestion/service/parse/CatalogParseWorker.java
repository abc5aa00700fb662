package com.eyelevel.catalogingestion.service.parse;

import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import com.eyelevel.catalogingestion.service.storage.FileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.io.RandomAccessReadBuffer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Background job that turns a stored catalog into staged rows, page by page, and reports progress
 * through the {@link ParseProgressReporter}. Runs on the application task executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogParseWorker {

    private final UploadSessionRepository uploadSessionRepository;
    private final CatalogPageExtractor pageExtractor;
    private final StagedRowWriter rowWriter;
    private final ParseProgressReporter progressReporter;
    private final FileStore fileStore;

    public void parse(final String uploadId) {
        final UploadSession session = uploadSessionRepository.findById(uploadId).orElse(null);
        if (session == null) {
            log.warn("[{}] Parse job started for a session that no longer exists. Nothing to do.", uploadId);
            return;
        }
        if (session.getStatus() != UploadStatus.PARSING) {
            log.warn("[{}] Parse job skipped: session is {} rather than parsing.", uploadId, session.getStatus());
            return;
        }

        try (InputStream in = fileStore.open(session.getFilePath());
             PDDocument document = Loader.loadPDF(new RandomAccessReadBuffer(in))) {
            parseDocument(uploadId, session.getMaxPages(), document);
        } catch (InvalidPasswordException e) {
            log.warn("[{}] Catalog is password protected.", uploadId);
            progressReporter.failed(uploadId, "The PDF is password protected and cannot be parsed.");
        } catch (IOException e) {
            log.error("[{}] Could not read catalog '{}'.", uploadId, session.getFilePath(), e);
            progressReporter.failed(uploadId, "Failed to read PDF: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure while parsing catalog.", uploadId, e);
            progressReporter.failed(uploadId, "Unexpected parse failure: " + e.getMessage());
        }
    }

    private void parseDocument(final String uploadId, final Integer maxPages, final PDDocument document) {
        final int documentPages = document.getNumberOfPages();
        final int pagesToProcess = maxPages == null ? documentPages : Math.min(maxPages, documentPages);
        log.info("[{}] Catalog has {} page(s); parsing {}.", uploadId, documentPages, pagesToProcess);

        if (!progressReporter.started(uploadId, pagesToProcess)) {
            log.warn("[{}] Session stopped accepting progress before parsing began. Aborting.", uploadId);
            return;
        }

        ParseCounts totals = ParseCounts.EMPTY;
        for (int pageNumber = 1; pageNumber <= pagesToProcess; pageNumber++) {
            try {
                final PageExtraction extraction = pageExtractor.extract(document, pageNumber);
                totals = totals.plus(rowWriter.write(uploadId, extraction));
            } catch (IOException | RuntimeException e) {
                log.error("[{}] Error parsing page {}; skipping it.", uploadId, pageNumber, e);
            }

            final String step = String.format("Parsing page %d/%d", pageNumber, pagesToProcess);
            if (!progressReporter.pageProcessed(uploadId, pageNumber, totals, step)) {
                log.warn("[{}] Session stopped accepting progress after page {}. Aborting.", uploadId, pageNumber);
                return;
            }
        }

        progressReporter.completed(uploadId, totals);
    }
}
