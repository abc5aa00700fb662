package com.eyelevel.catalogingestion.service.parse;

import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import com.eyelevel.catalogingestion.service.storage.FileStore;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogParseWorkerTest {

    private static final String UPLOAD_ID = "5b0d8c3e-2a64-4f0e-9b5b-8f3d6a1c2e10";
    private static final String FILE_KEY = FileStore.uploadKey(UPLOAD_ID, "catalog.pdf");

    @Mock
    private UploadSessionRepository uploadSessionRepository;
    @Mock
    private CatalogPageExtractor pageExtractor;
    @Mock
    private StagedRowWriter rowWriter;
    @Mock
    private ParseProgressReporter progressReporter;
    @Mock
    private FileStore fileStore;

    private CatalogParseWorker worker;

    @BeforeEach
    void setUp() {
        worker = new CatalogParseWorker(uploadSessionRepository, pageExtractor, rowWriter, progressReporter, fileStore);
    }

    @Test
    void parsesOnlyUpToMaxPages() throws IOException {
        givenSession(2, pdfWithPages(5));
        when(pageExtractor.extract(any(PDDocument.class), anyInt())).thenAnswer(
                invocation -> productPage(invocation.getArgument(1)));
        when(rowWriter.write(eq(UPLOAD_ID), any(PageExtraction.class))).thenReturn(new ParseCounts(1, 1, 2, 0));
        when(progressReporter.started(UPLOAD_ID, 2)).thenReturn(true);
        when(progressReporter.pageProcessed(eq(UPLOAD_ID), anyInt(), any(ParseCounts.class), anyString()))
                .thenReturn(true);

        worker.parse(UPLOAD_ID);

        InOrder order = inOrder(progressReporter);
        order.verify(progressReporter).started(UPLOAD_ID, 2);
        order.verify(progressReporter).pageProcessed(UPLOAD_ID, 1, new ParseCounts(1, 1, 2, 0), "Parsing page 1/2");
        order.verify(progressReporter).pageProcessed(UPLOAD_ID, 2, new ParseCounts(2, 2, 4, 0), "Parsing page 2/2");
        order.verify(progressReporter).completed(UPLOAD_ID, new ParseCounts(2, 2, 4, 0));

        ArgumentCaptor<Integer> pages = ArgumentCaptor.forClass(Integer.class);
        verify(pageExtractor, times(2)).extract(any(PDDocument.class), pages.capture());
        assertThat(pages.getAllValues()).containsExactly(1, 2);
        verify(progressReporter, never()).failed(anyString(), anyString());
    }

    @Test
    void skipsPageThatFailsToExtract() throws IOException {
        givenSession(null, pdfWithPages(2));
        when(pageExtractor.extract(any(PDDocument.class), eq(1))).thenThrow(new IOException("broken page"));
        when(pageExtractor.extract(any(PDDocument.class), eq(2))).thenReturn(productPage(2));
        when(rowWriter.write(eq(UPLOAD_ID), any(PageExtraction.class))).thenReturn(new ParseCounts(1, 1, 0, 1));
        when(progressReporter.started(UPLOAD_ID, 2)).thenReturn(true);
        when(progressReporter.pageProcessed(eq(UPLOAD_ID), anyInt(), any(ParseCounts.class), anyString()))
                .thenReturn(true);

        worker.parse(UPLOAD_ID);

        verify(progressReporter).pageProcessed(UPLOAD_ID, 1, ParseCounts.EMPTY, "Parsing page 1/2");
        verify(progressReporter).completed(UPLOAD_ID, new ParseCounts(1, 1, 0, 1));
    }

    @Test
    void stopsWhenSessionNoLongerAcceptsProgress() throws IOException {
        givenSession(null, pdfWithPages(3));
        when(pageExtractor.extract(any(PDDocument.class), anyInt())).thenReturn(PageExtraction.empty(1));
        when(rowWriter.write(eq(UPLOAD_ID), any(PageExtraction.class))).thenReturn(ParseCounts.EMPTY);
        when(progressReporter.started(UPLOAD_ID, 3)).thenReturn(true);
        when(progressReporter.pageProcessed(eq(UPLOAD_ID), eq(1), any(ParseCounts.class), anyString()))
                .thenReturn(false);

        worker.parse(UPLOAD_ID);

        verify(pageExtractor, times(1)).extract(any(PDDocument.class), anyInt());
        verify(progressReporter, never()).completed(anyString(), any(ParseCounts.class));
    }

    @Test
    void reportsPasswordProtectedPdf() throws IOException {
        givenSession(null, encryptedPdf());

        worker.parse(UPLOAD_ID);

        verify(progressReporter).failed(UPLOAD_ID, "The PDF is password protected and cannot be parsed.");
        verify(progressReporter, never()).started(anyString(), anyInt());
    }

    @Test
    void reportsUnreadablePdf() {
        givenSession(null, "%PDF-1.7 this is not really a pdf".getBytes(StandardCharsets.US_ASCII));

        worker.parse(UPLOAD_ID);

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(progressReporter).failed(eq(UPLOAD_ID), message.capture());
        assertThat(message.getValue()).startsWith("Failed to read PDF: ");
    }

    @Test
    void ignoresSessionThatIsNoLongerParsing() {
        when(uploadSessionRepository.findById(UPLOAD_ID)).thenReturn(Optional.of(
                UploadSession.builder().uploadId(UPLOAD_ID).status(UploadStatus.FAILED).filePath(FILE_KEY).build()));

        worker.parse(UPLOAD_ID);

        verify(fileStore, never()).open(anyString());
        verify(progressReporter, never()).failed(anyString(), anyString());
    }

    private void givenSession(final Integer maxPages, final byte[] pdf) {
        when(uploadSessionRepository.findById(UPLOAD_ID)).thenReturn(Optional.of(UploadSession.builder()
                .uploadId(UPLOAD_ID)
                .workspaceId("default")
                .filename("catalog.pdf")
                .filePath(FILE_KEY)
                .maxPages(maxPages)
                .status(UploadStatus.PARSING)
                .build()));
        when(fileStore.open(FILE_KEY)).thenReturn(new ByteArrayInputStream(pdf));
    }

    private static PageExtraction productPage(final int pageNumber) {
        PageExtraction.Product product = new PageExtraction.Product("10" + pageNumber + "0", "Model 10" + pageNumber + "0",
                null, PageExtraction.Dimensions.NONE, List.of());
        return new PageExtraction(pageNumber, null, List.of(product), List.of());
    }

    private static byte[] pdfWithPages(final int pages) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (int i = 0; i < pages; i++) {
                document.addPage(new PDPage());
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    private static byte[] encryptedPdf() throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.addPage(new PDPage());
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner-secret", "user-secret",
                                                                           new AccessPermission());
            policy.setEncryptionKeyLength(128);
            document.protect(policy);
            document.save(out);
            return out.toByteArray();
        }
    }
}
