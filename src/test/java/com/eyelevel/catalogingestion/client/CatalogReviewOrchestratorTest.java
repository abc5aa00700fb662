package com.eyelevel.catalogingestion.client;

import com.eyelevel.catalogingestion.dto.importer.ProductionImportResult;
import com.eyelevel.catalogingestion.dto.staged.PageResult;
import com.eyelevel.catalogingestion.dto.staged.StagedFamilyResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedProductResponse;
import com.eyelevel.catalogingestion.dto.upload.UploadAcceptedResponse;
import com.eyelevel.catalogingestion.dto.upload.UploadSessionResponse;
import com.eyelevel.catalogingestion.exception.ParseFailedException;
import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.model.UploadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.OngoingStubbing;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogReviewOrchestratorTest {

    private static final String FIRST = "11111111-1111-1111-1111-111111111111";
    private static final String SECOND = "22222222-2222-2222-2222-222222222222";

    @Mock
    private CatalogIngestionApiClient apiClient;
    @Mock
    private UploadStatusPoller statusPoller;

    private CatalogReviewOrchestrator orchestrator;
    private final List<UploadStatusPoller.Listener> pollListeners = new ArrayList<>();
    private final List<UploadStatusPoller.PollingSession> pollingSessions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        orchestrator = new CatalogReviewOrchestrator(apiClient, new StagedPageAggregator(Runnable::run, 200, 1),
                                                     statusPoller);
    }

    @Test
    void completedUploadEntersReviewMode() {
        acceptUploads(FIRST);
        stubStagedData(FIRST, 2, 3);
        RecordingReviewListener listener = new RecordingReviewListener();

        String uploadId = orchestrator.startUpload(catalog(), 5, listener);
        pollListeners.get(0).onProgress(status(FIRST, UploadStatus.PARSING));
        pollListeners.get(0).onCompleted(status(FIRST, UploadStatus.COMPLETED));

        assertThat(uploadId).isEqualTo(FIRST);
        assertThat(listener.progress).hasSize(1);
        assertThat(listener.ready).singleElement().satisfies(review -> {
            assertThat(review.uploadId()).isEqualTo(FIRST);
            assertThat(review.families()).hasSize(2);
            assertThat(review.products()).hasSize(3);
        });
        assertThat(orchestrator.currentReview()).map(ReviewState::uploadId).contains(FIRST);
        verify(apiClient).upload(any(Resource.class), eq(5));
    }

    @Test
    void newerUploadDiscardsResultOfOlderOne() {
        acceptUploads(FIRST, SECOND);
        RecordingReviewListener firstListener = new RecordingReviewListener();
        RecordingReviewListener secondListener = new RecordingReviewListener();

        orchestrator.startUpload(catalog(), null, firstListener);
        orchestrator.startUpload(catalog(), null, secondListener);
        pollListeners.get(0).onCompleted(status(FIRST, UploadStatus.COMPLETED));
        pollListeners.get(0).onFailed(new ParseFailedException(FIRST, "late failure", 1));

        assertThat(pollingSessions.get(0).isCancelled()).isTrue();
        assertThat(pollingSessions.get(1).isCancelled()).isFalse();
        assertThat(firstListener.ready).isEmpty();
        assertThat(firstListener.failures).isEmpty();
        assertThat(orchestrator.currentReview()).isEmpty();
    }

    @Test
    void cancelStopsPollingAndDropsLateCompletion() {
        acceptUploads(FIRST);
        RecordingReviewListener listener = new RecordingReviewListener();

        orchestrator.startUpload(catalog(), null, listener);
        orchestrator.cancel();
        pollListeners.get(0).onCompleted(status(FIRST, UploadStatus.COMPLETED));

        assertThat(pollingSessions.get(0).isCancelled()).isTrue();
        assertThat(listener.ready).isEmpty();
        assertThat(orchestrator.currentReview()).isEmpty();
    }

    @Test
    void parseFailureReachesListener() {
        acceptUploads(FIRST);
        RecordingReviewListener listener = new RecordingReviewListener();

        orchestrator.startUpload(catalog(), null, listener);
        pollListeners.get(0).onFailed(new ParseFailedException(FIRST, "PDF is password protected", 0));

        assertThat(listener.failures).singleElement().satisfies(
                failure -> assertThat(failure).hasMessage("PDF is password protected"));
        assertThat(orchestrator.currentReview()).isEmpty();
    }

    @Test
    void resumeLoadsLatestSessionWithoutId() {
        stubLatestFamily(SECOND);
        stubStagedData(SECOND, 1, 1);

        Optional<ReviewState> review = orchestrator.resume();

        assertThat(review).map(ReviewState::uploadId).contains(SECOND);
        assertThat(orchestrator.currentReview()).isEqualTo(review);
    }

    @Test
    void resumeWithNothingStagedIsEmpty() {
        when(apiClient.listFamilies(isNull(), eq(0L), eq(1))).thenReturn(new PageResult<>(List.of(), 0, 0, 1));
        when(apiClient.listProducts(isNull(), isNull(), eq(0L), eq(1)))
                .thenReturn(new PageResult<>(List.of(), 0, 0, 1));

        assertThat(orchestrator.resume()).isEmpty();
    }

    @Test
    void resumeFindsSessionThroughProductsWhenItHasNoFamilies() {
        when(apiClient.listFamilies(isNull(), eq(0L), eq(1))).thenReturn(new PageResult<>(List.of(), 0, 0, 1));
        when(apiClient.listProducts(isNull(), isNull(), eq(0L), eq(1)))
                .thenReturn(new PageResult<>(List.of(product(1, SECOND)), 1, 0, 1));
        stubStagedData(SECOND, 0, 2);

        assertThat(orchestrator.resume()).hasValueSatisfying(review -> {
            assertThat(review.uploadId()).isEqualTo(SECOND);
            assertThat(review.products()).hasSize(2);
        });
    }

    @Test
    void resumeKeepsTheSessionFoundFirstWhenANewerOneCompletes() {
        when(apiClient.listFamilies(isNull(), anyLong(), anyInt()))
                .thenReturn(new PageResult<>(List.of(family(1, SECOND)), 1, 0, 1))
                .thenReturn(new PageResult<>(List.of(family(9, FIRST)), 1, 0, 1));
        lenient().when(apiClient.listProducts(isNull(), isNull(), anyLong(), anyInt()))
                 .thenReturn(new PageResult<>(List.of(product(9, FIRST)), 1, 0, 200));
        stubStagedData(SECOND, 2, 3);

        Optional<ReviewState> review = orchestrator.resume();

        assertThat(review).hasValueSatisfying(state -> {
            assertThat(state.uploadId()).isEqualTo(SECOND);
            assertThat(state.families()).extracting(StagedFamilyResponse::uploadId).containsOnly(SECOND);
            assertThat(state.products()).extracting(StagedProductResponse::uploadId).containsOnly(SECOND);
        });
        verify(apiClient, times(1)).listFamilies(isNull(), anyLong(), anyInt());
        verify(apiClient, never()).listProducts(isNull(), isNull(), anyLong(), anyInt());
    }

    @Test
    void importLeavesReviewMode() {
        stubLatestFamily(SECOND);
        stubStagedData(SECOND, 1, 1);
        orchestrator.resume();
        ProductionImportResult result = new ProductionImportResult(SECOND, 1, 1, 0, 0, 0);
        when(apiClient.importSession(SECOND)).thenReturn(result);

        assertThat(orchestrator.importCurrent()).isEqualTo(result);
        assertThat(orchestrator.currentReview()).isEmpty();
    }

    @Test
    void importWithoutReviewIsRejected() {
        assertThatThrownBy(() -> orchestrator.importCurrent()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> orchestrator.clearCurrent()).isInstanceOf(IllegalStateException.class);
        verify(apiClient, never()).importSession(any());
    }

    private void acceptUploads(final String... uploadIds) {
        OngoingStubbing<UploadAcceptedResponse> stubbing = when(apiClient.upload(any(Resource.class), any()));
        for (String uploadId : uploadIds) {
            stubbing = stubbing.thenReturn(new UploadAcceptedResponse(uploadId, UploadStatus.PARSING, "accepted"));
        }
        when(statusPoller.start(any(), any(), any())).thenAnswer(invocation -> {
            pollListeners.add(invocation.getArgument(2));
            UploadStatusPoller.PollingSession session = new UploadStatusPoller.PollingSession(invocation.getArgument(0));
            pollingSessions.add(session);
            return session;
        });
    }

    private void stubLatestFamily(final String uploadId) {
        when(apiClient.listFamilies(isNull(), eq(0L), eq(1)))
                .thenReturn(new PageResult<>(List.of(family(1, uploadId)), 1, 0, 1));
    }

    private void stubStagedData(final String uploadId, final int families, final int products) {
        List<StagedFamilyResponse> familyRows = new ArrayList<>();
        for (long i = 1; i <= families; i++) {
            familyRows.add(family(i, uploadId));
        }
        List<StagedProductResponse> productRows = new ArrayList<>();
        for (long i = 1; i <= products; i++) {
            productRows.add(product(i, uploadId));
        }
        when(apiClient.listFamilies(eq(uploadId), anyLong(), anyInt()))
                .thenReturn(new PageResult<>(familyRows, families, 0, 200));
        when(apiClient.listProducts(eq(uploadId), isNull(), anyLong(), anyInt()))
                .thenReturn(new PageResult<>(productRows, products, 0, 200));
    }

    private static StagedFamilyResponse family(final long id, final String uploadId) {
        return new StagedFamilyResponse(id, uploadId, "FAMILY " + id, null, null, 1, 60, true, ImportStatus.PENDING);
    }

    private static StagedProductResponse product(final long id, final String uploadId) {
        return new StagedProductResponse(id, uploadId, null, "Product " + id, "44" + id, null, null, null, null, null,
                                         null, null, null, null, null, null, false, 85, 1, ImportStatus.PENDING, 0L,
                                         null, null);
    }

    private static Resource catalog() {
        return new ByteArrayResource("%PDF-1.7".getBytes()) {
            @Override
            public String getFilename() {
                return "catalog.pdf";
            }
        };
    }

    private static UploadSessionResponse status(final String uploadId, final UploadStatus status) {
        return new UploadSessionResponse(uploadId, "catalog.pdf", 8L, status, null, 2, 1, null, 0, 0, 0, 0, null,
                                         null, null, null, null, null);
    }

    private static final class RecordingReviewListener implements ReviewListener {

        private final List<UploadSessionResponse> progress = new ArrayList<>();
        private final List<ReviewState> ready = new ArrayList<>();
        private final List<ParseFailedException> failures = new ArrayList<>();
        private final List<RuntimeException> errors = new ArrayList<>();

        @Override
        public void onProgress(final UploadSessionResponse status) {
            progress.add(status);
        }

        @Override
        public void onReviewReady(final ReviewState review) {
            ready.add(review);
        }

        @Override
        public void onFailed(final ParseFailedException failure) {
            failures.add(failure);
        }

        @Override
        public void onError(final RuntimeException error) {
            errors.add(error);
        }
    }
}
