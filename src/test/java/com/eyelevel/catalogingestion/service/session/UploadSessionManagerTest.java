package com.eyelevel.catalogingestion.service.session;

import com.eyelevel.catalogingestion.dto.upload.SessionDeletionResult;
import com.eyelevel.catalogingestion.dto.upload.UploadAcceptedResponse;
import com.eyelevel.catalogingestion.exception.FileStoreException;
import com.eyelevel.catalogingestion.exception.apiclient.BadRequestException;
import com.eyelevel.catalogingestion.exception.apiclient.NotFoundException;
import com.eyelevel.catalogingestion.model.UploadSession;
import com.eyelevel.catalogingestion.model.UploadStatus;
import com.eyelevel.catalogingestion.repository.CatalogImageRepository;
import com.eyelevel.catalogingestion.repository.StagedFamilyRepository;
import com.eyelevel.catalogingestion.repository.StagedImageRepository;
import com.eyelevel.catalogingestion.repository.StagedProductRepository;
import com.eyelevel.catalogingestion.repository.StagedVariationRepository;
import com.eyelevel.catalogingestion.repository.UploadSessionRepository;
import com.eyelevel.catalogingestion.service.asynctask.AsyncTaskManager;
import com.eyelevel.catalogingestion.service.parse.CatalogParseWorker;
import com.eyelevel.catalogingestion.service.storage.FileStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadSessionManagerTest {

    private static final byte[] PDF_BYTES = "%PDF-1.7\n".getBytes(StandardCharsets.US_ASCII);

    @Mock
    private UploadSessionRepository uploadSessionRepository;
    @Mock
    private StagedFamilyRepository stagedFamilyRepository;
    @Mock
    private StagedProductRepository stagedProductRepository;
    @Mock
    private StagedVariationRepository stagedVariationRepository;
    @Mock
    private StagedImageRepository stagedImageRepository;
    @Mock
    private CatalogImageRepository catalogImageRepository;
    @Mock
    private UploadValidationService validationService;
    @Mock
    private SessionLifecycleManager lifecycleManager;
    @Mock
    private AsyncTaskManager asyncTaskManager;
    @Mock
    private CatalogParseWorker parseWorker;
    @Mock
    private FileStore fileStore;

    @InjectMocks
    private UploadSessionManager uploadSessionManager;

    @Test
    void storesFileAndSchedulesParse() {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.pdf", "application/pdf", PDF_BYTES);
        when(validationService.validateCatalogUpload(file)).thenReturn("catalog.pdf");

        UploadAcceptedResponse response = uploadSessionManager.createSession("showroom", file, 25);

        assertThat(response.status()).isEqualTo(UploadStatus.PARSING);
        assertThat(response.uploadId()).hasSize(36);

        ArgumentCaptor<UploadSession> saved = ArgumentCaptor.forClass(UploadSession.class);
        verify(uploadSessionRepository).save(saved.capture());
        UploadSession session = saved.getValue();
        assertThat(session.getUploadId()).isEqualTo(response.uploadId());
        assertThat(session.getWorkspaceId()).isEqualTo("showroom");
        assertThat(session.getStatus()).isEqualTo(UploadStatus.UPLOADING);
        assertThat(session.getMaxPages()).isEqualTo(25);
        assertThat(session.getFilePath()).isEqualTo("uploads/" + response.uploadId() + "_catalog.pdf");

        verify(fileStore).store(eq(session.getFilePath()), any(InputStream.class), eq((long) PDF_BYTES.length));
        verify(lifecycleManager).markParsing(response.uploadId());

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(asyncTaskManager).runAfterCommit(eq(response.uploadId()), task.capture(), any(Runnable.class));
        task.getValue().run();
        verify(parseWorker).parse(response.uploadId());
    }

    @Test
    void rejectsNonPositiveMaxPagesBeforeAnythingIsStored() {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.pdf", "application/pdf", PDF_BYTES);

        assertThatThrownBy(() -> uploadSessionManager.createSession("default", file, 0))
                .isInstanceOf(BadRequestException.class);
        verifyNoInteractions(uploadSessionRepository, fileStore, asyncTaskManager);
    }

    @Test
    void removesSessionWhenFileCannotBeStored() {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.pdf", "application/pdf", PDF_BYTES);
        when(validationService.validateCatalogUpload(file)).thenReturn("catalog.pdf");
        doThrow(new FileStoreException("disk full", null))
                .when(fileStore).store(anyString(), any(InputStream.class), anyLong());

        assertThatThrownBy(() -> uploadSessionManager.createSession("default", file, null))
                .isInstanceOf(FileStoreException.class);

        verify(uploadSessionRepository).deleteById(anyString());
        verify(lifecycleManager, never()).markParsing(anyString());
        verifyNoInteractions(asyncTaskManager);
    }

    @Test
    void statusOfUnknownSessionIsNotFound() {
        when(uploadSessionRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> uploadSessionManager.getStatus("missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void deleteRemovesRowsAndFiles() {
        String uploadId = "0f8fad5b-d9cb-469f-a165-70867728950e";
        UploadSession session = UploadSession.builder()
                                             .uploadId(uploadId)
                                             .status(UploadStatus.COMPLETED)
                                             .filePath(FileStore.uploadKey(uploadId, "catalog.pdf"))
                                             .build();
        when(uploadSessionRepository.findByIdForUpdate(uploadId)).thenReturn(Optional.of(session));
        when(stagedVariationRepository.deleteAllByUploadId(uploadId)).thenReturn(4);
        when(stagedImageRepository.deleteAllByUploadId(uploadId)).thenReturn(3);
        when(stagedProductRepository.deleteAllByUploadId(uploadId)).thenReturn(2);
        when(stagedFamilyRepository.deleteAllByUploadId(uploadId)).thenReturn(1);
        when(fileStore.delete(session.getFilePath())).thenReturn(true);
        when(catalogImageRepository.countReferencingPathPrefix(FileStore.imagePrefix(uploadId))).thenReturn(0L);
        when(fileStore.deletePrefix(FileStore.imagePrefix(uploadId))).thenReturn(3);

        SessionDeletionResult result = uploadSessionManager.deleteSession(uploadId);

        assertThat(result).isEqualTo(new SessionDeletionResult(uploadId, 1, 2, 4, 3, 4));
        verify(uploadSessionRepository).delete(session);
    }

    @Test
    void deleteKeepsImagesReferencedByProduction() {
        String uploadId = "7c9e6679-7425-40de-944b-e07fc1f90ae7";
        UploadSession session = UploadSession.builder().uploadId(uploadId).status(UploadStatus.IMPORTED).build();
        when(uploadSessionRepository.findByIdForUpdate(uploadId)).thenReturn(Optional.of(session));
        when(catalogImageRepository.countReferencingPathPrefix(FileStore.imagePrefix(uploadId))).thenReturn(5L);

        SessionDeletionResult result = uploadSessionManager.deleteSession(uploadId);

        assertThat(result.files()).isZero();
        verify(fileStore, never()).deletePrefix(anyString());
        verify(uploadSessionRepository).delete(session);
    }
}
