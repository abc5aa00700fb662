package com.eyelevel.catalogingestion.service.session;

import com.eyelevel.catalogingestion.config.CatalogIngestionConfig;
import com.eyelevel.catalogingestion.exception.InvalidFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadValidationServiceTest {

    private static final byte[] PDF_BYTES = "%PDF-1.7\n%minimal".getBytes(StandardCharsets.US_ASCII);

    private UploadValidationService validationService;

    @BeforeEach
    void setUp() {
        CatalogIngestionConfig config = new CatalogIngestionConfig();
        config.setMaxFileSize(1024);
        validationService = new UploadValidationService(config);
    }

    @Test
    void acceptsPdfAndSanitizesName() {
        MockMultipartFile file = new MockMultipartFile("file", "../Spring Catalog (2025).pdf", "application/pdf",
                                                       PDF_BYTES);

        assertThat(validationService.validateCatalogUpload(file)).isEqualTo("Spring_Catalog__2025_.pdf");
    }

    @Test
    void rejectsEmptyFile() {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.pdf", "application/pdf", new byte[0]);

        assertThatThrownBy(() -> validationService.validateCatalogUpload(file))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void rejectsOversizedFile() {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.pdf", "application/pdf", new byte[2048]);

        assertThatThrownBy(() -> validationService.validateCatalogUpload(file))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessageContaining("maximum upload size");
    }

    @Test
    void rejectsWrongExtension() {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.docx", "application/pdf", PDF_BYTES);

        assertThatThrownBy(() -> validationService.validateCatalogUpload(file))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessageContaining("'docx'");
    }

    @Test
    void rejectsPdfExtensionWithoutPdfHeader() {
        MockMultipartFile file = new MockMultipartFile("file", "catalog.pdf", "application/pdf",
                                                       "PK\u0003\u0004zip".getBytes(StandardCharsets.ISO_8859_1));

        assertThatThrownBy(() -> validationService.validateCatalogUpload(file))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessage("File content is not a PDF document.");
    }

    @Test
    void rejectsHiddenFile() {
        MockMultipartFile file = new MockMultipartFile("file", ".catalog.pdf", "application/pdf", PDF_BYTES);

        assertThatThrownBy(() -> validationService.validateCatalogUpload(file))
                .isInstanceOf(InvalidFormatException.class);
    }
}
