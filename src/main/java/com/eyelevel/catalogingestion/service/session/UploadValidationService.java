package com.eyelevel.catalogingestion.service.session;

import com.eyelevel.catalogingestion.config.CatalogIngestionConfig;
import com.eyelevel.catalogingestion.exception.InvalidFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

@Slf4j
@Service
@RequiredArgsConstructor
public class UploadValidationService {

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final CatalogIngestionConfig config;

    /**
     * Checks name, size, extension and the {@code %PDF} header of an uploaded catalog.
     *
     * @param file The uploaded file.
     *
     * @return The file's base name, safe to use inside a storage key.
     *
     * @throws InvalidFormatException if the upload is not an acceptable PDF.
     */
    public String validateCatalogUpload(final MultipartFile file) {
        if (file == null || file.isEmpty() || file.getSize() <= 0) {
            throw new InvalidFormatException("File is empty or has an invalid size.");
        }
        if (file.getSize() > config.getMaxFileSize()) {
            throw new InvalidFormatException(String.format("File exceeds the maximum upload size of %d bytes.",
                                                           config.getMaxFileSize()));
        }

        final String baseName = FilenameUtils.getName(file.getOriginalFilename());
        if (!StringUtils.hasText(baseName) || baseName.trim().equals(".")) {
            throw new InvalidFormatException("File has an invalid or empty name.");
        }
        if (baseName.startsWith(".")) {
            throw new InvalidFormatException("Hidden files are not accepted.");
        }

        final String extension = FilenameUtils.getExtension(baseName);
        if (!"pdf".equalsIgnoreCase(extension)) {
            throw new InvalidFormatException(
                    "File type '" + extension + "' is not supported. Only PDF catalogs are accepted.");
        }

        if (!hasPdfHeader(file)) {
            throw new InvalidFormatException("File content is not a PDF document.");
        }

        log.trace("File '{}' passed all upload checks.", baseName);
        return baseName.replaceAll("[^a-zA-Z0-9.\\-_]", "_");
    }

    private static boolean hasPdfHeader(final MultipartFile file) {
        try (InputStream in = file.getInputStream()) {
            final byte[] header = in.readNBytes(PDF_MAGIC.length);
            return Arrays.equals(header, PDF_MAGIC);
        } catch (IOException e) {
            log.warn("Could not read header of uploaded file '{}'.", file.getOriginalFilename(), e);
            return false;
        }
    }
}
