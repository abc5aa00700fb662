package com.eyelevel.catalogingestion.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lifecycle states of an {@link UploadSession}.
 * <p>
 * {@code uploading -> parsing -> (completed | failed)}, then {@code completed -> imported} through the
 * production importer, or {@code completed | failed -> expired} through the cleanup service.
 */
@Getter
@AllArgsConstructor
public enum UploadStatus {
    UPLOADING("uploading"),
    PARSING("parsing"),
    COMPLETED("completed"),
    FAILED("failed"),
    IMPORTED("imported"),
    EXPIRED("expired");

    /**
     * States in which the parse worker still owns the session.
     */
    public static final Set<UploadStatus> IN_FLIGHT = EnumSet.of(UPLOADING, PARSING);

    /**
     * States after which neither the session nor its staged rows may change.
     */
    public static final Set<UploadStatus> FROZEN = EnumSet.of(IMPORTED, EXPIRED);

    private static final Map<String, UploadStatus> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(UploadStatus::getValue, Function.identity()));

    @JsonValue
    private final String value;

    /**
     * Resolves the wire value of a status.
     *
     * @param value The lower-case status string.
     *
     * @return The matching status.
     *
     * @throws IllegalArgumentException if the value is unknown.
     */
    @JsonCreator
    public static UploadStatus convertByValue(String value) {
        UploadStatus status = VALUE_MAP.get(value);
        if (status == null) {
            throw new IllegalArgumentException("Unknown upload status: " + value);
        }
        return status;
    }

    public boolean isFrozen() {
        return FROZEN.contains(this);
    }
}
