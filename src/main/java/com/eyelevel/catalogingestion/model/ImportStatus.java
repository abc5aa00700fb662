package com.eyelevel.catalogingestion.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Review outcome of a staged row. {@code SKIPPED} rows are left out of the production import.
 */
@Getter
@AllArgsConstructor
public enum ImportStatus {
    PENDING("pending"),
    APPROVED("approved"),
    IMPORTED("imported"),
    SKIPPED("skipped");

    private static final Map<String, ImportStatus> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(ImportStatus::getValue, Function.identity()));

    @JsonValue
    private final String value;

    @JsonCreator
    public static ImportStatus convertByValue(String value) {
        ImportStatus status = VALUE_MAP.get(value);
        if (status == null) {
            throw new IllegalArgumentException("Unknown import status: " + value);
        }
        return status;
    }
}
