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
 * Display roles of a product image. One image may hold any combination of roles.
 */
@Getter
@AllArgsConstructor
public enum ImageRole {
    PRIMARY("primary"),
    HOVER("hover"),
    GALLERY("gallery");

    private static final Map<String, ImageRole> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(ImageRole::getValue, Function.identity()));

    @JsonValue
    private final String value;

    @JsonCreator
    public static ImageRole convertByValue(String value) {
        ImageRole role = VALUE_MAP.get(value);
        if (role == null) {
            throw new IllegalArgumentException("Unknown image role: " + value);
        }
        return role;
    }
}
