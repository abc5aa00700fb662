package com.eyelevel.catalogingestion.common.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Defines the contract for parsing JSON data into Java objects.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @throws com.eyelevel.catalogingestion.exception.json.JsonParsingException if the data cannot be
     *                                                                           parsed.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses JSON data into a tree, for callers that only need part of a document.
     *
     * @throws com.eyelevel.catalogingestion.exception.json.JsonParsingException if the data cannot be
     *                                                                           parsed.
     */
    JsonNode parseTree(byte[] jsonBytes);

    /**
     * Binds an already parsed subtree to a generic type such as {@code List<Foo>}.
     *
     * @throws com.eyelevel.catalogingestion.exception.json.JsonParsingException if the subtree does not
     *                                                                           match the type.
     */
    <T> T convert(JsonNode node, TypeReference<T> valueType);
}
