package com.eyelevel.catalogingestion.common.json;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    /**
     * Serializes a Java object into its JSON representation.
     *
     * @throws com.eyelevel.catalogingestion.exception.json.JsonParsingException if an error occurs
     *                                                                           during serialization.
     */
    <T> String serialize(T object);
}
