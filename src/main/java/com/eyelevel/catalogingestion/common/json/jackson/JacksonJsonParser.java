package com.eyelevel.catalogingestion.common.json.jackson;

import com.eyelevel.catalogingestion.common.json.JsonParser;
import com.eyelevel.catalogingestion.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON byte array to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON byte array", e);
        }
    }

    @Override
    public JsonNode parseTree(byte[] jsonBytes) {
        try {
            return objectMapper.readTree(jsonBytes);
        } catch (IOException e) {
            log.error("Error parsing JSON byte array to a tree", e);
            throw new JsonParsingException("Error parsing JSON byte array", e);
        }
    }

    @Override
    public <T> T convert(JsonNode node, TypeReference<T> valueType) {
        log.trace("Binding JSON tree to type: {}", valueType.getType());
        try {
            return objectMapper.treeToValue(node, objectMapper.getTypeFactory().constructType(valueType));
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error binding JSON tree to type: {}", valueType.getType(), e);
            throw new JsonParsingException("Error binding JSON tree", e);
        }
    }
}
