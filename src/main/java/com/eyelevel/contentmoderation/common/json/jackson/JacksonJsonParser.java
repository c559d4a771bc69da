package com.eyelevel.contentmoderation.common.json.jackson;


import com.eyelevel.contentmoderation.common.json.JsonParser;
import com.eyelevel.contentmoderation.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        return parseJson(jsonBytes, objectMapper.constructType(valueType));
    }

    private <T> T parseJson(byte[] jsonBytes, JavaType javaType) {
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Cannot parse empty JSON payload into " + javaType);
        }
        try {
            T result = objectMapper.readValue(jsonBytes, javaType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON into {}", javaType, e);
            throw new JsonParsingException("Error parsing JSON into " + javaType, e);
        }
    }
}
