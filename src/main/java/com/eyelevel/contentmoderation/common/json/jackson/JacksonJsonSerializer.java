package com.eyelevel.contentmoderation.common.json.jackson;


import com.eyelevel.contentmoderation.common.json.JsonSerializer;
import com.eyelevel.contentmoderation.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link JsonSerializer} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object, boolean prettyPrint) {
        log.debug("Serializing {} to JSON (prettyPrint: {})", object == null ? "null" : object.getClass().getName(),
                  prettyPrint);
        try {
            String json = prettyPrint
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(object)
                    : objectMapper.writeValueAsString(object);
            log.trace("Serialized JSON: {}", json);
            return json;
        } catch (JsonProcessingException e) {
            log.error("Error serializing Java object to JSON", e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
