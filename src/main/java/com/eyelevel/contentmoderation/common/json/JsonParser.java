package com.eyelevel.contentmoderation.common.json;

/**
 * Defines the contract for parsing JSON data into Java objects.
 *
 * <p>Implementations hide the JSON library in use, so API clients and the queue worker do not
 * depend on Jackson directly.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @param jsonBytes The JSON data as a byte array.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.contentmoderation.exception.json.JsonParsingException if the data cannot be parsed.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
