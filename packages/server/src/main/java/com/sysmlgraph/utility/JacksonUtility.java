package com.sysmlgraph.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sysmlgraph.exception.SerializationException;

/**
 * Shared Jackson mappers.
 *
 * <p>The JSON mapper writes compact output: it produces the text stored inside flat graph
 * properties, where indentation would only waste space.
 */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          // Stored blobs may carry fields written by newer clients
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static JavaType typeOf(Class<?> type) {
    return JSON_MAPPER.getTypeFactory().constructType(type);
  }

  public static JavaType typeOf(TypeReference<?> type) {
    return JSON_MAPPER.getTypeFactory().constructType(type);
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static <T> T fromJson(String json, JavaType type) {
    try {
      return JSON_MAPPER.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to parse JSON as " + type.toCanonical(), e);
    }
  }

  public static <T> T fromJson(String json, Class<T> type) {
    return fromJson(json, typeOf(type));
  }
}
