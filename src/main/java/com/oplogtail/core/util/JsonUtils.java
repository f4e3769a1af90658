package com.oplogtail.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Path;

public final class JsonUtils {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private JsonUtils() {}

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return MAPPER.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Failed to deserialize JSON to " + clazz.getSimpleName(), e);
    }
  }

  public static String toJson(Object obj) {
    try {
      return MAPPER.writeValueAsString(obj);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to serialize object: " + obj.getClass().getSimpleName(), e);
    }
  }

  public static <T> T readFile(Path path, Class<T> clazz) throws IOException {
    return MAPPER.readValue(path.toFile(), clazz);
  }

  public static void writeFile(Path path, Object obj) throws IOException {
    MAPPER.writeValue(path.toFile(), obj);
  }
}
