package com.magsasa.runtimeintel.notification.transport.webhook;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;

  private ObjectMapperProvider() {}

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          objectMapper =
              new ObjectMapper()
                  .setSerializationInclusion(Include.NON_NULL)
                  .registerModule(new JavaTimeModule())
                  .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }
      }
    }
    return objectMapper;
  }
}
