package com.magsasa.runtimeintel.engine.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.magsasa.runtimeintel.notification.transport.webhook.ObjectMapperProvider;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/** Reads request bodies as JSON and writes JSON responses. */
abstract class JsonServlet extends HttpServlet {
  static final String CONTENT_TYPE = "application/json";

  static JsonNode readJson(HttpServletRequest request) throws IOException {
    try (InputStream body = request.getInputStream()) {
      JsonNode node = ObjectMapperProvider.get().readTree(body);
      if (node == null || node.isMissingNode()) {
        throw new InvalidRequestException("request body is empty");
      }
      return node;
    }
  }

  static void writeJson(HttpServletResponse response, int status, Object body)
      throws IOException {
    response.setStatus(status);
    response.setContentType(CONTENT_TYPE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    ObjectMapperProvider.get().writeValue(response.getOutputStream(), body);
  }

  static void writeError(HttpServletResponse response, int status, String message)
      throws IOException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("message", message);
    writeJson(response, status, body);
  }

  static class InvalidRequestException extends RuntimeException {
    InvalidRequestException(String message) {
      super(message);
    }
  }
}
