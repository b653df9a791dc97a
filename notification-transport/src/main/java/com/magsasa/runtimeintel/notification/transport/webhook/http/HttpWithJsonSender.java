package com.magsasa.runtimeintel.notification.transport.webhook.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends JSON strings to a URL and hands back the status and body. Stateless apart from the
 * shared OkHttp client, so one instance serves every channel.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  static final String POST = "POST";
  static final String PATCH = "PATCH";
  private static final HttpWithJsonSender INSTANCE = new HttpWithJsonSender(new OkHttpClient());

  private final OkHttpClient client;

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public static HttpWithJsonSender getInstance() {
    return INSTANCE;
  }

  public static HttpWithJsonSender withTimeouts(Duration connectTimeout, Duration readTimeout) {
    return new HttpWithJsonSender(
        INSTANCE.client.newBuilder()
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .build());
  }

  public JsonResponse post(String url, String jsonString, Map<String, String> headers)
      throws IOException {
    return execute(POST, url, jsonString, headers);
  }

  public JsonResponse patch(String url, String jsonString, Map<String, String> headers)
      throws IOException {
    return execute(PATCH, url, jsonString, headers);
  }

  private JsonResponse execute(
      String method, String url, String jsonString, Map<String, String> headers)
      throws IOException {
    LOGGER.debug("Sending {} {} with body: {}", method, url, jsonString);
    Request.Builder requestBuilder =
        new Request.Builder().url(url).method(method, RequestBody.create(jsonString, JSON));
    headers.forEach(requestBuilder::header);
    try (Response response = client.newCall(requestBuilder.build()).execute()) {
      ResponseBody body = response.body();
      return new JsonResponse(
          response.code(), response.message(), body == null ? "" : body.string());
    }
  }

  public static class JsonResponse {
    private final int code;
    private final String message;
    private final String body;

    public JsonResponse(int code, String message, String body) {
      this.code = code;
      this.message = message;
      this.body = body;
    }

    public int getCode() {
      return code;
    }

    public String getMessage() {
      return message;
    }

    public String getBody() {
      return body;
    }

    public boolean isSuccessful() {
      return code >= 200 && code < 300;
    }
  }
}
