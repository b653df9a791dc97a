package com.magsasa.runtimeintel.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import com.magsasa.runtimeintel.processor.ingest.AlertIngestionException;
import com.magsasa.runtimeintel.processor.ingest.AlertIngestor.IngestResult;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code POST /webhook}: a single alert or an Alertmanager style envelope. */
public class WebhookServlet extends JsonServlet {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookServlet.class);

  private final transient RuntimeIntelligencePipeline pipeline;

  public WebhookServlet(RuntimeIntelligencePipeline pipeline) {
    this.pipeline = pipeline;
  }

  @Override
  protected void doPost(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    if (!pipeline.isAccepting()) {
      writeError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "service is stopping");
      return;
    }
    IngestResult result;
    try {
      result = pipeline.ingestAlerts(readJson(request));
    } catch (JsonProcessingException e) {
      LOGGER.warn("Rejected alert webhook with malformed JSON: {}", e.getOriginalMessage());
      writeError(response, HttpServletResponse.SC_BAD_REQUEST, "malformed JSON");
      return;
    } catch (AlertIngestionException | InvalidRequestException e) {
      LOGGER.warn("Rejected alert webhook: {}", e.getMessage());
      writeError(response, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
      return;
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "accepted");
    body.put("accepted", result.getEvents().size());
    body.put("rejected", result.getRejections());
    writeJson(response, HttpServletResponse.SC_ACCEPTED, body);
  }
}
