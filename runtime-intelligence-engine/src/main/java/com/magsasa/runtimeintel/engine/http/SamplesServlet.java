package com.magsasa.runtimeintel.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.magsasa.runtimeintel.detector.MetricSampleParser.ParsedSamples;
import com.magsasa.runtimeintel.detector.SampleIngestionException;
import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code POST /samples}: pushed metric samples. */
public class SamplesServlet extends JsonServlet {
  private static final Logger LOGGER = LoggerFactory.getLogger(SamplesServlet.class);

  private final transient RuntimeIntelligencePipeline pipeline;

  public SamplesServlet(RuntimeIntelligencePipeline pipeline) {
    this.pipeline = pipeline;
  }

  @Override
  protected void doPost(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    if (!pipeline.isAccepting()) {
      writeError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "service is stopping");
      return;
    }
    ParsedSamples parsed;
    try {
      parsed = pipeline.ingestSamples(readJson(request));
    } catch (JsonProcessingException e) {
      LOGGER.warn("Rejected samples with malformed JSON: {}", e.getOriginalMessage());
      writeError(response, HttpServletResponse.SC_BAD_REQUEST, "malformed JSON");
      return;
    } catch (SampleIngestionException | InvalidRequestException e) {
      LOGGER.warn("Rejected samples: {}", e.getMessage());
      writeError(response, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
      return;
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "accepted");
    body.put("accepted", parsed.getSamples().size());
    body.put("rejected", parsed.getRejections());
    writeJson(response, HttpServletResponse.SC_ACCEPTED, body);
  }
}
