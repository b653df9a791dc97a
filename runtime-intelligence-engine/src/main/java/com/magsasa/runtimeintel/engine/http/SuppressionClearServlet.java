package com.magsasa.runtimeintel.engine.http;

import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code POST /suppression/clear}: operator reset of the suppression table. */
public class SuppressionClearServlet extends JsonServlet {
  private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionClearServlet.class);

  private final transient RuntimeIntelligencePipeline pipeline;

  public SuppressionClearServlet(RuntimeIntelligencePipeline pipeline) {
    this.pipeline = pipeline;
  }

  @Override
  protected void doPost(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    int cleared = pipeline.clearSuppression();
    LOGGER.info("Suppression table cleared by {}", request.getRemoteAddr());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "cleared");
    body.put("cleared", cleared);
    writeJson(response, HttpServletResponse.SC_OK, body);
  }
}
