package com.magsasa.runtimeintel.engine.http;

import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import java.io.IOException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

public class HealthServlet extends JsonServlet {
  private final transient RuntimeIntelligencePipeline pipeline;

  public HealthServlet(RuntimeIntelligencePipeline pipeline) {
    this.pipeline = pipeline;
  }

  @Override
  protected void doGet(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    writeJson(
        response,
        pipeline.isAccepting()
            ? HttpServletResponse.SC_OK
            : HttpServletResponse.SC_SERVICE_UNAVAILABLE,
        pipeline.health());
  }
}
