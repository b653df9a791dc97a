package com.magsasa.runtimeintel.engine.http;

import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Embedded Jetty serving the ingestion and operational endpoints. */
public class HttpServer {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpServer.class);

  static final String WEBHOOK_PATH = "/webhook";
  static final String SAMPLES_PATH = "/samples";
  static final String HEALTH_PATH = "/health";
  static final String STATS_PATH = "/stats";
  static final String SUPPRESSION_CLEAR_PATH = "/suppression/clear";

  private final Server server;
  private final ServerConnector connector;

  public HttpServer(String host, int port, RuntimeIntelligencePipeline pipeline) {
    this.server = new Server();
    this.connector = new ServerConnector(server);
    connector.setHost(host);
    connector.setPort(port);
    server.setConnectors(new Connector[] {connector});

    ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
    context.setContextPath("/");
    context.addServlet(new ServletHolder(new WebhookServlet(pipeline)), WEBHOOK_PATH);
    context.addServlet(new ServletHolder(new SamplesServlet(pipeline)), SAMPLES_PATH);
    context.addServlet(new ServletHolder(new HealthServlet(pipeline)), HEALTH_PATH);
    context.addServlet(new ServletHolder(new StatsServlet(pipeline)), STATS_PATH);
    context.addServlet(
        new ServletHolder(new SuppressionClearServlet(pipeline)), SUPPRESSION_CLEAR_PATH);
    server.setHandler(context);
    server.setStopAtShutdown(false);
  }

  public void start() throws Exception {
    server.start();
    LOGGER.info("Listening on {}:{}", connector.getHost(), getPort());
  }

  /** Actual bound port, useful when started on port 0. */
  public int getPort() {
    return connector.getLocalPort();
  }

  public void stop() throws Exception {
    server.stop();
    LOGGER.info("HTTP server stopped");
  }
}
