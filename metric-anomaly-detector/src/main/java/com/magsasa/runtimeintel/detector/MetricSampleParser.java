package com.magsasa.runtimeintel.detector;

import com.fasterxml.jackson.databind.JsonNode;
import com.magsasa.runtimeintel.datamodel.MetricSample;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses metric feed documents: a single {@code {metric, labels, timestamp, value}} object or an
 * array of them. Timestamps are epoch seconds with a millisecond fraction, ISO-8601 strings are
 * accepted as well.
 */
public class MetricSampleParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(MetricSampleParser.class);
  private static final String METRIC = "metric";
  private static final String METRIC_ID = "metric_id";
  private static final String LABELS = "labels";
  private static final String TIMESTAMP = "timestamp";
  private static final String VALUE = "value";

  /** Parses every element, collecting the reason for each rejected one. */
  public ParsedSamples parse(JsonNode document) {
    List<MetricSample> samples = new ArrayList<>();
    List<String> rejections = new ArrayList<>();
    Iterable<JsonNode> elements =
        document.isArray() ? document : Collections.singletonList(document);
    for (JsonNode element : elements) {
      try {
        samples.add(parseSample(element));
      } catch (SampleIngestionException e) {
        LOGGER.warn("Rejected metric sample {}: {}", element, e.getMessage());
        rejections.add(e.getMessage());
      }
    }
    return new ParsedSamples(samples, rejections);
  }

  public MetricSample parseSample(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new SampleIngestionException("sample must be a JSON object");
    }
    JsonNode metricNode = node.has(METRIC) ? node.get(METRIC) : node.get(METRIC_ID);
    if (metricNode == null || !metricNode.isTextual() || metricNode.asText().isEmpty()) {
      throw new SampleIngestionException("missing metric");
    }
    JsonNode valueNode = node.get(VALUE);
    if (valueNode == null || !(valueNode.isNumber() || valueNode.isTextual())) {
      throw new SampleIngestionException("missing value for " + metricNode.asText());
    }
    double value = parseValue(valueNode);
    if (!Double.isFinite(value)) {
      throw new SampleIngestionException("non finite value for " + metricNode.asText());
    }
    return MetricSample.builder()
        .metricId(metricNode.asText())
        .labels(parseLabels(node.get(LABELS)))
        .timestamp(parseTimestamp(node.get(TIMESTAMP), metricNode.asText()))
        .value(value)
        .build();
  }

  private static double parseValue(JsonNode valueNode) {
    if (valueNode.isNumber()) {
      return valueNode.asDouble();
    }
    try {
      return Double.parseDouble(valueNode.asText());
    } catch (NumberFormatException e) {
      throw new SampleIngestionException("unparseable value " + valueNode.asText());
    }
  }

  private static Map<String, String> parseLabels(JsonNode labelsNode) {
    Map<String, String> labels = new LinkedHashMap<>();
    if (labelsNode == null || labelsNode.isNull()) {
      return labels;
    }
    if (!labelsNode.isObject()) {
      throw new SampleIngestionException("labels must be an object");
    }
    Iterator<Map.Entry<String, JsonNode>> fields = labelsNode.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      labels.put(field.getKey(), field.getValue().asText());
    }
    return labels;
  }

  private static Instant parseTimestamp(JsonNode timestampNode, String metric) {
    if (timestampNode == null || timestampNode.isNull()) {
      throw new SampleIngestionException("missing timestamp for " + metric);
    }
    if (timestampNode.isNumber()) {
      return MetricSample.fromEpochSeconds(timestampNode.asDouble());
    }
    String text = timestampNode.asText();
    try {
      return MetricSample.fromEpochSeconds(Double.parseDouble(text));
    } catch (NumberFormatException e) {
      try {
        return Instant.parse(text);
      } catch (DateTimeParseException dateTimeParseException) {
        throw new SampleIngestionException("unparseable timestamp " + text + " for " + metric);
      }
    }
  }

  @Getter
  public static class ParsedSamples {
    private final List<MetricSample> samples;
    private final List<String> rejections;

    ParsedSamples(List<MetricSample> samples, List<String> rejections) {
      this.samples = samples;
      this.rejections = rejections;
    }
  }
}
