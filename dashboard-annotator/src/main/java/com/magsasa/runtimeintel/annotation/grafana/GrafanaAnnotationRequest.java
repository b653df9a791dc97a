package com.magsasa.runtimeintel.annotation.grafana;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.magsasa.runtimeintel.annotation.Annotation;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Body of {@code POST /api/annotations} and {@code PATCH /api/annotations/{id}}. */
@Getter
@Builder
public class GrafanaAnnotationRequest {
  @JsonProperty("dashboardUID")
  private final String dashboardUid;

  private final Long dashboardId;
  private final Long panelId;
  private final Long time;
  private final Long timeEnd;
  private final String text;
  private final List<String> tags;

  static GrafanaAnnotationRequest create(Annotation annotation) {
    return GrafanaAnnotationRequest.builder()
        .dashboardUid(annotation.getDashboardUid())
        .dashboardId(annotation.getDashboardId())
        .panelId(annotation.getPanelId())
        .time(annotation.getStartTime().toEpochMilli())
        .timeEnd(annotation.getEndTime() == null ? null : annotation.getEndTime().toEpochMilli())
        .text(annotation.getText())
        .tags(annotation.getTags())
        .build();
  }

  static GrafanaAnnotationRequest close(Annotation annotation) {
    return GrafanaAnnotationRequest.builder()
        .time(annotation.getStartTime().toEpochMilli())
        .timeEnd(annotation.getEndTime().toEpochMilli())
        .tags(annotation.getTags())
        .build();
  }
}
