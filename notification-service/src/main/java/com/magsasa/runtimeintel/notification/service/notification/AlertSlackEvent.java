package com.magsasa.runtimeintel.notification.service.notification;

import com.google.common.base.Strings;
import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.Notification;
import com.magsasa.runtimeintel.datamodel.Notification.Transition;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.ActionBlock;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.Attachment;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.Block;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.Button;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.ContextBlock;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.Element;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.HeaderBlock;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.SectionBlock;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.SlackMessage;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.Text;
import java.util.ArrayList;
import java.util.List;

public class AlertSlackEvent {

  static final String SERVICE = "Service";
  static final String SEVERITY = "Severity";
  static final String TEAM = "Team";
  static final String ENVIRONMENT = "Environment";
  static final String ROUTE = "Route";
  private static final String ENVIRONMENT_LABEL = "environment";
  private static final String NO_DESCRIPTION = "No description available";

  private AlertSlackEvent() {}

  public static SlackMessage getMessage(Notification notification) {
    AlertEvent alert = notification.getAlert();
    String title = NotificationTemplate.title(notification);
    List<Block> blocks = new ArrayList<>();
    blocks.add(new HeaderBlock(title));

    List<Text> metadataFields = new ArrayList<>();
    addIfNotEmpty(metadataFields, alert.getService(), SERVICE);
    addIfNotEmpty(metadataFields, alert.getSeverity().name(), SEVERITY);
    addIfNotEmpty(metadataFields, alert.getTeam(), TEAM);
    if (alert.getLabels() != null) {
      addIfNotEmpty(metadataFields, alert.getLabels().get(ENVIRONMENT_LABEL), ENVIRONMENT);
    }
    addIfNotEmpty(
        metadataFields,
        notification.isUnrouted() ? "unrouted (default channel)" : notification.getRouteName(),
        ROUTE);
    blocks.add(SectionBlock.builder().fields(metadataFields).build());

    String description =
        Strings.isNullOrEmpty(alert.getDescription()) ? NO_DESCRIPTION : alert.getDescription();
    blocks.add(
        SectionBlock.builder()
            .blockId("summary")
            .text(Text.markdown("*" + alert.getSummary() + "*\n" + description))
            .build());

    String values = NotificationTemplate.valueLine(alert);
    if (values != null) {
      blocks.add(SectionBlock.builder().text(Text.markdown(values)).build());
    }

    List<Element> actions = new ArrayList<>();
    String runbook = NotificationTemplate.link(notification, Notification.LINK_RUNBOOK);
    if (runbook != null) {
      actions.add(
          Button.builder()
              .actionId(Notification.LINK_RUNBOOK)
              .text(Text.plain("Runbook"))
              .url(runbook)
              .style(Button.PRIMARY_STYLE)
              .build());
    }
    String dashboard = NotificationTemplate.link(notification, Notification.LINK_DASHBOARD);
    if (dashboard != null) {
      actions.add(Button.link(Notification.LINK_DASHBOARD, "Dashboard", dashboard));
    }
    if (!actions.isEmpty()) {
      blocks.add(ActionBlock.builder().elements(actions).build());
    }

    List<Element> footer = new ArrayList<>();
    footer.add(Text.markdown(footerText(notification)));
    String occurrences = NotificationTemplate.occurrenceLine(notification);
    if (occurrences != null) {
      footer.add(Text.markdown(occurrences));
    }
    blocks.add(new ContextBlock(footer));

    return new SlackMessage(title, List.of(new Attachment(color(notification), blocks)));
  }

  private static String footerText(Notification notification) {
    AlertEvent alert = notification.getAlert();
    if (notification.getTransition() == Transition.RESOLVED) {
      return "Resolved at " + NotificationTemplate.formatTime(alert.getResolvedAt());
    }
    return "Triggered at " + NotificationTemplate.formatTime(alert.getStartedAt());
  }

  static String color(Notification notification) {
    if (notification.getTransition() == Transition.RESOLVED) {
      return Attachment.GREEN;
    }
    switch (notification.getAlert().getSeverity()) {
      case CRITICAL:
        return Attachment.RED;
      case WARNING:
        return Attachment.AMBER;
      default:
        return Attachment.BLUE;
    }
  }

  private static void addIfNotEmpty(List<Text> metadataFields, String value, String type) {
    if (!Strings.isNullOrEmpty(value)) {
      metadataFields.add(Text.markdown("*" + type + ":*\n" + value));
    }
  }
}
