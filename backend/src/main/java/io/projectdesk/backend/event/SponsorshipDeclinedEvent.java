package io.projectdesk.backend.event;

import java.util.UUID;

public record SponsorshipDeclinedEvent(
    UUID userId, String recipientEmail, String recipientName, String supervisorName)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "sponsorship-declined";
  }
}
