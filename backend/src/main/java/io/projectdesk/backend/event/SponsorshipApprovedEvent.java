package io.projectdesk.backend.event;

import java.util.UUID;

public record SponsorshipApprovedEvent(
    UUID userId, String recipientEmail, String recipientName, String sponsorName)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "sponsorship-approved";
  }
}
