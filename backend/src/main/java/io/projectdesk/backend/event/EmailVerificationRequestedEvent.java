package io.projectdesk.backend.event;

import java.util.UUID;

public record EmailVerificationRequestedEvent(
    UUID userId, String recipientEmail, String recipientName, String token)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "email-verification";
  }
}
