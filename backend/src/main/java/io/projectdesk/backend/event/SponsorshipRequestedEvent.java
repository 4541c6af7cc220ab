package io.projectdesk.backend.event;

import java.util.UUID;

/** A student or collaborator named this supervisor as sponsor when signing up. */
public record SponsorshipRequestedEvent(
    UUID requesterId,
    String requesterName,
    String requesterEmail,
    String requesterRole,
    String recipientEmail,
    String recipientName)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "sponsorship-requested";
  }
}
