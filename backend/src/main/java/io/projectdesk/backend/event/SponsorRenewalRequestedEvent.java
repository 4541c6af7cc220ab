package io.projectdesk.backend.event;

import java.util.UUID;

/** A sponsored user asks their sponsor to reactivate the lapsed subscription. */
public record SponsorRenewalRequestedEvent(
    UUID requesterId,
    String requesterName,
    String requesterEmail,
    String recipientEmail,
    String recipientName)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "sponsor-renewal-requested";
  }
}
