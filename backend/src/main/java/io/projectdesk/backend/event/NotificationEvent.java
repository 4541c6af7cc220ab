package io.projectdesk.backend.event;

/**
 * Events that end in an email to one recipient. Account and project events are published inside
 * the transaction that makes the change and delivered only after it commits. Implementations are
 * records of plain values, never entities, so they stay valid once the persistence context is
 * closed.
 */
public sealed interface NotificationEvent
    permits EmailVerificationRequestedEvent,
        SponsorshipRequestedEvent,
        SponsorshipApprovedEvent,
        SponsorshipDeclinedEvent,
        ProjectInvitationEvent,
        ProjectUpdatePostedEvent,
        SponsorRenewalRequestedEvent,
        SupportTicketSubmittedEvent,
        SupportTicketConfirmationEvent,
        ContactRequestSubmittedEvent {

  String recipientEmail();

  /** Template under {@code templates/email/}. */
  String templateName();

  /** Address replies should go to, or null for the sender address. */
  default String replyTo() {
    return null;
  }

  /**
   * Address the hourly email limit is counted against. Mail bound for the shared support inbox is
   * counted against the person who caused it.
   */
  default String rateLimitKey() {
    return recipientEmail();
  }
}
