package io.projectdesk.backend.event;

/** Tells the reporter their ticket was logged under {@code reference}. */
public record SupportTicketConfirmationEvent(
    String reference, String title, String recipientName, String recipientEmail)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "support-ticket-confirmation";
  }
}
