package io.projectdesk.backend.event;

/** A signed-in user raised a support ticket; the mail goes to the support inbox. */
public record SupportTicketSubmittedEvent(
    String reference,
    String title,
    String description,
    String reporterName,
    String reporterEmail,
    String recipientEmail)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "support-ticket";
  }

  @Override
  public String replyTo() {
    return reporterEmail;
  }

  @Override
  public String rateLimitKey() {
    return reporterEmail;
  }
}
