package io.projectdesk.backend.event;

/** A visitor used the public contact form; the mail goes to the support inbox. */
public record ContactRequestSubmittedEvent(
    String reference,
    String contactType,
    String senderName,
    String senderEmail,
    String description,
    String recipientEmail)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "contact-request";
  }

  @Override
  public String replyTo() {
    return senderEmail;
  }

  @Override
  public String rateLimitKey() {
    return senderEmail;
  }
}
