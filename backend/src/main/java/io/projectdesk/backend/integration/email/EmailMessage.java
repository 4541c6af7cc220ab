package io.projectdesk.backend.integration.email;

import java.util.Objects;

/** Provider-agnostic email payload. At least one of the two bodies must be present. */
public record EmailMessage(
    String to, String subject, String htmlBody, String plainTextBody, String replyTo) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
  }

  public static EmailMessage of(String to, RenderedEmail rendered, String replyTo) {
    return new EmailMessage(
        to, rendered.subject(), rendered.htmlBody(), rendered.plainTextBody(), replyTo);
  }
}
