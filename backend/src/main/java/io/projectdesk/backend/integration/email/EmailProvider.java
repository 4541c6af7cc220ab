package io.projectdesk.backend.integration.email;

/** Port for sending emails via an external provider. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  SendResult sendEmail(EmailMessage message);
}
