package io.projectdesk.backend.webhook;

/** Thrown when no webhook secret is configured, so no delivery can be trusted. */
public class WebhookNotConfiguredException extends RuntimeException {

  public WebhookNotConfiguredException(String message) {
    super(message);
  }
}
