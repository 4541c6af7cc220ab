package io.projectdesk.backend.webhook;

/** Thrown when the webhook signature is missing or does not match the payload. */
public class WebhookAuthenticationException extends RuntimeException {

  public WebhookAuthenticationException(String message) {
    super(message);
  }
}
