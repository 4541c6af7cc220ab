package io.projectdesk.backend.webhook;

/** Thrown when the webhook body is not valid JSON. */
public class WebhookPayloadException extends RuntimeException {

  public WebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
