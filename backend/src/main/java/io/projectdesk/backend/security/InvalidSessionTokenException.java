package io.projectdesk.backend.security;

/** Thrown when a session token fails signature, expiry or claim checks. */
public class InvalidSessionTokenException extends RuntimeException {

  public InvalidSessionTokenException(String message) {
    super(message);
  }

  public InvalidSessionTokenException(String message, Throwable cause) {
    super(message, cause);
  }
}
