package io.projectdesk.backend.auth;

/** Reasons a login attempt is turned away, with the message shown to the user. */
public enum LoginRejection {
  NO_USER("No user found"),
  INVALID_PASSWORD("Invalid password"),
  EMAIL_NOT_VERIFIED("Email not verified"),
  AWAITING_SPONSORSHIP("Awaiting sponsorship approval"),
  FREE_TRIAL_ENDED("Your free trial has ended"),
  SUBSCRIPTION_CANCELLED("Subscription cancelled");

  private final String message;

  LoginRejection(String message) {
    this.message = message;
  }

  public String getMessage() {
    return message;
  }
}
