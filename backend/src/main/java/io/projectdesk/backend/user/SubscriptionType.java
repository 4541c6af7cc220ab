package io.projectdesk.backend.user;

import java.util.Locale;

/** Billing state of an account. Drives the authentication gate and the sponsoring rules. */
public enum SubscriptionType {
  FREE_TRIAL,
  SUBSCRIBED,
  SPONSORED,
  CANCELLED,
  ADMIN_APPROVED;

  /** Only paying and admin-approved accounts may sponsor other users. */
  public boolean canSponsorAccounts() {
    return this == SUBSCRIBED || this == ADMIN_APPROVED;
  }

  /**
   * Parses a subscription type supplied from outside the domain (admin input, legacy records).
   * Matching ignores case and treats hyphens and spaces as underscores.
   *
   * @throws IllegalArgumentException if the value names no known type
   */
  public static SubscriptionType fromExternal(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Subscription type is required");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    return SubscriptionType.valueOf(normalized);
  }
}
