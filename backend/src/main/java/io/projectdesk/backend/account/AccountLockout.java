package io.projectdesk.backend.account;

import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRole;

/**
 * Blocking states applied after login. A locked-out user can still sign out and fix the cause, but
 * cannot use the rest of the application.
 */
public enum AccountLockout {
  NONE,
  /** The supervisor's own subscription is cancelled. */
  SUPERVISOR_SUBSCRIPTION_CANCELLED,
  /** The sponsor of this account stopped paying after the sponsorship was granted. */
  SPONSOR_SUBSCRIPTION_INACTIVE;

  public static AccountLockout evaluate(User user) {
    if (user.getRole() == UserRole.SUPERVISOR
        && user.getSubscriptionType() == SubscriptionType.CANCELLED) {
      return SUPERVISOR_SUBSCRIPTION_CANCELLED;
    }
    if (user.getSponsorId() != null && user.isSponsorSubscriptionInactive()) {
      return SPONSOR_SUBSCRIPTION_INACTIVE;
    }
    return NONE;
  }

  public boolean isLocked() {
    return this != NONE;
  }
}
