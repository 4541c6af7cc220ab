package io.projectdesk.backend.auth;

import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.User;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Decides whether an account may log in. Checks run in a fixed order and the first failure is
 * reported. The gate has no side effects; re-sending the verification email on {@link
 * LoginRejection#EMAIL_NOT_VERIFIED} is left to the caller.
 *
 * <p>Rejecting CANCELLED accounts at login is controlled by {@code
 * projectdesk.auth.reject-cancelled-at-login}. With it off, a cancelled supervisor can still sign
 * in and is held by the account lockout instead.
 */
@Component
public class AuthenticationGate {

  private record AccountCheck(LoginRejection rejection, BiPredicate<User, Instant> fails) {}

  private final PasswordEncoder passwordEncoder;
  private final List<AccountCheck> accountChecks;

  public AuthenticationGate(
      PasswordEncoder passwordEncoder,
      @Value("${projectdesk.auth.reject-cancelled-at-login:true}") boolean rejectCancelled) {
    this.passwordEncoder = passwordEncoder;
    this.accountChecks = buildAccountChecks(rejectCancelled);
  }

  /**
   * @param user the account matching the submitted email, or null if none does
   * @return the first failing check, or empty if the login may proceed
   */
  public Optional<LoginRejection> check(User user, String rawPassword, Instant now) {
    if (user == null) {
      return Optional.of(LoginRejection.NO_USER);
    }
    if (rawPassword == null
        || user.isInvitationPending()
        || !passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
      return Optional.of(LoginRejection.INVALID_PASSWORD);
    }
    return accountChecks.stream()
        .filter(check -> check.fails().test(user, now))
        .map(AccountCheck::rejection)
        .findFirst();
  }

  private static List<AccountCheck> buildAccountChecks(boolean rejectCancelled) {
    var emailVerified =
        new AccountCheck(LoginRejection.EMAIL_NOT_VERIFIED, (u, now) -> !u.isEmailVerified());
    var sponsorship =
        new AccountCheck(
            LoginRejection.AWAITING_SPONSORSHIP, (u, now) -> u.isAwaitingSponsorship());
    var trial =
        new AccountCheck(LoginRejection.FREE_TRIAL_ENDED, (u, now) -> u.isTrialExpired(now));
    if (!rejectCancelled) {
      return List.of(emailVerified, sponsorship, trial);
    }
    var cancelled =
        new AccountCheck(
            LoginRejection.SUBSCRIPTION_CANCELLED,
            (u, now) -> u.getSubscriptionType() == SubscriptionType.CANCELLED);
    return List.of(emailVerified, sponsorship, trial, cancelled);
  }
}
