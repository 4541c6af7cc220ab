package io.projectdesk.backend.account;

import io.projectdesk.backend.event.SponsorRenewalRequestedEvent;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {

  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  private final UserRepository userRepository;
  private final ApplicationEventPublisher eventPublisher;

  public AccountService(UserRepository userRepository, ApplicationEventPublisher eventPublisher) {
    this.userRepository = userRepository;
    this.eventPublisher = eventPublisher;
  }

  public record Profile(User user, AccountLockout lockout) {}

  /** Reads the account fresh from storage; the lockout is never taken from the session. */
  @Transactional(readOnly = true)
  public Profile getProfile(UUID userId) {
    var user = requireUser(userId);
    return new Profile(user, AccountLockout.evaluate(user));
  }

  /** Asks the sponsor of a locked-out account to reactivate their subscription. */
  @Transactional(readOnly = true)
  public void notifySponsor(UUID userId) {
    var user = requireUser(userId);
    var sponsor =
        user.getSponsorId() != null
            ? userRepository.findById(user.getSponsorId()).orElse(null)
            : null;
    if (sponsor == null) {
      throw new InvalidStateException("No sponsor", "No sponsor found for this account");
    }
    if (!user.isSponsorSubscriptionInactive()) {
      throw new InvalidStateException(
          "Sponsor active", "Sponsor subscription is already active");
    }
    eventPublisher.publishEvent(
        new SponsorRenewalRequestedEvent(
            user.getId(), user.getName(), user.getEmail(), sponsor.getEmail(), sponsor.getName()));
    log.info("User {} asked sponsor {} to renew", userId, sponsor.getId());
  }

  private User requireUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }
}
