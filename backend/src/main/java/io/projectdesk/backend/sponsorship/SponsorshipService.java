package io.projectdesk.backend.sponsorship;

import io.projectdesk.backend.event.SponsorshipApprovedEvent;
import io.projectdesk.backend.event.SponsorshipDeclinedEvent;
import io.projectdesk.backend.exception.ForbiddenException;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceConflictException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.exception.SponsorLimitExceededException;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Supervisor-side sponsorship actions. Every grant locks the sponsor's row before counting its
 * sponsored accounts, so concurrent grants for the same sponsor are serialized and the limit holds.
 */
@Service
public class SponsorshipService {

  private static final Logger log = LoggerFactory.getLogger(SponsorshipService.class);

  public static final int SUPERVISOR_SPONSOR_LIMIT = 50;

  private final UserRepository userRepository;
  private final ApplicationEventPublisher eventPublisher;

  public SponsorshipService(
      UserRepository userRepository, ApplicationEventPublisher eventPublisher) {
    this.userRepository = userRepository;
    this.eventPublisher = eventPublisher;
  }

  public record SponsorshipOverview(
      List<User> sponsored,
      List<User> pendingRequests,
      long sponsoredCount,
      int sponsorLimit,
      boolean canSponsor) {}

  @Transactional(readOnly = true)
  public SponsorshipOverview getOverview(UUID sponsorId) {
    var sponsor = requireUser(sponsorId);
    var sponsored = userRepository.findBySponsorIdOrderByNameAsc(sponsorId);
    var pending = userRepository.findPendingSponsorshipRequests(sponsorId);
    return new SponsorshipOverview(
        sponsored,
        pending,
        sponsored.size(),
        SUPERVISOR_SPONSOR_LIMIT,
        sponsor.canSponsorAccounts());
  }

  /** Approves a pending request, or sponsors a student/collaborator directly. */
  @Transactional
  public User sponsor(UUID sponsorId, UUID targetId) {
    if (sponsorId.equals(targetId)) {
      throw new InvalidStateException("Invalid sponsorship", "You cannot sponsor yourself");
    }
    var sponsor = lockSponsor(sponsorId);
    requireCanSponsor(sponsor);

    var target = requireUser(targetId);
    if (!target.getRole().isSponsorable()) {
      throw new InvalidStateException(
          "Invalid sponsorship", "Only students or collaborators can be sponsored");
    }
    requireNotSponsoredElsewhere(target, sponsorId);

    boolean alreadyMine = sponsorId.equals(target.getSponsorId());
    if (!alreadyMine) {
      requireCapacity(sponsor, 1);
    }
    target.approveSponsorship(sponsorId, Instant.now());

    eventPublisher.publishEvent(
        new SponsorshipApprovedEvent(
            target.getId(), target.getEmail(), target.getName(), sponsor.getName()));
    log.info("Supervisor {} sponsored user {}", sponsorId, targetId);
    return target;
  }

  /** The sponsor drops a sponsored account, which stays locked out until sponsored again. */
  @Transactional
  public void removeSponsorship(UUID sponsorId, UUID targetId) {
    var target = requireUser(targetId);
    if (!sponsorId.equals(target.getSponsorId())) {
      throw new ForbiddenException(
          "Cannot remove sponsorship", "You are not the sponsor of this user");
    }
    target.releaseSponsorship(Instant.now());
    log.info("Supervisor {} removed sponsorship of user {}", sponsorId, targetId);
  }

  /** Declines a pending request addressed to this supervisor. */
  @Transactional
  public void declineRequest(UUID supervisorId, UUID targetId) {
    var target = requireUser(targetId);
    if (!supervisorId.equals(target.getSupervisorId()) || target.getSponsorId() != null) {
      throw ResourceNotFoundException.withDetail(
          "Request not found", "No pending sponsorship request from this user");
    }
    var supervisor = requireUser(supervisorId);
    target.releaseSponsorship(Instant.now());

    eventPublisher.publishEvent(
        new SponsorshipDeclinedEvent(
            target.getId(), target.getEmail(), target.getName(), supervisor.getName()));
    log.info("Supervisor {} declined sponsorship request from user {}", supervisorId, targetId);
  }

  // --- Shared with project membership ---

  /** Loads the sponsor with a row lock held until the surrounding transaction ends. */
  public User lockSponsor(UUID sponsorId) {
    return userRepository
        .findByIdForUpdate(sponsorId)
        .orElseThrow(() -> new ResourceNotFoundException("User", sponsorId));
  }

  public void requireCanSponsor(User sponsor) {
    if (!sponsor.canSponsorAccounts()) {
      throw new ForbiddenException(
          "Cannot sponsor accounts", "Only active subscribers can sponsor accounts");
    }
  }

  /**
   * Checks that {@code additional} new sponsorships fit under the limit. The sponsor must have been
   * loaded through {@link #lockSponsor} in the current transaction.
   */
  public void requireCapacity(User lockedSponsor, int additional) {
    long current = userRepository.countBySponsorId(lockedSponsor.getId());
    if (current + additional > SUPERVISOR_SPONSOR_LIMIT) {
      throw new SponsorLimitExceededException(SUPERVISOR_SPONSOR_LIMIT, current);
    }
  }

  public void requireNotSponsoredElsewhere(User target, UUID sponsorId) {
    if (target.getSponsorId() != null && !Objects.equals(target.getSponsorId(), sponsorId)) {
      throw new ResourceConflictException(
          "Already sponsored",
          (target.getEmail() != null ? target.getEmail() : "User")
              + " is already sponsored by another supervisor");
    }
  }

  private User requireUser(UUID id) {
    return userRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("User", id));
  }
}
