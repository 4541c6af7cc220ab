package io.projectdesk.backend.admin;

import io.projectdesk.backend.auth.AuthService;
import io.projectdesk.backend.auth.EmailVerificationTokenRepository;
import io.projectdesk.backend.billing.RedirectFlowRepository;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceConflictException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.integration.billing.BillingProvider;
import io.projectdesk.backend.project.ProjectRepository;
import io.projectdesk.backend.project.ProjectUpdateRepository;
import io.projectdesk.backend.task.TaskRepository;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Administrative account management. Callers are restricted to ADMIN at the controller. */
@Service
public class AdminUserService {

  private static final Logger log = LoggerFactory.getLogger(AdminUserService.class);

  private final UserRepository userRepository;
  private final ProjectRepository projectRepository;
  private final TaskRepository taskRepository;
  private final ProjectUpdateRepository projectUpdateRepository;
  private final EmailVerificationTokenRepository tokenRepository;
  private final RedirectFlowRepository redirectFlowRepository;
  private final BillingProvider billingProvider;

  public AdminUserService(
      UserRepository userRepository,
      ProjectRepository projectRepository,
      TaskRepository taskRepository,
      ProjectUpdateRepository projectUpdateRepository,
      EmailVerificationTokenRepository tokenRepository,
      RedirectFlowRepository redirectFlowRepository,
      BillingProvider billingProvider) {
    this.userRepository = userRepository;
    this.projectRepository = projectRepository;
    this.taskRepository = taskRepository;
    this.projectUpdateRepository = projectUpdateRepository;
    this.tokenRepository = tokenRepository;
    this.redirectFlowRepository = redirectFlowRepository;
    this.billingProvider = billingProvider;
  }

  @Transactional(readOnly = true)
  public List<User> listUsers() {
    return userRepository.findAllByOrderByEmailAsc();
  }

  /** Applies whichever of role, name and email are given. At least one is required. */
  @Transactional
  public User updateUser(UUID userId, String role, String name, String email) {
    if (role == null && name == null && email == null) {
      throw new InvalidStateException("Invalid update", "No updates provided");
    }
    var user = requireUser(userId);
    var now = Instant.now();

    if (role != null) {
      user.changeRole(parseRole(role), now);
    }
    String newName = name != null && !name.isBlank() ? name.trim() : null;
    String newEmail = null;
    if (email != null) {
      newEmail = AuthService.normalizeEmail(email);
      if (!AuthService.EMAIL_PATTERN.matcher(newEmail).matches()) {
        throw new InvalidStateException("Invalid update", "A valid email is required");
      }
      if (!newEmail.equals(user.getEmail()) && userRepository.existsByEmail(newEmail)) {
        throw new ResourceConflictException(
            "Email already registered", "An account with this email already exists");
      }
    }
    if (newName != null || newEmail != null) {
      user.updateProfile(newName, newEmail, now);
    }
    log.info("Admin updated user {}", userId);
    return user;
  }

  /** Sets subscription type and expiry directly, bypassing the billing provider. */
  @Transactional
  public User overrideSubscription(UUID userId, String subscriptionType, Instant expiresAt) {
    SubscriptionType type;
    try {
      type = SubscriptionType.fromExternal(subscriptionType);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid subscription type", "Unknown subscription type: " + subscriptionType);
    }
    var user = requireUser(userId);
    user.overrideSubscription(type, expiresAt, Instant.now());
    log.info("Admin set subscription of user {} to {} (expires {})", userId, type, expiresAt);
    return user;
  }

  /**
   * Deletes an account that neither supervises projects nor sponsors anyone. Provider-side
   * billing is cancelled best-effort first; all references from projects, tasks and pending
   * sponsorship requests are removed.
   */
  @Transactional
  public void deleteUser(UUID actingAdminId, UUID userId) {
    if (actingAdminId.equals(userId)) {
      throw new InvalidStateException("Invalid deletion", "You cannot delete your own account");
    }
    var user = requireUser(userId);
    if (projectRepository.existsBySupervisorId(userId)) {
      throw new ResourceConflictException(
          "User supervises projects",
          "This user supervises active projects. Reassign or archive those projects before"
              + " deleting the account.");
    }
    if (userRepository.existsBySponsorId(userId)) {
      throw new ResourceConflictException(
          "User sponsors accounts",
          "This user sponsors other accounts. Remove their sponsorships before deleting the"
              + " account.");
    }

    cancelBillingQuietly(user);

    var now = Instant.now();
    for (var project : projectRepository.findByMember(userId)) {
      project.removeMember(userId);
    }
    for (var task : taskRepository.findByAssignee(userId)) {
      task.unassign(userId);
    }
    taskRepository.clearFlagsRaisedBy(userId);
    projectUpdateRepository.deleteByAuthorId(userId);
    for (var pending : userRepository.findPendingSponsorshipRequests(userId)) {
      pending.releaseSponsorship(now);
    }
    userRepository.clearSupervisor(userId, now);
    tokenRepository.deleteByUserId(userId);
    redirectFlowRepository.deleteByUserId(userId);
    userRepository.delete(user);
    log.info("Admin {} deleted user {}", actingAdminId, userId);
  }

  private void cancelBillingQuietly(User user) {
    if (user.getGoCardlessSubscriptionId() != null) {
      try {
        billingProvider.cancelSubscription(user.getGoCardlessSubscriptionId());
      } catch (RuntimeException e) {
        log.warn(
            "Cancelling subscription {} before deleting user {} failed: {}",
            user.getGoCardlessSubscriptionId(),
            user.getId(),
            e.getMessage());
      }
    }
    if (user.getGoCardlessMandateId() != null) {
      try {
        billingProvider.cancelMandate(user.getGoCardlessMandateId());
      } catch (RuntimeException e) {
        log.warn(
            "Cancelling mandate {} before deleting user {} failed: {}",
            user.getGoCardlessMandateId(),
            user.getId(),
            e.getMessage());
      }
    }
  }

  private User requireUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  private static UserRole parseRole(String role) {
    try {
      return UserRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid role", "Unknown role: " + role);
    }
  }
}
