package io.projectdesk.backend.auth;

import io.projectdesk.backend.event.SponsorshipRequestedEvent;
import io.projectdesk.backend.exception.AuthenticationFailedException;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceConflictException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.security.SessionClaims;
import io.projectdesk.backend.security.SessionTokenService;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  public static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
  static final int MIN_PASSWORD_LENGTH = 8;

  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;
  private final AuthenticationGate authenticationGate;
  private final EmailVerificationService emailVerificationService;
  private final SessionTokenService sessionTokenService;
  private final ApplicationEventPublisher eventPublisher;

  public AuthService(
      UserRepository userRepository,
      PasswordEncoder passwordEncoder,
      AuthenticationGate authenticationGate,
      EmailVerificationService emailVerificationService,
      SessionTokenService sessionTokenService,
      ApplicationEventPublisher eventPublisher) {
    this.userRepository = userRepository;
    this.passwordEncoder = passwordEncoder;
    this.authenticationGate = authenticationGate;
    this.emailVerificationService = emailVerificationService;
    this.sessionTokenService = sessionTokenService;
    this.eventPublisher = eventPublisher;
  }

  public record SignupCommand(
      String name, String email, String password, String accountType, String sponsorEmail) {}

  public record LoginResult(String token, Instant tokenExpiresAt, SessionClaims session) {}

  /**
   * Registers a new account. Supervisors start a free trial; students and collaborators wait for
   * the supervisor named by {@code sponsorEmail} to approve them. An email that was invited to a
   * project claims the invited account instead.
   */
  @Transactional
  public User signup(SignupCommand command) {
    String name = command.name() != null ? command.name().trim() : "";
    String email = normalizeEmail(command.email());
    String sponsorEmail = normalizeEmail(command.sponsorEmail());

    if (name.isEmpty()) {
      throw new InvalidStateException("Invalid signup", "Name is required");
    }
    if (email.isEmpty() || !EMAIL_PATTERN.matcher(email).matches()) {
      throw new InvalidStateException("Invalid signup", "A valid email is required");
    }
    if (command.password() == null || command.password().length() < MIN_PASSWORD_LENGTH) {
      throw new InvalidStateException(
          "Invalid signup", "Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
    }

    Instant now = Instant.now();
    var existing = userRepository.findByEmail(email).orElse(null);
    if (existing != null) {
      if (!existing.isInvitationPending()) {
        throw new ResourceConflictException(
            "Email already registered", "An account with this email already exists");
      }
      return claimInvitation(existing, name, command.password(), now);
    }

    UserRole role = parseAccountType(command.accountType());
    if (role.isSponsorable() && sponsorEmail.isEmpty()) {
      throw new InvalidStateException(
          "Invalid signup", "Please provide the email address of your supervisor");
    }

    String passwordHash = passwordEncoder.encode(command.password());
    User user;
    if (role == UserRole.SUPERVISOR) {
      user = userRepository.save(User.supervisor(name, email, passwordHash, now));
    } else {
      var supervisor =
          userRepository
              .findByEmail(sponsorEmail)
              .filter(candidate -> candidate.getRole().canSupervise())
              .orElseThrow(
                  () ->
                      ResourceNotFoundException.withDetail(
                          "Supervisor not found",
                          "We couldn't find a supervisor with that email address"));
      user =
          userRepository.save(
              User.awaitingSponsorship(name, email, passwordHash, role, supervisor.getId(), now));
      eventPublisher.publishEvent(
          new SponsorshipRequestedEvent(
              user.getId(),
              user.getName(),
              user.getEmail(),
              role.name(),
              supervisor.getEmail(),
              supervisor.getName()));
    }

    emailVerificationService.issueToken(user);
    log.info(
        "Registered {} account {} with subscription {}",
        user.getRole(),
        user.getId(),
        user.getSubscriptionType());
    return user;
  }

  /**
   * An invited account keeps its role and sponsorship; signing up only sets the name and password
   * and sends a fresh verification email.
   */
  private User claimInvitation(User invited, String name, String rawPassword, Instant now) {
    invited.claimInvitation(name, passwordEncoder.encode(rawPassword), now);
    emailVerificationService.issueToken(invited);
    log.info("Invited account {} claimed as {}", invited.getId(), invited.getRole());
    return invited;
  }

  /**
   * Runs the authentication gate and issues a session token. Deliberately not transactional: an
   * unverified account gets a fresh verification token committed before the attempt is rejected.
   *
   * @throws AuthenticationFailedException with the rejection reason
   */
  public LoginResult login(String email, String password) {
    var user = userRepository.findByEmail(normalizeEmail(email)).orElse(null);
    var rejection = authenticationGate.check(user, password, Instant.now());
    if (rejection.isPresent()) {
      if (rejection.get() == LoginRejection.EMAIL_NOT_VERIFIED) {
        emailVerificationService.issueToken(user);
      }
      throw new AuthenticationFailedException(rejection.get().getMessage());
    }

    var session =
        new SessionClaims(
            user.getId(),
            user.getEmail(),
            user.getRole(),
            user.getSubscriptionType(),
            user.getSubscriptionStartedAt(),
            user.getSubscriptionExpiresAt(),
            user.getSponsorId());
    var issued = sessionTokenService.issueToken(session);
    log.info("User {} logged in", user.getId());
    return new LoginResult(issued.token(), issued.expiresAt(), session);
  }

  public void verifyEmail(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidStateException("Invalid token", "Verification token is required");
    }
    emailVerificationService.verify(token.trim());
  }

  public static String normalizeEmail(String email) {
    return email != null ? email.trim().toLowerCase(Locale.ROOT) : "";
  }

  private static UserRole parseAccountType(String accountType) {
    if (accountType == null || accountType.isBlank()) {
      return UserRole.SUPERVISOR;
    }
    return switch (accountType.trim().toUpperCase(Locale.ROOT)) {
      case "SUPERVISOR" -> UserRole.SUPERVISOR;
      case "STUDENT" -> UserRole.STUDENT;
      case "COLLABORATOR" -> UserRole.COLLABORATOR;
      default -> throw new InvalidStateException("Invalid signup", "Invalid account type");
    };
  }
}
