package io.projectdesk.backend.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.projectdesk.backend.auth.AuthService.SignupCommand;
import io.projectdesk.backend.event.SponsorshipRequestedEvent;
import io.projectdesk.backend.exception.AuthenticationFailedException;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceConflictException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.security.SessionTokenService;
import io.projectdesk.backend.testutil.TestUsers;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

  private static final String PASSWORD = "long-enough-password";

  @Mock private UserRepository userRepository;
  @Mock private EmailVerificationService emailVerificationService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);
  private final SessionTokenService tokenService =
      new SessionTokenService("auth-service-test-secret-0123456789abcdef", Duration.ofHours(1));

  private AuthService service;

  @BeforeEach
  void setUp() {
    service =
        new AuthService(
            userRepository,
            encoder,
            new AuthenticationGate(encoder, true),
            emailVerificationService,
            tokenService,
            eventPublisher);
    lenient()
        .when(userRepository.save(any(User.class)))
        .thenAnswer(invocation -> TestUsers.withId(invocation.getArgument(0)));
  }

  @Test
  void signup_supervisor_startsEightDayTrial() {
    var user =
        service.signup(new SignupCommand(" Ada ", " Ada@Example.com ", PASSWORD, null, null));

    assertThat(user.getName()).isEqualTo("Ada");
    assertThat(user.getEmail()).isEqualTo("ada@example.com");
    assertThat(user.getRole()).isEqualTo(UserRole.SUPERVISOR);
    assertThat(user.getSubscriptionType()).isEqualTo(SubscriptionType.FREE_TRIAL);
    assertThat(Duration.between(user.getSubscriptionStartedAt(), user.getSubscriptionExpiresAt()))
        .isEqualTo(Duration.ofDays(8));
    assertThat(encoder.matches(PASSWORD, user.getPasswordHash())).isTrue();
    verify(emailVerificationService).issueToken(user);
    verify(eventPublisher, never()).publishEvent(any(Object.class));
  }

  @Test
  void signup_student_awaitsNamedSupervisor() {
    var supervisor = TestUsers.subscribedSupervisor("sup@example.com", Instant.now());
    when(userRepository.findByEmail("stu@example.com")).thenReturn(Optional.empty());
    when(userRepository.findByEmail("sup@example.com")).thenReturn(Optional.of(supervisor));

    var user =
        service.signup(
            new SignupCommand("Stu", "stu@example.com", PASSWORD, "student", "SUP@example.com"));

    assertThat(user.getRole()).isEqualTo(UserRole.STUDENT);
    assertThat(user.getSubscriptionType()).isEqualTo(SubscriptionType.SPONSORED);
    assertThat(user.getSupervisorId()).isEqualTo(supervisor.getId());
    assertThat(user.isAwaitingSponsorship()).isTrue();

    var event = ArgumentCaptor.forClass(SponsorshipRequestedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().recipientEmail()).isEqualTo("sup@example.com");
    assertThat(event.getValue().requesterRole()).isEqualTo("STUDENT");
  }

  @Test
  void signup_studentWithoutSupervisorEmail_rejected() {
    assertThatThrownBy(
            () ->
                service.signup(
                    new SignupCommand("Stu", "stu@example.com", PASSWORD, "STUDENT", " ")))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Invalid signup");
  }

  @Test
  void signup_sponsorEmailOfNonSupervisor_notFound() {
    var otherStudent =
        TestUsers.sponsored(
            "other@example.com", UserRole.STUDENT, UUID.randomUUID(), Instant.now());
    when(userRepository.findByEmail("stu@example.com")).thenReturn(Optional.empty());
    when(userRepository.findByEmail("other@example.com")).thenReturn(Optional.of(otherStudent));

    assertThatThrownBy(
            () ->
                service.signup(
                    new SignupCommand(
                        "Stu", "stu@example.com", PASSWORD, "collaborator", "other@example.com")))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(userRepository, never()).save(any(User.class));
  }

  @Test
  void signup_duplicateEmail_conflict() {
    var existing = TestUsers.supervisor("ada@example.com", Instant.now());
    when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(existing));

    assertThatThrownBy(
            () -> service.signup(new SignupCommand("Ada", "ada@example.com", PASSWORD, null, null)))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void signup_invitedEmail_claimsInvitedAccount() {
    var invited =
        TestUsers.withId(
            User.invited("bob", "bob@example.com", UserRole.COLLABORATOR, Instant.now()));
    when(userRepository.findByEmail("bob@example.com")).thenReturn(Optional.of(invited));

    var user =
        service.signup(new SignupCommand("Bob Builder", "bob@example.com", PASSWORD, null, null));

    assertThat(user).isSameAs(invited);
    assertThat(user.getName()).isEqualTo("Bob Builder");
    assertThat(user.getRole()).isEqualTo(UserRole.COLLABORATOR);
    assertThat(user.isInvitationPending()).isFalse();
    assertThat(encoder.matches(PASSWORD, user.getPasswordHash())).isTrue();
    verify(emailVerificationService).issueToken(invited);
    verify(userRepository, never()).save(any(User.class));
  }

  @Test
  void signup_shortPassword_rejected() {
    assertThatThrownBy(
            () -> service.signup(new SignupCommand("Ada", "ada@example.com", "short", null, null)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void signup_malformedEmail_rejected() {
    assertThatThrownBy(
            () -> service.signup(new SignupCommand("Ada", "not-an-email", PASSWORD, null, null)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void signup_unknownAccountType_rejected() {
    assertThatThrownBy(
            () ->
                service.signup(
                    new SignupCommand("Ada", "ada@example.com", PASSWORD, "janitor", null)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void login_verifiedSupervisor_issuesSessionToken() {
    var user = verifiedSupervisor();
    when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));

    var result = service.login(" ADA@example.com", PASSWORD);

    assertThat(result.session().userId()).isEqualTo(user.getId());
    assertThat(result.session().subscriptionType()).isEqualTo(SubscriptionType.FREE_TRIAL);
    assertThat(tokenService.verifyToken(result.token())).isEqualTo(result.session());
  }

  @Test
  void login_unverifiedEmail_rejectedAndVerificationResent() {
    var user =
        TestUsers.withId(
            User.supervisor("Ada", "ada@example.com", encoder.encode(PASSWORD), Instant.now()));
    when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));

    assertThatThrownBy(() -> service.login("ada@example.com", PASSWORD))
        .isInstanceOfSatisfying(
            AuthenticationFailedException.class,
            e -> assertThat(e.getReason()).isEqualTo("Email not verified"));
    verify(emailVerificationService).issueToken(user);
  }

  @Test
  void login_wrongPassword_rejectedWithoutResend() {
    var user = verifiedSupervisor();
    when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));

    assertThatThrownBy(() -> service.login("ada@example.com", "wrong-password"))
        .isInstanceOfSatisfying(
            AuthenticationFailedException.class,
            e -> assertThat(e.getReason()).isEqualTo("Invalid password"));
    verify(emailVerificationService, never()).issueToken(any());
  }

  @Test
  void login_unknownEmail_noUser() {
    when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.login("ghost@example.com", PASSWORD))
        .isInstanceOfSatisfying(
            AuthenticationFailedException.class,
            e -> assertThat(e.getReason()).isEqualTo("No user found"));
  }

  private User verifiedSupervisor() {
    var user =
        TestUsers.withId(
            User.supervisor("Ada", "ada@example.com", encoder.encode(PASSWORD), Instant.now()));
    user.markEmailVerified(Instant.now());
    return user;
  }
}
