package io.projectdesk.backend.auth;

import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.UserRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public endpoints: signup, login and email verification. */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private final AuthService authService;

  public AuthController(AuthService authService) {
    this.authService = authService;
  }

  @PostMapping("/signup")
  public ResponseEntity<SignupResponse> signup(@RequestBody SignupRequest request) {
    var user =
        authService.signup(
            new AuthService.SignupCommand(
                request.name(),
                request.email(),
                request.password(),
                request.accountType(),
                request.sponsorEmail()));
    String message =
        user.getRole() == UserRole.SUPERVISOR
            ? "Welcome to ProjectDesk! Confirm your email and start your free 8-day trial."
            : "Account created. Please verify your email while we notify your supervisor for"
                + " sponsorship approval.";
    return ResponseEntity.created(URI.create("/api/account/profile"))
        .body(
            new SignupResponse(
                user.getId(),
                user.getEmail(),
                user.getRole(),
                user.getSubscriptionType(),
                message));
  }

  @PostMapping("/login")
  public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
    var result = authService.login(request.email(), request.password());
    var session = result.session();
    return ResponseEntity.ok(
        new LoginResponse(
            result.token(),
            result.tokenExpiresAt(),
            session.userId(),
            session.email(),
            session.role(),
            session.subscriptionType(),
            session.subscriptionStartedAt(),
            session.subscriptionExpiresAt(),
            session.sponsorId()));
  }

  @PostMapping("/verify-email")
  public ResponseEntity<Void> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
    authService.verifyEmail(request.token());
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record SignupRequest(
      String name, String email, String password, String accountType, String sponsorEmail) {}

  public record SignupResponse(
      UUID id,
      String email,
      UserRole role,
      SubscriptionType subscriptionType,
      String message) {}

  public record LoginRequest(@NotBlank String email, @NotBlank String password) {}

  public record LoginResponse(
      String token,
      Instant expiresAt,
      UUID userId,
      String email,
      UserRole role,
      SubscriptionType subscriptionType,
      Instant subscriptionStartedAt,
      Instant subscriptionExpiresAt,
      UUID sponsorId) {}

  public record VerifyEmailRequest(@NotBlank String token) {}
}
