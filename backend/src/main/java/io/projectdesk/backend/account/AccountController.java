package io.projectdesk.backend.account;

import io.projectdesk.backend.security.CurrentUser;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.UserRole;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/account")
public class AccountController {

  private final AccountService accountService;

  public AccountController(AccountService accountService) {
    this.accountService = accountService;
  }

  @GetMapping("/profile")
  public ResponseEntity<ProfileResponse> getProfile() {
    var profile = accountService.getProfile(CurrentUser.requireUserId());
    var user = profile.user();
    return ResponseEntity.ok(
        new ProfileResponse(
            user.getId(),
            user.getName(),
            user.getEmail(),
            user.getRole(),
            user.isEmailVerified(),
            user.getSubscriptionType(),
            user.getSubscriptionStartedAt(),
            user.getSubscriptionExpiresAt(),
            user.getSponsorId(),
            user.getSupervisorId(),
            user.isSponsorSubscriptionInactive(),
            profile.lockout(),
            profile.lockout().isLocked()));
  }

  @PostMapping("/notify-sponsor")
  public ResponseEntity<Void> notifySponsor() {
    accountService.notifySponsor(CurrentUser.requireUserId());
    return ResponseEntity.accepted().build();
  }

  public record ProfileResponse(
      UUID id,
      String name,
      String email,
      UserRole role,
      boolean emailVerified,
      SubscriptionType subscriptionType,
      Instant subscriptionStartedAt,
      Instant subscriptionExpiresAt,
      UUID sponsorId,
      UUID supervisorId,
      boolean sponsorSubscriptionInactive,
      AccountLockout lockout,
      boolean locked) {}
}
