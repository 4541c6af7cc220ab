package io.projectdesk.backend.admin;

import io.projectdesk.backend.admin.SubscriptionMetricsService.SubscriptionMetrics;
import io.projectdesk.backend.security.CurrentUser;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminUserController {

  private final AdminUserService adminUserService;
  private final SubscriptionMetricsService metricsService;

  public AdminUserController(
      AdminUserService adminUserService, SubscriptionMetricsService metricsService) {
    this.adminUserService = adminUserService;
    this.metricsService = metricsService;
  }

  @GetMapping("/users")
  public ResponseEntity<List<AdminUserResponse>> listUsers() {
    return ResponseEntity.ok(
        adminUserService.listUsers().stream().map(AdminUserResponse::from).toList());
  }

  @PutMapping("/users/{id}")
  public ResponseEntity<AdminUserResponse> updateUser(
      @PathVariable UUID id, @RequestBody UpdateUserRequest request) {
    var user = adminUserService.updateUser(id, request.role(), request.name(), request.email());
    return ResponseEntity.ok(AdminUserResponse.from(user));
  }

  @PutMapping("/users/{id}/subscription")
  public ResponseEntity<AdminUserResponse> overrideSubscription(
      @PathVariable UUID id, @Valid @RequestBody SubscriptionOverrideRequest request) {
    var user =
        adminUserService.overrideSubscription(
            id, request.subscriptionType(), request.subscriptionExpiresAt());
    return ResponseEntity.ok(AdminUserResponse.from(user));
  }

  @DeleteMapping("/users/{id}")
  public ResponseEntity<Void> deleteUser(@PathVariable UUID id) {
    adminUserService.deleteUser(CurrentUser.requireUserId(), id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/subscription-metrics")
  public ResponseEntity<SubscriptionMetrics> getSubscriptionMetrics() {
    return ResponseEntity.ok(metricsService.collect());
  }

  public record UpdateUserRequest(String role, String name, String email) {}

  public record SubscriptionOverrideRequest(
      @NotBlank(message = "subscriptionType is required") String subscriptionType,
      Instant subscriptionExpiresAt) {}

  public record AdminUserResponse(
      UUID id,
      String name,
      String email,
      UserRole role,
      boolean emailVerified,
      SubscriptionType subscriptionType,
      Instant subscriptionExpiresAt,
      UUID sponsorId,
      UUID supervisorId,
      boolean sponsorSubscriptionInactive,
      String providerStatus) {

    static AdminUserResponse from(User user) {
      return new AdminUserResponse(
          user.getId(),
          user.getName(),
          user.getEmail(),
          user.getRole(),
          user.isEmailVerified(),
          user.getSubscriptionType(),
          user.getSubscriptionExpiresAt(),
          user.getSponsorId(),
          user.getSupervisorId(),
          user.isSponsorSubscriptionInactive(),
          user.getGoCardlessSubscriptionStatus());
    }
  }
}
