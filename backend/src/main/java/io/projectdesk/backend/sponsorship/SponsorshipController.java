package io.projectdesk.backend.sponsorship;

import io.projectdesk.backend.security.CurrentUser;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/supervisor")
@PreAuthorize("hasAnyRole('SUPERVISOR', 'ADMIN')")
public class SponsorshipController {

  private final SponsorshipService sponsorshipService;

  public SponsorshipController(SponsorshipService sponsorshipService) {
    this.sponsorshipService = sponsorshipService;
  }

  @GetMapping("/sponsored")
  public ResponseEntity<SponsorshipOverviewResponse> getSponsored() {
    var overview = sponsorshipService.getOverview(CurrentUser.requireUserId());
    return ResponseEntity.ok(
        new SponsorshipOverviewResponse(
            overview.sponsored().stream().map(SponsoredUserResponse::from).toList(),
            overview.pendingRequests().stream().map(SponsoredUserResponse::from).toList(),
            overview.sponsoredCount(),
            overview.sponsorLimit(),
            overview.canSponsor()));
  }

  @PostMapping("/sponsored")
  public ResponseEntity<SponsoredUserResponse> sponsor(
      @Valid @RequestBody SponsorRequest request) {
    var user = sponsorshipService.sponsor(CurrentUser.requireUserId(), request.userId());
    return ResponseEntity.ok(SponsoredUserResponse.from(user));
  }

  @DeleteMapping("/sponsored/{userId}")
  public ResponseEntity<Void> removeSponsorship(@PathVariable UUID userId) {
    sponsorshipService.removeSponsorship(CurrentUser.requireUserId(), userId);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/requests/{userId}")
  public ResponseEntity<Void> declineRequest(@PathVariable UUID userId) {
    sponsorshipService.declineRequest(CurrentUser.requireUserId(), userId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record SponsorRequest(@NotNull UUID userId) {}

  public record SponsoredUserResponse(
      UUID id,
      String name,
      String email,
      UserRole role,
      SubscriptionType subscriptionType,
      Instant subscriptionStartedAt,
      Instant subscriptionExpiresAt,
      boolean sponsorSubscriptionInactive,
      Instant createdAt) {

    public static SponsoredUserResponse from(User user) {
      return new SponsoredUserResponse(
          user.getId(),
          user.getName(),
          user.getEmail(),
          user.getRole(),
          user.getSubscriptionType(),
          user.getSubscriptionStartedAt(),
          user.getSubscriptionExpiresAt(),
          user.isSponsorSubscriptionInactive(),
          user.getCreatedAt());
    }
  }

  public record SponsorshipOverviewResponse(
      List<SponsoredUserResponse> sponsored,
      List<SponsoredUserResponse> requests,
      long sponsoredCount,
      int sponsorLimit,
      boolean canSponsor) {}
}
