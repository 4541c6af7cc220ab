package io.projectdesk.backend.billing;

import io.projectdesk.backend.billing.SubscriptionService.StartedFlow;
import io.projectdesk.backend.billing.SubscriptionService.SubscriptionOverview;
import io.projectdesk.backend.security.CurrentUser;
import io.projectdesk.backend.user.SubscriptionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/supervisor/subscription")
@PreAuthorize("hasAnyRole('SUPERVISOR', 'ADMIN')")
public class BillingController {

  private final SubscriptionService subscriptionService;

  public BillingController(SubscriptionService subscriptionService) {
    this.subscriptionService = subscriptionService;
  }

  @GetMapping
  public ResponseEntity<SubscriptionOverview> getSubscription() {
    return ResponseEntity.ok(subscriptionService.getOverview(CurrentUser.requireUserId()));
  }

  @PostMapping
  public ResponseEntity<StartedFlow> startSubscription() {
    return ResponseEntity.ok(subscriptionService.start(CurrentUser.requireUserId()));
  }

  @PostMapping("/complete")
  public ResponseEntity<SubscriptionStateResponse> completeSubscription(
      @Valid @RequestBody CompleteRequest request) {
    var user = subscriptionService.complete(CurrentUser.requireUserId(), request.flowId());
    return ResponseEntity.ok(
        new SubscriptionStateResponse(
            user.getSubscriptionType(),
            user.getSubscriptionStartedAt(),
            user.getSubscriptionExpiresAt(),
            user.getGoCardlessSubscriptionStatus()));
  }

  @DeleteMapping
  public ResponseEntity<SubscriptionStateResponse> cancelSubscription() {
    var user = subscriptionService.cancel(CurrentUser.requireUserId());
    return ResponseEntity.ok(
        new SubscriptionStateResponse(
            user.getSubscriptionType(),
            user.getSubscriptionStartedAt(),
            user.getSubscriptionExpiresAt(),
            user.getGoCardlessSubscriptionStatus()));
  }

  public record CompleteRequest(@NotBlank(message = "flowId is required") String flowId) {}

  public record SubscriptionStateResponse(
      SubscriptionType subscriptionType,
      Instant subscriptionStartedAt,
      Instant subscriptionExpiresAt,
      String providerStatus) {}
}
