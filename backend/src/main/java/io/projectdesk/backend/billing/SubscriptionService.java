package io.projectdesk.backend.billing;

import io.projectdesk.backend.exception.BillingProviderException;
import io.projectdesk.backend.exception.ForbiddenException;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.integration.billing.BillingProvider;
import io.projectdesk.backend.integration.billing.BillingProvider.RedirectFlowRequest;
import io.projectdesk.backend.integration.billing.BillingProvider.SubscriptionRequest;
import io.projectdesk.backend.sponsorship.SponsorshipService;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Supervisor subscription lifecycle: mandate set-up through a provider redirect flow, recurring
 * subscription creation and cancellation. Subscription state changes fan out to the accounts the
 * supervisor sponsors through their {@code sponsorSubscriptionInactive} flag.
 */
@Service
public class SubscriptionService {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

  static final String FLOW_DESCRIPTION = "ProjectDesk supervisor subscription";
  static final String SUCCESS_PATH = "/supervisor/subscription/complete";
  private static final int SESSION_TOKEN_BYTES = 32;
  private static final SecureRandom RANDOM = new SecureRandom();

  private final UserRepository userRepository;
  private final RedirectFlowRepository redirectFlowRepository;
  private final BillingProvider billingProvider;
  private final SubscriptionPlan plan;
  private final String baseUrl;

  public SubscriptionService(
      UserRepository userRepository,
      RedirectFlowRepository redirectFlowRepository,
      BillingProvider billingProvider,
      SubscriptionPlan plan,
      @Value("${projectdesk.app.base-url}") String baseUrl) {
    this.userRepository = userRepository;
    this.redirectFlowRepository = redirectFlowRepository;
    this.billingProvider = billingProvider;
    this.plan = plan;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  public record SubscriptionOverview(
      SubscriptionType subscriptionType,
      Instant subscriptionStartedAt,
      Instant subscriptionExpiresAt,
      String providerStatus,
      Long trialDaysRemaining,
      boolean trialExpired,
      boolean cancelled,
      boolean canSponsor,
      long sponsoredCount,
      int sponsorLimit,
      long sponsorSlotsRemaining) {}

  public record StartedFlow(String flowId, String redirectUrl) {}

  /** Reads the supervisor's subscription, converting a lapsed paid period to CANCELLED first. */
  @Transactional
  public SubscriptionOverview getOverview(UUID userId) {
    var user = requireSupervisor(userId);
    var now = Instant.now();
    if (user.expireLapsedSubscription(now)) {
      log.info("Subscription of user {} lapsed at {}", userId, user.getSubscriptionExpiresAt());
    }

    long sponsoredCount = userRepository.countBySponsorId(userId);
    int limit = SponsorshipService.SUPERVISOR_SPONSOR_LIMIT;
    return new SubscriptionOverview(
        user.getSubscriptionType(),
        user.getSubscriptionStartedAt(),
        user.getSubscriptionExpiresAt(),
        user.getGoCardlessSubscriptionStatus(),
        trialDaysRemaining(user, now),
        user.isTrialExpired(now),
        user.getSubscriptionType() == SubscriptionType.CANCELLED,
        user.canSponsorAccounts(),
        sponsoredCount,
        limit,
        Math.max(0, limit - sponsoredCount));
  }

  /** Days left on a free trial, rounded up and never negative. Null for any other account. */
  static Long trialDaysRemaining(User user, Instant now) {
    if (user.getSubscriptionType() != SubscriptionType.FREE_TRIAL
        || user.getSubscriptionExpiresAt() == null) {
      return null;
    }
    long millis = Duration.between(now, user.getSubscriptionExpiresAt()).toMillis();
    long dayMillis = Duration.ofDays(1).toMillis();
    return Math.max(0L, Math.floorDiv(millis + dayMillis - 1, dayMillis));
  }

  /** Opens a provider redirect flow. Earlier unfinished flows of the same user are discarded. */
  @Transactional
  public StartedFlow start(UUID userId) {
    var user = requireSupervisor(userId);
    if (user.getSubscriptionType() == SubscriptionType.SUBSCRIBED
        && user.getGoCardlessSubscriptionId() != null) {
      throw new InvalidStateException(
          "Subscription already active",
          "Subscription already active. Cancel it before starting a new one.");
    }
    plan.requireValid();

    String sessionToken = newSessionToken();
    String[] names = splitName(user.getName());
    var flow =
        billingProvider.createRedirectFlow(
            new RedirectFlowRequest(
                FLOW_DESCRIPTION,
                sessionToken,
                baseUrl + SUCCESS_PATH,
                names[0],
                names[1],
                user.getEmail(),
                Map.of("userId", userId.toString())));
    if (flow.id() == null || flow.redirectUrl() == null) {
      throw new BillingProviderException("GoCardless response missing redirect flow");
    }

    int discarded = redirectFlowRepository.deletePendingByUserId(userId);
    redirectFlowRepository.save(new RedirectFlow(userId, flow.id(), sessionToken));
    log.info(
        "Started redirect flow {} for user {} (discarded {} pending)",
        flow.id(),
        userId,
        discarded);
    return new StartedFlow(flow.id(), flow.redirectUrl());
  }

  /**
   * Completes a redirect flow and creates the recurring subscription against the new mandate. The
   * supervisor becomes SUBSCRIBED and the accounts they sponsor are active again.
   */
  @Transactional
  public User complete(UUID userId, String flowId) {
    var user = requireSupervisor(userId);
    var flow =
        redirectFlowRepository
            .findByFlowIdAndUserId(flowId, userId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Redirect flow not found", "Redirect flow not found"));
    if (flow.isCompleted()) {
      throw new InvalidStateException(
          "Redirect flow already completed", "Redirect flow already completed");
    }
    plan.requireValid();

    var completed = billingProvider.completeRedirectFlow(flowId, flow.getSessionToken());
    if (completed.mandateId() == null || completed.customerId() == null) {
      throw new BillingProviderException("GoCardless response missing mandate or customer");
    }

    var subscription =
        billingProvider.createSubscription(
            new SubscriptionRequest(
                completed.mandateId(),
                plan.getAmount(),
                plan.getCurrency(),
                plan.getName(),
                plan.getIntervalUnit(),
                plan.getInterval(),
                Map.of("userId", userId.toString())));

    var now = Instant.now();
    flow.markCompleted(now);
    user.activateSubscription(
        completed.customerId(),
        completed.mandateId(),
        subscription.id(),
        subscription.status(),
        now);
    int reactivated = userRepository.updateSponsorSubscriptionInactive(userId, false, now);
    log.info(
        "User {} subscribed (subscription {}, {} sponsored accounts active)",
        userId,
        subscription.id(),
        reactivated);
    return user;
  }

  /** Cancels at the provider first; local state only changes once the provider has accepted. */
  @Transactional
  public User cancel(UUID userId) {
    var user = requireSupervisor(userId);
    String subscriptionId = user.getGoCardlessSubscriptionId();
    if (subscriptionId == null) {
      throw new InvalidStateException(
          "No subscription", "No GoCardless subscription to cancel.");
    }
    billingProvider.cancelSubscription(subscriptionId);
    applyTermination(user, "cancelled", Instant.now());
    return user;
  }

  /** Subscription ended at the provider or by the user. Sponsored accounts become inactive. */
  public void applyTermination(User user, String providerStatus, Instant now) {
    user.cancelSubscription(providerStatus, now);
    int flagged = userRepository.updateSponsorSubscriptionInactive(user.getId(), true, now);
    log.info(
        "Subscription of user {} ended ({}), {} sponsored accounts inactive",
        user.getId(),
        providerStatus,
        flagged);
  }

  /** Subscription (re)activated at the provider. Sponsored accounts become active. */
  public void applyActivation(User user, String providerStatus, Instant now) {
    user.markSubscriptionActive(providerStatus, now);
    int cleared = userRepository.updateSponsorSubscriptionInactive(user.getId(), false, now);
    log.info(
        "Subscription of user {} active ({}), {} sponsored accounts active",
        user.getId(),
        providerStatus,
        cleared);
  }

  /** Mandate revoked at the provider. Without it no payment is collected; the subscription ends. */
  public void applyMandateRevoked(User user, String providerStatus, Instant now) {
    user.revokeMandate(now);
    user.recordSubscriptionStatus(providerStatus, now);
    int flagged = userRepository.updateSponsorSubscriptionInactive(user.getId(), true, now);
    log.info(
        "Mandate of user {} {}, {} sponsored accounts inactive",
        user.getId(),
        providerStatus,
        flagged);
  }

  private User requireSupervisor(UUID userId) {
    var user =
        userRepository
            .findById(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    if (!user.getRole().canSupervise()) {
      throw new ForbiddenException(
          "Subscription not available", "Only supervisors can manage a subscription");
    }
    return user;
  }

  static String newSessionToken() {
    byte[] bytes = new byte[SESSION_TOKEN_BYTES];
    RANDOM.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }

  /** First word as given name, the rest as family name. Either may be null. */
  static String[] splitName(String name) {
    String[] parts =
        Arrays.stream(name == null ? new String[0] : name.trim().split("\\s+"))
            .filter(part -> !part.isEmpty())
            .toArray(String[]::new);
    if (parts.length == 0) {
      return new String[] {null, null};
    }
    String family =
        parts.length > 1 ? String.join(" ", Arrays.copyOfRange(parts, 1, parts.length)) : null;
    return new String[] {parts[0], family};
  }
}
