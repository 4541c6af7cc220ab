package io.projectdesk.backend.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.projectdesk.backend.billing.SubscriptionService;
import io.projectdesk.backend.user.UserRepository;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies GoCardless subscription and mandate events to supervisor accounts. Each event runs in
 * its own transaction, so a failure on one event does not undo the ones before it. Events already
 * recorded as processed are skipped; applying the same action twice leaves the same state anyway.
 */
@Service
public class BillingWebhookService {

  private static final Logger log = LoggerFactory.getLogger(BillingWebhookService.class);

  static final Set<String> SUBSCRIPTION_TERMINATION_ACTIONS =
      Set.of("cancelled", "expired", "finished", "failed");
  static final Set<String> SUBSCRIPTION_ACTIVE_ACTIONS =
      Set.of("created", "customer_approval_granted", "active");
  static final Set<String> MANDATE_TERMINATION_ACTIONS = Set.of("cancelled", "expired", "failed");

  private final WebhookSignatureVerifier signatureVerifier;
  private final WebhookIdempotencyService idempotencyService;
  private final UserRepository userRepository;
  private final SubscriptionService subscriptionService;
  private final ObjectMapper objectMapper;
  private final TransactionTemplate txTemplate;

  public BillingWebhookService(
      WebhookSignatureVerifier signatureVerifier,
      WebhookIdempotencyService idempotencyService,
      UserRepository userRepository,
      SubscriptionService subscriptionService,
      ObjectMapper objectMapper,
      PlatformTransactionManager txManager) {
    this.signatureVerifier = signatureVerifier;
    this.idempotencyService = idempotencyService;
    this.userRepository = userRepository;
    this.subscriptionService = subscriptionService;
    this.objectMapper = objectMapper;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  /** Webhook event as far as account state is concerned. */
  record BillingEvent(String id, String resourceType, String action, String resourceId) {}

  /**
   * Verifies and applies a delivery.
   *
   * @return number of events in the delivery
   */
  public int processWebhook(String rawBody, String signature) {
    signatureVerifier.verify(rawBody, signature);

    JsonNode root;
    try {
      root = objectMapper.readTree(rawBody);
    } catch (JsonProcessingException e) {
      log.warn("Failed to parse GoCardless webhook payload: {}", e.getOriginalMessage());
      throw new WebhookPayloadException("Invalid payload", e);
    }

    JsonNode events = root == null ? null : root.get("events");
    if (events == null || !events.isArray()) {
      log.debug("GoCardless webhook without events array");
      return 0;
    }
    for (JsonNode node : events) {
      var event = toEvent(node);
      txTemplate.executeWithoutResult(status -> apply(event));
    }
    return events.size();
  }

  static BillingEvent toEvent(JsonNode node) {
    String resourceType = node.path("resource_type").asText("");
    String action = node.path("action").asText("").trim().toLowerCase(Locale.ROOT);
    JsonNode links = node.path("links");
    String resourceId =
        switch (resourceType) {
          case "subscriptions" -> links.path("subscription").asText(null);
          case "mandates" -> links.path("mandate").asText(null);
          default -> null;
        };
    return new BillingEvent(node.path("id").asText(null), resourceType, action, resourceId);
  }

  void apply(BillingEvent event) {
    if (event.id() != null && idempotencyService.isAlreadyProcessed(event.id())) {
      log.info("Skipping already processed webhook event {}", event.id());
      return;
    }
    if (event.resourceId() != null) {
      if ("subscriptions".equals(event.resourceType())) {
        applySubscriptionEvent(event);
      } else if ("mandates".equals(event.resourceType())) {
        applyMandateEvent(event);
      }
    }
    if (event.id() != null) {
      idempotencyService.markProcessed(event.id(), event.resourceType(), event.action());
    }
  }

  private void applySubscriptionEvent(BillingEvent event) {
    var user = userRepository.findByGoCardlessSubscriptionId(event.resourceId()).orElse(null);
    if (user == null) {
      log.info("Ignoring {} event for unknown subscription {}", event.action(), event.resourceId());
      return;
    }
    var now = Instant.now();
    if (SUBSCRIPTION_TERMINATION_ACTIONS.contains(event.action())) {
      subscriptionService.applyTermination(user, event.action(), now);
    } else if (SUBSCRIPTION_ACTIVE_ACTIONS.contains(event.action())) {
      subscriptionService.applyActivation(user, event.action(), now);
    } else {
      user.recordSubscriptionStatus(event.action(), now);
      log.info("Subscription {} status now {}", event.resourceId(), event.action());
    }
  }

  private void applyMandateEvent(BillingEvent event) {
    if (!MANDATE_TERMINATION_ACTIONS.contains(event.action())) {
      log.debug("No account change for mandate action {}", event.action());
      return;
    }
    var user = userRepository.findByGoCardlessMandateId(event.resourceId()).orElse(null);
    if (user == null) {
      log.info("Ignoring {} event for unknown mandate {}", event.action(), event.resourceId());
      return;
    }
    subscriptionService.applyMandateRevoked(user, event.action(), Instant.now());
  }
}
