package io.projectdesk.backend.webhook;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/webhooks/gocardless")
public class BillingWebhookController {

  private static final Logger log = LoggerFactory.getLogger(BillingWebhookController.class);

  private final BillingWebhookService webhookService;

  public BillingWebhookController(BillingWebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> handleWebhook(
      @RequestBody String payload,
      @RequestHeader(value = "Webhook-Signature", required = false) String signature) {
    try {
      int received = webhookService.processWebhook(payload, signature);
      return ResponseEntity.ok(Map.of("received", received));
    } catch (WebhookNotConfiguredException e) {
      log.error("GoCardless webhook rejected: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(Map.of("error", e.getMessage()));
    } catch (WebhookAuthenticationException e) {
      log.warn("GoCardless webhook authentication failed: {}", e.getMessage());
      return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    } catch (WebhookPayloadException e) {
      log.warn("Invalid GoCardless webhook payload: {}", e.getMessage());
      return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
  }
}
