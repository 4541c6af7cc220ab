package io.projectdesk.backend.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WebhookIdempotencyService {

  private static final Logger log = LoggerFactory.getLogger(WebhookIdempotencyService.class);

  private final ProcessedWebhookRepository repository;

  public WebhookIdempotencyService(ProcessedWebhookRepository repository) {
    this.repository = repository;
  }

  public boolean isAlreadyProcessed(String eventId) {
    return repository.existsById(eventId);
  }

  @Transactional
  public void markProcessed(String eventId, String resourceType, String action) {
    if (repository.existsById(eventId)) {
      log.debug("Webhook event {} already marked as processed, skipping", eventId);
      return;
    }
    repository.save(new ProcessedWebhook(eventId, resourceType, action));
    log.debug("Marked webhook event {} ({} {}) as processed", eventId, resourceType, action);
  }
}
