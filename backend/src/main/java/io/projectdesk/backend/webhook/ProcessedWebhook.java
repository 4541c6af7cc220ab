package io.projectdesk.backend.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "processed_webhooks")
public class ProcessedWebhook {

  @Id
  @Column(name = "event_id")
  private String eventId;

  @Column(name = "resource_type", nullable = false)
  private String resourceType;

  @Column(name = "action", nullable = false)
  private String action;

  @Column(name = "processed_at", nullable = false)
  private Instant processedAt = Instant.now();

  protected ProcessedWebhook() {}

  public ProcessedWebhook(String eventId, String resourceType, String action) {
    this.eventId = eventId;
    this.resourceType = resourceType;
    this.action = action;
  }

  public String getEventId() {
    return eventId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getAction() {
    return action;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }
}
