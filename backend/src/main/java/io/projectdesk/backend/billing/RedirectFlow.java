package io.projectdesk.backend.billing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A mandate set-up started by a supervisor at the billing provider, pending or completed. */
@Entity
@Table(name = "redirect_flows")
public class RedirectFlow {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "flow_id", nullable = false, unique = true)
  private String flowId;

  @Column(name = "session_token", nullable = false, length = 64)
  private String sessionToken;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected RedirectFlow() {}

  public RedirectFlow(UUID userId, String flowId, String sessionToken) {
    this.userId = userId;
    this.flowId = flowId;
    this.sessionToken = sessionToken;
    this.createdAt = Instant.now();
  }

  public boolean isCompleted() {
    return completedAt != null;
  }

  public void markCompleted(Instant now) {
    this.completedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getFlowId() {
    return flowId;
  }

  public String getSessionToken() {
    return sessionToken;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
