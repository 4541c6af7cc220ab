package io.projectdesk.backend.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A progress note posted on a project. Updates are append-only. */
@Entity
@Table(name = "project_updates")
public class ProjectUpdate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "author_id", nullable = false, updatable = false)
  private UUID authorId;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "notify_all", nullable = false)
  private boolean notifyAll;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ProjectUpdate() {}

  public ProjectUpdate(
      UUID projectId, UUID authorId, String title, String description, boolean notifyAll) {
    this.projectId = projectId;
    this.authorId = authorId;
    this.title = title;
    this.description = description;
    this.notifyAll = notifyAll;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getAuthorId() {
    return authorId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public boolean isNotifyAll() {
    return notifyAll;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
