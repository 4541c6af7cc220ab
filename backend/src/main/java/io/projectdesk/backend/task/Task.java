package io.projectdesk.backend.task;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Column(name = "start_date")
  private Instant startDate;

  @Column(name = "due_date")
  private Instant dueDate;

  @Column(name = "duration_days")
  private Integer durationDays;

  @Column(name = "flagged", nullable = false)
  private boolean flagged;

  @Column(name = "flagged_by")
  private UUID flaggedBy;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "task_assignees", joinColumns = @JoinColumn(name = "task_id"))
  @Column(name = "user_id", nullable = false)
  private Set<UUID> assigneeIds = new LinkedHashSet<>();

  @Column(name = "created_by", nullable = false)
  private UUID createdBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(UUID projectId, String title, String description, TaskStatus status, UUID createdBy) {
    this.projectId = projectId;
    this.title = title;
    this.description = description;
    this.status = status != null ? status : TaskStatus.TODO;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void update(String title, String description, TaskStatus status) {
    this.title = title;
    this.description = description;
    if (status != null) {
      this.status = status;
    }
    this.updatedAt = Instant.now();
  }

  public void reschedule(Instant startDate, Instant dueDate, Integer durationDays) {
    if (durationDays != null && durationDays < 0) {
      throw new IllegalArgumentException("Duration cannot be negative");
    }
    this.startDate = startDate;
    this.dueDate = dueDate;
    this.durationDays = durationDays;
    this.updatedAt = Instant.now();
  }

  public void assignTo(Collection<UUID> userIds) {
    this.assigneeIds.clear();
    this.assigneeIds.addAll(userIds);
    this.updatedAt = Instant.now();
  }

  public void unassign(UUID userId) {
    if (assigneeIds.remove(userId)) {
      this.updatedAt = Instant.now();
    }
  }

  public void markComplete() {
    this.status = TaskStatus.COMPLETE;
    this.updatedAt = Instant.now();
  }

  /** Flips the flag. Flagging records who raised it; unflagging clears that. */
  public void toggleFlag(UUID actorId) {
    this.flagged = !this.flagged;
    this.flaggedBy = this.flagged ? actorId : null;
    this.updatedAt = Instant.now();
  }

  public boolean isAssignedTo(UUID userId) {
    return assigneeIds.contains(userId);
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getDueDate() {
    return dueDate;
  }

  public Integer getDurationDays() {
    return durationDays;
  }

  public boolean isFlagged() {
    return flagged;
  }

  public UUID getFlaggedBy() {
    return flaggedBy;
  }

  public Set<UUID> getAssigneeIds() {
    return Set.copyOf(assigneeIds);
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
