package io.projectdesk.backend.project;

import io.projectdesk.backend.exception.InvalidStateException;
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
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  static final String COLLABORATION_CATEGORY = "collaboration";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "category", length = 100)
  private String category;

  @Column(name = "start_date")
  private Instant startDate;

  @Column(name = "end_date")
  private Instant endDate;

  @Column(name = "is_completed", nullable = false)
  private boolean completed;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProjectStatus status;

  @Column(name = "supervisor_id", nullable = false)
  private UUID supervisorId;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "project_students", joinColumns = @JoinColumn(name = "project_id"))
  @Column(name = "user_id", nullable = false)
  private Set<UUID> studentIds = new LinkedHashSet<>();

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "project_collaborators", joinColumns = @JoinColumn(name = "project_id"))
  @Column(name = "user_id", nullable = false)
  private Set<UUID> collaboratorIds = new LinkedHashSet<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Project() {}

  public Project(
      String title,
      String description,
      String category,
      Instant startDate,
      Instant endDate,
      UUID supervisorId) {
    requireDateOrder(startDate, endDate);
    this.title = title;
    this.description = description;
    this.category = category;
    this.startDate = startDate;
    this.endDate = endDate;
    this.supervisorId = supervisorId;
    this.status = ProjectStatus.NOT_STARTED;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void update(
      String title, String description, String category, Instant startDate, Instant endDate) {
    requireDateOrder(startDate, endDate);
    this.title = title;
    this.description = description;
    this.category = category;
    this.startDate = startDate;
    this.endDate = endDate;
    this.updatedAt = Instant.now();
  }

  public void replaceMembers(Collection<UUID> studentIds, Collection<UUID> collaboratorIds) {
    this.studentIds.clear();
    this.studentIds.addAll(studentIds);
    this.collaboratorIds.clear();
    this.collaboratorIds.addAll(collaboratorIds);
    this.updatedAt = Instant.now();
  }

  public void removeMember(UUID userId) {
    boolean removed = studentIds.remove(userId) | collaboratorIds.remove(userId);
    if (removed) {
      this.updatedAt = Instant.now();
    }
  }

  /**
   * Stores a freshly derived status.
   *
   * @return true if the stored value changed
   */
  public boolean applyDerivedStatus(ProjectStatus derived) {
    if (this.status == derived) {
      return false;
    }
    this.status = derived;
    this.updatedAt = Instant.now();
    return true;
  }

  public void complete() {
    if (this.completed) {
      throw new InvalidStateException("Invalid project state", "Project is already completed");
    }
    this.completed = true;
    this.status = ProjectStatus.COMPLETED;
    this.updatedAt = Instant.now();
  }

  /** Clears completion; the caller recomputes the status from the tasks afterwards. */
  public void reactivate() {
    if (!this.completed) {
      throw new InvalidStateException("Invalid project state", "Project is not completed");
    }
    this.completed = false;
    this.updatedAt = Instant.now();
  }

  /** Completed projects always show as Completed whatever was last stored. */
  public ProjectStatus displayStatus() {
    return completed ? ProjectStatus.COMPLETED : status;
  }

  /** "Principal Investigator" for collaboration projects, "Supervisor" for the rest. */
  public String leadLabel() {
    return category != null && COLLABORATION_CATEGORY.equalsIgnoreCase(category.trim())
        ? "Principal Investigator"
        : "Supervisor";
  }

  public boolean hasMember(UUID userId) {
    return studentIds.contains(userId) || collaboratorIds.contains(userId);
  }

  private static void requireDateOrder(Instant startDate, Instant endDate) {
    if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid project dates", "End date must not be before the start date");
    }
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getCategory() {
    return category;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getEndDate() {
    return endDate;
  }

  public boolean isCompleted() {
    return completed;
  }

  public ProjectStatus getStatus() {
    return status;
  }

  public UUID getSupervisorId() {
    return supervisorId;
  }

  public Set<UUID> getStudentIds() {
    return Set.copyOf(studentIds);
  }

  public Set<UUID> getCollaboratorIds() {
    return Set.copyOf(collaboratorIds);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
