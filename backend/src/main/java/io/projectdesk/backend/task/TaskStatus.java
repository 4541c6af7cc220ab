package io.projectdesk.backend.task;

import java.util.Locale;
import java.util.Map;

/** Task progress status. {@code COMPLETE} is the only finished state. */
public enum TaskStatus {
  TODO,
  IN_PROGRESS,
  BEHIND_SCHEDULE,
  AT_RISK,
  COMPLETE,
  BLOCKED;

  /** Spellings used by clients and older records for the canonical values. */
  private static final Map<String, TaskStatus> ALIASES =
      Map.of(
          "DONE", COMPLETE,
          "COMPLETED", COMPLETE,
          "NOT_STARTED", TODO);

  public boolean isComplete() {
    return this == COMPLETE;
  }

  /** Statuses in which a past-due task counts as slipping behind schedule. */
  public boolean isSchedulable() {
    return this == TODO || this == IN_PROGRESS || this == BEHIND_SCHEDULE;
  }

  /**
   * Parses a status supplied from outside the domain. Case-insensitive; hyphens and spaces are
   * read as underscores; {@code DONE}/{@code COMPLETED} map to {@link #COMPLETE} and {@code
   * NOT_STARTED} to {@link #TODO}.
   *
   * @throws IllegalArgumentException if the value names no known status
   */
  public static TaskStatus fromExternal(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Task status is required");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    TaskStatus alias = ALIASES.get(normalized);
    return alias != null ? alias : TaskStatus.valueOf(normalized);
  }
}
