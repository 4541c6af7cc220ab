package io.projectdesk.backend.project;

import io.projectdesk.backend.task.Task;
import io.projectdesk.backend.task.TaskStatus;
import java.time.Instant;

/**
 * The fields of a task that the status engine reads. Any date may be null, meaning the rule it
 * gates does not apply.
 */
public record TaskSnapshot(
    TaskStatus status, Instant startDate, Instant dueDate, Integer durationDays) {

  public static TaskSnapshot from(Task task) {
    return new TaskSnapshot(
        task.getStatus(), task.getStartDate(), task.getDueDate(), task.getDurationDays());
  }

  public boolean isActive() {
    return status != TaskStatus.COMPLETE;
  }
}
