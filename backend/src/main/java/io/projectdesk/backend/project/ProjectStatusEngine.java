package io.projectdesk.backend.project;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Classifies a project from its tasks, its end date and the current time. Pure and deterministic:
 * the same snapshot always yields the same status, so callers may recompute freely.
 *
 * <p>Rules are evaluated in the order of {@link #RULES}; the first one that matches decides the
 * status. {@link ProjectStatus#ON_TRACK} is the fallback when none does.
 */
@Component
public class ProjectStatusEngine {

  static final Duration OVERDUE_GRACE = Duration.ofDays(1);

  /** One rule of the cascade. */
  record StatusRule(ProjectStatus result, Predicate<TaskAnalysis> matches) {}

  static final List<StatusRule> RULES =
      List.of(
          new StatusRule(ProjectStatus.NOT_STARTED, TaskAnalysis::isEmpty),
          new StatusRule(ProjectStatus.COMPLETED, TaskAnalysis::allComplete),
          new StatusRule(
              ProjectStatus.DANGER,
              a -> a.behindSchedule() >= 2 || a.durationOverflow() > 0 || a.beyondProject() > 0),
          new StatusRule(ProjectStatus.AT_RISK, a -> a.behindSchedule() == 1),
          new StatusRule(ProjectStatus.BEHIND_SCHEDULE, a -> a.overdue() > 0));

  public ProjectStatus evaluate(
      Collection<TaskSnapshot> tasks, Instant projectEndDate, Instant now) {
    var analysis = TaskAnalysis.of(tasks, projectEndDate, now);
    return RULES.stream()
        .filter(rule -> rule.matches().test(analysis))
        .map(StatusRule::result)
        .findFirst()
        .orElse(ProjectStatus.ON_TRACK);
  }

  /**
   * Counts over a task snapshot. The four set sizes only consider active (not complete) tasks.
   *
   * @param overdue due more than {@link #OVERDUE_GRACE} ago
   * @param behindSchedule past due at all while still TODO, IN_PROGRESS or BEHIND_SCHEDULE
   * @param durationOverflow start date plus duration runs past the project end date
   * @param beyondProject due after the project end date
   */
  record TaskAnalysis(
      int total,
      int complete,
      int overdue,
      int behindSchedule,
      int durationOverflow,
      int beyondProject) {

    boolean isEmpty() {
      return total == 0;
    }

    boolean allComplete() {
      return total > 0 && complete == total;
    }

    static TaskAnalysis of(Collection<TaskSnapshot> tasks, Instant projectEndDate, Instant now) {
      Instant overdueCutoff = now.minus(OVERDUE_GRACE);
      int complete = 0;
      int overdue = 0;
      int behindSchedule = 0;
      int durationOverflow = 0;
      int beyondProject = 0;

      for (TaskSnapshot task : tasks) {
        if (!task.isActive()) {
          complete++;
          continue;
        }
        Instant due = task.dueDate();
        if (due != null && due.isBefore(overdueCutoff)) {
          overdue++;
        }
        if (due != null && due.isBefore(now) && task.status().isSchedulable()) {
          behindSchedule++;
        }
        if (overflowsProject(task, projectEndDate)) {
          durationOverflow++;
        }
        if (due != null && projectEndDate != null && due.isAfter(projectEndDate)) {
          beyondProject++;
        }
      }
      return new TaskAnalysis(
          tasks.size(), complete, overdue, behindSchedule, durationOverflow, beyondProject);
    }

    private static boolean overflowsProject(TaskSnapshot task, Instant projectEndDate) {
      Integer duration = task.durationDays();
      if (task.startDate() == null || projectEndDate == null || duration == null || duration <= 0) {
        return false;
      }
      return task.startDate().plus(Duration.ofDays(duration)).isAfter(projectEndDate);
    }
  }
}
