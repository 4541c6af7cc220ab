package io.projectdesk.backend.project;

import static org.assertj.core.api.Assertions.assertThat;

import io.projectdesk.backend.task.TaskStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProjectStatusEngineTest {

  private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");
  private static final Instant PROJECT_END = NOW.plus(Duration.ofDays(30));

  private final ProjectStatusEngine engine = new ProjectStatusEngine();

  @Test
  void evaluate_noTasks_notStarted() {
    assertThat(engine.evaluate(List.of(), PROJECT_END, NOW)).isEqualTo(ProjectStatus.NOT_STARTED);
  }

  @Test
  void evaluate_allTasksComplete_completed() {
    var tasks =
        List.of(
            task(TaskStatus.COMPLETE, NOW.minus(Duration.ofDays(10))),
            task(TaskStatus.COMPLETE, null));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.COMPLETED);
  }

  @Test
  void evaluate_allTasksInFuture_onTrack() {
    var tasks =
        List.of(
            task(TaskStatus.TODO, NOW.plus(Duration.ofDays(2))),
            task(TaskStatus.IN_PROGRESS, NOW.plus(Duration.ofDays(5))),
            task(TaskStatus.COMPLETE, NOW.minus(Duration.ofDays(3))));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.ON_TRACK);
  }

  @Test
  void evaluate_tasksWithoutDates_onTrack() {
    var tasks = List.of(task(TaskStatus.TODO, null), task(TaskStatus.BLOCKED, null));

    assertThat(engine.evaluate(tasks, null, NOW)).isEqualTo(ProjectStatus.ON_TRACK);
  }

  @Test
  void evaluate_oneSchedulableTaskPastDue_atRisk() {
    var tasks =
        List.of(
            task(TaskStatus.TODO, NOW.minus(Duration.ofHours(2))),
            task(TaskStatus.IN_PROGRESS, NOW.plus(Duration.ofDays(2))));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.AT_RISK);
  }

  @Test
  void evaluate_twoSchedulableTasksPastDue_danger() {
    var tasks =
        List.of(
            task(TaskStatus.TODO, NOW.minus(Duration.ofHours(2))),
            task(TaskStatus.BEHIND_SCHEDULE, NOW.minus(Duration.ofHours(5))));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.DANGER);
  }

  @Test
  void evaluate_blockedTaskOverdueByMoreThanADay_behindSchedule() {
    var tasks = List.of(task(TaskStatus.BLOCKED, NOW.minus(Duration.ofHours(25))));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.BEHIND_SCHEDULE);
  }

  @Test
  void evaluate_atRiskTaskPastDueWithinGrace_onTrack() {
    var tasks = List.of(task(TaskStatus.AT_RISK, NOW.minus(Duration.ofHours(23))));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.ON_TRACK);
  }

  @Test
  void evaluate_singleTodoOverdueByMoreThanADay_atRiskWinsOverBehindSchedule() {
    var tasks = List.of(task(TaskStatus.TODO, NOW.minus(Duration.ofHours(25))));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.AT_RISK);
  }

  @Test
  void evaluate_durationRunsPastProjectEnd_danger() {
    var overflowing =
        new TaskSnapshot(TaskStatus.TODO, PROJECT_END.minus(Duration.ofDays(2)), null, 5);

    assertThat(engine.evaluate(List.of(overflowing), PROJECT_END, NOW))
        .isEqualTo(ProjectStatus.DANGER);
  }

  @Test
  void evaluate_durationEndingOnProjectEnd_onTrack() {
    var fitting =
        new TaskSnapshot(TaskStatus.TODO, PROJECT_END.minus(Duration.ofDays(5)), null, 5);

    assertThat(engine.evaluate(List.of(fitting), PROJECT_END, NOW))
        .isEqualTo(ProjectStatus.ON_TRACK);
  }

  @Test
  void evaluate_zeroDurationIgnored_onTrack() {
    var zero = new TaskSnapshot(TaskStatus.TODO, PROJECT_END.plus(Duration.ofDays(1)), null, 0);

    assertThat(engine.evaluate(List.of(zero), PROJECT_END, NOW)).isEqualTo(ProjectStatus.ON_TRACK);
  }

  @Test
  void evaluate_taskDueAfterProjectEnd_danger() {
    var tasks = List.of(task(TaskStatus.IN_PROGRESS, PROJECT_END.plus(Duration.ofDays(1))));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.DANGER);
  }

  @Test
  void evaluate_completedTaskDueAfterProjectEnd_ignored() {
    var tasks =
        List.of(
            task(TaskStatus.COMPLETE, PROJECT_END.plus(Duration.ofDays(1))),
            task(TaskStatus.TODO, NOW.plus(Duration.ofDays(1))));

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(ProjectStatus.ON_TRACK);
  }

  @Test
  void evaluate_noProjectEndDate_skipsProjectBoundRules() {
    var tasks =
        List.of(new TaskSnapshot(TaskStatus.TODO, NOW, NOW.plus(Duration.ofDays(400)), 365));

    assertThat(engine.evaluate(tasks, null, NOW)).isEqualTo(ProjectStatus.ON_TRACK);
  }

  @Test
  void evaluate_isDeterministicAndIgnoresTaskOrder() {
    var tasks = new ArrayList<TaskSnapshot>();
    tasks.add(task(TaskStatus.TODO, NOW.minus(Duration.ofHours(2))));
    tasks.add(task(TaskStatus.COMPLETE, NOW.minus(Duration.ofDays(4))));
    tasks.add(task(TaskStatus.BLOCKED, NOW.minus(Duration.ofDays(3))));

    var first = engine.evaluate(tasks, PROJECT_END, NOW);
    var reversed = new ArrayList<>(tasks);
    Collections.reverse(reversed);

    assertThat(engine.evaluate(tasks, PROJECT_END, NOW)).isEqualTo(first);
    assertThat(engine.evaluate(reversed, PROJECT_END, NOW)).isEqualTo(first);
    assertThat(first).isEqualTo(ProjectStatus.AT_RISK);
  }

  private static TaskSnapshot task(TaskStatus status, Instant dueDate) {
    return new TaskSnapshot(status, null, dueDate, null);
  }
}
