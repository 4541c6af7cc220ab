package io.projectdesk.backend.task;

import io.projectdesk.backend.security.CurrentUser;
import io.projectdesk.backend.task.TaskService.TaskCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping("/api/projects/{projectId}/tasks")
  public ResponseEntity<List<TaskResponse>> listTasks(@PathVariable UUID projectId) {
    var tasks = taskService.listTasks(CurrentUser.require(), projectId);
    return ResponseEntity.ok(tasks.stream().map(TaskResponse::from).toList());
  }

  @PostMapping("/api/projects/{projectId}/tasks")
  public ResponseEntity<TaskResponse> createTask(
      @PathVariable UUID projectId, @Valid @RequestBody TaskRequest request) {
    var task = taskService.createTask(CurrentUser.require(), projectId, request.toCommand());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.getId()))
        .body(TaskResponse.from(task));
  }

  @PutMapping("/api/tasks/{id}")
  public ResponseEntity<TaskResponse> updateTask(
      @PathVariable UUID id, @Valid @RequestBody TaskRequest request) {
    var task = taskService.updateTask(CurrentUser.require(), id, request.toCommand());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @DeleteMapping("/api/tasks/{id}")
  public ResponseEntity<Void> deleteTask(@PathVariable UUID id) {
    taskService.deleteTask(CurrentUser.require(), id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/tasks/{id}/flag")
  public ResponseEntity<TaskResponse> toggleFlag(@PathVariable UUID id) {
    return ResponseEntity.ok(TaskResponse.from(taskService.toggleFlag(CurrentUser.require(), id)));
  }

  public record TaskRequest(
      @NotBlank(message = "title is required") @Size(max = 255) String title,
      String description,
      String status,
      Instant startDate,
      Instant dueDate,
      @PositiveOrZero Integer durationDays,
      List<UUID> assigneeIds) {

    TaskCommand toCommand() {
      return new TaskCommand(
          title, description, status, startDate, dueDate, durationDays, assigneeIds);
    }
  }

  public record TaskResponse(
      UUID id,
      UUID projectId,
      String title,
      String description,
      TaskStatus status,
      Instant startDate,
      Instant dueDate,
      Integer durationDays,
      boolean flagged,
      UUID flaggedBy,
      Set<UUID> assigneeIds,
      UUID createdBy,
      Instant createdAt,
      Instant updatedAt) {

    public static TaskResponse from(Task task) {
      return new TaskResponse(
          task.getId(),
          task.getProjectId(),
          task.getTitle(),
          task.getDescription(),
          task.getStatus(),
          task.getStartDate(),
          task.getDueDate(),
          task.getDurationDays(),
          task.isFlagged(),
          task.getFlaggedBy(),
          Set.copyOf(task.getAssigneeIds()),
          task.getCreatedBy(),
          task.getCreatedAt(),
          task.getUpdatedAt());
    }
  }
}
