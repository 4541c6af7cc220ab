package io.projectdesk.backend.task;

import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceConflictException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.project.Project;
import io.projectdesk.backend.project.ProjectAccessService;
import io.projectdesk.backend.project.ProjectStatusService;
import io.projectdesk.backend.security.AuthenticatedUser;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Task CRUD within a project. Every mutation recomputes the owning project's status in the same
 * transaction.
 */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final ProjectAccessService accessService;
  private final ProjectStatusService statusService;

  public TaskService(
      TaskRepository taskRepository,
      ProjectAccessService accessService,
      ProjectStatusService statusService) {
    this.taskRepository = taskRepository;
    this.accessService = accessService;
    this.statusService = statusService;
  }

  /** Task fields as received. {@code status} is the client's spelling, parsed here. */
  public record TaskCommand(
      String title,
      String description,
      String status,
      Instant startDate,
      Instant dueDate,
      Integer durationDays,
      List<UUID> assigneeIds) {}

  @Transactional
  public List<Task> listTasks(AuthenticatedUser caller, UUID projectId) {
    var project = accessService.requireViewable(projectId, caller);
    statusService.recompute(project);
    return taskRepository.findByProjectId(projectId);
  }

  @Transactional
  public Task createTask(AuthenticatedUser caller, UUID projectId, TaskCommand command) {
    var project = accessService.requireViewable(projectId, caller);
    String title = requireTitle(command.title());
    if (taskRepository.existsByProjectIdAndTitleIgnoreCase(projectId, title)) {
      throw duplicateTitle(title);
    }

    var task =
        new Task(
            projectId,
            title,
            command.description(),
            parseStatus(command.status()),
            caller.userId());
    applySchedule(task, command);
    task.assignTo(requireAssignable(project, command.assigneeIds()));
    task = taskRepository.save(task);

    statusService.recompute(project);
    log.info("Created task {} in project {}", task.getId(), projectId);
    return task;
  }

  @Transactional
  public Task updateTask(AuthenticatedUser caller, UUID taskId, TaskCommand command) {
    var task = requireTask(taskId);
    var project = accessService.requireViewable(task.getProjectId(), caller);
    String title = requireTitle(command.title());
    if (taskRepository.existsByProjectIdAndTitleIgnoreCaseAndIdNot(
        task.getProjectId(), title, taskId)) {
      throw duplicateTitle(title);
    }

    task.update(title, command.description(), parseStatus(command.status()));
    applySchedule(task, command);
    if (command.assigneeIds() != null) {
      task.assignTo(requireAssignable(project, command.assigneeIds()));
    }

    statusService.recompute(project);
    log.info("Updated task {}", taskId);
    return task;
  }

  @Transactional
  public void deleteTask(AuthenticatedUser caller, UUID taskId) {
    var task = requireTask(taskId);
    var project = accessService.requireManageable(task.getProjectId(), caller);
    taskRepository.delete(task);
    statusService.recompute(project);
    log.info("Deleted task {} from project {}", taskId, project.getId());
  }

  /** Flags or unflags the task for attention, recording who raised the flag. */
  @Transactional
  public Task toggleFlag(AuthenticatedUser caller, UUID taskId) {
    var task = requireTask(taskId);
    accessService.requireViewable(task.getProjectId(), caller);
    task.toggleFlag(caller.userId());
    log.info("Task {} flagged={} by user {}", taskId, task.isFlagged(), caller.userId());
    return task;
  }

  private Task requireTask(UUID taskId) {
    return taskRepository
        .findById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  private static void applySchedule(Task task, TaskCommand command) {
    if (command.durationDays() != null && command.durationDays() < 0) {
      throw new InvalidStateException("Invalid task", "Duration cannot be negative");
    }
    task.reschedule(command.startDate(), command.dueDate(), command.durationDays());
  }

  /** Assignees must be the project's supervisor or one of its members. */
  private static Collection<UUID> requireAssignable(Project project, List<UUID> assigneeIds) {
    var assignees = new LinkedHashSet<UUID>();
    if (assigneeIds == null) {
      return assignees;
    }
    for (UUID id : assigneeIds) {
      if (!id.equals(project.getSupervisorId()) && !project.hasMember(id)) {
        throw new InvalidStateException(
            "Invalid assignee", "Assignees must be members of the project");
      }
      assignees.add(id);
    }
    return assignees;
  }

  static TaskStatus parseStatus(String status) {
    if (status == null || status.isBlank()) {
      return null;
    }
    try {
      return TaskStatus.fromExternal(status);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid task", "Unknown task status: " + status);
    }
  }

  private static String requireTitle(String title) {
    if (title == null || title.isBlank()) {
      throw new InvalidStateException("Invalid task", "Title is required");
    }
    return title.trim();
  }

  private static ResourceConflictException duplicateTitle(String title) {
    return new ResourceConflictException(
        "Duplicate task", "A task named \"" + title + "\" already exists in this project");
  }
}
