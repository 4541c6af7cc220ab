package io.projectdesk.backend.project;

import io.projectdesk.backend.task.TaskRepository;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Recomputes a project's stored status from its current tasks. */
@Service
public class ProjectStatusService {

  private static final Logger log = LoggerFactory.getLogger(ProjectStatusService.class);

  private final ProjectStatusEngine statusEngine;
  private final TaskRepository taskRepository;

  public ProjectStatusService(ProjectStatusEngine statusEngine, TaskRepository taskRepository) {
    this.statusEngine = statusEngine;
    this.taskRepository = taskRepository;
  }

  /**
   * Derives and stores the status of a project that is not completed. Writing back an unchanged
   * status is a no-op.
   *
   * @return the status the project now displays
   */
  @Transactional
  public ProjectStatus recompute(Project project) {
    if (project.isCompleted()) {
      return project.displayStatus();
    }
    var snapshots =
        taskRepository.findByProjectId(project.getId()).stream().map(TaskSnapshot::from).toList();
    var derived = statusEngine.evaluate(snapshots, project.getEndDate(), Instant.now());
    if (project.applyDerivedStatus(derived)) {
      log.debug("Project {} status changed to {}", project.getId(), derived);
    }
    return derived;
  }
}
