package io.projectdesk.backend.project;

import io.projectdesk.backend.exception.ForbiddenException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.security.AuthenticatedUser;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Project-level authorization. A project the caller cannot see is reported as missing; a visible
 * project the caller may not change is reported as forbidden.
 */
@Service
public class ProjectAccessService {

  private final ProjectRepository projectRepository;

  public ProjectAccessService(ProjectRepository projectRepository) {
    this.projectRepository = projectRepository;
  }

  public Project requireViewable(UUID projectId, AuthenticatedUser caller) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    if (!canView(project, caller)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
    return project;
  }

  /** Project details and membership: the project's supervisor or an admin. */
  public Project requireManageable(UUID projectId, AuthenticatedUser caller) {
    var project = requireViewable(projectId, caller);
    if (!canManage(project, caller)) {
      throw new ForbiddenException(
          "Cannot modify project", "Only the project supervisor can change this project");
    }
    return project;
  }

  public boolean canView(Project project, AuthenticatedUser caller) {
    return canManage(project, caller) || project.hasMember(caller.userId());
  }

  public boolean canManage(Project project, AuthenticatedUser caller) {
    return caller.isAdmin() || caller.userId().equals(project.getSupervisorId());
  }
}
