package io.projectdesk.backend.project;

import io.projectdesk.backend.project.ProjectService.ProjectCommand;
import io.projectdesk.backend.project.ProjectService.ProjectDetails;
import io.projectdesk.backend.security.CurrentUser;
import io.projectdesk.backend.user.User;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @GetMapping
  public ResponseEntity<List<ProjectResponse>> listProjects(
      @RequestParam(required = false) String category,
      @RequestParam(required = false) Boolean completed) {
    var projects = projectService.list(CurrentUser.require(), category, completed);
    return ResponseEntity.ok(projects.stream().map(ProjectResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID id) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.get(CurrentUser.require(), id)));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('SUPERVISOR', 'ADMIN')")
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody ProjectRequest request) {
    var details = projectService.create(CurrentUser.require(), request.toCommand());
    return ResponseEntity.created(URI.create("/api/projects/" + details.project().getId()))
        .body(ProjectResponse.from(details));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('SUPERVISOR', 'ADMIN')")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID id, @Valid @RequestBody ProjectRequest request) {
    var details = projectService.update(CurrentUser.require(), id, request.toCommand());
    return ResponseEntity.ok(ProjectResponse.from(details));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('SUPERVISOR', 'ADMIN')")
  public ResponseEntity<Void> deleteProject(@PathVariable UUID id) {
    projectService.delete(CurrentUser.require(), id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/complete")
  @PreAuthorize("hasAnyRole('SUPERVISOR', 'ADMIN')")
  public ResponseEntity<ProjectResponse> completeProject(
      @PathVariable UUID id, @RequestBody(required = false) CompleteRequest request) {
    boolean force = request != null && Boolean.TRUE.equals(request.force());
    return ResponseEntity.ok(
        ProjectResponse.from(projectService.complete(CurrentUser.require(), id, force)));
  }

  @PostMapping("/{id}/reactivate")
  @PreAuthorize("hasAnyRole('SUPERVISOR', 'ADMIN')")
  public ResponseEntity<ProjectResponse> reactivateProject(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ProjectResponse.from(projectService.reactivate(CurrentUser.require(), id)));
  }

  public record ProjectRequest(
      @NotBlank(message = "title is required") @Size(max = 255) String title,
      String description,
      @Size(max = 100) String category,
      Instant startDate,
      Instant endDate,
      List<String> studentEmails,
      List<String> collaboratorEmails) {

    ProjectCommand toCommand() {
      return new ProjectCommand(
          title, description, category, startDate, endDate, studentEmails, collaboratorEmails);
    }
  }

  public record CompleteRequest(Boolean force) {}

  public record MemberResponse(UUID id, String name, String email) {

    static MemberResponse from(User user) {
      return user == null
          ? null
          : new MemberResponse(user.getId(), user.getName(), user.getEmail());
    }
  }

  public record ProjectResponse(
      UUID id,
      String title,
      String description,
      String category,
      Instant startDate,
      Instant endDate,
      boolean completed,
      ProjectStatus status,
      String leadLabel,
      MemberResponse supervisor,
      List<MemberResponse> students,
      List<MemberResponse> collaborators,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(ProjectDetails details) {
      var project = details.project();
      return new ProjectResponse(
          project.getId(),
          project.getTitle(),
          project.getDescription(),
          project.getCategory(),
          project.getStartDate(),
          project.getEndDate(),
          project.isCompleted(),
          project.displayStatus(),
          project.leadLabel(),
          MemberResponse.from(details.supervisor()),
          details.students().stream().map(MemberResponse::from).toList(),
          details.collaborators().stream().map(MemberResponse::from).toList(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }
}
