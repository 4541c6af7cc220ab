package io.projectdesk.backend.project;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.projectdesk.backend.project.ProjectController.MemberResponse;
import io.projectdesk.backend.project.ProjectUpdateService.UpdateCommand;
import io.projectdesk.backend.project.ProjectUpdateService.UpdateDetails;
import io.projectdesk.backend.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/updates")
public class ProjectUpdateController {

  private final ProjectUpdateService updateService;

  public ProjectUpdateController(ProjectUpdateService updateService) {
    this.updateService = updateService;
  }

  @GetMapping
  public ResponseEntity<List<UpdateResponse>> listUpdates(@PathVariable UUID projectId) {
    var updates = updateService.list(CurrentUser.require(), projectId);
    return ResponseEntity.ok(updates.stream().map(UpdateResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<UpdateResponse> postUpdate(
      @PathVariable UUID projectId, @Valid @RequestBody UpdateRequest request) {
    var details =
        updateService.post(
            CurrentUser.require(),
            projectId,
            new UpdateCommand(request.title(), request.description(), request.notifyAllMembers()));
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/updates/" + details.update().getId()))
        .body(UpdateResponse.from(details));
  }

  public record UpdateRequest(
      @Size(max = 255) String title, String description,
      @JsonProperty("notifyAll") Boolean notifyAllMembers) {}

  public record UpdateResponse(
      UUID id,
      UUID projectId,
      String title,
      String description,
      @JsonProperty("notifyAll") boolean notifyAllMembers,
      MemberResponse author,
      Instant createdAt) {

    static UpdateResponse from(UpdateDetails details) {
      var update = details.update();
      return new UpdateResponse(
          update.getId(),
          update.getProjectId(),
          update.getTitle(),
          update.getDescription(),
          update.isNotifyAll(),
          MemberResponse.from(details.author()),
          update.getCreatedAt());
    }
  }
}
