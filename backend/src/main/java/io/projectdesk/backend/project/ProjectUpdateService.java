package io.projectdesk.backend.project;

import io.projectdesk.backend.event.ProjectUpdatePostedEvent;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.security.AuthenticatedUser;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Progress updates on a project. Anyone who can see the project can read and post updates; posting
 * notifies the rest of the team by email unless the author opts out.
 */
@Service
public class ProjectUpdateService {

  private static final Logger log = LoggerFactory.getLogger(ProjectUpdateService.class);

  private final ProjectUpdateRepository updateRepository;
  private final UserRepository userRepository;
  private final ProjectAccessService accessService;
  private final ApplicationEventPublisher eventPublisher;

  public ProjectUpdateService(
      ProjectUpdateRepository updateRepository,
      UserRepository userRepository,
      ProjectAccessService accessService,
      ApplicationEventPublisher eventPublisher) {
    this.updateRepository = updateRepository;
    this.userRepository = userRepository;
    this.accessService = accessService;
    this.eventPublisher = eventPublisher;
  }

  /** {@code notifyAllMembers} defaults to true when absent. */
  public record UpdateCommand(String title, String description, Boolean notifyAllMembers) {}

  /** An update with its author resolved; the author is null once the account is gone. */
  public record UpdateDetails(ProjectUpdate update, User author) {}

  /** Updates of a project, newest first. */
  @Transactional(readOnly = true)
  public List<UpdateDetails> list(AuthenticatedUser caller, UUID projectId) {
    accessService.requireViewable(projectId, caller);
    var updates = updateRepository.findByProjectIdOrderByCreatedAtDesc(projectId);
    if (updates.isEmpty()) {
      return List.of();
    }
    var authorIds = updates.stream().map(ProjectUpdate::getAuthorId).collect(Collectors.toSet());
    Map<UUID, User> authors =
        userRepository.findAllById(authorIds).stream()
            .collect(Collectors.toMap(User::getId, Function.identity()));
    return updates.stream()
        .map(update -> new UpdateDetails(update, authors.get(update.getAuthorId())))
        .toList();
  }

  @Transactional
  public UpdateDetails post(AuthenticatedUser caller, UUID projectId, UpdateCommand command) {
    String title = trimToNull(command.title());
    if (title == null) {
      throw new InvalidStateException("Invalid update", "Update title is required");
    }
    var project = accessService.requireViewable(projectId, caller);
    boolean notifyAll = !Boolean.FALSE.equals(command.notifyAllMembers());

    var update =
        updateRepository.save(
            new ProjectUpdate(
                project.getId(),
                caller.userId(),
                title,
                trimToNull(command.description()),
                notifyAll));
    var author = userRepository.findById(caller.userId()).orElse(null);

    if (notifyAll) {
      notifyTeam(project, update, author, caller.userId());
    }
    log.info("User {} posted update {} on project {}", caller.userId(), update.getId(), projectId);
    return new UpdateDetails(update, author);
  }

  private void notifyTeam(Project project, ProjectUpdate update, User author, UUID authorId) {
    var recipientIds = new LinkedHashSet<UUID>();
    recipientIds.add(project.getSupervisorId());
    recipientIds.addAll(project.getStudentIds());
    recipientIds.addAll(project.getCollaboratorIds());
    recipientIds.remove(authorId);
    if (recipientIds.isEmpty()) {
      return;
    }

    String authorName = author != null ? author.getName() : "A team member";
    int notified = 0;
    for (var recipient : userRepository.findAllById(recipientIds)) {
      if (recipient.getEmail() == null || recipient.getEmail().isBlank()) {
        continue;
      }
      eventPublisher.publishEvent(
          new ProjectUpdatePostedEvent(
              project.getId(),
              project.getTitle(),
              update.getTitle(),
              update.getDescription(),
              authorName,
              recipient.getEmail(),
              recipient.getName()));
      notified++;
    }
    log.debug("Update {} notifies {} team members", update.getId(), notified);
  }

  private static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
