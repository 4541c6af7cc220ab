package io.projectdesk.backend.project;

import io.projectdesk.backend.event.ProjectInvitationEvent;
import io.projectdesk.backend.exception.ForbiddenException;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceConflictException;
import io.projectdesk.backend.project.ProjectMembershipService.Member;
import io.projectdesk.backend.security.AuthenticatedUser;
import io.projectdesk.backend.task.Task;
import io.projectdesk.backend.task.TaskRepository;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  static final String DEFAULT_CATEGORY = "student-project";
  static final String INCOMPLETE_TASKS_CODE = "INCOMPLETE_TASKS";

  private final ProjectRepository projectRepository;
  private final TaskRepository taskRepository;
  private final UserRepository userRepository;
  private final ProjectAccessService accessService;
  private final ProjectMembershipService membershipService;
  private final ProjectStatusService statusService;
  private final ApplicationEventPublisher eventPublisher;

  public ProjectService(
      ProjectRepository projectRepository,
      TaskRepository taskRepository,
      UserRepository userRepository,
      ProjectAccessService accessService,
      ProjectMembershipService membershipService,
      ProjectStatusService statusService,
      ApplicationEventPublisher eventPublisher) {
    this.projectRepository = projectRepository;
    this.taskRepository = taskRepository;
    this.userRepository = userRepository;
    this.accessService = accessService;
    this.membershipService = membershipService;
    this.statusService = statusService;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Project fields plus member emails. On update a null email list leaves that side of the
   * membership unchanged; an empty list clears it.
   */
  public record ProjectCommand(
      String title,
      String description,
      String category,
      Instant startDate,
      Instant endDate,
      List<String> studentEmails,
      List<String> collaboratorEmails) {}

  /** A project with its people resolved. */
  public record ProjectDetails(
      Project project, User supervisor, List<User> students, List<User> collaborators) {}

  @Transactional
  public ProjectDetails create(AuthenticatedUser caller, ProjectCommand command) {
    if (!caller.role().canSupervise()) {
      throw new ForbiddenException(
          "Cannot create project", "Only supervisors can create projects");
    }
    var project =
        projectRepository.save(
            new Project(
                requireTitle(command.title()),
                command.description(),
                categoryOrDefault(command.category()),
                command.startDate(),
                command.endDate(),
                caller.userId()));

    var members =
        membershipService.resolveAndSponsor(
            command.studentEmails(), command.collaboratorEmails(), project.getSupervisorId());
    project.replaceMembers(members.studentIds(), members.collaboratorIds());
    statusService.recompute(project);

    publishInvitations(project, members.all(), caller.userId());
    log.info("Created project {} for supervisor {}", project.getId(), project.getSupervisorId());
    return describe(project);
  }

  @Transactional
  public ProjectDetails update(AuthenticatedUser caller, UUID projectId, ProjectCommand command) {
    var project = accessService.requireManageable(projectId, caller);
    project.update(
        requireTitle(command.title()),
        command.description(),
        command.category() != null ? command.category() : project.getCategory(),
        command.startDate(),
        command.endDate());

    if (command.studentEmails() != null || command.collaboratorEmails() != null) {
      Set<UUID> previous = new HashSet<>(project.getStudentIds());
      previous.addAll(project.getCollaboratorIds());

      var members =
          membershipService.resolveAndSponsor(
              command.studentEmails() != null
                  ? command.studentEmails()
                  : emailsOf(project.getStudentIds()),
              command.collaboratorEmails() != null
                  ? command.collaboratorEmails()
                  : emailsOf(project.getCollaboratorIds()),
              project.getSupervisorId());
      project.replaceMembers(members.studentIds(), members.collaboratorIds());

      var added =
          members.all().stream()
              .filter(member -> !previous.contains(member.user().getId()))
              .toList();
      publishInvitations(project, added, caller.userId());
    }

    statusService.recompute(project);
    log.info("Updated project {}", projectId);
    return describe(project);
  }

  /** Projects visible to the caller, each non-completed one with a freshly derived status. */
  @Transactional
  public List<ProjectDetails> list(AuthenticatedUser caller, String category, Boolean completed) {
    Collection<Project> visible;
    if (caller.isAdmin()) {
      visible = projectRepository.findAllOrdered();
    } else {
      var byId = new LinkedHashMap<UUID, Project>();
      projectRepository.findBySupervisorId(caller.userId()).forEach(p -> byId.put(p.getId(), p));
      projectRepository.findByMember(caller.userId()).forEach(p -> byId.putIfAbsent(p.getId(), p));
      visible = byId.values();
    }

    var projects =
        visible.stream()
            .filter(p -> category == null || category.equalsIgnoreCase(p.getCategory()))
            .filter(p -> completed == null || completed == p.isCompleted())
            .sorted(
                Comparator.comparing(
                        Project::getEndDate, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(Project::getTitle, String.CASE_INSENSITIVE_ORDER))
            .toList();
    projects.forEach(statusService::recompute);
    return describeAll(projects);
  }

  @Transactional
  public ProjectDetails get(AuthenticatedUser caller, UUID projectId) {
    var project = accessService.requireViewable(projectId, caller);
    statusService.recompute(project);
    return describe(project);
  }

  @Transactional
  public void delete(AuthenticatedUser caller, UUID projectId) {
    var project = accessService.requireManageable(projectId, caller);
    taskRepository.deleteAll(taskRepository.findByProjectId(projectId));
    projectRepository.delete(project);
    log.info("Deleted project {}", projectId);
  }

  /**
   * Marks the project completed. Outstanding tasks block completion unless {@code force} is set,
   * in which case they are completed along with the project.
   */
  @Transactional
  public ProjectDetails complete(AuthenticatedUser caller, UUID projectId, boolean force) {
    var project = accessService.requireManageable(projectId, caller);
    if (project.isCompleted()) {
      throw new InvalidStateException("Invalid project state", "Project is already completed");
    }
    var outstanding = taskRepository.findOutstandingByProjectId(projectId);
    if (!outstanding.isEmpty() && !force) {
      throw new ResourceConflictException(
          "Incomplete tasks",
          "Project has " + outstanding.size() + " incomplete task(s)",
          Map.of("code", INCOMPLETE_TASKS_CODE, "tasks", summarize(outstanding)));
    }
    outstanding.forEach(Task::markComplete);
    project.complete();
    log.info(
        "Completed project {} ({} outstanding tasks closed)", projectId, outstanding.size());
    return describe(project);
  }

  @Transactional
  public ProjectDetails reactivate(AuthenticatedUser caller, UUID projectId) {
    var project = accessService.requireManageable(projectId, caller);
    project.reactivate();
    statusService.recompute(project);
    log.info("Reactivated project {}", projectId);
    return describe(project);
  }

  private void publishInvitations(Project project, List<Member> invited, UUID inviterId) {
    if (invited.isEmpty()) {
      return;
    }
    String inviterName =
        userRepository.findById(inviterId).map(User::getName).orElse("Your supervisor");
    for (var member : invited) {
      var user = member.user();
      eventPublisher.publishEvent(
          new ProjectInvitationEvent(
              project.getId(),
              project.getTitle(),
              project.leadLabel(),
              inviterName,
              user.getEmail(),
              user.getName(),
              member.memberRole().name(),
              member.newAccount()));
    }
  }

  private List<String> emailsOf(Collection<UUID> userIds) {
    return userRepository.findAllById(userIds).stream().map(User::getEmail).toList();
  }

  private static List<Map<String, Object>> summarize(List<Task> tasks) {
    var summaries = new ArrayList<Map<String, Object>>();
    for (var task : tasks) {
      var summary = new LinkedHashMap<String, Object>();
      summary.put("id", task.getId());
      summary.put("title", task.getTitle());
      summary.put("status", task.getStatus().name());
      summaries.add(summary);
    }
    return summaries;
  }

  ProjectDetails describe(Project project) {
    return describeAll(List.of(project)).get(0);
  }

  private List<ProjectDetails> describeAll(List<Project> projects) {
    var ids = new HashSet<UUID>();
    for (var project : projects) {
      ids.add(project.getSupervisorId());
      ids.addAll(project.getStudentIds());
      ids.addAll(project.getCollaboratorIds());
    }
    Map<UUID, User> users =
        userRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(User::getId, Function.identity()));
    return projects.stream()
        .map(
            project ->
                new ProjectDetails(
                    project,
                    users.get(project.getSupervisorId()),
                    lookup(project.getStudentIds(), users),
                    lookup(project.getCollaboratorIds(), users)))
        .toList();
  }

  private static List<User> lookup(Collection<UUID> ids, Map<UUID, User> users) {
    return ids.stream()
        .map(users::get)
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(User::getName, String.CASE_INSENSITIVE_ORDER))
        .toList();
  }

  private static String requireTitle(String title) {
    if (title == null || title.isBlank()) {
      throw new InvalidStateException("Invalid project", "Title is required");
    }
    return title.trim();
  }

  private static String categoryOrDefault(String category) {
    return category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
  }
}
