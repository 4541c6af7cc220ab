package io.projectdesk.backend.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.projectdesk.backend.event.ProjectUpdatePostedEvent;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.project.ProjectUpdateService.UpdateCommand;
import io.projectdesk.backend.security.AuthenticatedUser;
import io.projectdesk.backend.testutil.TestUsers;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class ProjectUpdateServiceTest {

  private static final Instant NOW = Instant.now();

  @Mock private ProjectUpdateRepository updateRepository;
  @Mock private ProjectRepository projectRepository;
  @Mock private UserRepository userRepository;
  @Mock private ApplicationEventPublisher eventPublisher;
  @Captor private ArgumentCaptor<Iterable<UUID>> recipientIds;

  private ProjectUpdateService service;
  private User supervisor;
  private User student;
  private User collaborator;
  private Project project;

  @BeforeEach
  void setUp() {
    service =
        new ProjectUpdateService(
            updateRepository,
            userRepository,
            new ProjectAccessService(projectRepository),
            eventPublisher);
    supervisor = TestUsers.subscribedSupervisor("sup@example.com", NOW);
    student = TestUsers.sponsored("stu@example.com", UserRole.STUDENT, supervisor.getId(), NOW);
    collaborator =
        TestUsers.sponsored("col@example.com", UserRole.COLLABORATOR, supervisor.getId(), NOW);
    project = new Project("Thesis", null, "student-project", null, null, supervisor.getId());
    ReflectionTestUtils.setField(project, "id", UUID.randomUUID());
    project.replaceMembers(List.of(student.getId()), List.of(collaborator.getId()));
    lenient().when(projectRepository.findById(project.getId())).thenReturn(Optional.of(project));
  }

  @Test
  void post_blankTitle_rejectedBeforeProjectLookup() {
    var blank = new UpdateCommand("  ", "x", null);

    assertThatThrownBy(() -> service.post(caller(student), project.getId(), blank))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Update title is required");
    verifyNoInteractions(updateRepository, eventPublisher);
    verify(projectRepository, never()).findById(any());
  }

  @Test
  void post_unknownProject_notFound() {
    var missing = UUID.randomUUID();
    when(projectRepository.findById(missing)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.post(caller(student), missing, new UpdateCommand("Week 3", null, null)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(updateRepository, never()).save(any());
  }

  @Test
  void post_outsider_notFound() {
    var outsider =
        new AuthenticatedUser(UUID.randomUUID(), "other@example.com", UserRole.STUDENT);

    assertThatThrownBy(
            () -> service.post(outsider, project.getId(), new UpdateCommand("Week 3", null, null)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(updateRepository, never()).save(any());
  }

  @Test
  void post_notifiesWholeTeamExceptAuthor() {
    givenSavedUpdates();
    when(userRepository.findById(student.getId())).thenReturn(Optional.of(student));
    when(userRepository.findAllById(anyCollection())).thenReturn(List.of(supervisor, collaborator));

    var details =
        service.post(
            caller(student),
            project.getId(),
            new UpdateCommand("  Literature review done ", "   ", null));

    var update = details.update();
    assertThat(update.getTitle()).isEqualTo("Literature review done");
    assertThat(update.getDescription()).isNull();
    assertThat(update.isNotifyAll()).isTrue();
    assertThat(update.getAuthorId()).isEqualTo(student.getId());
    assertThat(details.author()).isSameAs(student);

    verify(userRepository).findAllById(recipientIds.capture());
    assertThat(recipientIds.getValue())
        .containsExactlyInAnyOrder(supervisor.getId(), collaborator.getId());

    var events = ArgumentCaptor.forClass(ProjectUpdatePostedEvent.class);
    verify(eventPublisher, times(2)).publishEvent(events.capture());
    assertThat(events.getAllValues())
        .extracting(
            ProjectUpdatePostedEvent::recipientEmail,
            ProjectUpdatePostedEvent::authorName,
            ProjectUpdatePostedEvent::updateTitle)
        .containsExactlyInAnyOrder(
            tuple("sup@example.com", student.getName(), "Literature review done"),
            tuple("col@example.com", student.getName(), "Literature review done"));
  }

  @Test
  void post_bySupervisor_keepsDescriptionAndSkipsSupervisor() {
    givenSavedUpdates();
    when(userRepository.findById(supervisor.getId())).thenReturn(Optional.of(supervisor));
    when(userRepository.findAllById(anyCollection())).thenReturn(List.of(student, collaborator));

    var details =
        service.post(
            caller(supervisor),
            project.getId(),
            new UpdateCommand("Milestone", " Draft chapter 2 by Friday ", true));

    assertThat(details.update().getDescription()).isEqualTo("Draft chapter 2 by Friday");
    verify(userRepository).findAllById(recipientIds.capture());
    assertThat(recipientIds.getValue())
        .containsExactlyInAnyOrder(student.getId(), collaborator.getId());
    verify(eventPublisher, times(2)).publishEvent(any(ProjectUpdatePostedEvent.class));
  }

  @Test
  void post_notifyAllFalse_savesWithoutEmails() {
    givenSavedUpdates();
    when(userRepository.findById(student.getId())).thenReturn(Optional.of(student));

    var details =
        service.post(caller(student), project.getId(), new UpdateCommand("Quiet", null, false));

    assertThat(details.update().isNotifyAll()).isFalse();
    verify(userRepository, never()).findAllById(anyCollection());
    verifyNoInteractions(eventPublisher);
  }

  @Test
  void list_returnsUpdatesInRepositoryOrderWithAuthors() {
    var newer = new ProjectUpdate(project.getId(), supervisor.getId(), "Newer", null, true);
    var older = new ProjectUpdate(project.getId(), student.getId(), "Older", "details", true);
    var orphan = new ProjectUpdate(project.getId(), UUID.randomUUID(), "Orphan", null, false);
    when(updateRepository.findByProjectIdOrderByCreatedAtDesc(project.getId()))
        .thenReturn(List.of(newer, older, orphan));
    when(userRepository.findAllById(anyCollection())).thenReturn(List.of(supervisor, student));

    var updates = service.list(caller(collaborator), project.getId());

    assertThat(updates)
        .extracting(d -> d.update().getTitle(), ProjectUpdateService.UpdateDetails::author)
        .containsExactly(
            tuple("Newer", supervisor), tuple("Older", student), tuple("Orphan", null));
  }

  @Test
  void list_noUpdates_skipsAuthorLookup() {
    when(updateRepository.findByProjectIdOrderByCreatedAtDesc(project.getId()))
        .thenReturn(List.of());

    assertThat(service.list(caller(student), project.getId())).isEmpty();
    verifyNoInteractions(userRepository);
  }

  @Test
  void list_outsider_notFound() {
    var outsider =
        new AuthenticatedUser(UUID.randomUUID(), "other@example.com", UserRole.COLLABORATOR);

    assertThatThrownBy(() -> service.list(outsider, project.getId()))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(updateRepository);
  }

  private void givenSavedUpdates() {
    when(updateRepository.save(any(ProjectUpdate.class)))
        .thenAnswer(
            invocation -> {
              ProjectUpdate update = invocation.getArgument(0);
              ReflectionTestUtils.setField(update, "id", UUID.randomUUID());
              return update;
            });
  }

  private static AuthenticatedUser caller(User user) {
    return new AuthenticatedUser(user.getId(), user.getEmail(), user.getRole());
  }
}
