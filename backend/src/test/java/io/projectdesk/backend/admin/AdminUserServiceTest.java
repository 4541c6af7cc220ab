package io.projectdesk.backend.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.projectdesk.backend.auth.EmailVerificationTokenRepository;
import io.projectdesk.backend.billing.RedirectFlowRepository;
import io.projectdesk.backend.exception.BillingProviderException;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.exception.ResourceConflictException;
import io.projectdesk.backend.exception.ResourceNotFoundException;
import io.projectdesk.backend.integration.billing.BillingProvider;
import io.projectdesk.backend.project.Project;
import io.projectdesk.backend.project.ProjectRepository;
import io.projectdesk.backend.project.ProjectUpdateRepository;
import io.projectdesk.backend.task.Task;
import io.projectdesk.backend.task.TaskRepository;
import io.projectdesk.backend.task.TaskStatus;
import io.projectdesk.backend.testutil.TestUsers;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AdminUserServiceTest {

  private static final Instant NOW = Instant.now();

  @Mock private UserRepository userRepository;
  @Mock private ProjectRepository projectRepository;
  @Mock private TaskRepository taskRepository;
  @Mock private ProjectUpdateRepository projectUpdateRepository;
  @Mock private EmailVerificationTokenRepository tokenRepository;
  @Mock private RedirectFlowRepository redirectFlowRepository;
  @Mock private BillingProvider billingProvider;

  private AdminUserService service;
  private final UUID adminId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    service =
        new AdminUserService(
            userRepository,
            projectRepository,
            taskRepository,
            projectUpdateRepository,
            tokenRepository,
            redirectFlowRepository,
            billingProvider);
  }

  @Test
  void updateUser_nothingGiven_rejected() {
    assertThatThrownBy(() -> service.updateUser(UUID.randomUUID(), null, null, null))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("No updates provided");
    verifyNoInteractions(userRepository);
  }

  @Test
  void updateUser_appliesRoleNameAndNormalizedEmail() {
    var user = TestUsers.supervisor("old@example.com", NOW);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

    service.updateUser(user.getId(), "collaborator", "  New Name ", " New@Example.COM ");

    assertThat(user.getRole()).isEqualTo(UserRole.COLLABORATOR);
    assertThat(user.getName()).isEqualTo("New Name");
    assertThat(user.getEmail()).isEqualTo("new@example.com");
  }

  @Test
  void updateUser_emailTaken_conflict() {
    var user = TestUsers.supervisor("old@example.com", NOW);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    when(userRepository.existsByEmail("taken@example.com")).thenReturn(true);

    assertThatThrownBy(() -> service.updateUser(user.getId(), null, null, "taken@example.com"))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(user.getEmail()).isEqualTo("old@example.com");
  }

  @Test
  void updateUser_unknownRole_rejected() {
    var user = TestUsers.supervisor("old@example.com", NOW);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

    assertThatThrownBy(() -> service.updateUser(user.getId(), "owner", null, null))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Unknown role: owner");
  }

  @Test
  void overrideSubscription_setsTypeAndExpiry() {
    var user = TestUsers.supervisor("sup@example.com", NOW);
    var expiry = NOW.plus(Duration.ofDays(365));
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

    service.overrideSubscription(user.getId(), "admin-approved", expiry);

    assertThat(user.getSubscriptionType()).isEqualTo(SubscriptionType.ADMIN_APPROVED);
    assertThat(user.getSubscriptionExpiresAt()).isEqualTo(expiry);
  }

  @Test
  void overrideSubscription_unknownType_rejected() {
    assertThatThrownBy(() -> service.overrideSubscription(UUID.randomUUID(), "lifetime", null))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Unknown subscription type: lifetime");
  }

  @Test
  void deleteUser_self_rejected() {
    assertThatThrownBy(() -> service.deleteUser(adminId, adminId))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("You cannot delete your own account");
  }

  @Test
  void deleteUser_missing_notFound() {
    var missing = UUID.randomUUID();
    when(userRepository.findById(missing)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteUser(adminId, missing))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void deleteUser_supervisingProjects_conflict() {
    var user = TestUsers.supervisor("sup@example.com", NOW);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    when(projectRepository.existsBySupervisorId(user.getId())).thenReturn(true);

    assertThatThrownBy(() -> service.deleteUser(adminId, user.getId()))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("User supervises projects");
    verify(userRepository, never()).delete(any());
  }

  @Test
  void deleteUser_sponsoringAccounts_conflict() {
    var user = TestUsers.subscribedSupervisor("sup@example.com", NOW);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    when(userRepository.existsBySponsorId(user.getId())).thenReturn(true);

    assertThatThrownBy(() -> service.deleteUser(adminId, user.getId()))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("User sponsors accounts");
    verifyNoInteractions(billingProvider);
  }

  @Test
  void deleteUser_removesReferencesThenAccount() {
    var user = TestUsers.sponsored("stu@example.com", UserRole.STUDENT, UUID.randomUUID(), NOW);
    var project = new Project("Thesis", null, "student-project", null, null, UUID.randomUUID());
    project.replaceMembers(List.of(user.getId()), List.of());
    var task = new Task(UUID.randomUUID(), "Draft", null, TaskStatus.TODO, UUID.randomUUID());
    task.assignTo(List.of(user.getId()));
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    when(projectRepository.findByMember(user.getId())).thenReturn(List.of(project));
    when(taskRepository.findByAssignee(user.getId())).thenReturn(List.of(task));

    service.deleteUser(adminId, user.getId());

    assertThat(project.hasMember(user.getId())).isFalse();
    assertThat(task.isAssignedTo(user.getId())).isFalse();
    verifyNoInteractions(billingProvider);
    var order =
        inOrder(
            taskRepository,
            projectUpdateRepository,
            tokenRepository,
            redirectFlowRepository,
            userRepository);
    order.verify(taskRepository).clearFlagsRaisedBy(user.getId());
    order.verify(projectUpdateRepository).deleteByAuthorId(user.getId());
    order.verify(userRepository).clearSupervisor(eq(user.getId()), any(Instant.class));
    order.verify(tokenRepository).deleteByUserId(user.getId());
    order.verify(redirectFlowRepository).deleteByUserId(user.getId());
    order.verify(userRepository).delete(user);
  }

  @Test
  void deleteUser_releasesPendingSponsorshipRequests() {
    var supervisor = TestUsers.supervisor("sup@example.com", NOW);
    var pending =
        TestUsers.awaitingSponsorship(
            "stu@example.com", UserRole.STUDENT, supervisor.getId(), NOW);
    when(userRepository.findById(supervisor.getId())).thenReturn(Optional.of(supervisor));
    when(userRepository.findPendingSponsorshipRequests(supervisor.getId()))
        .thenReturn(List.of(pending));

    service.deleteUser(adminId, supervisor.getId());

    assertThat(pending.getSupervisorId()).isNull();
    assertThat(pending.getSubscriptionType()).isEqualTo(SubscriptionType.FREE_TRIAL);
    verify(userRepository).delete(supervisor);
  }

  @Test
  void deleteUser_billingCancellationFailure_stillDeletes() {
    var user = TestUsers.subscribedSupervisor("sup@example.com", NOW);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    doThrow(new BillingProviderException("GoCardless unavailable"))
        .when(billingProvider)
        .cancelSubscription(anyString());

    service.deleteUser(adminId, user.getId());

    verify(billingProvider).cancelSubscription(user.getGoCardlessSubscriptionId());
    verify(billingProvider).cancelMandate(user.getGoCardlessMandateId());
    verify(userRepository).delete(user);
  }
}
