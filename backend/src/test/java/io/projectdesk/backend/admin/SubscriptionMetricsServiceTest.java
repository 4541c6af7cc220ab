package io.projectdesk.backend.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.projectdesk.backend.testutil.TestUsers;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubscriptionMetricsServiceTest {

  @Mock private UserRepository userRepository;
  @InjectMocks private SubscriptionMetricsService service;

  @Test
  void collect_fillsMissingTypesAndDerivesTotals() {
    var now = Instant.now();
    var sponsor = TestUsers.subscribedSupervisor("sup@example.com", now);
    var impacted = TestUsers.sponsored("stu@example.com", UserRole.STUDENT, sponsor.getId(), now);
    var trialUser = TestUsers.supervisor("trial@example.com", now);
    var counts =
        List.<Object[]>of(
            new Object[] {SubscriptionType.SUBSCRIBED, 3L},
            new Object[] {SubscriptionType.ADMIN_APPROVED, 1L},
            new Object[] {SubscriptionType.FREE_TRIAL, 2L});
    when(userRepository.countBySubscriptionType()).thenReturn(counts);
    when(userRepository.findTrialsEndingBetween(any(), any())).thenReturn(List.of(trialUser));
    when(userRepository.findCancelledSupervisors()).thenReturn(List.of());
    when(userRepository.findTop6BySponsorSubscriptionInactiveTrueOrderByCreatedAtDesc())
        .thenReturn(List.of(impacted));
    when(userRepository.countBySponsorSubscriptionInactiveTrue()).thenReturn(1L);
    when(userRepository.findById(sponsor.getId())).thenReturn(Optional.of(sponsor));
    when(userRepository.countByGoCardlessSubscriptionStatus())
        .thenReturn(List.<Object[]>of(new Object[] {"active", 3L}));

    var metrics = service.collect();

    assertThat(metrics.summary()).containsEntry(SubscriptionType.SPONSORED, 0L);
    assertThat(metrics.totals().totalUsers()).isEqualTo(6L);
    assertThat(metrics.totals().activeSubscribers()).isEqualTo(4L);
    assertThat(metrics.totals().freeTrials()).isEqualTo(2L);
    assertThat(metrics.freeTrialsEndingSoon())
        .singleElement()
        .satisfies(trial -> assertThat(trial.daysRemaining()).isEqualTo(8L));
    assertThat(metrics.sponsorAlerts().impactedCount()).isEqualTo(1L);
    assertThat(metrics.sponsorAlerts().users())
        .singleElement()
        .satisfies(alert -> assertThat(alert.sponsorEmail()).isEqualTo("sup@example.com"));
    assertThat(metrics.providerStatusCounts()).containsEntry("active", 3L);
  }

  @Test
  void daysRemaining_roundsPartialDaysUpAndNeverGoesNegative() {
    var now = Instant.parse("2025-03-01T12:00:00Z");

    assertThat(SubscriptionMetricsService.daysRemaining(now.plus(Duration.ofHours(1)), now))
        .isEqualTo(1L);
    assertThat(SubscriptionMetricsService.daysRemaining(now.plus(Duration.ofDays(2)), now))
        .isEqualTo(2L);
    assertThat(SubscriptionMetricsService.daysRemaining(now.minus(Duration.ofDays(1)), now))
        .isEqualTo(0L);
  }
}
