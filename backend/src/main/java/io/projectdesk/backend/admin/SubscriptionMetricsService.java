package io.projectdesk.backend.admin;

import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Aggregates for the admin subscription dashboard. */
@Service
public class SubscriptionMetricsService {

  static final Duration TRIAL_WINDOW = Duration.ofDays(7);
  static final int LIST_LIMIT = 6;

  private final UserRepository userRepository;

  public SubscriptionMetricsService(UserRepository userRepository) {
    this.userRepository = userRepository;
  }

  public record Totals(
      long totalUsers,
      long activeSubscribers,
      long freeTrials,
      long sponsoredAccounts,
      long cancelledAccounts) {}

  public record TrialEnding(
      UUID id, String name, String email, Instant subscriptionExpiresAt, long daysRemaining) {}

  public record CancelledSupervisor(UUID id, String name, String email, String providerStatus) {}

  public record SponsorAlertUser(
      UUID id, String name, String email, String role, String sponsorName, String sponsorEmail) {}

  public record SponsorAlerts(long impactedCount, List<SponsorAlertUser> users) {}

  public record SubscriptionMetrics(
      Map<SubscriptionType, Long> summary,
      Totals totals,
      List<TrialEnding> freeTrialsEndingSoon,
      List<CancelledSupervisor> cancelledSupervisors,
      SponsorAlerts sponsorAlerts,
      Map<String, Long> providerStatusCounts) {}

  @Transactional(readOnly = true)
  public SubscriptionMetrics collect() {
    var now = Instant.now();

    var summary = new EnumMap<SubscriptionType, Long>(SubscriptionType.class);
    for (var type : SubscriptionType.values()) {
      summary.put(type, 0L);
    }
    for (Object[] row : userRepository.countBySubscriptionType()) {
      summary.put((SubscriptionType) row[0], ((Number) row[1]).longValue());
    }
    long total = summary.values().stream().mapToLong(Long::longValue).sum();
    long active =
        summary.get(SubscriptionType.SUBSCRIBED) + summary.get(SubscriptionType.ADMIN_APPROVED);
    var totals =
        new Totals(
            total,
            active,
            summary.get(SubscriptionType.FREE_TRIAL),
            summary.get(SubscriptionType.SPONSORED),
            summary.get(SubscriptionType.CANCELLED));

    var trials =
        userRepository.findTrialsEndingBetween(now, now.plus(TRIAL_WINDOW)).stream()
            .limit(LIST_LIMIT)
            .map(
                user ->
                    new TrialEnding(
                        user.getId(),
                        user.getName(),
                        user.getEmail(),
                        user.getSubscriptionExpiresAt(),
                        daysRemaining(user.getSubscriptionExpiresAt(), now)))
            .toList();

    var cancelled =
        userRepository.findCancelledSupervisors().stream()
            .limit(LIST_LIMIT)
            .map(
                user ->
                    new CancelledSupervisor(
                        user.getId(),
                        user.getName(),
                        user.getEmail(),
                        user.getGoCardlessSubscriptionStatus()))
            .toList();

    var alertUsers =
        userRepository.findTop6BySponsorSubscriptionInactiveTrueOrderByCreatedAtDesc().stream()
            .map(this::toAlert)
            .toList();
    var alerts =
        new SponsorAlerts(userRepository.countBySponsorSubscriptionInactiveTrue(), alertUsers);

    var statusCounts = new LinkedHashMap<String, Long>();
    for (Object[] row : userRepository.countByGoCardlessSubscriptionStatus()) {
      statusCounts.put((String) row[0], ((Number) row[1]).longValue());
    }

    return new SubscriptionMetrics(summary, totals, trials, cancelled, alerts, statusCounts);
  }

  private SponsorAlertUser toAlert(User user) {
    User sponsor =
        user.getSponsorId() != null
            ? userRepository.findById(user.getSponsorId()).orElse(null)
            : null;
    return new SponsorAlertUser(
        user.getId(),
        user.getName(),
        user.getEmail(),
        user.getRole().name(),
        sponsor != null ? sponsor.getName() : null,
        sponsor != null ? sponsor.getEmail() : null);
  }

  static long daysRemaining(Instant expiresAt, Instant now) {
    long millis = Duration.between(now, expiresAt).toMillis();
    long dayMillis = Duration.ofDays(1).toMillis();
    return Math.max(0L, Math.floorDiv(millis + dayMillis - 1, dayMillis));
  }
}
