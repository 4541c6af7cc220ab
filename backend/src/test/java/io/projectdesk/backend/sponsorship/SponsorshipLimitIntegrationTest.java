package io.projectdesk.backend.sponsorship;

import static org.assertj.core.api.Assertions.assertThat;

import io.projectdesk.backend.TestcontainersConfiguration;
import io.projectdesk.backend.exception.SponsorLimitExceededException;
import io.projectdesk.backend.testutil.TestAccounts;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class SponsorshipLimitIntegrationTest {

  private static final int ALREADY_SPONSORED = SponsorshipService.SUPERVISOR_SPONSOR_LIMIT - 2;
  private static final int CONCURRENT_REQUESTS = 5;

  @Autowired private SponsorshipService sponsorshipService;
  @Autowired private UserRepository userRepository;
  @Autowired private PasswordEncoder passwordEncoder;

  @Test
  void concurrentApprovalsNeverExceedLimit() throws Exception {
    var supervisor =
        TestAccounts.subscribedSupervisor(
            userRepository, passwordEncoder, TestAccounts.uniqueEmail("limit-sup"), null);
    var now = Instant.now();
    var existing = new ArrayList<User>();
    for (int i = 0; i < ALREADY_SPONSORED; i++) {
      var user =
          User.awaitingSponsorship(
              "existing " + i,
              TestAccounts.uniqueEmail("existing"),
              null,
              UserRole.STUDENT,
              supervisor.getId(),
              now);
      user.approveSponsorship(supervisor.getId(), now);
      existing.add(user);
    }
    userRepository.saveAllAndFlush(existing);

    var pending = new ArrayList<User>();
    for (int i = 0; i < CONCURRENT_REQUESTS; i++) {
      pending.add(
          TestAccounts.awaitingSponsorship(
              userRepository,
              passwordEncoder,
              TestAccounts.uniqueEmail("pending"),
              UserRole.COLLABORATOR,
              supervisor.getId()));
    }

    var start = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(CONCURRENT_REQUESTS);
    var outcomes = new ArrayList<Future<User>>();
    try {
      for (var target : pending) {
        Callable<User> approve =
            () -> {
              start.await();
              return sponsorshipService.sponsor(supervisor.getId(), target.getId());
            };
        outcomes.add(executor.submit(approve));
      }
      start.countDown();

      int approved = 0;
      var failures = new ArrayList<Throwable>();
      for (var outcome : outcomes) {
        try {
          outcome.get(30, TimeUnit.SECONDS);
          approved++;
        } catch (ExecutionException e) {
          failures.add(e.getCause());
        }
      }

      assertThat(approved).isEqualTo(2);
      assertThat(failures)
          .hasSize(CONCURRENT_REQUESTS - 2)
          .allSatisfy(
              failure -> assertThat(failure).isInstanceOf(SponsorLimitExceededException.class));
    } finally {
      executor.shutdownNow();
    }

    assertThat(userRepository.countBySponsorId(supervisor.getId()))
        .isEqualTo(SponsorshipService.SUPERVISOR_SPONSOR_LIMIT);
    List<User> overview = sponsorshipService.getOverview(supervisor.getId()).sponsored();
    assertThat(overview).hasSize(SponsorshipService.SUPERVISOR_SPONSOR_LIMIT);
  }
}
