package io.projectdesk.backend.user;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRepository extends JpaRepository<User, UUID> {

  Optional<User> findByEmail(String email);

  boolean existsByEmail(String email);

  List<User> findByEmailIn(Collection<String> emails);

  List<User> findAllByOrderByEmailAsc();

  /**
   * Locks the user row for the rest of the transaction. Sponsorship grants lock the sponsor before
   * counting so two concurrent grants cannot both pass the limit check.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT u FROM User u WHERE u.id = :id")
  Optional<User> findByIdForUpdate(@Param("id") UUID id);

  long countBySponsorId(UUID sponsorId);

  boolean existsBySponsorId(UUID sponsorId);

  List<User> findBySponsorIdOrderByNameAsc(UUID sponsorId);

  @Query(
      """
      SELECT u FROM User u
      WHERE u.supervisorId = :supervisorId
        AND u.sponsorId IS NULL
        AND u.subscriptionType = io.projectdesk.backend.user.SubscriptionType.SPONSORED
        AND u.role IN (io.projectdesk.backend.user.UserRole.STUDENT,
                       io.projectdesk.backend.user.UserRole.COLLABORATOR)
      ORDER BY u.createdAt ASC
      """)
  List<User> findPendingSponsorshipRequests(@Param("supervisorId") UUID supervisorId);

  Optional<User> findByGoCardlessSubscriptionId(String subscriptionId);

  Optional<User> findByGoCardlessMandateId(String mandateId);

  /** Flags (or clears) the inactive-sponsor marker on every account the sponsor pays for. */
  @Modifying(flushAutomatically = true)
  @Query(
      """
      UPDATE User u SET u.sponsorSubscriptionInactive = :inactive, u.updatedAt = :now
      WHERE u.sponsorId = :sponsorId
      """)
  int updateSponsorSubscriptionInactive(
      @Param("sponsorId") UUID sponsorId,
      @Param("inactive") boolean inactive,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true)
  @Query("UPDATE User u SET u.supervisorId = NULL, u.updatedAt = :now WHERE u.supervisorId = :id")
  int clearSupervisor(@Param("id") UUID supervisorId, @Param("now") Instant now);

  // --- Metrics ---

  @Query("SELECT u.subscriptionType, COUNT(u) FROM User u GROUP BY u.subscriptionType")
  List<Object[]> countBySubscriptionType();

  @Query(
      """
      SELECT u.goCardlessSubscriptionStatus, COUNT(u) FROM User u
      WHERE u.goCardlessSubscriptionStatus IS NOT NULL
      GROUP BY u.goCardlessSubscriptionStatus
      """)
  List<Object[]> countByGoCardlessSubscriptionStatus();

  @Query(
      """
      SELECT u FROM User u
      WHERE u.role = io.projectdesk.backend.user.UserRole.SUPERVISOR
        AND u.subscriptionType = io.projectdesk.backend.user.SubscriptionType.FREE_TRIAL
        AND u.subscriptionExpiresAt >= :now
        AND u.subscriptionExpiresAt <= :until
      ORDER BY u.subscriptionExpiresAt ASC
      """)
  List<User> findTrialsEndingBetween(@Param("now") Instant now, @Param("until") Instant until);

  @Query(
      """
      SELECT u FROM User u
      WHERE u.role = io.projectdesk.backend.user.UserRole.SUPERVISOR
        AND u.subscriptionType = io.projectdesk.backend.user.SubscriptionType.CANCELLED
      ORDER BY u.subscriptionExpiresAt DESC NULLS LAST
      """)
  List<User> findCancelledSupervisors();

  long countBySponsorSubscriptionInactiveTrue();

  List<User> findTop6BySponsorSubscriptionInactiveTrueOrderByCreatedAtDesc();
}
