package io.projectdesk.backend.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Account holder. Besides identity and credentials it carries the subscription and sponsorship
 * fields read by the authentication gate. Every subscription transition goes through one of the
 * lifecycle methods below so the field combinations stay consistent.
 */
@Entity
@Table(name = "users")
public class User {

  public static final Duration FREE_TRIAL_LENGTH = Duration.ofDays(8);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "email", nullable = false, unique = true)
  private String email;

  @Column(name = "password_hash")
  private String passwordHash;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private UserRole role;

  @Column(name = "email_verified_at")
  private Instant emailVerifiedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "subscription_type", nullable = false, length = 20)
  private SubscriptionType subscriptionType;

  @Column(name = "subscription_started_at")
  private Instant subscriptionStartedAt;

  @Column(name = "subscription_expires_at")
  private Instant subscriptionExpiresAt;

  @Column(name = "sponsor_id")
  private UUID sponsorId;

  @Column(name = "supervisor_id")
  private UUID supervisorId;

  @Column(name = "sponsor_subscription_inactive", nullable = false)
  private boolean sponsorSubscriptionInactive;

  @Column(name = "gocardless_customer_id")
  private String goCardlessCustomerId;

  @Column(name = "gocardless_mandate_id")
  private String goCardlessMandateId;

  @Column(name = "gocardless_subscription_id")
  private String goCardlessSubscriptionId;

  @Column(name = "gocardless_subscription_status", length = 50)
  private String goCardlessSubscriptionStatus;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected User() {}

  private User(String name, String email, String passwordHash, UserRole role, Instant now) {
    this.name = name;
    this.email = email;
    this.passwordHash = passwordHash;
    this.role = role;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** A supervisor signing up starts an eight day free trial. */
  public static User supervisor(String name, String email, String passwordHash, Instant now) {
    var user = new User(name, email, passwordHash, UserRole.SUPERVISOR, now);
    user.subscriptionType = SubscriptionType.FREE_TRIAL;
    user.subscriptionStartedAt = now;
    user.subscriptionExpiresAt = now.plus(FREE_TRIAL_LENGTH);
    return user;
  }

  /**
   * A student or collaborator signing up is SPONSORED but has no sponsor yet: the named
   * supervisor has to approve the request before the account can log in.
   */
  public static User awaitingSponsorship(
      String name,
      String email,
      String passwordHash,
      UserRole role,
      UUID supervisorId,
      Instant now) {
    if (!role.isSponsorable()) {
      throw new IllegalArgumentException("Only students and collaborators can be sponsored");
    }
    var user = new User(name, email, passwordHash, role, now);
    user.subscriptionType = SubscriptionType.SPONSORED;
    user.subscriptionStartedAt = now;
    user.supervisorId = supervisorId;
    return user;
  }

  /**
   * Account created on someone's behalf when they are invited to a project. It has no password
   * until the invitee claims it by signing up with the same email.
   */
  public static User invited(String name, String email, UserRole role, Instant now) {
    var user = new User(name, email, null, role, now);
    user.subscriptionType = SubscriptionType.SPONSORED;
    user.subscriptionStartedAt = now;
    return user;
  }

  // --- Lifecycle ---

  public void markEmailVerified(Instant now) {
    if (this.emailVerifiedAt == null) {
      this.emailVerifiedAt = now;
      this.updatedAt = now;
    }
  }

  /** Billing set-up completed: the account now pays for itself. */
  public void activateSubscription(
      String customerId,
      String mandateId,
      String subscriptionId,
      String providerStatus,
      Instant now) {
    this.goCardlessCustomerId = customerId;
    this.goCardlessMandateId = mandateId;
    this.goCardlessSubscriptionId = subscriptionId;
    markSubscriptionActive(providerStatus, now);
  }

  /** Provider reports the subscription as active. */
  public void markSubscriptionActive(String providerStatus, Instant now) {
    this.subscriptionType = SubscriptionType.SUBSCRIBED;
    this.subscriptionStartedAt = now;
    this.subscriptionExpiresAt = null;
    this.goCardlessSubscriptionStatus = providerStatus;
    this.updatedAt = now;
  }

  /**
   * Subscription ended, whether cancelled by the user or terminated by the provider. An account
   * that is already CANCELLED keeps the time it first ended.
   */
  public void cancelSubscription(String providerStatus, Instant now) {
    endSubscription(now);
    this.goCardlessSubscriptionStatus = providerStatus;
    this.updatedAt = now;
  }

  /** The payment mandate is gone, so no subscription can be collected any more. */
  public void revokeMandate(Instant now) {
    this.goCardlessMandateId = null;
    endSubscription(now);
    this.updatedAt = now;
  }

  private void endSubscription(Instant now) {
    if (subscriptionType != SubscriptionType.CANCELLED || subscriptionExpiresAt == null) {
      this.subscriptionExpiresAt = now;
    }
    this.subscriptionType = SubscriptionType.CANCELLED;
  }

  public void recordSubscriptionStatus(String providerStatus, Instant now) {
    this.goCardlessSubscriptionStatus = providerStatus;
    this.updatedAt = now;
  }

  /**
   * Converts a SUBSCRIBED account whose paid period has lapsed to CANCELLED.
   *
   * @return true if the account was converted
   */
  public boolean expireLapsedSubscription(Instant now) {
    if (subscriptionType == SubscriptionType.SUBSCRIBED
        && subscriptionExpiresAt != null
        && subscriptionExpiresAt.isBefore(now)) {
      this.subscriptionType = SubscriptionType.CANCELLED;
      this.updatedAt = now;
      return true;
    }
    return false;
  }

  /** Links this account to the sponsor paying for it. */
  public void approveSponsorship(UUID sponsorId, Instant now) {
    if (!role.isSponsorable()) {
      throw new IllegalStateException("Only students and collaborators can be sponsored");
    }
    this.subscriptionType = SubscriptionType.SPONSORED;
    this.sponsorId = sponsorId;
    this.supervisorId = sponsorId;
    this.subscriptionExpiresAt = null;
    this.sponsorSubscriptionInactive = false;
    this.updatedAt = now;
  }

  /**
   * Drops the sponsor and supervisor links and puts the account on an already-expired free trial,
   * which locks it out until someone sponsors it again.
   */
  public void releaseSponsorship(Instant now) {
    this.subscriptionType = SubscriptionType.FREE_TRIAL;
    this.sponsorId = null;
    this.supervisorId = null;
    this.subscriptionExpiresAt = now;
    this.updatedAt = now;
  }

  /** Direct admin override of the subscription fields. No other field is touched. */
  public void overrideSubscription(SubscriptionType type, Instant expiresAt, Instant now) {
    this.subscriptionType = type;
    this.subscriptionExpiresAt = expiresAt;
    this.updatedAt = now;
  }

  public void changeRole(UserRole role, Instant now) {
    this.role = role;
    this.updatedAt = now;
  }

  public void updateProfile(String name, String email, Instant now) {
    if (name != null) {
      this.name = name;
    }
    if (email != null) {
      this.email = email;
    }
    this.updatedAt = now;
  }

  /** Invitee signs up with the invited email: sets their own name and password. */
  public void claimInvitation(String name, String passwordHash, Instant now) {
    if (!isInvitationPending()) {
      throw new IllegalStateException("Account has already been claimed");
    }
    this.name = name;
    this.passwordHash = passwordHash;
    this.updatedAt = now;
  }

  public void changePasswordHash(String passwordHash, Instant now) {
    this.passwordHash = passwordHash;
    this.updatedAt = now;
  }

  // --- Queries ---

  /** Created through a project invitation and not signed up for yet. */
  public boolean isInvitationPending() {
    return passwordHash == null;
  }

  public boolean isEmailVerified() {
    return emailVerifiedAt != null;
  }

  public boolean isAwaitingSponsorship() {
    return subscriptionType == SubscriptionType.SPONSORED && sponsorId == null;
  }

  public boolean isTrialExpired(Instant now) {
    return subscriptionType == SubscriptionType.FREE_TRIAL
        && subscriptionExpiresAt != null
        && subscriptionExpiresAt.isBefore(now);
  }

  public boolean canSponsorAccounts() {
    return subscriptionType.canSponsorAccounts();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public String getPasswordHash() {
    return passwordHash;
  }

  public UserRole getRole() {
    return role;
  }

  public Instant getEmailVerifiedAt() {
    return emailVerifiedAt;
  }

  public SubscriptionType getSubscriptionType() {
    return subscriptionType;
  }

  public Instant getSubscriptionStartedAt() {
    return subscriptionStartedAt;
  }

  public Instant getSubscriptionExpiresAt() {
    return subscriptionExpiresAt;
  }

  public UUID getSponsorId() {
    return sponsorId;
  }

  public UUID getSupervisorId() {
    return supervisorId;
  }

  public boolean isSponsorSubscriptionInactive() {
    return sponsorSubscriptionInactive;
  }

  public String getGoCardlessCustomerId() {
    return goCardlessCustomerId;
  }

  public String getGoCardlessMandateId() {
    return goCardlessMandateId;
  }

  public String getGoCardlessSubscriptionId() {
    return goCardlessSubscriptionId;
  }

  public String getGoCardlessSubscriptionStatus() {
    return goCardlessSubscriptionStatus;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
