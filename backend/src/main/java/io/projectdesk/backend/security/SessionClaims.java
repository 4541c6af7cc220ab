package io.projectdesk.backend.security;

import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.UserRole;
import java.time.Instant;
import java.util.UUID;

/**
 * Claims carried by a session token. They are a snapshot taken at login; billing and sponsorship
 * changes made afterwards are only visible through a profile fetch or a new login.
 */
public record SessionClaims(
    UUID userId,
    String email,
    UserRole role,
    SubscriptionType subscriptionType,
    Instant subscriptionStartedAt,
    Instant subscriptionExpiresAt,
    UUID sponsorId) {}
