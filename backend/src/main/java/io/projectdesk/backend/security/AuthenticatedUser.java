package io.projectdesk.backend.security;

import io.projectdesk.backend.user.UserRole;
import java.util.UUID;

/** Principal installed by {@link SessionAuthFilter} for a verified session token. */
public record AuthenticatedUser(UUID userId, String email, UserRole role) {

  public boolean isAdmin() {
    return role == UserRole.ADMIN;
  }
}
