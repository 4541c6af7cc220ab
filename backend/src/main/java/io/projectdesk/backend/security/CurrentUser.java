package io.projectdesk.backend.security;

import java.util.UUID;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/** Reads the authenticated principal bound to the current request. */
public final class CurrentUser {

  private CurrentUser() {}

  /** Returns the current principal. Throws if the request is not authenticated. */
  public static AuthenticatedUser require() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth != null && auth.getPrincipal() instanceof AuthenticatedUser user) {
      return user;
    }
    throw new AuthenticationCredentialsNotFoundException("No authenticated user bound");
  }

  public static UUID requireUserId() {
    return require().userId();
  }
}
