package io.projectdesk.backend.security;

/**
 * Authority naming. Account roles from {@code UserRole} are granted with this prefix, which is what
 * {@code hasRole(...)} in {@code @PreAuthorize} expects.
 */
public final class Roles {

  public static final String AUTHORITY_PREFIX = "ROLE_";

  private Roles() {}
}
