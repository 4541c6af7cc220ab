package io.projectdesk.backend.user;

/** Single-valued account role. Roles are mutually exclusive. */
public enum UserRole {
  SUPERVISOR,
  STUDENT,
  COLLABORATOR,
  ADMIN;

  /** Roles whose access depends on a supervisor sponsoring them. */
  public boolean isSponsorable() {
    return this == STUDENT || this == COLLABORATOR;
  }

  /** Roles that may be named as a sponsor when a student or collaborator signs up. */
  public boolean canSupervise() {
    return this == SUPERVISOR || this == ADMIN;
  }
}
