package io.projectdesk.backend.event;

import java.util.UUID;

/**
 * A user was added to a project. {@code newAccount} is true when the account was created for the
 * invitation and the recipient still has to verify it.
 */
public record ProjectInvitationEvent(
    UUID projectId,
    String projectTitle,
    String leadLabel,
    String inviterName,
    String recipientEmail,
    String recipientName,
    String memberRole,
    boolean newAccount)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "project-invitation";
  }
}
