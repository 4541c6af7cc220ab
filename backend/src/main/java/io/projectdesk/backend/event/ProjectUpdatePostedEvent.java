package io.projectdesk.backend.event;

import java.util.UUID;

/** Someone posted an update on a project the recipient belongs to. */
public record ProjectUpdatePostedEvent(
    UUID projectId,
    String projectTitle,
    String updateTitle,
    String updateDescription,
    String authorName,
    String recipientEmail,
    String recipientName)
    implements NotificationEvent {

  @Override
  public String templateName() {
    return "project-update-posted";
  }
}
