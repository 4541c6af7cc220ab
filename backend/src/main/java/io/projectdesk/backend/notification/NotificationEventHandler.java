package io.projectdesk.backend.notification;

import io.projectdesk.backend.event.NotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers notification emails once the publishing transaction has committed. A failed delivery is
 * logged and dropped; it never reaches the request that caused it.
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final EmailNotificationService emailNotificationService;

  public NotificationEventHandler(EmailNotificationService emailNotificationService) {
    this.emailNotificationService = emailNotificationService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onNotification(NotificationEvent event) {
    try {
      emailNotificationService.deliver(event);
    } catch (Exception e) {
      log.warn(
          "Failed to deliver '{}' email to {}",
          event.templateName(),
          event.recipientEmail(),
          e);
    }
  }
}
