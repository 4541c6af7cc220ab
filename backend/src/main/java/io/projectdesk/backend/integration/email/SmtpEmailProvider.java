package io.projectdesk.backend.integration.email;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP-based email provider that sends emails via {@link JavaMailSender}. Only active when {@code
 * spring.mail.host} is configured.
 */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public SmtpEmailProvider(
      JavaMailSender mailSender,
      @Value("${projectdesk.email.sender-address}") String senderAddress) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      populateMessage(helper, message);
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return new SendResult(true, messageId, null);
    } catch (MailException | MessagingException e) {
      log.error("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }

  private void populateMessage(MimeMessageHelper helper, EmailMessage message)
      throws MessagingException {
    if (message.htmlBody() == null && message.plainTextBody() == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
    helper.setFrom(senderAddress);
    helper.setTo(message.to());
    helper.setSubject(message.subject());
    if (message.htmlBody() != null && message.plainTextBody() != null) {
      helper.setText(message.plainTextBody(), message.htmlBody());
    } else if (message.htmlBody() != null) {
      helper.setText(message.htmlBody(), true);
    } else {
      helper.setText(message.plainTextBody(), false);
    }
    if (message.replyTo() != null) {
      helper.setReplyTo(message.replyTo());
    }
  }
}
