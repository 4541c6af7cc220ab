package io.projectdesk.backend.notification;

import io.projectdesk.backend.event.ContactRequestSubmittedEvent;
import io.projectdesk.backend.event.EmailVerificationRequestedEvent;
import io.projectdesk.backend.event.NotificationEvent;
import io.projectdesk.backend.event.ProjectInvitationEvent;
import io.projectdesk.backend.event.ProjectUpdatePostedEvent;
import io.projectdesk.backend.event.SponsorRenewalRequestedEvent;
import io.projectdesk.backend.event.SponsorshipApprovedEvent;
import io.projectdesk.backend.event.SponsorshipDeclinedEvent;
import io.projectdesk.backend.event.SponsorshipRequestedEvent;
import io.projectdesk.backend.event.SupportTicketConfirmationEvent;
import io.projectdesk.backend.event.SupportTicketSubmittedEvent;
import io.projectdesk.backend.integration.email.EmailMessage;
import io.projectdesk.backend.integration.email.EmailProvider;
import io.projectdesk.backend.integration.email.EmailRateLimiter;
import io.projectdesk.backend.notification.template.EmailTemplateRenderer;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Turns notification events into rendered emails and hands them to the {@link EmailProvider}. */
@Service
public class EmailNotificationService {

  private static final Logger log = LoggerFactory.getLogger(EmailNotificationService.class);

  private final EmailProvider emailProvider;
  private final EmailTemplateRenderer templateRenderer;
  private final EmailRateLimiter rateLimiter;
  private final String baseUrl;

  public EmailNotificationService(
      EmailProvider emailProvider,
      EmailTemplateRenderer templateRenderer,
      EmailRateLimiter rateLimiter,
      @Value("${projectdesk.app.base-url}") String baseUrl) {
    this.emailProvider = emailProvider;
    this.templateRenderer = templateRenderer;
    this.rateLimiter = rateLimiter;
    this.baseUrl = baseUrl;
  }

  /**
   * Renders and sends the email for an event.
   *
   * @return true if the provider accepted the message
   */
  public boolean deliver(NotificationEvent event) {
    if (!rateLimiter.tryAcquire(event.rateLimitKey())) {
      log.warn(
          "Email rate limit reached for {}, dropping '{}'",
          event.rateLimitKey(),
          event.templateName());
      return false;
    }

    var rendered = templateRenderer.render(event.templateName(), buildContext(event));
    var result =
        emailProvider.sendEmail(
            EmailMessage.of(event.recipientEmail(), rendered, event.replyTo()));
    if (!result.success()) {
      log.warn(
          "Email '{}' to {} was not sent: {}",
          event.templateName(),
          event.recipientEmail(),
          result.errorMessage());
      return false;
    }
    log.info(
        "Sent '{}' email to {} via {}",
        event.templateName(),
        event.recipientEmail(),
        emailProvider.providerId());
    return true;
  }

  Map<String, Object> buildContext(NotificationEvent event) {
    var context = new HashMap<String, Object>();
    context.put("appUrl", baseUrl);
    if (event instanceof EmailVerificationRequestedEvent e) {
      context.put("subject", "Verify your ProjectDesk email address");
      context.put("recipientName", e.recipientName());
      context.put("verifyUrl", baseUrl + "/verify-email?token=" + encode(e.token()));
    } else if (event instanceof SponsorshipRequestedEvent e) {
      context.put("subject", e.requesterName() + " requested sponsorship");
      context.put("recipientName", e.recipientName());
      context.put("requesterName", e.requesterName());
      context.put("requesterEmail", e.requesterEmail());
      context.put("requesterRole", e.requesterRole().toLowerCase(Locale.ROOT));
      context.put("reviewUrl", baseUrl + "/supervisor");
    } else if (event instanceof SponsorshipApprovedEvent e) {
      context.put("subject", "Your ProjectDesk account has been approved");
      context.put("recipientName", e.recipientName());
      context.put("sponsorName", e.sponsorName());
      context.put("signInUrl", baseUrl + "/signin");
    } else if (event instanceof SponsorshipDeclinedEvent e) {
      context.put("subject", "Your sponsorship request was declined");
      context.put("recipientName", e.recipientName());
      context.put("supervisorName", e.supervisorName());
    } else if (event instanceof ProjectInvitationEvent e) {
      context.put("subject", "You have been added to " + e.projectTitle());
      context.put("recipientName", e.recipientName());
      context.put("projectTitle", e.projectTitle());
      context.put("leadLabel", e.leadLabel());
      context.put("inviterName", e.inviterName());
      context.put("memberRole", e.memberRole().toLowerCase(Locale.ROOT));
      context.put("newAccount", e.newAccount());
      context.put("projectUrl", baseUrl + "/projects/" + e.projectId());
    } else if (event instanceof ProjectUpdatePostedEvent e) {
      context.put(
          "subject", "New project update: " + e.updateTitle() + " (" + e.projectTitle() + ")");
      context.put("recipientName", e.recipientName());
      context.put("authorName", e.authorName());
      context.put("projectTitle", e.projectTitle());
      context.put("updateTitle", e.updateTitle());
      context.put("updateDescription", e.updateDescription());
      context.put("projectUrl", baseUrl + "/projects/" + e.projectId());
    } else if (event instanceof SupportTicketSubmittedEvent e) {
      context.put("subject", "Support ticket " + e.reference() + ": " + e.title());
      context.put("reference", e.reference());
      context.put("title", e.title());
      context.put("description", e.description());
      context.put("reporterName", e.reporterName());
      context.put("reporterEmail", e.reporterEmail());
    } else if (event instanceof SupportTicketConfirmationEvent e) {
      context.put("subject", "We've logged your ticket (" + e.reference() + ")");
      context.put("recipientName", e.recipientName());
      context.put("reference", e.reference());
      context.put("title", e.title());
    } else if (event instanceof ContactRequestSubmittedEvent e) {
      context.put("subject", "Contact request: " + e.contactType());
      context.put("reference", e.reference());
      context.put("contactType", e.contactType());
      context.put("senderName", e.senderName());
      context.put("senderEmail", e.senderEmail());
      context.put("description", e.description());
    } else if (event instanceof SponsorRenewalRequestedEvent e) {
      context.put("subject", e.requesterName() + " needs your subscription renewed");
      context.put("recipientName", e.recipientName());
      context.put("requesterName", e.requesterName());
      context.put("requesterEmail", e.requesterEmail());
      context.put("subscriptionUrl", baseUrl + "/supervisor/subscription");
    }
    return context;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
