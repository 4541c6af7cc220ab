package io.projectdesk.backend.support;

import io.projectdesk.backend.event.ContactRequestSubmittedEvent;
import io.projectdesk.backend.event.SupportTicketConfirmationEvent;
import io.projectdesk.backend.event.SupportTicketSubmittedEvent;
import io.projectdesk.backend.exception.EmailDeliveryException;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.notification.EmailNotificationService;
import io.projectdesk.backend.security.AuthenticatedUser;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import java.time.Clock;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Relays support tickets and contact requests to the support inbox. Nothing is stored; the
 * generated reference is the only handle on a request. Mail is sent synchronously because the
 * caller needs to know whether the support inbox got it.
 */
@Service
public class SupportService {

  private static final Logger log = LoggerFactory.getLogger(SupportService.class);

  static final String DEFAULT_CONTACT_TYPE = "Contact";
  static final Set<String> CONTACT_TYPES =
      Set.of("Issue", "Bug report", "Billing query", "Custom pricing", "Partnership", "Other");

  private final EmailNotificationService emailNotificationService;
  private final UserRepository userRepository;
  private final String supportAddress;
  private final Clock clock;

  @Autowired
  public SupportService(
      EmailNotificationService emailNotificationService,
      UserRepository userRepository,
      @Value("${projectdesk.support.address:support@projectdesk.app}") String supportAddress) {
    this(emailNotificationService, userRepository, supportAddress, Clock.systemUTC());
  }

  SupportService(
      EmailNotificationService emailNotificationService,
      UserRepository userRepository,
      String supportAddress,
      Clock clock) {
    this.emailNotificationService = emailNotificationService;
    this.userRepository = userRepository;
    this.supportAddress = supportAddress;
    this.clock = clock;
  }

  public record ContactCommand(String name, String email, String type, String description) {}

  /**
   * Sends the ticket to support, then a confirmation to the reporter. Only the first mail decides
   * the outcome: a ticket that reached support is not reported as failed.
   *
   * @return the ticket reference
   */
  public String submitTicket(AuthenticatedUser caller, String title, String description) {
    if (isBlank(title) || isBlank(description)) {
      throw new InvalidStateException(
          "Invalid support ticket", "Title and description are required");
    }
    String reporterName =
        userRepository
            .findById(caller.userId())
            .map(User::getName)
            .filter(name -> !name.isBlank())
            .orElse(caller.email());
    String reference = createReference("T");

    boolean sent =
        emailNotificationService.deliver(
            new SupportTicketSubmittedEvent(
                reference,
                title.trim(),
                description.trim(),
                reporterName,
                caller.email(),
                supportAddress));
    if (!sent) {
      throw new EmailDeliveryException("Unable to send support ticket");
    }
    var confirmation =
        new SupportTicketConfirmationEvent(reference, title.trim(), reporterName, caller.email());
    if (!emailNotificationService.deliver(confirmation)) {
      log.warn("Support ticket {} logged but confirmation to {} failed", reference, caller.email());
    }
    log.info("Support ticket {} raised by user {}", reference, caller.userId());
    return reference;
  }

  /**
   * Forwards a contact form to support. Field lengths and the email format are checked at the
   * controller; the type and the arithmetic check are checked here.
   *
   * @return the contact reference
   */
  public String submitContact(ContactCommand command, CaptchaAnswer captcha) {
    String type = isBlank(command.type()) ? DEFAULT_CONTACT_TYPE : command.type().trim();
    if (!DEFAULT_CONTACT_TYPE.equals(type) && !CONTACT_TYPES.contains(type)) {
      throw new InvalidStateException("Invalid contact request", "Contact type is invalid");
    }
    if (captcha == null || !captcha.isCorrect()) {
      throw new InvalidStateException("Invalid contact request", "Captcha validation failed");
    }
    String reference = createReference("C");
    boolean sent =
        emailNotificationService.deliver(
            new ContactRequestSubmittedEvent(
                reference,
                type,
                command.name().trim(),
                command.email().trim(),
                command.description().trim(),
                supportAddress));
    if (!sent) {
      throw new EmailDeliveryException("Unable to send message");
    }
    log.info("Contact request {} ({}) forwarded to support", reference, type);
    return reference;
  }

  /** Prefix, base-36 timestamp and four random base-36 characters, upper case. */
  String createReference(String prefix) {
    String timestamp = Long.toString(clock.millis(), 36);
    var random = new StringBuilder(4);
    for (int i = 0; i < 4; i++) {
      random.append(Character.forDigit(ThreadLocalRandom.current().nextInt(36), 36));
    }
    return (prefix + "-" + timestamp + random).toUpperCase(Locale.ROOT);
  }

  /** Answer to the form's addition question. */
  public record CaptchaAnswer(Double first, Double second, Double answer) {

    boolean isCorrect() {
      if (first == null || second == null || answer == null) {
        return false;
      }
      if (!Double.isFinite(first) || !Double.isFinite(second) || !Double.isFinite(answer)) {
        return false;
      }
      return Double.compare(first + second, answer) == 0;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
