package io.projectdesk.backend.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.projectdesk.backend.event.ContactRequestSubmittedEvent;
import io.projectdesk.backend.event.NotificationEvent;
import io.projectdesk.backend.event.SupportTicketConfirmationEvent;
import io.projectdesk.backend.event.SupportTicketSubmittedEvent;
import io.projectdesk.backend.exception.EmailDeliveryException;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.notification.EmailNotificationService;
import io.projectdesk.backend.security.AuthenticatedUser;
import io.projectdesk.backend.support.SupportService.CaptchaAnswer;
import io.projectdesk.backend.support.SupportService.ContactCommand;
import io.projectdesk.backend.testutil.TestUsers;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SupportServiceTest {

  private static final String SUPPORT = "support@projectdesk.test";
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
  private static final String TIMESTAMP =
      Long.toString(NOW.toEpochMilli(), 36).toUpperCase(Locale.ROOT);

  @Mock private EmailNotificationService emailNotificationService;
  @Mock private UserRepository userRepository;

  private SupportService service;

  @BeforeEach
  void setUp() {
    service =
        new SupportService(
            emailNotificationService,
            userRepository,
            SUPPORT,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void submitTicket_sendsToSupportThenConfirmsToReporter() {
    var reporter = TestUsers.supervisor("ada@example.com", NOW);
    when(userRepository.findById(reporter.getId())).thenReturn(Optional.of(reporter));
    when(emailNotificationService.deliver(any())).thenReturn(true);

    String reference =
        service.submitTicket(caller(reporter.getId()), " Cannot upload ", " Picker is empty ");

    assertThat(reference).matches("T-" + TIMESTAMP + "[0-9A-Z]{4}");
    var events = ArgumentCaptor.forClass(NotificationEvent.class);
    verify(emailNotificationService, times(2)).deliver(events.capture());

    var ticket = (SupportTicketSubmittedEvent) events.getAllValues().get(0);
    assertThat(ticket.recipientEmail()).isEqualTo(SUPPORT);
    assertThat(ticket.reference()).isEqualTo(reference);
    assertThat(ticket.title()).isEqualTo("Cannot upload");
    assertThat(ticket.description()).isEqualTo("Picker is empty");
    assertThat(ticket.reporterName()).isEqualTo(reporter.getName());
    assertThat(ticket.replyTo()).isEqualTo("ada@example.com");

    var confirmation = (SupportTicketConfirmationEvent) events.getAllValues().get(1);
    assertThat(confirmation.recipientEmail()).isEqualTo("ada@example.com");
    assertThat(confirmation.reference()).isEqualTo(reference);
  }

  @Test
  void submitTicket_unknownUser_namedByEmail() {
    var caller = caller(UUID.randomUUID());
    when(userRepository.findById(caller.userId())).thenReturn(Optional.empty());
    when(emailNotificationService.deliver(any())).thenReturn(true);

    service.submitTicket(caller, "Title", "Body");

    var events = ArgumentCaptor.forClass(NotificationEvent.class);
    verify(emailNotificationService, times(2)).deliver(events.capture());
    assertThat(((SupportTicketSubmittedEvent) events.getAllValues().get(0)).reporterName())
        .isEqualTo("ada@example.com");
  }

  @Test
  void submitTicket_missingDescription_rejected() {
    assertThatThrownBy(() -> service.submitTicket(caller(UUID.randomUUID()), "T", " "))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Title and description are required");
    verifyNoInteractions(emailNotificationService, userRepository);
  }

  @Test
  void submitTicket_supportMailFails_badGatewayWithoutConfirmation() {
    var caller = caller(UUID.randomUUID());
    when(userRepository.findById(caller.userId())).thenReturn(Optional.empty());
    when(emailNotificationService.deliver(any())).thenReturn(false);

    assertThatThrownBy(() -> service.submitTicket(caller, "Title", "Body"))
        .isInstanceOf(EmailDeliveryException.class)
        .hasMessageContaining("Unable to send support ticket");
    verify(emailNotificationService, times(1)).deliver(any());
  }

  @Test
  void submitTicket_confirmationFails_ticketStillLogged() {
    var caller = caller(UUID.randomUUID());
    when(userRepository.findById(caller.userId())).thenReturn(Optional.empty());
    when(emailNotificationService.deliver(any())).thenReturn(true, false);

    assertThat(service.submitTicket(caller, "Title", "Body")).startsWith("T-");
  }

  @Test
  void submitContact_forwardsTrimmedRequestToSupport() {
    when(emailNotificationService.deliver(any())).thenReturn(true);

    String reference =
        service.submitContact(
            new ContactCommand(" Grace ", " grace@example.com ", "Billing query", " Invoice? "),
            new CaptchaAnswer(3.0, 4.0, 7.0));

    assertThat(reference).matches("C-" + TIMESTAMP + "[0-9A-Z]{4}");
    var event = ArgumentCaptor.forClass(NotificationEvent.class);
    verify(emailNotificationService).deliver(event.capture());
    var contact = (ContactRequestSubmittedEvent) event.getValue();
    assertThat(contact.recipientEmail()).isEqualTo(SUPPORT);
    assertThat(contact.contactType()).isEqualTo("Billing query");
    assertThat(contact.senderName()).isEqualTo("Grace");
    assertThat(contact.senderEmail()).isEqualTo("grace@example.com");
    assertThat(contact.description()).isEqualTo("Invoice?");
    assertThat(contact.rateLimitKey()).isEqualTo("grace@example.com");
  }

  @Test
  void submitContact_withoutType_usesDefault() {
    when(emailNotificationService.deliver(any())).thenReturn(true);

    service.submitContact(contact(null), new CaptchaAnswer(1.0, 1.0, 2.0));

    var event = ArgumentCaptor.forClass(NotificationEvent.class);
    verify(emailNotificationService).deliver(event.capture());
    assertThat(((ContactRequestSubmittedEvent) event.getValue()).contactType())
        .isEqualTo("Contact");
  }

  @Test
  void submitContact_unknownType_rejected() {
    assertThatThrownBy(
            () -> service.submitContact(contact("Sales"), new CaptchaAnswer(1.0, 1.0, 2.0)))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Contact type is invalid");
    verifyNoInteractions(emailNotificationService);
  }

  @Test
  void submitContact_wrongOrMissingCaptcha_rejected() {
    assertThatThrownBy(
            () -> service.submitContact(contact("Other"), new CaptchaAnswer(2.0, 2.0, 5.0)))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Captcha validation failed");
    assertThatThrownBy(() -> service.submitContact(contact("Other"), null))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(
            () -> service.submitContact(contact("Other"), new CaptchaAnswer(2.0, null, 4.0)))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(emailNotificationService);
  }

  @Test
  void submitContact_mailFails_badGateway() {
    when(emailNotificationService.deliver(any())).thenReturn(false);

    assertThatThrownBy(
            () -> service.submitContact(contact("Issue"), new CaptchaAnswer(1.0, 2.0, 3.0)))
        .isInstanceOf(EmailDeliveryException.class)
        .hasMessageContaining("Unable to send message");
  }

  private static ContactCommand contact(String type) {
    return new ContactCommand("Grace", "grace@example.com", type, "Hello");
  }

  private static AuthenticatedUser caller(UUID userId) {
    return new AuthenticatedUser(userId, "ada@example.com", UserRole.SUPERVISOR);
  }
}
