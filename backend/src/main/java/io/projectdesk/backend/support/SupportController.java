package io.projectdesk.backend.support;

import io.projectdesk.backend.security.CurrentUser;
import io.projectdesk.backend.support.SupportService.CaptchaAnswer;
import io.projectdesk.backend.support.SupportService.ContactCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/support")
public class SupportController {

  private final SupportService supportService;

  public SupportController(SupportService supportService) {
    this.supportService = supportService;
  }

  @PostMapping("/ticket")
  public ResponseEntity<SupportResponse> submitTicket(@RequestBody TicketRequest request) {
    String reference =
        supportService.submitTicket(CurrentUser.require(), request.title(), request.description());
    return ResponseEntity.ok(new SupportResponse(true, reference));
  }

  @PostMapping("/contact")
  public ResponseEntity<SupportResponse> submitContact(@Valid @RequestBody ContactRequest request) {
    String reference =
        supportService.submitContact(
            new ContactCommand(
                request.name(), request.email(), request.type(), request.description()),
            request.captcha());
    return ResponseEntity.ok(new SupportResponse(true, reference));
  }

  public record TicketRequest(String title, String description) {}

  public record ContactRequest(
      @NotBlank(message = "Name must be 1-120 characters")
          @Size(max = 120, message = "Name must be 1-120 characters")
          String name,
      @NotBlank(message = "A valid email is required")
          @Email(message = "A valid email is required")
          @Size(max = 254, message = "A valid email is required")
          String email,
      String type,
      @NotBlank(message = "Description must be 1-2000 characters")
          @Size(max = 2000, message = "Description must be 1-2000 characters")
          String description,
      CaptchaAnswer captcha) {}

  public record SupportResponse(boolean ok, String reference) {}
}
