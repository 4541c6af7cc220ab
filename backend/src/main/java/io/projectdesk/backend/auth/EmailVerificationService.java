package io.projectdesk.backend.auth;

import io.projectdesk.backend.event.EmailVerificationRequestedEvent;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and consumes email verification tokens. Tokens are 32 random bytes, URL-safe Base64
 * encoded, stored as SHA-256 hashes and valid for 48 hours.
 */
@Service
public class EmailVerificationService {

  private static final Logger log = LoggerFactory.getLogger(EmailVerificationService.class);
  private static final int TOKEN_BYTES = 32;
  static final Duration TOKEN_TTL = Duration.ofHours(48);

  private final EmailVerificationTokenRepository tokenRepository;
  private final UserRepository userRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final SecureRandom secureRandom = new SecureRandom();

  public EmailVerificationService(
      EmailVerificationTokenRepository tokenRepository,
      UserRepository userRepository,
      ApplicationEventPublisher eventPublisher) {
    this.tokenRepository = tokenRepository;
    this.userRepository = userRepository;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Creates a fresh token for the user and queues the verification email. Joins the caller's
   * transaction if there is one; a login attempt has none, so the token is committed even though
   * the attempt is then rejected.
   *
   * @return the raw token
   */
  @Transactional
  public String issueToken(User user) {
    byte[] tokenBytes = new byte[TOKEN_BYTES];
    secureRandom.nextBytes(tokenBytes);
    String rawToken = Base64.getUrlEncoder().withoutPadding().encodeToString(tokenBytes);

    tokenRepository.save(
        new EmailVerificationToken(
            user.getId(), hashToken(rawToken), Instant.now().plus(TOKEN_TTL)));
    eventPublisher.publishEvent(
        new EmailVerificationRequestedEvent(
            user.getId(), user.getEmail(), user.getName(), rawToken));

    log.debug("Issued email verification token for user {}", user.getId());
    return rawToken;
  }

  /**
   * Consumes a token and marks its user's email as verified.
   *
   * @return the verified user's id
   * @throws InvalidStateException if the token is unknown, expired or already used
   */
  @Transactional
  public UUID verify(String rawToken) {
    Instant now = Instant.now();
    var token =
        tokenRepository
            .findByTokenHashForUpdate(hashToken(rawToken))
            .orElseThrow(
                () -> new InvalidStateException("Invalid token", "Verification link is invalid"));
    if (token.isUsed()) {
      throw new InvalidStateException("Invalid token", "Verification link has already been used");
    }
    if (token.isExpired(now)) {
      throw new InvalidStateException("Invalid token", "Verification link has expired");
    }
    token.markUsed(now);

    userRepository
        .findById(token.getUserId())
        .orElseThrow(
            () -> new InvalidStateException("Invalid token", "Verification link is invalid"))
        .markEmailVerified(now);

    log.info("Verified email for user {}", token.getUserId());
    return token.getUserId();
  }

  static String hashToken(String rawToken) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hashBytes = digest.digest(rawToken.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hashBytes);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
