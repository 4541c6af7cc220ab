package io.projectdesk.backend.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.projectdesk.backend.user.SubscriptionType;
import io.projectdesk.backend.user.UserRole;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 session tokens. The secret must be at least 32 bytes, which is what
 * {@link MACSigner} requires for HS256.
 */
@Service
public class SessionTokenService {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);
  private static final String TOKEN_TYPE = "session";
  private static final int MIN_SECRET_BYTES = 32;

  private final byte[] secret;
  private final Duration ttl;

  public SessionTokenService(
      @Value("${projectdesk.jwt.secret}") String jwtSecret,
      @Value("${projectdesk.jwt.ttl:PT12H}") Duration ttl) {
    this.secret = jwtSecret == null ? new byte[0] : jwtSecret.getBytes(StandardCharsets.UTF_8);
    if (secret.length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "projectdesk.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.ttl = ttl;
  }

  public record IssuedToken(String token, Instant expiresAt) {}

  public IssuedToken issueToken(SessionClaims session) {
    try {
      Instant now = Instant.now();
      Instant expiresAt = now.plus(ttl);
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(session.userId().toString())
              .claim("type", TOKEN_TYPE)
              .claim("email", session.email())
              .claim("role", session.role().name())
              .claim("subscriptionType", session.subscriptionType().name())
              .claim("subscriptionStartedAt", toEpochMillis(session.subscriptionStartedAt()))
              .claim("subscriptionExpiresAt", toEpochMillis(session.subscriptionExpiresAt()))
              .claim(
                  "sponsorId",
                  session.sponsorId() != null ? session.sponsorId().toString() : null)
              .issueTime(Date.from(now))
              .expirationTime(Date.from(expiresAt))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.debug("Issued session token for user {}", session.userId());
      return new IssuedToken(signedJwt.serialize(), expiresAt);
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign session token", e);
    }
  }

  /**
   * Verifies signature, expiry and token type, then extracts the session claims.
   *
   * @throws InvalidSessionTokenException if any check fails
   */
  public SessionClaims verifyToken(String token) {
    try {
      var signedJwt = SignedJWT.parse(token);
      JWSVerifier verifier = new MACVerifier(secret);

      if (!signedJwt.verify(verifier)) {
        throw new InvalidSessionTokenException("Invalid session token signature");
      }

      var claims = signedJwt.getJWTClaimsSet();
      if (claims.getExpirationTime() == null
          || claims.getExpirationTime().toInstant().isBefore(Instant.now())) {
        throw new InvalidSessionTokenException("Session has expired");
      }
      if (!TOKEN_TYPE.equals(claims.getStringClaim("type"))) {
        throw new InvalidSessionTokenException("Invalid token type");
      }

      String sponsorId = claims.getStringClaim("sponsorId");
      return new SessionClaims(
          UUID.fromString(claims.getSubject()),
          claims.getStringClaim("email"),
          UserRole.valueOf(claims.getStringClaim("role")),
          SubscriptionType.valueOf(claims.getStringClaim("subscriptionType")),
          fromEpochMillis(claims.getLongClaim("subscriptionStartedAt")),
          fromEpochMillis(claims.getLongClaim("subscriptionExpiresAt")),
          sponsorId != null ? UUID.fromString(sponsorId) : null);
    } catch (ParseException | JOSEException | IllegalArgumentException e) {
      throw new InvalidSessionTokenException("Invalid session token: " + e.getMessage(), e);
    }
  }

  private static Long toEpochMillis(Instant instant) {
    return instant != null ? instant.toEpochMilli() : null;
  }

  private static Instant fromEpochMillis(Long millis) {
    return millis != null ? Instant.ofEpochMilli(millis) : null;
  }
}
