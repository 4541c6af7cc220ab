package io.projectdesk.backend.webhook;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Checks the {@code Webhook-Signature} header: HMAC-SHA256 of the raw body under the shared
 * secret, hex encoded, optionally prefixed with {@code sha256=}. Comparison is constant-time.
 */
@Component
public class WebhookSignatureVerifier {

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final String PREFIX = "sha256=";

  private final String secret;

  public WebhookSignatureVerifier(
      @Value("${projectdesk.gocardless.webhook-secret:}") String secret) {
    this.secret = secret;
  }

  public boolean isConfigured() {
    return secret != null && !secret.isBlank();
  }

  /**
   * @throws WebhookNotConfiguredException if no secret is configured
   * @throws WebhookAuthenticationException if the signature is missing or wrong
   */
  public void verify(String rawBody, String signatureHeader) {
    if (!isConfigured()) {
      throw new WebhookNotConfiguredException("Webhook secret not configured");
    }
    if (signatureHeader == null || signatureHeader.isBlank()) {
      throw new WebhookAuthenticationException("Missing webhook signature");
    }

    String provided = signatureHeader.trim();
    if (provided.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
      provided = provided.substring(PREFIX.length());
    }
    byte[] expected =
        HexFormat.of().formatHex(sign(rawBody)).getBytes(StandardCharsets.US_ASCII);
    byte[] actual = provided.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
    if (!MessageDigest.isEqual(expected, actual)) {
      throw new WebhookAuthenticationException("Invalid signature");
    }
  }

  /** Hex HMAC of the body, as the provider would send it. */
  public String signatureFor(String rawBody) {
    return HexFormat.of().formatHex(sign(rawBody));
  }

  private byte[] sign(String rawBody) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      return mac.doFinal(rawBody.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to compute webhook HMAC", e);
    }
  }
}
