package io.projectdesk.backend.integration.email;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Caps how many emails one recipient receives per hour, so repeated login attempts on an
 * unverified account cannot be used to flood an inbox.
 */
@Service
public class EmailRateLimiter {

  private final int perRecipientLimit;
  private final Cache<String, AtomicInteger> recipientCounters;

  @Autowired
  public EmailRateLimiter(
      @Value("${projectdesk.email.rate-limit-per-hour:20}") int perRecipientLimit) {
    this(perRecipientLimit, Ticker.systemTicker());
  }

  EmailRateLimiter(int perRecipientLimit, Ticker ticker) {
    this.perRecipientLimit = perRecipientLimit;
    this.recipientCounters =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
  }

  public boolean tryAcquire(String recipient) {
    String key = recipient.trim().toLowerCase(Locale.ROOT);
    var counter = recipientCounters.get(key, k -> new AtomicInteger(0));
    if (counter.incrementAndGet() > perRecipientLimit) {
      counter.decrementAndGet();
      return false;
    }
    return true;
  }
}
