package io.projectdesk.backend.integration.email;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Ticker;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class EmailRateLimiterTest {

  @Test
  void tryAcquire_succeedsWithinLimit() {
    var limiter = new EmailRateLimiter(3, Ticker.systemTicker());

    assertThat(limiter.tryAcquire("ada@example.com")).isTrue();
    assertThat(limiter.tryAcquire("ada@example.com")).isTrue();
    assertThat(limiter.tryAcquire("ada@example.com")).isTrue();
  }

  @Test
  void tryAcquire_failsWhenRecipientLimitExceeded() {
    var limiter = new EmailRateLimiter(2, Ticker.systemTicker());

    assertThat(limiter.tryAcquire("bob@example.com")).isTrue();
    assertThat(limiter.tryAcquire("bob@example.com")).isTrue();
    // 3rd should fail
    assertThat(limiter.tryAcquire("bob@example.com")).isFalse();
  }

  @Test
  void tryAcquire_countsRecipientsSeparately() {
    var limiter = new EmailRateLimiter(1, Ticker.systemTicker());

    assertThat(limiter.tryAcquire("one@example.com")).isTrue();
    assertThat(limiter.tryAcquire("two@example.com")).isTrue();
    assertThat(limiter.tryAcquire("one@example.com")).isFalse();
  }

  @Test
  void tryAcquire_ignoresCaseAndSurroundingWhitespace() {
    var limiter = new EmailRateLimiter(1, Ticker.systemTicker());

    assertThat(limiter.tryAcquire("Carol@Example.com")).isTrue();
    assertThat(limiter.tryAcquire("  carol@example.com ")).isFalse();
  }

  @Test
  void rejectedAttempts_doNotExtendTheCount() {
    var fakeTicker = new FakeTicker();
    var limiter = new EmailRateLimiter(1, fakeTicker);

    assertThat(limiter.tryAcquire("dan@example.com")).isTrue();
    assertThat(limiter.tryAcquire("dan@example.com")).isFalse();
    assertThat(limiter.tryAcquire("dan@example.com")).isFalse();

    fakeTicker.advance(61 * 60 * 1_000_000_000L);

    assertThat(limiter.tryAcquire("dan@example.com")).isTrue();
  }

  @Test
  void counters_resetAfterCacheExpiry() {
    var fakeTicker = new FakeTicker();
    var limiter = new EmailRateLimiter(2, fakeTicker);

    assertThat(limiter.tryAcquire("erin@example.com")).isTrue();
    assertThat(limiter.tryAcquire("erin@example.com")).isTrue();
    assertThat(limiter.tryAcquire("erin@example.com")).isFalse();

    // Advance time past the 1-hour expiry
    fakeTicker.advance(61 * 60 * 1_000_000_000L); // 61 minutes in nanos

    assertThat(limiter.tryAcquire("erin@example.com")).isTrue();
  }

  /** Fake ticker for simulating time passage in Caffeine caches. */
  private static class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong(System.nanoTime());

    void advance(long deltaNanos) {
      nanos.addAndGet(deltaNanos);
    }

    @Override
    public long read() {
      return nanos.get();
    }
  }
}
