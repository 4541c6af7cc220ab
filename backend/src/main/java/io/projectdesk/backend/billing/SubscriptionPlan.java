package io.projectdesk.backend.billing;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Price and cadence of the supervisor subscription, from {@code projectdesk.subscription.*}. The
 * amount is in the currency's minor unit (pence for GBP).
 */
@Component
public class SubscriptionPlan {

  static final String DEFAULT_NAME = "ProjectDesk Supervisor Subscription";
  private static final int MAX_NAME_LENGTH = 255;

  private final long amount;
  private final String currency;
  private final String intervalUnit;
  private final int interval;
  private final String name;

  public SubscriptionPlan(
      @Value("${projectdesk.subscription.amount:0}") long amount,
      @Value("${projectdesk.subscription.currency:GBP}") String currency,
      @Value("${projectdesk.subscription.interval-unit:monthly}") String intervalUnit,
      @Value("${projectdesk.subscription.interval:1}") int interval,
      @Value("${projectdesk.subscription.name:" + DEFAULT_NAME + "}") String name) {
    this.amount = amount;
    this.currency = currency;
    this.intervalUnit = intervalUnit;
    this.interval = interval;
    String resolved = name == null || name.isBlank() ? DEFAULT_NAME : name.trim();
    this.name =
        resolved.length() > MAX_NAME_LENGTH ? resolved.substring(0, MAX_NAME_LENGTH) : resolved;
  }

  /** Fails when the plan cannot be billed; checked before any provider call. */
  public void requireValid() {
    if (amount <= 0) {
      throw new IllegalStateException("projectdesk.subscription.amount must be greater than zero");
    }
    if (interval <= 0) {
      throw new IllegalStateException(
          "projectdesk.subscription.interval must be greater than zero");
    }
  }

  public long getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public String getIntervalUnit() {
    return intervalUnit;
  }

  public int getInterval() {
    return interval;
  }

  public String getName() {
    return name;
  }
}
