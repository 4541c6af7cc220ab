package io.projectdesk.backend.integration.billing;

import io.projectdesk.backend.exception.BillingProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/** Fallback when no GoCardless token is configured. Every billing call fails with 502. */
@Component
@ConditionalOnMissingBean(GoCardlessBillingProvider.class)
public class NoOpBillingProvider implements BillingProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpBillingProvider.class);
  static final String NOT_CONFIGURED = "Billing provider is not configured";

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public ProviderRedirectFlow createRedirectFlow(RedirectFlowRequest request) {
    throw notConfigured("createRedirectFlow");
  }

  @Override
  public ProviderRedirectFlow completeRedirectFlow(String flowId, String sessionToken) {
    throw notConfigured("completeRedirectFlow");
  }

  @Override
  public ProviderSubscription createSubscription(SubscriptionRequest request) {
    throw notConfigured("createSubscription");
  }

  @Override
  public void cancelSubscription(String subscriptionId) {
    throw notConfigured("cancelSubscription");
  }

  @Override
  public void cancelMandate(String mandateId) {
    throw notConfigured("cancelMandate");
  }

  private static BillingProviderException notConfigured(String operation) {
    log.warn("NoOp billing: {} called without a configured provider", operation);
    return new BillingProviderException(NOT_CONFIGURED);
  }
}
