package io.projectdesk.backend.integration.billing;

import java.util.Map;

/**
 * Port for the direct-debit billing provider. Every call is synchronous and attempted once; a
 * failure surfaces as a {@link io.projectdesk.backend.exception.BillingProviderException}
 * carrying the provider's message.
 */
public interface BillingProvider {

  /** Provider identifier (e.g., "gocardless", "noop"). */
  String providerId();

  /** Starts the hosted mandate set-up and returns where to send the payer. */
  ProviderRedirectFlow createRedirectFlow(RedirectFlowRequest request);

  /** Confirms a redirect flow after the payer returns; the result links the new mandate. */
  ProviderRedirectFlow completeRedirectFlow(String flowId, String sessionToken);

  ProviderSubscription createSubscription(SubscriptionRequest request);

  void cancelSubscription(String subscriptionId);

  void cancelMandate(String mandateId);

  record RedirectFlowRequest(
      String description,
      String sessionToken,
      String successRedirectUrl,
      String givenName,
      String familyName,
      String email,
      Map<String, String> metadata) {}

  /** {@code mandateId} and {@code customerId} are only set once the flow is completed. */
  record ProviderRedirectFlow(
      String id, String redirectUrl, String mandateId, String customerId) {}

  record SubscriptionRequest(
      String mandateId,
      long amount,
      String currency,
      String name,
      String intervalUnit,
      int interval,
      Map<String, String> metadata) {}

  record ProviderSubscription(String id, String status) {}
}
