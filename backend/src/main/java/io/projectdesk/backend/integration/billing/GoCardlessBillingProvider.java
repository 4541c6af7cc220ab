package io.projectdesk.backend.integration.billing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.projectdesk.backend.exception.BillingProviderException;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * GoCardless REST adapter. Active when {@code projectdesk.gocardless.access-token} is set; the
 * {@code environment} property picks the live or sandbox API.
 */
@Component
@ConditionalOnProperty(name = "projectdesk.gocardless.access-token")
public class GoCardlessBillingProvider implements BillingProvider {

  private static final Logger log = LoggerFactory.getLogger(GoCardlessBillingProvider.class);

  static final String API_VERSION = "2015-07-06";
  static final String LIVE_BASE_URL = "https://api.gocardless.com";
  static final String SANDBOX_BASE_URL = "https://api-sandbox.gocardless.com";

  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public GoCardlessBillingProvider(
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper,
      @Value("${projectdesk.gocardless.access-token}") String accessToken,
      @Value("${projectdesk.gocardless.environment:sandbox}") String environment) {
    this.objectMapper = objectMapper;
    this.restClient =
        restClientBuilder
            .baseUrl(resolveBaseUrl(environment))
            .defaultHeader("Authorization", "Bearer " + accessToken)
            .defaultHeader("GoCardless-Version", API_VERSION)
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
            .build();
  }

  static String resolveBaseUrl(String environment) {
    return "live".equals(environment == null ? "" : environment.trim().toLowerCase(Locale.ROOT))
        ? LIVE_BASE_URL
        : SANDBOX_BASE_URL;
  }

  @Override
  public String providerId() {
    return "gocardless";
  }

  @Override
  public ProviderRedirectFlow createRedirectFlow(RedirectFlowRequest request) {
    var prefilled = new LinkedHashMap<String, Object>();
    putIfPresent(prefilled, "given_name", request.givenName());
    putIfPresent(prefilled, "family_name", request.familyName());
    putIfPresent(prefilled, "email", request.email());

    var flow = new LinkedHashMap<String, Object>();
    flow.put("description", request.description());
    flow.put("session_token", request.sessionToken());
    flow.put("success_redirect_url", request.successRedirectUrl());
    flow.put("prefilled_customer", prefilled);
    flow.put("metadata", request.metadata());

    JsonNode body = post("/redirect_flows", Map.of("redirect_flows", flow));
    return toRedirectFlow(body.path("redirect_flows"));
  }

  @Override
  public ProviderRedirectFlow completeRedirectFlow(String flowId, String sessionToken) {
    JsonNode body =
        post(
            "/redirect_flows/" + flowId + "/actions/complete",
            Map.of("data", Map.of("session_token", sessionToken)));
    return toRedirectFlow(body.path("redirect_flows"));
  }

  @Override
  public ProviderSubscription createSubscription(SubscriptionRequest request) {
    var subscription = new LinkedHashMap<String, Object>();
    subscription.put("amount", request.amount());
    subscription.put("currency", request.currency());
    subscription.put("name", request.name());
    subscription.put("interval_unit", request.intervalUnit());
    subscription.put("interval", request.interval());
    subscription.put("metadata", request.metadata());
    subscription.put("links", Map.of("mandate", request.mandateId()));

    JsonNode node =
        post("/subscriptions", Map.of("subscriptions", subscription)).path("subscriptions");
    return new ProviderSubscription(text(node, "id"), text(node, "status"));
  }

  @Override
  public void cancelSubscription(String subscriptionId) {
    post("/subscriptions/" + subscriptionId + "/actions/cancel", Map.of("data", Map.of()));
    log.info("Cancelled GoCardless subscription {}", subscriptionId);
  }

  @Override
  public void cancelMandate(String mandateId) {
    post("/mandates/" + mandateId + "/actions/cancel", Map.of("data", Map.of()));
    log.info("Cancelled GoCardless mandate {}", mandateId);
  }

  private JsonNode post(String path, Object body) {
    try {
      JsonNode response =
          restClient
              .post()
              .uri(path)
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  (request, httpResponse) -> {
                    throw new BillingProviderException(extractErrorMessage(httpResponse));
                  })
              .body(JsonNode.class);
      return response != null ? response : objectMapper.createObjectNode();
    } catch (RestClientException e) {
      log.error("GoCardless request to {} failed: {}", path, e.getMessage());
      throw new BillingProviderException("GoCardless request failed: " + e.getMessage(), e);
    }
  }

  private String extractErrorMessage(ClientHttpResponse response) throws IOException {
    String fallback = "GoCardless request failed with status " + response.getStatusCode().value();
    try (InputStream bodyStream = response.getBody()) {
      JsonNode json = objectMapper.readTree(bodyStream);
      if (json == null) {
        return fallback;
      }
      JsonNode error = json.path("error");
      if (error.hasNonNull("message")) {
        return error.get("message").asText();
      }
      if (error.isTextual()) {
        return error.asText();
      }
      return fallback;
    } catch (IOException e) {
      log.debug("Unreadable GoCardless error body: {}", e.getMessage());
      return fallback;
    }
  }

  private static ProviderRedirectFlow toRedirectFlow(JsonNode node) {
    JsonNode links = node.path("links");
    return new ProviderRedirectFlow(
        text(node, "id"),
        text(node, "redirect_url"),
        text(links, "mandate"),
        text(links, "customer"));
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && !value.isNull() ? value.asText() : null;
  }

  private static void putIfPresent(Map<String, Object> map, String key, String value) {
    if (value != null && !value.isBlank()) {
      map.put(key, value);
    }
  }
}
