package io.projectdesk.backend.integration.email;

/** Outcome of a single send attempt. {@code providerMessageId} is null on failure. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
