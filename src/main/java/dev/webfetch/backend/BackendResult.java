package dev.webfetch.backend;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a single backend attempt. Ordinary failures (timeouts, non-2xx responses, blocked
 * pages) are represented here rather than thrown.
 */
public record BackendResult(
    boolean success,
    @Nullable BackendPayload payload,
    @Nullable String error,
    @Nullable Integer statusCode) {

  public static BackendResult ok(BackendPayload payload) {
    return new BackendResult(true, payload, null, null);
  }

  public static BackendResult ok(BackendPayload payload, int statusCode) {
    return new BackendResult(true, payload, null, statusCode);
  }

  public static BackendResult failed(String error) {
    return new BackendResult(false, null, error, null);
  }

  public static BackendResult failed(String error, int statusCode) {
    return new BackendResult(false, null, error, statusCode);
  }
}
