package dev.webfetch.backend;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/** Turns {@link RestClientException}s into the short reasons recorded in diagnostics. */
final class BackendErrors {

  private static final int MAX_BODY_CHARS = 200;

  private BackendErrors() {
    // utility class
  }

  static BackendResult toResult(RestClientException e) {
    if (e instanceof RestClientResponseException responseException) {
      int status = responseException.getStatusCode().value();
      return BackendResult.failed(describeStatus(status, responseException), status);
    }
    if (e instanceof ResourceAccessException) {
      return BackendResult.failed("I/O error: " + rootMessage(e));
    }
    return BackendResult.failed(rootMessage(e));
  }

  private static String describeStatus(int status, RestClientResponseException e) {
    String body = e.getResponseBodyAsString();
    if (body.isBlank()) {
      return "HTTP " + status;
    }
    String trimmed = body.strip();
    if (trimmed.length() > MAX_BODY_CHARS) {
      trimmed = trimmed.substring(0, MAX_BODY_CHARS) + "...";
    }
    return "HTTP " + status + ": " + trimmed;
  }

  private static String rootMessage(Throwable e) {
    Throwable root = e;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
  }
}
