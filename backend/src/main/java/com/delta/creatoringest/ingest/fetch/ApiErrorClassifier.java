package com.delta.creatoringest.ingest.fetch;

import com.delta.creatoringest.ingest.retry.FailureClassification;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Set;

public final class ApiErrorClassifier {
  public static final String TIMEOUT = "timeout";
  public static final String IO_ERROR = "io_error";
  public static final String MALFORMED_RESPONSE = "malformedResponse";

  private static final Set<String> QUOTA_REASONS = Set.of("quotaexceeded", "dailylimitexceeded");
  private static final Set<String> AUTH_REASONS =
      Set.of("keyinvalid", "keyexpired", "accessnotconfigured", "iprefererblocked", "unauthorized", "autherror");
  private static final Set<String> RATE_REASONS =
      Set.of("ratelimitexceeded", "userratelimitexceeded", "ratelimit", "backenderror", "internalerror");

  private ApiErrorClassifier() {}

  public static FailureClassification classify(int status, String reason) {
    String lower = reason == null ? "" : reason.toLowerCase(Locale.ROOT);
    if (QUOTA_REASONS.contains(lower)) {
      return FailureClassification.QUOTA_EXHAUSTED;
    }
    if (AUTH_REASONS.contains(lower) || status == 401) {
      return FailureClassification.FATAL_AUTH_ERROR;
    }
    if (RATE_REASONS.contains(lower)) {
      return FailureClassification.TRANSIENT_ERROR;
    }
    if (status == 404 || lower.endsWith("notfound") || lower.endsWith("notaccessible")) {
      return FailureClassification.NOT_FOUND;
    }
    if (status == 408 || status == 429 || status >= 500) {
      return FailureClassification.TRANSIENT_ERROR;
    }
    if (status == 400 || (status == 403 && "forbidden".equals(lower))) {
      // the request itself names something the API will never return
      return FailureClassification.NOT_FOUND;
    }
    return FailureClassification.TRANSIENT_ERROR;
  }

  /**
   * Turns a failed call into an exception carrying its classification. Transport errors (no
   * status) are always transient.
   */
  public static FetchException toException(ApiResponse response, JsonNode errorBody) {
    if (response.errorCode() != null) {
      return new FetchException(
          FailureClassification.TRANSIENT_ERROR,
          0,
          response.errorCode(),
          response.endpoint() + " failed: " + response.errorCode() + " " + safe(response.errorMessage()));
    }
    String reason = extractReason(errorBody);
    FailureClassification classification = classify(response.statusCode(), reason);
    return new FetchException(
        classification,
        response.statusCode(),
        reason,
        response.endpoint() + " returned HTTP " + response.statusCode() + (reason == null ? "" : " (" + reason + ")"));
  }

  public static FetchException malformed(ApiResponse response, Throwable cause) {
    return new FetchException(
        FailureClassification.TRANSIENT_ERROR,
        MALFORMED_RESPONSE,
        response.endpoint() + " returned an unparseable body",
        cause);
  }

  /**
   * Reads {@code error.errors[0].reason}, falling back to {@code error.status}.
   */
  public static String extractReason(JsonNode root) {
    if (root == null || root.isMissingNode()) {
      return null;
    }
    JsonNode error = root.path("error");
    JsonNode errors = error.path("errors");
    if (errors.isArray() && errors.size() > 0) {
      String reason = errors.get(0).path("reason").asText("");
      if (!reason.isBlank()) {
        return reason;
      }
    }
    String status = error.path("status").asText("");
    return status.isBlank() ? null : status;
  }

  private static String safe(String value) {
    return value == null ? "" : value;
  }
}
