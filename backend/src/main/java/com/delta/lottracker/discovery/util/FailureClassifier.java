package com.delta.lottracker.discovery.util;

import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.HttpFetchResult;
import com.delta.lottracker.discovery.model.SourceTag;

import java.util.Locale;

public final class FailureClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String UNEXPECTED_STATUS = "UNEXPECTED_STATUS";
  public static final String RATE_LIMITER_TIMEOUT = "RATE_LIMITER_TIMEOUT";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String CANCELLED = "CANCELLED";
  public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";
  public static final String UNKNOWN = "UNKNOWN";

  private FailureClassifier() {}

  /**
   * @return null for a successful result, otherwise the failure class driving retry decisions
   */
  public static FailureClass classify(HttpFetchResult result) {
    if (result == null) {
      return FailureClass.PERMANENT;
    }
    if (result.isSuccessful()) {
      return null;
    }
    return isRetryable(reasonCode(result)) ? FailureClass.RETRYABLE : FailureClass.PERMANENT;
  }

  public static String reasonCode(HttpFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null && !result.errorCode().isBlank()) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    return UNEXPECTED_STATUS;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.contains("rate_limiter")) {
      return RATE_LIMITER_TIMEOUT;
    }
    if (code.contains("invalid_url")) {
      return INVALID_URL;
    }
    if (code.contains("cancelled") || code.contains("interrupted")) {
      return CANCELLED;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return IO_ERROR;
    }
    return UNKNOWN;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, TLS_FAILURE, IO_ERROR, HTTP_429_RATE_LIMIT, HTTP_5XX, RATE_LIMITER_TIMEOUT -> true;
      default -> false;
    };
  }

  public static SourceFetchException toException(SourceTag source, HttpFetchResult result) {
    String reason = reasonCode(result);
    FailureClass failureClass = isRetryable(reason) ? FailureClass.RETRYABLE : FailureClass.PERMANENT;
    int status = result == null ? 0 : result.statusCode();
    String url = result == null ? "?" : result.requestedUrl();
    String detail = result == null || result.errorMessage() == null ? "" : " (" + result.errorMessage() + ")";
    int attempts = result == null ? 0 : result.attempts();
    return new SourceFetchException(
        source,
        failureClass,
        status,
        reason,
        source.key() + " request failed: " + reason + " status=" + status + " attempts=" + attempts + " url=" + url + detail
    );
  }
}
