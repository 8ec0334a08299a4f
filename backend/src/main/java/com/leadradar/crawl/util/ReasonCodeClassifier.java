package com.leadradar.crawl.util;

import com.leadradar.crawl.model.FetchErrorKind;
import com.leadradar.crawl.model.HttpFetchResult;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String BLOCKED = "BLOCKED";
  public static final String DENYLISTED = "DENYLISTED";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String SCRIPTED_UNAVAILABLE = "SCRIPTED_UNAVAILABLE";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return BLOCKED;
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
    return UNKNOWN;
  }

  public static FetchErrorKind toErrorKind(HttpFetchResult result) {
    if (result.errorCode() != null) {
      String code = result.errorCode().toLowerCase(Locale.ROOT);
      if (code.contains("timeout")) {
        return FetchErrorKind.TIMEOUT;
      }
      if (code.contains("invalid_url")) {
        return FetchErrorKind.INVALID_URL;
      }
      if (code.contains("interrupted")) {
        return FetchErrorKind.INTERRUPTED;
      }
      if (code.contains("io_error")) {
        return FetchErrorKind.IO_ERROR;
      }
      return FetchErrorKind.HTTP_ERROR;
    }
    int status = result.statusCode();
    if (status == 401 || status == 403) {
      return FetchErrorKind.BLOCKED;
    }
    if (status == 408) {
      return FetchErrorKind.TIMEOUT;
    }
    return FetchErrorKind.HTTP_ERROR;
  }

  public static String fromErrorKind(FetchErrorKind kind, int statusCode) {
    if (kind == null) {
      return UNKNOWN;
    }
    return switch (kind) {
      case BLOCKED -> BLOCKED;
      case TIMEOUT -> TIMEOUT;
      case UNAVAILABLE -> SCRIPTED_UNAVAILABLE;
      case INVALID_URL -> INVALID_URL;
      case INTERRUPTED -> INTERRUPTED;
      case HTTP_ERROR, IO_ERROR -> fromHttpStatus(statusCode);
    };
  }
}
