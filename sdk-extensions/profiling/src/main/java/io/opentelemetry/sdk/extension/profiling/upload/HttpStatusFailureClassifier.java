/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import java.io.IOException;

/**
 * 基于 HTTP 状态码的失败分类
 *
 * <ul>
 *   <li>5xx、429、408 可重试
 *   <li>其余 4xx 与 3xx 不可重试
 *   <li>{@link IOException}（连接失败、超时）可重试，其他异常不可重试
 * </ul>
 */
public final class HttpStatusFailureClassifier implements FailureClassifier {

  private static final HttpStatusFailureClassifier INSTANCE = new HttpStatusFailureClassifier();

  private HttpStatusFailureClassifier() {}

  public static HttpStatusFailureClassifier getInstance() {
    return INSTANCE;
  }

  @Override
  public ErrorKind classify(int statusCode) {
    if (statusCode >= 500 || statusCode == 429 || statusCode == 408) {
      return ErrorKind.RETRYABLE;
    }
    return ErrorKind.FATAL;
  }

  @Override
  public ErrorKind classify(Exception exception) {
    return exception instanceof IOException ? ErrorKind.RETRYABLE : ErrorKind.FATAL;
  }

  /**
   * 为状态码生成排查提示
   *
   * @param statusCode HTTP 状态码
   * @return 提示信息
   */
  static String hint(int statusCode) {
    switch (statusCode) {
      case 400:
        return "bad request, check your token";
      case 401:
      case 403:
        return "unauthorized, check your token";
      case 404:
        return "not found, check your endpoint path";
      case 408:
        return "request timeout";
      case 413:
        return "payload too large";
      case 429:
        return "rate limited";
      default:
        if (statusCode >= 500) {
          return "server error";
        }
        if (statusCode >= 300 && statusCode < 400) {
          return "unexpected redirect";
        }
        return "unexpected status";
    }
  }
}
