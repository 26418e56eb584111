/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

/** 失败分类器：决定一次失败是否值得重试 */
public interface FailureClassifier {

  /**
   * 对非 2xx 响应分类
   *
   * @param statusCode HTTP 状态码
   * @return 失败类型
   */
  ErrorKind classify(int statusCode);

  /**
   * 对传输异常分类
   *
   * @param exception 异常
   * @return 失败类型
   */
  ErrorKind classify(Exception exception);
}
