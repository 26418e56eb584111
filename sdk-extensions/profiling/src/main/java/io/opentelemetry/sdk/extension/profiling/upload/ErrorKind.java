/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

/** 上传失败类型 */
public enum ErrorKind {
  /** 可重试：连接失败、超时、5xx、429、408 */
  RETRYABLE,
  /** 不可重试：其余 4xx、3xx、客户端内部错误 */
  FATAL
}
