/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import javax.annotation.Nullable;

/**
 * 上传的终止错误
 *
 * <p>作为返回值交给调度器，而不是抛出。
 */
public final class UploadError {

  /** 无 HTTP 状态码（连接失败、超时等） */
  public static final int NO_STATUS = 0;

  private final ErrorKind kind;
  private final int statusCode;
  private final String message;
  private final int attempts;
  @Nullable private final Throwable cause;

  UploadError(
      ErrorKind kind, int statusCode, String message, int attempts, @Nullable Throwable cause) {
    this.kind = kind;
    this.statusCode = statusCode;
    this.message = message;
    this.attempts = attempts;
    this.cause = cause;
  }

  /**
   * 创建终止错误
   *
   * @param kind 失败类型
   * @param statusCode 最后一次 HTTP 状态码
   * @param message 错误消息
   * @param attempts 尝试次数
   * @param cause 原始异常
   * @return 终止错误
   */
  public static UploadError create(
      ErrorKind kind, int statusCode, String message, int attempts, @Nullable Throwable cause) {
    return new UploadError(kind, statusCode, message, attempts, cause);
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** 最后一次 HTTP 状态码，没有时为 {@link #NO_STATUS} */
  public int getStatusCode() {
    return statusCode;
  }

  public String getMessage() {
    return message;
  }

  /** 已执行的传输尝试次数 */
  public int getAttempts() {
    return attempts;
  }

  @Nullable
  public Throwable getCause() {
    return cause;
  }

  public boolean isFatal() {
    return kind == ErrorKind.FATAL;
  }

  public boolean isRetryable() {
    return kind == ErrorKind.RETRYABLE;
  }

  @Override
  public String toString() {
    return "UploadError{"
        + "kind="
        + kind
        + ", status="
        + statusCode
        + ", attempts="
        + attempts
        + ", message='"
        + message
        + '\''
        + '}';
  }
}
