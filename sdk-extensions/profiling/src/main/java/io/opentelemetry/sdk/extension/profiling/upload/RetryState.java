/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import java.time.Duration;
import javax.annotation.Nullable;

/**
 * 一次上传序列的重试状态机
 *
 * <p>仅在单个上传序列内被单线程修改。等待时间跨尝试单调不减：
 * 抖动后的计算值小于上一次等待时间时沿用上一次的值。
 */
public final class RetryState {

  private final int maxAttempts;
  private int attempt;
  private Duration nextDelay = Duration.ZERO;
  @Nullable private UploadError lastError;

  RetryState(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  /** 已开始的尝试次数 */
  public int getAttempt() {
    return attempt;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /** 下一次（或最近一次）尝试前的等待时间 */
  public Duration getNextDelay() {
    return nextDelay;
  }

  @Nullable
  public UploadError getLastError() {
    return lastError;
  }

  /** 是否还能发起下一次尝试 */
  boolean canAttempt() {
    if (attempt >= maxAttempts) {
      return false;
    }
    return lastError == null || lastError.isRetryable();
  }

  /**
   * 计算下一次尝试前的等待时间
   *
   * @param backoff 退避策略
   * @return 等待时间，首次尝试为零
   */
  Duration planNextAttempt(BackoffStrategy backoff) {
    if (attempt == 0) {
      nextDelay = Duration.ZERO;
      return nextDelay;
    }
    Duration computed = backoff.delayBefore(attempt + 1);
    if (computed.compareTo(nextDelay) > 0) {
      nextDelay = computed;
    }
    return nextDelay;
  }

  void attemptStarted() {
    attempt++;
  }

  void attemptFailed(ErrorKind kind, int statusCode, String message, @Nullable Throwable cause) {
    lastError = new UploadError(kind, statusCode, message, attempt, cause);
  }

  /**
   * 序列在未用完尝试次数前被终止（截止时间或中断），保留最近一次的状态码
   *
   * @param reason 终止原因
   */
  void abandon(String reason) {
    UploadError last = lastError;
    if (last == null) {
      lastError = new UploadError(ErrorKind.RETRYABLE, UploadError.NO_STATUS, reason, attempt, null);
    } else {
      lastError =
          new UploadError(
              ErrorKind.RETRYABLE,
              last.getStatusCode(),
              reason + ", last error: " + last.getMessage(),
              attempt,
              last.getCause());
    }
  }

  UploadError toUploadError() {
    UploadError error = lastError;
    if (error == null) {
      return new UploadError(
          ErrorKind.RETRYABLE, UploadError.NO_STATUS, "no attempt made", attempt, null);
    }
    return error;
  }

  @Override
  public String toString() {
    return "RetryState{"
        + "attempt="
        + attempt
        + "/"
        + maxAttempts
        + ", nextDelay="
        + nextDelay.toMillis()
        + "ms, lastError="
        + lastError
        + '}';
  }
}
