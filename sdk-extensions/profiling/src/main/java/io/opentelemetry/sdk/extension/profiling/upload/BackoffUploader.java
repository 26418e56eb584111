/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import io.opentelemetry.sdk.common.Clock;
import io.opentelemetry.sdk.extension.profiling.payload.UploadPayload;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 带退避重试的上传器
 *
 * <p>每次尝试调用一次 {@link ProfileTransport}。失败由 {@link FailureClassifier} 分类：
 * 可重试的失败在退避等待后重试，直到用完最大尝试次数；不可重试的失败立即终止。
 *
 * <p>每次尝试输出一行日志：尝试序号、等待时间、结果与状态码。
 *
 * <p>从不抛出异常。同一时刻只处理一个负载，由调度器保证。
 */
public final class BackoffUploader implements ProfileUploader {

  private final ProfileTransport transport;
  private final RetryPolicy policy;
  private final BackoffStrategy backoff;
  private final FailureClassifier classifier;
  private final Sleeper sleeper;
  private final Clock clock;
  private final Logger logger;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * 创建上传器
   *
   * @param transport 传输
   * @param policy 重试策略
   * @param backoff 退避策略
   * @param classifier 失败分类器
   * @param sleeper 退避等待
   * @param clock 时钟（用于截止时间）
   * @param logger 日志
   */
  public BackoffUploader(
      ProfileTransport transport,
      RetryPolicy policy,
      BackoffStrategy backoff,
      FailureClassifier classifier,
      Sleeper sleeper,
      Clock clock,
      Logger logger) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * 使用默认协作者创建上传器
   *
   * @param transport 传输
   * @param policy 重试策略
   * @return 上传器
   */
  public static BackoffUploader create(ProfileTransport transport, RetryPolicy policy) {
    return new BackoffUploader(
        transport,
        policy,
        ExponentialBackoff.create(policy),
        HttpStatusFailureClassifier.getInstance(),
        Sleeper.SYSTEM,
        Clock.getDefault(),
        Logger.getLogger(BackoffUploader.class.getName()));
  }

  @Override
  public UploadResult upload(UploadPayload payload) {
    return doUpload(payload, null);
  }

  @Override
  public UploadResult upload(UploadPayload payload, Duration budget) {
    return doUpload(payload, budget);
  }

  private UploadResult doUpload(UploadPayload payload, @Nullable Duration budget) {
    long deadline = deadlineNanos(budget);
    RetryState state = new RetryState(policy.getMaxAttempts());

    while (state.canAttempt()) {
      if (Thread.currentThread().isInterrupted()) {
        state.abandon("upload abandoned: interrupted");
        logAbandoned(state);
        break;
      }

      Duration delay = state.planNextAttempt(backoff);
      if (clock.nanoTime() + delay.toNanos() - deadline > 0) {
        state.abandon("upload deadline exceeded");
        logAbandoned(state);
        break;
      }

      if (!delay.isZero()) {
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          state.abandon("upload abandoned: interrupted during backoff");
          logAbandoned(state);
          break;
        }
      }

      state.attemptStarted();
      try {
        TransportResponse response = transport.send(payload);
        if (response.isSuccessful()) {
          logger.log(
              Level.FINE,
              "Profile upload attempt {0}/{1} succeeded: delayMs={2}, status={3}",
              new Object[] {
                state.getAttempt(), state.getMaxAttempts(), delay.toMillis(), response.getCode()
              });
          return UploadResult.success(state.getAttempt());
        }
        int status = response.getCode();
        state.attemptFailed(
            classifier.classify(status),
            status,
            response + " (" + HttpStatusFailureClassifier.hint(status) + ")",
            null);
      } catch (IOException e) {
        state.attemptFailed(classifier.classify(e), UploadError.NO_STATUS, describe(e), e);
      } catch (RuntimeException e) {
        state.attemptFailed(ErrorKind.FATAL, UploadError.NO_STATUS, describe(e), e);
      }
      logFailedAttempt(state, delay);
    }

    UploadError error = state.toUploadError();
    return UploadResult.failure(error);
  }

  private long deadlineNanos(@Nullable Duration budget) {
    long now = clock.nanoTime();
    if (budget == null) {
      return now + Long.MAX_VALUE / 2;
    }
    long budgetNanos = Math.min(budget.toNanos(), Long.MAX_VALUE / 2);
    return now + budgetNanos;
  }

  private void logFailedAttempt(RetryState state, Duration delay) {
    UploadError error = state.getLastError();
    if (error == null) {
      return;
    }
    logger.log(
        Level.WARNING,
        "Profile upload attempt {0}/{1} failed: delayMs={2}, outcome={3}, status={4}, error={5}",
        new Object[] {
          state.getAttempt(),
          state.getMaxAttempts(),
          delay.toMillis(),
          error.getKind(),
          error.getStatusCode(),
          error.getMessage()
        });
  }

  private void logAbandoned(RetryState state) {
    logger.log(
        Level.WARNING,
        "Profile upload stopped after {0}/{1} attempts: {2}",
        new Object[] {
          state.getAttempt(), state.getMaxAttempts(), state.toUploadError().getMessage()
        });
  }

  private static String describe(Exception e) {
    return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
  }

  public RetryPolicy getPolicy() {
    return policy;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      transport.close();
    }
  }

  @Override
  public String toString() {
    return "BackoffUploader{" + "policy=" + policy + ", backoff=" + backoff + '}';
  }
}
