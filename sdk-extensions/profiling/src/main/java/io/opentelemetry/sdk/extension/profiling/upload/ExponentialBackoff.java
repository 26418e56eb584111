/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 指数退避计算器
 *
 * <p>第 k 次尝试（k &gt;= 2）前的等待时间为 {@code min(max, initial * multiplier^(k-2))}，
 * 再叠加 {@code ±jitter} 比例的随机抖动，结果不超过最大退避。
 *
 * <p>无状态：每次都由尝试序号重新计算，可在多个上传序列间共享。
 */
public final class ExponentialBackoff implements BackoffStrategy {

  private final long initialNanos;
  private final long maxNanos;
  private final double multiplier;
  private final double jitter;
  private final DoubleSupplier random;

  /**
   * 创建指数退避计算器
   *
   * @param initial 初始退避
   * @param max 最大退避
   * @param multiplier 乘数
   * @param jitter 抖动比例
   * @param random 返回 [0, 1) 随机数
   */
  public ExponentialBackoff(
      Duration initial, Duration max, double multiplier, double jitter, DoubleSupplier random) {
    this.initialNanos = initial.toNanos();
    this.maxNanos = max.toNanos();
    this.multiplier = multiplier;
    this.jitter = jitter;
    this.random = random;
  }

  /**
   * 按重试策略创建
   *
   * @param policy 重试策略
   * @return 退避计算器
   */
  public static ExponentialBackoff create(RetryPolicy policy) {
    return new ExponentialBackoff(
        policy.getInitialBackoff(),
        policy.getMaxBackoff(),
        policy.getBackoffMultiplier(),
        policy.getJitter(),
        () -> ThreadLocalRandom.current().nextDouble());
  }

  @Override
  public Duration delayBefore(int attempt) {
    if (attempt <= 1) {
      return Duration.ZERO;
    }
    double base = Math.min((double) maxNanos, initialNanos * Math.pow(multiplier, attempt - 2));
    double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
    double delay = Math.max(0.0, Math.min((double) maxNanos, base * factor));
    return Duration.ofNanos(Math.round(delay));
  }

  public Duration getInitial() {
    return Duration.ofNanos(initialNanos);
  }

  public Duration getMax() {
    return Duration.ofNanos(maxNanos);
  }

  @Override
  public String toString() {
    return "ExponentialBackoff{"
        + "initialMs="
        + Duration.ofNanos(initialNanos).toMillis()
        + ", maxMs="
        + Duration.ofNanos(maxNanos).toMillis()
        + ", multiplier="
        + multiplier
        + ", jitter="
        + jitter
        + '}';
  }
}
