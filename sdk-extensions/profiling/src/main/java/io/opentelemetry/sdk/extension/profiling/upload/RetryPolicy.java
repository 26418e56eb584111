/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import java.time.Duration;
import java.util.Objects;

/**
 * 重试策略
 *
 * <p>最大尝试次数（含首次）、初始退避、最大退避、退避乘数与抖动比例。
 */
public final class RetryPolicy {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(8);
  public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
  public static final double DEFAULT_JITTER = 0.2;

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final double backoffMultiplier;
  private final double jitter;

  private RetryPolicy(Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.initialBackoff = builder.initialBackoff;
    this.maxBackoff = builder.maxBackoff;
    this.backoffMultiplier = builder.backoffMultiplier;
    this.jitter = builder.jitter;
  }

  /** 创建构建器 */
  public static Builder builder() {
    return new Builder();
  }

  /** 默认策略（3 次尝试，1s 起步，8s 封顶） */
  public static RetryPolicy defaultPolicy() {
    return builder().build();
  }

  /** 不重试 */
  public static RetryPolicy noRetry() {
    return builder().setMaxAttempts(1).build();
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public double getJitter() {
    return jitter;
  }

  @Override
  public String toString() {
    return "RetryPolicy{"
        + "maxAttempts="
        + maxAttempts
        + ", initialBackoff="
        + initialBackoff
        + ", maxBackoff="
        + maxBackoff
        + ", backoffMultiplier="
        + backoffMultiplier
        + ", jitter="
        + jitter
        + '}';
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
    private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
    private double jitter = DEFAULT_JITTER;

    private Builder() {}

    /** 设置最大尝试次数（含首次） */
    public Builder setMaxAttempts(int maxAttempts) {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("maxAttempts must be >= 1");
      }
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** 设置初始退避 */
    public Builder setInitialBackoff(Duration initialBackoff) {
      Objects.requireNonNull(initialBackoff, "initialBackoff");
      if (initialBackoff.isNegative()) {
        throw new IllegalArgumentException("initialBackoff must not be negative");
      }
      this.initialBackoff = initialBackoff;
      return this;
    }

    /** 设置最大退避 */
    public Builder setMaxBackoff(Duration maxBackoff) {
      Objects.requireNonNull(maxBackoff, "maxBackoff");
      if (maxBackoff.isNegative()) {
        throw new IllegalArgumentException("maxBackoff must not be negative");
      }
      this.maxBackoff = maxBackoff;
      return this;
    }

    /** 设置退避乘数 */
    public Builder setBackoffMultiplier(double backoffMultiplier) {
      if (backoffMultiplier < 1.0) {
        throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
      }
      this.backoffMultiplier = backoffMultiplier;
      return this;
    }

    /** 设置抖动比例，取值 [0, 1] */
    public Builder setJitter(double jitter) {
      if (jitter < 0.0 || jitter > 1.0) {
        throw new IllegalArgumentException("jitter must be in [0, 1]");
      }
      this.jitter = jitter;
      return this;
    }

    /** 构建策略 */
    public RetryPolicy build() {
      if (maxBackoff.compareTo(initialBackoff) < 0) {
        throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
      }
      return new RetryPolicy(this);
    }
  }
}
