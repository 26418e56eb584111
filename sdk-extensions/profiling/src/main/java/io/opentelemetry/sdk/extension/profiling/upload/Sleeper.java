/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** 退避等待 */
@FunctionalInterface
public interface Sleeper {

  /** 基于 {@link TimeUnit#sleep(long)} 的实现 */
  Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

  /**
   * 等待指定时长
   *
   * @param duration 时长
   * @throws InterruptedException 等待被中断
   */
  void sleep(Duration duration) throws InterruptedException;
}
