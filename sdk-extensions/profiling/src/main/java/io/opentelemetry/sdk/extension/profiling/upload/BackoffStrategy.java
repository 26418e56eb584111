/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import java.time.Duration;

/** 退避策略 */
public interface BackoffStrategy {

  /**
   * 计算第 {@code attempt} 次尝试前的等待时间
   *
   * @param attempt 尝试序号（从 2 开始，首次尝试不等待）
   * @return 等待时间
   */
  Duration delayBefore(int attempt);
}
