/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.export;

import io.opentelemetry.sdk.common.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 导出统计信息管理器。
 *
 * <p>负责管理导出的统计计数和周期性日志输出，包括：
 *
 * <ul>
 *   <li>按结果分类的周期计数
 *   <li>被跳过的调度 tick
 *   <li>因容量丢弃与因类型跳过的样本
 *   <li>周期性状态日志
 * </ul>
 */
public final class ExportStatistics {

  /** 默认状态日志输出间隔 */
  private static final long DEFAULT_STATUS_LOG_INTERVAL_NANOS = TimeUnit.MINUTES.toNanos(10);

  private final Logger logger;
  private final Clock clock;
  private final long statusLogIntervalNanos;

  private final Map<CycleOutcome, AtomicLong> cycleCounts = new EnumMap<>(CycleOutcome.class);
  private final AtomicLong skippedTicks = new AtomicLong(0);
  private final AtomicLong droppedSamples = new AtomicLong(0);
  private final AtomicLong skippedSamples = new AtomicLong(0);
  private final AtomicLong uploadAttempts = new AtomicLong(0);
  private final AtomicLong uploadedBytes = new AtomicLong(0);
  private final AtomicLong lastStatusLogTime;
  private final AtomicReference<CycleOutcome> lastOutcome = new AtomicReference<>();

  /**
   * 创建统计信息管理器（自定义日志间隔）
   *
   * @param clock 时钟
   * @param statusLogIntervalNanos 状态日志间隔（纳秒）
   * @param logger 日志
   */
  public ExportStatistics(Clock clock, long statusLogIntervalNanos, Logger logger) {
    this.clock = clock;
    this.statusLogIntervalNanos = statusLogIntervalNanos;
    this.logger = logger;
    this.lastStatusLogTime = new AtomicLong(clock.nanoTime());
    for (CycleOutcome outcome : CycleOutcome.values()) {
      cycleCounts.put(outcome, new AtomicLong(0));
    }
  }

  /** 创建统计信息管理器 */
  public ExportStatistics() {
    this(
        Clock.getDefault(),
        DEFAULT_STATUS_LOG_INTERVAL_NANOS,
        Logger.getLogger(ExportStatistics.class.getName()));
  }

  /** 记录一个完成的周期 */
  public void recordCycle(CycleOutcome outcome) {
    cycleCounts.get(outcome).incrementAndGet();
    lastOutcome.set(outcome);
  }

  public void recordSkippedTick() {
    skippedTicks.incrementAndGet();
  }

  public void recordDroppedSamples(long count) {
    if (count > 0) {
      droppedSamples.addAndGet(count);
    }
  }

  public void recordSkippedSamples(long count) {
    if (count > 0) {
      skippedSamples.addAndGet(count);
    }
  }

  public void recordUpload(int attempts, long bytes) {
    uploadAttempts.addAndGet(attempts);
    uploadedBytes.addAndGet(bytes);
  }

  public long getCycleCount(CycleOutcome outcome) {
    return cycleCounts.get(outcome).get();
  }

  /** 全部周期数 */
  public long getCycleCount() {
    long total = 0;
    for (AtomicLong count : cycleCounts.values()) {
      total += count.get();
    }
    return total;
  }

  public long getSkippedTicks() {
    return skippedTicks.get();
  }

  public long getDroppedSamples() {
    return droppedSamples.get();
  }

  public long getSkippedSamples() {
    return skippedSamples.get();
  }

  public long getUploadAttempts() {
    return uploadAttempts.get();
  }

  public long getUploadedBytes() {
    return uploadedBytes.get();
  }

  @Nullable
  public CycleOutcome getLastOutcome() {
    return lastOutcome.get();
  }

  /**
   * 周期性输出状态日志（如果需要）
   */
  public void logPeriodicStatusIfNeeded() {
    long now = clock.nanoTime();
    long lastLog = lastStatusLogTime.get();
    if (now - lastLog >= statusLogIntervalNanos && lastStatusLogTime.compareAndSet(lastLog, now)) {
      logStatus();
    }
  }

  /**
   * 强制输出状态日志
   */
  public void logStatus() {
    logger.log(
        Level.INFO,
        "Profiling export status - cycles: {0}, success: {1}, empty: {2}, failed: {3}, "
            + "abandoned: {4}, skippedTicks: {5}, droppedSamples: {6}, skippedSamples: {7}, "
            + "uploadedBytes: {8}",
        new Object[] {
          getCycleCount(),
          getCycleCount(CycleOutcome.SUCCESS),
          getCycleCount(CycleOutcome.EMPTY),
          getCycleCount(CycleOutcome.ENCODING_DROPPED)
              + getCycleCount(CycleOutcome.UPLOAD_RETRYABLE_EXHAUSTED)
              + getCycleCount(CycleOutcome.UPLOAD_FATAL)
              + getCycleCount(CycleOutcome.FAILED),
          getCycleCount(CycleOutcome.ABANDONED),
          skippedTicks.get(),
          droppedSamples.get(),
          skippedSamples.get(),
          uploadedBytes.get()
        });
  }
}
