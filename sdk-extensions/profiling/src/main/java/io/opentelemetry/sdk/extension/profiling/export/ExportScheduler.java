/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.export;

import io.opentelemetry.sdk.extension.profiling.EncodingException;
import io.opentelemetry.sdk.extension.profiling.payload.PayloadEncoder;
import io.opentelemetry.sdk.extension.profiling.payload.PayloadMetadata;
import io.opentelemetry.sdk.extension.profiling.payload.UploadPayload;
import io.opentelemetry.sdk.extension.profiling.pprof.BinaryProfile;
import io.opentelemetry.sdk.extension.profiling.pprof.ProfileBuilder;
import io.opentelemetry.sdk.extension.profiling.sample.ProfileWindow;
import io.opentelemetry.sdk.extension.profiling.sample.SampleAccumulator;
import io.opentelemetry.sdk.extension.profiling.upload.ProfileUploader;
import io.opentelemetry.sdk.extension.profiling.upload.UploadError;
import io.opentelemetry.sdk.extension.profiling.upload.UploadResult;
import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 导出调度器
 *
 * <p>按固定间隔在定时线程上触发导出周期，周期本身在单独的导出线程上执行：
 * swap → build → encode → upload。
 *
 * <p>状态：{@code IDLE → EXPORTING → IDLE}，{@code STOPPED} 为终态。
 * 周期执行期间到达的 tick 被跳过并计数，同一时刻最多一个负载在传输中。
 *
 * <p>{@link #stop()}：空闲时执行最后一次导出，导出中时等待当前周期；两种情况都受关闭超时约束，
 * 超时后中断导出线程并放弃进行中的上传。
 *
 * <p>所有编码异常、上传错误与运行时异常都在此处捕获并记录，不会传播到宿主进程。
 */
public final class ExportScheduler implements Closeable {

  /** 调度器状态 */
  public enum State {
    IDLE,
    EXPORTING,
    STOPPED
  }

  private static final String TIMER_THREAD_NAME = "otel-profiling-timer";
  private static final String EXPORT_THREAD_NAME = "otel-profiling-export";

  private final SampleAccumulator accumulator;
  private final ProfileBuilder profileBuilder;
  private final PayloadEncoder encoder;
  private final PayloadMetadata metadata;
  private final ProfileUploader uploader;
  private final Duration exportInterval;
  private final Duration exportTimeout;
  private final Duration shutdownFlushTimeout;
  private final ExportStatistics statistics;
  private final Logger logger;

  private final ScheduledExecutorService timer;
  private final ExecutorService worker;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition cycleFinished = lock.newCondition();
  private State state = State.IDLE;
  private boolean started;
  private boolean stopRequested;
  @Nullable private ScheduledFuture<?> tickFuture;
  private boolean abandoned;

  private ExportScheduler(Builder builder) {
    this.accumulator = builder.accumulator;
    this.profileBuilder = builder.profileBuilder;
    this.encoder = builder.encoder;
    this.metadata = builder.metadata;
    this.uploader = builder.uploader;
    this.exportInterval = builder.exportInterval;
    this.exportTimeout = builder.exportTimeout;
    this.shutdownFlushTimeout = builder.shutdownFlushTimeout;
    this.statistics = builder.statistics;
    this.logger = builder.logger;
    this.timer = Executors.newSingleThreadScheduledExecutor(daemonThreadFactory(TIMER_THREAD_NAME));
    this.worker = Executors.newSingleThreadExecutor(daemonThreadFactory(EXPORT_THREAD_NAME));
  }

  /**
   * 创建构建器
   *
   * @return 构建器
   */
  public static Builder builder() {
    return new Builder();
  }

  private static ThreadFactory daemonThreadFactory(String name) {
    return r -> {
      Thread t = new Thread(r, name);
      t.setDaemon(true);
      return t;
    };
  }

  /** 启动周期调度，重复调用无效果 */
  public void start() {
    lock.lock();
    try {
      if (stopRequested) {
        logger.log(Level.WARNING, "Cannot start profiling export scheduler, already stopped");
        return;
      }
      if (started) {
        return;
      }
      started = true;
      long intervalNanos = exportInterval.toNanos();
      tickFuture =
          timer.scheduleAtFixedRate(
              this::tick, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
    } finally {
      lock.unlock();
    }
    logger.log(
        Level.INFO,
        "Profiling export scheduler started, interval: {0}ms, exportTimeout: {1}ms",
        new Object[] {exportInterval.toMillis(), exportTimeout.toMillis()});
  }

  /** 定时线程上的 tick */
  void tick() {
    try {
      if (!tryEnterExporting()) {
        return;
      }
      try {
        worker.execute(() -> runCycle(exportTimeout));
      } catch (RejectedExecutionException e) {
        logger.log(Level.FINE, "Export worker rejected cycle: {0}", e.getMessage());
        leaveExporting();
      }
    } catch (Throwable t) {
      // 异常会取消后续的周期调度
      logger.log(Level.WARNING, "Unexpected error in profiling export tick", t);
    }
  }

  private boolean tryEnterExporting() {
    lock.lock();
    try {
      if (stopRequested) {
        return false;
      }
      if (state != State.IDLE) {
        statistics.recordSkippedTick();
        logger.log(Level.FINE, "Previous profiling export still running, skipping tick");
        return false;
      }
      state = State.EXPORTING;
      return true;
    } finally {
      lock.unlock();
    }
  }

  private void leaveExporting() {
    lock.lock();
    try {
      if (state == State.EXPORTING) {
        state = State.IDLE;
      }
      cycleFinished.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * 在调用线程上立即执行一个周期，已有周期在执行时返回 null
   *
   * @return 周期结果
   */
  @Nullable
  CycleOutcome exportNow() {
    if (!tryEnterExporting()) {
      return null;
    }
    return runCycle(exportTimeout);
  }

  private CycleOutcome runCycle(Duration budget) {
    CycleOutcome outcome = CycleOutcome.FAILED;
    try {
      outcome = exportOnce(budget);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Profiling export cycle failed unexpectedly", e);
    } finally {
      outcome = finishCycle(outcome);
    }
    return outcome;
  }

  /** 在锁内计数并离开 EXPORTING，stop() 被唤醒时结果已计入 */
  private CycleOutcome finishCycle(CycleOutcome outcome) {
    boolean counted;
    lock.lock();
    try {
      // stop() 已按 ABANDONED 计数
      counted = !(state == State.STOPPED && abandoned);
      if (counted) {
        statistics.recordCycle(outcome);
      }
      if (state == State.EXPORTING) {
        state = State.IDLE;
      }
      cycleFinished.signalAll();
    } finally {
      lock.unlock();
    }
    if (!counted) {
      logger.log(Level.FINE, "Abandoned profiling export cycle ended with {0}", outcome);
      return CycleOutcome.ABANDONED;
    }
    statistics.logPeriodicStatusIfNeeded();
    return outcome;
  }

  private CycleOutcome exportOnce(Duration budget) {
    ProfileWindow window = accumulator.swap();
    statistics.recordDroppedSamples(window.getDroppedSamples());
    if (window.isEmpty()) {
      logger.log(Level.FINE, "Profile window is empty, nothing to export");
      return CycleOutcome.EMPTY;
    }

    BinaryProfile profile;
    UploadPayload payload;
    try {
      profile = profileBuilder.build(window);
      statistics.recordSkippedSamples(profile.getSkippedSamples());
      if (profile.isEmpty()) {
        logger.log(
            Level.FINE,
            "Profile window has no exportable samples, {0} skipped",
            profile.getSkippedSamples());
        return CycleOutcome.EMPTY;
      }
      payload = encoder.encode(profile, metadata);
    } catch (EncodingException e) {
      logger.log(
          Level.WARNING,
          "Dropping profile window of {0} samples, encoding failed: {1}",
          new Object[] {window.getSampleCount(), e.getMessage()});
      return CycleOutcome.ENCODING_DROPPED;
    }

    UploadResult result = uploader.upload(payload, budget);
    statistics.recordUpload(
        result.getAttempts(), result.isSuccess() ? payload.getCompressedSize() : 0);
    UploadError error = result.getError();
    if (error == null) {
      logger.log(
          Level.INFO,
          "Exported profile: samples={0}, stacks={1}, bytes={2}, attempts={3}",
          new Object[] {
            profile.getSampleCount(),
            profile.getStackCount(),
            payload.getCompressedSize(),
            result.getAttempts()
          });
      return CycleOutcome.SUCCESS;
    }

    CycleOutcome outcome =
        error.isFatal() ? CycleOutcome.UPLOAD_FATAL : CycleOutcome.UPLOAD_RETRYABLE_EXHAUSTED;
    logger.log(
        Level.WARNING,
        "Failed to export profile: outcome={0}, status={1}, attempts={2}, error={3}",
        new Object[] {outcome, error.getStatusCode(), error.getAttempts(), error.getMessage()});
    return outcome;
  }

  /**
   * 停止调度器
   *
   * <p>空闲时执行最后一次导出；导出中时等待当前周期。两种情况都最多等待关闭超时，
   * 之后无论如何进入 {@link State#STOPPED}。重复调用无效果。
   */
  public void stop() {
    boolean runFinalCycle;
    ScheduledFuture<?> tick;
    lock.lock();
    try {
      if (stopRequested) {
        return;
      }
      stopRequested = true;
      runFinalCycle = state == State.IDLE;
      if (runFinalCycle) {
        state = State.EXPORTING;
      }
      tick = tickFuture;
      tickFuture = null;
    } finally {
      lock.unlock();
    }

    if (tick != null) {
      tick.cancel(false);
    }
    timer.shutdown();

    if (runFinalCycle) {
      try {
        worker.execute(() -> runCycle(shutdownFlushTimeout));
      } catch (RejectedExecutionException e) {
        logger.log(Level.FINE, "Export worker rejected final cycle: {0}", e.getMessage());
        leaveExporting();
      }
    }

    boolean finished = awaitCycle(shutdownFlushTimeout);

    lock.lock();
    try {
      finished = finished || state != State.EXPORTING;
      state = State.STOPPED;
      abandoned = !finished;
      cycleFinished.signalAll();
    } finally {
      lock.unlock();
    }

    if (finished) {
      worker.shutdown();
    } else {
      statistics.recordCycle(CycleOutcome.ABANDONED);
      logger.log(
          Level.WARNING,
          "Profiling export did not finish within {0}ms, abandoning in-flight upload",
          shutdownFlushTimeout.toMillis());
      worker.shutdownNow();
    }

    uploader.close();
    statistics.logStatus();
    logger.log(Level.INFO, "Profiling export scheduler stopped");
  }

  /** 等待进行中的周期结束，超时返回 false */
  private boolean awaitCycle(Duration timeout) {
    lock.lock();
    try {
      long nanos = timeout.toNanos();
      while (state == State.EXPORTING) {
        if (nanos <= 0) {
          return false;
        }
        nanos = cycleFinished.awaitNanos(nanos);
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    stop();
  }

  public State getState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public ExportStatistics getStatistics() {
    return statistics;
  }

  /** Builder for {@link ExportScheduler}. */
  public static final class Builder {
    @Nullable private SampleAccumulator accumulator;
    @Nullable private ProfileBuilder profileBuilder;
    @Nullable private PayloadEncoder encoder;
    @Nullable private PayloadMetadata metadata;
    @Nullable private ProfileUploader uploader;
    private Duration exportInterval = Duration.ofSeconds(60);
    private Duration exportTimeout = Duration.ofSeconds(30);
    private Duration shutdownFlushTimeout = Duration.ofSeconds(5);
    @Nullable private ExportStatistics statistics;
    private Logger logger = Logger.getLogger(ExportScheduler.class.getName());

    private Builder() {}

    public Builder setAccumulator(SampleAccumulator accumulator) {
      this.accumulator = Objects.requireNonNull(accumulator, "accumulator");
      return this;
    }

    public Builder setProfileBuilder(ProfileBuilder profileBuilder) {
      this.profileBuilder = Objects.requireNonNull(profileBuilder, "profileBuilder");
      return this;
    }

    public Builder setEncoder(PayloadEncoder encoder) {
      this.encoder = Objects.requireNonNull(encoder, "encoder");
      return this;
    }

    public Builder setMetadata(PayloadMetadata metadata) {
      this.metadata = Objects.requireNonNull(metadata, "metadata");
      return this;
    }

    public Builder setUploader(ProfileUploader uploader) {
      this.uploader = Objects.requireNonNull(uploader, "uploader");
      return this;
    }

    public Builder setExportInterval(Duration exportInterval) {
      this.exportInterval = Objects.requireNonNull(exportInterval, "exportInterval");
      return this;
    }

    public Builder setExportTimeout(Duration exportTimeout) {
      this.exportTimeout = Objects.requireNonNull(exportTimeout, "exportTimeout");
      return this;
    }

    public Builder setShutdownFlushTimeout(Duration shutdownFlushTimeout) {
      this.shutdownFlushTimeout =
          Objects.requireNonNull(shutdownFlushTimeout, "shutdownFlushTimeout");
      return this;
    }

    public Builder setStatistics(ExportStatistics statistics) {
      this.statistics = Objects.requireNonNull(statistics, "statistics");
      return this;
    }

    public Builder setLogger(Logger logger) {
      this.logger = Objects.requireNonNull(logger, "logger");
      return this;
    }

    /**
     * 构建调度器
     *
     * @return 调度器
     */
    public ExportScheduler build() {
      if (accumulator == null) {
        throw new IllegalStateException("accumulator is required");
      }
      if (profileBuilder == null) {
        throw new IllegalStateException("profileBuilder is required");
      }
      if (encoder == null) {
        throw new IllegalStateException("encoder is required");
      }
      if (metadata == null) {
        throw new IllegalStateException("metadata is required");
      }
      if (uploader == null) {
        throw new IllegalStateException("uploader is required");
      }
      if (exportInterval.isNegative() || exportInterval.isZero()) {
        throw new IllegalArgumentException("exportInterval must be positive");
      }
      if (statistics == null) {
        statistics = new ExportStatistics();
      }
      return new ExportScheduler(this);
    }
  }
}
