/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling;

import io.opentelemetry.sdk.common.Clock;
import io.opentelemetry.sdk.extension.profiling.config.ProfilingExportConfig;
import io.opentelemetry.sdk.extension.profiling.export.ExportScheduler;
import io.opentelemetry.sdk.extension.profiling.export.ExportStatistics;
import io.opentelemetry.sdk.extension.profiling.payload.PayloadEncoder;
import io.opentelemetry.sdk.extension.profiling.payload.PayloadMetadata;
import io.opentelemetry.sdk.extension.profiling.pprof.ProfileBuilder;
import io.opentelemetry.sdk.extension.profiling.sample.Sample;
import io.opentelemetry.sdk.extension.profiling.sample.SampleAccumulator;
import io.opentelemetry.sdk.extension.profiling.upload.BackoffUploader;
import io.opentelemetry.sdk.extension.profiling.upload.ExponentialBackoff;
import io.opentelemetry.sdk.extension.profiling.upload.HttpStatusFailureClassifier;
import io.opentelemetry.sdk.extension.profiling.upload.OkHttpProfileTransport;
import io.opentelemetry.sdk.extension.profiling.upload.ProfileTransport;
import io.opentelemetry.sdk.extension.profiling.upload.Sleeper;
import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Profile 导出器
 *
 * <p>组装样本累积器与导出调度器，是外部采样器的唯一入口：
 *
 * <pre>{@code
 * ProfilingExporter exporter = ProfilingExporter.create(config);
 * exporter.start();
 * exporter.record(sample);
 * ...
 * exporter.close();
 * }</pre>
 */
public final class ProfilingExporter implements Closeable {

  private static final Logger logger = Logger.getLogger(ProfilingExporter.class.getName());

  private final ProfilingExportConfig config;
  private final SampleAccumulator accumulator;
  private final ExportScheduler scheduler;

  private ProfilingExporter(
      ProfilingExportConfig config, SampleAccumulator accumulator, ExportScheduler scheduler) {
    this.config = config;
    this.accumulator = accumulator;
    this.scheduler = scheduler;
  }

  /**
   * 按配置创建导出器，使用 OkHttp 传输
   *
   * @param config 导出配置
   * @return 导出器
   */
  public static ProfilingExporter create(ProfilingExportConfig config) {
    return builder(config).build();
  }

  /**
   * 创建构建器
   *
   * @param config 导出配置
   * @return 构建器
   */
  public static Builder builder(ProfilingExportConfig config) {
    return new Builder(config);
  }

  /**
   * 记录一个样本，从不阻塞，从不抛出异常
   *
   * @param sample 样本
   */
  public void record(@Nullable Sample sample) {
    accumulator.record(sample);
  }

  /** 启动周期导出 */
  public void start() {
    scheduler.start();
    logger.log(Level.INFO, "Profiling exporter started: {0}", config);
  }

  /** 停止导出，最多等待关闭超时 */
  @Override
  public void close() {
    scheduler.close();
  }

  public ProfilingExportConfig getConfig() {
    return config;
  }

  public SampleAccumulator getAccumulator() {
    return accumulator;
  }

  public ExportScheduler getScheduler() {
    return scheduler;
  }

  public ExportStatistics getStatistics() {
    return scheduler.getStatistics();
  }

  /** Builder for {@link ProfilingExporter}. */
  public static final class Builder {
    private final ProfilingExportConfig config;
    @Nullable private ProfileTransport transport;
    private Clock clock = Clock.getDefault();
    private Sleeper sleeper = Sleeper.SYSTEM;

    private Builder(ProfilingExportConfig config) {
      this.config = Objects.requireNonNull(config, "config");
    }

    /** 设置传输，默认按配置创建 {@link OkHttpProfileTransport} */
    public Builder setTransport(ProfileTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder setSleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    /**
     * 构建导出器
     *
     * @return 导出器
     */
    public ProfilingExporter build() {
      SampleAccumulator accumulator =
          new SampleAccumulator(
              config.getAccumulatorCapacity(),
              clock,
              Logger.getLogger(SampleAccumulator.class.getName()));

      ProfileTransport profileTransport =
          transport != null ? transport : OkHttpProfileTransport.create(config);
      BackoffUploader uploader =
          new BackoffUploader(
              profileTransport,
              config.getRetryPolicy(),
              ExponentialBackoff.create(config.getRetryPolicy()),
              HttpStatusFailureClassifier.getInstance(),
              sleeper,
              clock,
              Logger.getLogger(BackoffUploader.class.getName()));

      ExportScheduler scheduler =
          ExportScheduler.builder()
              .setAccumulator(accumulator)
              .setProfileBuilder(
                  ProfileBuilder.forMemoryProfiling(
                      config.isMemoryEnabled(),
                      Logger.getLogger(ProfileBuilder.class.getName())))
              .setEncoder(new PayloadEncoder())
              .setMetadata(
                  PayloadMetadata.create(
                      config.getServiceName(),
                      config.getEnvironment(),
                      config.getHost(),
                      config.getAuthToken()))
              .setUploader(uploader)
              .setExportInterval(config.getExportInterval())
              .setExportTimeout(config.getExportTimeout())
              .setShutdownFlushTimeout(config.getShutdownFlushTimeout())
              .setStatistics(
                  new ExportStatistics(
                      clock,
                      TimeUnit.MINUTES.toNanos(10),
                      Logger.getLogger(ExportStatistics.class.getName())))
              .build();

      return new ProfilingExporter(config, accumulator, scheduler);
    }
  }
}
