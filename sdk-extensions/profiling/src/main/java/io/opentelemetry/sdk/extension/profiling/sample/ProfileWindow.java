/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 已关闭的采样时间窗口
 *
 * <p>由 {@link SampleAccumulator#swap()} 产生，之后不再变化。
 */
public final class ProfileWindow {

  private final long startNanos;
  private final long endNanos;
  private final List<Sample> samples;
  private final long droppedSamples;

  private ProfileWindow(long startNanos, long endNanos, List<Sample> samples, long droppedSamples) {
    this.startNanos = startNanos;
    this.endNanos = endNanos;
    this.samples = samples;
    this.droppedSamples = droppedSamples;
  }

  /**
   * 创建时间窗口
   *
   * @param startNanos 开始时间（Unix 纪元纳秒）
   * @param endNanos 结束时间（Unix 纪元纳秒）
   * @param samples 窗口内样本
   * @return 时间窗口
   */
  public static ProfileWindow create(long startNanos, long endNanos, List<Sample> samples) {
    return create(startNanos, endNanos, samples, 0);
  }

  /**
   * 创建时间窗口
   *
   * @param startNanos 开始时间（Unix 纪元纳秒）
   * @param endNanos 结束时间（Unix 纪元纳秒）
   * @param samples 窗口内样本
   * @param droppedSamples 因容量限制被丢弃的样本数
   * @return 时间窗口
   */
  public static ProfileWindow create(
      long startNanos, long endNanos, List<Sample> samples, long droppedSamples) {
    if (endNanos < startNanos) {
      throw new IllegalArgumentException("endNanos must not be before startNanos");
    }
    return new ProfileWindow(
        startNanos,
        endNanos,
        Collections.unmodifiableList(new ArrayList<>(samples)),
        droppedSamples);
  }

  public long getStartNanos() {
    return startNanos;
  }

  public long getEndNanos() {
    return endNanos;
  }

  public long getDurationNanos() {
    return endNanos - startNanos;
  }

  public List<Sample> getSamples() {
    return samples;
  }

  public int getSampleCount() {
    return samples.size();
  }

  public boolean isEmpty() {
    return samples.isEmpty();
  }

  public long getDroppedSamples() {
    return droppedSamples;
  }

  @Override
  public String toString() {
    return "ProfileWindow{"
        + "startNanos="
        + startNanos
        + ", endNanos="
        + endNanos
        + ", samples="
        + samples.size()
        + ", droppedSamples="
        + droppedSamples
        + '}';
  }
}
