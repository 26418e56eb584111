/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 单次采样观测
 *
 * <p>记录后不可变。{@code stackFrames} 第一个元素为最内层（叶子）帧。
 */
public final class Sample {

  private final SampleType sampleType;
  private final List<StackFrame> stackFrames;
  private final long value;
  private final long timestampNanos;

  private Sample(
      SampleType sampleType, List<StackFrame> stackFrames, long value, long timestampNanos) {
    this.sampleType = sampleType;
    this.stackFrames = stackFrames;
    this.value = value;
    this.timestampNanos = timestampNanos;
  }

  /**
   * 创建样本
   *
   * @param sampleType 样本类型
   * @param stackFrames 堆栈（叶子帧在前）
   * @param value 样本值，单位由样本类型决定
   * @param timestampNanos 采样时间（Unix 纪元纳秒）
   * @return 样本
   */
  public static Sample create(
      SampleType sampleType, List<StackFrame> stackFrames, long value, long timestampNanos) {
    Objects.requireNonNull(sampleType, "sampleType");
    Objects.requireNonNull(stackFrames, "stackFrames");
    return new Sample(
        sampleType,
        Collections.unmodifiableList(new ArrayList<>(stackFrames)),
        value,
        timestampNanos);
  }

  public SampleType getSampleType() {
    return sampleType;
  }

  public List<StackFrame> getStackFrames() {
    return stackFrames;
  }

  public long getValue() {
    return value;
  }

  public long getTimestampNanos() {
    return timestampNanos;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Sample)) {
      return false;
    }
    Sample that = (Sample) o;
    return value == that.value
        && timestampNanos == that.timestampNanos
        && sampleType == that.sampleType
        && stackFrames.equals(that.stackFrames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sampleType, stackFrames, value, timestampNanos);
  }

  @Override
  public String toString() {
    return "Sample{"
        + "sampleType="
        + sampleType
        + ", frames="
        + stackFrames.size()
        + ", value="
        + value
        + ", timestampNanos="
        + timestampNanos
        + '}';
  }
}
