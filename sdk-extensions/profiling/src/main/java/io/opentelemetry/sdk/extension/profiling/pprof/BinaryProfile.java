/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.pprof;

import io.opentelemetry.sdk.extension.profiling.sample.SampleType;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 不可变的 pprof 二进制 Profile（未压缩）
 *
 * <p>除序列化字节外，还携带构建摘要，便于日志与统计。
 */
public final class BinaryProfile {

  private final byte[] bytes;
  private final long startNanos;
  private final long endNanos;
  private final List<SampleType> sampleTypes;
  private final Map<SampleType, Long> sampleCounts;
  private final int stackCount;
  private final long skippedSamples;

  BinaryProfile(
      byte[] bytes,
      long startNanos,
      long endNanos,
      List<SampleType> sampleTypes,
      Map<SampleType, Long> sampleCounts,
      int stackCount,
      long skippedSamples) {
    this.bytes = bytes;
    this.startNanos = startNanos;
    this.endNanos = endNanos;
    this.sampleTypes = Collections.unmodifiableList(sampleTypes);
    this.sampleCounts =
        sampleCounts.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(sampleCounts));
    this.stackCount = stackCount;
    this.skippedSamples = skippedSamples;
  }

  /**
   * 获取序列化字节（副本）
   *
   * @return pprof 字节
   */
  public byte[] getBytes() {
    return bytes.clone();
  }

  public int getSize() {
    return bytes.length;
  }

  public long getStartNanos() {
    return startNanos;
  }

  public long getEndNanos() {
    return endNanos;
  }

  /**
   * 获取出现的样本类型（按声明顺序），每种类型对应两列值
   *
   * @return 样本类型列表
   */
  public List<SampleType> getSampleTypes() {
    return sampleTypes;
  }

  /**
   * 获取某一样本类型的样本数
   *
   * @param type 样本类型
   * @return 样本数
   */
  public long getSampleCount(SampleType type) {
    Long count = sampleCounts.get(type);
    return count != null ? count : 0L;
  }

  /** 全部样本数 */
  public long getSampleCount() {
    long total = 0;
    for (Long count : sampleCounts.values()) {
      total += count;
    }
    return total;
  }

  /** 聚合后的不同堆栈数 */
  public int getStackCount() {
    return stackCount;
  }

  /** 因样本类型无法识别被跳过的样本数 */
  public long getSkippedSamples() {
    return skippedSamples;
  }

  public boolean isEmpty() {
    return stackCount == 0;
  }

  /**
   * 判断两个 Profile 的字节是否一致
   *
   * @param other 另一个 Profile
   * @return 是否字节一致
   */
  public boolean contentEquals(BinaryProfile other) {
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public String toString() {
    return "BinaryProfile{"
        + "size="
        + bytes.length
        + ", sampleTypes="
        + sampleTypes
        + ", stacks="
        + stackCount
        + ", skippedSamples="
        + skippedSamples
        + '}';
  }
}
