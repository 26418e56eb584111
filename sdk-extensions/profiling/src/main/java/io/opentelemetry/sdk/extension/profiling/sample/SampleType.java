/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.sample;

/**
 * 样本类型
 *
 * <p>每种类型在 pprof 中对应两列：样本计数列与样本值列。
 */
public enum SampleType {
  /** CPU 时间 */
  CPU("cpu-samples", "cpu-time", "nanoseconds", "sum", /* sampled= */ true, /* memory= */ false),
  /** 墙钟时间 */
  WALL("wall-samples", "wall-time", "nanoseconds", "sum", /* sampled= */ true, /* memory= */ false),
  /** 分配字节数 */
  ALLOC_SPACE(
      "alloc-samples", "alloc-space", "bytes", "sum", /* sampled= */ true, /* memory= */ true),
  /** 分配对象数 */
  ALLOC_OBJECTS(
      "alloc-object-samples",
      "alloc-objects",
      "count",
      "sum",
      /* sampled= */ true,
      /* memory= */ true),
  /** 堆内存占用 */
  HEAP_SPACE(
      "heap-samples", "heap-space", "bytes", "average", /* sampled= */ false, /* memory= */ true);

  private final String countColumn;
  private final String valueColumn;
  private final String unit;
  private final String aggregation;
  private final boolean sampled;
  private final boolean memory;

  SampleType(
      String countColumn,
      String valueColumn,
      String unit,
      String aggregation,
      boolean sampled,
      boolean memory) {
    this.countColumn = countColumn;
    this.valueColumn = valueColumn;
    this.unit = unit;
    this.aggregation = aggregation;
    this.sampled = sampled;
    this.memory = memory;
  }

  /** 计数列名称，单位固定为 count */
  public String getCountColumn() {
    return countColumn;
  }

  /** 值列名称 */
  public String getValueColumn() {
    return valueColumn;
  }

  /** 值列单位 */
  public String getUnit() {
    return unit;
  }

  /** 服务端聚合方式（sum / average） */
  public String getAggregation() {
    return aggregation;
  }

  /** 值是否为采样得到 */
  public boolean isSampled() {
    return sampled;
  }

  /** 是否为内存类样本（关闭内存剖析时被忽略） */
  public boolean isMemory() {
    return memory;
  }

  /** 展示名称，例如 cpu_time */
  public String getDisplayName() {
    return valueColumn.replace('-', '_');
  }
}
