/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.sample;

import io.opentelemetry.sdk.common.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 样本累积器
 *
 * <p>接收外部采样器交付的样本，按样本类型缓存在当前打开的时间窗口中。
 *
 * <p>线程安全：{@link #record(Sample)} 无锁且从不阻塞；{@link #swap()} 原子地关闭当前窗口并打开后继窗口，
 * 与 {@code swap()} 并发记录的样本只会落入两个窗口中的一个。
 *
 * <p>每种样本类型有独立的容量上限，超出时丢弃最旧的样本并计数，内存不会无限增长。
 */
public final class SampleAccumulator {

  /** 默认每种样本类型的容量上限 */
  public static final int DEFAULT_CAPACITY_PER_TYPE = 10_000;

  private final Logger logger;
  private final Clock clock;
  private final int capacityPerType;
  private final AtomicReference<OpenWindow> current;
  private final Object swapLock = new Object();
  private final AtomicLong droppedSampleCount = new AtomicLong(0);
  private final AtomicLong rejectedSampleCount = new AtomicLong(0);
  private final AtomicLong recordedSampleCount = new AtomicLong(0);

  /**
   * 创建样本累积器
   *
   * @param capacityPerType 每种样本类型的容量上限
   * @param clock 时钟
   * @param logger 日志
   */
  public SampleAccumulator(int capacityPerType, Clock clock, Logger logger) {
    if (capacityPerType <= 0) {
      throw new IllegalArgumentException("capacityPerType must be positive");
    }
    this.capacityPerType = capacityPerType;
    this.clock = clock;
    this.logger = logger;
    this.current = new AtomicReference<>(new OpenWindow(clock.now(), capacityPerType));
  }

  /**
   * 创建样本累积器（系统时钟，默认日志）
   *
   * @param capacityPerType 每种样本类型的容量上限
   */
  public SampleAccumulator(int capacityPerType) {
    this(
        capacityPerType,
        Clock.getDefault(),
        Logger.getLogger(SampleAccumulator.class.getName()));
  }

  /**
   * 记录一个样本到当前打开的窗口
   *
   * <p>从不阻塞，从不抛出异常。{@code null} 样本被忽略并计数。
   *
   * @param sample 样本
   */
  public void record(@Nullable Sample sample) {
    if (sample == null) {
      rejectedSampleCount.incrementAndGet();
      return;
    }
    while (true) {
      OpenWindow window = current.get();
      if (!window.enter()) {
        // 窗口正在被 swap 关闭，重读后继窗口
        continue;
      }
      try {
        if (window.add(sample)) {
          droppedSampleCount.incrementAndGet();
        }
      } finally {
        window.exit();
      }
      recordedSampleCount.incrementAndGet();
      return;
    }
  }

  /**
   * 关闭当前窗口并打开后继窗口
   *
   * <p>后继窗口的开始时间等于被关闭窗口的结束时间。
   *
   * @return 被关闭的窗口
   */
  public ProfileWindow swap() {
    synchronized (swapLock) {
      OpenWindow previous = current.get();
      long endNanos = Math.max(clock.now(), previous.startNanos);
      current.set(new OpenWindow(endNanos, capacityPerType));
      previous.close();
      previous.awaitWriters();
      ProfileWindow closed = previous.toProfileWindow(endNanos);
      if (closed.getDroppedSamples() > 0) {
        logger.log(
            Level.FINE,
            "Closed profile window with {0} samples, {1} dropped due to capacity {2}",
            new Object[] {closed.getSampleCount(), closed.getDroppedSamples(), capacityPerType});
      }
      return closed;
    }
  }

  /**
   * 获取当前打开窗口的开始时间
   *
   * @return 开始时间（Unix 纪元纳秒）
   */
  public long getOpenWindowStartNanos() {
    return current.get().startNanos;
  }

  public int getCapacityPerType() {
    return capacityPerType;
  }

  /** 累计因容量限制丢弃的样本数 */
  public long getDroppedSampleCount() {
    return droppedSampleCount.get();
  }

  /** 累计被拒绝（null）的样本数 */
  public long getRejectedSampleCount() {
    return rejectedSampleCount.get();
  }

  /** 累计记录的样本数 */
  public long getRecordedSampleCount() {
    return recordedSampleCount.get();
  }

  /** 打开中的窗口 */
  private static final class OpenWindow {
    final long startNanos;
    final Map<SampleType, TypeBuffer> buffers;
    final AtomicInteger writers = new AtomicInteger(0);
    volatile boolean closed;

    OpenWindow(long startNanos, int capacityPerType) {
      this.startNanos = startNanos;
      this.buffers = new EnumMap<>(SampleType.class);
      for (SampleType type : SampleType.values()) {
        buffers.put(type, new TypeBuffer(capacityPerType));
      }
    }

    /** 登记写入者；窗口已关闭时返回 false */
    boolean enter() {
      writers.incrementAndGet();
      if (closed) {
        writers.decrementAndGet();
        return false;
      }
      return true;
    }

    void exit() {
      writers.decrementAndGet();
    }

    void close() {
      closed = true;
    }

    /** 等待已登记的写入者完成，写入者只做入队操作，等待时间很短 */
    void awaitWriters() {
      while (writers.get() != 0) {
        Thread.yield();
      }
    }

    /** 返回是否因容量限制丢弃了最旧样本 */
    boolean add(Sample sample) {
      return buffers.get(sample.getSampleType()).add(sample);
    }

    ProfileWindow toProfileWindow(long endNanos) {
      List<Sample> samples = new ArrayList<>();
      long dropped = 0;
      for (TypeBuffer buffer : buffers.values()) {
        samples.addAll(buffer.samples);
        dropped += buffer.dropped.get();
      }
      return ProfileWindow.create(startNanos, endNanos, samples, dropped);
    }
  }

  /** 单一样本类型的有界缓冲区 */
  private static final class TypeBuffer {
    final int capacity;
    final ConcurrentLinkedDeque<Sample> samples = new ConcurrentLinkedDeque<>();
    final AtomicInteger size = new AtomicInteger(0);
    final AtomicLong dropped = new AtomicLong(0);

    TypeBuffer(int capacity) {
      this.capacity = capacity;
    }

    boolean add(Sample sample) {
      samples.addLast(sample);
      if (size.incrementAndGet() <= capacity) {
        return false;
      }
      if (samples.pollFirst() != null) {
        size.decrementAndGet();
        dropped.incrementAndGet();
        return true;
      }
      return false;
    }
  }
}
