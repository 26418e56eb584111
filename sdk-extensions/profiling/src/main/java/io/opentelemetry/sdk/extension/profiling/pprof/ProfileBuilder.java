/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.pprof;

import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;
import io.opentelemetry.sdk.extension.profiling.EncodingException;
import io.opentelemetry.sdk.extension.profiling.sample.ProfileWindow;
import io.opentelemetry.sdk.extension.profiling.sample.Sample;
import io.opentelemetry.sdk.extension.profiling.sample.SampleType;
import io.opentelemetry.sdk.extension.profiling.sample.StackFrame;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * pprof Profile 构建器
 *
 * <p>将一个已关闭的 {@link ProfileWindow} 转换为不可变的 {@link BinaryProfile}：
 *
 * <ul>
 *   <li>按完全相同的堆栈分组，每个分组对每种样本类型累加两列：样本数与样本值
 *   <li>分组按堆栈字典序排列，值列按样本类型声明顺序排列
 *   <li>字符串表、函数表、位置表按首次出现顺序确定性地分配编号
 * </ul>
 *
 * <p>同一窗口多次构建得到字节完全一致的结果，与样本的记录顺序无关。
 *
 * <p>类型不在启用集合中的样本被跳过并计数，不会中断构建。
 */
public final class ProfileBuilder {

  private final Set<SampleType> enabledTypes;
  private final Logger logger;

  /**
   * 创建构建器
   *
   * @param enabledTypes 启用的样本类型
   * @param logger 日志
   */
  public ProfileBuilder(Set<SampleType> enabledTypes, Logger logger) {
    this.enabledTypes =
        enabledTypes.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(SampleType.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(enabledTypes));
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /** 创建启用全部样本类型的构建器 */
  public ProfileBuilder() {
    this(EnumSet.allOf(SampleType.class), Logger.getLogger(ProfileBuilder.class.getName()));
  }

  /**
   * 按内存分析开关创建构建器
   *
   * @param memoryEnabled 是否启用内存类样本
   * @param logger 日志
   * @return 构建器
   */
  public static ProfileBuilder forMemoryProfiling(boolean memoryEnabled, Logger logger) {
    EnumSet<SampleType> types = EnumSet.noneOf(SampleType.class);
    for (SampleType type : SampleType.values()) {
      if (memoryEnabled || !type.isMemory()) {
        types.add(type);
      }
    }
    return new ProfileBuilder(types, logger);
  }

  public Set<SampleType> getEnabledTypes() {
    return enabledTypes;
  }

  /**
   * 构建 Profile
   *
   * @param window 已关闭的窗口
   * @return 不可变 Profile
   * @throws EncodingException protobuf 序列化失败
   */
  public BinaryProfile build(ProfileWindow window) throws EncodingException {
    // ===== 分组 =====
    long skipped = 0;
    EnumMap<SampleType, Long> sampleCounts = new EnumMap<>(SampleType.class);
    TreeMap<List<StackFrame>, Map<SampleType, long[]>> groups =
        new TreeMap<>(ProfileBuilder::compareStacks);
    for (Sample sample : window.getSamples()) {
      SampleType type = sample.getSampleType();
      if (!enabledTypes.contains(type)) {
        skipped++;
        continue;
      }
      sampleCounts.merge(type, 1L, Long::sum);
      long[] totals =
          groups
              .computeIfAbsent(sample.getStackFrames(), k -> new EnumMap<>(SampleType.class))
              .computeIfAbsent(type, k -> new long[2]);
      totals[0] = saturatedAdd(totals[0], 1);
      totals[1] = saturatedAdd(totals[1], sample.getValue());
    }
    List<SampleType> columns = new ArrayList<>(sampleCounts.keySet());

    if (skipped > 0) {
      logger.log(
          Level.FINE,
          "Skipped {0} samples with unrecognized or disabled sample type",
          skipped);
    }

    // ===== 序列化 =====
    byte[] bytes;
    try {
      bytes = encode(window, columns, groups);
    } catch (IOException e) {
      throw new EncodingException(
          EncodingException.Stage.PROFILE, "Failed to serialize pprof profile", e);
    }

    BinaryProfile profile =
        new BinaryProfile(
            bytes,
            window.getStartNanos(),
            window.getEndNanos(),
            columns,
            sampleCounts,
            groups.size(),
            skipped);
    logger.log(Level.FINE, "Built profile: {0}", profile);
    return profile;
  }

  private static byte[] encode(
      ProfileWindow window,
      List<SampleType> columns,
      TreeMap<List<StackFrame>, Map<SampleType, long[]>> groups)
      throws IOException {
    StringTable strings = new StringTable();
    Map<FunctionKey, Long> functions = new LinkedHashMap<>();
    Map<LocationKey, Long> locations = new LinkedHashMap<>();

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    CodedOutputStream cos = CodedOutputStream.newInstance(out);

    // sample_type：每种类型两列（样本数、样本值）
    for (SampleType type : columns) {
      cos.writeByteArray(
          PprofFields.Profile.SAMPLE_TYPE.index,
          valueType(strings.intern(type.getCountColumn()), strings.intern("count")));
      cos.writeByteArray(
          PprofFields.Profile.SAMPLE_TYPE.index,
          valueType(strings.intern(type.getValueColumn()), strings.intern(type.getUnit())));
    }

    // sample
    for (Map.Entry<List<StackFrame>, Map<SampleType, long[]>> group : groups.entrySet()) {
      List<StackFrame> frames = group.getKey();
      long[] locationIds = new long[frames.size()];
      for (int i = 0; i < frames.size(); i++) {
        StackFrame frame = frames.get(i);
        FunctionKey functionKey =
            new FunctionKey(strings.intern(frame.getFunction()), strings.intern(frame.getFile()));
        long functionId = functions.computeIfAbsent(functionKey, k -> functions.size() + 1L);
        LocationKey locationKey = new LocationKey(functionId, frame.getLine());
        locationIds[i] = locations.computeIfAbsent(locationKey, k -> locations.size() + 1L);
      }
      long[] values = new long[columns.size() * 2];
      for (int c = 0; c < columns.size(); c++) {
        long[] totals = group.getValue().get(columns.get(c));
        if (totals != null) {
          values[c * 2] = totals[0];
          values[c * 2 + 1] = totals[1];
        }
      }
      cos.writeByteArray(PprofFields.Profile.SAMPLE.index, sample(locationIds, values));
    }

    // location
    for (Map.Entry<LocationKey, Long> location : locations.entrySet()) {
      cos.writeByteArray(
          PprofFields.Profile.LOCATION.index, location(location.getValue(), location.getKey()));
    }

    // function
    for (Map.Entry<FunctionKey, Long> function : functions.entrySet()) {
      cos.writeByteArray(
          PprofFields.Profile.FUNCTION.index, function(function.getValue(), function.getKey()));
    }

    long defaultSampleType = 0;
    byte[] periodType = null;
    if (!columns.isEmpty()) {
      SampleType first = columns.get(0);
      defaultSampleType = strings.intern(first.getValueColumn());
      periodType = valueType(defaultSampleType, strings.intern(first.getUnit()));
    }

    // string_table，索引 0 固定为空串
    for (String value : strings.values()) {
      cos.writeString(PprofFields.Profile.STRING_TABLE.index, value);
    }

    cos.writeInt64(PprofFields.Profile.TIME_NANOS.index, window.getStartNanos());
    cos.writeInt64(PprofFields.Profile.DURATION_NANOS.index, window.getDurationNanos());
    if (periodType != null) {
      cos.writeByteArray(PprofFields.Profile.PERIOD_TYPE.index, periodType);
      cos.writeInt64(PprofFields.Profile.PERIOD.index, 0L);
      cos.writeInt64(PprofFields.Profile.DEFAULT_SAMPLE_TYPE.index, defaultSampleType);
    }
    cos.flush();
    return out.toByteArray();
  }

  private static byte[] valueType(long type, long unit) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    CodedOutputStream cos = CodedOutputStream.newInstance(out);
    cos.writeInt64(PprofFields.ValueType.TYPE.index, type);
    cos.writeInt64(PprofFields.ValueType.UNIT.index, unit);
    cos.flush();
    return out.toByteArray();
  }

  private static byte[] sample(long[] locationIds, long[] values) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    CodedOutputStream cos = CodedOutputStream.newInstance(out);
    if (locationIds.length > 0) {
      int size = 0;
      for (long id : locationIds) {
        size += CodedOutputStream.computeUInt64SizeNoTag(id);
      }
      cos.writeTag(PprofFields.Sample.LOCATION_ID.index, WireFormat.WIRETYPE_LENGTH_DELIMITED);
      cos.writeUInt32NoTag(size);
      for (long id : locationIds) {
        cos.writeUInt64NoTag(id);
      }
    }
    if (values.length > 0) {
      int size = 0;
      for (long value : values) {
        size += CodedOutputStream.computeInt64SizeNoTag(value);
      }
      cos.writeTag(PprofFields.Sample.VALUE.index, WireFormat.WIRETYPE_LENGTH_DELIMITED);
      cos.writeUInt32NoTag(size);
      for (long value : values) {
        cos.writeInt64NoTag(value);
      }
    }
    cos.flush();
    return out.toByteArray();
  }

  private static byte[] location(long id, LocationKey key) throws IOException {
    ByteArrayOutputStream lineOut = new ByteArrayOutputStream();
    CodedOutputStream line = CodedOutputStream.newInstance(lineOut);
    line.writeUInt64(PprofFields.Line.FUNCTION_ID.index, key.functionId);
    line.writeInt64(PprofFields.Line.LINE.index, key.line);
    line.flush();

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    CodedOutputStream cos = CodedOutputStream.newInstance(out);
    cos.writeUInt64(PprofFields.Location.ID.index, id);
    cos.writeByteArray(PprofFields.Location.LINE.index, lineOut.toByteArray());
    cos.flush();
    return out.toByteArray();
  }

  private static byte[] function(long id, FunctionKey key) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    CodedOutputStream cos = CodedOutputStream.newInstance(out);
    cos.writeUInt64(PprofFields.Function.ID.index, id);
    cos.writeInt64(PprofFields.Function.NAME.index, key.name);
    cos.writeInt64(PprofFields.Function.SYSTEM_NAME.index, key.name);
    cos.writeInt64(PprofFields.Function.FILENAME.index, key.file);
    cos.flush();
    return out.toByteArray();
  }

  /** 饱和加法，溢出时截断到 long 边界 */
  static long saturatedAdd(long a, long b) {
    try {
      return Math.addExact(a, b);
    } catch (ArithmeticException e) {
      return b > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
    }
  }

  /** 堆栈字典序比较，前缀较短者在前 */
  static int compareStacks(List<StackFrame> left, List<StackFrame> right) {
    int n = Math.min(left.size(), right.size());
    for (int i = 0; i < n; i++) {
      int cmp = left.get(i).compareTo(right.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  /** 字符串表，索引 0 为空串 */
  private static final class StringTable {
    private final Map<String, Long> index = new HashMap<>();
    private final List<String> values = new ArrayList<>();

    StringTable() {
      intern("");
    }

    long intern(String value) {
      Long existing = index.get(value);
      if (existing != null) {
        return existing;
      }
      long id = values.size();
      values.add(value);
      index.put(value, id);
      return id;
    }

    List<String> values() {
      return values;
    }
  }

  private static final class FunctionKey {
    final long name;
    final long file;

    FunctionKey(long name, long file) {
      this.name = name;
      this.file = file;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof FunctionKey)) {
        return false;
      }
      FunctionKey that = (FunctionKey) o;
      return name == that.name && file == that.file;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, file);
    }
  }

  private static final class LocationKey {
    final long functionId;
    final long line;

    LocationKey(long functionId, long line) {
      this.functionId = functionId;
      this.line = line;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof LocationKey)) {
        return false;
      }
      LocationKey that = (LocationKey) o;
      return functionId == that.functionId && line == that.line;
    }

    @Override
    public int hashCode() {
      return Objects.hash(functionId, line);
    }
  }
}
