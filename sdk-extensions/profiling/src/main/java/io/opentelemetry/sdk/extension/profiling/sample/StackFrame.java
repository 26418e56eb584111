/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.sample;

import java.util.Objects;

/** 堆栈帧 */
public final class StackFrame implements Comparable<StackFrame> {

  private final String function;
  private final String file;
  private final long line;

  private StackFrame(String function, String file, long line) {
    this.function = function;
    this.file = file;
    this.line = line;
  }

  /**
   * 创建堆栈帧
   *
   * @param function 函数名
   * @param file 源文件名
   * @param line 行号，未知时为 0
   * @return 堆栈帧
   */
  public static StackFrame create(String function, String file, long line) {
    return new StackFrame(
        Objects.requireNonNull(function, "function"), Objects.requireNonNull(file, "file"), line);
  }

  public String getFunction() {
    return function;
  }

  public String getFile() {
    return file;
  }

  public long getLine() {
    return line;
  }

  @Override
  public int compareTo(StackFrame other) {
    int result = function.compareTo(other.function);
    if (result != 0) {
      return result;
    }
    result = file.compareTo(other.file);
    if (result != 0) {
      return result;
    }
    return Long.compare(line, other.line);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StackFrame)) {
      return false;
    }
    StackFrame that = (StackFrame) o;
    return line == that.line && function.equals(that.function) && file.equals(that.file);
  }

  @Override
  public int hashCode() {
    return Objects.hash(function, file, line);
  }

  @Override
  public String toString() {
    return function + "(" + file + ":" + line + ")";
  }
}
