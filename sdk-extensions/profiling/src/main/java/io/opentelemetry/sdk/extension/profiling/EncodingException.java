/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling;

import javax.annotation.Nullable;

/**
 * Profile 编码异常
 *
 * <p>pprof 序列化或压缩失败时抛出。对当前导出周期是致命的：该周期的 Profile 被丢弃，不重试，
 * 因为对同一份不可变 Profile 重新编码会以同样的方式失败。
 */
public class EncodingException extends Exception {

  private static final long serialVersionUID = 1L;

  /** 编码阶段 */
  public enum Stage {
    /** pprof 序列化 */
    PROFILE,
    /** 压缩 */
    COMPRESSION,
    /** 元数据序列化 */
    METADATA
  }

  private final Stage stage;

  /**
   * 创建编码异常
   *
   * @param stage 编码阶段
   * @param message 异常消息
   * @param cause 原始异常
   */
  public EncodingException(Stage stage, String message, @Nullable Throwable cause) {
    super("[" + stage.name() + "] " + message, cause);
    this.stage = stage;
  }

  public Stage getStage() {
    return stage;
  }
}
