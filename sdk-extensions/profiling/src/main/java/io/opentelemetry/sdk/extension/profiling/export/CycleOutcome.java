/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.export;

/** 导出周期结果 */
public enum CycleOutcome {
  /** 上传成功 */
  SUCCESS,
  /** 窗口内没有可导出的样本，未上传 */
  EMPTY,
  /** 编码失败，Profile 被丢弃 */
  ENCODING_DROPPED,
  /** 可重试的失败用完了尝试次数或时间预算 */
  UPLOAD_RETRYABLE_EXHAUSTED,
  /** 不可重试的上传失败 */
  UPLOAD_FATAL,
  /** 关闭超时，进行中的上传被放弃 */
  ABANDONED,
  /** 意外的运行时异常 */
  FAILED
}
