/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import io.opentelemetry.sdk.extension.profiling.payload.UploadPayload;
import java.io.Closeable;
import java.time.Duration;

/** Profile 上传器，从不抛出异常，失败以 {@link UploadResult} 返回 */
public interface ProfileUploader extends Closeable {

  /**
   * 上传负载
   *
   * @param payload 负载
   * @return 上传结果
   */
  UploadResult upload(UploadPayload payload);

  /**
   * 在给定时间预算内上传负载，超出预算后不再开始新的尝试或退避等待
   *
   * @param payload 负载
   * @param budget 时间预算
   * @return 上传结果
   */
  default UploadResult upload(UploadPayload payload, Duration budget) {
    return upload(payload);
  }

  @Override
  default void close() {}
}
