/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import io.opentelemetry.sdk.extension.profiling.payload.UploadPayload;
import java.io.Closeable;
import java.io.IOException;

/**
 * 单次传输
 *
 * <p>每次调用执行一次网络请求，不做重试。连接失败与超时以 {@link IOException} 抛出，
 * 非 2xx 响应以 {@link TransportResponse} 返回。
 */
public interface ProfileTransport extends Closeable {

  /**
   * 发送负载
   *
   * @param payload 上传负载
   * @return 响应摘要
   * @throws IOException 连接失败或超时
   */
  TransportResponse send(UploadPayload payload) throws IOException;

  @Override
  default void close() {}
}
