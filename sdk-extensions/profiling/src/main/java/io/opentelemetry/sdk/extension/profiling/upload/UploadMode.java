/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import java.util.Locale;

/** 请求体格式 */
public enum UploadMode {
  /** gzip 压缩的 pprof 原始字节，Content-Encoding: gzip */
  RAW,
  /** multipart 表单：profile 与 sample_type_config 两部分 */
  MULTIPART;

  /**
   * 解析配置值（大小写不敏感）
   *
   * @param value 配置值
   * @return 上传模式
   */
  public static UploadMode parse(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid upload mode: " + value + ", expected raw or multipart", e);
    }
  }
}
