/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.payload;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * 上传负载
 *
 * <p>不可变，值相等（字节数组按内容比较）。标签按键排序。
 */
public final class UploadPayload {

  /** 标签键：服务名 */
  public static final String LABEL_SERVICE_NAME = "service_name";

  /** 标签键：部署环境 */
  public static final String LABEL_ENVIRONMENT = "environment";

  /** 标签键：主机名 */
  public static final String LABEL_HOST = "host";

  /** 压缩编码 */
  public static final String CONTENT_ENCODING_GZIP = "gzip";

  /** 格式标记 */
  public static final String FORMAT_PPROF = "pprof";

  private final byte[] compressedBody;
  private final String contentEncoding;
  private final Map<String, String> labels;
  @Nullable private final String authToken;
  private final long startNanos;
  private final long endNanos;
  private final String format;
  private final String serviceName;
  private final byte[] sampleTypeConfig;

  UploadPayload(
      byte[] compressedBody,
      Map<String, String> labels,
      @Nullable String authToken,
      long startNanos,
      long endNanos,
      String serviceName,
      byte[] sampleTypeConfig) {
    this.compressedBody = compressedBody;
    this.contentEncoding = CONTENT_ENCODING_GZIP;
    this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
    this.authToken = authToken;
    this.startNanos = startNanos;
    this.endNanos = endNanos;
    this.format = FORMAT_PPROF;
    this.serviceName = serviceName;
    this.sampleTypeConfig = sampleTypeConfig;
  }

  /** 压缩后的 Profile 字节（副本） */
  public byte[] getCompressedBody() {
    return compressedBody.clone();
  }

  public int getCompressedSize() {
    return compressedBody.length;
  }

  public String getContentEncoding() {
    return contentEncoding;
  }

  /** 按键排序的标签 */
  public Map<String, String> getLabels() {
    return labels;
  }

  @Nullable
  public String getAuthToken() {
    return authToken;
  }

  public long getStartNanos() {
    return startNanos;
  }

  public long getEndNanos() {
    return endNanos;
  }

  public String getFormat() {
    return format;
  }

  public String getServiceName() {
    return serviceName;
  }

  /** sample_type_config JSON 文档（副本） */
  public byte[] getSampleTypeConfig() {
    return sampleTypeConfig.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UploadPayload)) {
      return false;
    }
    UploadPayload that = (UploadPayload) o;
    return startNanos == that.startNanos
        && endNanos == that.endNanos
        && Arrays.equals(compressedBody, that.compressedBody)
        && contentEncoding.equals(that.contentEncoding)
        && labels.equals(that.labels)
        && Objects.equals(authToken, that.authToken)
        && format.equals(that.format)
        && serviceName.equals(that.serviceName)
        && Arrays.equals(sampleTypeConfig, that.sampleTypeConfig);
  }

  @Override
  public int hashCode() {
    int result =
        Objects.hash(
            contentEncoding, labels, authToken, startNanos, endNanos, format, serviceName);
    result = 31 * result + Arrays.hashCode(compressedBody);
    result = 31 * result + Arrays.hashCode(sampleTypeConfig);
    return result;
  }

  @Override
  public String toString() {
    return "UploadPayload{"
        + "size="
        + compressedBody.length
        + ", contentEncoding="
        + contentEncoding
        + ", format="
        + format
        + ", labels="
        + labels
        + ", from="
        + startNanos
        + ", until="
        + endNanos
        + ", authToken="
        + (authToken != null ? "***" : "null")
        + '}';
  }
}
