/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opentelemetry.sdk.extension.profiling.EncodingException;
import io.opentelemetry.sdk.extension.profiling.pprof.BinaryProfile;
import io.opentelemetry.sdk.extension.profiling.sample.SampleType;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPOutputStream;

/**
 * 负载编码器
 *
 * <p>将 {@link BinaryProfile} 以 gzip 压缩，并附加标签、时间范围、认证 Token 与 sample_type_config。
 *
 * <p>编码是确定性的：相同的 Profile 与元数据得到值相等的负载。
 */
public final class PayloadEncoder {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final Logger logger;

  /**
   * 创建编码器
   *
   * @param logger 日志
   */
  public PayloadEncoder(Logger logger) {
    this.logger = logger;
  }

  public PayloadEncoder() {
    this(Logger.getLogger(PayloadEncoder.class.getName()));
  }

  /**
   * 编码负载
   *
   * @param profile Profile
   * @param metadata 元数据
   * @return 上传负载
   * @throws EncodingException 压缩或元数据序列化失败
   */
  public UploadPayload encode(BinaryProfile profile, PayloadMetadata metadata)
      throws EncodingException {
    byte[] compressed = gzip(profile.getBytes());
    byte[] sampleTypeConfig = sampleTypeConfig(profile);

    UploadPayload payload =
        new UploadPayload(
            compressed,
            labels(metadata),
            metadata.getAuthToken(),
            profile.getStartNanos(),
            profile.getEndNanos(),
            metadata.getServiceName(),
            sampleTypeConfig);
    logger.log(
        Level.FINE,
        "Encoded profile: {0} bytes -> {1} bytes gzip",
        new Object[] {profile.getSize(), compressed.length});
    return payload;
  }

  private static Map<String, String> labels(PayloadMetadata metadata) {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put(UploadPayload.LABEL_SERVICE_NAME, metadata.getServiceName());
    if (metadata.getEnvironment() != null) {
      labels.put(UploadPayload.LABEL_ENVIRONMENT, metadata.getEnvironment());
    }
    if (metadata.getHost() != null) {
      labels.put(UploadPayload.LABEL_HOST, metadata.getHost());
    }
    return labels;
  }

  static byte[] gzip(byte[] data) throws EncodingException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, data.length / 2));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(data);
    } catch (IOException e) {
      throw new EncodingException(
          EncodingException.Stage.COMPRESSION, "Failed to gzip profile", e);
    }
    return out.toByteArray();
  }

  /**
   * 生成 sample_type_config 文档
   *
   * <p>每种出现的样本类型的值列对应一项：单位、聚合方式、显示名、是否按采样计。
   */
  static byte[] sampleTypeConfig(BinaryProfile profile) throws EncodingException {
    ObjectNode root = OBJECT_MAPPER.createObjectNode();
    for (SampleType type : profile.getSampleTypes()) {
      ObjectNode node = root.putObject(type.getValueColumn());
      node.put("units", type.getUnit());
      node.put("aggregation", type.getAggregation());
      node.put("display-name", type.getDisplayName());
      node.put("sampled", type.isSampled());
    }
    try {
      return OBJECT_MAPPER.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      throw new EncodingException(
          EncodingException.Stage.METADATA, "Failed to serialize sample_type_config", e);
    }
  }
}
