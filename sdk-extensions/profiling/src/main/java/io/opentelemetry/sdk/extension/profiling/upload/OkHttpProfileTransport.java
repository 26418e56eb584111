/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import io.opentelemetry.sdk.extension.profiling.config.ProfilingExportConfig;
import io.opentelemetry.sdk.extension.profiling.payload.UploadPayload;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * 基于 OkHttp 的 Pyroscope 兼容传输
 *
 * <p>请求格式：
 *
 * <pre>
 * POST {endpoint}{ingestPath}?name={service}{labels}&amp;from={ns}&amp;until={ns}&amp;spyName=...&amp;format=pprof
 * Authorization: Bearer {token}
 * </pre>
 *
 * <p>{@link UploadMode#RAW} 直接发送 gzip 字节并声明 {@code Content-Encoding: gzip}；
 * {@link UploadMode#MULTIPART} 以表单发送 {@code profile} 与 {@code sample_type_config} 两部分，
 * 此时不带 {@code format} 参数。
 */
public final class OkHttpProfileTransport implements ProfileTransport {

  private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");
  private static final MediaType JSON_TYPE = MediaType.parse("application/json");
  private static final String HEADER_AUTHORIZATION = "Authorization";
  private static final String HEADER_CONTENT_ENCODING = "Content-Encoding";
  private static final String BEARER_PREFIX = "Bearer ";
  private static final int ERROR_BODY_LIMIT = 256;

  private final OkHttpClient httpClient;
  private final HttpUrl ingestUrl;
  private final UploadMode mode;
  private final String spyName;
  private final Logger logger;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * 创建传输
   *
   * @param httpClient OkHttp 客户端
   * @param ingestUrl 完整的 ingest 地址
   * @param mode 请求体格式
   * @param spyName spyName 参数
   * @param logger 日志
   */
  public OkHttpProfileTransport(
      OkHttpClient httpClient, String ingestUrl, UploadMode mode, String spyName, Logger logger) {
    this.httpClient = httpClient;
    this.ingestUrl = HttpUrl.get(ingestUrl);
    this.mode = mode;
    this.spyName = spyName;
    this.logger = logger;
  }

  /**
   * 按配置创建传输
   *
   * @param config 导出配置
   * @return 传输
   */
  public static OkHttpProfileTransport create(ProfilingExportConfig config) {
    Duration timeout = config.getUploadTimeout();
    OkHttpClient client =
        new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .callTimeout(timeout)
            // 重试由 BackoffUploader 负责
            .retryOnConnectionFailure(false)
            .build();
    Logger logger = Logger.getLogger(OkHttpProfileTransport.class.getName());
    OkHttpProfileTransport transport =
        new OkHttpProfileTransport(
            client, config.getIngestUrl(), config.getUploadMode(), config.getSpyName(), logger);
    logger.log(
        Level.INFO,
        "Profile transport initialized, url: {0}, mode: {1}, authentication: {2}",
        new Object[] {
          config.getIngestUrl(), config.getUploadMode(), config.getAuthToken() != null
        });
    return transport;
  }

  @Override
  public TransportResponse send(UploadPayload payload) throws IOException {
    if (closed.get()) {
      throw new IllegalStateException("Transport is closed");
    }
    Request request = buildRequest(payload);
    try (Response response = httpClient.newCall(request).execute()) {
      if (response.isSuccessful()) {
        return TransportResponse.create(response.code(), response.message(), "");
      }
      String body = response.peekBody(ERROR_BODY_LIMIT).string();
      logger.log(
          Level.FINE,
          "Profile ingest unsuccessful: code={0}, message={1}, body={2}",
          new Object[] {response.code(), response.message(), body});
      return TransportResponse.create(response.code(), response.message(), body);
    }
  }

  Request buildRequest(UploadPayload payload) {
    HttpUrl.Builder url =
        ingestUrl
            .newBuilder()
            .addQueryParameter("name", applicationName(payload))
            .addQueryParameter("from", Long.toString(payload.getStartNanos()))
            .addQueryParameter("until", Long.toString(payload.getEndNanos()))
            .addQueryParameter("spyName", spyName);

    Request.Builder builder = new Request.Builder();
    if (mode == UploadMode.MULTIPART) {
      RequestBody body =
          new MultipartBody.Builder()
              .setType(MultipartBody.FORM)
              .addFormDataPart(
                  "profile",
                  "profile.pprof",
                  RequestBody.create(payload.getCompressedBody(), OCTET_STREAM))
              .addFormDataPart(
                  "sample_type_config",
                  "sample_type_config.json",
                  RequestBody.create(payload.getSampleTypeConfig(), JSON_TYPE))
              .build();
      builder.post(body);
    } else {
      url.addQueryParameter("format", payload.getFormat());
      builder
          .header(HEADER_CONTENT_ENCODING, payload.getContentEncoding())
          .post(RequestBody.create(payload.getCompressedBody(), OCTET_STREAM));
    }

    String token = payload.getAuthToken();
    if (token != null) {
      builder.header(HEADER_AUTHORIZATION, BEARER_PREFIX + token);
    }
    return builder.url(url.build()).build();
  }

  /**
   * 生成 Pyroscope 应用名：{@code service{k=v,...}}，标签按键排序，不含服务名
   *
   * @param payload 负载
   * @return 应用名
   */
  static String applicationName(UploadPayload payload) {
    StringBuilder name = new StringBuilder(payload.getServiceName()).append('{');
    boolean first = true;
    for (Map.Entry<String, String> label : payload.getLabels().entrySet()) {
      if (UploadPayload.LABEL_SERVICE_NAME.equals(label.getKey())) {
        continue;
      }
      if (!first) {
        name.append(',');
      }
      name.append(label.getKey()).append('=').append(label.getValue());
      first = false;
    }
    return name.append('}').toString();
  }

  public UploadMode getMode() {
    return mode;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      httpClient.dispatcher().executorService().shutdown();
      try {
        if (!httpClient.dispatcher().executorService().awaitTermination(5, TimeUnit.SECONDS)) {
          httpClient.dispatcher().executorService().shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        httpClient.dispatcher().executorService().shutdownNow();
      }
      httpClient.connectionPool().evictAll();
      logger.log(Level.INFO, "Profile transport closed");
    }
  }

  @Override
  public String toString() {
    return "OkHttpProfileTransport{url=" + ingestUrl + ", mode=" + mode + '}';
  }
}
