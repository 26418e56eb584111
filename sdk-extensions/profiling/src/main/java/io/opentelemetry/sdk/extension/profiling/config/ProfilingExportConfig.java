/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.config;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.opentelemetry.sdk.extension.profiling.upload.RetryPolicy;
import io.opentelemetry.sdk.extension.profiling.upload.UploadMode;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;

/**
 * Profile 导出配置
 *
 * <p>从 OpenTelemetry 标准配置中复用服务名、Resource Attributes 与 OTLP Headers，
 * 并扩展 Profile 导出特定配置。
 */
public final class ProfilingExportConfig {

  private static final Logger logger = Logger.getLogger(ProfilingExportConfig.class.getName());

  // ===== 配置键常量 =====

  // OpenTelemetry 标准配置 (复用)
  private static final String SERVICE_NAME = "otel.service.name";
  private static final String RESOURCE_ATTRIBUTES = "otel.resource.attributes";
  private static final String OTLP_HEADERS = "otel.exporter.otlp.headers";

  // Resource Attributes 键
  private static final String SERVICE_AUTH_TOKEN_KEY = "token";
  private static final String DEPLOYMENT_ENVIRONMENT_KEY = "deployment.environment";
  private static final String DEPLOYMENT_ENVIRONMENT_NAME_KEY = "deployment.environment.name";
  private static final String HOST_NAME_KEY = "host.name";
  private static final String SERVICE_NAME_KEY = "service.name";

  // Profile 导出配置
  static final String PROFILING_ENABLED = "otel.profiling.enabled";
  static final String PROFILING_ENDPOINT = "otel.profiling.endpoint";
  static final String PROFILING_INGEST_PATH = "otel.profiling.ingest.path";
  static final String PROFILING_TOKEN = "otel.profiling.token";
  static final String PROFILING_ENVIRONMENT = "otel.profiling.environment";
  static final String PROFILING_HOST = "otel.profiling.host";
  static final String EXPORT_INTERVAL = "otel.profiling.export.interval";
  static final String EXPORT_TIMEOUT = "otel.profiling.export.timeout";
  static final String UPLOAD_TIMEOUT = "otel.profiling.upload.timeout";
  static final String UPLOAD_MODE = "otel.profiling.upload.mode";
  static final String RETRY_MAX_ATTEMPTS = "otel.profiling.retry.max.attempts";
  static final String RETRY_INITIAL_BACKOFF = "otel.profiling.retry.initial.backoff";
  static final String RETRY_MAX_BACKOFF = "otel.profiling.retry.max.backoff";
  static final String RETRY_BACKOFF_MULTIPLIER = "otel.profiling.retry.backoff.multiplier";
  static final String RETRY_JITTER = "otel.profiling.retry.jitter";
  static final String ACCUMULATOR_CAPACITY = "otel.profiling.accumulator.capacity";
  static final String SHUTDOWN_FLUSH_TIMEOUT = "otel.profiling.shutdown.flush.timeout";
  static final String MEMORY_ENABLED = "otel.profiling.memory.enabled";
  static final String SPY_NAME = "otel.profiling.spy.name";

  // ===== 默认值常量 =====
  private static final String DEFAULT_ENDPOINT = "http://localhost:4040";
  private static final String DEFAULT_INGEST_PATH = "/ingest";
  private static final String DEFAULT_SERVICE_NAME = "unknown_service:java";
  private static final Duration DEFAULT_EXPORT_INTERVAL = Duration.ofSeconds(60);
  private static final Duration DEFAULT_EXPORT_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration DEFAULT_UPLOAD_TIMEOUT = Duration.ofSeconds(10);
  private static final int DEFAULT_ACCUMULATOR_CAPACITY = 10_000;
  private static final Duration DEFAULT_SHUTDOWN_FLUSH_TIMEOUT = Duration.ofSeconds(5);
  private static final String DEFAULT_SPY_NAME = "otel-java";

  // ===== 配置字段 =====
  private final boolean enabled;
  private final String endpoint;
  private final String ingestPath;
  private final String serviceName;
  @Nullable private final String environment;
  @Nullable private final String host;
  private final Duration exportInterval;
  private final Duration exportTimeout;
  private final Duration uploadTimeout;
  private final UploadMode uploadMode;
  private final RetryPolicy retryPolicy;
  private final int accumulatorCapacity;
  private final Duration shutdownFlushTimeout;
  private final boolean memoryEnabled;
  private final String spyName;

  // Auth Token (启动时一次性解析)
  @Nullable private final String authToken;
  @Nullable private final String authTokenSource;

  private ProfilingExportConfig(Builder builder, RetryPolicy retryPolicy) {
    this.enabled = builder.enabled;
    this.endpoint = builder.endpoint;
    this.ingestPath = builder.ingestPath;
    this.serviceName = builder.serviceName;
    this.environment = builder.environment;
    this.host = builder.host != null ? builder.host : localHostName();
    this.exportInterval = builder.exportInterval;
    this.exportTimeout = builder.exportTimeout;
    this.uploadTimeout = builder.uploadTimeout;
    this.uploadMode = builder.uploadMode;
    this.retryPolicy = retryPolicy;
    this.accumulatorCapacity = builder.accumulatorCapacity;
    this.shutdownFlushTimeout = builder.shutdownFlushTimeout;
    this.memoryEnabled = builder.memoryEnabled;
    this.spyName = builder.spyName;

    // 一次性解析 AuthToken
    AuthTokenResult result =
        resolveAuthToken(builder.token, builder.resourceAttributes, builder.headers);
    this.authToken = result.token;
    this.authTokenSource = result.source;
    if (this.authToken != null) {
      logger.log(Level.INFO, "Profiling auth token configured from source: {0}", authTokenSource);
    }
  }

  /**
   * 按优先级解析 AuthToken
   *
   * <p>优先级:
   * <ol>
   *   <li>otel.profiling.token</li>
   *   <li>Resource Attributes 中的 token</li>
   *   <li>OTLP Headers 中的 Authorization</li>
   * </ol>
   */
  private static AuthTokenResult resolveAuthToken(
      @Nullable String explicitToken,
      @Nullable String resourceAttributes,
      @Nullable String otlpHeaders) {
    if (explicitToken != null && !explicitToken.trim().isEmpty()) {
      return new AuthTokenResult(explicitToken.trim(), PROFILING_TOKEN);
    }

    String token = extractAttribute(resourceAttributes, SERVICE_AUTH_TOKEN_KEY);
    if (token != null && !token.isEmpty()) {
      return new AuthTokenResult(token, "resource.attributes[token]");
    }

    token = extractTokenFromOtlpHeaders(otlpHeaders);
    if (token != null && !token.isEmpty()) {
      return new AuthTokenResult(token, "otel.exporter.otlp.headers[Authorization]");
    }

    return new AuthTokenResult(null, null);
  }

  /**
   * 从 Resource Attributes 提取属性值
   *
   * @param attributes resource attributes 字符串 (格式: key1=value1,key2=value2)
   * @param key 属性键
   * @return 属性值 或 null
   */
  @Nullable
  static String extractAttribute(@Nullable String attributes, String key) {
    if (attributes == null || attributes.isEmpty()) {
      return null;
    }

    for (String pair : attributes.split(",")) {
      String[] kv = pair.split("=", 2);
      if (kv.length == 2 && key.equals(kv[0].trim())) {
        return kv[1].trim();
      }
    }
    return null;
  }

  /**
   * 从 OTLP Headers 提取 Authorization Token
   *
   * @param headers OTLP headers 字符串 (格式: Header1=Value1,Header2=Value2)
   * @return token (不含 Bearer 前缀) 或 null
   */
  @Nullable
  private static String extractTokenFromOtlpHeaders(@Nullable String headers) {
    if (headers == null || headers.isEmpty()) {
      return null;
    }

    for (String pair : headers.split(",")) {
      String[] kv = pair.split("=", 2);
      if (kv.length == 2 && "Authorization".equalsIgnoreCase(kv[0].trim())) {
        String value = kv[1].trim();
        // 移除 "Bearer " 前缀（如果有）
        if (value.toLowerCase(Locale.ROOT).startsWith("bearer ")) {
          return value.substring(7).trim();
        }
        return value;
      }
    }
    return null;
  }

  @Nullable
  private static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      logger.log(Level.FINE, "Unable to resolve local host name: {0}", e.getMessage());
      return null;
    }
  }

  /** Token 解析结果（内部类） */
  private static class AuthTokenResult {
    @Nullable final String token;
    @Nullable final String source;

    AuthTokenResult(@Nullable String token, @Nullable String source) {
      this.token = token;
      this.source = source;
    }
  }

  /**
   * 从 ConfigProperties 创建配置实例
   *
   * @param properties 配置属性
   * @return 配置实例
   */
  public static ProfilingExportConfig create(ConfigProperties properties) {
    return builder().fromConfigProperties(properties).build();
  }

  /**
   * 创建构建器
   *
   * @return 构建器
   */
  public static Builder builder() {
    return new Builder();
  }

  // ===== Getter 方法 =====

  public boolean isEnabled() {
    return enabled;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public String getIngestPath() {
    return ingestPath;
  }

  public String getServiceName() {
    return serviceName;
  }

  @Nullable
  public String getEnvironment() {
    return environment;
  }

  @Nullable
  public String getHost() {
    return host;
  }

  public Duration getExportInterval() {
    return exportInterval;
  }

  /** 单个导出周期（含全部重试）的时间预算 */
  public Duration getExportTimeout() {
    return exportTimeout;
  }

  /** 单次 HTTP 请求超时 */
  public Duration getUploadTimeout() {
    return uploadTimeout;
  }

  public UploadMode getUploadMode() {
    return uploadMode;
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public int getAccumulatorCapacity() {
    return accumulatorCapacity;
  }

  public Duration getShutdownFlushTimeout() {
    return shutdownFlushTimeout;
  }

  /** 是否导出内存类样本（alloc-space、alloc-objects、heap-space） */
  public boolean isMemoryEnabled() {
    return memoryEnabled;
  }

  public String getSpyName() {
    return spyName;
  }

  /**
   * 获取 Auth Token（不含 Bearer 前缀）
   *
   * @return token 或 null
   */
  @Nullable
  public String getAuthToken() {
    return authToken;
  }

  /**
   * 获取 Auth Token 来源（用于日志/调试）
   *
   * @return token 来源描述 或 null
   */
  @Nullable
  public String getAuthTokenSource() {
    return authTokenSource;
  }

  /**
   * 获取完整的 ingest URL
   *
   * @return endpoint + ingestPath
   */
  public String getIngestUrl() {
    return joinUrl(endpoint, ingestPath);
  }

  private static String joinUrl(String endpoint, String path) {
    String base = endpoint;
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    if (path.isEmpty()) {
      return base;
    }
    return path.startsWith("/") ? base + path : base + "/" + path;
  }

  @Override
  public String toString() {
    return "ProfilingExportConfig{"
        + "enabled="
        + enabled
        + ", ingestUrl="
        + getIngestUrl()
        + ", serviceName="
        + serviceName
        + ", environment="
        + environment
        + ", host="
        + host
        + ", exportInterval="
        + exportInterval
        + ", exportTimeout="
        + exportTimeout
        + ", uploadMode="
        + uploadMode
        + ", retryPolicy="
        + retryPolicy
        + ", memoryEnabled="
        + memoryEnabled
        + ", authToken="
        + (authToken != null ? "***" : "null")
        + '}';
  }

  /** 构建器 */
  public static final class Builder {
    private boolean enabled = true;
    private String endpoint = DEFAULT_ENDPOINT;
    private String ingestPath = DEFAULT_INGEST_PATH;
    private String serviceName = DEFAULT_SERVICE_NAME;
    @Nullable private String environment;
    @Nullable private String host;
    private Duration exportInterval = DEFAULT_EXPORT_INTERVAL;
    private Duration exportTimeout = DEFAULT_EXPORT_TIMEOUT;
    private Duration uploadTimeout = DEFAULT_UPLOAD_TIMEOUT;
    private UploadMode uploadMode = UploadMode.RAW;
    private int retryMaxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private Duration retryInitialBackoff = RetryPolicy.DEFAULT_INITIAL_BACKOFF;
    private Duration retryMaxBackoff = RetryPolicy.DEFAULT_MAX_BACKOFF;
    private double retryBackoffMultiplier = RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER;
    private double retryJitter = RetryPolicy.DEFAULT_JITTER;
    private int accumulatorCapacity = DEFAULT_ACCUMULATOR_CAPACITY;
    private Duration shutdownFlushTimeout = DEFAULT_SHUTDOWN_FLUSH_TIMEOUT;
    private boolean memoryEnabled = true;
    private String spyName = DEFAULT_SPY_NAME;
    private boolean serviceNameExplicit;
    @Nullable private String token;
    @Nullable private String headers;
    @Nullable private String resourceAttributes;

    private Builder() {}

    /**
     * 从 ConfigProperties 加载配置
     *
     * @param properties 配置属性
     * @return 构建器
     */
    public Builder fromConfigProperties(ConfigProperties properties) {
      this.enabled = properties.getBoolean(PROFILING_ENABLED, true);

      String endpointConfig = properties.getString(PROFILING_ENDPOINT);
      if (endpointConfig != null) {
        this.endpoint = endpointConfig;
      }

      String ingestPathConfig = properties.getString(PROFILING_INGEST_PATH);
      if (ingestPathConfig != null) {
        this.ingestPath = ingestPathConfig;
      }

      // 复用 OpenTelemetry 标准配置
      this.headers = properties.getString(OTLP_HEADERS);
      this.resourceAttributes = properties.getString(RESOURCE_ATTRIBUTES);
      this.token = properties.getString(PROFILING_TOKEN);

      String service = properties.getString(SERVICE_NAME);
      if (service == null) {
        service = extractAttribute(resourceAttributes, SERVICE_NAME_KEY);
      }
      if (service != null && !service.isEmpty()) {
        this.serviceName = service;
        this.serviceNameExplicit = true;
      }

      String environmentConfig = properties.getString(PROFILING_ENVIRONMENT);
      if (environmentConfig == null) {
        environmentConfig = extractAttribute(resourceAttributes, DEPLOYMENT_ENVIRONMENT_KEY);
      }
      if (environmentConfig == null) {
        environmentConfig = extractAttribute(resourceAttributes, DEPLOYMENT_ENVIRONMENT_NAME_KEY);
      }
      this.environment = environmentConfig;

      String hostConfig = properties.getString(PROFILING_HOST);
      if (hostConfig == null) {
        hostConfig = extractAttribute(resourceAttributes, HOST_NAME_KEY);
      }
      this.host = hostConfig;

      Duration interval = properties.getDuration(EXPORT_INTERVAL);
      if (interval != null) {
        this.exportInterval = interval;
      }

      Duration exportTimeoutConfig = properties.getDuration(EXPORT_TIMEOUT);
      if (exportTimeoutConfig != null) {
        this.exportTimeout = exportTimeoutConfig;
      }

      Duration uploadTimeoutConfig = properties.getDuration(UPLOAD_TIMEOUT);
      if (uploadTimeoutConfig != null) {
        this.uploadTimeout = uploadTimeoutConfig;
      }

      String mode = properties.getString(UPLOAD_MODE);
      if (mode != null) {
        this.uploadMode = UploadMode.parse(mode);
      }

      Integer maxAttempts = properties.getInt(RETRY_MAX_ATTEMPTS);
      if (maxAttempts != null) {
        this.retryMaxAttempts = maxAttempts;
      }

      Duration initialBackoff = properties.getDuration(RETRY_INITIAL_BACKOFF);
      if (initialBackoff != null) {
        this.retryInitialBackoff = initialBackoff;
      }

      Duration maxBackoff = properties.getDuration(RETRY_MAX_BACKOFF);
      if (maxBackoff != null) {
        this.retryMaxBackoff = maxBackoff;
      }

      Double multiplier = properties.getDouble(RETRY_BACKOFF_MULTIPLIER);
      if (multiplier != null) {
        this.retryBackoffMultiplier = multiplier;
      }

      Double jitter = properties.getDouble(RETRY_JITTER);
      if (jitter != null) {
        this.retryJitter = jitter;
      }

      Integer capacity = properties.getInt(ACCUMULATOR_CAPACITY);
      if (capacity != null) {
        this.accumulatorCapacity = capacity;
      }

      Duration flushTimeout = properties.getDuration(SHUTDOWN_FLUSH_TIMEOUT);
      if (flushTimeout != null) {
        this.shutdownFlushTimeout = flushTimeout;
      }

      this.memoryEnabled = properties.getBoolean(MEMORY_ENABLED, true);

      String spy = properties.getString(SPY_NAME);
      if (spy != null) {
        this.spyName = spy;
      }

      return this;
    }

    /**
     * 用 SDK 合并后的 Resource 补全未显式配置的服务名、环境与主机
     *
     * @param resource Resource
     * @return 构建器
     */
    public Builder applyResource(Resource resource) {
      String resourceServiceName = resource.getAttribute(AttributeKey.stringKey(SERVICE_NAME_KEY));
      if (!serviceNameExplicit && resourceServiceName != null && !resourceServiceName.isEmpty()) {
        this.serviceName = resourceServiceName;
      }
      if (environment == null) {
        String env = resource.getAttribute(AttributeKey.stringKey(DEPLOYMENT_ENVIRONMENT_KEY));
        if (env == null) {
          env = resource.getAttribute(AttributeKey.stringKey(DEPLOYMENT_ENVIRONMENT_NAME_KEY));
        }
        this.environment = env;
      }
      if (host == null) {
        this.host = resource.getAttribute(AttributeKey.stringKey(HOST_NAME_KEY));
      }
      return this;
    }

    public Builder setEnabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder setEndpoint(String endpoint) {
      this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
      return this;
    }

    public Builder setIngestPath(String ingestPath) {
      this.ingestPath = Objects.requireNonNull(ingestPath, "ingestPath");
      return this;
    }

    public Builder setServiceName(String serviceName) {
      this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
      this.serviceNameExplicit = true;
      return this;
    }

    public Builder setEnvironment(@Nullable String environment) {
      this.environment = environment;
      return this;
    }

    public Builder setHost(@Nullable String host) {
      this.host = host;
      return this;
    }

    public Builder setToken(@Nullable String token) {
      this.token = token;
      return this;
    }

    public Builder setExportInterval(Duration exportInterval) {
      this.exportInterval = Objects.requireNonNull(exportInterval, "exportInterval");
      return this;
    }

    public Builder setExportTimeout(Duration exportTimeout) {
      this.exportTimeout = Objects.requireNonNull(exportTimeout, "exportTimeout");
      return this;
    }

    public Builder setUploadTimeout(Duration uploadTimeout) {
      this.uploadTimeout = Objects.requireNonNull(uploadTimeout, "uploadTimeout");
      return this;
    }

    public Builder setUploadMode(UploadMode uploadMode) {
      this.uploadMode = Objects.requireNonNull(uploadMode, "uploadMode");
      return this;
    }

    public Builder setRetryMaxAttempts(int retryMaxAttempts) {
      this.retryMaxAttempts = retryMaxAttempts;
      return this;
    }

    public Builder setRetryInitialBackoff(Duration retryInitialBackoff) {
      this.retryInitialBackoff = Objects.requireNonNull(retryInitialBackoff, "retryInitialBackoff");
      return this;
    }

    public Builder setRetryMaxBackoff(Duration retryMaxBackoff) {
      this.retryMaxBackoff = Objects.requireNonNull(retryMaxBackoff, "retryMaxBackoff");
      return this;
    }

    public Builder setRetryBackoffMultiplier(double retryBackoffMultiplier) {
      this.retryBackoffMultiplier = retryBackoffMultiplier;
      return this;
    }

    public Builder setRetryJitter(double retryJitter) {
      this.retryJitter = retryJitter;
      return this;
    }

    public Builder setAccumulatorCapacity(int accumulatorCapacity) {
      this.accumulatorCapacity = accumulatorCapacity;
      return this;
    }

    public Builder setShutdownFlushTimeout(Duration shutdownFlushTimeout) {
      this.shutdownFlushTimeout =
          Objects.requireNonNull(shutdownFlushTimeout, "shutdownFlushTimeout");
      return this;
    }

    public Builder setMemoryEnabled(boolean memoryEnabled) {
      this.memoryEnabled = memoryEnabled;
      return this;
    }

    public Builder setSpyName(String spyName) {
      this.spyName = Objects.requireNonNull(spyName, "spyName");
      return this;
    }

    /**
     * 构建配置实例
     *
     * @return 配置实例
     */
    public ProfilingExportConfig build() {
      RetryPolicy retryPolicy = validate();
      return new ProfilingExportConfig(this, retryPolicy);
    }

    private RetryPolicy validate() {
      if (HttpUrl.parse(joinUrl(endpoint, ingestPath)) == null) {
        throw new IllegalArgumentException("endpoint must be a valid http(s) URL: " + endpoint);
      }
      if (serviceName.trim().isEmpty()) {
        throw new IllegalArgumentException("serviceName cannot be empty");
      }
      requirePositive(exportInterval, "exportInterval");
      requirePositive(exportTimeout, "exportTimeout");
      requirePositive(uploadTimeout, "uploadTimeout");
      if (shutdownFlushTimeout.isNegative()) {
        throw new IllegalArgumentException("shutdownFlushTimeout must not be negative");
      }
      if (accumulatorCapacity <= 0) {
        throw new IllegalArgumentException("accumulatorCapacity must be positive");
      }
      if (spyName.trim().isEmpty()) {
        throw new IllegalArgumentException("spyName cannot be empty");
      }
      return RetryPolicy.builder()
          .setMaxAttempts(retryMaxAttempts)
          .setInitialBackoff(retryInitialBackoff)
          .setMaxBackoff(retryMaxBackoff)
          .setBackoffMultiplier(retryBackoffMultiplier)
          .setJitter(retryJitter)
          .build();
    }

    private static void requirePositive(Duration duration, String name) {
      if (duration.isNegative() || duration.isZero()) {
        throw new IllegalArgumentException(name + " must be positive");
      }
    }
  }
}
