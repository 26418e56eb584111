/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.payload;

import java.util.Objects;
import javax.annotation.Nullable;

/** 负载的静态元数据：服务名、环境、主机与认证 Token */
public final class PayloadMetadata {

  private final String serviceName;
  @Nullable private final String environment;
  @Nullable private final String host;
  @Nullable private final String authToken;

  private PayloadMetadata(
      String serviceName,
      @Nullable String environment,
      @Nullable String host,
      @Nullable String authToken) {
    this.serviceName = serviceName;
    this.environment = emptyToNull(environment);
    this.host = emptyToNull(host);
    this.authToken = emptyToNull(authToken);
  }

  /**
   * 创建元数据
   *
   * @param serviceName 服务名
   * @param environment 部署环境
   * @param host 主机名
   * @param authToken 认证 Token
   * @return 元数据
   */
  public static PayloadMetadata create(
      String serviceName,
      @Nullable String environment,
      @Nullable String host,
      @Nullable String authToken) {
    Objects.requireNonNull(serviceName, "serviceName");
    if (serviceName.isEmpty()) {
      throw new IllegalArgumentException("serviceName cannot be empty");
    }
    return new PayloadMetadata(serviceName, environment, host, authToken);
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

  @Nullable
  public String getAuthToken() {
    return authToken;
  }

  @Nullable
  private static String emptyToNull(@Nullable String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PayloadMetadata)) {
      return false;
    }
    PayloadMetadata that = (PayloadMetadata) o;
    return serviceName.equals(that.serviceName)
        && Objects.equals(environment, that.environment)
        && Objects.equals(host, that.host)
        && Objects.equals(authToken, that.authToken);
  }

  @Override
  public int hashCode() {
    return Objects.hash(serviceName, environment, host, authToken);
  }

  @Override
  public String toString() {
    return "PayloadMetadata{"
        + "serviceName='"
        + serviceName
        + '\''
        + ", environment='"
        + environment
        + '\''
        + ", host='"
        + host
        + '\''
        + ", authToken="
        + (authToken != null ? "***" : "null")
        + '}';
  }
}
