/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

/** 单次传输的 HTTP 响应摘要 */
public final class TransportResponse {

  private final int code;
  private final String message;
  private final String body;

  private TransportResponse(int code, String message, String body) {
    this.code = code;
    this.message = message;
    this.body = body;
  }

  /**
   * 创建响应摘要
   *
   * @param code HTTP 状态码
   * @param message 状态消息
   * @param body 响应体片段（仅用于日志）
   * @return 响应摘要
   */
  public static TransportResponse create(int code, String message, String body) {
    return new TransportResponse(code, message, body);
  }

  public static TransportResponse of(int code) {
    return new TransportResponse(code, "", "");
  }

  public int getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public String getBody() {
    return body;
  }

  public boolean isSuccessful() {
    return code >= 200 && code < 300;
  }

  @Override
  public String toString() {
    return "HTTP " + code + (message.isEmpty() ? "" : " " + message);
  }
}
