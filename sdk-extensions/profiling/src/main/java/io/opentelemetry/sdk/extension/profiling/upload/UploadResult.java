/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import java.util.Objects;
import javax.annotation.Nullable;

/** 上传结果：成功，或携带终止错误 */
public final class UploadResult {

  private final int attempts;
  @Nullable private final UploadError error;

  private UploadResult(int attempts, @Nullable UploadError error) {
    this.attempts = attempts;
    this.error = error;
  }

  /**
   * 成功结果
   *
   * @param attempts 尝试次数
   * @return 结果
   */
  public static UploadResult success(int attempts) {
    return new UploadResult(attempts, null);
  }

  /**
   * 失败结果
   *
   * @param error 终止错误
   * @return 结果
   */
  public static UploadResult failure(UploadError error) {
    Objects.requireNonNull(error, "error");
    return new UploadResult(error.getAttempts(), error);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public int getAttempts() {
    return attempts;
  }

  @Nullable
  public UploadError getError() {
    return error;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "UploadResult{success, attempts=" + attempts + '}'
        : "UploadResult{" + error + '}';
  }
}
