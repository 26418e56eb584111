/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 负载上传：有界重试、指数退避与失败分类。
 *
 * <p>{@link io.opentelemetry.sdk.extension.profiling.upload.BackoffUploader} 负责重试循环，
 * {@link io.opentelemetry.sdk.extension.profiling.upload.ProfileTransport} 负责单次网络传输。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.profiling.upload;

import javax.annotation.ParametersAreNonnullByDefault;
