/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 样本模型与样本累积器。
 *
 * <ul>
 *   <li>{@link io.opentelemetry.sdk.extension.profiling.sample.Sample} - 单次采样观测
 *   <li>{@link io.opentelemetry.sdk.extension.profiling.sample.ProfileWindow} - 已关闭的时间窗口
 *   <li>{@link io.opentelemetry.sdk.extension.profiling.sample.SampleAccumulator} - 样本累积器
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.profiling.sample;

import javax.annotation.ParametersAreNonnullByDefault;
