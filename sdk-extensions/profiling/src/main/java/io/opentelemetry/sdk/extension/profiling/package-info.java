/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * OpenTelemetry SDK Extension - Profiling Export
 *
 * <p>将进程内采样器产生的堆栈样本周期性地导出到远端 Profile 接入服务，包括：
 *
 * <ul>
 *   <li>样本累积与时间窗口切换
 *   <li>pprof 二进制编码
 *   <li>gzip 压缩与上报载荷组装
 *   <li>带退避重试的 HTTP 上报
 *   <li>定时导出调度与优雅停止
 * </ul>
 *
 * <p>启用方式：设置环境变量或系统属性 {@code otel.profiling.enabled=true}
 *
 * @see io.opentelemetry.sdk.extension.profiling.ProfilingExporter
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.profiling;

import javax.annotation.ParametersAreNonnullByDefault;
