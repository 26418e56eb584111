/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 周期导出调度。
 *
 * <p>{@link io.opentelemetry.sdk.extension.profiling.export.ExportScheduler} 按固定间隔执行
 * swap、build、encode、upload，同一时刻最多一个导出周期在执行。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.profiling.export;

import javax.annotation.ParametersAreNonnullByDefault;
