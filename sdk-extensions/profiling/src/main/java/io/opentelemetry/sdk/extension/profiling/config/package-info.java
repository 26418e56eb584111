/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** Profile 导出配置。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.profiling.config;

import javax.annotation.ParametersAreNonnullByDefault;
