/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** OpenTelemetry SDK 自动配置集成。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.profiling.spi;

import javax.annotation.ParametersAreNonnullByDefault;
