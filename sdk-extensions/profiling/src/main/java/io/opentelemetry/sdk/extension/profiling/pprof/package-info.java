/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** pprof 二进制 Profile 构建。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.profiling.pprof;

import javax.annotation.ParametersAreNonnullByDefault;
